package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

/**
 * Restriction facets with their XML Schema element names.
 */
public enum FacetKind {
  ENUMERATION("enumeration"),
  PATTERN("pattern"),
  MIN_EXCLUSIVE("minExclusive"),
  MAX_EXCLUSIVE("maxExclusive"),
  MIN_INCLUSIVE("minInclusive"),
  MAX_INCLUSIVE("maxInclusive"),
  LENGTH("length"),
  MIN_LENGTH("minLength"),
  MAX_LENGTH("maxLength");

  private final String localName;

  FacetKind(String localName) {
    this.localName = localName;
  }

  public String localName() {
    return localName;
  }
}

package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

/**
 * Anonymous simple type wrapping either a restriction or a union.
 */
public final class SimpleType implements XsdNode {

  private final SimpleTypeContent content;

  public SimpleType(SimpleTypeContent content) {
    this.content = content;
  }

  public SimpleTypeContent getContent() {
    return content;
  }

  public Restriction getRestriction() {
    return content instanceof Restriction restriction ? restriction : null;
  }

  public Union getUnion() {
    return content instanceof Union union ? union : null;
  }
}

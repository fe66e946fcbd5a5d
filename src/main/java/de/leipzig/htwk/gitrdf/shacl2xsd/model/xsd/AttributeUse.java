package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

public enum AttributeUse {
  REQUIRED("required"),
  OPTIONAL("optional");

  private final String value;

  AttributeUse(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}

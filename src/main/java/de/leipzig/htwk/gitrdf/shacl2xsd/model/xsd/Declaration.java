package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

/**
 * Common part of element and attribute declarations: a name and exactly one way of
 * typing the value (named type, inline simple type or fixed value).
 */
public abstract sealed class Declaration implements XsdNode permits Element, Attribute {

  private final String name;
  private String type;
  private boolean generatedType;
  private SimpleType simpleType;
  private String fixed;

  protected Declaration(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
    this.generatedType = false;
  }

  /**
   * Types the value with a complex type produced by the conversion rather than a datatype.
   */
  public void setGeneratedType(String typeName) {
    this.type = typeName;
    this.generatedType = typeName != null;
  }

  public boolean isGeneratedType() {
    return generatedType;
  }

  public SimpleType getSimpleType() {
    return simpleType;
  }

  public void setSimpleType(SimpleType simpleType) {
    this.simpleType = simpleType;
  }

  public String getFixed() {
    return fixed;
  }

  public void setFixed(String fixed) {
    this.fixed = fixed;
  }

  public boolean hasInlineType() {
    return simpleType != null;
  }
}

package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

public final class Attribute extends Declaration {

  private AttributeUse use = AttributeUse.OPTIONAL;

  public Attribute(String name) {
    super(name);
  }

  public AttributeUse getUse() {
    return use;
  }

  public void setUse(AttributeUse use) {
    this.use = use;
  }

  @Override
  public String toString() {
    return "Attribute[" + getName() + ", " + use + "]";
  }
}

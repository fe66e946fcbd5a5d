package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

import java.math.BigInteger;

/**
 * Element declaration. Either named (with a type, inline simple type or fixed value)
 * or a reference to a top-level element.
 */
public final class Element extends Declaration {

  private final String ref;
  private BigInteger minOccurs;
  private BigInteger maxOccurs;

  public Element(String name) {
    this(name, null);
  }

  private Element(String name, String ref) {
    super(name);
    this.ref = ref;
  }

  public static Element reference(String ref) {
    return new Element(null, ref);
  }

  public String getRef() {
    return ref;
  }

  public boolean isReference() {
    return ref != null;
  }

  public BigInteger getMinOccurs() {
    return minOccurs;
  }

  public void setMinOccurs(BigInteger minOccurs) {
    this.minOccurs = minOccurs;
  }

  public BigInteger getMaxOccurs() {
    return maxOccurs;
  }

  public void setMaxOccurs(BigInteger maxOccurs) {
    this.maxOccurs = maxOccurs;
  }

  @Override
  public String toString() {
    return isReference() ? "Element[ref=" + ref + "]" : "Element[" + getName() + "]";
  }
}

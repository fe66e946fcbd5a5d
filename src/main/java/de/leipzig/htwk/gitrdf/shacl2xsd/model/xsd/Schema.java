package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a generated schema document. Top-level elements come first, followed by the
 * complex type definitions, each in the order the conversion pass produced them.
 */
public final class Schema implements XsdNode {

  public static final String ELEMENT_FORM_DEFAULT = "qualified";
  public static final String ATTRIBUTE_FORM_DEFAULT = "unqualified";

  private final String targetNamespace;
  private final String schemaPrefix;
  private final List<Element> elements;
  private final List<ComplexType> complexTypes;

  public Schema(String targetNamespace, String schemaPrefix, List<Element> elements, List<ComplexType> complexTypes) {
    this.targetNamespace = targetNamespace;
    this.schemaPrefix = schemaPrefix;
    this.elements = List.copyOf(elements);
    this.complexTypes = List.copyOf(complexTypes);
  }

  public String getTargetNamespace() {
    return targetNamespace;
  }

  public String getSchemaPrefix() {
    return schemaPrefix;
  }

  public String getElementFormDefault() {
    return ELEMENT_FORM_DEFAULT;
  }

  public String getAttributeFormDefault() {
    return ATTRIBUTE_FORM_DEFAULT;
  }

  public List<Element> getElements() {
    return elements;
  }

  public List<ComplexType> getComplexTypes() {
    return complexTypes;
  }

  public List<XsdNode> getChildren() {
    List<XsdNode> children = new ArrayList<>(elements.size() + complexTypes.size());
    children.addAll(elements);
    children.addAll(complexTypes);
    return List.copyOf(children);
  }

  public ComplexType findComplexType(String name) {
    return complexTypes.stream().filter(t -> t.getName().equals(name)).findFirst().orElse(null);
  }

  public Element findElement(String name) {
    return elements.stream().filter(e -> name.equals(e.getName())).findFirst().orElse(null);
  }
}

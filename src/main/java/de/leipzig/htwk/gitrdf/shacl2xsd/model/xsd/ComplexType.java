package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Named complex type. The content list holds model groups, value unions and elements
 * placed directly in the body; when a base is set the content is rendered inside an
 * extension of that base.
 */
public final class ComplexType implements XsdNode {

  private final String name;
  private String base;
  private final List<XsdNode> content = new ArrayList<>();
  private final List<Attribute> attributes = new ArrayList<>();

  public ComplexType(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public String getBase() {
    return base;
  }

  public void setBase(String base) {
    this.base = base;
  }

  public boolean hasBase() {
    return base != null;
  }

  public void addGroup(ModelGroup group) {
    content.add(group);
  }

  public void addSimpleType(SimpleType simpleType) {
    content.add(simpleType);
  }

  public void addElement(Element element) {
    content.add(element);
  }

  public void addAttribute(Attribute attribute) {
    attributes.add(attribute);
  }

  public List<XsdNode> getContent() {
    return Collections.unmodifiableList(content);
  }

  public List<Attribute> getAttributes() {
    return Collections.unmodifiableList(attributes);
  }

  /**
   * True when the type contributes nothing beyond its extension base.
   */
  public boolean isPureExtension() {
    return base != null && content.isEmpty() && attributes.isEmpty();
  }

  @Override
  public String toString() {
    return "ComplexType[" + name + (base != null ? " extends " + base : "") + "]";
  }
}

package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered group of element particles inside a complex type.
 */
public abstract sealed class ModelGroup implements XsdNode permits Choice, All {

  private final List<Element> elements = new ArrayList<>();

  public void add(Element element) {
    elements.add(element);
  }

  public List<Element> getElements() {
    return Collections.unmodifiableList(elements);
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }
}

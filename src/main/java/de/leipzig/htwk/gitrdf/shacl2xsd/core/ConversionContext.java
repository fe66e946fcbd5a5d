package de.leipzig.htwk.gitrdf.shacl2xsd.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.eclipse.rdf4j.model.Resource;

import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeGraph;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.ComplexType;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Element;

/**
 * State of one conversion pass: the graph being read, the registry, and the output
 * accumulated so far. Created per pass and dropped once the schema is emitted.
 */
public class ConversionContext {

  private final ShapeGraph graph;
  private final ShapeRegistry registry = new ShapeRegistry();
  private final List<Element> topLevelElements = new ArrayList<>();
  private final List<ComplexType> complexTypes = new ArrayList<>();
  private final Map<Resource, String> forwardReferences = new LinkedHashMap<>();
  private final Set<String> unresolvedReferences = new LinkedHashSet<>();

  public ConversionContext(ShapeGraph graph) {
    this.graph = graph;
  }

  public ShapeGraph graph() {
    return graph;
  }

  public ShapeRegistry registry() {
    return registry;
  }

  public void emitElement(Element element) {
    topLevelElements.add(element);
  }

  public void emitComplexType(ComplexType complexType) {
    complexTypes.add(complexType);
  }

  public List<Element> topLevelElements() {
    return Collections.unmodifiableList(topLevelElements);
  }

  public List<ComplexType> complexTypes() {
    return Collections.unmodifiableList(complexTypes);
  }

  public void recordForwardReference(Resource shape, String name) {
    forwardReferences.putIfAbsent(shape, name);
  }

  public Map<Resource, String> forwardReferences() {
    return Collections.unmodifiableMap(forwardReferences);
  }

  public void recordUnresolved(Resource shape) {
    unresolvedReferences.add(shape.stringValue());
  }

  public Set<String> unresolvedReferences() {
    return Collections.unmodifiableSet(unresolvedReferences);
  }
}

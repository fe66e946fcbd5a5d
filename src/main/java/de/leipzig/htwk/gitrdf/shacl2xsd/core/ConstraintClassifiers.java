package de.leipzig.htwk.gitrdf.shacl2xsd.core;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.model.vocabulary.SHACL;

import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeGraph;
import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeNames;
import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeTerms;

/**
 * Structural policy predicates used by both lowering steps.
 */
public final class ConstraintClassifiers {

  private ConstraintClassifiers() {
  }

  /**
   * True when every branch declares {@code sh:datatype}, i.e. the alternatives differ
   * only in value type and can be written as a union of member types.
   */
  public static boolean isScalarUniform(ShapeGraph graph, List<Value> branches) {
    for (Value branch : branches) {
      if (!(branch instanceof Resource resource) || graph.valueOf(resource, SHACL.DATATYPE).isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Datatype local names of the branches, in branch order.
   */
  public static List<String> memberTypes(ShapeGraph graph, List<Value> branches) {
    List<String> members = new ArrayList<>();
    for (Value branch : branches) {
      if (branch instanceof Resource resource) {
        graph.valueOf(resource, SHACL.DATATYPE).map(ShapeNames::localName).ifPresent(members::add);
      }
    }
    return members;
  }

  /**
   * A shape is attribute-kind when its name, its identity or its {@code sh:path}
   * carries the attribute marker.
   */
  public static boolean isAttribute(ShapeGraph graph, Resource shape, String name) {
    if (name.startsWith(ShapeTerms.ATTRIBUTE_MARKER)) {
      return true;
    }
    if (ShapeNames.derivedName(shape).startsWith(ShapeTerms.ATTRIBUTE_MARKER)
        || ShapeNames.trailingSegment(shape.stringValue()).startsWith(ShapeTerms.ATTRIBUTE_MARKER)) {
      return true;
    }
    return graph.valueOf(shape, SHACL.PATH)
        .filter(path -> path instanceof Resource)
        .map(path -> ShapeNames.trailingSegment(path.stringValue()).startsWith(ShapeTerms.ATTRIBUTE_MARKER))
        .orElse(false);
  }

  /**
   * Branches typed as property shapes, or carrying a path, are lowered as properties;
   * anything else is treated as a node shape.
   */
  public static boolean isPropertyShape(ShapeGraph graph, Resource shape) {
    return graph.hasTriple(shape, RDF.TYPE, SHACL.PROPERTY_SHAPE) || graph.valueOf(shape, SHACL.PATH).isPresent();
  }
}

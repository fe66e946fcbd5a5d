package de.leipzig.htwk.gitrdf.shacl2xsd.graph;

import java.util.List;
import java.util.Optional;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Value;

/**
 * Read-only triple lookups the conversion engine needs from a shapes graph.
 */
public interface ShapeGraph {

  /**
   * First object of {@code (subject, predicate, ?)}, if any.
   */
  Optional<Value> valueOf(Resource subject, IRI predicate);

  /**
   * All objects of {@code (subject, predicate, ?)} in graph order.
   */
  List<Value> allValuesOf(Resource subject, IRI predicate);

  boolean hasTriple(Resource subject, IRI predicate, Value object);

  /**
   * Subjects typed with {@code type} via {@code rdf:type}, in graph order.
   */
  List<Resource> subjectsOfType(IRI type);

  /**
   * Whether the graph says anything at all about {@code subject}. Shapes referenced but
   * never described are unresolvable.
   */
  boolean hasStatementsAbout(Resource subject);
}

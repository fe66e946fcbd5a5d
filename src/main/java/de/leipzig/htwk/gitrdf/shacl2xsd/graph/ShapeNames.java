package de.leipzig.htwk.gitrdf.shacl2xsd.graph;

import java.math.BigInteger;
import java.util.Optional;

import org.eclipse.rdf4j.model.BNode;
import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Literal;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.vocabulary.SHACL;

/**
 * Naming rules shared by the lowering steps: shape names, datatype local names and the
 * lexical form of values written into the schema.
 */
public final class ShapeNames {

  private static final String NODE_SHAPE_SEGMENT = "NodeShape/";
  private static final String PROPERTY_SHAPE_SEGMENT = "PropertyShape/";

  private ShapeNames() {
  }

  /**
   * Explicit {@code sh:name} if present, otherwise derived from the identity.
   * The attribute marker is kept; callers strip it once they have classified the shape.
   */
  public static String shapeName(ShapeGraph graph, Resource shape) {
    Optional<Value> explicit = graph.valueOf(shape, SHACL.NAME);
    if (explicit.isPresent()) {
      return lexicalForm(explicit.get());
    }
    return derivedName(shape);
  }

  public static String derivedName(Resource shape) {
    if (shape instanceof BNode bnode) {
      return bnode.getID();
    }
    String identity = shape.stringValue();
    int nodeShape = identity.lastIndexOf(NODE_SHAPE_SEGMENT);
    if (nodeShape >= 0) {
      return identity.substring(nodeShape + NODE_SHAPE_SEGMENT.length());
    }
    int propertyShape = identity.lastIndexOf(PROPERTY_SHAPE_SEGMENT);
    if (propertyShape >= 0) {
      return identity.substring(propertyShape + PROPERTY_SHAPE_SEGMENT.length());
    }
    return trailingSegment(identity);
  }

  /**
   * Local part of a datatype IRI: after {@code #}, or after the last {@code /}.
   */
  public static String localName(Value datatype) {
    String value = datatype.stringValue();
    int hash = value.lastIndexOf('#');
    if (hash >= 0) {
      return value.substring(hash + 1);
    }
    return value.substring(value.lastIndexOf('/') + 1);
  }

  public static String trailingSegment(String identity) {
    int cut = Math.max(identity.lastIndexOf('/'), identity.lastIndexOf('#'));
    return identity.substring(cut + 1);
  }

  public static String lexicalForm(Value value) {
    if (value instanceof Literal literal) {
      return literal.getLabel();
    } else if (value instanceof IRI iri) {
      return iri.stringValue();
    } else if (value instanceof BNode bnode) {
      return bnode.getID();
    }
    return value.stringValue();
  }

  /**
   * Integer value of a literal, empty when the value is not an integer.
   */
  public static Optional<BigInteger> integerValue(Value value) {
    if (!(value instanceof Literal literal)) {
      return Optional.empty();
    }
    try {
      return Optional.of(new BigInteger(literal.getLabel().trim()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  public static String stripAttributeMarker(String name) {
    return name.startsWith(ShapeTerms.ATTRIBUTE_MARKER) ? name.substring(ShapeTerms.ATTRIBUTE_MARKER.length()) : name;
  }
}

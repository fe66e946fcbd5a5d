package de.leipzig.htwk.gitrdf.shacl2xsd.core;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.model.vocabulary.SHACL;

import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeGraph;
import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeNames;
import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeTerms;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Declaration;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Facet;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.FacetKind;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Restriction;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.SimpleType;

/**
 * Compiles value constraints of a property shape ({@code sh:in}, pattern, numeric and
 * length bounds) into an inline restriction on the declaration.
 */
class FacetCompiler {

  private static final List<IRI> NUMERIC_BOUNDS = List.of(
      SHACL.MIN_EXCLUSIVE, SHACL.MAX_EXCLUSIVE, SHACL.MIN_INCLUSIVE, SHACL.MAX_INCLUSIVE);

  /**
   * Base type for inline restrictions: the declared datatype, else {@code decimal} when
   * numeric bounds are present, else {@code string}.
   */
  static String baseType(ShapeGraph graph, Resource shape) {
    return graph.valueOf(shape, SHACL.DATATYPE)
        .map(ShapeNames::localName)
        .orElseGet(() -> defaultBaseType(graph, shape));
  }

  static String defaultBaseType(ShapeGraph graph, Resource shape) {
    for (IRI bound : NUMERIC_BOUNDS) {
      if (graph.valueOf(shape, bound).isPresent()) {
        return ShapeTerms.DEFAULT_NUMERIC_TYPE;
      }
    }
    return ShapeTerms.DEFAULT_TEXT_TYPE;
  }

  void applyEnumeration(ShapeGraph graph, Resource shape, Declaration declaration) {
    Optional<Value> in = graph.valueOf(shape, SHACL.IN);
    if (in.isEmpty() || RDF.NIL.equals(in.get())) {
      return;
    }

    Value value = in.get();
    if (!ListWalker.isListCell(graph, value)) {
      fixValue(declaration, ShapeNames.lexicalForm(value));
      return;
    }

    List<Value> members = ListWalker.walk(graph, value);
    if (members.isEmpty()) {
      return;
    }
    if (members.size() == 1) {
      fixValue(declaration, ShapeNames.lexicalForm(members.get(0)));
      return;
    }

    Restriction restriction = new Restriction(baseType(graph, shape));
    for (Value member : members) {
      restriction.addFacet(new Facet(FacetKind.ENUMERATION, ShapeNames.lexicalForm(member)));
    }
    declaration.setSimpleType(new SimpleType(restriction));
    declaration.setType(null);
  }

  void applyFacets(ShapeGraph graph, Resource shape, Declaration declaration) {
    Optional<Value> pattern = graph.valueOf(shape, SHACL.PATTERN);
    Optional<Value> minExclusive = graph.valueOf(shape, SHACL.MIN_EXCLUSIVE);
    Optional<Value> maxExclusive = graph.valueOf(shape, SHACL.MAX_EXCLUSIVE);
    Optional<Value> minInclusive = graph.valueOf(shape, SHACL.MIN_INCLUSIVE);
    Optional<Value> maxInclusive = graph.valueOf(shape, SHACL.MAX_INCLUSIVE);
    Optional<Value> minLength = graph.valueOf(shape, SHACL.MIN_LENGTH);
    Optional<Value> maxLength = graph.valueOf(shape, SHACL.MAX_LENGTH);
    Optional<Value> length = graph.valueOf(shape, ShapeTerms.LENGTH);

    boolean anyFacet = pattern.isPresent() || minExclusive.isPresent() || maxExclusive.isPresent()
        || minInclusive.isPresent() || maxInclusive.isPresent()
        || minLength.isPresent() || maxLength.isPresent() || length.isPresent();
    if (!anyFacet) {
      return;
    }

    Restriction restriction = inlineRestriction(graph, shape, declaration);
    addFacet(restriction, FacetKind.PATTERN, pattern);
    addFacet(restriction, FacetKind.MIN_EXCLUSIVE, minExclusive);
    addFacet(restriction, FacetKind.MAX_EXCLUSIVE, maxExclusive);
    addFacet(restriction, FacetKind.MIN_INCLUSIVE, minInclusive);
    addFacet(restriction, FacetKind.MAX_INCLUSIVE, maxInclusive);

    Optional<Value> exact = length.isPresent() ? length : equalBound(minLength, maxLength);
    if (exact.isPresent()) {
      addFacet(restriction, FacetKind.LENGTH, exact);
    } else {
      addFacet(restriction, FacetKind.MIN_LENGTH, minLength);
      addFacet(restriction, FacetKind.MAX_LENGTH, maxLength);
    }
  }

  private Restriction inlineRestriction(ShapeGraph graph, Resource shape, Declaration declaration) {
    SimpleType existing = declaration.getSimpleType();
    if (existing != null && existing.getRestriction() != null) {
      return existing.getRestriction();
    }
    Restriction restriction = new Restriction(baseType(graph, shape));
    declaration.setSimpleType(new SimpleType(restriction));
    declaration.setType(null);
    return restriction;
  }

  private static Optional<Value> equalBound(Optional<Value> minLength, Optional<Value> maxLength) {
    if (minLength.isEmpty() || maxLength.isEmpty()) {
      return Optional.empty();
    }
    Optional<BigInteger> min = ShapeNames.integerValue(minLength.get());
    Optional<BigInteger> max = ShapeNames.integerValue(maxLength.get());
    boolean equal = min.isPresent() && max.isPresent()
        ? min.get().equals(max.get())
        : ShapeNames.lexicalForm(minLength.get()).equals(ShapeNames.lexicalForm(maxLength.get()));
    return equal ? minLength : Optional.empty();
  }

  private static void addFacet(Restriction restriction, FacetKind kind, Optional<Value> value) {
    value.ifPresent(v -> restriction.addFacet(new Facet(kind, ShapeNames.lexicalForm(v))));
  }

  private static void fixValue(Declaration declaration, String value) {
    declaration.setFixed(value);
    declaration.setType(null);
  }
}

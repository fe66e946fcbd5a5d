package de.leipzig.htwk.gitrdf.shacl2xsd.core;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.vocabulary.SHACL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeGraph;
import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeNames;
import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeTerms;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Attribute;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.AttributeUse;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Declaration;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Element;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Restriction;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.SimpleType;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Union;

/**
 * Lowers one property shape into an element or attribute declaration.
 */
public class PropertyShapeLowering {

  private static final Logger logger = LoggerFactory.getLogger(PropertyShapeLowering.class);

  private final FacetCompiler facetCompiler = new FacetCompiler();

  /**
   * Returns the declaration for {@code shape}, or empty when the shape has no
   * {@code sh:path}. Repeated calls within a pass return the same node.
   */
  public Optional<Declaration> lower(Resource shape, ConversionContext context) {
    ShapeGraph graph = context.graph();
    ShapeRegistry registry = context.registry();

    if (registry.isVisited(shape)) {
      return registry.get(shape)
          .filter(Declaration.class::isInstance)
          .map(Declaration.class::cast);
    }
    registry.reserve(shape);

    String rawName = ShapeNames.shapeName(graph, shape);
    boolean attribute = ConstraintClassifiers.isAttribute(graph, shape, rawName);
    String name = ShapeNames.stripAttributeMarker(rawName);

    if (graph.valueOf(shape, SHACL.PATH).isEmpty()) {
      logger.debug("[SKIP] Property shape {} has no sh:path, nothing to convert", shape);
      registry.store(shape, null);
      return Optional.empty();
    }

    Declaration declaration;
    if (attribute) {
      declaration = new Attribute(name);
    } else {
      Element element = new Element(name);
      Optional<SimpleType> disjunction = disjunctionType(graph, shape, name);
      if (disjunction.isPresent()) {
        element.setSimpleType(disjunction.get());
        registry.store(shape, element);
        return Optional.of(element);
      }
      declaration = element;
    }

    declaration.setType(FacetCompiler.baseType(graph, shape));
    applyCardinality(graph, shape, declaration);
    facetCompiler.applyEnumeration(graph, shape, declaration);
    facetCompiler.applyFacets(graph, shape, declaration);

    registry.store(shape, declaration);
    logger.debug("[PROPERTY] Lowered {} to {}", shape, declaration);
    return Optional.of(declaration);
  }

  private void applyCardinality(ShapeGraph graph, Resource shape, Declaration declaration) {
    Optional<BigInteger> minCount = graph.valueOf(shape, SHACL.MIN_COUNT).flatMap(ShapeNames::integerValue);

    if (declaration instanceof Attribute attribute) {
      attribute.setUse(minCount.filter(count -> count.signum() > 0).isPresent() ? AttributeUse.REQUIRED : AttributeUse.OPTIONAL);
      return;
    }

    Element element = (Element) declaration;
    minCount.filter(count -> !BigInteger.ONE.equals(count)).ifPresent(element::setMinOccurs);
    graph.valueOf(shape, SHACL.MAX_COUNT)
        .flatMap(ShapeNames::integerValue)
        .filter(count -> !BigInteger.ONE.equals(count))
        .ifPresent(element::setMaxOccurs);
  }

  /**
   * Inline type for a property-level {@code sh:or}. Structured branches cannot be
   * expressed inside a simple type, so they narrow to a plain text restriction.
   */
  private Optional<SimpleType> disjunctionType(ShapeGraph graph, Resource shape, String name) {
    Optional<Value> head = graph.valueOf(shape, SHACL.OR);
    if (head.isEmpty()) {
      return Optional.empty();
    }
    List<Value> branches = ListWalker.walk(graph, head.get());
    if (branches.isEmpty()) {
      return Optional.empty();
    }

    if (ConstraintClassifiers.isScalarUniform(graph, branches)) {
      return Optional.of(new SimpleType(new Union(ConstraintClassifiers.memberTypes(graph, branches))));
    }
    logger.warn("[NARROWED] Property '{}' ({}) has sh:or over structured branches; written as a plain {} restriction",
        name, shape, ShapeTerms.DEFAULT_TEXT_TYPE);
    return Optional.of(new SimpleType(new Restriction(ShapeTerms.DEFAULT_TEXT_TYPE)));
  }
}

package de.leipzig.htwk.gitrdf.shacl2xsd.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.vocabulary.SHACL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeGraph;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Element;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Schema;

/**
 * Runs one conversion pass over a shapes graph: every node shape, then every property
 * shape no node shape reached, then assembles the schema.
 */
@Component
public class ShaclToXsdEngine {

  private static final Logger logger = LoggerFactory.getLogger(ShaclToXsdEngine.class);

  private final SchemaEmitter schemaEmitter = new SchemaEmitter();

  public ConversionOutcome convert(ShapeGraph graph, String targetNamespace, String schemaPrefix) {
    ConversionContext context = new ConversionContext(graph);
    PropertyShapeLowering propertyLowering = new PropertyShapeLowering();
    NodeShapeLowering nodeLowering = new NodeShapeLowering(propertyLowering);

    List<Resource> nodeShapes = graph.subjectsOfType(SHACL.NODE_SHAPE);
    logger.debug("[CONVERSION] Lowering {} node shapes", nodeShapes.size());
    for (Resource nodeShape : nodeShapes) {
      nodeLowering.lower(nodeShape, context);
    }

    // Standalone property shapes become top-level elements; attributes cannot stand alone.
    for (Resource propertyShape : graph.subjectsOfType(SHACL.PROPERTY_SHAPE)) {
      if (context.registry().isVisited(propertyShape)) {
        continue;
      }
      propertyLowering.lower(propertyShape, context)
          .filter(Element.class::isInstance)
          .map(Element.class::cast)
          .ifPresent(context::emitElement);
    }

    Schema schema = schemaEmitter.emit(context, targetNamespace, schemaPrefix);
    List<String> forwardReferences = checkForwardReferences(context);

    logger.info("[CONVERSION] Emitted {} top-level elements and {} complex types ({} unresolved, {} forward references)",
        schema.getElements().size(), schema.getComplexTypes().size(),
        context.unresolvedReferences().size(), forwardReferences.size());

    return new ConversionOutcome(schema, new ArrayList<>(context.unresolvedReferences()), forwardReferences);
  }

  private List<String> checkForwardReferences(ConversionContext context) {
    List<String> names = new ArrayList<>();
    for (Map.Entry<Resource, String> entry : context.forwardReferences().entrySet()) {
      if (context.registry().stateOf(entry.getKey()) != ShapeRegistry.State.DONE) {
        logger.warn("[CYCLE] Forward reference to {} never completed", entry.getKey());
      }
      names.add(entry.getValue());
    }
    return names;
  }
}

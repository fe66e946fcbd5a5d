package de.leipzig.htwk.gitrdf.shacl2xsd.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.leipzig.htwk.gitrdf.shacl2xsd.graph.ShapeGraph;

/**
 * Reads {@code rdf:first}/{@code rdf:rest} lists front to back.
 */
public final class ListWalker {

  private static final Logger logger = LoggerFactory.getLogger(ListWalker.class);

  private ListWalker() {
  }

  /**
   * Payloads of the list starting at {@code head}, in order. Stops at {@code rdf:nil},
   * at a cell without {@code rdf:rest}, or at a cell already seen; whatever was
   * collected up to that point is returned.
   */
  public static List<Value> walk(ShapeGraph graph, Value head) {
    List<Value> items = new ArrayList<>();
    Set<Resource> seen = new HashSet<>();
    Value cell = head;

    while (cell instanceof Resource resource && !RDF.NIL.equals(resource)) {
      if (!seen.add(resource)) {
        logger.warn("[LIST] List cell {} reached twice, stopping after {} items", resource, items.size());
        break;
      }
      graph.valueOf(resource, RDF.FIRST).ifPresent(items::add);

      Optional<Value> rest = graph.valueOf(resource, RDF.REST);
      if (rest.isEmpty()) {
        logger.debug("[LIST] List cell {} has no rdf:rest, stopping after {} items", resource, items.size());
        break;
      }
      cell = rest.get();
    }
    return items;
  }

  public static boolean isListCell(ShapeGraph graph, Value value) {
    return value instanceof Resource resource && graph.valueOf(resource, RDF.FIRST).isPresent();
  }
}

package de.leipzig.htwk.gitrdf.shacl2xsd.model;

import java.util.List;

import org.eclipse.rdf4j.model.Model;

/**
 * Parsed shapes graph together with the naming decisions taken from its prefixes.
 */
public record ShapeDocument(
    Model model,
    String targetNamespace,
    String schemaPrefix,
    List<String> sources
) {
  public int getStatementCount() {
    return model.size();
  }
}

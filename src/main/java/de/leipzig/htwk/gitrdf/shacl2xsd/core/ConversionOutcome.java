package de.leipzig.htwk.gitrdf.shacl2xsd.core;

import java.util.List;

import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Schema;

/**
 * Schema produced by one pass plus the references it could not inline:
 * shapes referenced but never defined, and shapes referenced while still being
 * converted (cyclic inheritance or branches).
 */
public record ConversionOutcome(
    Schema schema,
    List<String> unresolvedReferences,
    List<String> forwardReferences
) {

  public ConversionOutcome {
    unresolvedReferences = List.copyOf(unresolvedReferences);
    forwardReferences = List.copyOf(forwardReferences);
  }

  public boolean hasUnresolvedReferences() {
    return !unresolvedReferences.isEmpty();
  }

  public boolean hasForwardReferences() {
    return !forwardReferences.isEmpty();
  }
}

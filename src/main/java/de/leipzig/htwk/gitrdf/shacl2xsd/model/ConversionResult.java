package de.leipzig.htwk.gitrdf.shacl2xsd.model;

import java.util.List;

import de.leipzig.htwk.gitrdf.shacl2xsd.core.ConversionOutcome;

public class ConversionResult {
  private final String source;
  private final boolean successful;
  private final long durationMs;
  private final int complexTypeCount;
  private final int elementCount;
  private final List<String> unresolvedReferences;
  private final List<String> forwardReferences;
  private final String xsd;
  private final String errorMessage;

  private ConversionResult(String source, boolean successful, long durationMs, int complexTypeCount,
      int elementCount, List<String> unresolvedReferences, List<String> forwardReferences, String xsd,
      String errorMessage) {
    this.source = source;
    this.successful = successful;
    this.durationMs = durationMs;
    this.complexTypeCount = complexTypeCount;
    this.elementCount = elementCount;
    this.unresolvedReferences = unresolvedReferences != null ? List.copyOf(unresolvedReferences) : List.of();
    this.forwardReferences = forwardReferences != null ? List.copyOf(forwardReferences) : List.of();
    this.xsd = xsd;
    this.errorMessage = errorMessage;
  }

  public static ConversionResult success(String source, long durationMs, ConversionOutcome outcome, String xsd) {
    return new ConversionResult(source, true, durationMs,
        outcome.schema().getComplexTypes().size(),
        outcome.schema().getElements().size(),
        outcome.unresolvedReferences(),
        outcome.forwardReferences(),
        xsd,
        null);
  }

  public static ConversionResult failure(String source, long durationMs, String errorMessage) {
    return new ConversionResult(source, false, durationMs, 0, 0, List.of(), List.of(), null, errorMessage);
  }

  // Getters
  public String getSource() {
    return source;
  }

  public boolean isSuccessful() {
    return successful;
  }

  public long getDurationMs() {
    return durationMs;
  }

  public int getComplexTypeCount() {
    return complexTypeCount;
  }

  public int getElementCount() {
    return elementCount;
  }

  public List<String> getUnresolvedReferences() {
    return unresolvedReferences;
  }

  public List<String> getForwardReferences() {
    return forwardReferences;
  }

  public String getXsd() {
    return xsd;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public boolean hasError() {
    return errorMessage != null;
  }

  public String getSummary() {
    if (successful) {
      return String.format("%s converted to %d complex types and %d elements (took %dms)",
          source, complexTypeCount, elementCount, durationMs);
    } else {
      return String.format("%s could not be converted: %s (took %dms)", source, errorMessage, durationMs);
    }
  }
}

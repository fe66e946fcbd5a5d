package de.leipzig.htwk.gitrdf.shacl2xsd.service;

/**
 * Failure outside the conversion engine: rendering the schema or fetching shapes.
 */
public class ShapeConversionException extends RuntimeException {

  public ShapeConversionException(String message) {
    super(message);
  }

  public ShapeConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}

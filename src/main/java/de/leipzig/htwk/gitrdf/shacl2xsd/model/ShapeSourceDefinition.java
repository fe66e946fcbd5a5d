package de.leipzig.htwk.gitrdf.shacl2xsd.model;

import java.util.Map;

/**
 * JSON request body naming remote shape files: shape file name to URL.
 */
public record ShapeSourceDefinition(Map<String, String> shapes) {

  public boolean hasShapes() {
    return shapes != null && !shapes.isEmpty();
  }

  public int getShapeCount() {
    return shapes != null ? shapes.size() : 0;
  }
}

package de.leipzig.htwk.gitrdf.shacl2xsd.controller;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import de.leipzig.htwk.gitrdf.shacl2xsd.model.ConversionResult;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.ShapeSourceDefinition;
import de.leipzig.htwk.gitrdf.shacl2xsd.service.ShaclConversionService;

@RestController
@RequestMapping("/api/conversion")
public class ConversionController {

  private static final Logger logger = LoggerFactory.getLogger(ConversionController.class);

  static final String UPLOAD_SOURCE = "upload.ttl";

  @Autowired
  private ShaclConversionService conversionService;

  /**
   * Convert Turtle shapes posted as the request body
   */
  @PostMapping("/xsd")
  public ResponseEntity<String> convertShapes(
      @RequestBody String turtle,
      @RequestParam(defaultValue = UPLOAD_SOURCE) String name) {

    logger.info("[CONVERSION] Uploaded shapes: {} ({} characters)", name, turtle.length());

    try {
      return toXsdResponse(conversionService.convert(name, toStream(turtle)));
    } catch (IllegalArgumentException e) {
      logger.error("Invalid request for {} - {}", name, e.getMessage());
      return errorResponse(400, e.getMessage());
    } catch (Exception e) {
      logger.error("Conversion failed for {}", name, e);
      return errorResponse(500, e.getMessage());
    }
  }

  /**
   * Convert a Turtle file from the local data directory
   * Supports nested paths like: shapes/person.ttl
   */
  @GetMapping("/local")
  public ResponseEntity<String> convertLocalFile(@RequestParam String file) {
    logger.info("[CONVERSION] Local shapes: {}", file);

    try {
      Optional<ConversionResult> result = conversionService.convertLocalFile(file);
      if (result.isEmpty()) {
        return errorResponse(404, "Shape file not found: " + file);
      }
      return toXsdResponse(result.get());
    } catch (IllegalArgumentException e) {
      logger.error("Invalid request for file: {} - {}", file, e.getMessage());
      return errorResponse(400, e.getMessage());
    } catch (Exception e) {
      logger.error("Conversion failed for file: {}", file, e);
      return errorResponse(500, e.getMessage());
    }
  }

  /**
   * List all shape files in the local data directory
   */
  @GetMapping("/local/files")
  public ResponseEntity<AvailableFilesResponse> listLocalFiles() {
    List<String> files = conversionService.discoverLocalShapeFiles();
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(new AvailableFilesResponse(files, files.size()));
  }

  /**
   * Download shape files and convert them as one graph
   */
  @PostMapping("/remote")
  public ResponseEntity<String> convertRemoteShapes(@RequestBody ShapeSourceDefinition definition) {
    logger.info("[CONVERSION] Remote shapes: {} files", definition.getShapeCount());

    try {
      return toXsdResponse(conversionService.convertRemote(definition));
    } catch (IllegalArgumentException e) {
      logger.error("Invalid remote shape request - {}", e.getMessage());
      return errorResponse(400, e.getMessage());
    } catch (Exception e) {
      logger.error("Remote conversion failed", e);
      return errorResponse(500, e.getMessage());
    }
  }

  /**
   * Convert posted shapes and report counts only
   */
  @PostMapping("/summary")
  public ResponseEntity<ConversionResponse> summarize(
      @RequestBody String turtle,
      @RequestParam(defaultValue = UPLOAD_SOURCE) String name) {

    try {
      ConversionResult result = conversionService.convert(name, toStream(turtle));
      ConversionResponse response = ConversionResponse.from(result);
      return (result.isSuccessful() ? ResponseEntity.ok() : ResponseEntity.badRequest())
          .contentType(MediaType.APPLICATION_JSON)
          .body(response);
    } catch (Exception e) {
      logger.error("Summary failed for {}", name, e);
      return ResponseEntity.status(500)
          .contentType(MediaType.APPLICATION_JSON)
          .body(new ConversionResponse(name, 0, 0, 0, List.of(), List.of(), "[CONVERSION_FAILED]", e.getMessage()));
    }
  }

  private ResponseEntity<String> toXsdResponse(ConversionResult result) {
    if (!result.isSuccessful()) {
      return errorResponse(400, result.getErrorMessage());
    }
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_XML)
        .body(result.getXsd());
  }

  private ResponseEntity<String> errorResponse(int status, String message) {
    return ResponseEntity.status(status)
        .contentType(MediaType.TEXT_PLAIN)
        .body(message != null ? message : "Conversion failed");
  }

  private static ByteArrayInputStream toStream(String turtle) {
    return new ByteArrayInputStream(turtle.getBytes(StandardCharsets.UTF_8));
  }

  // Response DTOs
  public record ConversionResponse(
      String source,
      long durationMs,
      int complexTypeCount,
      int elementCount,
      List<String> unresolvedReferences,
      List<String> forwardReferences,
      String status,
      String errorMessage
  ) {
    static ConversionResponse from(ConversionResult result) {
      return new ConversionResponse(
          result.getSource(),
          result.getDurationMs(),
          result.getComplexTypeCount(),
          result.getElementCount(),
          result.getUnresolvedReferences(),
          result.getForwardReferences(),
          result.isSuccessful() ? "CONVERTED" : "[INVALID]",
          result.getErrorMessage()
      );
    }
  }

  public record AvailableFilesResponse(
      List<String> files,
      int count
  ) {}
}

package de.leipzig.htwk.gitrdf.shacl2xsd.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import de.leipzig.htwk.gitrdf.shacl2xsd.config.ConversionConfig;
import de.leipzig.htwk.gitrdf.shacl2xsd.core.ShaclToXsdEngine;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.ConversionResult;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.ShapeSourceDefinition;

class ShaclConversionServiceTest {

  @TempDir
  Path localData;

  private final ShaclConversionService conversionService = new ShaclConversionService();
  private final RemoteShapeService remoteShapeService = mock(RemoteShapeService.class);
  private final ConversionConfig config = new ConversionConfig();

  @BeforeEach
  void setUp() {
    config.setUriFixingEnabled(true);
    config.setMaxFileSizeMb(5);
    config.setLocalDataDir(localData.toString());

    UriSanitizer sanitizer = new UriSanitizer();
    ReflectionTestUtils.setField(sanitizer, "config", config);
    ShapeLoadingService loadingService = new ShapeLoadingService();
    ReflectionTestUtils.setField(loadingService, "uriSanitizer", sanitizer);
    ReflectionTestUtils.setField(loadingService, "config", config);

    ReflectionTestUtils.setField(conversionService, "shapeLoadingService", loadingService);
    ReflectionTestUtils.setField(conversionService, "engine", new ShaclToXsdEngine());
    ReflectionTestUtils.setField(conversionService, "xsdWriter", new XsdWriter());
    ReflectionTestUtils.setField(conversionService, "remoteShapeService", remoteShapeService);
    ReflectionTestUtils.setField(conversionService, "config", config);
  }

  private static InputStream personShapes() {
    InputStream stream = ShaclConversionServiceTest.class.getResourceAsStream("/shapes/person.ttl");
    assertThat(stream).isNotNull();
    return stream;
  }

  private static InputStream stream(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("Converts a shapes file end to end")
  void convertsPersonShapes() {
    ConversionResult result = conversionService.convert("person.ttl", personShapes());

    assertThat(result.isSuccessful()).isTrue();
    assertThat(result.hasError()).isFalse();
    assertThat(result.getComplexTypeCount()).isEqualTo(2);
    assertThat(result.getElementCount()).isEqualTo(2);
    assertThat(result.getXsd())
        .contains("<xsd:schema")
        .contains("targetNamespace=\"http://schema.org/\"")
        .contains("name=\"PersonShape\"")
        .contains("base=\"tns:PersonShape\"")
        .contains("value=\"diverse\"")
        .contains("name=\"id\"");
    assertThat(result.getSummary()).contains("2 complex types");
  }

  @Test
  void invalidTurtleIsAFailedResult() {
    ConversionResult result = conversionService.convert("broken.ttl", stream("@prefix sh: <broken"));

    assertThat(result.isSuccessful()).isFalse();
    assertThat(result.getErrorMessage()).startsWith("Invalid Turtle");
    assertThat(result.getXsd()).isNull();
  }

  @Test
  void oversizedInputIsAFailedResult() {
    config.setMaxFileSizeMb(0);

    ConversionResult result = conversionService.convert("person.ttl", personShapes());

    assertThat(result.isSuccessful()).isFalse();
    assertThat(result.getErrorMessage()).contains("too large");
  }

  @Test
  void reportsUnresolvedReferences() {
    ConversionResult result = conversionService.convert("orphan.ttl", stream("""
        @prefix sh: <http://www.w3.org/ns/shacl#> .
        <http://example.com/OrphanShape> a sh:NodeShape ; sh:node <http://example.com/MissingShape> .
        """));

    assertThat(result.isSuccessful()).isTrue();
    assertThat(result.getUnresolvedReferences()).containsExactly("http://example.com/MissingShape");
  }

  @Nested
  @DisplayName("Local files")
  class LocalFiles {

    @Test
    void convertsNestedFile() throws Exception {
      Path nested = Files.createDirectories(localData.resolve("shapes"));
      try (InputStream shapes = personShapes()) {
        Files.copy(shapes, nested.resolve("person.ttl"));
      }

      Optional<ConversionResult> result = conversionService.convertLocalFile("shapes/person.ttl");

      assertThat(result).hasValueSatisfying(r -> assertThat(r.isSuccessful()).isTrue());
      assertThat(conversionService.discoverLocalShapeFiles()).containsExactly("shapes/person.ttl");
    }

    @Test
    void missingFileIsEmpty() throws Exception {
      assertThat(conversionService.convertLocalFile("nope.ttl")).isEmpty();
    }

    @Test
    void pathsOutsideTheDirectoryAreRejected() {
      assertThatThrownBy(() -> conversionService.convertLocalFile("../secret.ttl"))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingDirectoryListsNothing() {
      config.setLocalDataDir(localData.resolve("absent").toString());

      assertThat(conversionService.discoverLocalShapeFiles()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Remote files")
  class RemoteFiles {

    @Test
    void convertsDownloadedShapes() {
      Map<String, String> urls = Map.of("person.ttl", "https://example.com/person.ttl");
      Map<String, InputStream> downloaded = new LinkedHashMap<>();
      downloaded.put("person.ttl", personShapes());
      when(remoteShapeService.downloadShapes(urls)).thenReturn(downloaded);

      ConversionResult result = conversionService.convertRemote(new ShapeSourceDefinition(urls));

      assertThat(result.isSuccessful()).isTrue();
      assertThat(result.getSource()).isEqualTo("person.ttl");
    }

    @Test
    void emptyDefinitionIsRejected() {
      assertThatThrownBy(() -> conversionService.convertRemote(new ShapeSourceDefinition(Map.of())))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}

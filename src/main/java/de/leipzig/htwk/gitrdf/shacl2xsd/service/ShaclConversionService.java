package de.leipzig.htwk.gitrdf.shacl2xsd.service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import org.eclipse.rdf4j.rio.RDFParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import de.leipzig.htwk.gitrdf.shacl2xsd.config.ConversionConfig;
import de.leipzig.htwk.gitrdf.shacl2xsd.core.ConversionOutcome;
import de.leipzig.htwk.gitrdf.shacl2xsd.core.ShaclToXsdEngine;
import de.leipzig.htwk.gitrdf.shacl2xsd.graph.Rdf4jShapeGraph;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.ConversionResult;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.ShapeDocument;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.ShapeSourceDefinition;

/**
 * Loads shapes, runs the conversion and renders the schema. Input problems (bad Turtle,
 * oversized files) come back as failed results; everything else propagates.
 */
@Service
public class ShaclConversionService {

    private static final Logger logger = LoggerFactory.getLogger(ShaclConversionService.class);

    @Autowired
    private ShapeLoadingService shapeLoadingService;
    @Autowired
    private ShaclToXsdEngine engine;
    @Autowired
    private XsdWriter xsdWriter;
    @Autowired
    private RemoteShapeService remoteShapeService;
    @Autowired
    private ConversionConfig config;

    public ConversionResult convert(String sourceName, InputStream turtle) {
        Map<String, InputStream> sources = new LinkedHashMap<>();
        sources.put(sourceName, turtle);
        return convert(sources);
    }

    public ConversionResult convert(Map<String, InputStream> sources) {
        String sourceLabel = String.join(", ", sources.keySet());
        long startTime = System.currentTimeMillis();

        logger.info("[CONVERSION] Converting {}", sourceLabel);

        try {
            ShapeDocument document = shapeLoadingService.load(sources);
            ConversionOutcome outcome = engine.convert(
                new Rdf4jShapeGraph(document.model()), document.targetNamespace(), document.schemaPrefix());
            String xsd = xsdWriter.write(outcome.schema());

            long durationMs = System.currentTimeMillis() - startTime;
            ConversionResult result = ConversionResult.success(sourceLabel, durationMs, outcome, xsd);
            logger.info("[CONVERSION] {}", result.getSummary());
            if (outcome.hasUnresolvedReferences()) {
                logger.warn("[UNRESOLVED] {} referenced shapes are not defined: {}",
                    outcome.unresolvedReferences().size(), outcome.unresolvedReferences());
            }
            return result;

        } catch (RDFParseException e) {
            long durationMs = System.currentTimeMillis() - startTime;
            logger.error("[CONVERSION] Invalid Turtle in {}: {}", sourceLabel, e.getMessage());
            return ConversionResult.failure(sourceLabel, durationMs, "Invalid Turtle: " + e.getMessage());
        } catch (IllegalArgumentException | IOException e) {
            long durationMs = System.currentTimeMillis() - startTime;
            logger.error("[CONVERSION] Could not read {}: {}", sourceLabel, e.getMessage());
            return ConversionResult.failure(sourceLabel, durationMs, e.getMessage());
        }
    }

    /**
     * Converts a Turtle file below the local data directory. Empty when the file does not exist.
     */
    public Optional<ConversionResult> convertLocalFile(String fileName) throws IOException {
        Path localDataPath = Paths.get(config.getLocalDataDir()).toAbsolutePath().normalize();
        Path filePath = localDataPath.resolve(fileName).normalize();

        if (!filePath.startsWith(localDataPath)) {
            throw new IllegalArgumentException("File must be inside " + config.getLocalDataDir() + ": " + fileName);
        }
        if (!Files.isRegularFile(filePath)) {
            logger.warn("[LOCAL] {} not found in {}", fileName, config.getLocalDataDir());
            return Optional.empty();
        }

        return Optional.of(convert(fileName, Files.newInputStream(filePath)));
    }

    /**
     * Lists Turtle files below the local data directory, relative to it.
     */
    public List<String> discoverLocalShapeFiles() {
        List<String> shapeFiles = new ArrayList<>();
        Path localDataPath = Paths.get(config.getLocalDataDir());

        if (!Files.isDirectory(localDataPath)) {
            logger.warn("[LOCAL] {} directory does not exist", config.getLocalDataDir());
            return shapeFiles;
        }

        try (Stream<Path> paths = Files.walk(localDataPath)) {
            paths
                .filter(Files::isRegularFile)
                .filter(path -> path.toString().toLowerCase().endsWith(".ttl"))
                .map(path -> localDataPath.relativize(path).toString().replace("\\", "/"))
                .sorted()
                .forEach(shapeFiles::add);
        } catch (IOException e) {
            logger.error("Error discovering shape files in {}", config.getLocalDataDir(), e);
        }

        logger.info("[LOCAL] Found {} shape files in {}", shapeFiles.size(), config.getLocalDataDir());
        return shapeFiles;
    }

    public ConversionResult convertRemote(ShapeSourceDefinition definition) {
        if (!definition.hasShapes()) {
            throw new IllegalArgumentException("No shape files given");
        }
        return convert(remoteShapeService.downloadShapes(definition.shapes()));
    }
}

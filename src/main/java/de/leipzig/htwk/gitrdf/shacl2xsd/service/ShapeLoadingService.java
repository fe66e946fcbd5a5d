package de.leipzig.htwk.gitrdf.shacl2xsd.service;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Model;
import org.eclipse.rdf4j.model.Namespace;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.impl.LinkedHashModel;
import org.eclipse.rdf4j.model.vocabulary.SHACL;
import org.eclipse.rdf4j.model.vocabulary.XSD;
import org.eclipse.rdf4j.rio.RDFFormat;
import org.eclipse.rdf4j.rio.Rio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import de.leipzig.htwk.gitrdf.shacl2xsd.config.ConversionConfig;
import de.leipzig.htwk.gitrdf.shacl2xsd.model.ShapeDocument;

/**
 * Parses Turtle shape files into one insertion-ordered model and reads the naming
 * hints (schema prefix, target namespace) the output document needs.
 */
@Service
public class ShapeLoadingService {

    private static final Logger logger = LoggerFactory.getLogger(ShapeLoadingService.class);

    static final String XS_PREFIX = "xs";
    static final String XSD_PREFIX = "xsd";

    @Autowired
    private UriSanitizer uriSanitizer;
    @Autowired
    private ConversionConfig config;

    public ShapeDocument load(String sourceName, InputStream turtle) throws IOException {
        Map<String, InputStream> sources = new LinkedHashMap<>();
        sources.put(sourceName, turtle);
        return load(sources);
    }

    /**
     * Parses every source into a single model, in the order given. Throws
     * {@link org.eclipse.rdf4j.rio.RDFParseException} on malformed Turtle.
     */
    public ShapeDocument load(Map<String, InputStream> sources) throws IOException {
        Model merged = new LinkedHashModel();

        for (Map.Entry<String, InputStream> source : sources.entrySet()) {
            String sourceName = source.getKey();
            InputStream fixed = uriSanitizer.fixUriEncoding(source.getValue(), sourceName);
            try (fixed) {
                Model parsed = Rio.parse(fixed, config.getDefaultTargetNamespace(), RDFFormat.TURTLE);
                merged.addAll(parsed);
                for (Namespace namespace : parsed.getNamespaces()) {
                    merged.setNamespace(namespace);
                }
                logger.info("[SHAPES] Loaded {} statements from {}", parsed.size(), sourceName);
            }
        }

        String schemaPrefix = schemaPrefix(merged);
        String targetNamespace = targetNamespace(merged);
        logger.debug("[SHAPES] Target namespace {}, schema prefix '{}'", targetNamespace, schemaPrefix);

        return new ShapeDocument(merged, targetNamespace, schemaPrefix, List.copyOf(sources.keySet()));
    }

    /**
     * {@code xsd} when the shapes bind that prefix to the XML Schema namespace, else {@code xs}.
     */
    String schemaPrefix(Model model) {
        for (Namespace namespace : model.getNamespaces()) {
            if (XSD_PREFIX.equals(namespace.getPrefix()) && XSD.NAMESPACE.equals(namespace.getName())) {
                return XSD_PREFIX;
            }
        }
        return XS_PREFIX;
    }

    /**
     * Namespace of the first {@code sh:targetClass} IRI, up to and including its last slash.
     */
    String targetNamespace(Model model) {
        for (Statement statement : model.filter(null, SHACL.TARGET_CLASS, null)) {
            if (statement.getObject() instanceof IRI targetClass) {
                String value = targetClass.stringValue();
                int slash = value.lastIndexOf('/');
                if (slash >= 0) {
                    return value.substring(0, slash + 1);
                }
            }
        }
        return config.getDefaultTargetNamespace();
    }
}

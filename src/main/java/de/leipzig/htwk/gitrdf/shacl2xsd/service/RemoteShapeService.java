package de.leipzig.htwk.gitrdf.shacl2xsd.service;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Service for downloading shape files from remote URLs
 */
@Service
public class RemoteShapeService {

    private static final Logger logger = LoggerFactory.getLogger(RemoteShapeService.class);

    @Autowired
    private RestTemplate restTemplate;

    /**
     * Download shape files in the order given
     * @param shapeDefinitions Map of shape file names to URLs
     * @return Map of shape file names to downloaded content
     */
    public Map<String, InputStream> downloadShapes(Map<String, String> shapeDefinitions) {
        Map<String, InputStream> downloadedShapes = new LinkedHashMap<>();

        logger.info("[REMOTE_SHAPES] Downloading {} shape files", shapeDefinitions.size());

        for (Map.Entry<String, String> entry : shapeDefinitions.entrySet()) {
            String shapeName = entry.getKey();
            String shapeUrl = entry.getValue();

            validateUrl(shapeName, shapeUrl);
            logger.info("[DOWNLOAD] Downloading shape file '{}' from: {}", shapeName, shapeUrl);

            ResponseEntity<String> response;
            try {
                response = restTemplate.getForEntity(shapeUrl, String.class);
            } catch (RestClientException e) {
                logger.error("[ERROR] Failed to download shape file '{}' from {}: {}", shapeName, shapeUrl, e.getMessage());
                throw new ShapeConversionException("Failed to download shape file '" + shapeName + "' from " + shapeUrl, e);
            }

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new ShapeConversionException("Failed to download shape file from " + shapeUrl
                    + ". Status: " + response.getStatusCode());
            }

            byte[] content = response.getBody().getBytes(StandardCharsets.UTF_8);
            downloadedShapes.put(shapeName, new ByteArrayInputStream(content));
            logger.info("[SUCCESS] Downloaded shape file '{}' ({} bytes)", shapeName, content.length);
        }

        return downloadedShapes;
    }

    void validateUrl(String shapeName, String shapeUrl) {
        try {
            URI uri = new URI(shapeUrl);
            String scheme = uri.getScheme();
            if (!"http".equals(scheme) && !"https".equals(scheme)) {
                throw new IllegalArgumentException("Only HTTP and HTTPS URLs are supported for shape file '"
                    + shapeName + "': " + shapeUrl);
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL for shape file '" + shapeName + "': " + shapeUrl, e);
        }
    }
}

package de.leipzig.htwk.gitrdf.shacl2xsd.service;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import de.leipzig.htwk.gitrdf.shacl2xsd.config.ConversionConfig;

/**
 * Percent-encodes characters inside {@code <...>} IRIs that Turtle rejects, so shape files
 * exported by sloppy tools still parse.
 */
@Service
public class UriSanitizer {

  private static final Logger logger = LoggerFactory.getLogger(UriSanitizer.class);

  @Autowired
  private ConversionConfig config;

  private static final Pattern URI_PATTERN = Pattern.compile("<([^>]+)>");

  private static final Pattern INVALID_URI_CHARS = Pattern.compile("[\\[\\]\\s\\{\\}\\|\\\\\\^`]");

  private long getMaxContentSize() {
    return (long) config.getMaxFileSizeMb() * 1024 * 1024;
  }

  /**
   * Returns a stream with fixed IRIs. The original stream is consumed and closed unless
   * fixing is disabled, in which case it is returned untouched.
   */
  public InputStream fixUriEncoding(InputStream originalStream, String sourceName) throws IOException {
    if (!config.isUriFixingEnabled()) {
      logger.debug("URI fixing disabled - returning original stream for: {}", sourceName);
      return originalStream;
    }

    StringBuilder content = new StringBuilder();
    long totalSize = 0;
    int fixedLines = 0;

    try (BufferedReader reader = new BufferedReader(new InputStreamReader(originalStream, StandardCharsets.UTF_8))) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;

        totalSize += line.length() + 1;
        if (totalSize > getMaxContentSize()) {
          throw new IllegalArgumentException(
              String.format("Shapes file %s is too large (>%d MB)", sourceName, config.getMaxFileSizeMb()));
        }

        String fixedLine = fixUrisInLine(line, lineNumber, sourceName);
        if (!fixedLine.equals(line)) {
          fixedLines++;
        }
        content.append(fixedLine).append("\n");
      }
    }

    logger.debug("Processed {} bytes from {} ({} lines with fixed IRIs)", totalSize, sourceName, fixedLines);
    return new ByteArrayInputStream(content.toString().getBytes(StandardCharsets.UTF_8));
  }

  String fixUrisInLine(String line, int lineNumber, String sourceName) {
    String trimmed = line.trim();
    if (trimmed.isEmpty() || trimmed.startsWith("#") || !line.contains("<") || !line.contains(">")) {
      return line;
    }

    Matcher matcher = URI_PATTERN.matcher(line);
    StringBuilder result = new StringBuilder();
    boolean lineChanged = false;

    while (matcher.find()) {
      String originalUri = matcher.group(1);
      String fixedUri = isValidUri(originalUri) ? originalUri : encodeInvalidCharacters(originalUri);
      if (!originalUri.equals(fixedUri)) {
        logger.debug("Fixed IRI at line {} in {}: '{}' -> '{}'", lineNumber, sourceName, originalUri, fixedUri);
        lineChanged = true;
      }
      matcher.appendReplacement(result, "<" + Matcher.quoteReplacement(fixedUri) + ">");
    }
    matcher.appendTail(result);

    return lineChanged ? result.toString() : line;
  }

  String encodeInvalidCharacters(String uri) {
    String fixed = uri;
    fixed = fixed.replace(" ", "%20");
    fixed = fixed.replace("[", "%5B");
    fixed = fixed.replace("]", "%5D");
    fixed = fixed.replace("{", "%7B");
    fixed = fixed.replace("}", "%7D");
    fixed = fixed.replace("|", "%7C");
    fixed = fixed.replace("\\", "%5C");
    fixed = fixed.replace("^", "%5E");
    fixed = fixed.replace("`", "%60");
    fixed = fixed.replace("\t", "%09");
    return fixed;
  }

  public boolean isValidUri(String uri) {
    if (uri == null || uri.isEmpty()) {
      return false;
    }
    return !INVALID_URI_CHARS.matcher(uri).find();
  }
}

package de.leipzig.htwk.gitrdf.shacl2xsd.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "shacl.conversion")
public class ConversionConfig {

  /** Used when no sh:targetClass tells us the namespace, and as base IRI while parsing. */
  private String defaultTargetNamespace = "http://example.com/";
  private String localDataDir = "/local_data";

  @Value("${shacl.uri-fixing-enabled:true}")
  private boolean uriFixingEnabled;

  @Value("${shacl.max-file-size-mb:50}")
  private int maxFileSizeMb;

  // Getters and setters
  public String getDefaultTargetNamespace() {
    return defaultTargetNamespace;
  }

  public void setDefaultTargetNamespace(String defaultTargetNamespace) {
    this.defaultTargetNamespace = defaultTargetNamespace;
  }

  public String getLocalDataDir() {
    return localDataDir;
  }

  public void setLocalDataDir(String localDataDir) {
    this.localDataDir = localDataDir;
  }

  public boolean isUriFixingEnabled() {
    return uriFixingEnabled;
  }

  public void setUriFixingEnabled(boolean uriFixingEnabled) {
    this.uriFixingEnabled = uriFixingEnabled;
  }

  public int getMaxFileSizeMb() {
    return maxFileSizeMb;
  }

  public void setMaxFileSizeMb(int maxFileSizeMb) {
    this.maxFileSizeMb = maxFileSizeMb;
  }
}

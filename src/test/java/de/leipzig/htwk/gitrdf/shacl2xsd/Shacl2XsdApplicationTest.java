package de.leipzig.htwk.gitrdf.shacl2xsd;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import de.leipzig.htwk.gitrdf.shacl2xsd.config.ConversionConfig;
import de.leipzig.htwk.gitrdf.shacl2xsd.controller.ConversionController;
import de.leipzig.htwk.gitrdf.shacl2xsd.service.ShaclConversionService;

@SpringBootTest
class Shacl2XsdApplicationTest {

  @Autowired
  private ConversionController controller;
  @Autowired
  private ShaclConversionService conversionService;
  @Autowired
  private ConversionConfig config;

  @Test
  void contextLoadsWithConfiguredDefaults() {
    assertThat(controller).isNotNull();
    assertThat(conversionService).isNotNull();
    assertThat(config.getDefaultTargetNamespace()).isEqualTo("http://example.com/");
    assertThat(config.isUriFixingEnabled()).isTrue();
    assertThat(config.getMaxFileSizeMb()).isEqualTo(50);
  }
}

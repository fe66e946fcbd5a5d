package de.leipzig.htwk.gitrdf.shacl2xsd.core;

import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.Schema;

/**
 * Assembles the root document from what a pass accumulated.
 */
public class SchemaEmitter {

  public Schema emit(ConversionContext context, String targetNamespace, String schemaPrefix) {
    return new Schema(targetNamespace, schemaPrefix, context.topLevelElements(), context.complexTypes());
  }
}

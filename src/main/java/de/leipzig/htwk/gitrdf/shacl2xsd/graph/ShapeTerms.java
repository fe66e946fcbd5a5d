package de.leipzig.htwk.gitrdf.shacl2xsd.graph;

import java.util.Set;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.util.Values;
import org.eclipse.rdf4j.model.vocabulary.SHACL;

/**
 * Shape vocabulary terms that RDF4J's {@link SHACL} class does not define.
 */
public final class ShapeTerms {

  /** Exact string length, paired with {@code sh:minLength}/{@code sh:maxLength}. */
  public static final IRI LENGTH = Values.iri(SHACL.NAMESPACE, "length");

  public static final String XSD_NAMESPACE = "http://www.w3.org/2001/XMLSchema";

  /** Marker that turns a property shape into an attribute. */
  public static final String ATTRIBUTE_MARKER = "@";

  public static final String DEFAULT_TEXT_TYPE = "string";
  public static final String DEFAULT_NUMERIC_TYPE = "decimal";

  /** Built-in XML Schema datatypes, referenced with the schema prefix in output. */
  public static final Set<String> BUILT_IN_TYPES = Set.of(
      "anyType", "anySimpleType", "anyURI", "base64Binary", "boolean", "byte", "date",
      "dateTime", "dateTimeStamp", "dayTimeDuration", "decimal", "double", "duration",
      "ENTITIES", "ENTITY", "float", "gDay", "gMonth", "gMonthDay", "gYear", "gYearMonth",
      "hexBinary", "ID", "IDREF", "IDREFS", "int", "integer", "language", "long", "Name",
      "NCName", "negativeInteger", "NMTOKEN", "NMTOKENS", "nonNegativeInteger",
      "nonPositiveInteger", "normalizedString", "NOTATION", "positiveInteger", "QName",
      "short", "string", "time", "token", "unsignedByte", "unsignedInt", "unsignedLong",
      "unsignedShort", "yearMonthDuration");

  private ShapeTerms() {
  }

  public static boolean isBuiltInType(String localName) {
    return BUILT_IN_TYPES.contains(localName);
  }
}

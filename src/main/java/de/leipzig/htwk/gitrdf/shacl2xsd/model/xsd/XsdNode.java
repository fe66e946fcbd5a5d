package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

/**
 * Closed set of nodes that make up a generated schema tree.
 */
public sealed interface XsdNode permits Schema, ComplexType, Declaration, SimpleType, SimpleTypeContent, ModelGroup {
}

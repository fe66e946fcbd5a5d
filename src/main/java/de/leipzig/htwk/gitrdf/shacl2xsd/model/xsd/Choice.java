package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

/**
 * Exactly one of the contained particles applies.
 */
public final class Choice extends ModelGroup {
}

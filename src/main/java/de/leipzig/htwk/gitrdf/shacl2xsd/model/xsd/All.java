package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

/**
 * Unordered group: every contained element may appear in any order.
 */
public final class All extends ModelGroup {
}

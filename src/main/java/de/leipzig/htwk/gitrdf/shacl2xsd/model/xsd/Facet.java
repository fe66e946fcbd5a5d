package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

public record Facet(FacetKind kind, String value) {
}

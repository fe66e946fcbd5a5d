package de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Restriction of a base type by an ordered list of facets. Facets keep the order in
 * which they were added; callers add them in canonical order.
 */
public final class Restriction implements SimpleTypeContent {

  private final String base;
  private final List<Facet> facets = new ArrayList<>();

  public Restriction(String base) {
    this.base = base;
  }

  public String getBase() {
    return base;
  }

  public void addFacet(Facet facet) {
    facets.add(facet);
  }

  public List<Facet> getFacets() {
    return Collections.unmodifiableList(facets);
  }

  public List<String> valuesOf(FacetKind kind) {
    return facets.stream().filter(f -> f.kind() == kind).map(Facet::value).toList();
  }
}

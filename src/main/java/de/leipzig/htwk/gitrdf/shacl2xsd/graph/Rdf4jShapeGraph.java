package de.leipzig.htwk.gitrdf.shacl2xsd.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Model;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.util.Models;
import org.eclipse.rdf4j.model.vocabulary.RDF;

/**
 * {@link ShapeGraph} over an RDF4J {@link Model}. Lookups follow the model's statement
 * order, so an insertion-ordered model gives a deterministic traversal.
 */
public class Rdf4jShapeGraph implements ShapeGraph {

  private final Model model;

  public Rdf4jShapeGraph(Model model) {
    this.model = model;
  }

  @Override
  public Optional<Value> valueOf(Resource subject, IRI predicate) {
    return Models.object(model.filter(subject, predicate, null));
  }

  @Override
  public List<Value> allValuesOf(Resource subject, IRI predicate) {
    return new ArrayList<>(model.filter(subject, predicate, null).objects());
  }

  @Override
  public boolean hasTriple(Resource subject, IRI predicate, Value object) {
    return model.contains(subject, predicate, object);
  }

  @Override
  public List<Resource> subjectsOfType(IRI type) {
    return new ArrayList<>(model.filter(null, RDF.TYPE, type).subjects());
  }

  @Override
  public boolean hasStatementsAbout(Resource subject) {
    return model.contains(subject, null, null);
  }

  public int size() {
    return model.size();
  }
}

package de.leipzig.htwk.gitrdf.shacl2xsd.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.eclipse.rdf4j.model.Resource;

import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.XsdNode;

/**
 * Per-pass memo from shape identity to its lowered node.
 * <p>
 * A shape is {@link State#IN_PROGRESS} from {@link #reserve} until {@link #store}. A node
 * reserved with a placeholder is handed out while still in progress; callers that meet
 * an in-progress shape only use its name, which is how cycles turn into named
 * forward references instead of endless recursion.
 */
public class ShapeRegistry {

  public enum State {
    UNVISITED,
    IN_PROGRESS,
    DONE
  }

  private record Entry(State state, XsdNode node) {
  }

  private final Map<Resource, Entry> entries = new HashMap<>();

  public Optional<XsdNode> get(Resource shape) {
    Entry entry = entries.get(shape);
    return entry == null ? Optional.empty() : Optional.ofNullable(entry.node());
  }

  public State stateOf(Resource shape) {
    Entry entry = entries.get(shape);
    return entry == null ? State.UNVISITED : entry.state();
  }

  public boolean isVisited(Resource shape) {
    return entries.containsKey(shape);
  }

  public void reserve(Resource shape) {
    reserve(shape, null);
  }

  public void reserve(Resource shape, XsdNode placeholder) {
    if (entries.containsKey(shape)) {
      throw new IllegalStateException("Shape " + shape + " was already reserved");
    }
    entries.put(shape, new Entry(State.IN_PROGRESS, placeholder));
  }

  /**
   * Finalizes the entry. {@code node} may be null for shapes that produce nothing;
   * they still count as processed.
   */
  public void store(Resource shape, XsdNode node) {
    entries.put(shape, new Entry(State.DONE, node));
  }

  public int size() {
    return entries.size();
  }
}

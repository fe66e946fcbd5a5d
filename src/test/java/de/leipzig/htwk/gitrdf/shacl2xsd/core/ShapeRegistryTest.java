package de.leipzig.htwk.gitrdf.shacl2xsd.core;

import static de.leipzig.htwk.gitrdf.shacl2xsd.graph.TurtleFixtures.ex;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import de.leipzig.htwk.gitrdf.shacl2xsd.model.xsd.ComplexType;

class ShapeRegistryTest {

  private final ShapeRegistry registry = new ShapeRegistry();

  @Test
  void tracksStates() {
    ComplexType placeholder = new ComplexType("Person");

    assertThat(registry.stateOf(ex("Person"))).isEqualTo(ShapeRegistry.State.UNVISITED);

    registry.reserve(ex("Person"), placeholder);
    assertThat(registry.stateOf(ex("Person"))).isEqualTo(ShapeRegistry.State.IN_PROGRESS);
    assertThat(registry.get(ex("Person"))).containsSame(placeholder);

    registry.store(ex("Person"), placeholder);
    assertThat(registry.stateOf(ex("Person"))).isEqualTo(ShapeRegistry.State.DONE);
    assertThat(registry.size()).isEqualTo(1);
  }

  @Test
  void emptyResultStillCountsAsVisited() {
    registry.reserve(ex("NoPath"));
    registry.store(ex("NoPath"), null);

    assertThat(registry.isVisited(ex("NoPath"))).isTrue();
    assertThat(registry.get(ex("NoPath"))).isEmpty();
  }

  @Test
  void reservingTwiceFails() {
    registry.reserve(ex("Person"));

    assertThatThrownBy(() -> registry.reserve(ex("Person")))
        .isInstanceOf(IllegalStateException.class);
  }
}

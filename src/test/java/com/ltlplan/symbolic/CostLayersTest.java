package com.ltlplan.symbolic;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

public class CostLayersTest {
  @Test
  public void testPointwiseMinimum() {
    BddManager manager = new BddManager();
    StateEncoder<Integer> encoder = StateEncoder.single(manager, "x", 8);
    int a = encoder.cube(0);
    int b = encoder.cube(1);
    int ab = manager.or(a, b);

    CostLayers layers = new CostLayers(manager);
    assertThat(layers.add(5, ab), is(true));
    assertThat(layers.add(3, a), is(true));
    assertThat(layers.costOf(a), is(OptionalInt.of(3)));
    assertThat(layers.costOf(b), is(OptionalInt.of(5)));
    assertThat(layers.get(5), is(b));

    assertThat(layers.add(7, b), is(false));
    assertThat(layers.costOf(b), is(OptionalInt.of(5)));
    assertThat(layers.lowestCost(), is(OptionalInt.of(3)));
  }

  @Test
  public void testRemove() {
    BddManager manager = new BddManager();
    StateEncoder<Integer> encoder = StateEncoder.single(manager, "x", 4);
    CostLayers layers = new CostLayers(manager);
    layers.add(2, encoder.cube(0));
    layers.add(0, encoder.cube(1));
    assertThat(layers.remove(0), is(encoder.cube(1)));
    assertThat(layers.lowestCost(), is(OptionalInt.of(2)));
    layers.remove(2);
    assertThat(layers.isEmpty(), is(true));
    assertThat(layers.costOf(encoder.cube(0)), is(OptionalInt.empty()));
  }
}

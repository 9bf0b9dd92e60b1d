package com.ltlplan.symbolic;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.ltlplan.model.ConfigurationException;
import com.ltlplan.model.State;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class StateEncoderTest {
  @Test
  public void testRoundTrip() {
    BddManager manager = new BddManager();
    List<State> states = List.of(State.of(0), State.of(1, 2), State.of(3), State.of(0, 3), State.of());
    StateEncoder<State> encoder = StateEncoder.paired(manager, "x", states);
    assertThat(encoder.current().width(), is(3));
    for (State state : states) {
      int code = encoder.code(state);
      assertThat(encoder.decodeAll(encoder.cube(state)), is(Set.of(state)));
      assertThat(encoder.decode(code), is(state));
      int next = encoder.toNext(encoder.cube(state));
      assertThat(next, is(encoder.nextCube(state)));
      assertThat(encoder.toCurrent(next), is(encoder.cube(state)));
    }
    assertThat(encoder.decodeAll(encoder.domain()).size(), is(states.size()));
  }

  @Test
  public void testInterleavedPools() {
    BddManager manager = new BddManager();
    StateEncoder<Integer> encoder = StateEncoder.paired(manager, "q", 4);
    for (int j = 0; j < encoder.current().width(); j++) {
      assertThat(encoder.next().variable(j), is(encoder.current().variable(j) + 1));
    }
  }

  @Test
  public void testCodesInRegistrationOrder() {
    BddManager manager = new BddManager();
    StateEncoder<String> encoder = StateEncoder.single(manager, "l", 3);
    assertThat(encoder.encode("b"), is(0));
    assertThat(encoder.encode("a"), is(1));
    assertThat(encoder.encode("b"), is(0));
    assertThat(encoder.objects(), contains("b", "a"));
    assertThat(encoder.isEncoded("a"), is(true));
    assertThat(encoder.isEncoded("c"), is(false));
  }

  @Test
  public void testOverflow() {
    BddManager manager = new BddManager();
    StateEncoder<String> encoder = StateEncoder.single(manager, "l", 2);
    encoder.encode("a");
    encoder.encode("b");
    assertThrows(ConfigurationException.class, () -> encoder.encode("c"));
  }

  @Test
  public void testSingleObjectHasOneBit() {
    BddManager manager = new BddManager();
    StateEncoder<String> encoder = StateEncoder.single(manager, "l", List.of("only"));
    assertThat(encoder.current().width(), is(1));
    assertThat(encoder.hasNext(), is(false));
  }
}

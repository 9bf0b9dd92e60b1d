package com.ltlplan.model;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class GuardTest {
  @Test
  public void testDisjunctiveNormalForm() {
    Guard guard = new Guard(List.of(Guard.Clause.of(List.of("a", "!b")), Guard.Clause.of(List.of("c"))));
    assertThat(guard.test(Set.of("a")), is(true));
    assertThat(guard.test(Set.of("a", "b")), is(false));
    assertThat(guard.test(Set.of("a", "b", "c")), is(true));
    assertThat(guard.test(Set.of()), is(false));
    assertThat(guard.propositions(), is(Set.of("a", "b", "c")));
  }

  @Test
  public void testConstants() {
    assertThat(Guard.TRUE.test(Set.of()), is(true));
    assertThat(Guard.FALSE.test(Set.of("a")), is(false));
  }
}

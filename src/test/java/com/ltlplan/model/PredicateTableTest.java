package com.ltlplan.model;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

public class PredicateTableTest {
  @Test
  public void testRegistrationOrder() {
    PredicateTable table = PredicateTable.of(List.of("(on b0 l1)", "(on b1 l2)", "(on b0 l1)", "(gripper free)"));
    assertThat(table.size(), is(3));
    assertThat(table.id("(on b0 l1)"), is(0));
    assertThat(table.id("(gripper free)"), is(2));
    assertThat(table.predicate(1), is("(on b1 l2)"));
  }

  @Test
  public void testUnknownAndMalformed() {
    PredicateTable table = PredicateTable.of(List.of("(on b0 l1)"));
    assertThrows(InvariantViolationException.class, () -> table.id("(on b0 l2)"));
    assertThrows(InvariantViolationException.class, () -> PredicateTable.of(List.of("on b0 l1")));
  }
}

package com.ltlplan.symbolic;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.is;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Test;

public class BddManagerTest {
  private static BitSet support(int... variables) {
    BitSet support = new BitSet();
    for (int variable : variables) {
      support.set(variable);
    }
    return support;
  }

  @Test
  public void testCubeDecode() {
    BddManager manager = new BddManager();
    int[] variables = {manager.createVariable(), manager.createVariable(), manager.createVariable()};
    for (int code = 0; code < 8; code++) {
      int cube = manager.cube(variables, code);
      BitSet assignment = manager.anyAssignment(cube, support(variables));
      assertThat(BddManager.decode(assignment, variables), is(code));
      assertThat(manager.countAssignments(cube, support(variables)), is(BigInteger.ONE));
    }
  }

  @Test
  public void testEnumerationExpandsUnconstrainedVariables() {
    BddManager manager = new BddManager();
    int[] variables = {manager.createVariable(), manager.createVariable(), manager.createVariable()};
    int node = manager.variable(variables[0]);
    List<Integer> codes = new ArrayList<>();
    manager.forEachAssignment(node, support(variables),
        assignment -> codes.add(BddManager.decode(assignment, variables)));
    assertThat(codes, containsInAnyOrder(1, 3, 5, 7));
    assertThat(manager.countAssignments(node, support(variables)), is(BigInteger.valueOf(4)));
  }

  @Test
  public void testRenameSwapsPools() {
    BddManager manager = new BddManager();
    int[] current = {manager.createVariable(), manager.createVariable()};
    int[] next = {manager.createVariable(), manager.createVariable()};
    int pair = manager.and(manager.cube(current, 1), manager.cube(next, 2));
    int swapped = manager.rename(pair, concat(current, next), concat(next, current));
    int expected = manager.and(manager.cube(current, 2), manager.cube(next, 1));
    assertThat(swapped, is(expected));
  }

  @Test
  public void testQuantifiers() {
    BddManager manager = new BddManager();
    int x = manager.createVariable();
    int y = manager.createVariable();
    int conjunction = manager.and(manager.variable(x), manager.variable(y));
    assertThat(manager.exists(conjunction, support(y)), is(manager.variable(x)));
    int disjunction = manager.or(manager.variable(x), manager.variable(y));
    assertThat(manager.forall(disjunction, support(y)), is(manager.variable(x)));
    assertThat(manager.andNot(disjunction, manager.variable(y)), is(manager.and(manager.variable(x),
        manager.not(manager.variable(y)))));
    int excluded = manager.or(manager.variable(x), manager.not(manager.variable(x)));
    assertThat(manager.isTrue(excluded), is(true));
    assertThat(manager.isTrue(disjunction), is(false));
  }

  @Test
  public void testEquivalent() {
    BddManager manager = new BddManager();
    int x = manager.createVariable();
    int y = manager.createVariable();
    int same = manager.equivalent(x, y);
    assertThat(manager.countAssignments(same, support(x, y)), is(BigInteger.TWO));
    int both = manager.and(same, manager.variable(x));
    assertThat(both, is(manager.and(manager.variable(x), manager.variable(y))));
  }

  private static int[] concat(int[] first, int[] second) {
    int[] result = new int[first.length + second.length];
    System.arraycopy(first, 0, result, 0, first.length);
    System.arraycopy(second, 0, result, first.length, second.length);
    return result;
  }
}

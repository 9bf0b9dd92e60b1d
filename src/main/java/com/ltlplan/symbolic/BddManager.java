package com.ltlplan.symbolic;

import static com.google.common.base.Preconditions.checkArgument;

import de.tum.in.jbdd.Bdd;
import de.tum.in.jbdd.BddFactory;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import java.math.BigInteger;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Single owner of the decision-diagram engine for one planning problem. Every node returned by this class is
 * referenced; callers hand nodes they no longer need back through {@link #release(int)}. Nodes of different managers
 * must never be mixed.
 */
public final class BddManager {
  private static final int INITIAL_NODE_TABLE_SIZE = 10_000;

  private final Bdd bdd;
  private final IntList variableNodes = new IntArrayList();

  public BddManager() {
    this(BddFactory.buildBdd(INITIAL_NODE_TABLE_SIZE));
  }

  BddManager(Bdd bdd) {
    this.bdd = bdd;
  }

  public int createVariable() {
    int node = bdd.reference(bdd.createVariable());
    variableNodes.add(node);
    return variableNodes.size() - 1;
  }

  public int variableCount() {
    return variableNodes.size();
  }

  public int variable(int index) {
    return variableNodes.getInt(index);
  }

  public int trueNode() {
    return bdd.trueNode();
  }

  public int falseNode() {
    return bdd.falseNode();
  }

  public boolean isTrue(int node) {
    return node == bdd.trueNode();
  }

  public boolean isFalse(int node) {
    return node == bdd.falseNode();
  }

  public int and(int left, int right) {
    return bdd.reference(bdd.and(left, right));
  }

  public int or(int left, int right) {
    return bdd.reference(bdd.or(left, right));
  }

  public int not(int node) {
    return bdd.reference(bdd.not(node));
  }

  public int andNot(int left, int right) {
    int negated = bdd.reference(bdd.not(right));
    int result = bdd.reference(bdd.and(left, negated));
    bdd.dereference(negated);
    return result;
  }

  public int ifThenElse(int condition, int then, int otherwise) {
    return bdd.reference(bdd.ifThenElse(condition, then, otherwise));
  }

  /** Node which holds iff the two given variables agree. */
  public int equivalent(int leftVariable, int rightVariable) {
    int right = variable(rightVariable);
    int negatedRight = bdd.reference(bdd.not(right));
    int result = bdd.reference(bdd.ifThenElse(variable(leftVariable), right, negatedRight));
    bdd.dereference(negatedRight);
    return result;
  }

  public int exists(int node, BitSet variables) {
    if (variables.isEmpty()) {
      return bdd.reference(node);
    }
    return bdd.reference(bdd.exists(node, variables));
  }

  public int forall(int node, BitSet variables) {
    int negated = not(node);
    int witness = exists(negated, variables);
    int result = not(witness);
    release(negated);
    release(witness);
    return result;
  }

  /**
   * Renames variables: every variable {@code from[i]} is replaced by {@code to[i]}. Variables in neither array are left
   * untouched. Passing both directions of a pairing swaps the two groups.
   */
  public int rename(int node, int[] from, int[] to) {
    checkArgument(from.length == to.length, "Rename arity mismatch");
    if (from.length == 0) {
      return bdd.reference(node);
    }
    int[] mapping = variableNodes.toIntArray();
    for (int i = 0; i < from.length; i++) {
      mapping[from[i]] = variableNodes.getInt(to[i]);
    }
    return bdd.reference(bdd.compose(node, mapping));
  }

  /** Conjunction of literals fixing {@code variables[j]} to bit {@code j} of {@code code}. */
  public int cube(int[] variables, int code) {
    int cube = bdd.reference(bdd.trueNode());
    for (int j = variables.length - 1; j >= 0; j--) {
      int variable = variableNodes.getInt(variables[j]);
      boolean set = (code & (1 << j)) != 0;
      int literal = set ? variable : bdd.reference(bdd.not(variable));
      int next = bdd.reference(bdd.and(cube, literal));
      bdd.dereference(cube);
      if (!set) {
        bdd.dereference(literal);
      }
      cube = next;
    }
    return cube;
  }

  /** Reads the code stored in {@code variables} of a complete assignment. */
  public static int decode(BitSet assignment, int[] variables) {
    int code = 0;
    for (int j = 0; j < variables.length; j++) {
      if (assignment.get(variables[j])) {
        code |= 1 << j;
      }
    }
    return code;
  }

  /**
   * Enumerates all assignments to the {@code support} variables under which {@code node} holds. Variables outside of
   * the support are projected away; each projected assignment is reported once, in path order.
   */
  public void forEachAssignment(int node, BitSet support, Consumer<BitSet> action) {
    Set<BitSet> seen = new LinkedHashSet<>();
    int[] supportVariables = support.stream().toArray();
    bdd.forEachPath(node, (path, pathSupport) -> {
      BitSet projected = (BitSet) path.clone();
      projected.and(support);
      IntList free = new IntArrayList();
      for (int variable : supportVariables) {
        if (!pathSupport.get(variable)) {
          free.add(variable);
        }
      }
      checkArgument(free.size() < Integer.SIZE - 1, "Too many unconstrained variables to enumerate");
      for (int combination = 0; combination < (1 << free.size()); combination++) {
        BitSet assignment = (BitSet) projected.clone();
        for (int j = 0; j < free.size(); j++) {
          assignment.set(free.getInt(j), (combination & (1 << j)) != 0);
        }
        seen.add(assignment);
      }
    });
    seen.forEach(action);
  }

  /** Some assignment to {@code support} satisfying {@code node}, unconstrained variables set to false. */
  public BitSet anyAssignment(int node, BitSet support) {
    if (isFalse(node)) {
      throw new NoSuchElementException("Empty set has no assignment");
    }
    BitSet[] first = new BitSet[1];
    bdd.forEachPath(node, (path, pathSupport) -> {
      if (first[0] == null) {
        first[0] = (BitSet) path.clone();
      }
    });
    first[0].and(support);
    return first[0];
  }

  /** Number of assignments to the {@code support} variables satisfying {@code node}. */
  public BigInteger countAssignments(int node, BitSet support) {
    int projected = exists(node, complement(support));
    BigInteger[] count = {BigInteger.ZERO};
    int width = support.cardinality();
    bdd.forEachPath(projected, (path, pathSupport) ->
        count[0] = count[0].add(BigInteger.ONE.shiftLeft(width - pathSupport.cardinality())));
    release(projected);
    return count[0];
  }

  private BitSet complement(BitSet support) {
    BitSet complement = new BitSet(variableCount());
    complement.set(0, variableCount());
    complement.andNot(support);
    return complement;
  }

  public int retain(int node) {
    return bdd.reference(node);
  }

  public void release(int node) {
    bdd.dereference(node);
  }

  @Override
  public String toString() {
    return "BddManager[%d variables]".formatted(variableCount());
  }
}

package com.ltlplan.symbolic;

import java.util.Arrays;
import java.util.BitSet;

/** An ordered group of decision-diagram variables holding one binary code. */
public record VariablePool(String name, int[] variables) {
  public VariablePool {
    variables = variables.clone();
  }

  public int width() {
    return variables.length;
  }

  public int variable(int bit) {
    return variables[bit];
  }

  @Override
  public int[] variables() {
    return variables.clone();
  }

  public BitSet support() {
    BitSet support = new BitSet();
    for (int variable : variables) {
      support.set(variable);
    }
    return support;
  }

  static int width(int capacity) {
    int width = 1;
    while (width < Integer.SIZE - 1 && (1 << width) < capacity) {
      width++;
    }
    return width;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof VariablePool that && name.equals(that.name)
        && Arrays.equals(variables, that.variables));
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + Arrays.hashCode(variables);
  }

  @Override
  public String toString() {
    return name + Arrays.toString(variables);
  }
}

package com.ltlplan.symbolic;

import static com.google.common.base.Preconditions.checkState;

import com.ltlplan.model.ConfigurationException;
import com.ltlplan.model.InvariantViolationException;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Assigns binary codes to explicit objects and builds their cubes. The {@code i}-th registered object receives code
 * {@code i}. Encoders of transition-system and automaton states own a current and a next pool, allocated interleaved
 * so that {@code x_j} and {@code x'_j} are adjacent in the variable order.
 */
public final class StateEncoder<T> {
  private final BddManager manager;
  private final VariablePool current;
  @Nullable
  private final VariablePool next;
  private final int capacity;
  private final Object2IntMap<T> codes = new Object2IntOpenHashMap<>();
  private final List<T> objects = new ArrayList<>();
  private final IntList currentCubes = new IntArrayList();
  private final IntList nextCubes = new IntArrayList();
  private int domain;

  private StateEncoder(BddManager manager, String name, int capacity, boolean withNext) {
    this.manager = manager;
    this.capacity = capacity;
    int width = VariablePool.width(capacity);
    int[] currentVariables = new int[width];
    int[] nextVariables = new int[width];
    for (int j = 0; j < width; j++) {
      currentVariables[j] = manager.createVariable();
      if (withNext) {
        nextVariables[j] = manager.createVariable();
      }
    }
    this.current = new VariablePool(name, currentVariables);
    this.next = withNext ? new VariablePool(name + "'", nextVariables) : null;
    this.codes.defaultReturnValue(-1);
    this.domain = manager.falseNode();
  }

  /** Encoder with current and next pools, sized for at most {@code capacity} objects. */
  public static <T> StateEncoder<T> paired(BddManager manager, String name, int capacity) {
    return new StateEncoder<>(manager, name, capacity, true);
  }

  /** Encoder with a single pool, used for labels and action indices. */
  public static <T> StateEncoder<T> single(BddManager manager, String name, int capacity) {
    return new StateEncoder<>(manager, name, capacity, false);
  }

  public static <T> StateEncoder<T> paired(BddManager manager, String name, Collection<T> objects) {
    StateEncoder<T> encoder = paired(manager, name, new LinkedHashSet<>(objects).size());
    objects.forEach(encoder::encode);
    return encoder;
  }

  public static <T> StateEncoder<T> single(BddManager manager, String name, Collection<T> objects) {
    StateEncoder<T> encoder = single(manager, name, new LinkedHashSet<>(objects).size());
    objects.forEach(encoder::encode);
    return encoder;
  }

  /** Returns the code of the object, assigning the next free one on first sight. */
  public int encode(T object) {
    int code = codes.getInt(object);
    if (code >= 0) {
      return code;
    }
    code = objects.size();
    if (code >= capacity || code >= (1 << current.width())) {
      throw new ConfigurationException("Encoder %s overflows its capacity %d when adding %s"
          .formatted(current.name(), capacity, object));
    }
    codes.put(object, code);
    objects.add(object);
    int cube = manager.cube(current.variables(), code);
    currentCubes.add(cube);
    if (next != null) {
      nextCubes.add(manager.cube(next.variables(), code));
    }
    int newDomain = manager.or(domain, cube);
    manager.release(domain);
    domain = newDomain;
    return code;
  }

  public boolean isEncoded(T object) {
    return codes.containsKey(object);
  }

  public int code(T object) {
    int code = codes.getInt(object);
    if (code < 0) {
      throw new InvariantViolationException("%s has no code in %s".formatted(object, current.name()));
    }
    return code;
  }

  public int cube(T object) {
    return currentCubes.getInt(encode(object));
  }

  public int nextCube(T object) {
    checkState(next != null, "Encoder %s has no next pool", current.name());
    return nextCubes.getInt(encode(object));
  }

  public T decode(int code) {
    if (code < 0 || code >= objects.size()) {
      throw new InvariantViolationException("Code %d is unassigned in %s".formatted(code, current.name()));
    }
    return objects.get(code);
  }

  public T decode(BitSet assignment) {
    return decode(BddManager.decode(assignment, current.variables()));
  }

  /** All encoded objects contained in the given node, which may only depend on the current pool. */
  public Set<T> decodeAll(int node) {
    Set<T> result = new LinkedHashSet<>();
    manager.forEachAssignment(node, current.support(), assignment -> result.add(decode(assignment)));
    return result;
  }

  /** Disjunction of the cubes of all encoded objects. */
  public int domain() {
    return domain;
  }

  public List<T> objects() {
    return List.copyOf(objects);
  }

  public int size() {
    return objects.size();
  }

  public VariablePool current() {
    return current;
  }

  public VariablePool next() {
    checkState(next != null, "Encoder %s has no next pool", current.name());
    return next;
  }

  public boolean hasNext() {
    return next != null;
  }

  public int toNext(int node) {
    return manager.rename(node, current.variables(), next().variables());
  }

  public int toCurrent(int node) {
    return manager.rename(node, next().variables(), current.variables());
  }

  @Override
  public String toString() {
    return "%s[%d/%d]".formatted(current.name(), objects.size(), capacity);
  }
}

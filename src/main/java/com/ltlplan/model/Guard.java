package com.ltlplan.model;

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Edge guard in disjunctive normal form over atomic propositions. An empty disjunction never holds. */
public record Guard(List<Clause> clauses) {
  public static final Guard TRUE = new Guard(List.of(Clause.TRUE));
  public static final Guard FALSE = new Guard(List.of());

  public Guard {
    clauses = List.copyOf(clauses);
  }

  public static Guard of(Clause... clauses) {
    return new Guard(List.of(clauses));
  }

  public boolean test(Set<String> label) {
    return clauses.stream().anyMatch(clause -> clause.test(label));
  }

  public Set<String> propositions() {
    return clauses.stream().flatMap(clause -> clause.propositions().stream()).collect(Collectors.toSet());
  }

  @Override
  public String toString() {
    return clauses.isEmpty() ? "false" : clauses.stream().map(Clause::toString).collect(Collectors.joining(" | "));
  }

  public record Clause(ImmutableSet<String> positive, ImmutableSet<String> negative) {
    public static final Clause TRUE = new Clause(ImmutableSet.of(), ImmutableSet.of());

    /** Parses literals of the form {@code p} and {@code !p}. */
    public static Clause of(Iterable<String> literals) {
      ImmutableSet.Builder<String> positive = ImmutableSet.builder();
      ImmutableSet.Builder<String> negative = ImmutableSet.builder();
      for (String literal : literals) {
        String trimmed = literal.strip();
        if (trimmed.startsWith("!")) {
          negative.add(trimmed.substring(1).strip());
        } else {
          positive.add(trimmed);
        }
      }
      return new Clause(positive.build(), negative.build());
    }

    public boolean test(Set<String> label) {
      return label.containsAll(positive) && negative.stream().noneMatch(label::contains);
    }

    public Set<String> propositions() {
      return ImmutableSet.<String>builder().addAll(positive).addAll(negative).build();
    }

    @Override
    public String toString() {
      if (positive.isEmpty() && negative.isEmpty()) {
        return "true";
      }
      return ImmutableSet.<String>builder().addAll(positive)
          .addAll(negative.stream().map(p -> "!" + p).toList()).build()
          .stream().collect(Collectors.joining(" & "));
    }
  }
}

package ca.gc.cra.recon.domain.filter;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Predicate tree over record documents.
 * <p><strong>Why:</strong> Query builders compose filters as plain data so they can be logged, compared in tests,
 * and interpreted by any store adapter.</p>
 * <p><strong>Role:</strong> Domain value produced by the {@code search*} builders and {@link Filters}, consumed by
 * {@link FilterEvaluator} and by {@code DocumentStorePort} implementations.</p>
 * <p><strong>Semantics:</strong> {@link Leaf} paths are array-aware: a leaf holds when any value reached through
 * the collection's array registry satisfies it, and never holds when the path reaches nothing.
 * {@link Elements} quantifies explicitly over one array; paths inside its condition are relative to each
 * element.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface Filter permits Filter.Leaf, Filter.And, Filter.Or, Filter.Not, Filter.Constant,
    Filter.Elements {

  /** Matches every record. */
  Filter TRUE = new Constant(true);

  /** Matches no record. */
  Filter FALSE = new Constant(false);

  /** Comparison applied by a {@link Leaf}. */
  enum Kind {
    EQUALS,
    NOT_EQUALS,
    LESS,
    LESS_OR_EQUAL,
    GREATER,
    GREATER_OR_EQUAL,
    /** Operand is a collection of accepted values. */
    ONE_OF,
    /** Operand is a {@link java.util.regex.Pattern} searched in text values. */
    MATCHES,
    /** Operand is ignored; holds when the path is present, even with a {@code null} value. */
    EXISTS,
    /** Exact membership of the operand in an array value. */
    CONTAINS
  }

  /** Quantifier of an {@link Elements} node. */
  enum Quantifier {
    ANY,
    ALL
  }

  /**
   * Comparison of the values at {@code path} against {@code operand}.
   *
   * @param path dotted path, relative to the enclosing {@link Elements} element if any
   * @param kind comparison kind
   * @param operand comparison operand; ignored for {@link Kind#EXISTS}
   */
  record Leaf(String path, Kind kind, Object operand) implements Filter {
    public Leaf {
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(kind, "kind");
    }
  }

  /** Conjunction; an empty list is never built, {@link #TRUE} is used instead. */
  record And(List<Filter> operands) implements Filter {
    public And {
      operands = List.copyOf(operands);
    }
  }

  /** Disjunction; an empty list is never built, {@link #FALSE} is used instead. */
  record Or(List<Filter> operands) implements Filter {
    public Or {
      operands = List.copyOf(operands);
    }
  }

  record Not(Filter operand) implements Filter {
    public Not {
      Objects.requireNonNull(operand, "operand");
    }
  }

  record Constant(boolean value) implements Filter {}

  /**
   * Quantified condition over the elements of the array stored at {@code path}.
   *
   * <p>Holds only when {@code path} resolves to an array; {@link Quantifier#ALL} over an empty array holds.</p>
   *
   * @param path dotted path of the array, resolved without crossing other arrays
   * @param quantifier how many elements must satisfy {@code condition}
   * @param condition predicate evaluated against each element
   */
  record Elements(String path, Quantifier quantifier, Filter condition) implements Filter {
    public Elements {
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(quantifier, "quantifier");
      Objects.requireNonNull(condition, "condition");
    }
  }
}

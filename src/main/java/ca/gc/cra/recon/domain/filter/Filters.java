package ca.gc.cra.recon.domain.filter;

import ca.gc.cra.recon.domain.filter.Filter.Elements;
import ca.gc.cra.recon.domain.filter.Filter.Kind;
import ca.gc.cra.recon.domain.filter.Filter.Leaf;
import ca.gc.cra.recon.domain.filter.Filter.Quantifier;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Builders and combinators for {@link Filter} trees.
 * <p><strong>Why:</strong> Keeps the algebraic simplifications (flattening, constant folding, double negation) in
 * one place so every query builder produces canonical trees.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Filters {
  private Filters() {
    // Utility
  }

  public static Filter eq(String path, Object value) {
    return new Leaf(path, Kind.EQUALS, value);
  }

  public static Filter ne(String path, Object value) {
    return new Leaf(path, Kind.NOT_EQUALS, value);
  }

  public static Filter lt(String path, Object value) {
    return new Leaf(path, Kind.LESS, requireOperand(value));
  }

  public static Filter lte(String path, Object value) {
    return new Leaf(path, Kind.LESS_OR_EQUAL, requireOperand(value));
  }

  public static Filter gt(String path, Object value) {
    return new Leaf(path, Kind.GREATER, requireOperand(value));
  }

  public static Filter gte(String path, Object value) {
    return new Leaf(path, Kind.GREATER_OR_EQUAL, requireOperand(value));
  }

  public static Filter oneOf(String path, Collection<?> values) {
    return new Leaf(path, Kind.ONE_OF, List.copyOf(Objects.requireNonNull(values, "values")));
  }

  public static Filter matches(String path, Pattern pattern) {
    return new Leaf(path, Kind.MATCHES, Objects.requireNonNull(pattern, "pattern"));
  }

  public static Filter matches(String path, String regex) {
    return matches(path, Pattern.compile(regex));
  }

  public static Filter exists(String path) {
    return new Leaf(path, Kind.EXISTS, null);
  }

  public static Filter contains(String path, Object value) {
    return new Leaf(path, Kind.CONTAINS, value);
  }

  /**
   * Presence test that nests an {@link Quantifier#ANY} quantifier at every array level of {@code path}.
   *
   * @param schema array registry of the collection
   * @param path dotted path from the record root
   * @return filter holding when at least one value is reachable through {@code path}
   */
  public static Filter exists(FieldSchema schema, String path) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(path, "path");
    return existsFrom(schema, path.split("\\."), 0, "");
  }

  private static Filter existsFrom(FieldSchema schema, String[] segments, int from, String base) {
    String full = base;
    String relative = "";
    for (int i = from; i < segments.length - 1; i++) {
      full = FieldSchema.join(full, segments[i]);
      relative = FieldSchema.join(relative, segments[i]);
      if (schema.isList(full)) {
        return any(relative, existsFrom(schema, segments, i + 1, full));
      }
    }
    return exists(FieldSchema.join(relative, segments[segments.length - 1]));
  }

  /**
   * Builds an ordering comparison from its textual operator.
   *
   * @param path dotted path
   * @param operator one of {@code <}, {@code <=}, {@code >}, {@code >=}
   * @param value comparison operand
   * @return comparison leaf
   * @throws IllegalArgumentException for any other operator
   */
  public static Filter compare(String path, String operator, Object value) {
    if (operator == null) {
      throw new IllegalArgumentException("Unknown operator null (for key " + path + " and val " + value + ")");
    }
    return switch (operator) {
      case "<" -> lt(path, value);
      case "<=" -> lte(path, value);
      case ">" -> gt(path, value);
      case ">=" -> gte(path, value);
      default -> throw new IllegalArgumentException(
          "Unknown operator '" + operator + "' (for key " + path + " and val " + value + ")");
    };
  }

  /**
   * Text criterion on a scalar path: regular expressions search, literals compare for equality.
   *
   * @param path dotted path
   * @param match criterion
   * @param neg {@code true} to exclude matches instead
   * @return filter
   */
  public static Filter text(String path, StringMatch match, boolean neg) {
    Objects.requireNonNull(match, "match");
    if (match instanceof StringMatch.Regex regex) {
      Filter res = matches(path, regex.pattern());
      return neg ? not(res) : res;
    }
    String literal = ((StringMatch.Exact) match).value();
    return neg ? ne(path, literal) : eq(path, literal);
  }

  public static Filter text(String path, StringMatch match) {
    return text(path, match, false);
  }

  /**
   * Text criterion on an array of strings: a regular expression must match one element, a literal must
   * be a member.
   *
   * @param path dotted path of the array
   * @param match criterion
   * @param neg {@code true} to exclude matches instead
   * @return filter
   */
  public static Filter textInArray(String path, StringMatch match, boolean neg) {
    Objects.requireNonNull(match, "match");
    Filter res = match instanceof StringMatch.Regex regex
        ? matches(path, regex.pattern())
        : contains(path, ((StringMatch.Exact) match).value());
    return neg ? not(res) : res;
  }

  public static Filter any(String path, Filter condition) {
    return new Elements(path, Quantifier.ANY, condition);
  }

  public static Filter all(String path, Filter condition) {
    return new Elements(path, Quantifier.ALL, condition);
  }

  public static Filter and(Filter... operands) {
    return and(Arrays.asList(operands));
  }

  /**
   * Conjunction with nested conjunctions flattened and constants folded.
   *
   * @param operands filters to combine
   * @return {@link Filter#TRUE} for no operands, the operand itself for one, an {@link Filter.And} otherwise
   */
  public static Filter and(List<Filter> operands) {
    List<Filter> flat = new ArrayList<>();
    for (Filter operand : operands) {
      Objects.requireNonNull(operand, "operand");
      if (operand instanceof Filter.Constant constant) {
        if (!constant.value()) {
          return Filter.FALSE;
        }
        continue;
      }
      if (operand instanceof Filter.And and) {
        flat.addAll(and.operands());
      } else {
        flat.add(operand);
      }
    }
    if (flat.isEmpty()) {
      return Filter.TRUE;
    }
    return flat.size() == 1 ? flat.get(0) : new Filter.And(flat);
  }

  public static Filter or(Filter... operands) {
    return or(Arrays.asList(operands));
  }

  /**
   * Disjunction with nested disjunctions flattened and constants folded.
   *
   * @param operands filters to combine
   * @return {@link Filter#FALSE} for no operands, the operand itself for one, an {@link Filter.Or} otherwise
   */
  public static Filter or(List<Filter> operands) {
    List<Filter> flat = new ArrayList<>();
    for (Filter operand : operands) {
      Objects.requireNonNull(operand, "operand");
      if (operand instanceof Filter.Constant constant) {
        if (constant.value()) {
          return Filter.TRUE;
        }
        continue;
      }
      if (operand instanceof Filter.Or or) {
        flat.addAll(or.operands());
      } else {
        flat.add(operand);
      }
    }
    if (flat.isEmpty()) {
      return Filter.FALSE;
    }
    return flat.size() == 1 ? flat.get(0) : new Filter.Or(flat);
  }

  /**
   * Negation; {@code not(not(p))} returns {@code p} and constants flip.
   *
   * @param operand filter to negate
   * @return negated filter
   */
  public static Filter not(Filter operand) {
    Objects.requireNonNull(operand, "operand");
    if (operand instanceof Filter.Not not) {
      return not.operand();
    }
    if (operand instanceof Filter.Constant constant) {
      return constant.value() ? Filter.FALSE : Filter.TRUE;
    }
    return new Filter.Not(operand);
  }

  private static Object requireOperand(Object value) {
    if (value == null) {
      throw new IllegalArgumentException("ordering comparisons need a non-null operand");
    }
    return value;
  }
}

package ca.gc.cra.recon.domain.filter;

import ca.gc.cra.recon.domain.path.PathValueExtractor;
import ca.gc.cra.recon.domain.path.Values;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Interprets {@link Filter} trees against in-memory documents.
 * <p><strong>Role:</strong> Evaluator used by store adapters that keep documents as maps.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class FilterEvaluator {
  private final PathValueExtractor extractor;

  public FilterEvaluator(FieldSchema schema) {
    this.extractor = new PathValueExtractor(Objects.requireNonNull(schema, "schema"));
  }

  /**
   * Evaluates a filter against a record.
   *
   * @param filter filter tree
   * @param record document
   * @return {@code true} when the record satisfies the filter
   */
  public boolean test(Filter filter, Map<String, Object> record) {
    return evaluate(Objects.requireNonNull(filter, "filter"), record, "");
  }

  /**
   * Adapts a filter to a {@link Predicate} over records.
   *
   * @param filter filter tree
   * @return predicate delegating to {@link #test(Filter, Map)}
   */
  public Predicate<Map<String, Object>> predicate(Filter filter) {
    Objects.requireNonNull(filter, "filter");
    return record -> evaluate(filter, record, "");
  }

  private boolean evaluate(Filter filter, Object node, String base) {
    if (filter instanceof Filter.Constant constant) {
      return constant.value();
    }
    if (filter instanceof Filter.And and) {
      for (Filter operand : and.operands()) {
        if (!evaluate(operand, node, base)) {
          return false;
        }
      }
      return true;
    }
    if (filter instanceof Filter.Or or) {
      for (Filter operand : or.operands()) {
        if (evaluate(operand, node, base)) {
          return true;
        }
      }
      return false;
    }
    if (filter instanceof Filter.Not not) {
      return !evaluate(not.operand(), node, base);
    }
    if (filter instanceof Filter.Elements elements) {
      return evaluateElements(elements, node, base);
    }
    return evaluateLeaf((Filter.Leaf) filter, node, base);
  }

  private boolean evaluateElements(Filter.Elements elements, Object node, String base) {
    Object target = PathValueExtractor.lookup(node, elements.path());
    if (!(target instanceof List<?> list)) {
      return false;
    }
    String elementBase = FieldSchema.join(base, elements.path());
    if (elements.quantifier() == Filter.Quantifier.ALL) {
      for (Object element : list) {
        if (!evaluate(elements.condition(), element, elementBase)) {
          return false;
        }
      }
      return true;
    }
    for (Object element : list) {
      if (evaluate(elements.condition(), element, elementBase)) {
        return true;
      }
    }
    return false;
  }

  private boolean evaluateLeaf(Filter.Leaf leaf, Object node, String base) {
    String path = leaf.path();
    Object operand = leaf.operand();
    switch (leaf.kind()) {
      case EXISTS:
        return exists(node, base, path);
      case EQUALS:
        return extractor.values(node, base, path).anyMatch(value -> Values.equal(value, operand));
      case NOT_EQUALS:
        return extractor.values(node, base, path).anyMatch(value -> !Values.equal(value, operand));
      case LESS:
        return extractor.values(node, base, path)
            .anyMatch(value -> Values.comparable(value, operand) && Values.compare(value, operand) < 0);
      case LESS_OR_EQUAL:
        return extractor.values(node, base, path)
            .anyMatch(value -> Values.comparable(value, operand) && Values.compare(value, operand) <= 0);
      case GREATER:
        return extractor.values(node, base, path)
            .anyMatch(value -> Values.comparable(value, operand) && Values.compare(value, operand) > 0);
      case GREATER_OR_EQUAL:
        return extractor.values(node, base, path)
            .anyMatch(value -> Values.comparable(value, operand) && Values.compare(value, operand) >= 0);
      case ONE_OF: {
        Collection<?> accepted = (Collection<?>) operand;
        return extractor.values(node, base, path)
            .anyMatch(value -> accepted.stream().anyMatch(candidate -> Values.equal(value, candidate)));
      }
      case MATCHES: {
        Pattern pattern = (Pattern) operand;
        return extractor.values(node, base, path).anyMatch(value -> matches(pattern, value));
      }
      case CONTAINS:
        return extractor.values(node, base, path).anyMatch(value -> contains(value, operand));
      default:
        throw new IllegalStateException("Unhandled filter kind " + leaf.kind());
    }
  }

  private boolean exists(Object node, String base, String path) {
    int dot = path.lastIndexOf('.');
    if (dot < 0) {
      return node instanceof Map<?, ?> map && map.containsKey(path);
    }
    String key = path.substring(dot + 1);
    return extractor.values(node, base, path.substring(0, dot))
        .anyMatch(parent -> parent instanceof Map<?, ?> map && map.containsKey(key));
  }

  private static boolean matches(Pattern pattern, Object value) {
    if (value instanceof CharSequence text) {
      return pattern.matcher(text).find();
    }
    if (value instanceof List<?> list) {
      // Arrays the registry does not declare still match element-wise.
      for (Object element : list) {
        if (element instanceof CharSequence text && pattern.matcher(text).find()) {
          return true;
        }
      }
    }
    return false;
  }

  private static boolean contains(Object value, Object operand) {
    if (value instanceof List<?> list) {
      for (Object element : list) {
        if (Values.equal(element, operand)) {
          return true;
        }
      }
      return false;
    }
    return Values.equal(value, operand);
  }
}

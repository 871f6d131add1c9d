package ca.gc.cra.recon.application.topvalues;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Ordered table mapping pseudo-field names to {@link PseudoField} factories.
 * <p><strong>Why:</strong> Each aggregation dimension is one registration that can be tested on its own,
 * instead of a long chain of name comparisons.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Try registrations in order; the first pattern matching the whole name wins.</li>
 *   <li>Fall back to a direct path dimension for path-shaped names.</li>
 *   <li>Reject anything else with {@link IllegalArgumentException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once built.</p>
 *
 * @since 0.1.0
 */
public final class PseudoFieldRegistry {
  private static final Pattern PATH_SHAPED = Pattern.compile("\\A[A-Za-z_][\\w-]*(?:\\.[\\w-]+)*\\z");

  private final List<Registration> registrations;
  private final Function<String, PseudoField> fallback;

  private PseudoFieldRegistry(List<Registration> registrations, Function<String, PseudoField> fallback) {
    this.registrations = List.copyOf(registrations);
    this.fallback = fallback;
  }

  /**
   * Starts a registry whose unmatched path-shaped names resolve through {@code fallback}.
   *
   * @param fallback factory for direct stored paths
   * @return builder
   */
  public static Builder builder(Function<String, PseudoField> fallback) {
    return new Builder(Objects.requireNonNull(fallback, "fallback"));
  }

  /**
   * Resolves a pseudo-field name.
   *
   * @param name pseudo-field name, e.g. {@code port:open} or {@code infos.as_num}
   * @return resolved dimension
   * @throws IllegalArgumentException when the name is unknown or one of its arguments is malformed
   */
  public PseudoField resolve(String name) {
    Objects.requireNonNull(name, "name");
    for (Registration registration : registrations) {
      Matcher matcher = registration.pattern().matcher(name);
      if (matcher.matches()) {
        return registration.factory().create(matcher);
      }
    }
    if (PATH_SHAPED.matcher(name).matches()) {
      return fallback.apply(name);
    }
    throw new IllegalArgumentException("Unknown pseudo-field: " + name);
  }

  /**
   * Lists the registered name patterns in resolution order.
   *
   * @return regular expressions
   */
  public List<String> patterns() {
    List<String> patterns = new ArrayList<>(registrations.size());
    for (Registration registration : registrations) {
      patterns.add(registration.pattern().pattern());
    }
    return patterns;
  }

  /** Creates a {@link PseudoField} from a name that matched a registration. */
  @FunctionalInterface
  public interface Factory {
    /**
     * Builds the dimension.
     *
     * @param match matcher positioned on the full name; groups carry the embedded arguments
     * @return dimension
     * @throws IllegalArgumentException when an argument is malformed
     */
    PseudoField create(Matcher match);
  }

  private record Registration(Pattern pattern, Factory factory) {}

  /** Collects registrations in resolution order. */
  public static final class Builder {
    private final Function<String, PseudoField> fallback;
    private final List<Registration> registrations = new ArrayList<>();

    private Builder(Function<String, PseudoField> fallback) {
      this.fallback = fallback;
    }

    /**
     * Adds a registration.
     *
     * @param regex pattern that must match the whole name
     * @param factory dimension factory
     * @return this builder
     */
    public Builder register(String regex, Factory factory) {
      registrations.add(new Registration(Pattern.compile(regex), Objects.requireNonNull(factory, "factory")));
      return this;
    }

    public PseudoFieldRegistry build() {
      return new PseudoFieldRegistry(registrations, fallback);
    }
  }
}

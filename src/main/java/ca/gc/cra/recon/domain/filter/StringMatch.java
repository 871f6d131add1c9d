package ca.gc.cra.recon.domain.filter;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Text criterion accepted by the search builders: either an exact literal or a regular expression.
 *
 * <p>{@link #parse(String)} reads {@code /pattern/flags} as a regular expression (flags {@code i},
 * {@code m}, {@code s}, {@code x}) and anything else as a literal.</p>
 *
 * @since 0.1.0
 */
public sealed interface StringMatch permits StringMatch.Exact, StringMatch.Regex {

  /**
   * Tests a candidate value.
   *
   * @param candidate value to test, may be {@code null}
   * @return {@code true} when the candidate is text satisfying this criterion
   */
  boolean test(Object candidate);

  static StringMatch exact(String value) {
    return new Exact(value);
  }

  static StringMatch regex(String pattern) {
    return new Regex(Pattern.compile(pattern));
  }

  static StringMatch regex(Pattern pattern) {
    return new Regex(pattern);
  }

  /**
   * Parses a user-supplied criterion.
   *
   * @param text literal or {@code /pattern/flags}
   * @return parsed criterion
   * @throws IllegalArgumentException when the pattern or its flags are invalid
   */
  static StringMatch parse(String text) {
    Objects.requireNonNull(text, "text");
    int end = text.lastIndexOf('/');
    if (text.length() < 2 || text.charAt(0) != '/' || end <= 0) {
      return new Exact(text);
    }
    int flags = 0;
    for (char flag : text.substring(end + 1).toCharArray()) {
      switch (flag) {
        case 'i' -> flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        case 'm' -> flags |= Pattern.MULTILINE;
        case 's' -> flags |= Pattern.DOTALL;
        case 'x' -> flags |= Pattern.COMMENTS;
        default -> {
          return new Exact(text);
        }
      }
    }
    try {
      return new Regex(Pattern.compile(text.substring(1, end), flags));
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException("invalid regular expression: " + text, ex);
    }
  }

  /** Literal text equality. */
  record Exact(String value) implements StringMatch {
    public Exact {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean test(Object candidate) {
      return value.equals(candidate);
    }
  }

  /** Regular expression searched anywhere in the candidate. */
  record Regex(Pattern pattern) implements StringMatch {
    public Regex {
      Objects.requireNonNull(pattern, "pattern");
    }

    @Override
    public boolean test(Object candidate) {
      return candidate instanceof CharSequence text && pattern.matcher(text).find();
    }
  }
}

package ca.gc.cra.recon.domain.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Date;
import java.util.regex.Pattern;

/**
 * Normalizes timestamps to epoch seconds and back.
 *
 * <p>The stored form is a {@link Long} when the instant falls on a whole second and an exact
 * {@link BigDecimal} otherwise. Text without an offset is read as UTC.</p>
 *
 * @since 0.1.0
 */
public final class TimestampCodec {
  private static final Pattern NUMERIC = Pattern.compile("\\A-?\\d+(?:\\.\\d+)?\\z");
  private static final Pattern OFFSET_SUFFIX = Pattern.compile("(?:Z|[+-]\\d{2}:\\d{2})\\z");
  private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);
  private static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .optionalStart().appendLiteral('T').optionalEnd()
      .optionalStart().appendLiteral(' ').optionalEnd()
      .appendValue(ChronoField.HOUR_OF_DAY, 2)
      .appendLiteral(':')
      .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
      .optionalStart()
      .appendLiteral(':')
      .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
      .optionalEnd()
      .optionalEnd()
      .toFormatter();

  private TimestampCodec() {
    // Utility
  }

  /**
   * Converts an accepted timestamp form to epoch seconds.
   *
   * @param value epoch number, numeric or date/time text, or a {@code java.time}/{@link Date} value
   * @return epoch seconds as {@link Long} or {@link BigDecimal}
   * @throws DecodingException when the value cannot be interpreted
   */
  public static Number toEpoch(Object value) {
    if (value == null) {
      throw new DecodingException("timestamp must not be null");
    }
    if (value instanceof Long || value instanceof Integer || value instanceof Short) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger big) {
      return canonical(new BigDecimal(big));
    }
    if (value instanceof BigDecimal decimal) {
      return canonical(decimal);
    }
    if (value instanceof Double || value instanceof Float) {
      double raw = ((Number) value).doubleValue();
      if (Double.isNaN(raw) || Double.isInfinite(raw)) {
        throw new DecodingException("timestamp must be finite (was " + raw + ")");
      }
      return canonical(BigDecimal.valueOf(raw).setScale(9, RoundingMode.HALF_UP));
    }
    if (value instanceof Instant instant) {
      return fromInstant(instant);
    }
    if (value instanceof ZonedDateTime zoned) {
      return fromInstant(zoned.toInstant());
    }
    if (value instanceof OffsetDateTime offset) {
      return fromInstant(offset.toInstant());
    }
    if (value instanceof LocalDateTime local) {
      return fromInstant(local.toInstant(ZoneOffset.UTC));
    }
    if (value instanceof LocalDate date) {
      return fromInstant(date.atStartOfDay(ZoneOffset.UTC).toInstant());
    }
    if (value instanceof Date date) {
      return fromInstant(date.toInstant());
    }
    if (value instanceof String text) {
      return parseText(text);
    }
    throw new DecodingException("unsupported timestamp type: " + value.getClass().getName());
  }

  /**
   * Converts epoch seconds back to an {@link Instant}.
   *
   * @param epoch stored epoch seconds
   * @return instant with nanosecond precision
   */
  public static Instant toInstant(Object epoch) {
    if (!(epoch instanceof Number)) {
      throw new DecodingException("stored timestamp must be numeric (was " + epoch + ")");
    }
    BigDecimal seconds = toDecimal((Number) epoch);
    BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
    int nanos = seconds.subtract(whole).multiply(NANOS_PER_SECOND).intValue();
    try {
      return Instant.ofEpochSecond(whole.longValueExact(), nanos);
    } catch (ArithmeticException | DateTimeException ex) {
      throw new DecodingException("timestamp out of range: " + epoch, ex);
    }
  }

  private static Number parseText(String text) {
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      throw new DecodingException("timestamp text must not be blank");
    }
    if (NUMERIC.matcher(trimmed).matches()) {
      return canonical(new BigDecimal(trimmed));
    }
    try {
      if (OFFSET_SUFFIX.matcher(trimmed).find()) {
        return fromInstant(OffsetDateTime.parse(trimmed.replace(' ', 'T')).toInstant());
      }
      if (trimmed.length() == 10) {
        return fromInstant(LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant());
      }
      return fromInstant(LocalDateTime.parse(trimmed, LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException ex) {
      throw new DecodingException("unrecognized timestamp text: " + text, ex);
    }
  }

  private static Number fromInstant(Instant instant) {
    if (instant.getNano() == 0) {
      return instant.getEpochSecond();
    }
    BigDecimal fraction = BigDecimal.valueOf(instant.getNano()).divide(NANOS_PER_SECOND);
    return canonical(BigDecimal.valueOf(instant.getEpochSecond()).add(fraction));
  }

  private static Number canonical(BigDecimal value) {
    BigDecimal stripped = value.stripTrailingZeros();
    if (stripped.scale() <= 0) {
      try {
        return stripped.longValueExact();
      } catch (ArithmeticException ex) {
        throw new DecodingException("timestamp out of range: " + value, ex);
      }
    }
    if (stripped.scale() > 9) {
      throw new DecodingException("timestamp precision finer than nanoseconds: " + value);
    }
    return stripped;
  }

  private static BigDecimal toDecimal(Number number) {
    if (number instanceof BigDecimal decimal) {
      return decimal;
    }
    if (number instanceof BigInteger big) {
      return new BigDecimal(big);
    }
    if (number instanceof Double || number instanceof Float) {
      return BigDecimal.valueOf(number.doubleValue());
    }
    return BigDecimal.valueOf(number.longValue());
  }
}

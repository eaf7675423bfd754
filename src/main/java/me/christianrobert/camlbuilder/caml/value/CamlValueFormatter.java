package me.christianrobert.camlbuilder.caml.value;

import me.christianrobert.camlbuilder.caml.context.CamlBuildException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Formats payloads into the literal text the CAML dialect expects for each value type.
 *
 * <p>Rules:
 * <ul>
 *   <li>Integers and ids: canonical decimal text</li>
 *   <li>Numbers and currency: plain decimal notation, no exponent, no trailing zeros</li>
 *   <li>Booleans: {@code 1} / {@code 0}</li>
 *   <li>Date: {@code yyyy-MM-dd}, or the date-time form when the time is included</li>
 *   <li>Date-time: {@code yyyy-MM-dd'T'HH:mm:ss'Z'}, zoned payloads normalized to UTC</li>
 *   <li>Multi-choice: {@code ;#a;#b;#}</li>
 *   <li>Everything else: {@code String.valueOf}</li>
 * </ul>
 *
 * <p>No escaping happens here; see {@code CamlContext}.
 */
public final class CamlValueFormatter {

  static final String MULTI_CHOICE_DELIMITER = ";#";

  private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
  private static final DateTimeFormatter DATE_TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'", Locale.ROOT);

  private CamlValueFormatter() {
  }

  /**
   * Formats a payload for the given value type.
   *
   * @param valueType Literal value type (not a sentinel)
   * @param value Payload, never null
   * @param includeTimeValue Whether a DATE payload keeps its time of day
   * @return Literal text
   * @throws CamlBuildException if the payload cannot be represented as the given type
   */
  public static String format(CamlValueType valueType, Object value, boolean includeTimeValue) {
    if (value == null) {
      throw new CamlBuildException("A value of type " + valueType + " requires a payload");
    }

    switch (valueType) {
      case INTEGER:
      case COUNTER:
      case LOOKUP_ID:
      case USER_ID:
        return formatInteger(valueType, value);

      case NUMBER:
      case CURRENCY:
        return formatNumber(valueType, value);

      case BOOLEAN:
        return formatBoolean(value);

      case DATE:
        return includeTimeValue ? formatDateTime(valueType, value) : formatDate(value);

      case DATE_TIME:
        return formatDateTime(valueType, value);

      case MULTI_CHOICE:
        return formatMultiChoice(value);

      case GUID:
        return formatGuid(value);

      case TEXT:
      case NOTE:
      case LOOKUP_VALUE:
      case CHOICE:
      case URL:
      case COMPUTED:
        return String.valueOf(value);

      case CURRENT_USER:
      case TODAY:
      case NOW:
      default:
        throw new IllegalStateException("No literal format for value type " + valueType);
    }
  }

  private static String formatInteger(CamlValueType valueType, Object value) {
    if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte || value instanceof BigInteger) {
      return value.toString();
    }
    if (value instanceof CharSequence) {
      try {
        return new BigInteger(value.toString().trim()).toString();
      } catch (NumberFormatException e) {
        throw new CamlBuildException("Not an integer: '" + value + "'", valueType.name(), e);
      }
    }
    throw unsupported(valueType, value);
  }

  private static String formatNumber(CamlValueType valueType, Object value) {
    BigDecimal decimal;
    if (value instanceof BigDecimal) {
      decimal = (BigDecimal) value;
    } else if (value instanceof BigInteger) {
      decimal = new BigDecimal((BigInteger) value);
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new CamlBuildException("Not a finite number: " + value, valueType.name());
      }
      // Float.toString keeps the float's shortest representation
      decimal = value instanceof Float ? new BigDecimal(value.toString()) : BigDecimal.valueOf(d);
    } else if (value instanceof Number) {
      decimal = BigDecimal.valueOf(((Number) value).longValue());
    } else if (value instanceof CharSequence) {
      try {
        decimal = new BigDecimal(value.toString().trim());
      } catch (NumberFormatException e) {
        throw new CamlBuildException("Not a number: '" + value + "'", valueType.name(), e);
      }
    } else {
      throw unsupported(valueType, value);
    }
    return decimal.stripTrailingZeros().toPlainString();
  }

  private static String formatBoolean(Object value) {
    if (value instanceof Boolean) {
      return ((Boolean) value) ? "1" : "0";
    }
    if (value instanceof CharSequence) {
      String text = value.toString().trim();
      if ("true".equalsIgnoreCase(text) || "1".equals(text)) {
        return "1";
      }
      if ("false".equalsIgnoreCase(text) || "0".equals(text)) {
        return "0";
      }
      throw new CamlBuildException("Not a boolean: '" + value + "'", CamlValueType.BOOLEAN.name());
    }
    throw unsupported(CamlValueType.BOOLEAN, value);
  }

  /**
   * Date only. The payload's own calendar date is used, without shifting to UTC.
   */
  private static String formatDate(Object value) {
    if (value instanceof CharSequence) {
      return value.toString();
    }
    if (value instanceof LocalDate) {
      return DATE_FORMAT.format((LocalDate) value);
    }
    if (value instanceof LocalDateTime) {
      return DATE_FORMAT.format(((LocalDateTime) value).toLocalDate());
    }
    if (value instanceof OffsetDateTime) {
      return DATE_FORMAT.format(((OffsetDateTime) value).toLocalDate());
    }
    if (value instanceof ZonedDateTime) {
      return DATE_FORMAT.format(((ZonedDateTime) value).toLocalDate());
    }
    if (value instanceof Instant || value instanceof Date) {
      return DATE_FORMAT.format(toUtc(CamlValueType.DATE, value).toLocalDate());
    }
    throw unsupported(CamlValueType.DATE, value);
  }

  private static String formatDateTime(CamlValueType valueType, Object value) {
    if (value instanceof CharSequence) {
      return value.toString();
    }
    return DATE_TIME_FORMAT.format(toUtc(valueType, value));
  }

  private static LocalDateTime toUtc(CamlValueType valueType, Object value) {
    if (value instanceof LocalDateTime) {
      return (LocalDateTime) value;
    }
    if (value instanceof LocalDate) {
      return ((LocalDate) value).atStartOfDay();
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }
    if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }
    if (value instanceof Instant) {
      return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
    }
    if (value instanceof Date) {
      // java.sql.Date#toInstant throws, go through the epoch millis instead
      return LocalDateTime.ofInstant(Instant.ofEpochMilli(((Date) value).getTime()), ZoneOffset.UTC);
    }
    throw unsupported(valueType, value);
  }

  private static String formatMultiChoice(Object value) {
    List<Object> choices = new ArrayList<>();
    if (value instanceof Iterable) {
      for (Object choice : (Iterable<?>) value) {
        choices.add(choice);
      }
    } else if (value instanceof Object[]) {
      for (Object choice : (Object[]) value) {
        choices.add(choice);
      }
    } else {
      return String.valueOf(value);
    }

    if (choices.isEmpty()) {
      throw new CamlBuildException("A multi-choice value requires at least one choice",
          CamlValueType.MULTI_CHOICE.name());
    }

    StringBuilder sb = new StringBuilder(MULTI_CHOICE_DELIMITER);
    for (Object choice : choices) {
      if (choice == null) {
        throw new CamlBuildException("A multi-choice value cannot contain null",
            CamlValueType.MULTI_CHOICE.name());
      }
      sb.append(choice).append(MULTI_CHOICE_DELIMITER);
    }
    return sb.toString();
  }

  private static String formatGuid(Object value) {
    if (value instanceof UUID || value instanceof CharSequence) {
      return value.toString();
    }
    throw unsupported(CamlValueType.GUID, value);
  }

  private static CamlBuildException unsupported(CamlValueType valueType, Object value) {
    return new CamlBuildException(
        "Cannot format " + value.getClass().getName() + " as " + valueType, valueType.name());
  }
}

package io.github.pwf.schema;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// `format` keyword vocabulary asserted when `JsonSchemaOptions.assertFormats` is on.
/// Unknown format names are annotations only.
public enum Format {
  DATE("date", s -> parses(() -> LocalDate.parse(s))),
  /// RFC 3339 full-time: seconds and offset are mandatory
  TIME("time", s -> parses(() -> Patterns.FULL_TIME.parse(s))),
  /// RFC 3339 date-time: seconds and offset are mandatory
  DATE_TIME("date-time", s -> parses(() -> Patterns.DATE_TIME.parse(s))),
  EMAIL("email", s -> Patterns.EMAIL.matcher(s).matches() && !s.contains("..")),
  URI_FORMAT("uri", s -> {
    try {
      return new URI(s).isAbsolute();
    } catch (URISyntaxException e) {
      return false;
    }
  }),
  URI_REFERENCE("uri-reference", s -> {
    try {
      new URI(s);
      return true;
    } catch (URISyntaxException e) {
      return false;
    }
  }),
  UUID("uuid", s -> Patterns.UUID.matcher(s).matches()),
  IPV4("ipv4", Format::isIpv4),
  HOSTNAME("hostname", Format::isHostname),
  REGEX("regex", s -> {
    try {
      Pattern.compile(s);
      return true;
    } catch (PatternSyntaxException e) {
      return false;
    }
  });

  private final String wireName;
  private final Predicate<String> check;

  Format(String wireName, Predicate<String> check) {
    this.wireName = wireName;
    this.check = check;
  }

  /// Name as written in schemas, e.g. `date-time`
  public String wireName() {
    return wireName;
  }

  public boolean test(String value) {
    return check.test(value);
  }

  /// Format for a schema `format` value, or null when the name is not asserted
  static Format byName(String name) {
    for (Format format : values()) {
      if (format.wireName.equals(name)) {
        return format;
      }
    }
    return null;
  }

  private static boolean parses(Runnable parse) {
    try {
      parse.run();
      return true;
    } catch (DateTimeParseException e) {
      return false;
    }
  }

  private static boolean isIpv4(String s) {
    String[] octets = s.split("\\.", -1);
    if (octets.length != 4) return false;
    for (String octet : octets) {
      // digits only, no leading zeros
      if (octet.isEmpty() || octet.length() > 3 || !octet.chars().allMatch(Character::isDigit)) return false;
      if (octet.length() > 1 && octet.charAt(0) == '0') return false;
      if (Integer.parseInt(octet) > 255) return false;
    }
    return true;
  }

  private static boolean isHostname(String s) {
    if (s.isEmpty() || s.length() > 253) return false;
    for (String label : s.split("\\.", -1)) {
      if (!Patterns.HOST_LABEL.matcher(label).matches()) return false;
    }
    return true;
  }

  /// Enum constants cannot reference static fields of their own enum in initializers
  private static final class Patterns {
    static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    static final Pattern UUID = Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    static final Pattern HOST_LABEL = Pattern.compile("^[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?$");

    static final DateTimeFormatter FULL_TIME = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendValue(ChronoField.HOUR_OF_DAY, 2)
        .appendLiteral(':')
        .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
        .appendLiteral(':')
        .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
        .optionalEnd()
        .appendOffset("+HH:MM", "Z")
        .toFormatter(Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT);

    static final DateTimeFormatter DATE_TIME = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .appendLiteral('T')
        .append(FULL_TIME)
        .toFormatter(Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT);
  }
}

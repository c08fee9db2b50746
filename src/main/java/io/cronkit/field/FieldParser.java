package io.cronkit.field;

import io.cronkit.CronException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and validates the expression of a single field into its list items.
 *
 * <p>Accepted syntax, per comma separated item:
 *
 * <ul>
 *   <li>{@code *}, a value, a literal ({@code JAN}, {@code MON}), a range {@code a-b}
 *   <li>a step {@code *}{@code /n}, {@code a-b/n} or {@code a/n} (from {@code a} to the range end)
 *   <li>day of month: {@code ?}, {@code L}, {@code LW}, {@code NW}
 *   <li>day of week: {@code ?}, {@code NL}, {@code N#k}
 * </ul>
 */
public final class FieldParser {
  private static final Pattern DIGITS = Pattern.compile("\\d+");
  private static final Pattern NEAREST_WEEKDAY = Pattern.compile("(\\d+)W");

  private final FieldKind kind;
  private final String text;
  private String item;

  private FieldParser(FieldKind kind, String text) {
    this.kind = kind;
    this.text = text;
    this.item = text;
  }

  /**
   * Parses a field expression.
   *
   * @param kind the field the expression belongs to
   * @param text the field expression
   * @return the parsed list items, in input order
   * @throws CronException if the expression is invalid for the field
   */
  public static List<FieldItem> parse(FieldKind kind, String text) throws CronException {
    return new FieldParser(kind, text).doParse();
  }

  private List<FieldItem> doParse() throws CronException {
    if (text.equals("*")) {
      return List.of(FieldItem.any());
    }

    if (kind == FieldKind.DAY_OF_MONTH
        && text.contains(",")
        && (text.contains("W") || text.contains("L"))) {
      throw error();
    }

    List<FieldItem> items = new ArrayList<>();
    for (String part : text.split(",", -1)) {
      item = part;
      items.add(parseItem(part));
    }
    return items;
  }

  private FieldItem parseItem(String part) throws CronException {
    if (part.isEmpty()) {
      throw error();
    }
    if (part.equals("*")) {
      return FieldItem.any();
    }
    if (part.equals("?")) {
      if (!kind.allowsNoConstraint()) {
        throw error();
      }
      return FieldItem.noConstraint();
    }

    if (kind == FieldKind.DAY_OF_MONTH) {
      FieldItem special = parseDayOfMonthSpecial(part);
      if (special != null) {
        return special;
      }
    } else if (kind == FieldKind.DAY_OF_WEEK) {
      FieldItem special = parseDayOfWeekSpecial(part);
      if (special != null) {
        return special;
      }
    }

    if (part.contains("/")) {
      return parseStep(part);
    }

    if (part.contains("-")) {
      int[] range = parseRange(part);
      return values(expand(range[0], range[1], 1));
    }

    return values(List.of(parseValue(part)));
  }

  /** Parse L, LW and NW. */
  private FieldItem parseDayOfMonthSpecial(String part) throws CronException {
    if (part.equals("L")) {
      return FieldItem.lastDay();
    }
    if (part.equals("LW")) {
      return FieldItem.lastWeekday();
    }

    Matcher m = NEAREST_WEEKDAY.matcher(part);
    if (m.matches()) {
      return FieldItem.nearestWeekday(parseValue(m.group(1)));
    }
    if (part.contains("W") || part.contains("L")) {
      throw error();
    }

    return null;
  }

  /** Parse N#k and NL. */
  private FieldItem parseDayOfWeekSpecial(String part) throws CronException {
    if (part.contains("#")) {
      String[] pieces = part.split("#", -1);
      if (pieces.length != 2 || !DIGITS.matcher(pieces[1]).matches()) {
        throw error();
      }

      Weekday weekday = parseWeekday(pieces[0]);
      int nth = parseInt(pieces[1]);
      if (nth < 1 || nth > 5) {
        throw error();
      }
      return FieldItem.nth(weekday, nth);
    }

    if (part.length() > 1 && part.endsWith("L")) {
      return FieldItem.lastOf(parseWeekday(part.substring(0, part.length() - 1)));
    }

    return null;
  }

  /** Parse a/n, a-b/n and *&#47;n. */
  private FieldItem parseStep(String part) throws CronException {
    String[] pieces = part.split("/", -1);
    if (pieces.length != 2 || !DIGITS.matcher(pieces[1]).matches()) {
      throw error();
    }

    int step = parseInt(pieces[1]);
    if (step < 1) {
      throw error();
    }

    String rangePart = pieces[0];
    int start;
    int end;
    if (rangePart.equals("*")) {
      start = kind.rangeStart();
      end = kind.rangeEnd();
    } else if (rangePart.contains("-")) {
      int[] range = parseRange(rangePart);
      start = range[0];
      end = range[1];
    } else {
      start = parseValue(rangePart);
      end = kind.rangeEnd();
    }

    return values(expand(start, end, step));
  }

  private int[] parseRange(String part) throws CronException {
    String[] bounds = part.split("-", -1);
    if (bounds.length != 2 || bounds[0].equals("*") || bounds[1].equals("*")) {
      throw error();
    }

    int first = parseValue(bounds[0]);
    int last = parseValue(bounds[1]);

    // 0 and 7 are both Sunday: 7-3 starts the week, 6-0 ends it
    if (kind == FieldKind.DAY_OF_WEEK) {
      if (first == 7) {
        first = 0;
      }
      if (last == 0) {
        last = 7;
      }
    }

    if (first > last) {
      throw error();
    }
    return new int[] {first, last};
  }

  /**
   * Expands a stepped range. A step larger than the field range wraps around the full range and
   * selects a single value; a step larger than the given range selects its start only.
   */
  private List<Integer> expand(int start, int end, int step) {
    if (step > kind.rangeEnd()) {
      return List.of(kind.rangeStart() + step % kind.rangeLength());
    }
    if (step > end - start) {
      return List.of(start);
    }

    List<Integer> values = new ArrayList<>();
    for (int v = start; v <= end; v += step) {
      values.add(v);
    }
    return values;
  }

  private Weekday parseWeekday(String token) throws CronException {
    return Weekday.fromCron(parseValue(token)).orElseThrow(this::error);
  }

  private int parseValue(String token) throws CronException {
    OptionalInt literal = kind.literal(token);
    if (literal.isPresent()) {
      return literal.getAsInt();
    }

    if (!DIGITS.matcher(token).matches()) {
      throw error();
    }
    int value = parseInt(token);
    if (value < kind.rangeStart() || value > kind.rangeEnd()) {
      throw error();
    }
    return value;
  }

  private int parseInt(String digits) throws CronException {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      throw error();
    }
  }

  private FieldItem values(List<Integer> values) {
    if (kind != FieldKind.DAY_OF_WEEK) {
      return FieldItem.values(values);
    }

    Set<Integer> normalized = new LinkedHashSet<>();
    for (int v : values) {
      normalized.add(v == 7 ? 0 : v);
    }
    return FieldItem.values(new ArrayList<>(normalized));
  }

  private CronException error() {
    return CronException.invalidField(kind, text, item);
  }
}

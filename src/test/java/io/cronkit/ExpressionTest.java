package io.cronkit;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronkit.field.FieldKind;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Unit tests for Expression parsing and field substitution. */
public class ExpressionTest {

  @Test
  void testParseKeepsFieldText() throws CronException {
    Expression e = Expression.parse("3-59/15 6-12 */15 1 2-5");
    assertEquals("3-59/15", e.minute().toString());
    assertEquals("6-12", e.hour().toString());
    assertEquals("*/15", e.dayOfMonth().toString());
    assertEquals("1", e.month().toString());
    assertEquals("2-5", e.dayOfWeek().toString());
    assertEquals("3-59/15 6-12 */15 1 2-5", e.toString());
  }

  @Test
  void testParseCollapsesWhitespace() throws CronException {
    Expression e = Expression.parse("  0\t0  *\n* *  ");
    assertEquals("0 0 * * *", e.toString());
  }

  @Test
  void testParseAliasIsCaseInsensitive() throws CronException {
    assertEquals("0 0 * * *", Expression.parse("@MIDNIGHT").toString());
    assertEquals("0 0 1 * *", Expression.parse("@Monthly").toString());
  }

  @Test
  void testParseAggregatesFieldErrors() {
    CronException e =
        assertThrows(CronException.class, () -> Expression.parse("90 * 0 13 *"));
    assertEquals(ErrorKind.SYNTAX, e.kind());
    assertEquals(List.of("minute", "dayOfMonth", "month"), List.copyOf(e.fieldErrors().keySet()));
    assertEquals("90", e.fieldErrors().get("minute"));
    assertEquals("0", e.fieldErrors().get("dayOfMonth"));
    assertEquals("13", e.fieldErrors().get("month"));
    assertEquals(
        List.of(new Span(0, 2), new Span(5, 6), new Span(7, 9)), e.spans());
    assertEquals("90 * 0 13 *", e.input().orElseThrow());
  }

  @Test
  void testParseRejectsWrongFieldCount() {
    CronException e = assertThrows(CronException.class, () -> Expression.parse("* * * *"));
    assertTrue(e.getMessage().contains("is not a valid CRON expression"));
    assertTrue(e.fieldErrors().isEmpty());
  }

  @Test
  void testIsValid() {
    assertTrue(Expression.isValid("* * * * *"));
    assertTrue(Expression.isValid("@yearly"));
    assertFalse(Expression.isValid("* * * * 8-3"));
    assertFalse(Expression.isValid("not a cron"));
  }

  @Test
  void testWithSameFieldReturnsSameInstance() throws CronException {
    Expression e = Expression.parse("5 4 * * SUN");
    assertSame(e, e.withMinute("5"));
    assertSame(e, e.withHour(e.hour().toString()));
    assertSame(e, e.withDayOfWeek("SUN"));
  }

  @Test
  void testWithReplacesOneField() throws CronException {
    Expression e = Expression.parse("5 4 * * SUN");
    Expression changed = e.withDayOfMonth("L").withMonth("JAN-JUN");
    assertEquals("5 4 L JAN-JUN SUN", changed.toString());
    assertEquals("5 4 * * SUN", e.toString());
    assertNotEquals(e, changed);
  }

  @Test
  void testWithValidatesField() throws CronException {
    Expression e = Expression.parse("* * * * *");
    CronException ex = assertThrows(CronException.class, () -> e.withHour("24"));
    assertEquals(Map.of("hour", "24"), ex.fieldErrors());
    assertThrows(CronException.class, () -> e.with(FieldKind.MONTH, "FOO"));
  }

  @Test
  void testFromFieldsDefaultsToWildcard() throws CronException {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("dayOfWeek", "MON");
    fields.put("minute", "30");
    fields.put("hour", "9");
    assertEquals("30 9 * * MON", Expression.fromFields(fields).toString());
    assertEquals("* * * * *", Expression.fromFields(Map.of()).toString());
  }

  @Test
  void testFromFieldsRejectsUnknownField() {
    assertThrows(CronException.class, () -> Expression.fromFields(Map.of("second", "0")));
    assertThrows(CronException.class, () -> Expression.build(Map.of("weekday", "1")));
  }

  @Test
  void testBuildDoesNotValidateValues() throws CronException {
    assertEquals("99 * * * *", Expression.build(Map.of("minute", "99")));
  }

  @Test
  void testToMap() throws CronException {
    Map<String, String> m = Expression.parse("1 2 3 4 5").toMap();
    assertEquals(
        List.of("minute", "hour", "dayOfMonth", "month", "dayOfWeek"), List.copyOf(m.keySet()));
    assertEquals(List.of("1", "2", "3", "4", "5"), List.copyOf(m.values()));
  }

  @Test
  void testFieldsInPositionalOrder() throws CronException {
    Expression e = Expression.parse("1 2 3 4 5");
    assertEquals(List.of(FieldKind.values()), List.copyOf(e.fields().keySet()));
    assertEquals("3", e.field(FieldKind.DAY_OF_MONTH).toString());
  }

  @Test
  void testNamedFactories() {
    assertEquals("0 0 1 1 *", Expression.yearly().toString());
    assertEquals("0 0 1 * *", Expression.monthly().toString());
    assertEquals("0 0 * * 0", Expression.weekly().toString());
    assertEquals("0 0 * * *", Expression.daily().toString());
    assertEquals("0 * * * *", Expression.hourly().toString());
  }

  @Test
  void testEqualsAndHashCode() throws CronException {
    Expression a = Expression.parse("0 0 * * 1-5");
    Expression b = Expression.parse("0  0 * * 1-5");
    Expression c = Expression.parse("0 0 * * MON-FRI");
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    // same schedule, different text
    assertNotEquals(a, c);
  }

  @Test
  void testJsonRoundTrip() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    Expression e = Expression.parse("*/5 9-17 * * MON-FRI");
    String json = mapper.writeValueAsString(e);
    assertEquals("\"*/5 9-17 * * MON-FRI\"", json);
    assertEquals(e, mapper.readValue(json, Expression.class));
    assertEquals("\"9-17\"", mapper.writeValueAsString(e.hour()));
  }

  @Test
  void testJsonRejectsInvalidExpression() {
    ObjectMapper mapper = new ObjectMapper();
    assertThrows(Exception.class, () -> mapper.readValue("\"61 * * * *\"", Expression.class));
  }
}

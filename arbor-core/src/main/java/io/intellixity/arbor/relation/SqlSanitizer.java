package io.intellixity.arbor.relation;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes bind values into raw SQL condition strings.
 *
 * <p>Positional {@code ?} and named {@code :name} placeholders are replaced with quoted literals.
 * A double colon ({@code ::type}) is left alone.</p>
 */
public final class SqlSanitizer {
  private static final Pattern NAMED = Pattern.compile("(:?):([a-zA-Z]\\w*)");

  private SqlSanitizer() {}

  public static String sanitize(String sql, Object... binds) {
    Objects.requireNonNull(sql, "sql");
    Object[] values = binds == null ? new Object[0] : binds;
    int expected = countPlaceholders(sql);
    if (expected != values.length) {
      throw new IllegalArgumentException("wrong number of bind variables (" + values.length + " for " + expected +
          ") in: " + sql);
    }

    StringBuilder out = new StringBuilder(sql.length() + 16 * values.length);
    boolean quoted = false;
    int n = 0;
    for (int i = 0; i < sql.length(); i++) {
      char c = sql.charAt(i);
      if (c == '\'') quoted = !quoted;
      if (c == '?' && !quoted) {
        out.append(quote(values[n++]));
      } else {
        out.append(c);
      }
    }
    return out.toString();
  }

  public static String sanitize(String sql, Map<String, ?> named) {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(named, "named");
    Matcher m = NAMED.matcher(sql);
    StringBuilder out = new StringBuilder();
    while (m.find()) {
      String replacement;
      if (!m.group(1).isEmpty()) {
        replacement = m.group();
      } else {
        String name = m.group(2);
        if (!named.containsKey(name)) {
          throw new IllegalArgumentException("missing value for :" + name + " in: " + sql);
        }
        replacement = quote(named.get(name));
      }
      m.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(out);
    return out.toString();
  }

  /** SQL literal for {@code value}; collections become a comma separated list. */
  public static String quote(Object value) {
    if (value == null) return "NULL";
    if (value instanceof Boolean b) return b ? "TRUE" : "FALSE";
    if (value instanceof Number n) return n.toString();
    if (value instanceof Enum<?> e) return quoteString(e.name());
    if (value instanceof Object[] arr) return quote(Arrays.asList(arr));
    if (value instanceof Collection<?> c) {
      if (c.isEmpty()) return "NULL";
      List<String> parts = new ArrayList<>(c.size());
      for (Object o : c) parts.add(quote(o));
      return String.join(",", parts);
    }
    return quoteString(String.valueOf(value));
  }

  private static String quoteString(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  private static int countPlaceholders(String sql) {
    boolean quoted = false;
    int n = 0;
    for (int i = 0; i < sql.length(); i++) {
      char c = sql.charAt(i);
      if (c == '\'') quoted = !quoted;
      else if (c == '?' && !quoted) n++;
    }
    return n;
  }
}

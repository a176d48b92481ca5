package io.intellixity.arbor.join;

import io.intellixity.arbor.util.Inflector;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-build alias allocation.
 *
 * <p>A table joined for the first time keeps its own name. Later joins of an already used table get
 * {@code <pluralized association>_<parent table>}; repeats of that candidate get a {@code _n} suffix where
 * {@code n} counts how often the candidate has been handed out. Tables and aliases named in raw SQL joins
 * count as used.</p>
 */
final class TableAliases {
  private final Map<String, Integer> counts = new HashMap<>();
  private final List<String> rawJoins;
  private final int maxLength;

  TableAliases(String rootTable, List<String> rawJoins, int maxLength) {
    if (maxLength < 4) throw new IllegalArgumentException("tableAliasLength must be >= 4");
    this.rawJoins = List.copyOf(rawJoins);
    this.maxLength = maxLength;
    counts.put(rootTable, 1);
  }

  String aliasFor(String table, String associationName, String parentTable) {
    if (count(table) == 0) counts.put(table, countInRawJoins(table));
    if (count(table) == 0) {
      counts.put(table, 1);
      return table;
    }

    String candidate = truncate(Inflector.pluralize(associationName) + "_" + parentTable, maxLength);
    int n = counts.merge(candidate, 1, Integer::sum);
    if (n == 1) {
      n += countInRawJoins(candidate);
      counts.put(candidate, n);
    }
    if (n > 1) {
      return truncate(candidate, maxLength - 2) + "_" + n;
    }
    return candidate;
  }

  private int count(String name) {
    return counts.getOrDefault(name, 0);
  }

  private int countInRawJoins(String name) {
    if (rawJoins.isEmpty()) return 0;
    // JOIN <name> ON ... / JOIN <table> [AS] <name> ON ...
    Pattern p = Pattern.compile(
        "\\bjoin\\s+(?:\\S+\\s+(?:as\\s+)?)?[\"`\\[]?" + Pattern.quote(name.toLowerCase(Locale.ROOT)) + "[\"`\\]]?\\s+on\\b");
    int n = 0;
    for (String join : rawJoins) {
      Matcher m = p.matcher(join.toLowerCase(Locale.ROOT));
      while (m.find()) n++;
    }
    return n;
  }

  private static String truncate(String s, int max) {
    return s.length() <= max ? s : s.substring(0, max);
  }
}

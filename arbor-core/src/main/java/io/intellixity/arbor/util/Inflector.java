package io.intellixity.arbor.util;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * English naming helpers used for join aliases and default foreign keys.
 *
 * <p>Covers the regular pluralization rules plus a small irregular table. Words that are already plural
 * (ending in {@code s} or listed as an irregular plural) are returned unchanged.</p>
 */
public final class Inflector {
  private static final Map<String, String> IRREGULAR = new LinkedHashMap<>();
  private static final Set<String> UNCOUNTABLE = Set.of(
      "equipment", "information", "rice", "money", "species", "series", "fish", "sheep", "jeans", "police");

  static {
    IRREGULAR.put("person", "people");
    IRREGULAR.put("woman", "women");
    IRREGULAR.put("child", "children");
    IRREGULAR.put("mouse", "mice");
  }

  private Inflector() {}

  public static String pluralize(String word) {
    if (word == null || word.isEmpty()) return word;
    String lower = word.toLowerCase(Locale.ROOT);
    if (UNCOUNTABLE.contains(lower)) return word;

    for (var e : IRREGULAR.entrySet()) {
      if (lower.endsWith(e.getValue())) return word;
      if (lower.endsWith(e.getKey())) {
        return word.substring(0, word.length() - e.getKey().length()) + e.getValue();
      }
    }

    if (lower.endsWith("s")) return word;
    if (lower.endsWith("x") || lower.endsWith("z") || lower.endsWith("ch") || lower.endsWith("sh")) {
      return word + "es";
    }
    if (lower.endsWith("y") && word.length() > 1 && !isVowel(lower.charAt(lower.length() - 2))) {
      return word.substring(0, word.length() - 1) + "ies";
    }
    return word + "s";
  }

  /**
   * CamelCase to snake_case, per dot segment.
   * - customerName -> customer_name
   * - BlogPost -> blog_post
   */
  public static String underscore(String s) {
    if (s == null || s.isEmpty()) return s;
    StringBuilder out = new StringBuilder(s.length() + 8);
    char prev = 0;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (Character.isUpperCase(c)) {
        if (i > 0 && prev != '_' && prev != '.' && !Character.isUpperCase(prev)) out.append('_');
        out.append(Character.toLowerCase(c));
      } else {
        out.append(c);
      }
      prev = c;
    }
    return out.toString();
  }

  /** Default foreign key naming an entity type from the other side, e.g. {@code Person -> person_id}. */
  public static String foreignKey(String type) {
    return underscore(type) + "_id";
  }

  private static boolean isVowel(char c) {
    return c == 'a' || c == 'e' || c == 'i' || c == 'o' || c == 'u';
  }
}

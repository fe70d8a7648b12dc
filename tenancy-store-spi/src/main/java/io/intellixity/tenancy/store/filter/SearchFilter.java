package io.intellixity.tenancy.store.filter;

import io.intellixity.tenancy.store.MetadataStoreException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conjunctive filter-string language shared by the stores and the isolation layer.\n
 *
 * Grammar: {@code clause (AND clause)*}, where a clause is {@code property op 'value'}, {@code op} is one of
 * {@code = != LIKE ILIKE}, a property is a bare attribute name or {@code tags.key} / {@code tags.`key`}, and a
 * single quote inside a value is written as {@code ''}.
 */
public final class SearchFilter {
  private SearchFilter() {}

  private static final Pattern CLAUSE = Pattern.compile(
      "^\\s*(?<prop>tags?\\.(?:`[^`]+`|\"[^\"]+\"|[\\w.\\-]+)|[A-Za-z_][\\w.]*)"
          + "\\s*(?<op>!=|=|(?i:ILIKE)|(?i:LIKE))\\s*'(?<val>(?:[^']|'')*)'\\s*$");

  public static List<FilterClause> parse(String filter) {
    if (filter == null || filter.isBlank()) return List.of();
    List<FilterClause> out = new ArrayList<>();
    for (String part : splitConjunction(filter)) {
      Matcher m = CLAUSE.matcher(part);
      if (!m.matches()) {
        throw MetadataStoreException.invalidParameter("Invalid filter clause: '" + part.trim() + "'");
      }
      out.add(new FilterClause(normalizeProperty(m.group("prop")),
          FilterOperator.fromSymbol(m.group("op")),
          unquote(m.group("val"))));
    }
    return List.copyOf(out);
  }

  /** AND-compose two filters; either side may be null or blank. */
  public static String and(String left, String right) {
    boolean hasLeft = left != null && !left.isBlank();
    boolean hasRight = right != null && !right.isBlank();
    if (hasLeft && hasRight) return left.trim() + " AND " + right.trim();
    if (hasLeft) return left.trim();
    return hasRight ? right.trim() : null;
  }

  public static String tagEquals(String key, String value) {
    return new FilterClause(FilterClause.TAG_PREFIX + key, FilterOperator.EQ, value).render();
  }

  public static String nameStartsWith(String prefix) {
    return new FilterClause("name", FilterOperator.LIKE, escapeLike(prefix) + "%").render();
  }

  /**
   * Rewrite the value of every clause on the {@code name} attribute ({@code =}, {@code !=}, {@code LIKE},
   * {@code ILIKE}), leaving tag and other attribute clauses untouched.
   */
  public static String rewriteNameValues(String filter, UnaryOperator<String> rewrite) {
    if (filter == null || filter.isBlank()) return filter;
    List<String> out = new ArrayList<>();
    for (String part : splitConjunction(filter)) {
      Matcher m = CLAUSE.matcher(part);
      if (m.matches() && "name".equals(m.group("prop"))) {
        FilterOperator op = FilterOperator.fromSymbol(m.group("op"));
        out.add(new FilterClause("name", op, rewrite.apply(unquote(m.group("val")))).render());
      } else {
        out.add(part.trim());
      }
    }
    return String.join(" AND ", out);
  }

  public static String quote(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  static String unquote(String raw) {
    return raw.replace("''", "'");
  }

  static Pattern likeToRegex(String like, boolean caseInsensitive) {
    StringBuilder re = new StringBuilder();
    for (int i = 0; i < like.length(); i++) {
      char c = like.charAt(i);
      if (c == '\\' && i + 1 < like.length()) {
        re.append(Pattern.quote(String.valueOf(like.charAt(++i))));
      } else if (c == '%') {
        re.append(".*");
      } else if (c == '_') {
        re.append('.');
      } else {
        re.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return caseInsensitive
        ? Pattern.compile(re.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL)
        : Pattern.compile(re.toString(), Pattern.DOTALL);
  }

  private static String escapeLike(String s) {
    return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private static String normalizeProperty(String prop) {
    int dot = prop.indexOf('.');
    String head = dot < 0 ? prop : prop.substring(0, dot).toLowerCase(Locale.ROOT);
    if (dot < 0 || !(head.equals("tags") || head.equals("tag"))) return prop;
    String key = prop.substring(dot + 1);
    if (key.length() >= 2 && (key.startsWith("`") && key.endsWith("`") || key.startsWith("\"") && key.endsWith("\""))) {
      key = key.substring(1, key.length() - 1);
    }
    return FilterClause.TAG_PREFIX + key;
  }

  /** Split on AND keywords that are outside quoted values and backticked keys. */
  private static List<String> splitConjunction(String filter) {
    List<String> parts = new ArrayList<>();
    int start = 0;
    boolean inQuote = false;
    boolean inTick = false;
    int i = 0;
    while (i < filter.length()) {
      char c = filter.charAt(i);
      if (c == '\'' && !inTick) {
        if (inQuote && i + 1 < filter.length() && filter.charAt(i + 1) == '\'') {
          i += 2;
          continue;
        }
        inQuote = !inQuote;
      } else if (c == '`' && !inQuote) {
        inTick = !inTick;
      } else if (!inQuote && !inTick && isAndKeyword(filter, i)) {
        parts.add(filter.substring(start, i));
        i += 3;
        start = i;
        continue;
      }
      i++;
    }
    if (inQuote) throw MetadataStoreException.invalidParameter("Unterminated quoted value in filter: " + filter);
    parts.add(filter.substring(start));
    return parts;
  }

  private static boolean isAndKeyword(String s, int i) {
    if (i + 3 > s.length() || !s.regionMatches(true, i, "AND", 0, 3)) return false;
    boolean spaceBefore = i > 0 && Character.isWhitespace(s.charAt(i - 1));
    boolean spaceAfter = i + 3 < s.length() && Character.isWhitespace(s.charAt(i + 3));
    return spaceBefore && spaceAfter;
  }
}

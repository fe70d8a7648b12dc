package io.intellixity.tenancy.store.filter;

import java.util.Objects;

/**
 * One {@code <property> <operator> '<value>'} predicate of a filter string.
 * <p>
 * Tag properties are normalized to {@code tags.<key>} with quoting removed.
 */
public record FilterClause(String property, FilterOperator operator, String value) {
  public static final String TAG_PREFIX = "tags.";

  public FilterClause {
    Objects.requireNonNull(property, "property");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(value, "value");
  }

  public boolean isTag() {
    return property.startsWith(TAG_PREFIX);
  }

  public String tagKey() {
    return isTag() ? property.substring(TAG_PREFIX.length()) : null;
  }

  /** Evaluate against an attribute or tag value; {@code null} means the property is absent. */
  public boolean test(String actual) {
    switch (operator) {
      case EQ:
        return value.equals(actual);
      case NE:
        return actual != null && !value.equals(actual);
      case LIKE:
        return actual != null && SearchFilter.likeToRegex(value, false).matcher(actual).matches();
      case ILIKE:
        return actual != null && SearchFilter.likeToRegex(value, true).matcher(actual).matches();
      default:
        throw new IllegalStateException("Unhandled operator: " + operator);
    }
  }

  public String render() {
    String prop = isTag() ? TAG_PREFIX + "`" + tagKey() + "`" : property;
    return prop + " " + operator.symbol() + " " + SearchFilter.quote(value);
  }
}

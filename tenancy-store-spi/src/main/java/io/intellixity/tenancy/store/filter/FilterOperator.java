package io.intellixity.tenancy.store.filter;

public enum FilterOperator {
  EQ("="),
  NE("!="),
  LIKE("LIKE"),
  ILIKE("ILIKE");

  private final String symbol;

  FilterOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  static FilterOperator fromSymbol(String s) {
    for (FilterOperator op : values()) {
      if (op.symbol.equalsIgnoreCase(s)) return op;
    }
    throw new IllegalArgumentException("Unknown filter operator: " + s);
  }
}

package io.intellixity.arbor.query;

public enum Operator {
  EQ("=", true),
  NE("<>", true),
  LT("<", true),
  LE("<=", true),
  GT(">", true),
  GE(">=", true),

  MATCHES("LIKE", true),
  DOES_NOT_MATCH("NOT LIKE", true),

  IN("IN", true),
  NOT_IN("NOT IN", true),

  PLUS("+", false),
  MINUS("-", false),
  MULTIPLY("*", false),
  DIVIDE("/", false),

  // symbol supplied per node
  CUSTOM(null, false);

  private final String symbol;
  private final boolean predicate;

  Operator(String symbol, boolean predicate) {
    this.symbol = symbol;
    this.predicate = predicate;
  }

  public String symbol() { return symbol; }

  /** True when the operator yields a boolean (comparison, match, membership). */
  public boolean isPredicate() { return predicate; }
}

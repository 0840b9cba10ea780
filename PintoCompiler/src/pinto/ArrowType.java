package pinto;

public enum ArrowType {
  RIGHT("->"),
  LEFT("<-"),
  BOTH("<->"),
  DOTTED("-->"),
  THICK("==>"),
  LINE("--");

  private final String symbol;

  ArrowType(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public boolean hasStartArrow() {
    return this == LEFT || this == BOTH;
  }

  public boolean hasEndArrow() {
    return this != LEFT;
  }

  public static ArrowType fromToken(TokenType type) {
    switch (type) {
      case ARROW_BOTH:
        return BOTH;
      case ARROW_DOTTED:
        return DOTTED;
      case ARROW_THICK:
        return THICK;
      case ARROW_LEFT:
        return LEFT;
      case ARROW_RIGHT:
        return RIGHT;
      case ARROW_LINE:
        return LINE;
      default:
        throw new IllegalArgumentException("not an arrow: " + type);
    }
  }
}

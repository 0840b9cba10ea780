package pinto;

/** Logical node shapes, with the intrinsic size used when a node does not set its own. */
public enum ShapeType {
  RECT("rect", 120, 60),
  CIRCLE("circle", 80, 80),
  DIAMOND("diamond", 100, 100),
  CYLINDER("cylinder", 80, 100);

  public static final ShapeType DEFAULT = RECT;

  private final String keyword;
  private final int defaultWidth;
  private final int defaultHeight;

  ShapeType(String keyword, int defaultWidth, int defaultHeight) {
    this.keyword = keyword;
    this.defaultWidth = defaultWidth;
    this.defaultHeight = defaultHeight;
  }

  /** The canonical DSL keyword. */
  public String keyword() {
    return keyword;
  }

  public int defaultWidth() {
    return defaultWidth;
  }

  public int defaultHeight() {
    return defaultHeight;
  }

  public static ShapeType fromToken(TokenType type) {
    switch (type) {
      case SHAPE_RECT:
      case SHAPE_BOX:
      case SHAPE_RECTANGLE:
        return RECT;
      case SHAPE_CIRCLE:
      case SHAPE_OVAL:
      case SHAPE_ELLIPSE:
        return CIRCLE;
      case SHAPE_DIAMOND:
        return DIAMOND;
      case SHAPE_CYLINDER:
      case SHAPE_DATABASE:
      case SHAPE_DB:
        return CYLINDER;
      default:
        throw new IllegalArgumentException("not a shape keyword: " + type);
    }
  }
}

package pinto;

/** Raised when automatic layout cannot produce usable node positions. */
public class LayoutException extends CompilerException {
  private static final long serialVersionUID = 1L;

  public LayoutException(String errorMsg) {
    super(errorMsg);
  }

  public LayoutException(String errorMsg, Throwable cause) {
    super(errorMsg, cause);
  }
}

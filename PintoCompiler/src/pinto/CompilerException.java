package pinto;

import java.util.Optional;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Optional<Location> location;
  private final String errorMsg;

  public CompilerException(String errorMsg) {
    this(Optional.empty(), errorMsg, null);
  }

  public CompilerException(Location location, String errorMsg) {
    this(Optional.of(location), errorMsg, null);
  }

  public CompilerException(String errorMsg, Throwable cause) {
    this(Optional.empty(), errorMsg, cause);
  }

  private CompilerException(Optional<Location> location, String errorMsg, Throwable cause) {
    super(errorMsg, cause);
    this.location = location;
    this.errorMsg = errorMsg;
  }

  public Optional<Location> location() {
    return location;
  }

  public void print(String file) {
    if (location.isPresent()) {
      System.out.println(
          String.format(
              "ERROR: %s@%d:%d %s",
              file, location.get().startLine(), location.get().startColumn(), errorMsg));
    } else {
      System.out.println(String.format("ERROR: %s %s", file, errorMsg));
    }
  }
}

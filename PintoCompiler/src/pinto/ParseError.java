package pinto;

import java.util.Optional;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class ParseError {
  public abstract String message();

  public abstract Optional<Location> location();

  public static ParseError create(String message, Location location) {
    return new AutoValue_ParseError(message, Optional.of(location));
  }

  public static ParseError create(String message) {
    return new AutoValue_ParseError(message, Optional.empty());
  }

  public CompilerException toException() {
    return location().isPresent()
        ? new CompilerException(location().get(), message())
        : new CompilerException(message());
  }

  @Override
  public String toString() {
    return location().map(l -> l + " " + message()).orElse(message());
  }
}

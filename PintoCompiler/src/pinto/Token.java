package pinto;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class Token {
  public abstract TokenType type();

  public abstract String text();

  public abstract Location location();

  public static Token create(TokenType type, String text, Location location) {
    return new AutoValue_Token(type, text, location);
  }

  public boolean is(TokenType type) {
    return type() == type;
  }

  @Override
  public String toString() {
    return type() + "(" + text() + ")@" + location();
  }
}

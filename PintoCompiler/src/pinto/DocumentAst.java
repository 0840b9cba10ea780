package pinto;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A parsed document. Statements and errors are never both non-empty. */
@AutoValue
public abstract class DocumentAst {
  public abstract ImmutableList<Statement> statements();

  public abstract ImmutableList<ParseError> errors();

  public static DocumentAst of(List<? extends Statement> statements) {
    return new AutoValue_DocumentAst(ImmutableList.copyOf(statements), ImmutableList.of());
  }

  public static DocumentAst failed(List<ParseError> errors) {
    return new AutoValue_DocumentAst(ImmutableList.of(), ImmutableList.copyOf(errors));
  }

  public boolean hasErrors() {
    return !errors().isEmpty();
  }
}

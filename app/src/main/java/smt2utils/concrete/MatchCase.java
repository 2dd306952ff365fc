package smt2utils.concrete;

import java.util.List;
import java.util.Objects;
import smt2utils.model.Symbol;

/** One {@code (pattern term)} arm of a {@code match} term. */
public record MatchCase(Pattern pattern, Term term) {

  public MatchCase {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(term, "term");
  }

  /** Constructor pattern; a bare symbol has no variables. */
  public record Pattern(Symbol constructor, List<Symbol> variables) {
    public Pattern {
      Objects.requireNonNull(constructor, "constructor");
      variables = variables == null ? List.of() : List.copyOf(variables);
    }
  }
}

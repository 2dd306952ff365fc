package smt2utils.concrete;

import java.util.Objects;
import smt2utils.model.Keyword;
import smt2utils.sexpr.SExpr;

/** Keyword with an optional value ({@code :named a1}, {@code :pattern ((f x))}). */
public record Attribute(Keyword keyword, SExpr value) {

  public Attribute {
    Objects.requireNonNull(keyword, "keyword");
  }

  public boolean hasValue() {
    return value != null;
  }
}

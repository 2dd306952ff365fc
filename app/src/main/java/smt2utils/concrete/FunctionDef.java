package smt2utils.concrete;

import java.util.Objects;

/** Function signature plus body. */
public record FunctionDef(FunctionDec signature, Term body) {

  public FunctionDef {
    Objects.requireNonNull(signature, "signature");
    Objects.requireNonNull(body, "body");
  }
}

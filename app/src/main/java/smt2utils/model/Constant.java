package smt2utils.model;

/** Literal constant of SMT-LIB-2: a numeric literal or a string literal. */
public interface Constant {

  /** Text to emit when printing; reproduces the original lexeme. */
  String lexeme();
}

package smt2utils.graph;

/** Kind of a term node, one per term-creating trace event. */
public enum TermKind {
  APP,
  VAR,
  QUANT,
  LAMBDA,
  PROOF
}

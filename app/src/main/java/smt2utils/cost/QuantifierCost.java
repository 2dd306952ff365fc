package smt2utils.cost;

/** Report row: instantiation count and accumulated cost of one quantifier. */
public record QuantifierCost(int quantifierId, long count, long cost) {}

package smt2utils.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-session intern table for symbols, keyed by lexeme. Sessions own their table; there is no
 * process-wide instance, so independent parsers never contend or leak symbols into each other.
 */
public final class SymbolTable {
  private final Map<String, Symbol> interned;
  private final boolean enabled;
  private long requests;

  public SymbolTable() {
    this(true);
  }

  public SymbolTable(boolean enabled) {
    this.enabled = enabled;
    this.interned = enabled ? new HashMap<>() : Map.of();
  }

  /**
   * Returns the symbol for {@code lexeme}. With interning enabled, equal lexemes always yield the
   * identical instance; otherwise a fresh, equal symbol is allocated on each call.
   */
  public Symbol intern(String lexeme) {
    Objects.requireNonNull(lexeme, "lexeme");
    requests++;
    if (!enabled) {
      return Symbol.fromLexeme(lexeme);
    }
    return interned.computeIfAbsent(lexeme, Symbol::fromLexeme);
  }

  public boolean enabled() {
    return enabled;
  }

  /** Number of distinct lexemes held by the table. */
  public int size() {
    return interned.size();
  }

  public long requests() {
    return requests;
  }
}

package smt2utils.parser;

/**
 * Configuration for an SMT-LIB-2 parsing session.
 *
 * @param internSymbols share one {@code Symbol} instance per distinct lexeme
 * @param maxTermDepth nesting limit for terms and sorts; deeper input is a syntax error
 */
public record ParserOptions(boolean internSymbols, int maxTermDepth) {

  private static final int DEFAULT_MAX_TERM_DEPTH = 2_000;

  public static ParserOptions defaults() {
    return new ParserOptions(true, DEFAULT_MAX_TERM_DEPTH);
  }

  public static ParserOptions normalize(ParserOptions options) {
    if (options == null) {
      return defaults();
    }
    int maxTermDepth =
        options.maxTermDepth() > 0 ? options.maxTermDepth() : DEFAULT_MAX_TERM_DEPTH;
    return new ParserOptions(options.internSymbols(), maxTermDepth);
  }
}

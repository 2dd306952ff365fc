package smt2utils.lexer;

/** Location in a source text: 1-based line and column, 0-based character offset. */
public record Position(int line, int column, int offset) {

  public static final Position START = new Position(1, 1, 0);

  public Position {
    if (line < 1 || column < 1 || offset < 0) {
      throw new IllegalArgumentException(
          "Invalid position " + line + ":" + column + " (offset " + offset + ")");
    }
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}

package smt2utils.sexpr;

import java.util.List;
import java.util.Objects;
import smt2utils.lexer.Position;
import smt2utils.model.Constant;
import smt2utils.model.Keyword;
import smt2utils.model.Symbol;

/**
 * Concrete S-expression: a symbol, keyword or constant atom, or a list of S-expressions. Every
 * node remembers where its first token started. Trees are immutable and never share a child
 * between two parents.
 */
public interface SExpr {

  Position position();

  default boolean isList() {
    return false;
  }

  /** Symbol atom, e.g. {@code f}, {@code |a b|} or the reserved word {@code let}. */
  record SymbolAtom(Symbol symbol, Position position) implements SExpr {
    public SymbolAtom {
      Objects.requireNonNull(symbol, "symbol");
      Objects.requireNonNull(position, "position");
    }

    @Override
    public String toString() {
      return symbol.lexeme();
    }
  }

  /** Keyword atom, e.g. {@code :named}. */
  record KeywordAtom(Keyword keyword, Position position) implements SExpr {
    public KeywordAtom {
      Objects.requireNonNull(keyword, "keyword");
      Objects.requireNonNull(position, "position");
    }

    @Override
    public String toString() {
      return keyword.lexeme();
    }
  }

  /** Numeric or string constant atom. */
  record ConstantAtom(Constant constant, Position position) implements SExpr {
    public ConstantAtom {
      Objects.requireNonNull(constant, "constant");
      Objects.requireNonNull(position, "position");
    }

    @Override
    public String toString() {
      return constant.lexeme();
    }
  }

  /** Parenthesized sequence; {@code position} is that of the opening parenthesis. */
  record ListExpr(List<SExpr> elements, Position position) implements SExpr {
    public ListExpr {
      elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
      Objects.requireNonNull(position, "position");
    }

    @Override
    public boolean isList() {
      return true;
    }

    public int size() {
      return elements.size();
    }

    public SExpr get(int index) {
      return elements.get(index);
    }

    public boolean isEmpty() {
      return elements.isEmpty();
    }

    @Override
    public String toString() {
      return SExprPrinter.render(this);
    }
  }
}

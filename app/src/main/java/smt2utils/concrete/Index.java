package smt2utils.concrete;

import java.util.Objects;
import smt2utils.model.NumeralLiteral;
import smt2utils.model.Symbol;

/** Index of an indexed identifier such as the {@code 32} in {@code (_ BitVec 32)}. */
public interface Index {

  String lexeme();

  record NumeralIndex(NumeralLiteral numeral) implements Index {
    public NumeralIndex {
      Objects.requireNonNull(numeral, "numeral");
    }

    @Override
    public String lexeme() {
      return numeral.lexeme();
    }
  }

  record SymbolIndex(Symbol symbol) implements Index {
    public SymbolIndex {
      Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public String lexeme() {
      return symbol.lexeme();
    }
  }
}

package smt2utils.concrete;

import java.util.List;
import java.util.Objects;
import smt2utils.model.Symbol;

/** Simple identifier ({@code f}) or indexed identifier ({@code (_ extract 7 0)}). */
public record Identifier(Symbol symbol, List<Index> indices) {

  public Identifier {
    Objects.requireNonNull(symbol, "symbol");
    indices = indices == null ? List.of() : List.copyOf(indices);
  }

  public static Identifier simple(Symbol symbol) {
    return new Identifier(symbol, List.of());
  }

  public boolean isIndexed() {
    return !indices.isEmpty();
  }
}

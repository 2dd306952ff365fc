package smt2utils.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

final class SymbolTest {

  @Test
  void addsBarsOnlyWhenTheNameNeedsThem() {
    assertEquals("x", Symbol.of("x").lexeme(), "Simple names stay bare");
    assertEquals("|x y|", Symbol.of("x y").lexeme(), "Spaces need bars");
    assertEquals("|x|", Symbol.fromLexeme("|x|").lexeme(), "Written bars are kept");
    assertEquals(Symbol.of("x"), Symbol.fromLexeme("|x|"), "Quoting is not part of identity");
  }

  @Test
  void rejectsNamesThatCannotBeQuoted() {
    assertThrows(IllegalArgumentException.class, () -> Symbol.of("a|b"), "Inner bar");
    assertThrows(IllegalArgumentException.class, () -> Symbol.of("a\\b"), "Backslash");
    assertThrows(
        IllegalArgumentException.class,
        () -> Symbol.of("x").withName("x|0"),
        "Renaming is checked too");
  }
}

package smt2utils.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class SymbolTableTest {

  @Test
  void internsEqualLexemesToOneInstance() {
    SymbolTable table = new SymbolTable();
    Symbol first = table.intern("x");
    Symbol second = table.intern("x");
    assertSame(first, second, "Interned symbols should be shared");
    table.intern("y");
    assertEquals(2, table.size(), "Two distinct lexemes");
    assertEquals(3, table.requests(), "Every request is counted");
  }

  @Test
  void disabledTableAllocatesEqualSymbols() {
    SymbolTable table = new SymbolTable(false);
    Symbol first = table.intern("x");
    Symbol second = table.intern("x");
    assertNotSame(first, second, "No sharing without interning");
    assertEquals(first, second, "Symbols are still equal");
    assertEquals(0, table.size(), "Nothing is retained");
  }

  @Test
  void quotingIsLexicalOnly() {
    Symbol quoted = Symbol.fromLexeme("|x|");
    Symbol plain = Symbol.fromLexeme("x");
    assertEquals(plain, quoted, "Bars do not change the symbol");
    assertEquals("|x|", quoted.lexeme(), "Original bars are reproduced");
    assertEquals("|a b|", Symbol.of("a b").lexeme(), "Bars are added when needed");
    assertEquals("|0x|", Symbol.of("0x").lexeme(), "Leading digits need bars");
    assertEquals("|x@1|", quoted.withName("x@1").lexeme(), "Renaming keeps the quoting");
  }

  @Test
  void onlyBareReservedWordsAreReserved() {
    assertTrue(Symbol.fromLexeme("let").isReserved(), "Bare let is reserved");
    assertFalse(Symbol.fromLexeme("|let|").isReserved(), "Quoted let is not");
    assertFalse(Symbol.fromLexeme("lets").isReserved(), "Other names are not");
  }
}

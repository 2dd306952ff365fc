package smt2utils.printer;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import smt2utils.concrete.Command;
import smt2utils.concrete.Sort;
import smt2utils.parser.CommandParser;

final class TermRewriterTest {
  private static final TermRewriter RENAME_X =
      TermRewriter.renaming(
          symbol -> symbol.name().equals("x") ? symbol.withName("x_1") : symbol);

  @Test
  void renamesBoundAndFreeOccurrences() {
    assertEquals(
        "(assert (forall ((x_1 Int)) (> x_1 y)))",
        rewrite("(assert (forall ((x Int)) (> x y)))"),
        "Binder and body are renamed together");
    assertEquals(
        "(declare-fun x_1 (Int) Bool)", rewrite("(declare-fun x (Int) Bool)"), "Declared name");
    assertEquals(
        "(define-fun g ((x_1 Int)) Int (let ((z x_1)) z))",
        rewrite("(define-fun g ((x Int)) Int (let ((z x)) z))"),
        "Parameters and let bodies");
  }

  @Test
  void renamesSymbolAttributeValuesOnly() {
    assertEquals(
        "(assert (! (p x_1) :named x_1 :pattern ((p x))))",
        rewrite("(assert (! (p x) :named x :pattern ((p x))))"),
        "Symbol values are renamed, list values are kept");
  }

  @Test
  void identityRewriterRebuildsEqualCommands() {
    Command command =
        CommandParser.parse("(define-fun-rec h ((n Int)) Int (ite (= n 0) 0 (h (- n 1))))").get(0);
    assertEquals(command, new TermRewriter().rewrite(command), "Nothing changes by default");
  }

  @Test
  void rewritesSorts() {
    Command.DeclareConst constant =
        (Command.DeclareConst) CommandParser.parse("(declare-const a (Array x Int))").get(0);
    Sort rewritten = RENAME_X.rewrite(constant.sort());
    assertEquals("(Array x_1 Int)", SyntaxPrinter.render(rewritten), "Sort names are renamed");
  }

  private static String rewrite(String input) {
    return SyntaxPrinter.render(RENAME_X.rewrite(CommandParser.parse(input).get(0)));
  }
}

package smt2utils.printer;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import smt2utils.concrete.Command;
import smt2utils.concrete.Sort;
import smt2utils.parser.CommandParser;
import smt2utils.testing.Fixtures;

final class SyntaxPrinterTest {

  @Test
  void reproducesCanonicalInputLineByLine() {
    for (String line : Splitter.on('\n').omitEmptyStrings().split(Fixtures.read("sample.smt2"))) {
      if (line.startsWith(";")) {
        continue;
      }
      List<Command> commands = CommandParser.parse(line);
      assertEquals(1, commands.size(), "One command on " + line);
      assertEquals(line, SyntaxPrinter.render(commands.get(0)), "Round trip of " + line);
    }
  }

  @Test
  void normalizesLayoutButKeepsLexemes() {
    String messy =
        "( assert\n  ; comment\n  (=   bv   #x00FF) )\n(declare-const |x| (_   BitVec 16))";
    List<String> rendered = new ArrayList<>();
    CommandParser.of(messy).parseAll(new SyntaxPrinter(rendered::add));
    assertEquals(
        List.of("(assert (= bv #x00FF))", "(declare-const |x| (_ BitVec 16))"),
        rendered,
        "Whitespace is canonical while radix and quoting survive");
  }

  @Test
  void printingIsIdempotent() {
    StringBuilder once = new StringBuilder();
    CommandParser.of(Fixtures.read("sample.smt2")).parseAll(SyntaxPrinter.appendingTo(once));
    StringBuilder twice = new StringBuilder();
    CommandParser.of(once).parseAll(SyntaxPrinter.appendingTo(twice));
    assertEquals(once.toString(), twice.toString(), "Printing printed output changes nothing");
  }

  @Test
  void rendersTermsAndSortsOnTheirOwn() {
    String input = "(declare-fun a () (Array Int (List Int)))";
    Command.DeclareFun declaration = (Command.DeclareFun) CommandParser.parse(input).get(0);
    Sort sort = declaration.sort();
    assertEquals("(Array Int (List Int))", SyntaxPrinter.render(sort), "Parameterized sort");
    Command.Assert assertion =
        (Command.Assert) CommandParser.parse("(assert (let ((y 1)) (+ y 2)))").get(0);
    assertEquals("(let ((y 1)) (+ y 2))", SyntaxPrinter.render(assertion.term()), "Let term");
  }
}

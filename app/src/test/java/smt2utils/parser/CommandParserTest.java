package smt2utils.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import smt2utils.SyntaxException;
import smt2utils.concrete.Command;
import smt2utils.concrete.CommandVisitor;
import smt2utils.concrete.QualIdentifier;
import smt2utils.concrete.Sort;
import smt2utils.concrete.Term;
import smt2utils.lexer.LexException;
import smt2utils.lexer.Lexer;
import smt2utils.model.NumeralLiteral;
import smt2utils.model.Symbol;
import smt2utils.testing.Fixtures;

final class CommandParserTest {

  @Test
  void parsesDeclarationAndAssertion() {
    List<Command> commands =
        CommandParser.parse("(declare-fun f (Int) Int)\n(assert (= (f 0) 1))");
    Sort integer = Sort.simple(Symbol.of("Int"));
    assertEquals(
        new Command.DeclareFun(Symbol.of("f"), List.of(integer), integer),
        commands.get(0),
        "Declaration of a unary function");
    Term application =
        new Term.Application(
            QualIdentifier.simple(Symbol.of("f")),
            List.of(new Term.ConstantTerm(NumeralLiteral.of(0))));
    Term equality =
        new Term.Application(
            QualIdentifier.simple(Symbol.of("=")),
            List.of(application, new Term.ConstantTerm(NumeralLiteral.of(1))));
    assertEquals(new Command.Assert(equality), commands.get(1), "Assertion of an equality");
    assertEquals(2, commands.size(), "Exactly two commands");
  }

  @Test
  void parsesEveryCommandOfTheSample() {
    String sample = Fixtures.read("sample.smt2");
    List<Command> commands = CommandParser.parse(sample);
    assertEquals(37, commands.size(), "One command per non-comment line");
    assertEquals("set-info", commands.get(0).name(), "First command");
    assertEquals("exit", commands.get(commands.size() - 1).name(), "Last command");
    assertEquals(commands, CommandParser.parse(sample), "Parsing is deterministic");
  }

  @Test
  void streamsCommandsToVisitorInOrder() {
    CommandParser parser = CommandParser.of("(push 1) (check-sat) (pop 1)");
    List<String> names = new ArrayList<>();
    CommandVisitor visitor =
        new CommandVisitor() {
          @Override
          public void visitDefault(Command command) {
            names.add(command.name());
          }
        };
    assertTrue(parser.parseCommand(visitor), "First command dispatched");
    assertEquals(List.of("push"), names, "Only one command per call");
    assertEquals(2, parser.parseAll(visitor), "Remaining commands");
    assertEquals(List.of("push", "check-sat", "pop"), names, "Source order");
    assertFalse(parser.parseCommand(visitor), "End of input");
    assertEquals(3, parser.commandCount(), "Commands counted");
  }

  @Test
  void syntaxErrorConsumesTheBrokenForm() {
    CommandParser parser = CommandParser.of("(assert) (frobnicate 1) (check-sat)");
    List<Command> seen = new ArrayList<>();
    CommandVisitor visitor =
        new CommandVisitor() {
          @Override
          public void visitDefault(Command command) {
            seen.add(command);
          }
        };
    assertThrows(SyntaxException.class, () -> parser.parseCommand(visitor), "Missing term");
    SyntaxException unknown =
        assertThrows(
            SyntaxException.class, () -> parser.parseCommand(visitor), "Unknown command");
    assertEquals(1, unknown.position().line(), "Error carries a position");
    assertTrue(parser.parseCommand(visitor), "Parsing continues with the next form");
    assertInstanceOf(Command.CheckSat.class, seen.get(0), "Only the valid command is seen");
  }

  @Test
  void recoversFromLexicalErrorInsideForm() {
    CommandParser parser = CommandParser.of("(assert (= x #q (f y))) (check-sat)");
    List<Command> seen = new ArrayList<>();
    CommandVisitor visitor =
        new CommandVisitor() {
          @Override
          public void visitDefault(Command command) {
            seen.add(command);
          }
        };
    assertThrows(LexException.class, () -> parser.parseCommand(visitor), "Bad radix");
    assertTrue(parser.recover() > 0, "Rest of the form is skipped");
    assertTrue(parser.parseCommand(visitor), "Next command parses");
    assertEquals(List.of(new Command.CheckSat()), seen, "Broken assertion is dropped");
  }

  @Test
  void rejectsTermsNestedBeyondTheLimit() {
    String nested = "(assert " + "(not ".repeat(10) + "p" + ")".repeat(10) + ")";
    CommandParser limited = new CommandParser(new Lexer(nested), new ParserOptions(true, 5));
    CommandVisitor ignore = new CommandVisitor() {};
    assertThrows(SyntaxException.class, () -> limited.parseCommand(ignore), "Too deep");
    assertEquals(1, CommandParser.parse(nested).size(), "Default limit accepts it");
  }

  @Test
  void rejectsReservedWordsWhereSymbolsAreExpected() {
    assertThrows(
        SyntaxException.class,
        () -> CommandParser.parse("(declare-const let Int)"),
        "let cannot be declared");
    assertEquals(
        1,
        CommandParser.parse("(declare-const |let| Int)").size(),
        "Quoted let is an ordinary symbol");
  }

  @Test
  void decodesStringsAndQuotedSymbols() {
    List<Command> commands =
        CommandParser.parse("(echo \"a \"\"b\"\"\") (declare-const |x y| Int)");
    Command.Echo echo = (Command.Echo) commands.get(0);
    assertEquals("a \"b\"", echo.message().value(), "Doubled quotes decode to one");
    Command.DeclareConst constant = (Command.DeclareConst) commands.get(1);
    assertEquals("x y", constant.symbol().name(), "Bars are not part of the name");
    assertTrue(constant.symbol().quoted(), "Quoting is remembered");
  }

  @Test
  void internsSymbolsPerParser() {
    CommandParser parser = CommandParser.of("(assert (= x x)) (assert (= y x))");
    parser.parseAll(new CommandVisitor() {});
    assertEquals(4, parser.symbols().size(), "assert, =, x and y");
  }
}

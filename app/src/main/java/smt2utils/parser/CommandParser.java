package smt2utils.parser;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smt2utils.SyntaxException;
import smt2utils.concrete.Command;
import smt2utils.concrete.CommandVisitor;
import smt2utils.lexer.LexException;
import smt2utils.lexer.Lexer;
import smt2utils.lexer.Position;
import smt2utils.model.SymbolTable;
import smt2utils.sexpr.SExpr;
import smt2utils.sexpr.SExprReader;

/**
 * Streaming SMT-LIB-2 command parser.
 *
 * <p>Each call to {@link #parseCommand(CommandVisitor)} reads exactly one top-level form, decodes
 * it and dispatches it to the visitor before returning. Nothing is buffered between calls, so the
 * only state retained across commands is the symbol table.
 *
 * <p>Errors are strict. A {@link SyntaxException} is raised after the offending form has been
 * consumed, so the next call continues with the following form. A {@link LexException} stops in
 * the middle of a form; the caller may {@link #recover()} to skip the rest of it.
 */
public final class CommandParser {
  private static final Logger LOG = LoggerFactory.getLogger(CommandParser.class);

  private final SExprReader reader;
  private final SymbolTable symbols;
  private final CommandDecoder decoder;
  private LexException pendingLexError;
  private long commandCount;

  public CommandParser(Lexer lexer) {
    this(lexer, ParserOptions.defaults());
  }

  public CommandParser(Lexer lexer, ParserOptions options) {
    Objects.requireNonNull(lexer, "lexer");
    ParserOptions normalized = ParserOptions.normalize(options);
    this.symbols = new SymbolTable(normalized.internSymbols());
    this.reader = new SExprReader(lexer, symbols);
    this.decoder = new CommandDecoder(normalized.maxTermDepth());
  }

  public static CommandParser of(CharSequence input) {
    return new CommandParser(new Lexer(input));
  }

  public static CommandParser of(Reader reader, ParserOptions options) throws IOException {
    return new CommandParser(Lexer.of(reader), options);
  }

  /** Parses every command of {@code input}, failing on the first error. */
  public static List<Command> parse(CharSequence input) {
    List<Command> commands = new ArrayList<>();
    CommandParser parser = of(input);
    parser.parseAll(new CommandVisitor() {
      @Override
      public void visitDefault(Command command) {
        commands.add(command);
      }
    });
    return commands;
  }

  /**
   * Parses the next command and dispatches it to {@code visitor}.
   *
   * @return {@code true} if a command was dispatched, {@code false} at end of input
   * @throws LexException when a token of the current form is malformed
   * @throws SyntaxException when the current form is not a well-formed command
   */
  public boolean parseCommand(CommandVisitor visitor) {
    Objects.requireNonNull(visitor, "visitor");
    Optional<SExpr> form;
    try {
      form = reader.read();
    } catch (LexException ex) {
      pendingLexError = ex;
      throw ex;
    }
    pendingLexError = null;
    if (form.isEmpty()) {
      return false;
    }
    Command command = decoder.decode(form.get());
    commandCount++;
    LOG.debug("Parsed {} at {}", command.name(), form.get().position());
    command.accept(visitor);
    return true;
  }

  /**
   * Dispatches all remaining commands to {@code visitor}.
   *
   * @return number of commands dispatched by this call
   */
  public long parseAll(CommandVisitor visitor) {
    long dispatched = 0;
    while (parseCommand(visitor)) {
      dispatched++;
    }
    LOG.debug("Dispatched {} commands, {} distinct symbols", dispatched, symbols.size());
    return dispatched;
  }

  /**
   * Skips the remainder of the form abandoned by the last lexical error, up to and including
   * its closing parenthesis. After a syntax error there is nothing to skip.
   *
   * @return number of tokens skipped
   */
  public int recover() {
    LexException cause = pendingLexError;
    pendingLexError = null;
    int skipped = reader.recover(cause);
    LOG.debug("Recovered after {} skipped tokens", skipped);
    return skipped;
  }

  public Position position() {
    return reader.lexer().checkpoint();
  }

  public long commandCount() {
    return commandCount;
  }

  public SymbolTable symbols() {
    return symbols;
  }
}

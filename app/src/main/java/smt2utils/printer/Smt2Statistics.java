package smt2utils.printer;

import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.TreeMultiset;
import java.util.ArrayDeque;
import java.util.Deque;
import smt2utils.concrete.Command;
import smt2utils.concrete.CommandVisitor;
import smt2utils.concrete.FunctionDef;
import smt2utils.concrete.MatchCase;
import smt2utils.concrete.Term;
import smt2utils.concrete.TermVisitor;
import smt2utils.concrete.VarBinding;

/** Command visitor that tallies command kinds and the shape of asserted and defined terms. */
public final class Smt2Statistics implements CommandVisitor {
  private final Multiset<String> commands = TreeMultiset.create();
  private final Multiset<String> symbols = TreeMultiset.create();
  private final Deque<Term> pending = new ArrayDeque<>();
  private final TermCounter counter = new TermCounter();
  private long assertions;
  private long termNodes;
  private long quantifiers;
  private long annotations;
  private long maxArity;

  @Override
  public void visitDefault(Command command) {
    commands.add(command.name());
  }

  @Override
  public void visitAssert(Command.Assert command) {
    visitDefault(command);
    assertions++;
    walk(command.term());
  }

  @Override
  public void visitDefineFun(Command.DefineFun command) {
    visitDefault(command);
    walkDefinition(command.definition());
  }

  @Override
  public void visitDefineFunRec(Command.DefineFunRec command) {
    visitDefault(command);
    walkDefinition(command.definition());
  }

  @Override
  public void visitDefineFunsRec(Command.DefineFunsRec command) {
    visitDefault(command);
    command.bodies().forEach(this::walk);
  }

  @Override
  public void visitDeclareFun(Command.DeclareFun command) {
    visitDefault(command);
    maxArity = Math.max(maxArity, command.arity());
  }

  @Override
  public void visitGetValue(Command.GetValue command) {
    visitDefault(command);
    command.terms().forEach(this::walk);
  }

  private void walkDefinition(FunctionDef definition) {
    maxArity = Math.max(maxArity, definition.signature().parameters().size());
    walk(definition.body());
  }

  private void walk(Term root) {
    pending.push(root);
    while (!pending.isEmpty()) {
      termNodes++;
      pending.pop().accept(counter);
    }
  }

  public long commandCount() {
    return commands.size();
  }

  public int commandCount(String name) {
    return commands.count(name);
  }

  /** Command names with their counts, in name order. */
  public Multiset<String> commands() {
    return ImmutableMultiset.copyOf(commands);
  }

  /** Occurrences of each function or constant symbol in visited terms. */
  public Multiset<String> symbolOccurrences() {
    return ImmutableMultiset.copyOf(symbols);
  }

  public long assertions() {
    return assertions;
  }

  public long termNodes() {
    return termNodes;
  }

  public long quantifiers() {
    return quantifiers;
  }

  /** Attributes attached to terms with {@code !}. */
  public long annotations() {
    return annotations;
  }

  /** Largest parameter count among declared and defined functions. */
  public long maxArity() {
    return maxArity;
  }

  private final class TermCounter implements TermVisitor<Void> {
    @Override
    public Void visitConstant(Term.ConstantTerm term) {
      return null;
    }

    @Override
    public Void visitIdentifier(Term.IdentifierTerm term) {
      symbols.add(term.identifier().symbol().name());
      return null;
    }

    @Override
    public Void visitApplication(Term.Application term) {
      symbols.add(term.function().symbol().name());
      term.arguments().forEach(pending::push);
      return null;
    }

    @Override
    public Void visitLet(Term.Let term) {
      for (VarBinding binding : term.bindings()) {
        pending.push(binding.term());
      }
      pending.push(term.body());
      return null;
    }

    @Override
    public Void visitForall(Term.Forall term) {
      quantifiers++;
      pending.push(term.body());
      return null;
    }

    @Override
    public Void visitExists(Term.Exists term) {
      quantifiers++;
      pending.push(term.body());
      return null;
    }

    @Override
    public Void visitMatch(Term.Match term) {
      pending.push(term.scrutinee());
      for (MatchCase matchCase : term.cases()) {
        pending.push(matchCase.term());
      }
      return null;
    }

    @Override
    public Void visitAnnotated(Term.Annotated term) {
      annotations += term.attributes().size();
      pending.push(term.term());
      return null;
    }
  }
}

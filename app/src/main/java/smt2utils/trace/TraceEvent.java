package smt2utils.trace;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import smt2utils.model.NumeralLiteral;

/** One line of the trace log. Every variant carries the 1-based line it was read from. */
public interface TraceEvent {

  long line();

  TraceEventKind kind();

  /** {@code [tool-version] Z3 4.8.9} */
  record ToolVersion(long line, String tool, String version) implements TraceEvent {
    public ToolVersion {
      Objects.requireNonNull(tool, "tool");
      Objects.requireNonNull(version, "version");
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.TOOL_VERSION;
    }
  }

  /** {@code [mk-app] #12 f #10 #11}: application of {@code name} to earlier terms. */
  record MkApp(long line, Ident id, String name, List<Ident> arguments) implements TraceEvent {
    public MkApp {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(name, "name");
      arguments = List.copyOf(arguments);
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.MK_APP;
    }
  }

  /** {@code [mk-var] #3 0}: bound variable with its de Bruijn index. */
  record MkVar(long line, Ident id, int index) implements TraceEvent {
    public MkVar {
      Objects.requireNonNull(id, "id");
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.MK_VAR;
    }
  }

  /**
   * {@code [mk-quant] #5 name 2 #3 #4} and {@code [mk-lambda] ...}: binder over {@code
   * variableCount} variables. The last term is the body, the others are patterns.
   */
  record MkQuant(
      long line, Ident id, String name, int variableCount, List<Ident> patterns, Ident body,
      boolean lambda)
      implements TraceEvent {
    public MkQuant {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(name, "name");
      patterns = List.copyOf(patterns);
      Objects.requireNonNull(body, "body");
    }

    @Override
    public TraceEventKind kind() {
      return lambda ? TraceEventKind.MK_LAMBDA : TraceEventKind.MK_QUANT;
    }
  }

  /** {@code [mk-proof] #9 rule #7 #8 #6}: proof step with premises and a conclusion. */
  record MkProof(long line, Ident id, String rule, List<Ident> premises, Ident conclusion)
      implements TraceEvent {
    public MkProof {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(rule, "rule");
      premises = List.copyOf(premises);
      Objects.requireNonNull(conclusion, "conclusion");
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.MK_PROOF;
    }
  }

  /**
   * {@code [attach-meaning] #10 arith 1}: theory interpretation of a term. Payloads that are
   * SMT-LIB-2 numerals are decoded.
   */
  record AttachMeaning(long line, Ident id, String theory, String payload, NumeralLiteral numeral)
      implements TraceEvent {
    public AttachMeaning {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(theory, "theory");
      Objects.requireNonNull(payload, "payload");
    }

    public Optional<NumeralLiteral> numeralValue() {
      return Optional.ofNullable(numeral);
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.ATTACH_MEANING;
    }
  }

  /** {@code [attach-var-names] #5 (|x| ; |Int|) (|y| ; |Bool|)} */
  record AttachVarNames(long line, Ident id, List<VarName> names) implements TraceEvent {
    public AttachVarNames {
      Objects.requireNonNull(id, "id");
      names = List.copyOf(names);
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.ATTACH_VAR_NAMES;
    }
  }

  /** Name and sort of a quantified variable. */
  record VarName(String name, String sort) {
    public VarName {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(sort, "sort");
    }
  }

  /** {@code [attach-enode] #10 0}: the term entered the E-graph at the given generation. */
  record AttachEnode(long line, Ident id, int generation) implements TraceEvent {
    public AttachEnode {
      Objects.requireNonNull(id, "id");
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.ATTACH_ENODE;
    }
  }

  /** How an {@code eq-expl} line justifies an equality. */
  enum Explanation {
    ROOT,
    LITERAL,
    CONGRUENCE,
    THEORY,
    AXIOM,
    UNKNOWN
  }

  /**
   * {@code [eq-expl] #10 lit #7 ; #11}: {@code id} equals {@code target}, justified by the
   * listed terms. A {@code root} line has no target.
   */
  record EqExpl(
      long line,
      Ident id,
      Explanation explanation,
      List<Ident> evidence,
      String theory,
      Ident target)
      implements TraceEvent {
    public EqExpl {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(explanation, "explanation");
      evidence = List.copyOf(evidence);
      if ((explanation == Explanation.ROOT) != (target == null)) {
        throw new IllegalArgumentException("Only root explanations lack a target");
      }
    }

    public boolean isRoot() {
      return explanation == Explanation.ROOT;
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.EQ_EXPL;
    }
  }

  /** {@code [new-match] 0x1f #5 #8 #10 #11 ; #9 (#12 #13)}: a pattern matched. */
  record NewMatch(
      long line, long key, Ident quantifier, Ident trigger, List<Ident> bindings,
      List<Ident> used)
      implements TraceEvent {
    public NewMatch {
      Objects.requireNonNull(quantifier, "quantifier");
      Objects.requireNonNull(trigger, "trigger");
      bindings = List.copyOf(bindings);
      used = List.copyOf(used);
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.NEW_MATCH;
    }
  }

  /** {@code [inst-discovered] theory-solving 0x2a #5 #10 ; #7}: instance found without a match. */
  record InstDiscovered(
      long line, String method, long key, Ident quantifier, List<Ident> bindings,
      List<Ident> blamed)
      implements TraceEvent {
    public InstDiscovered {
      Objects.requireNonNull(method, "method");
      Objects.requireNonNull(quantifier, "quantifier");
      bindings = List.copyOf(bindings);
      blamed = List.copyOf(blamed);
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.INST_DISCOVERED;
    }
  }

  /** {@code [instance] 0x1f #20 ; 1}: the match with this key is being instantiated. */
  record Instance(long line, long key, Ident proof, int generation) implements TraceEvent {
    public Optional<Ident> proofTerm() {
      return Optional.ofNullable(proof);
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.INSTANCE;
    }
  }

  record EndOfInstance(long line) implements TraceEvent {
    @Override
    public TraceEventKind kind() {
      return TraceEventKind.END_OF_INSTANCE;
    }
  }

  record DecideAndOr(long line, Ident first, Ident second) implements TraceEvent {
    public DecideAndOr {
      Objects.requireNonNull(first, "first");
      Objects.requireNonNull(second, "second");
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.DECIDE_AND_OR;
    }
  }

  /** Boolean literal over a term: {@code #7} or {@code (not #7)}. */
  record Literal(Ident term, boolean negated) {
    public Literal {
      Objects.requireNonNull(term, "term");
    }

    @Override
    public String toString() {
      return negated ? "(not " + term + ")" : term.toString();
    }
  }

  /** {@code [assign] (not #7) decision axiom}: the justification is kept as written. */
  record Assign(long line, Literal literal, String justification) implements TraceEvent {
    public Assign {
      Objects.requireNonNull(literal, "literal");
      Objects.requireNonNull(justification, "justification");
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.ASSIGN;
    }
  }

  record Conflict(long line, List<Literal> literals) implements TraceEvent {
    public Conflict {
      literals = List.copyOf(literals);
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.CONFLICT;
    }
  }

  record Push(long line, int scope) implements TraceEvent {
    @Override
    public TraceEventKind kind() {
      return TraceEventKind.PUSH;
    }
  }

  /** {@code [pop] 1 3}: leaves {@code levels} scopes out of {@code scope}. */
  record Pop(long line, int levels, int scope) implements TraceEvent {
    @Override
    public TraceEventKind kind() {
      return TraceEventKind.POP;
    }
  }

  record BeginCheck(long line, int scope) implements TraceEvent {
    @Override
    public TraceEventKind kind() {
      return TraceEventKind.BEGIN_CHECK;
    }
  }

  record QueryDone(long line, String result) implements TraceEvent {
    public QueryDone {
      Objects.requireNonNull(result, "result");
    }

    @Override
    public TraceEventKind kind() {
      return TraceEventKind.QUERY_DONE;
    }
  }

  /** {@code [resolve-lit]} and {@code [resolve-process]}: conflict resolution steps, kept raw. */
  record Resolve(long line, boolean process, List<String> fields) implements TraceEvent {
    public Resolve {
      fields = List.copyOf(fields);
    }

    @Override
    public TraceEventKind kind() {
      return process ? TraceEventKind.RESOLVE_PROCESS : TraceEventKind.RESOLVE_LIT;
    }
  }

  record Eof(long line) implements TraceEvent {
    @Override
    public TraceEventKind kind() {
      return TraceEventKind.EOF;
    }
  }
}

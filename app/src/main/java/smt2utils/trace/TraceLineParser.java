package smt2utils.trace;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import smt2utils.model.NumeralFormatException;
import smt2utils.model.NumeralLiteral;
import smt2utils.model.Symbol;
import smt2utils.trace.TraceEvent.Explanation;
import smt2utils.trace.TraceEvent.Literal;
import smt2utils.trace.TraceEvent.VarName;
import smt2utils.trace.TraceParseException.Reason;

/**
 * Decodes one trace line of the form {@code [tag] field field ...}.
 *
 * <p>Fields are separated by whitespace, except inside a bar-quoted {@code |...|} run, which
 * stays part of its field with the bars kept. Term references are {@link Ident}s and match keys
 * are hexadecimal {@code 0x...} numbers. A {@code ;} separates the optional trailing section of
 * equality explanations, matches and instances.
 */
public final class TraceLineParser {
  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();
  private static final Splitter FIELDS = Splitter.on(WHITESPACE).omitEmptyStrings();
  private static final String SEPARATOR = ";";

  private TraceLineParser() {}

  /**
   * Parses {@code text}, read from line {@code line}.
   *
   * @throws TraceParseException when the line is malformed
   */
  public static TraceEvent parse(long line, String text) {
    String trimmed = text.strip();
    int close = trimmed.indexOf(']');
    if (!trimmed.startsWith("[") || close < 0) {
      throw new TraceParseException(line, Reason.MISSING_TAG, abbreviate(trimmed));
    }
    String tag = trimmed.substring(1, close);
    TraceEventKind kind =
        TraceEventKind.fromTag(tag)
            .orElseThrow(() -> new TraceParseException(line, Reason.UNKNOWN_TAG, tag));
    String rest = trimmed.substring(close + 1);
    Fields fields = new Fields(line, splitFields(line, rest));
    TraceEvent event =
        switch (kind) {
          case TOOL_VERSION -> {
            String tool = fields.word("tool");
            yield new TraceEvent.ToolVersion(line, tool, String.join(" ", fields.remaining()));
          }
          case MK_APP ->
              new TraceEvent.MkApp(
                  line, fields.ident("term"), fields.symbol("function name"), fields.idents());
          case MK_VAR -> new TraceEvent.MkVar(line, fields.ident("term"), fields.integer("index"));
          case MK_QUANT, MK_LAMBDA -> {
            Ident id = fields.ident("term");
            String name = fields.symbol("quantifier name");
            int variables = fields.integer("variable count");
            List<Ident> terms = fields.idents();
            if (terms.isEmpty()) {
              throw new TraceParseException(line, Reason.MISSING_FIELD, "body");
            }
            Ident body = terms.get(terms.size() - 1);
            yield new TraceEvent.MkQuant(
                line,
                id,
                name,
                variables,
                terms.subList(0, terms.size() - 1),
                body,
                kind == TraceEventKind.MK_LAMBDA);
          }
          case MK_PROOF -> {
            Ident id = fields.ident("term");
            String rule = fields.symbol("proof rule");
            List<Ident> terms = fields.idents();
            if (terms.isEmpty()) {
              throw new TraceParseException(line, Reason.MISSING_FIELD, "conclusion");
            }
            yield new TraceEvent.MkProof(
                line, id, rule, terms.subList(0, terms.size() - 1), terms.get(terms.size() - 1));
          }
          case ATTACH_MEANING -> {
            Ident id = fields.ident("term");
            String theory = fields.word("theory");
            String payload = String.join(" ", fields.remaining());
            if (payload.isEmpty()) {
              throw new TraceParseException(line, Reason.MISSING_FIELD, "meaning");
            }
            yield new TraceEvent.AttachMeaning(line, id, theory, payload, numeral(payload));
          }
          case ATTACH_VAR_NAMES -> {
            Ident id = fields.ident("term");
            yield new TraceEvent.AttachVarNames(
                line, id, varNames(line, String.join(" ", fields.remaining())));
          }
          case ATTACH_ENODE ->
              new TraceEvent.AttachEnode(
                  line, fields.ident("term"), fields.integer("generation"));
          case EQ_EXPL -> eqExpl(line, fields);
          case NEW_MATCH -> {
            long key = fields.key();
            Ident quantifier = fields.ident("quantifier");
            Ident trigger = fields.ident("trigger");
            List<Ident> bindings = fields.identsUntilSeparator();
            List<Ident> used = fields.skipSeparator() ? fields.groupedIdents() : List.of();
            yield new TraceEvent.NewMatch(line, key, quantifier, trigger, bindings, used);
          }
          case INST_DISCOVERED -> {
            String method = fields.word("method");
            long key = fields.key();
            Ident quantifier = fields.ident("quantifier");
            List<Ident> bindings = fields.identsUntilSeparator();
            List<Ident> blamed = fields.skipSeparator() ? fields.groupedIdents() : List.of();
            yield new TraceEvent.InstDiscovered(line, method, key, quantifier, bindings, blamed);
          }
          case INSTANCE -> {
            long key = fields.key();
            Ident proof = null;
            if (fields.hasNext() && !fields.peek().equals(SEPARATOR)) {
              proof = fields.ident("proof term");
            }
            int generation = fields.skipSeparator() ? fields.integer("generation") : 0;
            yield new TraceEvent.Instance(line, key, proof, generation);
          }
          case END_OF_INSTANCE -> new TraceEvent.EndOfInstance(line);
          case DECIDE_AND_OR ->
              new TraceEvent.DecideAndOr(line, fields.ident("term"), fields.ident("term"));
          case ASSIGN -> {
            Literal literal = fields.literal();
            yield new TraceEvent.Assign(line, literal, String.join(" ", fields.remaining()));
          }
          case CONFLICT -> {
            List<Literal> literals = new ArrayList<>();
            while (fields.hasNext()) {
              literals.add(fields.literal());
            }
            yield new TraceEvent.Conflict(line, literals);
          }
          case PUSH -> new TraceEvent.Push(line, fields.integer("scope"));
          case POP -> new TraceEvent.Pop(line, fields.integer("levels"), fields.integer("scope"));
          case BEGIN_CHECK -> new TraceEvent.BeginCheck(line, fields.integer("scope"));
          case QUERY_DONE -> new TraceEvent.QueryDone(line, fields.word("result"));
          case RESOLVE_LIT -> new TraceEvent.Resolve(line, false, fields.remaining());
          case RESOLVE_PROCESS -> new TraceEvent.Resolve(line, true, fields.remaining());
          case EOF -> new TraceEvent.Eof(line);
        };
    fields.expectEnd();
    return event;
  }

  private static TraceEvent eqExpl(long line, Fields fields) {
    Ident id = fields.ident("term");
    String word = fields.word("explanation");
    Explanation explanation =
        switch (word) {
          case "root" -> Explanation.ROOT;
          case "lit" -> Explanation.LITERAL;
          case "cg" -> Explanation.CONGRUENCE;
          case "th" -> Explanation.THEORY;
          case "ax" -> Explanation.AXIOM;
          case "unknown" -> Explanation.UNKNOWN;
          default -> throw new TraceParseException(line, Reason.MALFORMED_EXPLANATION, word);
        };
    if (explanation == Explanation.ROOT) {
      return new TraceEvent.EqExpl(line, id, explanation, List.of(), null, null);
    }
    String theory = null;
    List<Ident> evidence = List.of();
    if (explanation == Explanation.THEORY) {
      theory = fields.word("theory");
    } else if (explanation == Explanation.LITERAL || explanation == Explanation.CONGRUENCE) {
      evidence = fields.groupedIdentsUntilSeparator();
    }
    if (!fields.skipSeparator()) {
      throw new TraceParseException(line, Reason.MALFORMED_EXPLANATION, "missing ';' target");
    }
    return new TraceEvent.EqExpl(
        line, id, explanation, evidence, theory, fields.ident("target"));
  }

  /** Decodes the payload as an SMT-LIB-2 numeral, or returns null if it is something else. */
  private static NumeralLiteral numeral(String payload) {
    char first = payload.charAt(0);
    if (first != '#' && (first < '0' || first > '9')) {
      return null;
    }
    try {
      return NumeralLiteral.parse(payload);
    } catch (NumeralFormatException ex) {
      // Theory payloads such as bit-vector sorts share the prefix; they stay raw.
      return null;
    }
  }

  /** Splits on whitespace outside {@code |...|} runs. */
  private static List<String> splitFields(long line, String text) {
    if (text.indexOf('|') < 0) {
      return FIELDS.splitToList(text);
    }
    List<String> fields = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      if (WHITESPACE.matches(text.charAt(i))) {
        i++;
        continue;
      }
      int start = i;
      while (i < text.length() && !WHITESPACE.matches(text.charAt(i))) {
        i = text.charAt(i) == '|' ? closingBar(line, text, i) + 1 : i + 1;
      }
      fields.add(text.substring(start, i));
    }
    return fields;
  }

  /** Index of the bar closing the quoted run opened at {@code open}. */
  private static int closingBar(long line, String text, int open) {
    int close = text.indexOf('|', open + 1);
    if (close < 0) {
      throw new TraceParseException(
          line, Reason.MALFORMED_LITERAL, "unterminated " + abbreviate(text.substring(open)));
    }
    return close;
  }

  /** First index at or after {@code from} holding {@code target} outside a quoted run, or -1. */
  private static int indexOutsideBars(long line, String text, char target, int from) {
    int i = from;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == target) {
        return i;
      }
      i = c == '|' ? closingBar(line, text, i) + 1 : i + 1;
    }
    return -1;
  }

  private static List<VarName> varNames(long line, String text) {
    List<VarName> names = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (WHITESPACE.matches(c)) {
        i++;
        continue;
      }
      int separator = c == '(' ? indexOutsideBars(line, text, ';', i + 1) : -1;
      int close = separator < 0 ? -1 : indexOutsideBars(line, text, ')', separator + 1);
      if (close < 0 || indexOutsideBars(line, text, ')', i + 1) != close) {
        throw new TraceParseException(line, Reason.MALFORMED_LITERAL, abbreviate(text));
      }
      names.add(
          new VarName(
              unquote(text.substring(i + 1, separator).strip()),
              unquote(text.substring(separator + 1, close).strip())));
      i = close + 1;
    }
    return names;
  }

  private static String unquote(String text) {
    if (text.length() >= 2 && text.startsWith("|") && text.endsWith("|")) {
      return text.substring(1, text.length() - 1);
    }
    return text;
  }

  private static String abbreviate(String text) {
    return text.length() <= 60 ? text : text.substring(0, 57) + "...";
  }

  /** Cursor over the whitespace-separated fields of one line. */
  private static final class Fields {
    private final long line;
    private final List<String> items;
    private int next;

    Fields(long line, List<String> items) {
      this.line = line;
      this.items = items;
    }

    boolean hasNext() {
      return next < items.size();
    }

    String peek() {
      return items.get(next);
    }

    String word(String what) {
      if (!hasNext()) {
        throw new TraceParseException(line, Reason.MISSING_FIELD, what);
      }
      return items.get(next++);
    }

    /** A function, quantifier or rule name; its lexeme must be a valid symbol. */
    String symbol(String what) {
      String text = word(what);
      String name =
          text.length() >= 2 && text.startsWith("|") && text.endsWith("|")
              ? text.substring(1, text.length() - 1)
              : text;
      if (!Symbol.isQuotable(name)) {
        throw new TraceParseException(line, Reason.MALFORMED_SYMBOL, text);
      }
      return text;
    }

    Ident ident(String what) {
      return toIdent(word(what));
    }

    int integer(String what) {
      String text = word(what);
      try {
        return Integer.parseInt(text);
      } catch (NumberFormatException ex) {
        throw new TraceParseException(line, Reason.MALFORMED_NUMBER, what + " '" + text + "'");
      }
    }

    long key() {
      String text = word("match key");
      if (!text.startsWith("0x") || text.length() == 2) {
        throw new TraceParseException(line, Reason.MALFORMED_KEY, text);
      }
      try {
        return Long.parseUnsignedLong(text.substring(2), 16);
      } catch (NumberFormatException ex) {
        throw new TraceParseException(line, Reason.MALFORMED_KEY, text);
      }
    }

    Literal literal() {
      String text = word("literal");
      if (text.equals("(not")) {
        String term = word("negated literal");
        if (!term.endsWith(")")) {
          throw new TraceParseException(line, Reason.MALFORMED_LITERAL, "(not " + term);
        }
        return new Literal(toIdent(term.substring(0, term.length() - 1)), true);
      }
      return new Literal(toIdent(text), false);
    }

    List<Ident> idents() {
      List<Ident> idents = new ArrayList<>();
      while (hasNext()) {
        idents.add(toIdent(items.get(next++)));
      }
      return idents;
    }

    List<Ident> identsUntilSeparator() {
      List<Ident> idents = new ArrayList<>();
      while (hasNext() && !peek().equals(SEPARATOR)) {
        idents.add(toIdent(items.get(next++)));
      }
      return idents;
    }

    /** Identifiers, possibly grouped in pairs such as {@code (#1 #2)}, up to the end. */
    List<Ident> groupedIdents() {
      List<Ident> idents = new ArrayList<>();
      while (hasNext()) {
        idents.add(toIdent(stripParens(items.get(next++))));
      }
      return idents;
    }

    List<Ident> groupedIdentsUntilSeparator() {
      List<Ident> idents = new ArrayList<>();
      while (hasNext() && !peek().equals(SEPARATOR)) {
        idents.add(toIdent(stripParens(items.get(next++))));
      }
      return idents;
    }

    boolean skipSeparator() {
      if (hasNext() && peek().equals(SEPARATOR)) {
        next++;
        return true;
      }
      return false;
    }

    List<String> remaining() {
      List<String> rest = items.subList(next, items.size());
      next = items.size();
      return rest;
    }

    void expectEnd() {
      if (hasNext()) {
        throw new TraceParseException(line, Reason.UNEXPECTED_FIELD, peek());
      }
    }

    private Ident toIdent(String text) {
      try {
        return Ident.parse(text);
      } catch (IllegalArgumentException ex) {
        throw new TraceParseException(line, Reason.MALFORMED_IDENT, text);
      }
    }

    private static String stripParens(String text) {
      int start = 0;
      int end = text.length();
      while (start < end && text.charAt(start) == '(') {
        start++;
      }
      while (end > start && text.charAt(end - 1) == ')') {
        end--;
      }
      return text.substring(start, end);
    }
  }
}

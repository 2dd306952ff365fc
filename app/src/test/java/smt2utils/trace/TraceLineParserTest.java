package smt2utils.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;
import smt2utils.trace.TraceEvent.Explanation;
import smt2utils.trace.TraceParseException.Reason;

final class TraceLineParserTest {

  @Test
  void parsesTermCreation() {
    TraceEvent.MkApp app =
        assertInstanceOf(TraceEvent.MkApp.class, TraceLineParser.parse(3, "[mk-app] #5 f #1 #2"));
    assertEquals(Ident.of(5), app.id(), "Defined term");
    assertEquals("f", app.name(), "Function name");
    assertEquals(List.of(Ident.of(1), Ident.of(2)), app.arguments(), "Arguments in order");
    assertEquals(3, app.line(), "Line number is kept");
    assertEquals(TraceEventKind.MK_APP, app.kind(), "Kind follows the tag");

    TraceEvent.MkQuant quant =
        assertInstanceOf(
            TraceEvent.MkQuant.class, TraceLineParser.parse(4, "[mk-quant] #9 q 2 #6 #7 #8"));
    assertEquals(2, quant.variableCount(), "Bound variables");
    assertEquals(List.of(Ident.of(6), Ident.of(7)), quant.patterns(), "Patterns before the body");
    assertEquals(Ident.of(8), quant.body(), "Body is the last term");
    assertFalse(quant.lambda(), "Quantifier, not lambda");
  }

  @Test
  void parsesNamespacedIdentifiers() {
    TraceEvent.MkVar variable =
        assertInstanceOf(TraceEvent.MkVar.class, TraceLineParser.parse(1, "[mk-var] datatype#3 1"));
    assertEquals(new Ident("datatype", 3), variable.id(), "Namespace before the hash");
    assertEquals("datatype#3", variable.id().toString(), "Printed as written");
    assertEquals(1, variable.index(), "De Bruijn index");
  }

  @Test
  void parsesEqualityExplanations() {
    TraceEvent.EqExpl root =
        assertInstanceOf(TraceEvent.EqExpl.class, TraceLineParser.parse(1, "[eq-expl] #4 root"));
    assertTrue(root.isRoot(), "Root explanation");
    assertNull(root.target(), "Roots have no target");

    TraceEvent.EqExpl congruence =
        assertInstanceOf(
            TraceEvent.EqExpl.class,
            TraceLineParser.parse(2, "[eq-expl] #4 cg (#1 #2) (#3 #5) ; #6"));
    assertEquals(Explanation.CONGRUENCE, congruence.explanation(), "Congruence");
    assertEquals(
        List.of(Ident.of(1), Ident.of(2), Ident.of(3), Ident.of(5)),
        congruence.evidence(),
        "Argument pairs are flattened");
    assertEquals(Ident.of(6), congruence.target(), "Target after the separator");

    TraceEvent.EqExpl theory =
        assertInstanceOf(
            TraceEvent.EqExpl.class, TraceLineParser.parse(3, "[eq-expl] #4 th arith ; #7"));
    assertEquals("arith", theory.theory(), "Theory name");
  }

  @Test
  void parsesMatchesAndInstances() {
    TraceEvent.NewMatch match =
        assertInstanceOf(
            TraceEvent.NewMatch.class,
            TraceLineParser.parse(1, "[new-match] 0x1f #8 #6 #1 #2 ; (#3 #4) #5"));
    assertEquals(0x1fL, match.key(), "Hexadecimal key");
    assertEquals(List.of(Ident.of(1), Ident.of(2)), match.bindings(), "Bindings");
    assertEquals(
        List.of(Ident.of(3), Ident.of(4), Ident.of(5)), match.used(), "Used terms, ungrouped");

    TraceEvent.Instance instance =
        assertInstanceOf(
            TraceEvent.Instance.class, TraceLineParser.parse(2, "[instance] 0x1f #20 ; 3"));
    assertEquals(Ident.of(20), instance.proof(), "Proof term");
    assertEquals(3, instance.generation(), "Generation");

    TraceEvent.Instance bare =
        assertInstanceOf(TraceEvent.Instance.class, TraceLineParser.parse(3, "[instance] 0x2"));
    assertNull(bare.proof(), "Proof term is optional");
    assertEquals(0, bare.generation(), "Generation defaults to zero");

    TraceEvent.InstDiscovered discovered =
        assertInstanceOf(
            TraceEvent.InstDiscovered.class,
            TraceLineParser.parse(4, "[inst-discovered] theory-solving 0x3 #8 #1 ; #2"));
    assertEquals("theory-solving", discovered.method(), "Discovery method");
    assertEquals(List.of(Ident.of(2)), discovered.blamed(), "Blamed terms");
  }

  @Test
  void parsesSolverEvents() {
    TraceEvent.Conflict conflict =
        assertInstanceOf(
            TraceEvent.Conflict.class, TraceLineParser.parse(1, "[conflict] #3 (not #4)"));
    assertEquals(
        List.of(
            new TraceEvent.Literal(Ident.of(3), false), new TraceEvent.Literal(Ident.of(4), true)),
        conflict.literals(),
        "Literals with polarity");
    TraceEvent.Pop pop =
        assertInstanceOf(TraceEvent.Pop.class, TraceLineParser.parse(2, "[pop] 2 5"));
    assertEquals(2, pop.levels(), "Levels popped");
    assertEquals(5, pop.scope(), "Scope after the pop");
    TraceEvent.ToolVersion version =
        assertInstanceOf(
            TraceEvent.ToolVersion.class, TraceLineParser.parse(3, "[tool-version] Z3 4.12.2"));
    assertEquals("4.12.2", version.version(), "Version text");
  }

  @Test
  void decodesNumeralMeanings() {
    TraceEvent.AttachMeaning hex =
        assertInstanceOf(
            TraceEvent.AttachMeaning.class,
            TraceLineParser.parse(1, "[attach-meaning] #2 bv #x0f"));
    assertEquals(
        BigInteger.valueOf(15),
        hex.numeralValue().orElseThrow().bigIntegerValue(),
        "Hexadecimal payload decoded");
    TraceEvent.AttachMeaning sort =
        assertInstanceOf(
            TraceEvent.AttachMeaning.class,
            TraceLineParser.parse(2, "[attach-meaning] #3 bv (_ bv 4 8)"));
    assertTrue(sort.numeralValue().isEmpty(), "Non-numeral payloads stay raw");
    assertEquals("(_ bv 4 8)", sort.payload(), "Payload text is kept");
  }

  @Test
  void keepsQuotedFunctionNamesInOneField() {
    TraceEvent.MkApp app =
        assertInstanceOf(
            TraceEvent.MkApp.class, TraceLineParser.parse(1, "[mk-app] #3 |foo bar| #1 #2"));
    assertEquals("|foo bar|", app.name(), "Quoted name with its bars");
    assertEquals(List.of(Ident.of(1), Ident.of(2)), app.arguments(), "Arguments after the name");

    TraceEvent.MkQuant quant =
        assertInstanceOf(
            TraceEvent.MkQuant.class, TraceLineParser.parse(2, "[mk-quant] #9 |k!0 ax| 1 #8"));
    assertEquals("|k!0 ax|", quant.name(), "Quoted quantifier name");
  }

  @Test
  void parsesVariableNamesWithParenthesizedSorts() {
    TraceEvent.AttachVarNames names =
        assertInstanceOf(
            TraceEvent.AttachVarNames.class,
            TraceLineParser.parse(
                1, "[attach-var-names] #8 (|x| ; |(_ BitVec 32)|) (|a| ; |(Array Int Int)|)"));
    assertEquals(
        List.of(
            new TraceEvent.VarName("x", "(_ BitVec 32)"),
            new TraceEvent.VarName("a", "(Array Int Int)")),
        names.names(),
        "Sorts keep their inner parentheses");
  }

  @Test
  void rejectsUnterminatedQuotedFields() {
    assertReason(Reason.MALFORMED_LITERAL, "[mk-app] #1 |foo #2");
    assertReason(Reason.MALFORMED_LITERAL, "[attach-var-names] #8 (|x| ; |Int)");
    assertReason(Reason.MALFORMED_LITERAL, "[attach-var-names] #8 (|x|) ; Int)");
  }

  @Test
  void reportsMalformedLinesWithReasons() {
    assertReason(Reason.MISSING_TAG, "mk-app #1 f");
    assertReason(Reason.UNKNOWN_TAG, "[mk-thing] #1");
    assertReason(Reason.MISSING_FIELD, "[mk-app] #1");
    assertReason(Reason.UNEXPECTED_FIELD, "[push] 1 2");
    assertReason(Reason.MALFORMED_IDENT, "[mk-app] 1 f");
    assertReason(Reason.MALFORMED_NUMBER, "[push] one");
    assertReason(Reason.MALFORMED_KEY, "[instance] 12");
    assertReason(Reason.MALFORMED_LITERAL, "[assign] (not #1 decision");
    assertReason(Reason.MALFORMED_EXPLANATION, "[eq-expl] #1 magic ; #2");
    assertReason(Reason.MALFORMED_SYMBOL, "[mk-app] #1 a|b| #2");
    assertReason(Reason.MALFORMED_SYMBOL, "[mk-quant] #1 |q\\0| 1 #2");
  }

  private static void assertReason(Reason expected, String text) {
    TraceParseException error =
        assertThrows(TraceParseException.class, () -> TraceLineParser.parse(7, text), text);
    assertEquals(expected, error.reason(), "Reason for " + text);
    assertEquals(7, error.line(), "Line number for " + text);
  }
}

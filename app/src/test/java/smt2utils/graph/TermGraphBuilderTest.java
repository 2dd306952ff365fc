package smt2utils.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;
import smt2utils.model.Symbol;
import smt2utils.trace.Ident;
import smt2utils.trace.TraceLineParser;

final class TermGraphBuilderTest {

  @Test
  void deduplicatesStructurallyEqualTerms() {
    TermGraphBuilder builder = new TermGraphBuilder();
    assertEquals(GraphDelta.created(0), ingest(builder, 1, "[mk-app] #1 0"), "Constant");
    assertEquals(GraphDelta.created(1), ingest(builder, 2, "[mk-app] #2 f #1"), "First f(0)");
    assertEquals(
        GraphDelta.deduplicated(1), ingest(builder, 3, "[mk-app] #3 f #1"), "Second f(0)");
    assertEquals(2, builder.graph().nodeCount(), "Only two nodes");
    assertEquals(3, builder.creationEvents(), "Three creation events");
    assertEquals(OptionalInt.of(1), builder.lookup(Ident.of(3)), "#3 is bound to the shared node");
    StructuralKey key = new StructuralKey(TermKind.APP, Symbol.of("f"), List.of(0), 0);
    assertEquals(1, builder.graph().find(key).orElseThrow(), "Found by structure");
    assertEquals("(f 0)", builder.graph().render(1, 5), "Rendered with labels");
  }

  @Test
  void acceptsQuotedNamesContainingSpaces() {
    TermGraphBuilder builder = new TermGraphBuilder();
    assertEquals(GraphDelta.created(0), ingest(builder, 1, "[mk-app] #1 |foo bar|"), "Constant");
    assertEquals(GraphDelta.created(1), ingest(builder, 2, "[mk-app] #2 g #1"), "Uses #1");
    assertEquals(Symbol.of("foo bar"), builder.graph().node(0).symbol(), "Bars are stripped");
    assertEquals("(g foo bar)", builder.graph().render(1, 5), "Rendered by name");
  }

  @Test
  void rejectsUnknownReferencesWithoutSideEffects() {
    TermGraphBuilder builder = new TermGraphBuilder();
    ingest(builder, 1, "[mk-app] #1 a");
    GraphIntegrityException error =
        assertThrows(
            GraphIntegrityException.class, () -> ingest(builder, 2, "[mk-app] #2 g #1 #99"));
    assertEquals(GraphIntegrityException.Reason.UNKNOWN_TERM, error.reason(), "Unknown term");
    assertEquals(Ident.of(99), error.ident(), "Offending identifier");
    assertEquals(2, error.line(), "Offending line");
    assertEquals(1, builder.graph().nodeCount(), "No node was added");
    assertTrue(builder.lookup(Ident.of(2)).isEmpty(), "#2 stays unbound");
    assertEquals(1, builder.creationEvents(), "Rejected event is not counted");

    assertEquals(
        GraphDelta.created(1), ingest(builder, 3, "[mk-app] #3 g #1"), "Later lines still apply");
  }

  @Test
  void rejectsSelfReferences() {
    TermGraphBuilder builder = new TermGraphBuilder();
    ingest(builder, 1, "[mk-app] #1 a");
    GraphIntegrityException error =
        assertThrows(
            GraphIntegrityException.class, () -> ingest(builder, 2, "[mk-app] #1 f #1"));
    assertEquals(GraphIntegrityException.Reason.SELF_REFERENCE, error.reason(), "Self reference");
    assertEquals(OptionalInt.of(0), builder.lookup(Ident.of(1)), "Binding is untouched");
  }

  @Test
  void rebindsReusedIdentifiers() {
    TermGraphBuilder builder = new TermGraphBuilder();
    ingest(builder, 1, "[mk-app] #1 a");
    ingest(builder, 2, "[mk-app] #1 b");
    assertEquals(OptionalInt.of(1), builder.lookup(Ident.of(1)), "Latest definition wins");
    assertEquals("a", builder.graph().node(0).label(), "Old node is kept");
  }

  @Test
  void mergesEquivalenceClasses() {
    TermGraphBuilder builder = new TermGraphBuilder();
    ingest(builder, 1, "[mk-app] #1 c");
    ingest(builder, 2, "[mk-app] #2 h #1");
    ingest(builder, 3, "[mk-app] #3 = #2 #1");
    assertEquals(GraphDelta.unchanged(1), ingest(builder, 4, "[eq-expl] #2 root"), "Root");
    GraphDelta merged = ingest(builder, 5, "[eq-expl] #2 lit #3 ; #1");
    assertEquals(GraphDelta.Kind.MERGED, merged.kind(), "Classes joined");
    assertTrue(builder.graph().sameClass(0, 1), "c ~ h(c)");
    assertEquals(0, builder.graph().representative(1), "Lower root on a tie");
    assertEquals(2, builder.graph().classCount(), "Three nodes in two classes");
    assertEquals(
        GraphDelta.Kind.UNCHANGED,
        ingest(builder, 6, "[eq-expl] #1 lit #3 ; #2").kind(),
        "Already equal");
  }

  @Test
  void attachesAnnotations() {
    TermGraphBuilder builder = new TermGraphBuilder();
    ingest(builder, 1, "[mk-app] #1 5");
    ingest(builder, 2, "[attach-meaning] #1 arith 5");
    ingest(builder, 3, "[mk-var] #2 0");
    ingest(builder, 4, "[mk-quant] #3 q 1 #2");
    ingest(builder, 5, "[attach-var-names] #3 (|x| ; |Int|)");
    TermMeaning meaning = builder.graph().meaning(0).orElseThrow();
    assertEquals("arith", meaning.theory(), "Theory");
    assertEquals(
        BigInteger.valueOf(5), meaning.numeralValue().orElseThrow().bigIntegerValue(), "Value");
    assertEquals("x", builder.graph().variableNames(2).get(0).name(), "Variable name");
    assertEquals("?0", builder.graph().node(1).label(), "Variables are labelled by index");
    assertEquals(TermKind.QUANT, builder.graph().node(2).kind(), "Quantifier node");
  }

  @Test
  void randomTracesStayAcyclicAndDeduplicated() {
    Random random = new Random(17);
    TermGraphBuilder builder = new TermGraphBuilder();
    int rejected = 0;
    for (int line = 1; line <= 2_000; line++) {
      int ident = random.nextInt(64);
      StringBuilder text = new StringBuilder("[mk-app] #").append(ident).append(" f");
      int arity = random.nextInt(3);
      for (int i = 0; i < arity; i++) {
        text.append(" #").append(random.nextInt(64));
      }
      try {
        ingest(builder, line, text.toString());
      } catch (GraphIntegrityException ex) {
        rejected++;
      }
    }
    TermGraph graph = builder.graph();
    assertTrue(rejected > 0, "Some lines reference unknown or defining terms");
    assertTrue(graph.nodeCount() <= builder.creationEvents(), "Never more nodes than events");
    Set<StructuralKey> keys = new HashSet<>();
    for (int id = 0; id < graph.nodeCount(); id++) {
      TermNode node = graph.node(id);
      assertTrue(keys.add(node.key()), "Shape of node " + id + " is unique");
      for (int argument : node.arguments()) {
        assertTrue(argument < id, "Arguments of node " + id + " were created before it");
      }
    }
  }

  private static GraphDelta ingest(TermGraphBuilder builder, long line, String text) {
    return builder.ingest(TraceLineParser.parse(line, text));
  }
}

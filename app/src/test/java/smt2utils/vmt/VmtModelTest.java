package smt2utils.vmt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import smt2utils.printer.SyntaxPrinter;
import smt2utils.testing.Fixtures;

final class VmtModelTest {

  @Test
  void readsStateVariablesActionsAndConditions() {
    VmtModel model = VmtModel.parse(Fixtures.read("counter.vmt"));
    assertEquals(1, model.stateVariables().size(), "One state variable");
    StateVariable counter = model.stateVariables().get(0);
    assertEquals("x", counter.currentName().name(), "Current copy");
    assertEquals("x.next", counter.nextName().name(), "Next-state copy");
    assertEquals(1, model.actions().size(), "One action");
    assertEquals("inc", model.actions().get(0).name().name(), "Action variable");
    assertEquals("(= x 0)", SyntaxPrinter.render(model.initialCondition()), "Initial condition");
    assertEquals("(< x 10)", SyntaxPrinter.render(model.propertyCondition()), "Property");
    assertTrue(model.describe().contains("TRANS: (= x.next"), "Listing shows the transition");
  }

  @Test
  void unrollsTransitionsStepByStep() {
    BmcProblem problem = VmtModel.parse(Fixtures.read("counter.vmt")).unroll(2);
    String expected =
        String.join(
            "\n",
            "(declare-fun x@0 () Int)",
            "(declare-fun inc@0 () Bool)",
            "(declare-fun x@1 () Int)",
            "(declare-fun inc@1 () Bool)",
            "(declare-fun x@2 () Int)",
            "(declare-fun inc@2 () Bool)",
            "(assert (= x@0 0))",
            "(assert (= x@1 (ite inc@0 (+ x@0 1) x@0)))",
            "(assert (= x@2 (ite inc@1 (+ x@1 1) x@1)))",
            "(assert (not (< x@2 10)))");
    assertEquals(expected, problem.toSmtLib2(), "Two unrolled steps");
    assertEquals(2, problem.steps(), "Steps are the number of transitions");
  }

  @Test
  void zeroStepsChecksTheInitialStates() {
    BmcProblem problem = VmtModel.parse(Fixtures.read("counter.vmt")).unroll(0);
    assertEquals(0, problem.steps(), "No transitions");
    assertEquals(
        "(assert (not (< x@0 10)))",
        SyntaxPrinter.render(problem.commands().get(problem.commands().size() - 1)),
        "Property at step 0");
  }

  @Test
  void rejectsMalformedModels() {
    assertThrows(
        IllegalArgumentException.class,
        () -> VmtModel.parse("(declare-fun x () Int) (check-sat)"),
        "Too few commands");
    assertThrows(
        IllegalArgumentException.class,
        () ->
            VmtModel.parse(
                "(declare-fun x () Int)\n"
                    + "(define-fun .t () Bool (! true :trans true))\n"
                    + "(define-fun .i () Bool (! true :init true))\n"
                    + "(define-fun .p () Bool (! true :invar-property 0))"),
        "Init and trans out of order");
    assertThrows(
        IllegalArgumentException.class,
        () ->
            VmtModel.parse(
                "(assert true)\n"
                    + "(define-fun .i () Bool (! true :init true))\n"
                    + "(define-fun .t () Bool (! true :trans true))\n"
                    + "(define-fun .p () Bool (! true :invar-property 0))"),
        "Assertions are not part of a model");
    assertThrows(
        IllegalArgumentException.class,
        () -> VmtModel.parse(Fixtures.read("counter.vmt")).unroll(-1),
        "Negative length");
  }
}

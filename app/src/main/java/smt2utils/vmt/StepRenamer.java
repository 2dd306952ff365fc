package smt2utils.vmt;

import java.util.Map;
import java.util.Set;
import smt2utils.model.Symbol;
import smt2utils.printer.TermRewriter;

/**
 * Renames the variables of a transition system to their copy at one unrolling step: a current
 * variable {@code x} becomes {@code x@step}, a next-state variable becomes {@code x@(step+1)}
 * where {@code x} is its current counterpart. Other symbols are left alone.
 */
final class StepRenamer extends TermRewriter {
  private final Set<String> currentNames;
  private final Map<String, String> nextToCurrent;
  private final int step;

  StepRenamer(Set<String> currentNames, Map<String, String> nextToCurrent, int step) {
    this.currentNames = currentNames;
    this.nextToCurrent = nextToCurrent;
    this.step = step;
  }

  static String stepName(String name, int step) {
    return name + "@" + step;
  }

  @Override
  protected Symbol rewriteSymbol(Symbol symbol) {
    if (currentNames.contains(symbol.name())) {
      return symbol.withName(stepName(symbol.name(), step));
    }
    String current = nextToCurrent.get(symbol.name());
    if (current != null) {
      return symbol.withName(stepName(current, step + 1));
    }
    return symbol;
  }
}

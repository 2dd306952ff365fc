package smt2utils.sexpr;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** Renders S-expressions with single spaces, using an explicit work stack instead of recursion. */
public final class SExprPrinter {
  private static final Object CLOSE = new Object();
  private static final Object SPACE = new Object();

  private SExprPrinter() {}

  public static String render(SExpr expr) {
    StringBuilder out = new StringBuilder();
    append(out, expr);
    return out.toString();
  }

  public static void append(StringBuilder out, SExpr expr) {
    Deque<Object> work = new ArrayDeque<>();
    work.push(expr);
    while (!work.isEmpty()) {
      Object item = work.pop();
      if (item == CLOSE) {
        out.append(')');
      } else if (item == SPACE) {
        out.append(' ');
      } else if (item instanceof SExpr.ListExpr list) {
        out.append('(');
        work.push(CLOSE);
        List<SExpr> elements = list.elements();
        for (int i = elements.size() - 1; i >= 0; i--) {
          work.push(elements.get(i));
          if (i > 0) {
            work.push(SPACE);
          }
        }
      } else {
        out.append(item);
      }
    }
  }
}

package smt2utils.concrete;

import java.util.List;
import java.util.Objects;
import smt2utils.model.Constant;

/** SMT-LIB-2 term. Variants are immutable records dispatched through {@link TermVisitor}. */
public interface Term {

  <R> R accept(TermVisitor<R> visitor);

  record ConstantTerm(Constant constant) implements Term {
    public ConstantTerm {
      Objects.requireNonNull(constant, "constant");
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visitConstant(this);
    }
  }

  record IdentifierTerm(QualIdentifier identifier) implements Term {
    public IdentifierTerm {
      Objects.requireNonNull(identifier, "identifier");
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visitIdentifier(this);
    }
  }

  record Application(QualIdentifier function, List<Term> arguments) implements Term {
    public Application {
      Objects.requireNonNull(function, "function");
      arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
      if (arguments.isEmpty()) {
        throw new IllegalArgumentException("An application needs at least one argument");
      }
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visitApplication(this);
    }
  }

  record Let(List<VarBinding> bindings, Term body) implements Term {
    public Let {
      bindings = List.copyOf(Objects.requireNonNull(bindings, "bindings"));
      Objects.requireNonNull(body, "body");
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visitLet(this);
    }
  }

  record Forall(List<SortedVar> variables, Term body) implements Term {
    public Forall {
      variables = List.copyOf(Objects.requireNonNull(variables, "variables"));
      Objects.requireNonNull(body, "body");
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visitForall(this);
    }
  }

  record Exists(List<SortedVar> variables, Term body) implements Term {
    public Exists {
      variables = List.copyOf(Objects.requireNonNull(variables, "variables"));
      Objects.requireNonNull(body, "body");
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visitExists(this);
    }
  }

  record Match(Term scrutinee, List<MatchCase> cases) implements Term {
    public Match {
      Objects.requireNonNull(scrutinee, "scrutinee");
      cases = List.copyOf(Objects.requireNonNull(cases, "cases"));
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visitMatch(this);
    }
  }

  /** {@code (! term :named a ...)}. */
  record Annotated(Term term, List<Attribute> attributes) implements Term {
    public Annotated {
      Objects.requireNonNull(term, "term");
      attributes = List.copyOf(Objects.requireNonNull(attributes, "attributes"));
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visitAnnotated(this);
    }
  }
}

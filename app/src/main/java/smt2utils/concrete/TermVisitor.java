package smt2utils.concrete;

/** Double dispatch over {@link Term} variants. */
public interface TermVisitor<R> {

  R visitConstant(Term.ConstantTerm term);

  R visitIdentifier(Term.IdentifierTerm term);

  R visitApplication(Term.Application term);

  R visitLet(Term.Let term);

  R visitForall(Term.Forall term);

  R visitExists(Term.Exists term);

  R visitMatch(Term.Match term);

  R visitAnnotated(Term.Annotated term);
}

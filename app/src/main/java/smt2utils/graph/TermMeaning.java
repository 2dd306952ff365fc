package smt2utils.graph;

import java.util.Objects;
import java.util.Optional;
import smt2utils.model.NumeralLiteral;

/** Theory interpretation attached to a term, such as an arithmetic constant. */
public record TermMeaning(String theory, String payload, NumeralLiteral numeral) {

  public TermMeaning {
    Objects.requireNonNull(theory, "theory");
    Objects.requireNonNull(payload, "payload");
  }

  public Optional<NumeralLiteral> numeralValue() {
    return Optional.ofNullable(numeral);
  }
}

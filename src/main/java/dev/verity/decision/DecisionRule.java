package dev.verity.decision;

import dev.verity.scoring.ReasonCode;
import java.util.List;
import java.util.Optional;

/** One entry of the final decision cascade. */
interface DecisionRule {

  /** Returns the rule's decision and reasons if it fires, empty otherwise. */
  Optional<Fired> evaluate(DecisionInput input);

  record Fired(Decision decision, List<ReasonCode> reasons) {

    public Fired {
      reasons = List.copyOf(reasons);
    }

    static Fired of(Decision decision, ReasonCode reason) {
      return new Fired(decision, List.of(reason));
    }
  }
}

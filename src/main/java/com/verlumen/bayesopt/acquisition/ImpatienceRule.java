package com.verlumen.bayesopt.acquisition;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * Switches away from EIPS once enough distinct parameter sets have been scored. The replacement
 * name is resolved lazily so that validation can report an unknown name with the other
 * configuration errors.
 */
@AutoValue
public abstract class ImpatienceRule {
  public static ImpatienceRule create(String replacement, int rounds) {
    checkArgument(rounds > 0, "Impatience rounds must be positive: %s", rounds);
    return new AutoValue_ImpatienceRule(replacement, rounds);
  }

  /** Never switches. */
  public static ImpatienceRule never() {
    return create(AcquisitionFunction.UCB.shortName(), Integer.MAX_VALUE);
  }

  public abstract String replacement();

  /** Number of distinct scored parameter sets at which the switch happens. */
  public abstract int rounds();

  public AcquisitionFunction replacementFunction() {
    return AcquisitionFunction.fromName(replacement());
  }

  /** Returns the function to use for the next round. Only EIPS is ever replaced. */
  public AcquisitionFunction apply(AcquisitionFunction current, int distinctObservations) {
    if (current != AcquisitionFunction.EIPS || distinctObservations < rounds()) {
      return current;
    }
    AcquisitionFunction replacement = replacementFunction();
    return replacement == AcquisitionFunction.EIPS ? current : replacement;
  }
}

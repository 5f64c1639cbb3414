package com.verlumen.bayesopt.surrogate;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Closed set of stationary covariance families supported by the surrogate. */
public enum KernelKind {
  GAUSSIAN("Gaussian") {
    @Override
    double correlation(double weightedSquaredDistance) {
      return Math.exp(-weightedSquaredDistance);
    }
  },
  EXPONENTIAL("Exponential") {
    @Override
    double correlation(double weightedSquaredDistance) {
      return Math.exp(-Math.sqrt(weightedSquaredDistance));
    }
  },
  MATERN32("Matern32") {
    @Override
    double correlation(double weightedSquaredDistance) {
      double r = Math.sqrt(3.0 * weightedSquaredDistance);
      return (1.0 + r) * Math.exp(-r);
    }
  },
  MATERN52("Matern52") {
    @Override
    double correlation(double weightedSquaredDistance) {
      double r = Math.sqrt(5.0 * weightedSquaredDistance);
      return (1.0 + r + r * r / 3.0) * Math.exp(-r);
    }
  };

  private final String displayName;

  KernelKind(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Correlation between two points given {@code theta * ||x - y||^2}. Equals 1 at distance 0 and
   * decreases monotonically towards 0.
   */
  abstract double correlation(double weightedSquaredDistance);

  public String displayName() {
    return displayName;
  }

  /** Resolves a kernel by its display name, ignoring case. */
  public static KernelKind fromName(String name) {
    checkNotNull(name, "Kernel name cannot be null");
    for (KernelKind kind : values()) {
      if (kind.displayName.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name)) {
        return kind;
      }
    }
    throw new IllegalArgumentException(
        "Kernel not recognized: "
            + name
            + ". Expected one of "
            + Arrays.stream(values())
                .map(KernelKind::displayName)
                .collect(Collectors.joining(", ")));
  }
}

package com.verlumen.bayesopt.surrogate;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class KernelTest {
  private static final double[] ORIGIN = {0.0, 0.0};

  @Test
  public void correlation_samePoint_isOne() {
    for (KernelKind kind : KernelKind.values()) {
      assertThat(Kernel.create(kind, 0.0).correlation(ORIGIN, ORIGIN)).isWithin(1e-12).of(1.0);
    }
  }

  @Test
  public void correlation_decreasesWithDistance() {
    for (KernelKind kind : KernelKind.values()) {
      Kernel kernel = Kernel.create(kind, 0.0);
      double near = kernel.correlation(ORIGIN, new double[] {0.1, 0.0});
      double far = kernel.correlation(ORIGIN, new double[] {0.5, 0.5});

      assertThat(near).isLessThan(1.0);
      assertThat(far).isLessThan(near);
      assertThat(far).isGreaterThan(0.0);
    }
  }

  @Test
  public void correlation_largerBeta_decaysFaster() {
    double[] point = {0.3, 0.0};

    assertThat(Kernel.matern52().withBeta(1.0).correlation(ORIGIN, point))
        .isLessThan(Kernel.matern52().correlation(ORIGIN, point));
  }

  @Test
  public void gaussian_matchesClosedForm() {
    Kernel kernel = Kernel.create(KernelKind.GAUSSIAN, 1.0);

    assertThat(kernel.correlation(ORIGIN, new double[] {0.1, 0.2}))
        .isWithin(1e-12)
        .of(Math.exp(-10 * 0.05));
  }

  @Test
  public void fromName_ignoresCase() {
    assertThat(KernelKind.fromName("matern52")).isEqualTo(KernelKind.MATERN52);
    assertThat(KernelKind.fromName("Gaussian")).isEqualTo(KernelKind.GAUSSIAN);
  }

  @Test
  public void fromName_unknown_throws() {
    assertThrows(IllegalArgumentException.class, () -> KernelKind.fromName("cubic"));
  }

  @Test
  public void create_nonFiniteBeta_throws() {
    assertThrows(
        IllegalArgumentException.class, () -> Kernel.create(KernelKind.MATERN32, Double.NaN));
  }
}

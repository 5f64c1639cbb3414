package com.verlumen.bayesopt.space;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParameterSpecTest {
  @Test
  public void integer_storesBoundsAsDoubles() {
    ParameterSpec spec = ParameterSpec.integer("depth", 2, 10);

    assertThat(spec.lower()).isEqualTo(2.0);
    assertThat(spec.upper()).isEqualTo(10.0);
    assertThat(spec.kind()).isEqualTo(ParameterKind.INTEGER);
    assertThat(spec.range()).isEqualTo(8.0);
  }

  @Test
  public void contains_includesBothEnds() {
    ParameterSpec spec = ParameterSpec.continuous("x", -1, 1);

    assertThat(spec.contains(-1)).isTrue();
    assertThat(spec.contains(1)).isTrue();
    assertThat(spec.contains(1.0001)).isFalse();
  }

  @Test
  public void create_upperNotAboveLower_throws() {
    assertThrows(IllegalArgumentException.class, () -> ParameterSpec.continuous("x", 1, 1));
  }

  @Test
  public void create_emptyName_throws() {
    assertThrows(IllegalArgumentException.class, () -> ParameterSpec.continuous("", 0, 1));
  }

  @Test
  public void create_infiniteBound_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ParameterSpec.continuous("x", 0, Double.POSITIVE_INFINITY));
  }
}

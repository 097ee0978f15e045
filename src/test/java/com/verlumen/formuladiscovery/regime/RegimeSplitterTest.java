package com.verlumen.formuladiscovery.regime;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.formuladiscovery.features.TrainingExample;
import com.verlumen.formuladiscovery.features.TrainingInputs;
import java.time.LocalDate;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RegimeSplitterTest {
  private static final ImmutableList<RegimeRange> RANGES = RegimeSplitter.defaultRegimeRanges();
  private static final RegimeRange BEAR = RANGES.get(0);
  private static final RegimeRange NEUTRAL = RANGES.get(1);
  private static final RegimeRange BULL = RANGES.get(2);

  @Test
  public void defaultRegimeRanges_coverMinusOneToOne() {
    assertThat(RANGES)
        .containsExactly(
            new RegimeRange(-1.0, -0.3, "bear"),
            new RegimeRange(-0.3, 0.3, "neutral"),
            new RegimeRange(0.3, 1.0, "bull"))
        .inOrder();
  }

  @Test
  public void splitByRegime_boundaryScores_goToUpperRange() {
    // Arrange
    TrainingExample atMinusOne = example(-1.0);
    TrainingExample atMinusPointThree = example(-0.3);
    TrainingExample atPointThree = example(0.3);
    TrainingExample atOne = example(1.0);

    // Act
    ImmutableMap<RegimeRange, ImmutableList<TrainingExample>> buckets =
        RegimeSplitter.splitByRegime(
            ImmutableList.of(atMinusOne, atMinusPointThree, atPointThree, atOne), RANGES);

    // Assert
    assertThat(buckets.get(BEAR)).containsExactly(atMinusOne);
    assertThat(buckets.get(NEUTRAL)).containsExactly(atMinusPointThree);
    assertThat(buckets.get(BULL)).containsExactly(atPointThree, atOne).inOrder();
  }

  @Test
  public void splitByRegime_outOfRangeScores_areDropped() {
    ImmutableMap<RegimeRange, ImmutableList<TrainingExample>> buckets =
        RegimeSplitter.splitByRegime(ImmutableList.of(example(-1.5), example(1.2)), RANGES);

    assertThat(buckets.keySet()).containsExactly(BEAR, NEUTRAL, BULL).inOrder();
    assertThat(buckets.values().stream().allMatch(ImmutableList::isEmpty)).isTrue();
  }

  @Test
  public void classify_usesHalfOpenRangesExceptLast() {
    assertThat(RegimeSplitter.classify(-0.31, RANGES)).hasValue(BEAR);
    assertThat(RegimeSplitter.classify(0.0, RANGES)).hasValue(NEUTRAL);
    assertThat(RegimeSplitter.classify(1.0, RANGES)).hasValue(BULL);
    assertThat(RegimeSplitter.classify(1.01, RANGES)).isEmpty();
  }

  @Test
  public void filterByRegimeRange_includesBothBounds() {
    TrainingExample low = example(-0.3);
    TrainingExample high = example(0.3);
    TrainingExample outside = example(0.31);

    ImmutableList<TrainingExample> filtered =
        RegimeSplitter.filterByRegimeRange(ImmutableList.of(low, high, outside), -0.3, 0.3);

    assertThat(filtered).containsExactly(low, high).inOrder();
  }

  @Test
  public void regimeRange_minNotBelowMax_throwsIllegalArgumentException() {
    assertThrows(IllegalArgumentException.class, () -> RegimeRange.create(0.5, 0.5, "flat"));
  }

  private static TrainingExample example(double regimeScore) {
    return TrainingExample.create(
        "SPY",
        LocalDate.of(2023, 1, 31),
        LocalDate.of(2023, 7, 31),
        TrainingInputs.builder().setRegimeScore(regimeScore).build(),
        0.0);
  }
}

package com.verlumen.formuladiscovery.discovery;

import static com.google.common.truth.Truth.assertThat;

import com.verlumen.formuladiscovery.features.Feature;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FormulaTypeTest {
  @Test
  public void defaultVariables_scoring_listsScoreGroupsThenRegime() {
    assertThat(FormulaType.SCORING.defaultVariables())
        .containsExactly(
            "long_term",
            "fundamentals",
            "dividends",
            "opportunity",
            "short_term",
            "technicals",
            "opinion",
            "diversification",
            "total_score",
            "regime")
        .inOrder();
  }

  @Test
  public void defaultVariables_expectedReturn_listsEveryFeature() {
    assertThat(FormulaType.EXPECTED_RETURN.defaultVariables())
        .isEqualTo(Feature.allVariableNames());
  }

  @Test
  public void fromString_mixedCaseWithWhitespace_parses() {
    assertThat(FormulaType.fromString(" Scoring ")).isEqualTo(FormulaType.SCORING);
    assertThat(FormulaType.SCORING.wireName()).isEqualTo("scoring");
  }
}

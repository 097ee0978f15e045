package com.verlumen.formuladiscovery.parser;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.verlumen.formuladiscovery.formula.Node;
import com.verlumen.formuladiscovery.formula.Operation;
import com.verlumen.formuladiscovery.formula.Operator;
import com.verlumen.formuladiscovery.formula.Variable;
import com.verlumen.formuladiscovery.parser.FormulaParseException.ErrorKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FormulaParserTest {
  private static final double TOLERANCE = 1e-9;

  @Test
  public void parse_weightedSum_evaluatesWithPrecedence() throws Exception {
    // Act
    Node formula = FormulaParser.parse("cagr * 0.3 + stability * 0.2");

    // Assert
    assertThat(formula.toString()).isEqualTo("((cagr * 0.300000) + (stability * 0.200000))");
    assertThat(formula.evaluate(ImmutableMap.of("cagr", 0.1, "stability", 0.5)))
        .isWithin(TOLERANCE)
        .of(0.13);
  }

  @Test
  public void parse_arithmetic_followsPrecedenceAndAssociativity() throws Exception {
    assertThat(evaluate("2 + 3 * 4")).isWithin(TOLERANCE).of(14.0);
    assertThat(evaluate("(2 + 3) * 4")).isWithin(TOLERANCE).of(20.0);
    assertThat(evaluate("10 - 4 - 3")).isWithin(TOLERANCE).of(3.0);
    assertThat(evaluate("2 ** 3 ** 2")).isWithin(TOLERANCE).of(512.0);
    assertThat(evaluate("8 / 4 / 2")).isWithin(TOLERANCE).of(1.0);
  }

  @Test
  public void parse_subtractionWithoutSpaces_isNotASignedNumber() throws Exception {
    assertThat(evaluate("2-1")).isWithin(TOLERANCE).of(1.0);
  }

  @Test
  public void parse_scientificNotation_parsesExponent() throws Exception {
    assertThat(evaluate("1.5e-3 * 1000")).isWithin(TOLERANCE).of(1.5);
    assertThat(evaluate("2E+2")).isWithin(TOLERANCE).of(200.0);
  }

  @Test
  public void parse_unaryMinus_buildsNegation() throws Exception {
    Node formula = FormulaParser.parse("-cagr");

    assertThat(formula).isEqualTo(Operation.unary(Operator.NEGATE, Variable.of("cagr")));
    assertThat(formula.toString()).isEqualTo("-(cagr)");
  }

  @Test
  public void parse_functionCalls_mapToOperators() throws Exception {
    assertThat(evaluate("sqrt(16)")).isWithin(TOLERANCE).of(4.0);
    assertThat(evaluate("abs(-3)")).isWithin(TOLERANCE).of(3.0);
    assertThat(evaluate("log(1)")).isWithin(TOLERANCE).of(0.0);
    assertThat(evaluate("exp(0)")).isWithin(TOLERANCE).of(1.0);
    assertThat(evaluate("pow(2, 10)")).isWithin(TOLERANCE).of(1024.0);
    assertThat(evaluate("max(1, 2) + min(1, 2)")).isWithin(TOLERANCE).of(3.0);
  }

  @Test
  public void parse_renderedFormula_parsesBackToSameTree() throws Exception {
    // Arrange
    Node original =
        FormulaParser.parse("max(long_term, sqrt(total_score)) / (1 + volatility) - -(rsi)");

    // Act
    Node reparsed = FormulaParser.parse(original.toString());

    // Assert
    assertThat(reparsed).isEqualTo(original);
  }

  @Test
  public void parse_emptyInput_throwsEmptyInput() {
    assertThat(parseError("")).isEqualTo(ErrorKind.EMPTY_INPUT);
    assertThat(parseError("   ")).isEqualTo(ErrorKind.EMPTY_INPUT);
    assertThat(parseError(null)).isEqualTo(ErrorKind.EMPTY_INPUT);
  }

  @Test
  public void parse_malformedNumber_throwsMalformedNumber() {
    assertThat(parseError("1.2.3 + cagr")).isEqualTo(ErrorKind.MALFORMED_NUMBER);
  }

  @Test
  public void parse_unbalancedParentheses_throwsUnmatchedParenthesis() {
    assertThat(parseError("(cagr + 1")).isEqualTo(ErrorKind.UNMATCHED_PARENTHESIS);
    assertThat(parseError("cagr + 1)")).isEqualTo(ErrorKind.UNMATCHED_PARENTHESIS);
    assertThat(parseError("sqrt(cagr")).isEqualTo(ErrorKind.UNMATCHED_PARENTHESIS);
  }

  @Test
  public void parse_wrongArgumentCount_throwsWrongArgumentCount() {
    assertThat(parseError("sqrt(1, 2)")).isEqualTo(ErrorKind.WRONG_ARGUMENT_COUNT);
    assertThat(parseError("pow(2)")).isEqualTo(ErrorKind.WRONG_ARGUMENT_COUNT);
  }

  @Test
  public void parse_unknownFunction_throwsUnknownFunction() {
    assertThat(parseError("tanh(cagr)")).isEqualTo(ErrorKind.UNKNOWN_FUNCTION);
  }

  @Test
  public void parse_trailingTokens_throwsTrailingTokens() {
    assertThat(parseError("cagr 2")).isEqualTo(ErrorKind.TRAILING_TOKENS);
  }

  @Test
  public void parse_misplacedToken_throwsUnexpectedToken() {
    assertThat(parseError("* 2")).isEqualTo(ErrorKind.UNEXPECTED_TOKEN);
    assertThat(parseError("sqrt()")).isEqualTo(ErrorKind.UNEXPECTED_TOKEN);
  }

  @Test
  public void parse_danglingOperator_throwsUnexpectedEnd() {
    assertThat(parseError("cagr +")).isEqualTo(ErrorKind.UNEXPECTED_END);
  }

  @Test
  public void parse_unknownVariable_isAcceptedAndReadsAsZero() throws Exception {
    Node formula = FormulaParser.parse("stability + 1");

    assertThat(formula.evaluate(ImmutableMap.of())).isEqualTo(1.0);
  }

  @Test
  public void parseStrict_unknownVariable_throwsUnknownVariable() {
    FormulaParseException e =
        assertThrows(FormulaParseException.class, () -> FormulaParser.parseStrict("stability"));

    assertThat(e.kind()).isEqualTo(ErrorKind.UNKNOWN_VARIABLE);
    assertThat(e).hasMessageThat().contains("stability");
  }

  @Test
  public void parseStrict_knownVariables_parses() throws Exception {
    Node formula = FormulaParser.parseStrict("cagr * dividend_yield + regime");

    assertThat(formula.toString()).isEqualTo("((cagr * dividend_yield) + regime)");
  }

  private static double evaluate(String text) throws FormulaParseException {
    return FormulaParser.parse(text).evaluate(ImmutableMap.of());
  }

  private static ErrorKind parseError(String text) {
    return assertThrows(FormulaParseException.class, () -> FormulaParser.parse(text)).kind();
  }
}

package com.verlumen.formuladiscovery.parser;

import com.google.common.collect.ImmutableList;
import com.verlumen.formuladiscovery.formula.Constant;
import com.verlumen.formuladiscovery.formula.Node;
import com.verlumen.formuladiscovery.formula.Operation;
import com.verlumen.formuladiscovery.formula.Operator;
import com.verlumen.formuladiscovery.formula.Variable;
import com.verlumen.formuladiscovery.parser.FormulaParseException.ErrorKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for formula text.
 *
 * <p>Grammar, lowest precedence first:
 *
 * <pre>
 * expression     := additive
 * additive       := multiplicative (("+" | "-") multiplicative)*
 * multiplicative := power (("*" | "/") power)*
 * power          := unary ("**" power)?
 * unary          := "-" unary | primary
 * primary        := NUMBER | IDENTIFIER | IDENTIFIER "(" expression ("," expression)* ")"
 *                 | "(" expression ")"
 * </pre>
 *
 * <p>Calls map to fixed operators: {@code sqrt}, {@code log}, {@code exp} and {@code abs} take
 * one argument; {@code pow}, {@code max} and {@code min} take two.
 */
public final class FormulaParser {
  private final ImmutableList<Token> tokens;
  private final boolean strict;
  private int position;

  private FormulaParser(ImmutableList<Token> tokens, boolean strict) {
    this.tokens = tokens;
    this.strict = strict;
  }

  /**
   * Parses formula text. Any identifier that is not a call is accepted as a variable; names that
   * are not recognized features evaluate to {@code 0.0}.
   *
   * @throws FormulaParseException if the text is not a single well-formed expression
   */
  public static Node parse(String text) throws FormulaParseException {
    return parse(text, false);
  }

  /**
   * Parses formula text, rejecting variables that are not recognized feature names with {@link
   * ErrorKind#UNKNOWN_VARIABLE}.
   */
  public static Node parseStrict(String text) throws FormulaParseException {
    return parse(text, true);
  }

  private static Node parse(String text, boolean strict) throws FormulaParseException {
    if (text == null || text.trim().isEmpty()) {
      throw new FormulaParseException(ErrorKind.EMPTY_INPUT, "Empty formula string");
    }

    FormulaParser parser = new FormulaParser(Tokenizer.tokenize(text.trim()), strict);
    Node formula = parser.parseExpression();
    if (parser.hasMore()) {
      Token extra = parser.peek();
      if (extra.type() == TokenType.RIGHT_PAREN) {
        throw new FormulaParseException(
            ErrorKind.UNMATCHED_PARENTHESIS, "Unmatched ')' at position " + extra.position());
      }
      throw new FormulaParseException(
          ErrorKind.TRAILING_TOKENS,
          "Unexpected token '" + extra.text() + "' at position " + extra.position());
    }
    return formula;
  }

  private Node parseExpression() throws FormulaParseException {
    return parseAdditive();
  }

  private Node parseAdditive() throws FormulaParseException {
    Node left = parseMultiplicative();
    while (hasMore()) {
      TokenType type = peek().type();
      if (type == TokenType.PLUS) {
        position++;
        left = Operation.binary(Operator.ADD, left, parseMultiplicative());
      } else if (type == TokenType.MINUS) {
        position++;
        left = Operation.binary(Operator.SUBTRACT, left, parseMultiplicative());
      } else {
        break;
      }
    }
    return left;
  }

  private Node parseMultiplicative() throws FormulaParseException {
    Node left = parsePower();
    while (hasMore()) {
      TokenType type = peek().type();
      if (type == TokenType.MULTIPLY) {
        position++;
        left = Operation.binary(Operator.MULTIPLY, left, parsePower());
      } else if (type == TokenType.DIVIDE) {
        position++;
        left = Operation.binary(Operator.DIVIDE, left, parsePower());
      } else {
        break;
      }
    }
    return left;
  }

  private Node parsePower() throws FormulaParseException {
    Node base = parseUnary();
    if (hasMore() && peek().type() == TokenType.POWER) {
      position++;
      return Operation.binary(Operator.POWER, base, parsePower());
    }
    return base;
  }

  private Node parseUnary() throws FormulaParseException {
    if (!hasMore()) {
      throw new FormulaParseException(ErrorKind.UNEXPECTED_END, "Unexpected end of expression");
    }
    if (peek().type() == TokenType.MINUS) {
      position++;
      return Operation.unary(Operator.NEGATE, parseUnary());
    }
    return parsePrimary();
  }

  private Node parsePrimary() throws FormulaParseException {
    if (!hasMore()) {
      throw new FormulaParseException(ErrorKind.UNEXPECTED_END, "Unexpected end of expression");
    }

    Token token = tokens.get(position++);
    switch (token.type()) {
      case NUMBER:
        return parseNumber(token);
      case IDENTIFIER:
        if (hasMore() && peek().type() == TokenType.LEFT_PAREN) {
          position++;
          return parseCall(token);
        }
        return parseVariable(token);
      case LEFT_PAREN:
        Node inner = parseExpression();
        if (!hasMore() || peek().type() != TokenType.RIGHT_PAREN) {
          throw new FormulaParseException(
              ErrorKind.UNMATCHED_PARENTHESIS,
              "Expected ')' to close '(' at position " + token.position());
        }
        position++;
        return inner;
      default:
        throw new FormulaParseException(
            ErrorKind.UNEXPECTED_TOKEN,
            "Unexpected token '" + token.text() + "' at position " + token.position());
    }
  }

  private Node parseNumber(Token token) throws FormulaParseException {
    try {
      return Constant.of(Double.parseDouble(token.text()));
    } catch (NumberFormatException e) {
      throw new FormulaParseException(
          ErrorKind.MALFORMED_NUMBER,
          "Invalid number '" + token.text() + "' at position " + token.position(),
          e);
    }
  }

  private Node parseVariable(Token token) throws FormulaParseException {
    Variable variable = Variable.of(token.text());
    if (strict && !variable.isBound()) {
      throw new FormulaParseException(
          ErrorKind.UNKNOWN_VARIABLE,
          "Unknown variable '" + token.text() + "' at position " + token.position());
    }
    return variable;
  }

  private Node parseCall(Token name) throws FormulaParseException {
    List<Node> arguments = new ArrayList<>();
    while (true) {
      if (!hasMore()) {
        throw unclosedCall(name);
      }
      arguments.add(parseExpression());
      if (!hasMore()) {
        throw unclosedCall(name);
      }
      Token separator = tokens.get(position++);
      if (separator.type() == TokenType.RIGHT_PAREN) {
        break;
      }
      if (separator.type() != TokenType.COMMA) {
        throw new FormulaParseException(
            ErrorKind.UNEXPECTED_TOKEN,
            "Expected ',' or ')' in call to "
                + name.text()
                + " at position "
                + separator.position());
      }
    }

    switch (name.text()) {
      case "sqrt":
        return unaryCall(Operator.SQRT, name, arguments);
      case "log":
        return unaryCall(Operator.LOG, name, arguments);
      case "exp":
        return unaryCall(Operator.EXP, name, arguments);
      case "abs":
        return unaryCall(Operator.ABS, name, arguments);
      case "pow":
        return binaryCall(Operator.POWER, name, arguments);
      case "max":
        return binaryCall(Operator.MAX, name, arguments);
      case "min":
        return binaryCall(Operator.MIN, name, arguments);
      default:
        throw new FormulaParseException(
            ErrorKind.UNKNOWN_FUNCTION,
            "Unknown function '" + name.text() + "' at position " + name.position());
    }
  }

  private static Node unaryCall(Operator operator, Token name, List<Node> arguments)
      throws FormulaParseException {
    checkArgumentCount(name, arguments, 1);
    return Operation.unary(operator, arguments.get(0));
  }

  private static Node binaryCall(Operator operator, Token name, List<Node> arguments)
      throws FormulaParseException {
    checkArgumentCount(name, arguments, 2);
    return Operation.binary(operator, arguments.get(0), arguments.get(1));
  }

  private static void checkArgumentCount(Token name, List<Node> arguments, int expected)
      throws FormulaParseException {
    if (arguments.size() != expected) {
      throw new FormulaParseException(
          ErrorKind.WRONG_ARGUMENT_COUNT,
          String.format(
              "%s requires %d argument(s), got %d", name.text(), expected, arguments.size()));
    }
  }

  private static FormulaParseException unclosedCall(Token name) {
    return new FormulaParseException(
        ErrorKind.UNMATCHED_PARENTHESIS,
        "Unexpected end in call to " + name.text() + " at position " + name.position());
  }

  private boolean hasMore() {
    return position < tokens.size();
  }

  private Token peek() {
    return tokens.get(position);
  }
}

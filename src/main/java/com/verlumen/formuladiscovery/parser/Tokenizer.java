package com.verlumen.formuladiscovery.parser;

import com.google.common.collect.ImmutableList;

/**
 * Splits formula text into tokens.
 *
 * <p>Whitespace is skipped and characters that cannot start a token are dropped silently, so
 * {@code "cagr $ 2"} tokenizes like {@code "cagr 2"}. A number is a run of digits and dots with an
 * optional exponent; a sign belongs to a number only directly after {@code e} or {@code E}.
 * Malformed runs such as {@code 1.2.3} are still returned as one number token and rejected by the
 * parser.
 */
final class Tokenizer {

  static ImmutableList<Token> tokenize(String text) {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
        continue;
      }
      if (c == '*' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
        tokens.add(new Token(TokenType.POWER, "**", i));
        i += 2;
        continue;
      }

      TokenType single = singleCharacterType(c);
      if (single != null) {
        tokens.add(new Token(single, String.valueOf(c), i));
        i++;
      } else if (isDigit(c) || c == '.') {
        int end = scanNumber(text, i);
        tokens.add(new Token(TokenType.NUMBER, text.substring(i, end), i));
        i = end;
      } else if (isLetter(c)) {
        int end = i;
        while (end < text.length() && isIdentifierPart(text.charAt(end))) {
          end++;
        }
        tokens.add(new Token(TokenType.IDENTIFIER, text.substring(i, end), i));
        i = end;
      } else {
        i++;
      }
    }
    return tokens.build();
  }

  private static int scanNumber(String text, int start) {
    int i = start;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (isDigit(c) || c == '.') {
        i++;
      } else if (c == 'e' || c == 'E') {
        i++;
        if (i < text.length() && (text.charAt(i) == '+' || text.charAt(i) == '-')) {
          i++;
        }
      } else {
        break;
      }
    }
    return i;
  }

  private static TokenType singleCharacterType(char c) {
    switch (c) {
      case '+':
        return TokenType.PLUS;
      case '-':
        return TokenType.MINUS;
      case '*':
        return TokenType.MULTIPLY;
      case '/':
        return TokenType.DIVIDE;
      case '(':
        return TokenType.LEFT_PAREN;
      case ')':
        return TokenType.RIGHT_PAREN;
      case ',':
        return TokenType.COMMA;
      default:
        return null;
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierPart(char c) {
    return isLetter(c) || isDigit(c) || c == '_';
  }

  private static boolean isLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private Tokenizer() {}
}

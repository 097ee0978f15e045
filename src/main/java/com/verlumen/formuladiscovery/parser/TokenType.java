package com.verlumen.formuladiscovery.parser;

/** Lexical categories of formula text. */
enum TokenType {
  NUMBER,
  IDENTIFIER,
  PLUS,
  MINUS,
  MULTIPLY,
  DIVIDE,
  POWER,
  LEFT_PAREN,
  RIGHT_PAREN,
  COMMA
}

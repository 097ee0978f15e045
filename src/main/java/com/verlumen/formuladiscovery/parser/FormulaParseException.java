package com.verlumen.formuladiscovery.parser;

import static com.google.common.base.Preconditions.checkNotNull;

/** Thrown when formula text cannot be parsed. */
public final class FormulaParseException extends Exception {
  /** What went wrong. */
  public enum ErrorKind {
    EMPTY_INPUT,
    MALFORMED_NUMBER,
    UNMATCHED_PARENTHESIS,
    WRONG_ARGUMENT_COUNT,
    UNKNOWN_FUNCTION,
    UNKNOWN_VARIABLE,
    TRAILING_TOKENS,
    UNEXPECTED_TOKEN,
    UNEXPECTED_END
  }

  private final ErrorKind kind;

  FormulaParseException(ErrorKind kind, String message) {
    super(message);
    this.kind = checkNotNull(kind);
  }

  FormulaParseException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = checkNotNull(kind);
  }

  public ErrorKind kind() {
    return kind;
  }
}

package com.verlumen.formuladiscovery.parser;

/** A lexical token and the offset of its first character in the source text. */
record Token(TokenType type, String text, int position) {}

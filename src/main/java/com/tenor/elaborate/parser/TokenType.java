package com.tenor.elaborate.parser;

public enum TokenType {
    // Punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, COLON, DOT, STAR, ARROW,

    // Comparison
    EQUAL, BANG_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Logic and quantifiers
    AND, OR, NOT, FORALL, EXISTS, IN,

    // Literals
    WORD, STRING, INT, FLOAT,

    EOF
}

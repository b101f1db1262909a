package com.tenor.elaborate.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.tenor.elaborate.ElabError;
import com.tenor.elaborate.ElaborationException;

public class Lexer {
    private final String source;
    private final String file;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source, String file) {
        this.source = source;
        this.file = file;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '.': addToken(TokenType.DOT); break;
            case '*': addToken(TokenType.STAR); break;
            case '=': addToken(TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '!':
                if (match('=')) addToken(TokenType.BANG_EQUAL);
                else throw error("unexpected character '!'");
                break;
            case '-':
                if (match('>')) addToken(TokenType.ARROW);
                else if (isDigit(peek())) number();
                else throw error("unexpected character '-'");
                break;
            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    throw error("unexpected character '/'");
                }
                break;

            // Unicode operators
            case '→': addToken(TokenType.ARROW); break;
            case '∀': addToken(TokenType.FORALL); break;
            case '∃': addToken(TokenType.EXISTS); break;
            case '∈': addToken(TokenType.IN); break;
            case '∧': addToken(TokenType.AND); break;
            case '∨': addToken(TokenType.OR); break;
            case '¬': addToken(TokenType.NOT); break;
            case '≠': addToken(TokenType.BANG_EQUAL); break;
            case '≤': addToken(TokenType.LESS_EQUAL); break;
            case '≥': addToken(TokenType.GREATER_EQUAL); break;

            case ' ': case '\r': case '\t':
                break;
            case '\n':
                line++;
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) word();
                else throw error("unexpected character '" + c + "'");
        }
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (peek() == '\n') line++;
            advance();
        }
        throw error("unterminated block comment");
    }

    private void word() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(keywords.getOrDefault(text, TokenType.WORD), text);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
            String text = source.substring(start, current);
            addToken(TokenType.FLOAT, new BigDecimal(text));
            return;
        }
        String text = source.substring(start, current);
        try {
            addToken(TokenType.INT, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw error("invalid integer '" + text + "'");
        }
    }

    private void string() {
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (isAtEnd() || peek() == '\n') throw error("unterminated string literal");
            char c = advance();
            if (c == '"') break;
            if (c == '\\') {
                if (isAtEnd()) throw error("unterminated escape in string");
                char e = advance();
                switch (e) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case '"': sb.append('"'); break;
                    case '\\': sb.append('\\'); break;
                    default: sb.append('\\').append(e);
                }
            } else {
                sb.append(c);
            }
        }
        addToken(TokenType.STRING, sb.toString());
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return current + 1 >= source.length() ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) { return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_'; }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
    }

    private ElaborationException error(String msg) {
        return new ElaborationException(ElabError.lexical(file, line, msg));
    }
}

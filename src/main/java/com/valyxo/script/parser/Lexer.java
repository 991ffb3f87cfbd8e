package com.valyxo.script.parser;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tokenizes retained source lines. Each line is scanned on its own and followed by a NEWLINE
 * token, so statements never run across lines except inside braces.
 */
public class Lexer {
    private final List<SourceLine> lines;
    private final List<Token> tokens = new ArrayList<>();

    private String source;
    private int start = 0;
    private int current = 0;
    private int line = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("set", TokenType.SET);
        map.put("print", TokenType.PRINT);
        map.put("if", TokenType.IF);
        map.put("then", TokenType.THEN);
        map.put("else", TokenType.ELSE);
        map.put("for", TokenType.FOR);
        map.put("in", TokenType.IN);
        map.put("to", TokenType.TO);
        map.put("while", TokenType.WHILE);
        map.put("func", TokenType.FUNC);
        map.put("exit", TokenType.EXIT);
        map.put("vars", TokenType.VARS);
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        map.put("True", TokenType.TRUE);
        map.put("true", TokenType.TRUE);
        map.put("False", TokenType.FALSE);
        map.put("false", TokenType.FALSE);
        map.put("None", TokenType.NONE);
        map.put("none", TokenType.NONE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(List<SourceLine> lines) {
        this.lines = lines;
    }

    public Lexer(String text, int lineNumber) {
        this(Collections.singletonList(new SourceLine(lineNumber, text)));
    }

    public static boolean isKeyword(String word) {
        return keywords.containsKey(word);
    }

    public List<Token> tokenize() {
        for (SourceLine sl : lines) {
            source = sl.text;
            line = sl.number;
            start = 0;
            current = 0;
            while (!isAtEnd()) {
                start = current;
                scanToken();
            }
            tokens.add(new Token(TokenType.NEWLINE, "", null, line));
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
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '*':
                if (match('*')) addToken(TokenType.DOUBLE_STAR);
                else addToken(TokenType.STAR);
                break;
            case '/':
                if (match('/')) addToken(TokenType.DOUBLE_SLASH);
                else addToken(TokenType.SLASH);
                break;
            case '!':
                if (match('=')) addToken(TokenType.BANG_EQUAL);
                else throw error("Unexpected '!'", "Use 'not' for negation and '!=' for inequality");
                break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '#':
                // trailing comment
                current = source.length();
                break;
            case ' ': case '\r': case '\t':
                break;
            case '"':
            case '\'':
                string(c);
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c, null);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        boolean isFloat = false;
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int save = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (isDigit(peek())) {
                isFloat = true;
                while (isDigit(peek())) advance();
            } else {
                current = save;
            }
        }
        String text = source.substring(start, current);
        if (isFloat) addToken(TokenType.FLOAT, Double.parseDouble(text));
        else addToken(TokenType.INTEGER, new BigInteger(text));
    }

    private void string(char quote) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char e = advance();
                switch (e) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case '\\': sb.append('\\'); break;
                    case '"': sb.append('"'); break;
                    case '\'': sb.append('\''); break;
                    default: sb.append('\\').append(e);
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) throw error("Unterminated string", "Close the string with " + quote);
        advance();
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
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
    }

    private ScriptError error(String msg, String suggestion) {
        return new ScriptError(ErrorKind.SYNTAX_ERROR, line, source, msg, suggestion);
    }
}

package db.pesa.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import db.pesa.error.SqlSyntaxException;

/**
 * Hand-written SQL scanner. Keywords are case-insensitive; identifiers keep their case.
 * Supports single-quoted strings with '' as an escaped quote, double-quoted identifiers,
 * signed integer and decimal literals, and -- line comments.
 */
public class Tokenizer {
    static final Set<String> KEYWORDS = Set.of(
        "SELECT", "DISTINCT", "FROM", "WHERE", "INSERT", "INTO", "VALUES", "UPDATE", "SET", "DELETE",
        "CREATE", "DROP", "DATABASE", "DATABASES", "TABLE", "TABLES", "USE", "SHOW", "DESCRIBE",
        "PRIMARY", "KEY", "UNIQUE", "REFERENCES", "IF", "EXISTS",
        "AND", "OR", "NOT", "NULL", "IS", "IN", "LIKE", "BETWEEN", "TRUE", "FALSE",
        "INNER", "JOIN", "ON", "GROUP", "BY", "HAVING", "ORDER", "ASC", "DESC", "LIMIT", "OFFSET", "AS");

    private final String src;
    private int pos;

    public Tokenizer(String src) {
        if (src == null) throw new IllegalArgumentException("sql must not be null");
        this.src = src;
    }

    /** Tokenizes the whole input; the last token is always EOF. */
    public List<Token> tokenize() {
        List<Token> out = new ArrayList<>();
        pos = 0;
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= src.length()) {
                out.add(new Token(TokenType.EOF, "", pos));
                return out;
            }
            out.add(nextToken());
        }
    }

    private void skipWhitespaceAndComments() {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '-' && peek(1) == '-') {
                while (pos < src.length() && src.charAt(pos) != '\n') pos++;
            } else {
                return;
            }
        }
    }

    private Token nextToken() {
        int start = pos;
        char c = src.charAt(pos);
        if (Character.isLetter(c) || c == '_') return word(start);
        if (Character.isDigit(c) || (c == '-' && Character.isDigit(peek(1)))
                || (c == '.' && Character.isDigit(peek(1)))) {
            return number(start);
        }
        switch (c) {
            case '\'': return string(start);
            case '"': return quotedIdentifier(start);
            case ',': pos++; return new Token(TokenType.COMMA, ",", start);
            case '(': pos++; return new Token(TokenType.LPAREN, "(", start);
            case ')': pos++; return new Token(TokenType.RPAREN, ")", start);
            case ';': pos++; return new Token(TokenType.SEMICOLON, ";", start);
            case '*': pos++; return new Token(TokenType.STAR, "*", start);
            case '.': pos++; return new Token(TokenType.DOT, ".", start);
            case '=': pos++; return new Token(TokenType.EQUALS, "=", start);
            case '!':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.COMPARISON, "!=", start);
                }
                break;
            case '<':
                if (peek(1) == '=' || peek(1) == '>') {
                    pos += 2;
                    return new Token(TokenType.COMPARISON, src.substring(start, pos), start);
                }
                pos++;
                return new Token(TokenType.COMPARISON, "<", start);
            case '>':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.COMPARISON, ">=", start);
                }
                pos++;
                return new Token(TokenType.COMPARISON, ">", start);
            default:
                break;
        }
        throw new SqlSyntaxException("Unexpected character '" + c + "'", String.valueOf(c), start);
    }

    private Token word(int start) {
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
        String text = src.substring(start, pos);
        String upper = text.toUpperCase(Locale.ROOT);
        if (KEYWORDS.contains(upper)) return new Token(TokenType.KEYWORD, upper, start);
        return new Token(TokenType.IDENTIFIER, text, start);
    }

    private Token number(int start) {
        if (src.charAt(pos) == '-') pos++;
        boolean dot = false;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isDigit(c)) {
                pos++;
            } else if (c == '.' && !dot && Character.isDigit(peek(1))) {
                dot = true;
                pos++;
            } else {
                break;
            }
        }
        if (pos < src.length() && (Character.isLetter(src.charAt(pos)) || src.charAt(pos) == '_')) {
            throw new SqlSyntaxException("Malformed number '" + src.substring(start, pos + 1) + "'",
                src.substring(start, pos + 1), start);
        }
        return new Token(TokenType.NUMBER, src.substring(start, pos), start);
    }

    private Token string(int start) {
        StringBuilder sb = new StringBuilder();
        pos++; // opening quote
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\'') {
                if (peek(1) == '\'') {
                    sb.append('\'');
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            sb.append(c);
            pos++;
        }
        throw new SqlSyntaxException("Unterminated string literal", "'", start);
    }

    private Token quotedIdentifier(int start) {
        int end = src.indexOf('"', start + 1);
        if (end < 0) throw new SqlSyntaxException("Unterminated quoted identifier", "\"", start);
        if (end == start + 1) throw new SqlSyntaxException("Empty quoted identifier", "\"\"", start);
        pos = end + 1;
        return new Token(TokenType.IDENTIFIER, src.substring(start + 1, end), start);
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < src.length() ? src.charAt(i) : '\0';
    }
}

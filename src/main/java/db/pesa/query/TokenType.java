package db.pesa.query;

public enum TokenType {
    NUMBER,
    STRING,
    KEYWORD,
    IDENTIFIER,
    COMPARISON, // !=, <>, <, >, <=, >=
    EQUALS,
    COMMA,
    LPAREN,
    RPAREN,
    SEMICOLON,
    STAR,
    DOT,
    EOF;
}

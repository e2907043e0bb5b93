package db.pesa.query;

// Lexical unit. text is upper-cased for keywords, unquoted for strings; position is the
// 0-based offset of the first character in the source.
public record Token(TokenType type, String text, int position) {

    public boolean is(TokenType t) { return type == t; }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}

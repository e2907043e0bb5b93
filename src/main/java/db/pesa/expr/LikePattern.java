package db.pesa.expr;

import java.util.regex.Pattern;

/**
 * SQL LIKE pattern compiled once: '%' is any sequence, '_' any single character, everything else
 * literal. Matching is anchored at both ends and case-insensitive.
 */
public final class LikePattern {
    private final String source;
    private final Pattern regex;

    public LikePattern(String source) {
        this.source = source;
        StringBuilder sb = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < source.length(); i++) {
            char ch = source.charAt(i);
            if (ch == '%' || ch == '_') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(ch == '%' ? ".*" : ".");
            } else {
                literal.append(ch);
            }
        }
        if (literal.length() > 0) sb.append(Pattern.quote(literal.toString()));
        this.regex = Pattern.compile(sb.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    public boolean matches(String text) {
        return regex.matcher(text).matches();
    }

    public String source() { return source; }

    @Override
    public boolean equals(Object o) {
        return o instanceof LikePattern p && source.equals(p.source);
    }

    @Override
    public int hashCode() { return source.hashCode(); }

    @Override
    public String toString() { return "'" + source.replace("'", "''") + "'"; }
}

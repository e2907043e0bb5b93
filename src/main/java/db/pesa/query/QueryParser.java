package db.pesa.query;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import db.pesa.catalog.ColumnSchema;
import db.pesa.catalog.DataType;
import db.pesa.catalog.ForeignKey;
import db.pesa.catalog.TableSchema;
import db.pesa.error.InvalidSchemaException;
import db.pesa.error.SqlSyntaxException;
import db.pesa.error.UnsupportedFeatureException;
import db.pesa.expr.AggregateCall;
import db.pesa.expr.AggregateFunction;
import db.pesa.expr.And;
import db.pesa.expr.Between;
import db.pesa.expr.ColumnRef;
import db.pesa.expr.CompareOp;
import db.pesa.expr.Comparison;
import db.pesa.expr.Expression;
import db.pesa.expr.InList;
import db.pesa.expr.IsNull;
import db.pesa.expr.Like;
import db.pesa.expr.LikePattern;
import db.pesa.expr.Literal;
import db.pesa.expr.Not;
import db.pesa.expr.Or;

/**
 * Recursive-descent SQL parser, one method per production.
 * <pre>
 *   statement := select | insert | update | delete
 *              | CREATE DATABASE name | CREATE TABLE [IF NOT EXISTS] name ( element, ... )
 *              | DROP DATABASE name | DROP TABLE [IF EXISTS] name
 *              | USE name | SHOW DATABASES | SHOW TABLES | (DESCRIBE | DESC) name
 *   select    := SELECT [DISTINCT] (* | item, ...) FROM name [[INNER] JOIN name ON expr]
 *                [WHERE expr] [GROUP BY column, ...] [HAVING expr]
 *                [ORDER BY key [ASC | DESC], ...] [LIMIT n] [OFFSET n]
 *   expr      := and {OR and};  and := not {AND not};  not := NOT not | ( expr ) | predicate
 *   predicate := operand [op operand | IS [NOT] NULL | [NOT] BETWEEN operand AND operand
 *                         | [NOT] IN ( operand, ... ) | [NOT] LIKE 'pattern']
 *   operand   := literal | column | aggregate
 * </pre>
 * Not thread-safe: one parse at a time per instance.
 */
public class QueryParser {
    private static final Set<String> AGGREGATES = Set.of("COUNT", "SUM", "AVG", "MIN", "MAX");

    private List<Token> tokens;
    private int pos;

    /** Parses exactly one statement; a trailing semicolon is optional. */
    public Query parse(String sql) {
        tokens = new Tokenizer(sql).tokenize();
        pos = 0;
        if (peek().is(TokenType.EOF) || peek().is(TokenType.SEMICOLON)) {
            throw new SqlSyntaxException("Empty statement", "", peek().position());
        }
        Query q = statement();
        while (match(TokenType.SEMICOLON)) {
            // allow "stmt;;"
        }
        if (!peek().is(TokenType.EOF)) throw unexpected("end of statement");
        return q;
    }

    /** Parses every statement of a semicolon-separated script. */
    public List<Query> parseScript(String script) {
        List<Query> out = new ArrayList<>();
        for (String stmt : splitStatements(script)) out.add(parse(stmt));
        return out;
    }

    /**
     * Splits a script on top-level semicolons (semicolons inside string literals or comments do
     * not count). Blank statements are dropped.
     */
    public List<String> splitStatements(String script) {
        List<Token> all = new Tokenizer(script).tokenize();
        List<String> out = new ArrayList<>();
        int start = 0;
        for (Token t : all) {
            if (t.is(TokenType.SEMICOLON) || t.is(TokenType.EOF)) {
                int end = t.is(TokenType.EOF) ? script.length() : t.position();
                String stmt = script.substring(start, end).trim();
                if (!stmt.isEmpty() && new Tokenizer(stmt).tokenize().size() > 1) out.add(stmt);
                start = end + 1;
            }
        }
        return out;
    }

    // ---- statements ----

    private Query statement() {
        Token t = peek();
        if (t.is(TokenType.KEYWORD)) {
            switch (t.text()) {
                case "SELECT": return select();
                case "INSERT": return insert();
                case "UPDATE": return update();
                case "DELETE": return delete();
                case "CREATE": return create();
                case "DROP": return drop();
                case "USE":
                    advance();
                    return new UseQuery(identifier("database name"));
                case "SHOW": return show();
                case "DESCRIBE":
                case "DESC":
                    advance();
                    return new DescribeQuery(identifier("table name"));
                default:
                    break;
            }
        }
        throw unexpected("a statement (SELECT, INSERT, UPDATE, DELETE, CREATE, DROP, USE, SHOW, DESCRIBE)");
    }

    private Query create() {
        expectKeyword("CREATE");
        if (matchKeyword("DATABASE")) return new CreateDatabaseQuery(identifier("database name"));
        expectKeyword("TABLE");
        boolean ifNotExists = false;
        if (matchKeyword("IF")) {
            expectKeyword("NOT");
            expectKeyword("EXISTS");
            ifNotExists = true;
        }
        String name = identifier("table name");
        expect(TokenType.LPAREN, "'('");
        List<ColumnSchema> columns = new ArrayList<>();
        String tablePrimaryKey = null;
        do {
            if (peek().isKeyword("PRIMARY")) {
                advance();
                expectKeyword("KEY");
                expect(TokenType.LPAREN, "'('");
                Token keyToken = peek();
                String key = identifier("column name");
                expect(TokenType.RPAREN, "')'");
                if (tablePrimaryKey != null) {
                    throw new SqlSyntaxException("Duplicate PRIMARY KEY clause", key, keyToken.position());
                }
                tablePrimaryKey = key;
            } else {
                columns.add(columnDefinition());
            }
        } while (match(TokenType.COMMA));
        expect(TokenType.RPAREN, "',' or ')'");
        if (tablePrimaryKey != null) columns = applyTablePrimaryKey(name, columns, tablePrimaryKey);
        return new CreateTableQuery(new TableSchema(name, columns), ifNotExists);
    }

    private ColumnSchema columnDefinition() {
        String name = identifier("column name");
        Token typeToken = peek();
        String typeName = identifier("data type");
        DataType type;
        try {
            type = DataType.fromKeyword(typeName);
        } catch (IllegalArgumentException e) {
            throw new SqlSyntaxException("Unknown data type '" + typeName + "'", typeName, typeToken.position());
        }
        if (match(TokenType.LPAREN)) { // VARCHAR(50): length accepted and ignored
            expect(TokenType.NUMBER, "a length");
            expect(TokenType.RPAREN, "')'");
        }
        boolean primaryKey = false;
        boolean unique = false;
        ForeignKey references = null;
        while (true) {
            if (matchKeyword("PRIMARY")) {
                expectKeyword("KEY");
                primaryKey = true;
            } else if (matchKeyword("UNIQUE")) {
                unique = true;
            } else if (matchKeyword("REFERENCES")) {
                String table = identifier("referenced table");
                expect(TokenType.LPAREN, "'('");
                String column = identifier("referenced column");
                expect(TokenType.RPAREN, "')'");
                references = new ForeignKey(table, column);
            } else {
                break;
            }
        }
        return new ColumnSchema(name, type, primaryKey, unique, references);
    }

    private List<ColumnSchema> applyTablePrimaryKey(String table, List<ColumnSchema> columns, String key) {
        List<ColumnSchema> out = new ArrayList<>(columns.size());
        boolean found = false;
        for (ColumnSchema c : columns) {
            if (c.name().equals(key)) {
                found = true;
                out.add(new ColumnSchema(c.name(), c.type(), true, c.unique(), c.references()));
            } else {
                out.add(c);
            }
        }
        if (!found) throw new InvalidSchemaException("PRIMARY KEY column '" + key + "' is not defined in table '" + table + "'");
        return out;
    }

    private Query drop() {
        expectKeyword("DROP");
        if (matchKeyword("DATABASE")) return new DropDatabaseQuery(identifier("database name"));
        expectKeyword("TABLE");
        boolean ifExists = false;
        if (matchKeyword("IF")) {
            expectKeyword("EXISTS");
            ifExists = true;
        }
        return new DropTableQuery(identifier("table name"), ifExists);
    }

    private Query show() {
        expectKeyword("SHOW");
        if (matchKeyword("DATABASES")) return new ShowDatabasesQuery();
        if (matchKeyword("TABLES")) return new ShowTablesQuery();
        throw unexpected("DATABASES or TABLES");
    }

    private Query insert() {
        expectKeyword("INSERT");
        expectKeyword("INTO");
        String table = identifier("table name");
        List<String> columns = new ArrayList<>();
        if (match(TokenType.LPAREN)) {
            Set<String> seen = new HashSet<>();
            do {
                Token colToken = peek();
                String col = identifier("column name");
                if (!seen.add(col)) {
                    throw new SqlSyntaxException("Column '" + col + "' listed more than once", col, colToken.position());
                }
                columns.add(col);
            } while (match(TokenType.COMMA));
            expect(TokenType.RPAREN, "',' or ')'");
        }
        expectKeyword("VALUES");
        List<List<Object>> rows = new ArrayList<>();
        do {
            expect(TokenType.LPAREN, "'('");
            List<Object> values = new ArrayList<>();
            do {
                values.add(literalValue());
            } while (match(TokenType.COMMA));
            expect(TokenType.RPAREN, "',' or ')'");
            rows.add(values);
        } while (match(TokenType.COMMA));
        return new InsertQuery(table, columns, rows);
    }

    private Query update() {
        expectKeyword("UPDATE");
        String table = identifier("table name");
        expectKeyword("SET");
        List<Assignment> assignments = new ArrayList<>();
        do {
            String column = identifier("column name");
            expect(TokenType.EQUALS, "'='");
            assignments.add(new Assignment(column, literalValue()));
        } while (match(TokenType.COMMA));
        Expression where = matchKeyword("WHERE") ? expression() : null;
        return new UpdateQuery(table, assignments, where);
    }

    private Query delete() {
        expectKeyword("DELETE");
        expectKeyword("FROM");
        String table = identifier("table name");
        Expression where = matchKeyword("WHERE") ? expression() : null;
        return new DeleteQuery(table, where);
    }

    private Query select() {
        expectKeyword("SELECT");
        boolean distinct = matchKeyword("DISTINCT");
        List<SelectItem> items = new ArrayList<>();
        if (!match(TokenType.STAR)) {
            do {
                items.add(selectItem());
            } while (match(TokenType.COMMA));
        }
        expectKeyword("FROM");
        String table = identifier("table name");

        JoinSpec join = null;
        if (peek().isKeyword("INNER") || peek().isKeyword("JOIN")) {
            if (matchKeyword("INNER")) {
                if (!peek().isKeyword("JOIN")) throw unexpected("JOIN after INNER");
            }
            expectKeyword("JOIN");
            String right = identifier("table name");
            expectKeyword("ON");
            join = new JoinSpec(right, expression());
        }

        Expression where = matchKeyword("WHERE") ? expression() : null;

        List<ColumnRef> groupBy = new ArrayList<>();
        if (matchKeyword("GROUP")) {
            expectKeyword("BY");
            do {
                groupBy.add(columnRef());
            } while (match(TokenType.COMMA));
        }

        Expression having = matchKeyword("HAVING") ? expression() : null;

        List<OrderItem> orderBy = new ArrayList<>();
        if (matchKeyword("ORDER")) {
            expectKeyword("BY");
            do {
                Expression key = isAggregateStart() ? aggregate() : columnRef();
                boolean desc = false;
                if (matchKeyword("DESC")) desc = true;
                else matchKeyword("ASC");
                orderBy.add(new OrderItem(key, desc));
            } while (match(TokenType.COMMA));
        }

        // LIMIT and OFFSET in either order
        Long limit = null;
        Long offset = null;
        for (int i = 0; i < 2; i++) {
            if (limit == null && matchKeyword("LIMIT")) limit = count("LIMIT");
            else if (offset == null && matchKeyword("OFFSET")) offset = count("OFFSET");
        }
        return new SelectQuery(distinct, items, table, join, where, groupBy, having, orderBy, limit, offset);
    }

    private SelectItem selectItem() {
        Expression e = isAggregateStart() ? aggregate() : columnRef();
        String alias = null;
        if (matchKeyword("AS")) alias = identifier("alias");
        else if (peek().is(TokenType.IDENTIFIER)) alias = advance().text();
        return new SelectItem(e, alias);
    }

    private long count(String clause) {
        Token t = expect(TokenType.NUMBER, "a row count after " + clause);
        try {
            long n = Long.parseLong(t.text());
            if (n < 0) throw new SqlSyntaxException(clause + " must not be negative", t.text(), t.position());
            return n;
        } catch (NumberFormatException e) {
            throw new SqlSyntaxException(clause + " expects a whole number", t.text(), t.position());
        }
    }

    // ---- expressions ----

    private Expression expression() {
        Expression left = andExpression();
        while (matchKeyword("OR")) left = new Or(left, andExpression());
        return left;
    }

    private Expression andExpression() {
        Expression left = notExpression();
        while (matchKeyword("AND")) left = new And(left, notExpression());
        return left;
    }

    private Expression notExpression() {
        if (matchKeyword("NOT")) return new Not(notExpression());
        if (match(TokenType.LPAREN)) {
            Expression inner = expression();
            expect(TokenType.RPAREN, "')'");
            return inner;
        }
        return predicate();
    }

    private Expression predicate() {
        Expression left = operand();
        Token t = peek();
        if (t.is(TokenType.EQUALS) || t.is(TokenType.COMPARISON)) {
            advance();
            return new Comparison(CompareOp.fromSymbol(t.text()), left, operand());
        }
        if (matchKeyword("IS")) {
            boolean negated = matchKeyword("NOT");
            expectKeyword("NULL");
            return new IsNull(left, negated);
        }
        boolean negated = false;
        if (t.isKeyword("NOT")) {
            Token after = peek(1);
            if (after.isKeyword("BETWEEN") || after.isKeyword("IN") || after.isKeyword("LIKE")) {
                advance();
                negated = true;
            }
        }
        if (matchKeyword("BETWEEN")) {
            Expression low = operand();
            expectKeyword("AND");
            return new Between(left, low, operand(), negated);
        }
        if (matchKeyword("IN")) {
            expect(TokenType.LPAREN, "'('");
            List<Expression> values = new ArrayList<>();
            do {
                values.add(operand());
            } while (match(TokenType.COMMA));
            expect(TokenType.RPAREN, "',' or ')'");
            return new InList(left, values, negated);
        }
        if (matchKeyword("LIKE")) {
            Token pattern = expect(TokenType.STRING, "a quoted LIKE pattern");
            return new Like(left, new LikePattern(pattern.text()), negated);
        }
        return left; // bare operand, e.g. WHERE active
    }

    private Expression operand() {
        Token t = peek();
        if (t.is(TokenType.NUMBER) || t.is(TokenType.STRING) || t.isKeyword("TRUE") || t.isKeyword("FALSE")
                || t.isKeyword("NULL")) {
            return new Literal(literalValue());
        }
        if (isAggregateStart()) return aggregate();
        if (t.is(TokenType.IDENTIFIER)) return columnRef();
        throw unexpected("a column, literal or aggregate");
    }

    private boolean isAggregateStart() {
        return peek().is(TokenType.IDENTIFIER)
            && AGGREGATES.contains(peek().text().toUpperCase(Locale.ROOT))
            && peek(1).is(TokenType.LPAREN);
    }

    private AggregateCall aggregate() {
        Token name = advance();
        AggregateFunction fn = AggregateFunction.valueOf(name.text().toUpperCase(Locale.ROOT));
        expect(TokenType.LPAREN, "'('");
        Token t = peek();
        if (t.isKeyword("DISTINCT")) {
            throw new UnsupportedFeatureException(fn + "(DISTINCT ...) is not supported");
        }
        if (match(TokenType.STAR)) {
            if (fn != AggregateFunction.COUNT) {
                throw new SqlSyntaxException(fn + " requires a column argument", "*", t.position());
            }
            expect(TokenType.RPAREN, "')'");
            return AggregateCall.countStar();
        }
        if (!t.is(TokenType.IDENTIFIER)) {
            if (t.is(TokenType.RPAREN) || t.is(TokenType.EOF)) throw unexpected("an aggregate argument");
            throw new UnsupportedFeatureException("Only a plain column is supported as argument of " + fn);
        }
        ColumnRef arg = columnRef();
        Token close = peek();
        if (!close.is(TokenType.RPAREN)) {
            if (close.is(TokenType.COMMA) || close.is(TokenType.EOF) || close.is(TokenType.SEMICOLON)) {
                throw unexpected("')'");
            }
            throw new UnsupportedFeatureException("Expressions as aggregate arguments are not supported ("
                + fn + " at position " + name.position() + ")");
        }
        advance();
        return new AggregateCall(fn, arg);
    }

    private ColumnRef columnRef() {
        String first = identifier("column name");
        if (match(TokenType.DOT)) return new ColumnRef(first, identifier("column name after '.'"));
        return ColumnRef.of(first);
    }

    private Object literalValue() {
        Token t = advance();
        switch (t.type()) {
            case NUMBER:
                try {
                    if (t.text().contains(".")) return DataType.normalize(Double.parseDouble(t.text()));
                    return Long.parseLong(t.text());
                } catch (NumberFormatException e) {
                    throw new SqlSyntaxException("Numeric literal out of range", t.text(), t.position());
                }
            case STRING:
                return t.text();
            case KEYWORD:
                if (t.text().equals("TRUE")) return Boolean.TRUE;
                if (t.text().equals("FALSE")) return Boolean.FALSE;
                if (t.text().equals("NULL")) return null;
                break;
            default:
                break;
        }
        pos--;
        throw unexpected("a literal value");
    }

    // ---- token helpers ----

    private Token peek() { return tokens.get(pos); }

    private Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token advance() {
        Token t = tokens.get(pos);
        if (!t.is(TokenType.EOF)) pos++;
        return t;
    }

    private boolean match(TokenType type) {
        if (!peek().is(type)) return false;
        advance();
        return true;
    }

    private boolean matchKeyword(String keyword) {
        if (!peek().isKeyword(keyword)) return false;
        advance();
        return true;
    }

    private Token expect(TokenType type, String expected) {
        if (!peek().is(type)) throw unexpected(expected);
        return advance();
    }

    private void expectKeyword(String keyword) {
        if (!matchKeyword(keyword)) throw unexpected(keyword);
    }

    private String identifier(String what) {
        return expect(TokenType.IDENTIFIER, what).text();
    }

    private SqlSyntaxException unexpected(String expected) {
        Token t = peek();
        return new SqlSyntaxException("Expected " + expected + " but found " + t, t.text(), t.position());
    }
}

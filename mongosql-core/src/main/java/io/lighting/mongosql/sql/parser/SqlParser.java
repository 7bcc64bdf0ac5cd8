package io.lighting.mongosql.sql.parser;

import io.lighting.mongosql.error.ParseException;
import io.lighting.mongosql.error.UnsupportedFeatureException;
import io.lighting.mongosql.sql.Numbers;
import io.lighting.mongosql.sql.ast.Assignment;
import io.lighting.mongosql.sql.ast.DeleteStmt;
import io.lighting.mongosql.sql.ast.Expr;
import io.lighting.mongosql.sql.ast.InsertStmt;
import io.lighting.mongosql.sql.ast.Join;
import io.lighting.mongosql.sql.ast.JoinType;
import io.lighting.mongosql.sql.ast.OrderItem;
import io.lighting.mongosql.sql.ast.SelectItem;
import io.lighting.mongosql.sql.ast.SelectStmt;
import io.lighting.mongosql.sql.ast.SortDirection;
import io.lighting.mongosql.sql.ast.Stmt;
import io.lighting.mongosql.sql.ast.TableRef;
import io.lighting.mongosql.sql.ast.TransactionDirective;
import io.lighting.mongosql.sql.ast.TransactionStmt;
import io.lighting.mongosql.sql.ast.UpdateStmt;
import io.lighting.mongosql.sql.lexer.Token;
import io.lighting.mongosql.sql.lexer.TokenType;
import io.lighting.mongosql.sql.lexer.Tokenizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent parser with one token of lookahead.
 * <p>
 * Precedence, lowest first: {@code OR}, {@code AND}, prefix {@code NOT},
 * comparison and membership, {@code + -}, {@code * /}, unary minus, primary.
 */
public final class SqlParser {
    /**
     * Words that end a select item or table reference instead of being taken as a
     * bare alias.
     */
    private static final Set<String> RESERVED = Set.of(
        "SELECT", "FROM", "WHERE", "GROUP", "BY", "HAVING", "ORDER", "LIMIT", "OFFSET",
        "JOIN", "INNER", "LEFT", "OUTER", "ON", "AS", "AND", "OR", "NOT", "IN", "LIKE",
        "IS", "BETWEEN", "ASC", "DESC", "SET", "VALUES", "INTO", "NULL", "TRUE", "FALSE",
        "UNION"
    );

    private final Tokenizer tokenizer;
    private int positionalCount;

    public SqlParser(String sql) {
        this.tokenizer = new Tokenizer(sql);
    }

    public static Stmt parse(String sql) {
        return new SqlParser(sql).parseStatement();
    }

    public Stmt parseStatement() {
        Token first = tokenizer.next();
        if (first.type() != TokenType.IDENTIFIER) {
            throw new ParseException(first, "a statement keyword");
        }
        Stmt stmt = switch (first.text().toUpperCase(Locale.ROOT)) {
            case "SELECT" -> parseSelectBody();
            case "INSERT" -> parseInsert();
            case "UPDATE" -> parseUpdate();
            case "DELETE" -> parseDelete();
            case "BEGIN" -> new TransactionStmt(TransactionDirective.BEGIN);
            case "COMMIT" -> new TransactionStmt(TransactionDirective.COMMIT);
            case "ROLLBACK" -> new TransactionStmt(TransactionDirective.ROLLBACK);
            default -> throw new ParseException(first, "SELECT, INSERT, UPDATE, DELETE, BEGIN, COMMIT or ROLLBACK");
        };
        Token trailing = tokenizer.peek();
        if (trailing.type() != TokenType.EOF) {
            throw new ParseException(trailing, "end of input");
        }
        return stmt;
    }

    private SelectStmt parseSelectBody() {
        List<SelectItem> columns = parseSelectList();
        expectKeyword("FROM");
        TableRef from = parseTableRef(true);
        List<Join> joins = new ArrayList<>();
        Join join;
        while ((join = parseJoin()) != null) {
            joins.add(join);
        }
        Expr where = null;
        if (matchKeyword("WHERE")) {
            where = parseExpression();
        }
        List<Expr.Column> groupBy = new ArrayList<>();
        if (matchKeyword("GROUP")) {
            expectKeyword("BY");
            do {
                groupBy.add(parseColumnReference());
            } while (matchOperator(","));
        }
        Expr having = null;
        if (matchKeyword("HAVING")) {
            having = parseExpression();
        }
        List<OrderItem> orderBy = new ArrayList<>();
        if (matchKeyword("ORDER")) {
            expectKeyword("BY");
            do {
                Expr expr = parseExpression();
                SortDirection direction = SortDirection.ASC;
                if (matchKeyword("DESC")) {
                    direction = SortDirection.DESC;
                } else {
                    matchKeyword("ASC");
                }
                orderBy.add(new OrderItem(expr, direction));
            } while (matchOperator(","));
        }
        Integer limit = null;
        if (matchKeyword("LIMIT")) {
            limit = parseInteger("LIMIT");
        }
        Integer offset = null;
        if (matchKeyword("OFFSET")) {
            offset = parseInteger("OFFSET");
        }
        return new SelectStmt(columns, from, joins, where, groupBy, having, orderBy, limit, offset);
    }

    private List<SelectItem> parseSelectList() {
        List<SelectItem> items = new ArrayList<>();
        do {
            if (matchOperator("*")) {
                items.add(new SelectItem(new Expr.Wildcard()));
                continue;
            }
            Expr expr = parseExpression();
            items.add(new SelectItem(expr, parseAlias()));
        } while (matchOperator(","));
        return items;
    }

    private String parseAlias() {
        if (matchKeyword("AS")) {
            return expectIdentifier("alias");
        }
        Token next = tokenizer.peek();
        if (next.type() == TokenType.IDENTIFIER && !isReserved(next)) {
            return tokenizer.next().text();
        }
        return null;
    }

    private TableRef parseTableRef(boolean allowAlias) {
        String name = expectIdentifier("table name");
        if (!allowAlias) {
            return new TableRef(name);
        }
        return new TableRef(name, parseAlias());
    }

    private Join parseJoin() {
        JoinType type;
        if (matchKeyword("JOIN")) {
            type = JoinType.INNER;
        } else if (matchKeyword("INNER")) {
            expectKeyword("JOIN");
            type = JoinType.INNER;
        } else if (matchKeyword("LEFT")) {
            matchKeyword("OUTER");
            expectKeyword("JOIN");
            type = JoinType.LEFT;
        } else {
            return null;
        }
        TableRef table = parseTableRef(true);
        expectKeyword("ON");
        Expr on = parseExpression();
        if (on instanceof Expr.Binary binary
            && binary.op() == Expr.BinaryOp.EQ
            && binary.left() instanceof Expr.Column left
            && binary.right() instanceof Expr.Column right) {
            return new Join(type, table, left, right);
        }
        throw new UnsupportedFeatureException(
            "Join on " + table.tableName() + " must be an equality between two columns"
        );
    }

    private Stmt parseInsert() {
        expectKeyword("INTO");
        TableRef into = parseTableRef(false);
        List<String> columns = new ArrayList<>();
        if (matchOperator("(")) {
            do {
                columns.add(expectIdentifier("column name"));
            } while (matchOperator(","));
            expectOperator(")");
        }
        if (matchKeyword("VALUES")) {
            List<List<Expr>> rows = new ArrayList<>();
            do {
                Token open = tokenizer.peek();
                expectOperator("(");
                List<Expr> row = new ArrayList<>();
                do {
                    row.add(parseExpression());
                } while (matchOperator(","));
                expectOperator(")");
                if (!columns.isEmpty() && row.size() != columns.size()) {
                    throw new ParseException(String.format(
                        "Row %d at position %d has %d values but %d columns were declared",
                        rows.size() + 1,
                        open.position(),
                        row.size(),
                        columns.size()
                    ));
                }
                rows.add(row);
            } while (matchOperator(","));
            return new InsertStmt(into, columns, rows, null);
        }
        if (matchKeyword("SELECT")) {
            return new InsertStmt(into, columns, null, parseSelectBody());
        }
        throw new ParseException(tokenizer.peek(), "VALUES or SELECT");
    }

    private Stmt parseUpdate() {
        TableRef table = parseTableRef(false);
        expectKeyword("SET");
        List<Assignment> assignments = new ArrayList<>();
        do {
            String column = expectIdentifier("column name");
            expectOperator("=");
            assignments.add(new Assignment(column, parseExpression()));
        } while (matchOperator(","));
        Expr where = null;
        if (matchKeyword("WHERE")) {
            where = parseExpression();
        }
        return new UpdateStmt(table, assignments, where);
    }

    private Stmt parseDelete() {
        expectKeyword("FROM");
        TableRef from = parseTableRef(false);
        Expr where = null;
        if (matchKeyword("WHERE")) {
            where = parseExpression();
        }
        return new DeleteStmt(from, where);
    }

    private Expr parseExpression() {
        return parseOr();
    }

    private Expr parseOr() {
        Expr left = parseAnd();
        while (matchKeyword("OR")) {
            Expr right = parseAnd();
            left = new Expr.Binary(Expr.BinaryOp.OR, left, right);
        }
        return left;
    }

    private Expr parseAnd() {
        Expr left = parseNot();
        while (matchKeyword("AND")) {
            Expr right = parseNot();
            left = new Expr.Binary(Expr.BinaryOp.AND, left, right);
        }
        return left;
    }

    private Expr parseNot() {
        if (matchKeyword("NOT")) {
            return new Expr.Unary(Expr.UnaryOp.NOT, parseNot());
        }
        return parseComparison();
    }

    private Expr parseComparison() {
        Expr left = parseAdditive();
        if (matchKeyword("IS")) {
            Expr.BinaryOp op = matchKeyword("NOT") ? Expr.BinaryOp.IS_NOT : Expr.BinaryOp.IS;
            expectKeyword("NULL");
            return new Expr.Binary(op, left, new Expr.NullLiteral());
        }
        if (matchKeyword("NOT")) {
            if (matchKeyword("IN")) {
                return new Expr.Binary(Expr.BinaryOp.NOT_IN, left, parseInTarget());
            }
            if (matchKeyword("LIKE")) {
                Expr like = new Expr.Binary(Expr.BinaryOp.LIKE, left, parseAdditive());
                return new Expr.Unary(Expr.UnaryOp.NOT, like);
            }
            if (matchKeyword("BETWEEN")) {
                return new Expr.Unary(Expr.UnaryOp.NOT, parseBetween(left));
            }
            throw new ParseException(tokenizer.peek(), "IN, LIKE or BETWEEN after NOT");
        }
        if (matchKeyword("IN")) {
            return new Expr.Binary(Expr.BinaryOp.IN, left, parseInTarget());
        }
        if (matchKeyword("BETWEEN")) {
            return parseBetween(left);
        }
        if (matchKeyword("LIKE")) {
            return new Expr.Binary(Expr.BinaryOp.LIKE, left, parseAdditive());
        }
        Expr.BinaryOp op = comparisonOperator(tokenizer.peek());
        if (op != null) {
            tokenizer.next();
            return new Expr.Binary(op, left, parseAdditive());
        }
        return left;
    }

    private Expr parseInTarget() {
        Token next = tokenizer.peek();
        if (next.type() == TokenType.POSITIONAL_PARAM || next.type() == TokenType.NAMED_PARAM) {
            return parsePrimary();
        }
        expectOperator("(");
        List<Expr> items = new ArrayList<>();
        if (!matchOperator(")")) {
            do {
                items.add(parseAdditive());
            } while (matchOperator(","));
            expectOperator(")");
        }
        return new Expr.ArrayLiteral(items);
    }

    private Expr parseBetween(Expr left) {
        Expr from = parseAdditive();
        expectKeyword("AND");
        Expr to = parseAdditive();
        return new Expr.Binary(Expr.BinaryOp.BETWEEN, left, new Expr.Between(from, to));
    }

    private static Expr.BinaryOp comparisonOperator(Token token) {
        if (token.type() != TokenType.OPERATOR) {
            return null;
        }
        return switch (token.text()) {
            case "=" -> Expr.BinaryOp.EQ;
            case "!=", "<>" -> Expr.BinaryOp.NE;
            case ">" -> Expr.BinaryOp.GT;
            case ">=" -> Expr.BinaryOp.GE;
            case "<" -> Expr.BinaryOp.LT;
            case "<=" -> Expr.BinaryOp.LE;
            default -> null;
        };
    }

    private Expr parseAdditive() {
        Expr left = parseMultiplicative();
        while (true) {
            if (matchOperator("+")) {
                left = new Expr.Binary(Expr.BinaryOp.ADD, left, parseMultiplicative());
            } else if (matchOperator("-")) {
                left = new Expr.Binary(Expr.BinaryOp.SUB, left, parseMultiplicative());
            } else {
                return left;
            }
        }
    }

    private Expr parseMultiplicative() {
        Expr left = parseUnary();
        while (true) {
            if (matchOperator("*")) {
                left = new Expr.Binary(Expr.BinaryOp.MUL, left, parseUnary());
            } else if (matchOperator("/")) {
                left = new Expr.Binary(Expr.BinaryOp.DIV, left, parseUnary());
            } else {
                return left;
            }
        }
    }

    private Expr parseUnary() {
        if (matchOperator("-")) {
            Expr operand = parseUnary();
            if (operand instanceof Expr.NumberLiteral literal) {
                return new Expr.NumberLiteral(Numbers.negate(literal.value()));
            }
            return new Expr.Unary(Expr.UnaryOp.NEG, operand);
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        Token token = tokenizer.next();
        switch (token.type()) {
            case NUMBER:
                return new Expr.NumberLiteral(parseNumber(token));
            case STRING:
                return new Expr.StringLiteral(token.text());
            case POSITIONAL_PARAM:
                return new Expr.PositionalParam(positionalCount++);
            case NAMED_PARAM:
                return new Expr.NamedParam(token.text());
            case IDENTIFIER:
                return parseIdentifierExpression(token);
            case OPERATOR:
                if (token.isOperator("(")) {
                    Expr inner = parseExpression();
                    expectOperator(")");
                    return inner;
                }
                if (token.isOperator("*")) {
                    return new Expr.Wildcard();
                }
                throw new ParseException(token, "an expression");
            default:
                throw new ParseException(token, "an expression");
        }
    }

    private Expr parseIdentifierExpression(Token token) {
        String upper = token.text().toUpperCase(Locale.ROOT);
        switch (upper) {
            case "NULL":
                return new Expr.NullLiteral();
            case "TRUE":
                return new Expr.BooleanLiteral(true);
            case "FALSE":
                return new Expr.BooleanLiteral(false);
            default:
                break;
        }
        if (matchOperator("(")) {
            List<Expr> args = new ArrayList<>();
            if (!matchOperator(")")) {
                do {
                    if (matchOperator("*")) {
                        args.add(new Expr.Wildcard());
                    } else {
                        args.add(parseExpression());
                    }
                } while (matchOperator(","));
                expectOperator(")");
            }
            return new Expr.Call(upper, args);
        }
        if (isReserved(token)) {
            throw new ParseException(token, "an expression");
        }
        if (matchOperator(".")) {
            return new Expr.Column(token.text(), expectIdentifier("column name"));
        }
        return new Expr.Column(token.text());
    }

    private Expr.Column parseColumnReference() {
        Token token = tokenizer.peek();
        Expr expr = parseAdditive();
        if (expr instanceof Expr.Column column) {
            return column;
        }
        throw new ParseException(token, "a column reference");
    }

    private static Number parseNumber(Token token) {
        try {
            return Numbers.parse(token.text());
        } catch (NumberFormatException ex) {
            throw new ParseException(token, "a number in range");
        }
    }

    private int parseInteger(String clause) {
        Token token = tokenizer.next();
        if (token.type() != TokenType.NUMBER || token.text().indexOf('.') >= 0) {
            throw new ParseException(token, "an integer after " + clause);
        }
        try {
            return Integer.parseInt(token.text());
        } catch (NumberFormatException ex) {
            throw new ParseException(token, "an integer in range after " + clause);
        }
    }

    private String expectIdentifier(String what) {
        Token token = tokenizer.next();
        if (token.type() != TokenType.IDENTIFIER) {
            throw new ParseException(token, what);
        }
        return token.text();
    }

    private void expectKeyword(String keyword) {
        Token token = tokenizer.next();
        if (!token.isKeyword(keyword)) {
            throw new ParseException(token, keyword);
        }
    }

    private void expectOperator(String op) {
        Token token = tokenizer.next();
        if (!token.isOperator(op)) {
            throw new ParseException(token, "'" + op + "'");
        }
    }

    private boolean matchKeyword(String keyword) {
        if (tokenizer.peek().isKeyword(keyword)) {
            tokenizer.next();
            return true;
        }
        return false;
    }

    private boolean matchOperator(String op) {
        if (tokenizer.peek().isOperator(op)) {
            tokenizer.next();
            return true;
        }
        return false;
    }

    private static boolean isReserved(Token token) {
        return RESERVED.contains(token.text().toUpperCase(Locale.ROOT));
    }
}

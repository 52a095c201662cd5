package com.bireporting.anomaly.engine.condition;

import com.bireporting.anomaly.engine.condition.ConditionLexer.Token;
import com.bireporting.anomaly.engine.condition.ConditionLexer.TokenType;
import com.bireporting.anomaly.exception.ConditionSyntaxException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for rule conditions.
 *
 * <pre>
 * expr     := andExpr (("OR" | "||") andExpr)*
 * andExpr  := unary (("AND" | "&&") unary)*
 * unary    := ("NOT" | "!") unary | primary
 * primary  := "(" expr ")" | operand op operand | operand "IS" ["NOT"] "NULL"
 * operand  := identifier | [bracketed name] | number | 'string' | "string" | TRUE | FALSE | NULL
 * op       := &lt; | &lt;= | &gt; | &gt;= | = | == | != | &lt;&gt;
 * </pre>
 */
final class ConditionParser {

    private final String source;
    private final List<Token> tokens;
    private final Set<String> identifiers = new LinkedHashSet<>();
    private int current;

    ConditionParser(String source) {
        this.source = source;
        this.tokens = new ConditionLexer(source).tokenize();
    }

    ConditionNode parse() {
        if (peek().type() == TokenType.EOF) {
            throw new ConditionSyntaxException("Empty condition", source, 0);
        }
        ConditionNode root = orExpr();
        if (peek().type() != TokenType.EOF) {
            throw error("Unexpected '" + peek().text() + "'");
        }
        return root;
    }

    /** Identifiers referenced by the parsed condition, in order of first appearance. */
    Set<String> identifiers() {
        return identifiers;
    }

    private ConditionNode orExpr() {
        ConditionNode left = andExpr();
        while (match(TokenType.OR)) {
            left = new ConditionNode.Or(left, andExpr());
        }
        return left;
    }

    private ConditionNode andExpr() {
        ConditionNode left = unary();
        while (match(TokenType.AND)) {
            left = new ConditionNode.And(left, unary());
        }
        return left;
    }

    private ConditionNode unary() {
        if (match(TokenType.NOT)) {
            return new ConditionNode.Not(unary());
        }
        return primary();
    }

    private ConditionNode primary() {
        if (match(TokenType.LPAREN)) {
            ConditionNode inner = orExpr();
            if (!match(TokenType.RPAREN)) {
                throw error("Expected ')'");
            }
            return inner;
        }

        ConditionNode.Operand left = operand();

        if (match(TokenType.IS)) {
            boolean negated = match(TokenType.NOT);
            if (!match(TokenType.NULL)) {
                throw error("Expected NULL after IS");
            }
            return new ConditionNode.NullCheck(left, negated);
        }

        Token op = peek();
        if (op.type() != TokenType.COMPARISON) {
            throw error("Expected comparison operator");
        }
        current++;
        ConditionNode.Operand right = operand();
        return new ConditionNode.Comparison(left, ConditionNode.ComparisonOperator.fromSymbol(op.text()), right);
    }

    private ConditionNode.Operand operand() {
        Token token = peek();
        switch (token.type()) {
            case IDENTIFIER:
                current++;
                identifiers.add(token.text());
                return new ConditionNode.ColumnRef(token.text());
            case NUMBER:
                current++;
                return new ConditionNode.Literal(Double.parseDouble(token.text()));
            case STRING:
                current++;
                return new ConditionNode.Literal(token.text());
            case TRUE:
                current++;
                return new ConditionNode.Literal(Boolean.TRUE);
            case FALSE:
                current++;
                return new ConditionNode.Literal(Boolean.FALSE);
            case NULL:
                current++;
                return new ConditionNode.Literal(null);
            default:
                throw error(token.type() == TokenType.EOF ? "Unexpected end of condition" : "Expected operand");
        }
    }

    private boolean match(TokenType type) {
        if (peek().type() == type) {
            current++;
            return true;
        }
        return false;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private ConditionSyntaxException error(String message) {
        return new ConditionSyntaxException(message, source, peek().position());
    }
}

package com.pathway.rules.parse;

import com.pathway.rules.RuleSyntaxException;
import com.pathway.rules.VariablePath;
import com.pathway.rules.ast.Comparison;
import com.pathway.rules.ast.ComparisonOperator;
import com.pathway.rules.ast.ListOperand;
import com.pathway.rules.ast.Literal;
import com.pathway.rules.ast.Logical;
import com.pathway.rules.ast.Membership;
import com.pathway.rules.ast.Not;
import com.pathway.rules.ast.Operand;
import com.pathway.rules.ast.RuleExpression;
import com.pathway.rules.ast.Truthy;
import com.pathway.rules.ast.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for visibility rules.
 * <pre>
 * expr       := or
 * or         := and (('OR' | '||') and)*
 * and        := unary (('AND' | '&amp;&amp;') unary)*
 * unary      := ('NOT' | '!') unary | '(' expr ')' | condition
 * condition  := operand [ comparator operand | ('in' | 'not_in' | 'not' 'in') operand | 'contains' operand ]
 * operand    := string | number | true | false | null | path | '[' [operand (',' operand)*] ']'
 * </pre>
 */
public final class RuleParser {

    private final String expression;
    private final List<Token> tokens;
    private int index;

    private RuleParser(String expression) {
        this.expression = expression;
        this.tokens = new RuleLexer(expression).tokenize();
    }

    /**
     * Parses an expression into a typed tree.
     *
     * @throws RuleSyntaxException when the expression is malformed or empty
     */
    public static RuleExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new RuleSyntaxException("Empty expression", String.valueOf(expression), 0);
        }
        RuleParser parser = new RuleParser(expression);
        RuleExpression result = parser.parseOr();
        parser.expect(TokenType.EOF, "end of expression");
        return result;
    }

    private RuleExpression parseOr() {
        List<RuleExpression> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (peek().getType() == TokenType.OR) {
            index++;
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new Logical(Logical.Kind.OR, operands);
    }

    private RuleExpression parseAnd() {
        List<RuleExpression> operands = new ArrayList<>();
        operands.add(parseUnary());
        while (peek().getType() == TokenType.AND) {
            index++;
            operands.add(parseUnary());
        }
        return operands.size() == 1 ? operands.get(0) : new Logical(Logical.Kind.AND, operands);
    }

    private RuleExpression parseUnary() {
        Token token = peek();
        if (token.getType() == TokenType.NOT) {
            index++;
            return new Not(parseUnary());
        }
        if (token.getType() == TokenType.LPAREN) {
            index++;
            RuleExpression inner = parseOr();
            expect(TokenType.RPAREN, "')'");
            return inner;
        }
        return parseCondition();
    }

    private RuleExpression parseCondition() {
        Operand left = parseOperand();
        Token token = peek();
        switch (token.getType()) {
            case COMPARATOR:
                index++;
                return new Comparison(left, ComparisonOperator.fromSymbol(token.getText()), parseOperand());
            case IN:
                index++;
                return new Membership(left, Membership.Kind.IN, parseOperand());
            case NOT_IN:
                index++;
                return new Membership(left, Membership.Kind.NOT_IN, parseOperand());
            case NOT:
                if (peekAt(1).getType() == TokenType.IN) {
                    index += 2;
                    return new Membership(left, Membership.Kind.NOT_IN, parseOperand());
                }
                throw error("Unexpected 'not'", token);
            case CONTAINS:
                index++;
                return new Membership(left, Membership.Kind.CONTAINS, parseOperand());
            default:
                return new Truthy(left);
        }
    }

    private Operand parseOperand() {
        Token token = next();
        switch (token.getType()) {
            case STRING:
                return new Literal(token.getText());
            case NUMBER:
                return new Literal(parseNumber(token));
            case TRUE:
                return new Literal(Boolean.TRUE);
            case FALSE:
                return new Literal(Boolean.FALSE);
            case NULL:
                return Literal.NULL;
            case PATH:
                return new Variable(VariablePath.of(token.getText(), token.getSegments()));
            case LBRACKET: {
                List<Operand> elements = new ArrayList<>();
                if (peek().getType() != TokenType.RBRACKET) {
                    elements.add(parseOperand());
                    while (peek().getType() == TokenType.COMMA) {
                        index++;
                        elements.add(parseOperand());
                    }
                }
                expect(TokenType.RBRACKET, "']'");
                return new ListOperand(elements);
            }
            default:
                throw error("Operand expected", token);
        }
    }

    private Number parseNumber(Token token) {
        String text = token.getText();
        try {
            if (text.contains(".")) return Double.parseDouble(text);
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw error("Malformed number '" + text + "'", token);
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.getType() != TokenType.EOF) index++;
        return token;
    }

    private void expect(TokenType type, String what) {
        Token token = peek();
        if (token.getType() != type) {
            throw error(what + " expected but found '" + token.getText() + "'", token);
        }
        index++;
    }

    private RuleSyntaxException error(String message, Token token) {
        return new RuleSyntaxException(message, expression, token.getPosition());
    }
}

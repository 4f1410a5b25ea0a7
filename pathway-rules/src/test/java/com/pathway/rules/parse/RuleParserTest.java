package com.pathway.rules.parse;

import com.pathway.rules.RuleSyntaxException;
import com.pathway.rules.ast.Comparison;
import com.pathway.rules.ast.Logical;
import com.pathway.rules.ast.Membership;
import com.pathway.rules.ast.Not;
import com.pathway.rules.ast.RuleExpression;
import com.pathway.rules.ast.Truthy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RuleParserTest {

    @Test
    void parse_andBindsTighterThanOr() {
        RuleExpression expr = RuleParser.parse("a == 1 OR b == 2 AND c == 3");

        Logical or = assertInstanceOf(Logical.class, expr);
        assertEquals(Logical.Kind.OR, or.getKind());
        assertInstanceOf(Comparison.class, or.getOperands().get(0));
        Logical and = assertInstanceOf(Logical.class, or.getOperands().get(1));
        assertEquals(Logical.Kind.AND, and.getKind());
    }

    @Test
    void parse_keywordsAreCaseInsensitive() {
        assertInstanceOf(Logical.class, RuleParser.parse("a == 1 and b == 2"));
        assertInstanceOf(Not.class, RuleParser.parse("NOT a"));
        assertInstanceOf(Membership.class, RuleParser.parse("a NOT_IN ['x']"));
        assertInstanceOf(Truthy.class, RuleParser.parse("TRUE"));
    }

    @Test
    void lexer_gluesBracketSegmentsToPaths() {
        List<Token> tokens = new RuleLexer("responses['intro'].age >= 18 in [1, 2]").tokenize();

        assertEquals(TokenType.PATH, tokens.get(0).getType());
        assertEquals(List.of("responses", "intro", "age"), tokens.get(0).getSegments());
        assertEquals(TokenType.COMPARATOR, tokens.get(1).getType());
        assertEquals(TokenType.IN, tokens.get(3).getType());
        assertEquals(TokenType.LBRACKET, tokens.get(4).getType());
    }

    @Test
    void lexer_acceptsHyphenatedIdsAndNegativeNumbers() {
        List<Token> tokens = new RuleLexer("stage-2.delta > -1.5").tokenize();

        assertEquals(List.of("stage-2", "delta"), tokens.get(0).getSegments());
        assertEquals("-1.5", tokens.get(2).getText());
    }

    @Test
    void parse_rejectsMalformedExpressions() {
        assertThrows(RuleSyntaxException.class, () -> RuleParser.parse("a =="));
        assertThrows(RuleSyntaxException.class, () -> RuleParser.parse("(a == 1"));
        assertThrows(RuleSyntaxException.class, () -> RuleParser.parse("a == 'open"));
        assertThrows(RuleSyntaxException.class, () -> RuleParser.parse("a = 1"));
        assertThrows(RuleSyntaxException.class, () -> RuleParser.parse("a == 1 b == 2"));
        assertThrows(RuleSyntaxException.class, () -> RuleParser.parse(""));
    }

    @Test
    void syntaxException_carriesPosition() {
        RuleSyntaxException e = assertThrows(RuleSyntaxException.class, () -> RuleParser.parse("a == 1 )"));

        assertEquals(7, e.getPosition());
    }
}

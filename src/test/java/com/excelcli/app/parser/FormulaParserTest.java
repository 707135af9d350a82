package com.excelcli.app.parser;

import com.excelcli.app.exceptions.LexException;
import com.excelcli.app.exceptions.ParseException;
import com.excelcli.app.exceptions.RecursionLimitExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the precedence-climbing formula parser.
 * Parsed trees are checked through their fully parenthesized rendering.
 */
class FormulaParserTest {

    private static final SourceLocation ORIGIN = new SourceLocation(1, 2);

    private ExprArena arena;
    private FormulaParser parser;

    @BeforeEach
    void setUp() {
        arena = new ExprArena();
        parser = new FormulaParser(arena, 100);
    }

    private String parse(String formula) {
        return arena.format(parser.parse(formula, ORIGIN));
    }

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        assertEquals("((2 * 3) + 4)", parse("2*3+4"));
        assertEquals("(2 + (3 * 4))", parse("2+3*4"));
    }

    @Test
    void testParenthesesOverridePrecedence() {
        assertEquals("((2 + 3) * 4)", parse("(2+3)*4"));
    }

    @Test
    void testEqualPrecedenceFoldsLeft() {
        assertEquals("((2 - 3) - 4)", parse("2-3-4"));
        assertEquals("((8 / 4) / 2)", parse("8/4/2"));
        assertEquals("((2 ^ 3) * 2)", parse("2^3*2"));
    }

    @Test
    void testUnaryMinusTakesTheNextFactor() {
        assertEquals("(-5 + 2)", parse("-5+2"));
        assertEquals("-(1 + 2)", parse("-(1+2)"));
        assertEquals("--3", parse("--3"));
    }

    @Test
    void testCellReferences() {
        int root = parser.parse("B3", ORIGIN);
        Expr ref = arena.get(root);
        assertEquals(ExprKind.CELL_REF, ref.getKind());
        assertEquals(2, ref.getRow());
        assertEquals(1, ref.getCol());
        assertEquals("(A1 + Z10)", parse("A1 + Z10"));
    }

    @Test
    void testDecimalNumbers() {
        Expr number = arena.get(parser.parse("2.5", ORIGIN));
        assertEquals(2.5, number.getNumber());
        assertEquals(0.5, arena.get(parser.parse(".5", ORIGIN)).getNumber());
    }

    @Test
    void testNodesCarrySourceLocations() {
        int root = parser.parse("1 + A2", ORIGIN);
        Expr sum = arena.get(root);
        assertEquals(new SourceLocation(1, 4), sum.getLocation());
        assertEquals(new SourceLocation(1, 6), arena.get(sum.getRhs()).getLocation());
    }

    @Test
    void testUnclosedParenthesis() {
        ParseException ex = assertThrows(ParseException.class, () -> parser.parse("(1+2", ORIGIN));
        assertEquals(new SourceLocation(1, 6), ex.getLocation());
    }

    @Test
    void testMissingOperand() {
        assertThrows(ParseException.class, () -> parser.parse("1+", ORIGIN));
        assertThrows(ParseException.class, () -> parser.parse("*2", ORIGIN));
        assertThrows(ParseException.class, () -> parser.parse("()", ORIGIN));
    }

    @Test
    void testEmptyFormula() {
        assertThrows(ParseException.class, () -> parser.parse("  ", ORIGIN));
    }

    @Test
    void testTrailingTokens() {
        ParseException ex = assertThrows(ParseException.class, () -> parser.parse("1 2", ORIGIN));
        assertEquals(new SourceLocation(1, 4), ex.getLocation());
        assertThrows(ParseException.class, () -> parser.parse("(1))", ORIGIN));
    }

    @Test
    void testBadCellReferences() {
        // lowercase column
        ParseException lower = assertThrows(ParseException.class, () -> parser.parse("a1", ORIGIN));
        assertEquals(new SourceLocation(1, 2), lower.getLocation());
        // two letters, missing or non-numeric row, row zero
        assertThrows(ParseException.class, () -> parser.parse("AB1", ORIGIN));
        assertThrows(ParseException.class, () -> parser.parse("A", ORIGIN));
        assertThrows(ParseException.class, () -> parser.parse("A1x", ORIGIN));
        assertThrows(ParseException.class, () -> parser.parse("A0", ORIGIN));
        assertThrows(ParseException.class, () -> parser.parse("A99999999999", ORIGIN));
    }

    @Test
    void testMalformedNumber() {
        assertThrows(ParseException.class, () -> parser.parse("1.2.3", ORIGIN));
    }

    @Test
    void testLexErrorsPropagate() {
        assertThrows(LexException.class, () -> parser.parse("1 % 2", ORIGIN));
    }

    @Test
    void testDeepNestingHitsTheDepthLimit() {
        String nested = "(".repeat(200) + "1" + ")".repeat(200);
        assertThrows(RecursionLimitExceededException.class, () -> parser.parse(nested, ORIGIN));

        FormulaParser roomy = new FormulaParser(arena, 5000);
        assertEquals("1", arena.format(roomy.parse(nested, ORIGIN)));
    }
}

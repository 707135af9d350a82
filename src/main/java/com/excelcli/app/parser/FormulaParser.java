package com.excelcli.app.parser;

import com.excelcli.app.exceptions.ParseException;
import com.excelcli.app.exceptions.RecursionLimitExceededException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for formula text, using precedence climbing.
 *
 * Grammar (loosest first):
 *   expr   := term (('+' | '-') term)*
 *   term   := factor (('*' | '/' | '^') factor)*
 *   factor := number | '(' expr ')' | '-' factor | cellref
 *
 * Each level parses its first operand one level up, then folds every operator
 * of its own level into the accumulated left-hand side, so chains of equal
 * precedence associate to the left: 2-3-4 is (2-3)-4.
 *
 * Nodes are allocated into the shared {@link ExprArena}; {@link #parse} returns
 * the index of the root.
 */
public class FormulaParser {

    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");
    private static final Pattern CELL_REF_PATTERN = Pattern.compile("^(?<col>[A-Z])(?<row>\\d+)$");

    private final ExprArena arena;
    private final int maxDepth;

    public FormulaParser(ExprArena arena, int maxDepth) {
        this.arena = arena;
        this.maxDepth = maxDepth;
    }

    /**
     * Parses one formula (without its leading '=').
     *
     * @param formula the formula text
     * @param origin  location of the first character of {@code formula} in the input table
     * @return arena index of the root node
     */
    public int parse(String formula, SourceLocation origin) {
        Lexer lexer = new Lexer(formula, origin);
        if (lexer.peek().isEmpty()) {
            throw new ParseException(lexer.peek().getLocation(), "formula is empty");
        }
        int root = parseExpr(lexer, 0, 0);
        Token trailing = lexer.peek();
        if (!trailing.isEmpty()) {
            throw new ParseException(trailing.getLocation(),
                    "unexpected token " + trailing + " after the end of the formula");
        }
        return root;
    }

    private int parseExpr(Lexer lexer, int precedence, int depth) {
        checkDepth(lexer, depth);
        if (precedence > BinaryOpKind.MAX_PRECEDENCE) {
            return parsePrimary(lexer, depth + 1);
        }

        int lhs = parseExpr(lexer, precedence + 1, depth + 1);
        BinaryOpKind op = BinaryOpKind.fromSymbol(lexer.peek().getText());
        while (op != null && op.getPrecedence() == precedence) {
            Token opToken = lexer.next();
            int rhs = parseExpr(lexer, precedence + 1, depth + 1);
            lhs = arena.add(Expr.binary(op, lhs, rhs, opToken.getLocation()));
            op = BinaryOpKind.fromSymbol(lexer.peek().getText());
        }
        return lhs;
    }

    private int parsePrimary(Lexer lexer, int depth) {
        checkDepth(lexer, depth);
        Token token = lexer.next();
        if (token.isEmpty()) {
            throw new ParseException(token.getLocation(), "expected an operand but reached the end of the formula");
        }

        String text = token.getText();
        if (token.is("(")) {
            int inner = parseExpr(lexer, 0, depth + 1);
            Token close = lexer.next();
            if (!close.is(")")) {
                throw new ParseException(close.getLocation(), "expected ')' but got " + close);
            }
            return inner;
        }
        if (token.is("-")) {
            int operand = parsePrimary(lexer, depth + 1);
            return arena.add(Expr.unary(UnaryOpKind.NEG, operand, token.getLocation()));
        }

        char first = text.charAt(0);
        if ((first >= '0' && first <= '9') || first == '.') {
            return arena.add(Expr.number(parseNumber(token), token.getLocation()));
        }
        if (Character.isLetter(first) || first == '_') {
            return parseCellRef(token);
        }
        throw new ParseException(token.getLocation(), "expected an operand but got " + token);
    }

    private double parseNumber(Token token) {
        if (!NUMBER_PATTERN.matcher(token.getText()).matches()) {
            throw new ParseException(token.getLocation(), token + " is not a valid number");
        }
        return Double.parseDouble(token.getText());
    }

    /**
     * A reference is exactly one uppercase column letter followed by a 1-based row number.
     */
    private int parseCellRef(Token token) {
        String text = token.getText();
        char first = text.charAt(0);
        if (first < 'A' || first > 'Z') {
            throw new ParseException(token.getLocation(),
                    "cell reference " + token + " must start with an uppercase column letter");
        }
        Matcher m = CELL_REF_PATTERN.matcher(text);
        if (!m.matches()) {
            throw new ParseException(token.getLocation(),
                    "cell reference " + token + " must be a column letter followed by a row number");
        }

        int row;
        try {
            row = Integer.parseInt(m.group("row"));
        } catch (NumberFormatException e) {
            throw new ParseException(token.getLocation(), "row number in " + token + " is too large");
        }
        if (row == 0) {
            throw new ParseException(token.getLocation(), "row numbers start at 1, got " + token);
        }
        int col = m.group("col").charAt(0) - 'A';
        return arena.add(Expr.cellRef(row - 1, col, token.getLocation()));
    }

    private void checkDepth(Lexer lexer, int depth) {
        if (depth > maxDepth) {
            throw new RecursionLimitExceededException(lexer.peek().getLocation(),
                    "formula is nested deeper than " + maxDepth + " levels");
        }
    }
}

package com.excelcli.app.services;

import com.excelcli.app.exceptions.CircularReferenceException;
import com.excelcli.app.exceptions.CloneOutOfBoundsException;
import com.excelcli.app.exceptions.InvariantViolationException;
import com.excelcli.app.exceptions.RecursionLimitExceededException;
import com.excelcli.app.exceptions.ReferenceOutOfBoundsException;
import com.excelcli.app.exceptions.TextInArithmeticException;
import com.excelcli.app.models.Cell;
import com.excelcli.app.models.CellKind;
import com.excelcli.app.models.CellStatus;
import com.excelcli.app.models.CloneDirection;
import com.excelcli.app.models.Table;
import com.excelcli.app.parser.Expr;
import com.excelcli.app.parser.ExprArena;
import com.excelcli.app.parser.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates the cells of one table on demand, depth-first.
 *
 * Every cell runs through UNEVALUATED -> IN_PROGRESS -> EVALUATED. The status is the
 * memo (an EVALUATED formula is never recomputed) and the cycle detector (meeting an
 * IN_PROGRESS cell again means the dependency chain loops back on itself).
 *
 * Clone cells copy their neighbor. A copied formula is re-based first: its cell
 * references are shifted one step opposite to the clone direction, so the copy keeps
 * the same relative offsets from the clone that the original had from the neighbor.
 *
 * One instance per run; not thread-safe.
 */
public class TableEvaluator {

    private static final Logger log = LoggerFactory.getLogger(TableEvaluator.class);

    private final Table table;
    private final ExprArena arena;
    private final int maxDepth;

    private int depth;
    private int formulaEvaluations;

    public TableEvaluator(Table table, ExprArena arena, int maxDepth) {
        this.table = table;
        this.arena = arena;
        this.maxDepth = maxDepth;
    }

    /**
     * Evaluates every cell, top to bottom and left to right, then confirms
     * that no clone cell is left and every cell reached EVALUATED.
     */
    public void evaluateAll() {
        for (int row = 0; row < table.getRows(); row++) {
            for (int col = 0; col < table.getCols(); col++) {
                evaluateCell(row, col);
            }
        }

        for (int row = 0; row < table.getRows(); row++) {
            for (int col = 0; col < table.getCols(); col++) {
                Cell cell = table.getCell(row, col);
                if (cell.getKind() == CellKind.CLONE || cell.getStatus() != CellStatus.EVALUATED) {
                    throw new InvariantViolationException(cell.getLocation(),
                            "cell " + ExprArena.cellName(row, col) + " is " + cell.getKind() + "/" + cell.getStatus()
                                    + " after evaluation");
                }
            }
        }
        log.debug("Evaluated {}x{} table {} ({} formula evaluations, {} expression nodes)",
                table.getRows(), table.getCols(), table.getLabel(), formulaEvaluations, arena.size());
    }

    /**
     * Brings the cell at (row, col) to EVALUATED, evaluating its dependencies first,
     * and returns it.
     */
    public Cell evaluateCell(int row, int col) {
        Cell cell = table.getCell(row, col);
        enter(cell.getLocation());
        try {
            switch (cell.getKind()) {
                case TEXT:
                case NUMBER:
                    cell.setStatus(CellStatus.EVALUATED);
                    break;
                case FORMULA:
                    evaluateFormula(cell, row, col);
                    break;
                case CLONE:
                    evaluateClone(cell, row, col);
                    break;
                default:
                    throw new InvariantViolationException(cell.getLocation(), "unknown cell kind " + cell.getKind());
            }
            return cell;
        } finally {
            depth--;
        }
    }

    /**
     * Number of times a formula body was actually computed during this run.
     */
    public int getFormulaEvaluations() {
        return formulaEvaluations;
    }

    private void evaluateFormula(Cell cell, int row, int col) {
        switch (cell.getStatus()) {
            case EVALUATED:
                return;
            case IN_PROGRESS:
                throw circular(cell, row, col);
            case UNEVALUATED:
                cell.setStatus(CellStatus.IN_PROGRESS);
                formulaEvaluations++;
                cell.setValue(evaluateExpr(cell.getExprIndex()));
                cell.setStatus(CellStatus.EVALUATED);
                return;
            default:
                throw new InvariantViolationException(cell.getLocation(), "unknown cell status " + cell.getStatus());
        }
    }

    private void evaluateClone(Cell cell, int row, int col) {
        if (cell.getStatus() == CellStatus.EVALUATED) {
            throw new InvariantViolationException(cell.getLocation(),
                    "clone cell " + ExprArena.cellName(row, col) + " is marked evaluated but was never resolved");
        }
        if (cell.getStatus() == CellStatus.IN_PROGRESS) {
            throw circular(cell, row, col);
        }
        cell.setStatus(CellStatus.IN_PROGRESS);

        CloneDirection direction = cell.getDirection();
        int neighborRow = row + direction.getRowStep();
        int neighborCol = col + direction.getColStep();
        if (!table.contains(neighborRow, neighborCol)) {
            throw new CloneOutOfBoundsException(cell.getLocation(),
                    "clone cell " + ExprArena.cellName(row, col) + " copies " + direction.name().toLowerCase()
                            + " but there is no cell in that direction");
        }

        Cell neighbor = evaluateCell(neighborRow, neighborCol);
        switch (neighbor.getKind()) {
            case TEXT:
                cell.resolveToText(neighbor.getText());
                break;
            case NUMBER:
                cell.resolveToNumber(neighbor.getValue());
                break;
            case FORMULA:
                int rebased = rebase(neighbor.getExprIndex(),
                        -direction.getRowStep(), -direction.getColStep(), cell.getLocation());
                cell.resolveToFormula(rebased);
                if (log.isTraceEnabled()) {
                    log.trace("Clone {} resolved to ={}", ExprArena.cellName(row, col), arena.format(rebased));
                }
                formulaEvaluations++;
                cell.setValue(evaluateExpr(rebased));
                break;
            default:
                throw new InvariantViolationException(neighbor.getLocation(),
                        "neighbor " + ExprArena.cellName(neighborRow, neighborCol) + " is still a clone after evaluation");
        }
        cell.setStatus(CellStatus.EVALUATED);
    }

    /**
     * Computes the value of the expression rooted at {@code index}.
     * Cell references evaluate the referenced cell first.
     */
    double evaluateExpr(int index) {
        Expr expr = arena.get(index);
        enter(expr.getLocation());
        try {
            switch (expr.getKind()) {
                case NUMBER:
                    return expr.getNumber();
                case CELL_REF:
                    return evaluateReference(expr);
                case BINARY_OP:
                    double lhs = evaluateExpr(expr.getLhs());
                    double rhs = evaluateExpr(expr.getRhs());
                    return expr.getBinaryOp().apply(lhs, rhs);
                case UNARY_OP:
                    return expr.getUnaryOp().apply(evaluateExpr(expr.getOperand()));
                default:
                    throw new InvariantViolationException(expr.getLocation(), "unknown expression kind " + expr.getKind());
            }
        } finally {
            depth--;
        }
    }

    private double evaluateReference(Expr ref) {
        int row = ref.getRow();
        int col = ref.getCol();
        String name = ExprArena.cellName(row, col);
        if (!table.contains(row, col)) {
            throw new ReferenceOutOfBoundsException(ref.getLocation(),
                    "reference " + name + " is outside the " + table.getRows() + "x" + table.getCols() + " table");
        }

        Cell target = evaluateCell(row, col);
        switch (target.getKind()) {
            case TEXT:
                throw new TextInArithmeticException(ref.getLocation(), target.getLocation(),
                        "cell " + name + " at " + target.getLocation() + " holds text '" + target.getText()
                                + "' and cannot be used in arithmetic");
            case NUMBER:
            case FORMULA:
                return target.getValue();
            default:
                throw new InvariantViolationException(target.getLocation(),
                        "cell " + name + " is still a clone after evaluation");
        }
    }

    /**
     * Copies the subtree at {@code index} with every cell reference moved by (rowShift, colShift).
     * Number leaves are shared; every rebuilt node is stamped with {@code location}.
     *
     * @return arena index of the copied root
     */
    int rebase(int index, int rowShift, int colShift, SourceLocation location) {
        Expr expr = arena.get(index);
        enter(location);
        try {
            switch (expr.getKind()) {
                case NUMBER:
                    return index;
                case CELL_REF:
                    return arena.add(Expr.cellRef(expr.getRow() + rowShift, expr.getCol() + colShift, location));
                case BINARY_OP:
                    int lhs = rebase(expr.getLhs(), rowShift, colShift, location);
                    int rhs = rebase(expr.getRhs(), rowShift, colShift, location);
                    return arena.add(Expr.binary(expr.getBinaryOp(), lhs, rhs, location));
                case UNARY_OP:
                    int operand = rebase(expr.getOperand(), rowShift, colShift, location);
                    return arena.add(Expr.unary(expr.getUnaryOp(), operand, location));
                default:
                    throw new InvariantViolationException(expr.getLocation(), "unknown expression kind " + expr.getKind());
            }
        } finally {
            depth--;
        }
    }

    private CircularReferenceException circular(Cell cell, int row, int col) {
        return new CircularReferenceException(cell.getLocation(),
                "circular reference: cell " + ExprArena.cellName(row, col) + " depends on itself");
    }

    private void enter(SourceLocation location) {
        if (depth >= maxDepth) {
            throw new RecursionLimitExceededException(location,
                    "evaluation is nested deeper than " + maxDepth + " levels");
        }
        depth++;
    }
}

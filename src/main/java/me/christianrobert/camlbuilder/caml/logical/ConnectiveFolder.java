package me.christianrobert.camlbuilder.caml.logical;

import me.christianrobert.camlbuilder.caml.CamlStatement;
import me.christianrobert.camlbuilder.caml.context.CamlBuildException;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds any number of statements into the binary-only And/Or of the CAML dialect.
 *
 * <p>Rules:
 * <ul>
 *   <li>one statement: returned as is, never wrapped</li>
 *   <li>two statements: one join, in the given order</li>
 *   <li>more: nested according to the {@link FoldStrategy}, order preserved</li>
 *   <li>none: rejected</li>
 * </ul>
 *
 * <p>The result is a strict binary tree whose leaves, read left to right,
 * are the input statements in input order.
 */
public final class ConnectiveFolder {

    private ConnectiveFolder() {
    }

    /**
     * Folds statements left-deep.
     *
     * @param joinType And / Or
     * @param statements At least one statement
     * @return Root statement
     * @throws CamlBuildException if the list is null, empty or contains null
     */
    public static CamlStatement fold(LogicalJoinType joinType, List<? extends CamlStatement> statements) {
        return fold(joinType, statements, FoldStrategy.LEFT_DEEP);
    }

    /**
     * Folds statements with the given strategy.
     *
     * @param joinType And / Or
     * @param statements At least one statement
     * @param strategy Nesting strategy
     * @return Root statement
     * @throws CamlBuildException if the list is null, empty or contains null
     */
    public static CamlStatement fold(LogicalJoinType joinType, List<? extends CamlStatement> statements,
                                     FoldStrategy strategy) {
        if (joinType == null) {
            throw new CamlBuildException("Join type cannot be null");
        }
        if (strategy == null) {
            throw new CamlBuildException("Fold strategy cannot be null", joinType.getTag());
        }
        if (statements == null || statements.isEmpty()) {
            throw new CamlBuildException("A logical join requires at least one statement", joinType.getTag());
        }

        List<CamlStatement> operands = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            CamlStatement statement = statements.get(i);
            if (statement == null) {
                throw new CamlBuildException("Statement at index " + i + " is null", joinType.getTag());
            }
            operands.add(statement);
        }

        switch (strategy) {
            case BALANCED:
                return foldBalanced(joinType, operands, 0, operands.size());
            case LEFT_DEEP:
            default:
                return foldLeftDeep(joinType, operands);
        }
    }

    private static CamlStatement foldLeftDeep(LogicalJoinType joinType, List<CamlStatement> operands) {
        CamlStatement result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            result = new LogicalJoin(joinType, result, operands.get(i));
        }
        return result;
    }

    /**
     * Folds operands[from, to). The left half gets the extra element on odd sizes.
     */
    private static CamlStatement foldBalanced(LogicalJoinType joinType, List<CamlStatement> operands,
                                              int from, int to) {
        int size = to - from;
        if (size == 1) {
            return operands.get(from);
        }
        int mid = from + (size + 1) / 2;
        return new LogicalJoin(joinType,
            foldBalanced(joinType, operands, from, mid),
            foldBalanced(joinType, operands, mid, to));
    }
}

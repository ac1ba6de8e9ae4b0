package dev.abapfmt.indent;

import dev.abapfmt.model.InternalConsistencyException;
import dev.abapfmt.model.Program;
import dev.abapfmt.model.Statement;
import dev.abapfmt.model.StatementKind;
import dev.abapfmt.source.RawStatement;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the nesting depth of every raw statement with a block-keyword state machine and hands the result to the
 * built statements.
 */
public class IndentationEngine {

    /**
     * Assigns each statement of {@code program} the level computed for the raw statement it was built from.
     */
    public void indent(Program program, List<RawStatement> rawStatements) {
        int[] levels = computeLevels(rawStatements);
        for (Statement statement : program.statements()) {
            int index = statement.sourceIndex();
            if (index < 0 || index >= levels.length) {
                throw new InternalConsistencyException("Statement refers to unknown raw statement " + index,
                        statement.span());
            }
            statement.assignIndentLevel(levels[index]);
        }
    }

    /**
     * One level per raw statement; {@link Statement#KEEP_ORIGINAL_COLUMN} for synthetic statements.
     */
    public int[] computeLevels(List<RawStatement> statements) {
        int[] levels = new int[statements.size()];
        Set<Integer> openingBlocks = matchOptionalBlocks(statements);
        int depth = 0;
        int alignTarget = -1;
        int alignDepth = 0;

        for (int index = 0; index < statements.size(); index++) {
            if (alignTarget >= 0 && index >= alignTarget) {
                alignTarget = -1;
            }
            RawStatement statement = statements.get(index);
            if (statement.isSynthetic()) {
                levels[index] = Statement.KEEP_ORIGINAL_COLUMN;
                continue;
            }

            BlockBehavior behavior = BlockKeywords.behaviorOf(statement.kind());
            if (behavior.movesOut()) {
                depth = Math.max(depth - 1, 0);
            }

            int level = depth;
            if (alignTarget >= 0) {
                level = alignDepth;
            } else if (statement.isComment()) {
                int target = findAlignmentTarget(statements, index, depth);
                if (target >= 0) {
                    alignTarget = target;
                    alignDepth = Math.max(depth - 1, 0);
                    level = alignDepth;
                }
            }
            levels[index] = level;

            if (behavior.indentAfter() && (!behavior.optionalBlock() || openingBlocks.contains(index))) {
                depth++;
            }
        }
        return levels;
    }

    // A comment block separated by a blank line right before ELSE, WHEN or CATCH describes that branch.
    private int findAlignmentTarget(List<RawStatement> statements, int start, int depth) {
        if (depth <= 0 || start == 0 || !hasBlankLineAbove(statements.get(start), statements.get(start - 1))) {
            return -1;
        }
        int cursor = start + 1;
        while (cursor < statements.size()
                && statements.get(cursor).isComment()
                && !hasBlankLineAbove(statements.get(cursor), statements.get(cursor - 1))) {
            cursor++;
        }
        if (cursor >= statements.size()) {
            return -1;
        }
        return BlockKeywords.isMiddle(statements.get(cursor).kind()) ? cursor : -1;
    }

    private static boolean hasBlankLineAbove(RawStatement statement, RawStatement previous) {
        return statement.span().startLine() - previous.span().endLine() >= 2;
    }

    private static Set<Integer> matchOptionalBlocks(List<RawStatement> statements) {
        Set<Integer> matched = new HashSet<>();
        Map<StatementKind, Deque<Integer>> openers = new EnumMap<>(StatementKind.class);
        for (int index = 0; index < statements.size(); index++) {
            StatementKind kind = statements.get(index).kind();
            StatementKind closer = BlockKeywords.optionalCloserOf(kind);
            if (closer != null) {
                openers.computeIfAbsent(closer, ignored -> new ArrayDeque<>()).push(index);
                continue;
            }
            Deque<Integer> open = openers.get(kind);
            if (open != null && !open.isEmpty()) {
                matched.add(open.pop());
            }
        }
        return matched;
    }
}

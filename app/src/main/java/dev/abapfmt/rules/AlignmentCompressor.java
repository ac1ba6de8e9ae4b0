package dev.abapfmt.rules;

import dev.abapfmt.model.Chain;
import dev.abapfmt.model.ChainEntry;
import dev.abapfmt.model.Comment;
import dev.abapfmt.model.Statement;
import dev.abapfmt.model.Token;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Detects stale vertical alignment across lines and records per-token space overrides that shrink it.
 *
 * <p>Tokens are indexed by horizontal signature: {@code 2 * column} for their left edge, and {@code 2 * column + 1}
 * for the right edge of operators or the decimal position of numeric literals. Signatures are processed from right
 * to left. Runs of at least {@value #MIN_RUN} compatible tokens on consecutive lines form an alignment column whose
 * surplus padding is removed evenly; tokens outside any column are condensed to a single space.
 */
public class AlignmentCompressor {

    static final int MIN_RUN = 3;

    private static final Comparator<PositionedToken> SOURCE_ORDER = Comparator
            .comparingInt(PositionedToken::line)
            .thenComparingInt(PositionedToken::statementOrdinal)
            .thenComparingInt(PositionedToken::startColumn);

    private static final Set<String> BRIDGE_KEYWORDS = Set.of("ELSE", "ELSEIF", "WHEN");

    public void apply(List<Statement> statements, FormattingContext context) {
        new Pass(statements, context).run();
    }

    private static final class Pass {

        private final List<Statement> statements;
        private final FormattingContext context;
        private final List<PositionedToken> positions = new ArrayList<>();
        private final TreeMap<Integer, List<PositionedToken>> bySignature = new TreeMap<>();
        private final Map<Integer, PositionedToken> firstTokenOfLine = new HashMap<>();
        private final Set<Integer> occupiedLines = new HashSet<>();
        private final Set<Token> grouped = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Set<Token> processed = Collections.newSetFromMap(new IdentityHashMap<>());

        Pass(List<Statement> statements, FormattingContext context) {
            this.statements = statements;
            this.context = context;
        }

        void run() {
            collect();
            for (Integer signature : bySignature.descendingKeySet()) {
                List<PositionedToken> group = bySignature.get(signature);
                if (group.size() < MIN_RUN) {
                    continue;
                }
                group.sort(SOURCE_ORDER);
                processGroup(group, signature);
            }
            condenseStandaloneTokens();
            collapseEmptyBrackets();
        }

        private void collect() {
            for (int ordinal = 0; ordinal < statements.size(); ordinal++) {
                Statement statement = statements.get(ordinal);
                statement.trailingComment().ifPresent(this::occupy);
                if (statement.isChain()) {
                    Chain chain = statement.chain().orElseThrow();
                    chain.keywordTokens().forEach(token -> occupy(token.span().startLine(), token.span().endLine()));
                    for (ChainEntry entry : chain.entries()) {
                        entry.comment().ifPresent(this::occupy);
                        entry.trailingComment().ifPresent(this::occupy);
                        collectSequence(entry.tokens(), ordinal);
                    }
                } else {
                    collectSequence(statement.tokens(), ordinal);
                }
            }
        }

        private void collectSequence(List<Token> tokens, int ordinal) {
            PositionedToken previous = null;
            for (Token token : tokens) {
                int line = token.span().startLine();
                int startColumn = token.span().startColumn();
                boolean firstInLine = previous == null || previous.line() != line;
                int previousEnd = firstInLine ? startColumn : previous.endColumn();
                int spacesLeft = firstInLine ? startColumn : Math.max(0, startColumn - previous.endColumn());
                AlignmentClass alignmentClass = AlignmentClass.of(token);
                PositionedToken position = new PositionedToken(token, alignmentClass,
                        previous == null ? null : previous.alignmentClass(), line, ordinal, startColumn,
                        token.span().endColumn(), previousEnd, spacesLeft, firstInLine);
                positions.add(position);
                occupy(line, token.span().endLine());
                if (firstInLine) {
                    firstTokenOfLine.putIfAbsent(line, position);
                }

                register(2 * startColumn, position);
                if (alignmentClass == AlignmentClass.ASSIGNMENT_OP || alignmentClass == AlignmentClass.COMPARISON_OP) {
                    register(2 * (token.span().endColumn() - 1) + 1, position);
                } else if (AlignmentClass.isNumericLiteral(token)) {
                    register(2 * (startColumn + AlignmentClass.numericAlignmentIndex(token.text())) + 1, position);
                }
                previous = position;
            }
        }

        private void register(int signature, PositionedToken position) {
            bySignature.computeIfAbsent(signature, ignored -> new ArrayList<>()).add(position);
        }

        private void occupy(Comment comment) {
            occupy(comment.span().startLine(), comment.span().endLine());
        }

        private void occupy(int fromLine, int toLine) {
            for (int line = fromLine; line <= toLine; line++) {
                occupiedLines.add(line);
            }
        }

        private void processGroup(List<PositionedToken> group, int signature) {
            boolean derived = signature % 2 != 0;
            int column = signature / 2;
            int start = 0;
            while (start < group.size()) {
                PositionedToken first = group.get(start);
                int end = start + 1;
                while (end < group.size() && !breaksRun(first, group.get(end - 1), group.get(end), column)) {
                    end++;
                }
                List<PositionedToken> run = group.subList(start, end);
                if (run.stream().noneMatch(position -> processed.contains(position.token()))) {
                    compress(run, derived);
                }
                start = end;
            }
        }

        private boolean breaksRun(PositionedToken first, PositionedToken previous, PositionedToken candidate,
                                  int column) {
            if (first.alignmentClass() != AlignmentClass.COMMENT
                    && previous.statementOrdinal() != candidate.statementOrdinal()
                    && candidate.line() > previous.line() + 1
                    && hasBreakingLineBetween(previous.line(), candidate.line(), column)) {
                return true;
            }
            if (first.previousClass() == AlignmentClass.ASSIGNMENT_OP
                    && candidate.previousClass() == AlignmentClass.ASSIGNMENT_OP) {
                return false;
            }
            return !first.alignmentClass().isCompatibleWith(candidate.alignmentClass());
        }

        // Blank lines break a run; comment-only lines and lines led by ELSE, ELSEIF or WHEN do not.
        private boolean hasBreakingLineBetween(int fromLine, int toLine, int column) {
            for (int line = fromLine + 1; line < toLine; line++) {
                PositionedToken leading = firstTokenOfLine.get(line);
                if (leading == null) {
                    if (!occupiedLines.contains(line)) {
                        return true;
                    }
                    continue;
                }
                if (leading.startColumn() < column && !BRIDGE_KEYWORDS.contains(leading.token().upper())) {
                    return true;
                }
            }
            return false;
        }

        private void compress(List<PositionedToken> run, boolean derived) {
            if (run.size() < MIN_RUN) {
                return;
            }
            run.forEach(position -> grouped.add(position.token()));

            int anchor = 0;
            if (derived) {
                boolean allColumnsEqual = run.stream()
                        .allMatch(position -> position.startColumn() == run.get(0).startColumn());
                if (allColumnsEqual) {
                    return;
                }
                for (PositionedToken position : run) {
                    if (!position.firstInLine()) {
                        anchor = Math.max(anchor, position.previousEnd());
                    }
                }
                run.forEach(position -> processed.add(position.token()));
            }

            int spacesToSpare = Integer.MAX_VALUE;
            for (PositionedToken position : run) {
                if (position.firstInLine()) {
                    return;
                }
                int slack = derived
                        ? position.startColumn() - anchor - 1
                        : position.spacesLeft() - 1;
                spacesToSpare = Math.min(spacesToSpare, slack);
            }
            if (spacesToSpare <= 0) {
                return;
            }

            for (PositionedToken position : run) {
                if (position.alignmentClass().isSeparator() || position.alignmentClass() == AlignmentClass.COMMENT) {
                    continue;
                }
                context.overrideSpaces(position.token(), Math.max(0, position.spacesLeft() - spacesToSpare));
            }
        }

        private void condenseStandaloneTokens() {
            for (PositionedToken position : positions) {
                if (position.firstInLine() || grouped.contains(position.token())
                        || context.hasOverride(position.token())) {
                    continue;
                }
                AlignmentClass alignmentClass = position.alignmentClass();
                if (alignmentClass.isSeparator() || alignmentClass == AlignmentClass.COMMENT
                        || alignmentClass == AlignmentClass.PRAGMA) {
                    continue;
                }
                if (position.spacesLeft() > 1) {
                    context.overrideSpaces(position.token(), 1);
                }
            }
        }

        private void collapseEmptyBrackets() {
            for (Statement statement : statements) {
                if (statement.isChain()) {
                    statement.chain().orElseThrow().entries().forEach(entry -> collapseEmptyBrackets(entry.tokens()));
                } else {
                    collapseEmptyBrackets(statement.tokens());
                }
            }
        }

        private void collapseEmptyBrackets(List<Token> tokens) {
            for (int index = 0; index + 1 < tokens.size(); index++) {
                Token current = tokens.get(index);
                Token next = tokens.get(index + 1);
                boolean pair = (current.is("(") && next.is(")")) || (current.is("[") && next.is("]"));
                if (pair && current.span().endLine() == next.span().startLine()
                        && next.span().startColumn() > current.span().endColumn()) {
                    context.overrideSpaces(next, 0);
                }
            }
        }
    }

    private record PositionedToken(Token token,
                                   AlignmentClass alignmentClass,
                                   AlignmentClass previousClass,
                                   int line,
                                   int statementOrdinal,
                                   int startColumn,
                                   int endColumn,
                                   int previousEnd,
                                   int spacesLeft,
                                   boolean firstInLine) {
    }
}

package dev.abapfmt.render;

import dev.abapfmt.config.FormatOptions;
import dev.abapfmt.model.Chain;
import dev.abapfmt.model.ChainEntry;
import dev.abapfmt.model.Comment;
import dev.abapfmt.model.Statement;
import dev.abapfmt.model.Token;
import dev.abapfmt.rules.AbapKeywords;
import dev.abapfmt.rules.CommentNormalizer;
import dev.abapfmt.rules.FormattingContext;
import dev.abapfmt.rules.SpacingRules;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns one statement into output lines: indentation, token spacing, break flags and comment placement.
 */
public class LineRenderer {

    /** Chain keywords whose first entry always starts on the line after the colon. */
    static final Set<String> BLOCK_STYLE_CHAIN_KEYWORDS = Set.of("CLEAR", "FREE", "SORT", "CATCH", "TRY");

    private final FormatOptions options;
    private final AbapKeywords keywords;
    private final SpacingRules spacing;
    private final CommentNormalizer comments;

    public LineRenderer(FormatOptions options, AbapKeywords keywords) {
        this.options = Objects.requireNonNull(options, "options");
        this.keywords = Objects.requireNonNull(keywords, "keywords");
        this.spacing = new SpacingRules(options);
        this.comments = new CommentNormalizer(options);
    }

    public List<String> render(Statement statement, FormattingContext context) {
        if (statement.isCommentOnly()) {
            return statement.trailingComment()
                    .map(comment -> List.of(renderStandaloneComment(comment, baseIndent(statement))))
                    .orElse(List.of());
        }
        if (statement.isChain()) {
            return renderChain(statement, context);
        }
        return renderSimple(statement, context);
    }

    private List<String> renderSimple(Statement statement, FormattingContext context) {
        List<Token> tokens = statement.tokens();
        int base = baseIndent(statement);
        RenderedLines rendered = renderTokens(tokens, spaces(base), base, tokens.get(0).span().startColumn(),
                context);
        Optional<Comment> postComment = context.postComment(statement);
        rendered.mergeLeadingPunctuation(postComment.isPresent());

        statement.trailingComment().ifPresent(comment -> {
            int index = rendered.lineFor(comment);
            rendered.replace(index, comments.append(rendered.lines().get(index), comment));
        });
        postComment.ifPresent(comment -> rendered.replace(rendered.lastIndex(),
                comments.append(rendered.lines().get(rendered.lastIndex()), comment)));
        return rendered.lines();
    }

    private List<String> renderChain(Statement statement, FormattingContext context) {
        Chain chain = statement.chain().orElseThrow();
        int base = baseIndent(statement);
        String keyword = renderKeywordTokens(chain.keywordTokens(), context);
        boolean inlineFirst = !BLOCK_STYLE_CHAIN_KEYWORDS.contains(chain.keyword().upper());
        int entryIndent = inlineFirst ? base + keyword.length() + 2 : base + options.indentWidth();

        List<String> lines = new ArrayList<>();
        List<Boolean> endsInComment = new ArrayList<>();
        boolean firstMemberSeen = false;
        for (ChainEntry entry : chain.entries()) {
            if (!entry.isMember()) {
                Comment comment = entry.comment().orElseThrow();
                lines.add(comment.isLineComment()
                        ? comment.value()
                        : spaces(comment.span().startColumn()) + comments.normalize(comment.value().stripLeading()));
                endsInComment.add(true);
                continue;
            }
            String firstPrefix;
            if (!firstMemberSeen && inlineFirst && !entry.tokens().isEmpty()) {
                firstPrefix = spaces(base) + keyword + ": ";
            } else {
                if (!firstMemberSeen) {
                    lines.add(spaces(base) + keyword + ":");
                    endsInComment.add(false);
                }
                firstPrefix = spaces(entryIndent);
            }
            firstMemberSeen = true;
            if (entry.tokens().isEmpty()) {
                lines.add(firstPrefix.stripTrailing());
                endsInComment.add(false);
                continue;
            }

            RenderedLines rendered = renderTokens(entry.tokens(), firstPrefix, entryIndent,
                    entry.tokens().get(0).span().startColumn(), context);
            rendered.mergeLeadingPunctuation(false);
            boolean commented = entry.trailingComment().isPresent();
            entry.trailingComment().ifPresent(comment -> {
                int index = rendered.lineFor(comment);
                rendered.replace(index, comments.append(rendered.lines().get(index), comment));
            });
            for (int index = 0; index < rendered.lines().size(); index++) {
                lines.add(rendered.lines().get(index));
                endsInComment.add(commented && index == rendered.lastIndex());
            }
        }
        if (lines.isEmpty()) {
            lines.add(spaces(base) + keyword + ":");
            endsInComment.add(false);
        }
        return mergeDanglingSeparators(lines, endsInComment);
    }

    // An empty member leaves a lone comma or period; it joins the line above unless that line ends in a comment.
    private static List<String> mergeDanglingSeparators(List<String> lines, List<Boolean> endsInComment) {
        List<String> merged = new ArrayList<>();
        List<Boolean> mergedComments = new ArrayList<>();
        for (int index = 0; index < lines.size(); index++) {
            String stripped = lines.get(index).stripLeading();
            boolean separator = stripped.startsWith(".") || stripped.startsWith(",");
            int last = merged.size() - 1;
            if (separator && last >= 0 && !mergedComments.get(last)) {
                merged.set(last, merged.get(last).stripTrailing() + stripped);
                mergedComments.set(last, endsInComment.get(index));
            } else {
                merged.add(lines.get(index));
                mergedComments.add(endsInComment.get(index));
            }
        }
        return merged;
    }

    private RenderedLines renderTokens(List<Token> tokens, String firstPrefix, int continuationIndent,
                                       int originColumn, FormattingContext context) {
        RenderedLines rendered = new RenderedLines();
        StringBuilder line = new StringBuilder(firstPrefix);
        Token previous = null;
        int firstSourceLine = -1;
        int lastSourceLine = -1;
        for (Token token : tokens) {
            if (firstSourceLine < 0) {
                firstSourceLine = token.line();
            }
            lastSourceLine = token.line();
            if (previous == null) {
                if (!rendered.isEmpty()) {
                    line.append(spaces(continuationIndent + Math.max(0, token.span().startColumn() - originColumn)));
                }
            } else {
                line.append(spaces(spacing.spacesBefore(token, previous, context)));
            }
            line.append(keywords.render(token, options.keywordCase()));
            previous = token;

            if (token.hasFollowingLineBreak()) {
                rendered.add(line.toString(), firstSourceLine, lastSourceLine);
                line = new StringBuilder();
                previous = null;
                firstSourceLine = -1;
            }
        }
        if (!line.toString().isBlank() || rendered.isEmpty()) {
            int last = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).line();
            rendered.add(line.toString(), firstSourceLine < 0 ? last : firstSourceLine, Math.max(lastSourceLine, last));
        }
        return rendered;
    }

    private String renderKeywordTokens(List<Token> tokens, FormattingContext context) {
        StringBuilder text = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (previous != null) {
                text.append(spaces(Math.min(1, spacing.spacesBefore(token, previous, context))));
            }
            text.append(keywords.render(token, options.keywordCase()));
            previous = token;
        }
        return text.toString();
    }

    private String renderStandaloneComment(Comment comment, int indent) {
        if (comment.isLineComment()) {
            return comment.value();
        }
        return spaces(indent) + comments.normalize(comment.value().stripLeading());
    }

    private int baseIndent(Statement statement) {
        int level = statement.indentLevel();
        if (level == Statement.KEEP_ORIGINAL_COLUMN) {
            return statement.span().startColumn();
        }
        return level * options.indentWidth();
    }

    private static String spaces(int count) {
        return " ".repeat(Math.max(0, count));
    }
}

package dev.abapfmt.build;

import dev.abapfmt.model.Chain;
import dev.abapfmt.model.ChainEntry;
import dev.abapfmt.model.Comment;
import dev.abapfmt.model.InternalConsistencyException;
import dev.abapfmt.model.Program;
import dev.abapfmt.model.SourceSpan;
import dev.abapfmt.model.Statement;
import dev.abapfmt.model.Token;
import dev.abapfmt.model.TokenRole;
import dev.abapfmt.source.RawStatement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups raw statements into logical statements: chain members sharing one colon become a single chain-bearing
 * statement, and comments are attached as trailing comments, chain entries or standalone comment statements.
 */
public class StatementBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(StatementBuilder.class);

    public Program build(String fileName, List<RawStatement> rawStatements) {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(rawStatements, "rawStatements");
        List<Statement> statements = new Run(rawStatements).build();
        LOGGER.debug("Built {} statements from {} raw statements in {}", statements.size(), rawStatements.size(),
                fileName);
        return new Program(fileName, statements);
    }

    /**
     * Copies the tokens and sets each break flag when the following token starts on a later source line.
     */
    static List<Token> copyWithLineBreaks(List<Token> tokens) {
        List<Token> copies = new ArrayList<>(tokens.size());
        for (int index = 0; index < tokens.size(); index++) {
            Token token = tokens.get(index);
            boolean lineBreak = index + 1 < tokens.size()
                    && tokens.get(index + 1).span().startLine() > token.span().endLine();
            copies.add(token.copy(lineBreak));
        }
        return copies;
    }

    /**
     * Places pragma copies right before the terminal period or comma, or at the end of an unterminated statement.
     */
    static List<Token> insertPragmas(List<Token> tokens, List<Token> pragmas) {
        if (pragmas.isEmpty()) {
            return tokens;
        }
        List<Token> result = new ArrayList<>(tokens);
        List<Token> copies = pragmas.stream().map(pragma -> pragma.copy(false)).collect(Collectors.toList());
        int insertAt = result.size();
        if (!result.isEmpty()) {
            Token last = result.get(result.size() - 1);
            if (last.role() == TokenRole.PUNCTUATION && (last.isPeriod() || last.isComma())) {
                insertAt = result.size() - 1;
            }
        }
        result.addAll(insertAt, copies);
        return result;
    }

    private static final class Run {

        private final List<RawStatement> raw;
        private final List<Statement> statements = new ArrayList<>();
        private final List<Comment> pending = new ArrayList<>();

        Run(List<RawStatement> raw) {
            this.raw = raw;
        }

        List<Statement> build() {
            int index = 0;
            while (index < raw.size()) {
                RawStatement current = raw.get(index);
                if (current.isComment()) {
                    placeComment(toComment(current), index);
                    index++;
                } else if (current.isChainMember()) {
                    index = buildChain(index);
                } else {
                    statements.add(buildSimple(current, index));
                    index++;
                }
            }
            for (Comment leftover : pending) {
                statements.add(Statement.commentOnly(leftover.asInline(false), raw.size() - 1));
            }
            return statements;
        }

        private void placeComment(Comment comment, int index) {
            // A '*' comment only counts as a comment in the first column, so it always keeps a line of its own.
            if (comment.isLineComment()) {
                statements.add(Statement.commentOnly(comment, index));
                return;
            }
            RawStatement next = nextCode(index);
            if (next != null && next.span().containsOffset(comment.span().startOffset())) {
                if (next.isChainMember() || pending.isEmpty()) {
                    pending.add(comment.asInline(true));
                } else {
                    statements.add(Statement.commentOnly(comment, index));
                }
                return;
            }
            Statement previous = statements.isEmpty() ? null : statements.get(statements.size() - 1);
            if (previous != null && !previous.isCommentOnly() && previous.span().endLine() == comment.line()) {
                if (previous.trailingComment().isEmpty()) {
                    previous.setTrailingComment(comment.asInline(true));
                } else {
                    statements.add(Statement.commentOnly(comment.asInline(true), index));
                }
                return;
            }
            statements.add(Statement.commentOnly(comment, index));
        }

        private Statement buildSimple(RawStatement source, int index) {
            List<Token> tokens = copyWithLineBreaks(source.tokens());
            List<Token> withPragmas = insertPragmas(tokens, source.pragmas());
            Statement.Builder builder = Statement.builder(source.kind(), source.span())
                    .tokens(withPragmas)
                    .pragmas(withPragmas.stream().filter(token -> token.role() == TokenRole.PRAGMA).toList())
                    .raw(describe(source.tokens()))
                    .sourceIndex(index);
            if (!pending.isEmpty()) {
                builder.trailingComment(pending.remove(0));
            }
            return builder.build();
        }

        private int buildChain(int start) {
            RawStatement first = raw.get(start);
            int colonOffset = first.colon().span().startOffset();
            List<Token> keywordTokens = first.tokens().stream()
                    .filter(token -> token.span().startOffset() < colonOffset)
                    .toList();
            if (keywordTokens.isEmpty()) {
                throw new InternalConsistencyException("Chain keyword statement yields no tokens", first.span());
            }

            List<RawStatement> members = new ArrayList<>();
            List<Comment> interleaved = new ArrayList<>();
            members.add(first);
            int cursor = start + 1;
            while (cursor < raw.size()) {
                RawStatement candidate = raw.get(cursor);
                if (!candidate.isComment() && sharesColon(candidate, colonOffset)) {
                    members.add(candidate);
                } else if (candidate.isComment() && nextMemberFollows(cursor, colonOffset)) {
                    interleaved.add(toComment(candidate));
                } else {
                    break;
                }
                cursor++;
            }

            List<Member> slots = new ArrayList<>();
            List<Token> allTokens = new ArrayList<>();
            List<Token> allPragmas = new ArrayList<>();
            SourceSpan span = first.colon().span();
            for (Token keyword : keywordTokens) {
                span = span.union(keyword.span());
            }
            for (RawStatement member : members) {
                List<Token> own = member.tokens().stream()
                        .filter(token -> token.span().startOffset() > colonOffset)
                        .toList();
                List<Token> tokens = insertPragmas(copyWithLineBreaks(own), member.pragmas());
                ChainEntry entry = ChainEntry.member(tokens);
                SourceSpan ownSpan = tokens.isEmpty() ? member.span() : spanOf(tokens);
                slots.add(new Member(entry, ownSpan));
                allTokens.addAll(tokens);
                tokens.stream().filter(token -> token.role() == TokenRole.PRAGMA).forEach(allPragmas::add);
                span = span.union(ownSpan);
            }

            List<ChainEntry> entries = new ArrayList<>();
            slots.forEach(slot -> entries.add(slot.entry()));
            ChainEntry firstEntry = slots.get(0).entry();
            for (Comment comment : pending) {
                if (firstEntry.trailingComment().isEmpty()) {
                    firstEntry.setTrailingComment(comment.asInline(true));
                } else {
                    entries.add(ChainEntry.comment(comment.asInline(false)));
                }
            }
            pending.clear();
            for (Comment comment : interleaved) {
                span = span.union(comment.span());
                placeInChain(comment, slots, entries);
            }

            Chain chain = new Chain(copyWithLineBreaks(keywordTokens), entries);
            statements.add(Statement.builder(first.kind(), span)
                    .tokens(allTokens)
                    .pragmas(allPragmas)
                    .raw(describe(keywordTokens) + ": " + describe(allTokens))
                    .chain(chain)
                    .sourceIndex(start)
                    .build());
            return cursor;
        }

        private void placeInChain(Comment comment, List<Member> slots, List<ChainEntry> entries) {
            if (comment.isLineComment()) {
                entries.add(ChainEntry.comment(comment));
                return;
            }
            int offset = comment.span().startOffset();
            Member previous = null;
            for (Member slot : slots) {
                if (slot.span().containsOffset(offset)) {
                    if (slot.entry().trailingComment().isEmpty()) {
                        slot.entry().setTrailingComment(comment.asInline(true));
                        return;
                    }
                    break;
                }
                if (slot.span().endOffset() <= offset) {
                    previous = slot;
                }
            }
            if (previous != null && previous.span().endLine() == comment.line()
                    && previous.entry().trailingComment().isEmpty()) {
                previous.entry().setTrailingComment(comment.asInline(true));
                return;
            }
            entries.add(ChainEntry.comment(comment.asInline(false)));
        }

        private boolean nextMemberFollows(int cursor, int colonOffset) {
            int index = cursor + 1;
            while (index < raw.size() && raw.get(index).isComment()) {
                index++;
            }
            return index < raw.size() && sharesColon(raw.get(index), colonOffset);
        }

        private RawStatement nextCode(int index) {
            for (int cursor = index + 1; cursor < raw.size(); cursor++) {
                if (!raw.get(cursor).isComment()) {
                    return raw.get(cursor);
                }
            }
            return null;
        }

        private static boolean sharesColon(RawStatement candidate, int colonOffset) {
            return candidate.colon() != null && candidate.colon().span().startOffset() == colonOffset;
        }

        private static Comment toComment(RawStatement source) {
            Token token = source.tokens().get(0);
            return new Comment(token.text(), false, token.span());
        }

        private static SourceSpan spanOf(List<Token> tokens) {
            SourceSpan span = tokens.get(0).span();
            for (Token token : tokens) {
                span = span.union(token.span());
            }
            return span;
        }

        private static String describe(List<Token> tokens) {
            return tokens.stream().map(Token::text).collect(Collectors.joining(" "));
        }
    }

    private record Member(ChainEntry entry, SourceSpan span) {
    }
}

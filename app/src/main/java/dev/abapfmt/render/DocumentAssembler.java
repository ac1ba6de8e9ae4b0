package dev.abapfmt.render;

import dev.abapfmt.model.Comment;
import dev.abapfmt.model.Program;
import dev.abapfmt.model.Statement;
import dev.abapfmt.rules.CommentNormalizer;
import dev.abapfmt.rules.FormattingContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Joins rendered statements into the output document, keeping the number of blank lines between statements.
 */
public class DocumentAssembler {

    private final LineRenderer renderer;
    private final CommentNormalizer comments;

    public DocumentAssembler(LineRenderer renderer, CommentNormalizer comments) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.comments = Objects.requireNonNull(comments, "comments");
    }

    public List<String> assembleLines(Program program, FormattingContext context) {
        List<String> output = new ArrayList<>();
        Statement previous = null;
        for (Statement statement : program.statements()) {
            if (previous != null && appendsToPreviousLine(statement, previous)) {
                int last = output.size() - 1;
                output.set(last, comments.append(output.get(last), statement.trailingComment().orElseThrow()));
                continue;
            }
            List<String> lines = renderer.render(statement, context);
            if (lines.isEmpty()) {
                continue;
            }
            if (previous != null) {
                int gap = Math.max(1, statement.span().startLine() - previous.span().endLine());
                for (int blank = 1; blank < gap; blank++) {
                    output.add("");
                }
            }
            output.addAll(lines);
            previous = statement;
        }
        return output;
    }

    /**
     * The document text: lines joined with line feeds and terminated by one.
     */
    public String assemble(Program program, FormattingContext context) {
        return String.join("\n", assembleLines(program, context)) + "\n";
    }

    // An inline comment that was not merged stays on the line of the statement it followed.
    private static boolean appendsToPreviousLine(Statement statement, Statement previous) {
        if (!statement.isCommentOnly()) {
            return false;
        }
        Optional<Comment> comment = statement.trailingComment();
        return comment.isPresent() && comment.get().inline() && comment.get().line() == previous.span().endLine();
    }
}

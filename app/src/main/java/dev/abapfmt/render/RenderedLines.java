package dev.abapfmt.render;

import dev.abapfmt.model.Comment;
import java.util.ArrayList;
import java.util.List;

/**
 * Output lines of one token sequence together with the source line range each of them carries.
 */
final class RenderedLines {

    private final List<String> lines = new ArrayList<>();
    private final List<int[]> sourceRanges = new ArrayList<>();

    void add(String line, int firstSourceLine, int lastSourceLine) {
        lines.add(line.stripTrailing());
        sourceRanges.add(new int[] {firstSourceLine, lastSourceLine});
    }

    boolean isEmpty() {
        return lines.isEmpty();
    }

    List<String> lines() {
        return lines;
    }

    /**
     * Pulls every line that starts with a period or comma up to the end of the line before it. With
     * {@code keepLast} the last line stays where it is.
     */
    void mergeLeadingPunctuation(boolean keepLast) {
        for (int index = 1; index < lines.size(); index++) {
            if (keepLast && index == lines.size() - 1) {
                break;
            }
            String stripped = lines.get(index).stripLeading();
            if (!stripped.startsWith(".") && !stripped.startsWith(",")) {
                continue;
            }
            lines.set(index - 1, lines.get(index - 1).stripTrailing() + stripped);
            sourceRanges.get(index - 1)[1] = sourceRanges.get(index)[1];
            lines.remove(index);
            sourceRanges.remove(index);
            index--;
        }
    }

    /**
     * Index of the line whose source range holds the comment, else the last line.
     */
    int lineFor(Comment comment) {
        for (int index = 0; index < sourceRanges.size(); index++) {
            int[] range = sourceRanges.get(index);
            if (comment.line() >= range[0] && comment.line() <= range[1]) {
                return index;
            }
        }
        return lines.size() - 1;
    }

    void replace(int index, String line) {
        lines.set(index, line);
    }

    int lastIndex() {
        return lines.size() - 1;
    }
}

package dev.abapfmt.rules;

import static org.assertj.core.api.Assertions.assertThat;

import dev.abapfmt.build.StatementBuilder;
import dev.abapfmt.config.FormatOptions;
import dev.abapfmt.format.AbapFormatter;
import dev.abapfmt.model.Statement;
import dev.abapfmt.model.Token;
import dev.abapfmt.source.AbapStatementReader;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class AlignmentCompressorTest {

    private final AlignmentCompressor compressor = new AlignmentCompressor();

    @Test
    void shrinksPaddingOfAlignedColumnEvenly() {
        List<Statement> statements = build(String.join("\n",
                "lv_a             = 1.",
                "lv_bb            = 2.",
                "lv_c             = 3.",
                ""));
        FormattingContext context = new FormattingContext();

        compressor.apply(statements, context);

        assertThat(overridesOf(statements, "=", context)).containsExactly(2, 1, 2);
    }

    @Test
    void condensesTwoLineAlignmentToSingleSpace() {
        List<Statement> statements = build("lv_a     = 1.\nlv_bb    = 2.\n");
        FormattingContext context = new FormattingContext();

        compressor.apply(statements, context);

        assertThat(overridesOf(statements, "=", context)).containsExactly(1, 1);
    }

    @Test
    void blankLineEndsAlignmentRun() {
        List<Statement> statements = build("lv_a      = 1.\nlv_bb     = 2.\n\nlv_c      = 3.\n");
        FormattingContext context = new FormattingContext();

        compressor.apply(statements, context);

        assertThat(overridesOf(statements, "=", context)).containsExactly(1, 1, 1);
    }

    @Test
    void commentLineDoesNotEndAlignmentRun() {
        List<Statement> statements = build("lv_a      = 1.\nlv_bb     = 2.\n\" note\nlv_c      = 3.\n");
        FormattingContext context = new FormattingContext();

        compressor.apply(statements, context);

        assertThat(overridesOf(statements, "=", context)).containsExactly(2, 1, 2);
    }

    @Test
    void leavesTightAlignmentAlone() {
        List<Statement> statements = build("lv_a  = 1.\nlv_bb = 2.\nlv_c  = 3.\n");
        FormattingContext context = new FormattingContext();

        compressor.apply(statements, context);

        assertThat(statements).allSatisfy(statement -> assertThat(statement.tokens())
                .allSatisfy(token -> assertThat(context.hasOverride(token)).isFalse()));
    }

    @Test
    void collapsesEmptyBrackets() {
        List<Statement> statements = build("lv_a = f(   ).\n");
        FormattingContext context = new FormattingContext();

        compressor.apply(statements, context);

        assertThat(overridesOf(statements, ")", context)).containsExactly(0);
    }

    @Test
    void alignsRightEdgesOfOperatorsOfDifferentLength() {
        String source = String.join("\n",
                "lv_a     += 1.",
                "lv_bbb    = 2.",
                "lv_c     -= 3.",
                "");

        assertThat(format(source)).isEqualTo(String.join("\n",
                "lv_a   += 1.",
                "lv_bbb  = 2.",
                "lv_c   -= 3.",
                ""));
    }

    @Test
    void keepsNumbersAlignedOnTheirDecimalPoint() {
        String source = String.join("\n",
                "lv_a   =      1.5.",
                "lv_b   =     22.25.",
                "lv_c   =    333.125.",
                "");

        assertThat(format(source)).isEqualTo(String.join("\n",
                "lv_a =   1.5.",
                "lv_b =  22.25.",
                "lv_c = 333.125.",
                ""));
    }

    @Test
    void elseLineDoesNotEndAlignmentRun() {
        String source = String.join("\n",
                "IF lv_flag = abap_true.",
                "  lv_a      = 1.",
                "  lv_bb     = 2.",
                "ELSE.",
                "  lv_c      = 3.",
                "ENDIF.",
                "");

        assertThat(format(source)).isEqualTo(String.join("\n",
                "IF lv_flag = abap_true.",
                "  lv_a  = 1.",
                "  lv_bb = 2.",
                "ELSE.",
                "  lv_c  = 3.",
                "ENDIF.",
                ""));
    }

    @Test
    void neverWidensOriginalSpacing() {
        List<Statement> statements = build(String.join("\n",
                "lv_a     += 1.",
                "lv_bbb    = 2.",
                "lv_c     -= 3.",
                "lv_x   =      1.5.",
                "lv_y   =     22.25.",
                "lv_z   =    333.125.",
                "IF lv_flag     =    abap_true.",
                "  lv_q      = f(   ).   \" note",
                "  lv_rr     = 2.",
                "  lv_s      = 3.",
                "ENDIF.",
                ""));
        FormattingContext context = new FormattingContext();

        compressor.apply(statements, context);

        for (Statement statement : statements) {
            List<Token> tokens = statement.tokens();
            for (int index = 0; index < tokens.size(); index++) {
                Token token = tokens.get(index);
                if (!context.hasOverride(token)) {
                    continue;
                }
                assertThat(index).as("override on first token of %s", statement).isPositive();
                Token previous = tokens.get(index - 1);
                assertThat(previous.span().endLine()).isEqualTo(token.span().startLine());
                int original = token.span().startColumn() - previous.span().endColumn();
                assertThat(context.spaceOverride(token).getAsInt()).isBetween(0, original);
            }
        }
    }

    private static String format(String source) {
        return new AbapFormatter(FormatOptions.defaults()).format("zdemo.prog.abap", source).text();
    }

    private static List<Integer> overridesOf(List<Statement> statements, String text, FormattingContext context) {
        return statements.stream()
                .flatMap(statement -> statement.tokens().stream())
                .filter(token -> token.is(text))
                .map(context::spaceOverride)
                .map(value -> value.isPresent() ? value.getAsInt() : -1)
                .collect(Collectors.toList());
    }

    private static List<Statement> build(String source) {
        return new StatementBuilder()
                .build("zdemo.prog.abap", new AbapStatementReader().read("zdemo.prog.abap", source))
                .statements();
    }
}

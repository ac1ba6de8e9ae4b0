package dev.abapfmt.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.abapfmt.config.FormatOptions;
import dev.abapfmt.config.KeywordCase;
import dev.abapfmt.model.InternalConsistencyException;
import dev.abapfmt.model.SourceSpan;
import dev.abapfmt.model.StatementKind;
import dev.abapfmt.model.Token;
import dev.abapfmt.model.TokenRole;
import dev.abapfmt.source.LexedStatement;
import dev.abapfmt.source.RawStatement;
import java.util.List;
import org.junit.jupiter.api.Test;

class AbapFormatterTest {

    private final AbapFormatter formatter = new AbapFormatter(FormatOptions.defaults());

    @Test
    void indentsNestedBlocks() {
        String source = String.join("\n",
                "IF lv_a = 1.",
                "lv_x = 2.",
                "ELSE.",
                "lv_x = 3.",
                "ENDIF.",
                "");

        assertThat(format(source)).isEqualTo(String.join("\n",
                "IF lv_a = 1.",
                "  lv_x = 2.",
                "ELSE.",
                "  lv_x = 3.",
                "ENDIF.",
                ""));
    }

    @Test
    void keepsCaseBranchesAtTheLevelOfCase() {
        String source = String.join("\n",
                "CASE lv_kind.",
                "WHEN 1.",
                "lv_x = 1.",
                "WHEN OTHERS.",
                "lv_x = 2.",
                "ENDCASE.",
                "");

        assertThat(format(source)).isEqualTo(String.join("\n",
                "CASE lv_kind.",
                "WHEN 1.",
                "  lv_x = 1.",
                "WHEN OTHERS.",
                "  lv_x = 2.",
                "ENDCASE.",
                ""));
    }

    @Test
    void pullsClosingBracketUpAndKeepsInlineComment() {
        String source = "any_operation( iv_param = 1 \" comment\n).\n";

        assertThat(format(source)).isEqualTo("any_operation( iv_param = 1 ). \" comment\n");
    }

    @Test
    void mergesCommentOfMovedPeriodIntoTrailingComment() {
        String source = "lv_a = get_value( 1 \" first\n). \" second\n";

        assertThat(format(source)).isEqualTo("lv_a = get_value( 1 ). \" first; second\n");
    }

    @Test
    void keepsPseudoCommentsApartAndMovesPeriodToItsOwnLine() {
        String source = "lv_a = get_value( 1 \"#EC NEEDED\n). \"#EC NOTEXT\n";

        String formatted = format(source);

        assertThat(formatted).isEqualTo("lv_a = get_value( 1 ) \"#EC NEEDED\n . \"#EC NOTEXT\n");
        assertThat(format(formatted)).isEqualTo(formatted);
    }

    @Test
    void compressesStaleAssignmentAlignment() {
        String source = String.join("\n",
                "lv_a             = 1.",
                "lv_bb            = 2.",
                "lv_c             = 3.",
                "");

        assertThat(format(source)).isEqualTo(String.join("\n",
                "lv_a  = 1.",
                "lv_bb = 2.",
                "lv_c  = 3.",
                ""));
    }

    @Test
    void realignsAfterLeftHandSideWasShortened() {
        String source = String.join("\n",
                "lv_first           = 1.",
                "lv_second          = 2.",
                "lv_x               = 3.",
                "");

        assertThat(format(source)).isEqualTo(String.join("\n",
                "lv_first  = 1.",
                "lv_second = 2.",
                "lv_x      = 3.",
                ""));
    }

    @Test
    void inlinesFirstChainEntryAfterColon() {
        assertThat(format("DATA: lv_a TYPE i, lv_b TYPE i.\n"))
                .isEqualTo("DATA: lv_a TYPE i,\n      lv_b TYPE i.\n");
    }

    @Test
    void startsBlockStyleChainOnNextLine() {
        assertThat(format("CLEAR: lv_a, lv_b.\n")).isEqualTo("CLEAR:\n  lv_a,\n  lv_b.\n");
    }

    @Test
    void appliesLowerKeywordCase() {
        AbapFormatter lower = new AbapFormatter(FormatOptions.defaults().withKeywordCase(KeywordCase.LOWER));

        FormatResult result = lower.format("zdemo.prog.abap", "IF lv_flag = abap_true.\nCLEAR lv_flag.\nENDIF.\n");

        assertThat(result.text()).isEqualTo("if lv_flag = abap_true.\n  clear lv_flag.\nendif.\n");
    }

    @Test
    void movesPragmaNextToPeriodAndCondensesSpacing() {
        assertThat(format("DATA ##needed     lv_a TYPE i.\n")).isEqualTo("DATA lv_a TYPE i ##NEEDED.\n");
    }

    @Test
    void keepsBlankLinesBetweenStatements() {
        String source = "lv_a = 1.\n\n\nlv_b = 2.\n";

        assertThat(format(source)).isEqualTo(source);
    }

    @Test
    void keepsFullLineCommentInsideStatementOnItsOwnLine() {
        String source = "lv_a = f( 1\n* note\n).\n";

        String once = format(source);

        assertThat(once).isEqualTo("* note\nlv_a = f( 1 ).\n");
        assertThat(format(once)).isEqualTo(once);
    }

    @Test
    void formattingIsIdempotent() {
        String source = String.join("\n",
                "CLASS lcl_demo DEFINITION.",
                "PUBLIC SECTION.",
                "METHODS run.",
                "ENDCLASS.",
                "",
                "CLASS lcl_demo IMPLEMENTATION.",
                "METHOD run.",
                "DATA: lv_count TYPE i,",
                "lv_name TYPE string.",
                "* full line comment",
                "LOOP AT mt_items INTO DATA(ls_item).",
                "IF ls_item-active = abap_true.",
                "lv_count = lv_count + 1. \" count it",
                "ENDIF.",
                "ENDLOOP.",
                "ENDMETHOD.",
                "ENDCLASS.",
                "");

        String once = format(source);

        assertThat(once).isEqualTo(String.join("\n",
                "CLASS lcl_demo DEFINITION.",
                "  PUBLIC SECTION.",
                "  METHODS run.",
                "ENDCLASS.",
                "",
                "CLASS lcl_demo IMPLEMENTATION.",
                "  METHOD run.",
                "    DATA: lv_count TYPE i,",
                "          lv_name TYPE string.",
                "* full line comment",
                "    LOOP AT mt_items INTO DATA(ls_item).",
                "      IF ls_item-active = abap_true.",
                "        lv_count = lv_count + 1. \" count it",
                "      ENDIF.",
                "    ENDLOOP.",
                "  ENDMETHOD.",
                "ENDCLASS.",
                ""));
        assertThat(format(once)).isEqualTo(once);
    }

    @Test
    void passesThroughUnterminatedLiteral() {
        FormatResult result = formatter.format("zbroken.prog.abap", "lv_x = 'open.   \n  next line  \n");

        assertThat(result.formatted()).isFalse();
        assertThat(result.reason()).hasValueSatisfying(reason -> assertThat(reason).contains("Unterminated"));
        assertThat(result.text()).isEqualTo("lv_x = 'open.\n  next line\n");
    }

    @Test
    void passesThroughUnsupportedObjectTypes() {
        String source = "define view entity ZI_Demo as select from zdemo {   \n  key id\n}\n";

        FormatResult result = formatter.format("zi_demo.ddls.asddls", source);

        assertThat(result.formatted()).isFalse();
        assertThat(result.text()).isEqualTo("define view entity ZI_Demo as select from zdemo {\n  key id\n}\n");
    }

    @Test
    void passesThroughBlankDocument() {
        FormatResult result = formatter.format("zempty.prog.abap", "   \n");

        assertThat(result.formatted()).isFalse();
        assertThat(result.text()).isEqualTo("\n");
    }

    @Test
    void normalizesWindowsLineEndings() {
        assertThat(format("IF lv_a = 1.\r\nlv_b = 2.\r\nENDIF.\r\n")).isEqualTo("IF lv_a = 1.\n  lv_b = 2.\nENDIF.\n");
    }

    @Test
    void rejectsChainWithoutKeyword() {
        Token colon = new Token(TokenRole.COLON, ":", new SourceSpan(0, 1, 1, 0, 1, 1));
        Token member = new Token(TokenRole.WORD, "lv_a", new SourceSpan(2, 6, 1, 2, 1, 6));
        List<RawStatement> raw = List.of(LexedStatement.code(StatementKind.OTHER, List.of(member), colon, List.of()));

        assertThatThrownBy(() -> formatter.formatStatements("zbad.prog.abap", raw))
                .isInstanceOf(InternalConsistencyException.class)
                .hasMessageContaining("no tokens");
    }

    private String format(String source) {
        FormatResult result = formatter.format("zdemo.prog.abap", source);
        assertThat(result.formatted()).isTrue();
        return result.text();
    }
}

package dev.abapfmt.indent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.abapfmt.build.StatementBuilder;
import dev.abapfmt.model.InternalConsistencyException;
import dev.abapfmt.model.Program;
import dev.abapfmt.model.SourceSpan;
import dev.abapfmt.model.Statement;
import dev.abapfmt.model.StatementKind;
import dev.abapfmt.model.Token;
import dev.abapfmt.model.TokenRole;
import dev.abapfmt.source.AbapStatementReader;
import dev.abapfmt.source.LexedStatement;
import dev.abapfmt.source.RawStatement;
import dev.abapfmt.source.RawStatementType;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class IndentationEngineTest {

    private final AbapStatementReader reader = new AbapStatementReader();
    private final IndentationEngine engine = new IndentationEngine();

    @Test
    void nestsBlocksAndDedentsMiddleStatements() {
        String source = String.join("\n",
                "METHOD run.",
                "TRY.",
                "lv_a = 1.",
                "CATCH cx_root.",
                "lv_a = 2.",
                "ENDTRY.",
                "ENDMETHOD.",
                "");

        assertThat(levels(source)).containsExactly(0, 1, 2, 1, 2, 1, 0);
    }

    @Test
    void opensSelectBlockOnlyWhenEndselectFollows() {
        String source = String.join("\n",
                "SELECT SINGLE * FROM t000 INTO ls_a.",
                "lv_a = 1.",
                "SELECT * FROM t000 INTO ls_a.",
                "lv_b = 2.",
                "ENDSELECT.",
                "lv_c = 3.",
                "");

        assertThat(levels(source)).containsExactly(0, 0, 0, 1, 0, 0);
    }

    @Test
    void alignsSeparatedCommentBlockWithFollowingBranch() {
        String source = String.join("\n",
                "IF lv_a = 1.",
                "lv_b = 1.",
                "",
                "\" otherwise",
                "\" really",
                "ELSE.",
                "lv_b = 2.",
                "ENDIF.",
                "");

        assertThat(levels(source)).containsExactly(0, 1, 0, 0, 0, 1, 0);
    }

    @Test
    void keepsAdjacentCommentAtBlockDepth() {
        String source = String.join("\n",
                "IF lv_a = 1.",
                "lv_b = 1.",
                "\" otherwise",
                "ELSE.",
                "ENDIF.",
                "");

        assertThat(levels(source)).containsExactly(0, 1, 1, 0, 0);
    }

    @Test
    void neverGoesBelowZero() {
        assertThat(levels("ENDIF.\nENDLOOP.\nlv_a = 1.\n")).containsExactly(0, 0, 0);
    }

    @Test
    void keepsOriginalColumnOfSyntheticStatements() {
        Token token = new Token(TokenRole.WORD, "lv_a", new SourceSpan(0, 4, 1, 4, 1, 8));
        List<RawStatement> raw = new ArrayList<>(reader.read("zdemo.prog.abap", "IF lv_a = 1.\n"));
        raw.add(new LexedStatement(RawStatementType.STATEMENT, StatementKind.OTHER, List.of(token), null, List.of(),
                true));

        assertThat(engine.computeLevels(raw)).containsExactly(0, Statement.KEEP_ORIGINAL_COLUMN);
    }

    @Test
    void assignsLevelsToBuiltStatementsOnce() {
        List<RawStatement> raw = reader.read("zdemo.prog.abap", "DO 3 TIMES.\nDATA: lv_a TYPE i,\nlv_b TYPE i.\nENDDO.\n");
        Program program = new StatementBuilder().build("zdemo.prog.abap", raw);

        engine.indent(program, raw);

        assertThat(program.statements()).extracting(Statement::indentLevel).containsExactly(0, 1, 0);
        assertThatThrownBy(() -> engine.indent(program, raw))
                .isInstanceOf(InternalConsistencyException.class)
                .hasMessageContaining("twice");
    }

    private int[] levels(String source) {
        return engine.computeLevels(reader.read("zdemo.prog.abap", source));
    }
}

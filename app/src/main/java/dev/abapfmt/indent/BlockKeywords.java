package dev.abapfmt.indent;

import dev.abapfmt.model.StatementKind;
import java.util.EnumMap;
import java.util.Map;

/**
 * Decision table from statement kind to block behaviour.
 */
public final class BlockKeywords {

    private static final Map<StatementKind, BlockBehavior> TABLE = new EnumMap<>(StatementKind.class);
    private static final Map<StatementKind, StatementKind> OPTIONAL_CLOSERS = new EnumMap<>(StatementKind.class);

    static {
        for (StatementKind kind : new StatementKind[] {
                StatementKind.IF, StatementKind.WHILE, StatementKind.LOOP, StatementKind.DO, StatementKind.TRY,
                StatementKind.CASE, StatementKind.CASE_TYPE, StatementKind.CLASS_DEFINITION,
                StatementKind.CLASS_IMPLEMENTATION, StatementKind.INTERFACE, StatementKind.METHOD,
                StatementKind.FUNCTION, StatementKind.MODULE, StatementKind.FORM, StatementKind.DEFINE,
                StatementKind.CHAIN, StatementKind.AT, StatementKind.EXEC_SQL, StatementKind.CATCH_SYSTEM_EXCEPTIONS,
                StatementKind.TEST_SEAM, StatementKind.TEST_INJECTION}) {
            TABLE.put(kind, BlockBehavior.OPENER);
        }
        for (StatementKind kind : new StatementKind[] {
                StatementKind.ELSE, StatementKind.ELSEIF, StatementKind.CATCH, StatementKind.CLEANUP,
                StatementKind.WHEN, StatementKind.WHEN_TYPE, StatementKind.WHEN_OTHERS}) {
            TABLE.put(kind, BlockBehavior.MIDDLE);
        }
        for (StatementKind kind : new StatementKind[] {
                StatementKind.ENDIF, StatementKind.ENDWHILE, StatementKind.ENDLOOP, StatementKind.ENDSELECT,
                StatementKind.ENDTRY, StatementKind.ENDCASE, StatementKind.ENDDO, StatementKind.ENDFUNCTION,
                StatementKind.ENDMETHOD, StatementKind.ENDCLASS, StatementKind.ENDMODULE, StatementKind.ENDFORM,
                StatementKind.ENDINTERFACE, StatementKind.ENDCHAIN, StatementKind.ENDAT, StatementKind.ENDEXEC,
                StatementKind.ENDCATCH, StatementKind.END_TEST_INJECTION, StatementKind.END_TEST_SEAM,
                StatementKind.END_OF_DEFINITION}) {
            TABLE.put(kind, BlockBehavior.CLOSER);
        }
        TABLE.put(StatementKind.SELECT, BlockBehavior.OPTIONAL_OPENER);
        OPTIONAL_CLOSERS.put(StatementKind.SELECT, StatementKind.ENDSELECT);
    }

    private BlockKeywords() {
    }

    public static BlockBehavior behaviorOf(StatementKind kind) {
        return TABLE.getOrDefault(kind, BlockBehavior.NEUTRAL);
    }

    public static boolean isMiddle(StatementKind kind) {
        return behaviorOf(kind).middle();
    }

    /**
     * The closer that turns an optional opener into a block, or {@code null} for other kinds.
     */
    static StatementKind optionalCloserOf(StatementKind kind) {
        return OPTIONAL_CLOSERS.get(kind);
    }
}

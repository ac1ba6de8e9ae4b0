package dev.abapfmt.model;

/**
 * Closed set of statement kinds relevant for layout. Every statement that opens, continues or closes no block is
 * {@link #OTHER}.
 */
public enum StatementKind {
    COMMENT,
    OTHER,

    IF,
    ELSEIF,
    ELSE,
    ENDIF,

    CASE,
    CASE_TYPE,
    WHEN,
    WHEN_TYPE,
    WHEN_OTHERS,
    ENDCASE,

    DO,
    ENDDO,
    WHILE,
    ENDWHILE,
    LOOP,
    ENDLOOP,
    SELECT,
    ENDSELECT,
    AT,
    ENDAT,

    TRY,
    CATCH,
    CLEANUP,
    ENDTRY,
    CATCH_SYSTEM_EXCEPTIONS,
    ENDCATCH,

    CLASS_DEFINITION,
    CLASS_IMPLEMENTATION,
    ENDCLASS,
    INTERFACE,
    ENDINTERFACE,
    METHOD,
    ENDMETHOD,
    FUNCTION,
    ENDFUNCTION,
    FORM,
    ENDFORM,
    MODULE,
    ENDMODULE,

    DEFINE,
    END_OF_DEFINITION,
    CHAIN,
    ENDCHAIN,
    EXEC_SQL,
    ENDEXEC,
    TEST_SEAM,
    END_TEST_SEAM,
    TEST_INJECTION,
    END_TEST_INJECTION
}

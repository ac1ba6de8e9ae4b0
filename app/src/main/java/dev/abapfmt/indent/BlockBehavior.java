package dev.abapfmt.indent;

/**
 * How a statement kind affects block nesting.
 *
 * @param dedentBefore closes a block, so the statement moves one level out
 * @param middle continues a block (ELSE, CATCH, WHEN), also one level out
 * @param indentAfter opens a block for the statements that follow
 * @param optionalBlock opens a block only when a matching closer follows later
 */
public record BlockBehavior(boolean dedentBefore, boolean middle, boolean indentAfter, boolean optionalBlock) {

    public static final BlockBehavior NEUTRAL = new BlockBehavior(false, false, false, false);
    static final BlockBehavior OPENER = new BlockBehavior(false, false, true, false);
    static final BlockBehavior CLOSER = new BlockBehavior(true, false, false, false);
    static final BlockBehavior MIDDLE = new BlockBehavior(false, true, true, false);
    static final BlockBehavior OPTIONAL_OPENER = new BlockBehavior(false, false, true, true);

    public boolean movesOut() {
        return dedentBefore || middle;
    }
}

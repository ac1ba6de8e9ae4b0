package dev.abapfmt.source;

import dev.abapfmt.model.StatementKind;
import dev.abapfmt.model.Token;
import dev.abapfmt.model.TokenRole;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the {@link StatementKind} of a statement from its leading keywords.
 */
final class StatementClassifier {

    private static final Map<String, StatementKind> SINGLE_KEYWORDS = Map.ofEntries(
            Map.entry("IF", StatementKind.IF),
            Map.entry("ELSEIF", StatementKind.ELSEIF),
            Map.entry("ELSE", StatementKind.ELSE),
            Map.entry("ENDIF", StatementKind.ENDIF),
            Map.entry("ENDCASE", StatementKind.ENDCASE),
            Map.entry("DO", StatementKind.DO),
            Map.entry("ENDDO", StatementKind.ENDDO),
            Map.entry("WHILE", StatementKind.WHILE),
            Map.entry("ENDWHILE", StatementKind.ENDWHILE),
            Map.entry("LOOP", StatementKind.LOOP),
            Map.entry("ENDLOOP", StatementKind.ENDLOOP),
            Map.entry("SELECT", StatementKind.SELECT),
            Map.entry("ENDSELECT", StatementKind.ENDSELECT),
            Map.entry("ENDAT", StatementKind.ENDAT),
            Map.entry("TRY", StatementKind.TRY),
            Map.entry("CLEANUP", StatementKind.CLEANUP),
            Map.entry("ENDTRY", StatementKind.ENDTRY),
            Map.entry("ENDCATCH", StatementKind.ENDCATCH),
            Map.entry("ENDCLASS", StatementKind.ENDCLASS),
            Map.entry("ENDINTERFACE", StatementKind.ENDINTERFACE),
            Map.entry("METHOD", StatementKind.METHOD),
            Map.entry("ENDMETHOD", StatementKind.ENDMETHOD),
            Map.entry("FUNCTION", StatementKind.FUNCTION),
            Map.entry("ENDFUNCTION", StatementKind.ENDFUNCTION),
            Map.entry("FORM", StatementKind.FORM),
            Map.entry("ENDFORM", StatementKind.ENDFORM),
            Map.entry("MODULE", StatementKind.MODULE),
            Map.entry("ENDMODULE", StatementKind.ENDMODULE),
            Map.entry("DEFINE", StatementKind.DEFINE),
            Map.entry("END-OF-DEFINITION", StatementKind.END_OF_DEFINITION),
            Map.entry("CHAIN", StatementKind.CHAIN),
            Map.entry("ENDCHAIN", StatementKind.ENDCHAIN),
            Map.entry("ENDEXEC", StatementKind.ENDEXEC),
            Map.entry("TEST-SEAM", StatementKind.TEST_SEAM),
            Map.entry("END-TEST-SEAM", StatementKind.END_TEST_SEAM),
            Map.entry("TEST-INJECTION", StatementKind.TEST_INJECTION),
            Map.entry("END-TEST-INJECTION", StatementKind.END_TEST_INJECTION));

    private static final Set<String> GROUP_LEVELS = Set.of("FIRST", "LAST", "NEW", "END");

    private StatementClassifier() {
    }

    static StatementKind classify(List<Token> tokens) {
        List<String> words = leadingWords(tokens);
        if (words.isEmpty()) {
            return StatementKind.OTHER;
        }
        String first = words.get(0);
        String second = words.size() > 1 ? words.get(1) : "";
        String third = words.size() > 2 ? words.get(2) : "";
        return switch (first) {
            case "CASE" -> "TYPE".equals(second) && "OF".equals(third) ? StatementKind.CASE_TYPE : StatementKind.CASE;
            case "WHEN" -> switch (second) {
                case "OTHERS" -> StatementKind.WHEN_OTHERS;
                case "TYPE" -> StatementKind.WHEN_TYPE;
                default -> StatementKind.WHEN;
            };
            case "AT" -> GROUP_LEVELS.contains(second) ? StatementKind.AT : StatementKind.OTHER;
            case "CATCH" -> "SYSTEM-EXCEPTIONS".equals(second)
                    ? StatementKind.CATCH_SYSTEM_EXCEPTIONS
                    : StatementKind.CATCH;
            case "EXEC" -> "SQL".equals(second) ? StatementKind.EXEC_SQL : StatementKind.OTHER;
            case "CLASS" -> classifyClass(words);
            case "INTERFACE" -> isForwardDeclaration(words) ? StatementKind.OTHER : StatementKind.INTERFACE;
            default -> SINGLE_KEYWORDS.getOrDefault(first, StatementKind.OTHER);
        };
    }

    private static StatementKind classifyClass(List<String> words) {
        if (isForwardDeclaration(words)) {
            return StatementKind.OTHER;
        }
        int friends = words.indexOf("FRIENDS");
        if (friends > 0 && "LOCAL".equals(words.get(friends - 1))) {
            return StatementKind.OTHER;
        }
        if (words.contains("DEFINITION")) {
            return StatementKind.CLASS_DEFINITION;
        }
        if (words.contains("IMPLEMENTATION")) {
            return StatementKind.CLASS_IMPLEMENTATION;
        }
        return StatementKind.OTHER;
    }

    private static boolean isForwardDeclaration(List<String> words) {
        return words.contains("DEFERRED") || words.contains("LOAD");
    }

    private static List<String> leadingWords(List<Token> tokens) {
        List<String> words = new ArrayList<>();
        for (Token token : tokens) {
            if (token.role() != TokenRole.WORD) {
                break;
            }
            words.add(token.upper());
        }
        return words;
    }
}

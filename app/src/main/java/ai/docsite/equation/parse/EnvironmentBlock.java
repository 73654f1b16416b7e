package ai.docsite.equation.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Body of a {@code \begin{name}...\end{name}} block. The body ends at the first matching end marker.
 */
record EnvironmentBlock(String body, int end) {

    static final String ROW_SEPARATOR = "\\\\";
    static final char COLUMN_SEPARATOR = '&';

    private static final Pattern ROW_SPLITTER = Pattern.compile(Pattern.quote(ROW_SEPARATOR));

    static Optional<EnvironmentBlock> match(String input, String environment) {
        String begin = "\\begin{" + environment + "}";
        if (!input.startsWith(begin)) {
            return Optional.empty();
        }
        String endMarker = "\\end{" + environment + "}";
        int close = input.indexOf(endMarker, begin.length());
        if (close < 0) {
            return Optional.empty();
        }
        return Optional.of(new EnvironmentBlock(input.substring(begin.length(), close), close + endMarker.length()));
    }

    /**
     * Trimmed, non-blank rows of the body.
     */
    List<String> rows() {
        List<String> rows = new ArrayList<>();
        for (String row : ROW_SPLITTER.split(LatexScanner.trim(body))) {
            String trimmed = LatexScanner.trim(row);
            if (!trimmed.isEmpty()) {
                rows.add(trimmed);
            }
        }
        return rows;
    }

    static List<String> cells(String row) {
        List<String> cells = new ArrayList<>();
        for (String cell : row.split(Pattern.quote(String.valueOf(COLUMN_SEPARATOR)), -1)) {
            cells.add(LatexScanner.trim(cell));
        }
        return cells;
    }
}

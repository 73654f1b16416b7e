package ai.docsite.equation.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One surface syntax for a scripted base, built from a fixed sequence of parts. Parts are matched left to right
 * without backtracking; each capturing part records the identifier it consumed.
 */
final class ScriptSyntax {

    /**
     * A single element of a script syntax.
     */
    interface Part {

        /**
         * Matches at {@code position} and returns the end offset, or {@link LatexScanner#NO_MATCH}.
         */
        int match(String input, int position, List<String> captures);
    }

    /**
     * Captures of a successful match and the number of characters consumed.
     */
    record Match(List<String> captures, int end) {

        Match {
            captures = List.copyOf(captures);
        }
    }

    private final String pattern;
    private final List<Part> parts;

    private ScriptSyntax(String pattern, List<Part> parts) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.parts = List.copyOf(parts);
    }

    static ScriptSyntax of(String pattern, Part... parts) {
        return new ScriptSyntax(pattern, List.of(parts));
    }

    String pattern() {
        return pattern;
    }

    Optional<Match> match(String input) {
        List<String> captures = new ArrayList<>(3);
        int position = 0;
        for (Part part : parts) {
            position = part.match(input, position, captures);
            if (position == LatexScanner.NO_MATCH) {
                return Optional.empty();
            }
        }
        return Optional.of(new Match(captures, position));
    }

    /**
     * {@code \name}, capturing the name without the backslash.
     */
    static Part macro() {
        return (input, position, captures) -> {
            int end = LatexScanner.macroEnd(input, position);
            if (end != LatexScanner.NO_MATCH) {
                captures.add(input.substring(position + 1, end));
            }
            return end;
        };
    }

    /**
     * {@code {text}}, capturing the text verbatim.
     */
    static Part braced() {
        return (input, position, captures) -> {
            int end = LatexScanner.bracedEnd(input, position);
            if (end != LatexScanner.NO_MATCH) {
                captures.add(input.substring(position + 1, end - 1));
            }
            return end;
        };
    }

    /**
     * One ASCII letter or digit.
     */
    static Part alphanumeric() {
        return singleCharacter(false);
    }

    /**
     * One ASCII letter, digit or {@code *}.
     */
    static Part alphanumericOrStar() {
        return singleCharacter(true);
    }

    static Part literal(char expected) {
        return (input, position, captures) ->
                position < input.length() && input.charAt(position) == expected ? position + 1 : LatexScanner.NO_MATCH;
    }

    private static Part singleCharacter(boolean allowStar) {
        return (input, position, captures) -> {
            if (position >= input.length()) {
                return LatexScanner.NO_MATCH;
            }
            char ch = input.charAt(position);
            if (LatexScanner.isAsciiAlphanumeric(ch) || (allowStar && ch == '*')) {
                captures.add(String.valueOf(ch));
                return position + 1;
            }
            return LatexScanner.NO_MATCH;
        };
    }

    @Override
    public String toString() {
        return pattern;
    }
}

package ai.docsite.equation.parse;

/**
 * Character-level helpers shared by the recognizers. Positions returned are exclusive end offsets, or {@code -1} when
 * nothing matched. Letters and digits are ASCII only.
 */
final class LatexScanner {

    static final int NO_MATCH = -1;

    private LatexScanner() {
    }

    static boolean isAsciiLetter(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    static boolean isAsciiDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    static boolean isAsciiAlphanumeric(char ch) {
        return isAsciiLetter(ch) || isAsciiDigit(ch);
    }

    /**
     * End of a {@code \name} macro starting at {@code position}.
     */
    static int macroEnd(String input, int position) {
        if (position >= input.length() || input.charAt(position) != '\\') {
            return NO_MATCH;
        }
        int index = position + 1;
        while (index < input.length() && isAsciiLetter(input.charAt(index))) {
            index++;
        }
        return index > position + 1 ? index : NO_MATCH;
    }

    /**
     * End of a {@code {...}} group holding at least one character and no closing brace.
     */
    static int bracedEnd(String input, int position) {
        if (position >= input.length() || input.charAt(position) != '{') {
            return NO_MATCH;
        }
        int close = input.indexOf('}', position + 1);
        return close > position + 1 ? close + 1 : NO_MATCH;
    }

    /**
     * End of a {@code (...)} group holding at least one character and no closing parenthesis.
     */
    static int parenthesizedEnd(String input, int position) {
        if (position >= input.length() || input.charAt(position) != '(') {
            return NO_MATCH;
        }
        int close = input.indexOf(')', position + 1);
        return close > position + 1 ? close + 1 : NO_MATCH;
    }

    /**
     * Whitespace in the Unicode sense, including no-break spaces that {@link String#strip()} keeps.
     */
    static boolean isSpace(char ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
    }

    static int skipWhitespace(String input, int position) {
        int index = position;
        while (index < input.length() && isSpace(input.charAt(index))) {
            index++;
        }
        return index;
    }

    static String trim(String input) {
        int start = skipWhitespace(input, 0);
        int end = input.length();
        while (end > start && isSpace(input.charAt(end - 1))) {
            end--;
        }
        return input.substring(start, end);
    }
}

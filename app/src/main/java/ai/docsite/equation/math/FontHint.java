package ai.docsite.equation.math;

/**
 * Glyph-shaping convention the renderer applies to a literal run.
 */
public enum FontHint {
    DEFAULT("default"),
    EAST_ASIAN("eastAsia");

    private final String markupValue;

    FontHint(String markupValue) {
        this.markupValue = markupValue;
    }

    public String markupValue() {
        return markupValue;
    }
}

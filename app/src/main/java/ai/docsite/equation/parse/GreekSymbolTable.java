package ai.docsite.equation.parse;

import ai.docsite.equation.math.MathRun;
import java.util.Map;
import java.util.Optional;

/**
 * Exact, case-sensitive mapping from Greek macro names to their glyphs.
 */
public final class GreekSymbolTable {

    private static final Map<String, String> GLYPHS = Map.ofEntries(
            Map.entry("alpha", "α"),
            Map.entry("beta", "β"),
            Map.entry("gamma", "γ"),
            Map.entry("delta", "δ"),
            Map.entry("epsilon", "ε"),
            Map.entry("zeta", "ζ"),
            Map.entry("eta", "η"),
            Map.entry("theta", "θ"),
            Map.entry("iota", "ι"),
            Map.entry("kappa", "κ"),
            Map.entry("lambda", "λ"),
            Map.entry("mu", "μ"),
            Map.entry("nu", "ν"),
            Map.entry("xi", "ξ"),
            Map.entry("pi", "π"),
            Map.entry("rho", "ρ"),
            Map.entry("sigma", "σ"),
            Map.entry("tau", "τ"),
            Map.entry("upsilon", "υ"),
            Map.entry("phi", "φ"),
            Map.entry("chi", "χ"),
            Map.entry("psi", "ψ"),
            Map.entry("omega", "ω"),
            Map.entry("Gamma", "Γ"),
            Map.entry("Delta", "Δ"),
            Map.entry("Theta", "Θ"),
            Map.entry("Lambda", "Λ"),
            Map.entry("Xi", "Ξ"),
            Map.entry("Pi", "Π"),
            Map.entry("Sigma", "Σ"),
            Map.entry("Phi", "Φ"),
            Map.entry("Psi", "Ψ"),
            Map.entry("Omega", "Ω"));

    private GreekSymbolTable() {
    }

    public static Optional<String> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(GLYPHS.get(name));
    }

    public static boolean contains(String name) {
        return lookup(name).isPresent();
    }

    public static int size() {
        return GLYPHS.size();
    }

    /**
     * Resolves a captured base, subscript or superscript identifier. A table hit yields the glyph with the east-asian
     * hint; anything else is kept verbatim with the default hint.
     */
    public static MathRun resolve(String captured) {
        return lookup(captured)
                .map(MathRun::eastAsian)
                .orElseGet(() -> MathRun.of(captured));
    }
}

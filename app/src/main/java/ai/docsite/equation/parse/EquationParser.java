package ai.docsite.equation.parse;

import ai.docsite.equation.math.Equation;
import ai.docsite.equation.math.MathNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the supported LaTeX subset into an immutable {@link Equation}.
 *
 * <p>The parser dispatches the {@link Recognizers#standard() recognizers} in priority order over the remaining input,
 * trimming surrounding whitespace before every attempt. It never fails on unrecognized input: characters no
 * recognizer accepts are dropped one at a time. The only error it raises is {@link EquationNestingException} when
 * sub-expressions nest deeper than {@code maxNestingDepth}.
 *
 * <p>Instances hold no mutable state and may be shared between threads.
 */
public final class EquationParser {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 128;

    private static final Logger LOGGER = LoggerFactory.getLogger(EquationParser.class);

    private final List<Recognizer> recognizers;
    private final int maxNestingDepth;

    public EquationParser() {
        this(DEFAULT_MAX_NESTING_DEPTH);
    }

    public EquationParser(int maxNestingDepth) {
        this(Recognizers.standard(), maxNestingDepth);
    }

    EquationParser(List<Recognizer> recognizers, int maxNestingDepth) {
        Objects.requireNonNull(recognizers, "recognizers");
        if (recognizers.isEmpty()) {
            throw new IllegalArgumentException("At least one recognizer is required");
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be at least 1");
        }
        this.recognizers = List.copyOf(recognizers);
        this.maxNestingDepth = maxNestingDepth;
    }

    public int maxNestingDepth() {
        return maxNestingDepth;
    }

    /**
     * Parses one formula. A single enclosing {@code $$...$$} or {@code $...$} pair is removed first.
     *
     * @return the equation, or empty when nothing but delimiters and whitespace was given
     * @throws EquationNestingException if the formula nests deeper than the configured limit
     */
    public Optional<Equation> parse(String source) {
        if (source == null) {
            return Optional.empty();
        }
        String expression = stripMathDelimiters(source);
        if (expression.isEmpty()) {
            return Optional.empty();
        }
        List<MathNode> nodes = parseSequence(expression, 0);
        LOGGER.debug("Parsed '{}' into {} top-level node(s)", expression, nodes.size());
        return Optional.of(new Equation(nodes));
    }

    List<MathNode> parseSequence(String expression, int depth) {
        if (depth > maxNestingDepth) {
            throw new EquationNestingException(maxNestingDepth);
        }
        ParseContext context = new ParseContext(this, depth);
        List<MathNode> nodes = new ArrayList<>();
        String remaining = LatexScanner.trim(expression);
        while (!remaining.isEmpty()) {
            Recognition recognition = dispatch(remaining, context);
            nodes.addAll(recognition.nodes());
            remaining = LatexScanner.trim(remaining.substring(recognition.consumed()));
        }
        return nodes;
    }

    private Recognition dispatch(String remaining, ParseContext context) {
        for (Recognizer recognizer : recognizers) {
            Optional<Recognition> recognition = recognizer.recognize(remaining, context);
            if (recognition.isPresent()) {
                return recognition.get();
            }
        }
        // Custom recognizer lists may lack the skip rule; keep the guarantee of progress anyway.
        return Recognition.skip(1);
    }

    /**
     * Trims the source and removes one enclosing {@code $$} pair, or failing that one {@code $} pair.
     */
    static String stripMathDelimiters(String source) {
        String expression = LatexScanner.trim(source);
        if (expression.startsWith("$$") && expression.endsWith("$$")) {
            return expression.length() < 4 ? "" : LatexScanner.trim(expression.substring(2, expression.length() - 2));
        }
        if (expression.startsWith("$") && expression.endsWith("$")) {
            return expression.length() < 2 ? "" : LatexScanner.trim(expression.substring(1, expression.length() - 1));
        }
        return expression;
    }
}

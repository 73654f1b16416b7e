package ai.docsite.equation.convert;

import ai.docsite.equation.math.Equation;
import ai.docsite.equation.omml.OmmlWriter;
import ai.docsite.equation.parse.EquationParser;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a formula and serializes the resulting tree to OMML.
 */
public class EquationConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(EquationConverter.class);

    private final EquationParser parser;
    private final OmmlWriter writer;

    public EquationConverter(EquationParser parser, OmmlWriter writer) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    public ConversionResult convert(String formula) {
        String source = formula == null ? "" : formula;
        Optional<Equation> equation = parser.parse(source);
        if (equation.isEmpty()) {
            LOGGER.debug("Formula '{}' is blank after removing delimiters", source);
            return ConversionResult.blank(source);
        }
        String omml = writer.toXml(equation.get());
        LOGGER.debug("Converted formula '{}' ({} node(s), {} characters of markup)",
                source, equation.get().nodes().size(), omml.length());
        return new ConversionResult(source, equation, Optional.of(omml));
    }
}

package ai.docsite.equation.parse;

import static ai.docsite.equation.parse.ScriptSyntax.alphanumeric;
import static ai.docsite.equation.parse.ScriptSyntax.alphanumericOrStar;
import static ai.docsite.equation.parse.ScriptSyntax.braced;
import static ai.docsite.equation.parse.ScriptSyntax.literal;
import static ai.docsite.equation.parse.ScriptSyntax.macro;

import ai.docsite.equation.math.MathNode;
import ai.docsite.equation.math.Sub;
import ai.docsite.equation.math.SubSup;
import ai.docsite.equation.math.Sup;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Subscript and superscript forms. Each instance tries its surface syntaxes in order and resolves every captured
 * identifier through the Greek table. Braced captures are kept verbatim and are not parsed further.
 */
final class ScriptRecognizer implements Recognizer {

    private final String name;
    private final List<ScriptSyntax> syntaxes;
    private final Function<List<MathNode>, MathNode> factory;

    private ScriptRecognizer(String name, List<ScriptSyntax> syntaxes, Function<List<MathNode>, MathNode> factory) {
        this.name = Objects.requireNonNull(name, "name");
        this.syntaxes = List.copyOf(syntaxes);
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    static ScriptRecognizer subSup() {
        return new ScriptRecognizer("sub-sup", List.of(
                ScriptSyntax.of("\\M_{s}^{p}", macro(), literal('_'), braced(), literal('^'), braced()),
                ScriptSyntax.of("\\M_s^p", macro(), literal('_'), alphanumeric(), literal('^'), alphanumericOrStar()),
                ScriptSyntax.of("b_\\M^{p}", alphanumeric(), literal('_'), macro(), literal('^'), braced()),
                ScriptSyntax.of("b_\\M^p", alphanumeric(), literal('_'), macro(), literal('^'), alphanumericOrStar()),
                ScriptSyntax.of("b_{s}^{p}", alphanumeric(), literal('_'), braced(), literal('^'), braced()),
                ScriptSyntax.of("b_s^p", alphanumeric(), literal('_'), alphanumeric(), literal('^'), alphanumericOrStar())),
                nodes -> new SubSup(nodes.get(0), nodes.get(1), nodes.get(2)));
    }

    static ScriptRecognizer sub() {
        return new ScriptRecognizer("sub", List.of(
                ScriptSyntax.of("\\M_{s}", macro(), literal('_'), braced()),
                ScriptSyntax.of("\\M_s", macro(), literal('_'), alphanumeric()),
                ScriptSyntax.of("b_\\M", alphanumeric(), literal('_'), macro()),
                ScriptSyntax.of("b_{s}", alphanumeric(), literal('_'), braced()),
                ScriptSyntax.of("b_s", alphanumeric(), literal('_'), alphanumeric())),
                nodes -> new Sub(nodes.get(0), nodes.get(1)));
    }

    static ScriptRecognizer sup() {
        return new ScriptRecognizer("sup", List.of(
                ScriptSyntax.of("\\M^{p}", macro(), literal('^'), braced()),
                ScriptSyntax.of("\\M^p", macro(), literal('^'), alphanumericOrStar()),
                ScriptSyntax.of("b^{p}", alphanumeric(), literal('^'), braced()),
                ScriptSyntax.of("b^p", alphanumeric(), literal('^'), alphanumericOrStar())),
                nodes -> new Sup(nodes.get(0), nodes.get(1)));
    }

    @Override
    public String name() {
        return name;
    }

    List<ScriptSyntax> syntaxes() {
        return syntaxes;
    }

    @Override
    public Optional<Recognition> recognize(String input, ParseContext context) {
        for (ScriptSyntax syntax : syntaxes) {
            Optional<ScriptSyntax.Match> match = syntax.match(input);
            if (match.isPresent()) {
                List<MathNode> parts = match.get().captures().stream()
                        .map(GreekSymbolTable::resolve)
                        .map(MathNode.class::cast)
                        .collect(Collectors.toList());
                return Optional.of(Recognition.of(factory.apply(parts), match.get().end()));
            }
        }
        return Optional.empty();
    }
}

package ai.docsite.equation.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.equation.config.ConfigLoader;
import ai.docsite.equation.convert.FormulaReader;
import ai.docsite.equation.convert.OmmlFileWriter;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.util.ContextInitializer;
import ch.qos.logback.core.joran.spi.JoranException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final StringWriter output = new StringWriter();

    private CliApplication application() {
        return new CliApplication(new ConfigLoader(key -> Optional.empty()), new FormulaReader(),
                new OmmlFileWriter(), new PrintWriter(output, true));
    }

    @AfterEach
    void restoreLogging() throws JoranException {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        new ContextInitializer(context).autoConfig();
    }

    private List<String> outputLines() {
        return output.toString().lines().collect(Collectors.toList());
    }

    @Test
    void printsOneFragmentPerFormula() {
        int exitCode = application().run(new String[] {"$x^2$", "\\frac{1}{2}"});

        assertThat(exitCode).isZero();
        assertThat(outputLines()).hasSize(2).allSatisfy(line -> assertThat(line).startsWith("<m:oMath"));
    }

    @Test
    void skipsBlankFormulas() {
        int exitCode = application().run(new String[] {"$$", "a"});

        assertThat(exitCode).isZero();
        assertThat(outputLines()).hasSize(1);
    }

    @Test
    void skipsFormulaMadeOfNoBreakSpaces() {
        int exitCode = application().run(new String[] {"$$\u00a0$$", "\u00a0", "y"});

        assertThat(exitCode).isZero();
        assertThat(outputLines()).hasSize(1);
    }

    @Test
    void multiLineFormulaStaysOnOneOutputLine() {
        int exitCode = application().run(new String[] {"x_{n\n+1}", "\\frac{a\r\n}{b}"});

        assertThat(exitCode).isZero();
        List<String> lines = outputLines();
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).startsWith("<m:oMath").endsWith("</m:oMath>").contains("n +1");
        assertThat(lines.get(1)).startsWith("<m:oMath").endsWith("</m:oMath>");
    }

    @Test
    void reportsFailureWhenFormulaExceedsNestingLimit() {
        int exitCode = application().run(new String[] {"--max-depth", "1", "\\frac{(\\alpha)}{2}", "y"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_CONVERSION_FAILED);
        assertThat(outputLines()).hasSize(1);
    }

    @Test
    void rejectsNonNumericDepth() {
        int exitCode = application().run(new String[] {"--max-depth", "abc", "x"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(output.toString()).isEmpty();
    }

    @Test
    void rejectsMissingFormulas() {
        assertThat(application().run(new String[0])).isEqualTo(2);
    }

    @Test
    void readsInputFileAndWritesOutputFile() throws Exception {
        Path input = tempDir.resolve("matrix.tex");
        Path target = tempDir.resolve("out/result.xml");
        Files.writeString(input, "$$\\begin{bmatrix}\n1 & 0 \\\\\n0 & 1\n\\end{bmatrix}$$", StandardCharsets.UTF_8);

        int exitCode = application().run(new String[] {"--input", input.toString(), "--output", target.toString()});

        assertThat(exitCode).isZero();
        assertThat(output.toString()).isEmpty();
        List<String> written = Files.readAllLines(target, StandardCharsets.UTF_8);
        assertThat(written).hasSize(1);
        assertThat(written.get(0)).startsWith("<m:oMath").contains("<m:m>");
    }

    @Test
    void missingInputFileFailsConversion() {
        int exitCode = application().run(new String[] {"--input", tempDir.resolve("absent.tex").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_CONVERSION_FAILED);
    }

    @Test
    void helpIsPrintedToOutput() {
        int exitCode = application().run(new String[] {"--help"});

        assertThat(exitCode).isZero();
        assertThat(output.toString()).contains("equation-converter").contains("--max-depth");
    }
}

package ai.docsite.equation.cli;

import ai.docsite.equation.config.LogFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "equation-converter", mixinStandardHelpOptions = true, version = "equation-converter 0.1.0",
        description = "Converts LaTeX-style formulas into Office Math (OMML) markup")
public class CliArguments {

    @CommandLine.Parameters(arity = "0..*", paramLabel = "FORMULA", description = "Formulas to convert, optionally wrapped in $ or $$")
    private List<String> formulas = new ArrayList<>();

    @CommandLine.Option(names = "--input", description = "Read one formula from the given file", paramLabel = "FILE")
    private Path inputFile;

    @CommandLine.Option(names = "--output", description = "Write OMML fragments to the given file instead of stdout", paramLabel = "FILE")
    private Path outputFile;

    @CommandLine.Option(names = "--max-depth", description = "Maximum nesting depth of sub-expressions", paramLabel = "DEPTH")
    private Integer maxNestingDepth;

    @CommandLine.Option(names = "--math-font", description = "Font name written into math runs", paramLabel = "FONT")
    private String mathFont;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatOption.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log parser decisions at debug level")
    private boolean verbose;

    public List<String> formulas() {
        return formulas == null ? List.of() : formulas;
    }

    public Path inputFile() {
        return inputFile;
    }

    public Path outputFile() {
        return outputFile;
    }

    public Integer maxNestingDepth() {
        return maxNestingDepth;
    }

    public String mathFont() {
        return mathFont;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }

    public static final class LogFormatOption implements CommandLine.ITypeConverter<LogFormat> {
        @Override
        public LogFormat convert(String value) {
            return LogFormat.from(value);
        }
    }
}

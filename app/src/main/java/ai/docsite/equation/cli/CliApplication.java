package ai.docsite.equation.cli;

import ai.docsite.equation.config.Config;
import ai.docsite.equation.config.ConfigLoader;
import ai.docsite.equation.config.EnvironmentReader;
import ai.docsite.equation.convert.ConversionResult;
import ai.docsite.equation.convert.EquationConverter;
import ai.docsite.equation.convert.FormulaReader;
import ai.docsite.equation.convert.OmmlFileWriter;
import ai.docsite.equation.logging.LoggingConfigurator;
import ai.docsite.equation.omml.OmmlWriter;
import ai.docsite.equation.parse.EquationNestingException;
import ai.docsite.equation.parse.EquationParser;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and converter.
 */
public final class CliApplication {

    static final int EXIT_CONVERSION_FAILED = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final String MDC_FORMULA = "formula";

    private final ConfigLoader configLoader;
    private final FormulaReader formulaReader;
    private final OmmlFileWriter fileWriter;
    private final PrintWriter out;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new FormulaReader(), new OmmlFileWriter(),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, FormulaReader formulaReader, OmmlFileWriter fileWriter, PrintWriter out) {
        this.configLoader = configLoader;
        this.formulaReader = formulaReader;
        this.fileWriter = fileWriter;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Converting with maxNestingDepth={} mathFont='{}'", config.maxNestingDepth(), config.mathFont());

        EquationConverter converter = new EquationConverter(
                new EquationParser(config.maxNestingDepth()), new OmmlWriter(config.mathFont()));

        List<String> formulas;
        try {
            formulas = collectFormulas(config);
        } catch (UncheckedIOException ex) {
            LOGGER.error("{}", ex.getMessage(), ex);
            return EXIT_CONVERSION_FAILED;
        }

        List<String> fragments = new ArrayList<>();
        int failures = 0;
        for (int i = 0; i < formulas.size(); i++) {
            MDC.put(MDC_FORMULA, String.valueOf(i + 1));
            try {
                ConversionResult result = converter.convert(formulas.get(i));
                if (result.isBlank()) {
                    LOGGER.warn("Skipping blank formula #{}", i + 1);
                    continue;
                }
                result.omml().ifPresent(fragments::add);
            } catch (EquationNestingException ex) {
                failures++;
                LOGGER.error("Formula #{} rejected: {}", i + 1, ex.getMessage());
            } finally {
                MDC.remove(MDC_FORMULA);
            }
        }

        try {
            emit(config, fragments);
        } catch (UncheckedIOException ex) {
            LOGGER.error("{}", ex.getMessage(), ex);
            return EXIT_CONVERSION_FAILED;
        }
        LOGGER.info("Converted {} of {} formula(s)", fragments.size(), formulas.size());
        return failures > 0 ? EXIT_CONVERSION_FAILED : 0;
    }

    private List<String> collectFormulas(Config config) {
        List<String> formulas = new ArrayList<>(config.formulas());
        config.inputFile().ifPresent(path -> formulas.add(formulaReader.read(path)));
        return formulas;
    }

    private void emit(Config config, List<String> fragments) {
        if (config.outputFile().isPresent()) {
            fileWriter.write(config.outputFile().get(), fragments);
            LOGGER.info("Wrote {} fragment(s) to {}", fragments.size(), config.outputFile().get());
            return;
        }
        fragments.forEach(out::println);
        out.flush();
    }
}

package ai.latex.translator.cli;

import ai.latex.translator.completeness.CompletenessReport;
import ai.latex.translator.completeness.ContentCompletenessValidator;
import ai.latex.translator.config.Config;
import ai.latex.translator.config.ConfigLoader;
import ai.latex.translator.config.SystemEnvironmentReader;
import ai.latex.translator.fix.BackupManager;
import ai.latex.translator.fix.DocumentWriter;
import ai.latex.translator.fix.FixException;
import ai.latex.translator.fix.SimpleFixer;
import ai.latex.translator.llm.LlmSyntaxFixer;
import ai.latex.translator.logging.LogContext;
import ai.latex.translator.logging.LoggingConfigurator;
import ai.latex.translator.pipeline.RepairPipeline;
import ai.latex.translator.pipeline.RepairReport;
import ai.latex.translator.reference.ReferenceBasedFixer;
import ai.latex.translator.validate.SyntaxValidator;
import ai.latex.translator.validate.ValidationIssue;
import ai.latex.translator.validate.ValidationResult;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the validate, repair and
 * completeness commands.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final ContentCompletenessValidator completenessValidator;
    private final Function<Config, LlmSyntaxFixer> fixerFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new ContentCompletenessValidator(),
                config -> new LlmSyntaxFixer(config.llmConfig(), config.secrets().llmApiKey()));
    }

    CliApplication(ConfigLoader configLoader,
                   ContentCompletenessValidator completenessValidator,
                   Function<Config, LlmSyntaxFixer> fixerFactory) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.completenessValidator = Objects.requireNonNull(completenessValidator, "completenessValidator");
        this.fixerFactory = Objects.requireNonNull(fixerFactory, "fixerFactory");
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
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        String command = config.command().name().toLowerCase(Locale.ROOT);

        try (MDC.MDCCloseable ignored = LogContext.command(command)) {
            LOGGER.info("Running {} command", command);
            return switch (config.command()) {
                case VALIDATE -> runValidate(config);
                case REPAIR -> runRepair(config);
                case COMPLETENESS -> runCompleteness(config);
            };
        } catch (UncheckedIOException | FixException ex) {
            LOGGER.error("{} command failed: {}", command, ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private int runValidate(Config config) {
        Path file = config.file().orElseThrow();
        ValidationResult result = new SyntaxValidator().validateFile(file);
        for (ValidationIssue issue : result.issues()) {
            if (issue.isError()) {
                LOGGER.error("{}: {}", file, issue.describe());
            } else {
                LOGGER.warn("{}: {}", file, issue.describe());
            }
        }
        LOGGER.info("{}: {}", file, result.summary());
        return result.valid() ? EXIT_OK : EXIT_FAILURE;
    }

    private int runRepair(Config config) {
        Path file = config.file().orElseThrow();
        DocumentWriter documentWriter = new DocumentWriter();
        Optional<String> original = config.original().map(documentWriter::read);

        SyntaxValidator validator = config.llmFix()
                ? new SyntaxValidator(fixerFactory.apply(config))
                : new SyntaxValidator();
        BackupManager backupManager = new BackupManager();
        RepairPipeline pipeline = new RepairPipeline(validator,
                new SimpleFixer(validator, backupManager, documentWriter),
                new ReferenceBasedFixer(),
                backupManager,
                documentWriter,
                config.llmFix(),
                config.restoreOnFailure());

        RepairReport report = pipeline.repair(file, original);
        report.fixesApplied().forEach(fix -> LOGGER.info("Applied: {}", fix));
        report.remainingIssues().stream()
                .filter(ValidationIssue::isError)
                .forEach(issue -> LOGGER.error("{}: {}", file, issue.describe()));
        LOGGER.info("Repair of {} finished: valid={}, stages={}", file, report.valid(), report.stagesApplied());
        return report.valid() ? EXIT_OK : EXIT_FAILURE;
    }

    private int runCompleteness(Config config) {
        CompletenessReport report = completenessValidator.validate(config.originalPdf().orElseThrow(),
                config.translatedPdf().orElseThrow());
        report.warnings().forEach(warning -> LOGGER.warn("{}", warning));
        LOGGER.info("Completeness score {} ({} of {} sections found)",
                String.format("%.1f", report.score()),
                report.originalSections().size() - report.missingSections().size(),
                report.originalSections().size());
        return report.complete() ? EXIT_OK : EXIT_FAILURE;
    }
}

package ai.latex.translator.cli;

import ai.latex.translator.config.Command;
import ai.latex.translator.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-latex-translator", mixinStandardHelpOptions = true,
        description = "Validates and repairs translated LaTeX documents")
public class CliArguments {

    @CommandLine.Option(names = "--command", converter = CommandConverter.class, defaultValue = "VALIDATE",
            description = "Operation to run: validate, repair or completeness")
    private Command command = Command.VALIDATE;

    @CommandLine.Option(names = "--file", description = "LaTeX document to validate or repair", paramLabel = "FILE")
    private Path file;

    @CommandLine.Option(names = "--original", description = "Untranslated source used as the structural reference", paramLabel = "FILE")
    private Path original;

    @CommandLine.Option(names = "--original-pdf", description = "Compiled original document", paramLabel = "PDF")
    private Path originalPdf;

    @CommandLine.Option(names = "--translated-pdf", description = "Compiled translated document", paramLabel = "PDF")
    private Path translatedPdf;

    @CommandLine.Option(names = "--llm-fix", description = "Ask the configured chat model to fix remaining errors")
    private boolean llmFix;

    @CommandLine.Option(names = "--restore-on-failure", description = "Restore the backup when the document is still invalid after repair")
    private boolean restoreOnFailure;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Command command() {
        return command;
    }

    public Path file() {
        return file;
    }

    public Path original() {
        return original;
    }

    public Path originalPdf() {
        return originalPdf;
    }

    public Path translatedPdf() {
        return translatedPdf;
    }

    public boolean llmFix() {
        return llmFix;
    }

    public boolean restoreOnFailure() {
        return restoreOnFailure;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}

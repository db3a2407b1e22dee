package ai.latex.translator.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.latex.translator.completeness.ContentCompletenessValidator;
import ai.latex.translator.completeness.PdfTextSource;
import ai.latex.translator.completeness.TextBlock;
import ai.latex.translator.config.ConfigLoader;
import ai.latex.translator.llm.LlmSyntaxFixer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String VALID_DOCUMENT = "\\documentclass{article}\n\\begin{document}\nHello\n\\end{document}\n";

    @TempDir
    Path tempDir;

    private final AtomicInteger fixerBuilds = new AtomicInteger();

    @Test
    void validateSucceedsForWellFormedDocument() throws Exception {
        Path file = write("paper.tex", VALID_DOCUMENT);

        int exitCode = application(List.of()).run(new String[] {"--file", file.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
    }

    @Test
    void validateFailsForBrokenDocument() throws Exception {
        Path file = write("paper.tex", "\\begin{itemize}\n\\item x\n\\end{enumerate}\n");

        int exitCode = application(List.of()).run(new String[] {"--command", "validate", "--file", file.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
    }

    @Test
    void repairUsesOriginalAsReference() throws Exception {
        String preamble = "\\documentclass{article}\n\\begin{document}\n";
        Path original = write("paper.tex", preamble + "\\begin{figure}\n\\caption{Overview}\n\\end{figure}\n\\end{document}\n");
        Path translated = write("paper_zh.tex", preamble + "% \\begin{figure}\n\\caption{概览}\n% \\end{figure}\n\\end{document}\n");

        int exitCode = application(List.of()).run(new String[] {
                "--command", "repair",
                "--file", translated.toString(),
                "--original", original.toString()
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(Files.readString(translated, StandardCharsets.UTF_8))
                .isEqualTo(preamble + "\\begin{figure}\n\\caption{概览}\n\\end{figure}\n\\end{document}\n");
        assertThat(fixerBuilds).hasValue(0);
    }

    @Test
    void repairBuildsLlmFixerOnlyWhenRequested() throws Exception {
        Path file = write("paper.tex", VALID_DOCUMENT);

        int exitCode = application(List.of()).run(new String[] {"--command", "fix", "--file", file.toString(), "--llm-fix"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(fixerBuilds).hasValue(1);
    }

    @Test
    void completenessReportsMissingContent() {
        List<TextBlock> blocks = List.of(new TextBlock(1, "1 Introduction"), new TextBlock(2, "2 Method"));

        int complete = application(blocks).run(new String[] {
                "--command", "completeness", "--original-pdf", "a.pdf", "--translated-pdf", "a.pdf"});
        int incomplete = application(blocks).run(new String[] {
                "--command", "completeness", "--original-pdf", "a.pdf", "--translated-pdf", "b.pdf"});

        assertThat(complete).isEqualTo(CliApplication.EXIT_OK);
        assertThat(incomplete).isEqualTo(CliApplication.EXIT_FAILURE);
    }

    @Test
    void missingRequiredInputIsInvalidInput() {
        int exitCode = application(List.of()).run(new String[] {"--command", "repair"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void unknownOptionIsInvalidInput() {
        int exitCode = application(List.of()).run(new String[] {"--bogus"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void helpExitsSuccessfully() {
        assertThat(application(List.of()).run(new String[] {"--help"})).isZero();
    }

    @Test
    void unreadableFileFailsTheCommand() {
        int exitCode = application(List.of()).run(new String[] {"--file", tempDir.resolve("missing.tex").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
    }

    private CliApplication application(List<TextBlock> originalBlocks) {
        PdfTextSource textSource = new PdfTextSource() {
            @Override
            public int pageCount(Path pdf) {
                return 2;
            }

            @Override
            public List<TextBlock> extractBlocks(Path pdf) {
                return pdf.getFileName().toString().equals("a.pdf") ? originalBlocks : List.of();
            }
        };
        return new CliApplication(new ConfigLoader(key -> Optional.empty()),
                new ContentCompletenessValidator(textSource),
                config -> {
                    fixerBuilds.incrementAndGet();
                    return new LlmSyntaxFixer(config.llmConfig(), Optional.empty());
                });
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}

package ai.latex.translator.fix;

import static org.assertj.core.api.Assertions.assertThat;

import ai.latex.translator.validate.IssueCode;
import ai.latex.translator.validate.IssueType;
import ai.latex.translator.validate.SyntaxValidator;
import ai.latex.translator.validate.ValidationIssue;
import ai.latex.translator.validate.ValidationResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SimpleFixerTest {

    private static final String PREAMBLE = "\\documentclass{article}\n\\begin{document}\n";
    private static final String VALID_DOCUMENT = PREAMBLE + "Hello\n\\end{document}\n";

    @TempDir
    Path tempDir;

    private final SyntaxValidator validator = new SyntaxValidator();
    private final SimpleFixer fixer = new SimpleFixer(validator, new BackupManager(), new DocumentWriter());

    @Test
    void correctsKnownTyposAndKeepsBackup() throws Exception {
        String broken = PREAMBLE + "\\begn{itemize}\n\\item a\n\\end{itemize}\n\\end{document}\n";
        Path file = write("typo.tex", broken);

        FixResult result = fixer.tryFixFile(file, validator.validateFile(file));

        assertThat(result.fixed()).isTrue();
        assertThat(result.fixesApplied()).anySatisfy(fix -> assertThat(fix).contains("\\begn"));
        assertThat(read(file)).contains("\\begin{itemize}").doesNotContain("\\begn");
        assertThat(validator.validateFile(file).valid()).isTrue();
        assertThat(result.backupPath()).hasValueSatisfying(backup -> assertThat(read(backup)).isEqualTo(broken));
    }

    @Test
    void collapsesDuplicateEndDocument() throws Exception {
        Path file = write("duplicate.tex", VALID_DOCUMENT + "\\end{document}\n");

        FixResult result = fixer.smartFix(file);

        assertThat(result.fixed()).isTrue();
        assertThat(read(file)).isEqualTo(VALID_DOCUMENT);
    }

    @Test
    void truncatesContentAfterEndDocument() throws Exception {
        Path file = write("tail.tex", VALID_DOCUMENT + "leftover text\n");

        fixer.smartFix(file);

        assertThat(read(file)).isEqualTo(VALID_DOCUMENT);
    }

    @Test
    void closesMissingBracesBeforeEndDocument() throws Exception {
        Path file = write("open.tex", PREAMBLE + "\\textbf{bold\n\\end{document}\n");

        FixResult result = fixer.smartFix(file);

        assertThat(result.fixesApplied()).contains("Added 1 missing closing brace(s)");
        assertThat(read(file)).isEqualTo(PREAMBLE + "\\textbf{bold\n}\n\\end{document}\n");
        assertThat(validator.validateFile(file).valid()).isTrue();
    }

    @Test
    void removesSurplusClosingBraces() throws Exception {
        Path file = write("surplus.tex", PREAMBLE + "Text}}\n\\end{document}\n");

        FixResult result = fixer.smartFix(file);

        assertThat(result.fixesApplied()).contains("Removed 2 extra closing brace(s)");
        assertThat(read(file)).isEqualTo(PREAMBLE + "Text\n\\end{document}\n");
    }

    @Test
    void leavesMisplacedBracesAlone() {
        String content = PREAMBLE + "}text{\n\\end{document}\n";

        FixResult result = fixer.fixContent(content, validator.validate(content));

        assertThat(result.fixed()).isFalse();
        assertThat(result.content()).isEqualTo(content);
    }

    @Test
    void keepsCommentTailWhenOnlyTerminatorIsDuplicated() {
        String checked = VALID_DOCUMENT + "% note\n";
        String content = checked + "\\end{document}\n";

        FixResult kept = fixer.fixContent(content, validator.validate(checked));
        FixResult truncated = fixer.fixContent(content, validator.validate(content));

        assertThat(kept.content()).isEqualTo(VALID_DOCUMENT + "% note\n");
        assertThat(kept.fixesApplied()).containsExactly("Removed 1 duplicate \\end{document}");
        assertThat(truncated.content()).isEqualTo(VALID_DOCUMENT);
    }

    @Test
    void linePreservingScopeLeavesBracesAndFinalNewlineAlone() {
        String content = PREAMBLE + "\\textbf{bold  \n\\end{document}";

        FixResult result = fixer.fixContent(content, validator.validate(content), FixScope.LINE_PRESERVING);

        assertThat(result.content()).isEqualTo(PREAMBLE + "\\textbf{bold\n\\end{document}");
        assertThat(result.fixesApplied()).containsExactly("Trimmed trailing whitespace");
    }

    @Test
    void normalizesLineEndingsAndTrailingWhitespace() {
        String content = "\\documentclass{article}  \r\n\\begin{document}\r\nHello\\ \r\n\\end{document}\r\n\r\n";

        FixResult result = fixer.fixContent(content, validator.validate(content));

        assertThat(result.fixed()).isTrue();
        assertThat(result.content()).isEqualTo("\\documentclass{article}\n\\begin{document}\nHello\\ \n\\end{document}\n");
        assertThat(result.backupPath()).isEmpty();
    }

    @Test
    void fixUnbalancedBracesIgnoresIssuesWithoutDelta() {
        ValidationIssue issue = ValidationIssue.error(IssueType.ENVIRONMENT, IssueCode.UNMATCHED_END, 1, 1, "x");

        assertThat(fixer.fixUnbalancedBraces("text", issue)).isEmpty();
        assertThat(fixer.fixUnbalancedBraces("\\textbf{a", issue.withDelta(1))).isEmpty();
    }

    @Test
    void fixUnbalancedBracesAppendsClosersWithoutTerminator() {
        ValidationIssue issue = ValidationIssue.error(IssueType.BRACE, IssueCode.UNMATCHED_OPENING, 1, 8, "Unclosed '{'")
                .withDelta(2);

        assertThat(fixer.fixUnbalancedBraces("\\textbf{\\emph{a\n", issue)).contains("\\textbf{\\emph{a\n}}\n");
    }

    @Test
    void smartFixSkipsValidDocuments() throws Exception {
        Path file = write("valid.tex", VALID_DOCUMENT);

        FixResult result = fixer.smartFix(file);

        assertThat(result.fixed()).isFalse();
        assertThat(result.backupPath()).isEmpty();
        assertThat(Files.exists(tempDir.resolve("valid.tex" + BackupManager.BACKUP_SUFFIX))).isFalse();
    }

    @Test
    void restoresAndCleansUpBackup() throws Exception {
        String broken = VALID_DOCUMENT + "junk\n";
        Path file = write("restore.tex", broken);
        fixer.smartFix(file);
        assertThat(read(file)).isNotEqualTo(broken);

        fixer.restoreBackup(file);
        assertThat(read(file)).isEqualTo(broken);

        fixer.cleanupBackup(file);
        assertThat(Files.exists(tempDir.resolve("restore.tex" + BackupManager.BACKUP_SUFFIX))).isFalse();
    }

    @Test
    void fixDirectoryReportsOnlyChangedFiles() throws Exception {
        write("valid.tex", VALID_DOCUMENT);
        Path broken = write("chapters/broken.tex", VALID_DOCUMENT + "\\end{document}\n");
        write("notes.txt", "\\begn{");

        Map<Path, FixResult> results = fixer.fixDirectory(tempDir);

        assertThat(results).containsOnlyKeys(broken);
        assertThat(read(tempDir.resolve("notes.txt"))).isEqualTo("\\begn{");
    }

    @Test
    void fixContentLeavesValidInputUntouched() {
        ValidationResult result = validator.validate(VALID_DOCUMENT);

        assertThat(fixer.fixContent(VALID_DOCUMENT, result)).isEqualTo(FixResult.unchanged(VALID_DOCUMENT));
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}

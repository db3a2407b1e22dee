package ai.latex.translator.fix;

import ai.latex.translator.reference.DocumentTerminators;
import ai.latex.translator.scan.LatexLines;
import ai.latex.translator.validate.IssueCode;
import ai.latex.translator.validate.IssueType;
import ai.latex.translator.validate.SyntaxValidator;
import ai.latex.translator.validate.ValidationIssue;
import ai.latex.translator.validate.ValidationResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic rule catalog for common corruption. Works without a reference document and
 * without external calls.
 */
public class SimpleFixer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimpleFixer.class);

    private static final List<TypoCorrection> TYPO_CORRECTIONS = List.of(
            new TypoCorrection("\\begn", "\\begin"),
            new TypoCorrection("\\ened", "\\end"),
            new TypoCorrection("\\docmentclass", "\\documentclass"));
    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("[ \\t]+$");

    private final SyntaxValidator validator;
    private final BackupManager backupManager;
    private final DocumentWriter documentWriter;

    public SimpleFixer() {
        this(new SyntaxValidator(), new BackupManager(), new DocumentWriter());
    }

    public SimpleFixer(SyntaxValidator validator, BackupManager backupManager, DocumentWriter documentWriter) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.backupManager = Objects.requireNonNull(backupManager, "backupManager");
        this.documentWriter = Objects.requireNonNull(documentWriter, "documentWriter");
    }

    /**
     * Backs up {@code file}, applies the rule catalog and writes the result back when anything changed.
     */
    public FixResult tryFixFile(Path file, ValidationResult validationResult) {
        return tryFixFile(file, validationResult, FixScope.ALL);
    }

    public FixResult tryFixFile(Path file, ValidationResult validationResult, FixScope scope) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(validationResult, "validationResult");
        String content = documentWriter.read(file);
        Path backup = backupManager.createBackup(file);
        FixResult result = fixContent(content, validationResult, scope);
        if (result.fixed()) {
            documentWriter.write(file, result.content());
            LOGGER.info("Applied {} fix(es) to {}: {}", result.fixesApplied().size(), file, result.fixesApplied());
        } else {
            LOGGER.debug("No rule-based fix applies to {}", file);
        }
        return result.withBackup(backup);
    }

    /**
     * Validates {@code file} and only runs the catalog when the document is invalid.
     */
    public FixResult smartFix(Path file) {
        ValidationResult validation = validator.validateFile(file);
        if (validation.valid()) {
            return FixResult.unchanged(documentWriter.read(file));
        }
        return tryFixFile(file, validation);
    }

    /**
     * Runs {@link #smartFix(Path)} on every {@code .tex} file below {@code directory}.
     */
    public Map<Path, FixResult> fixDirectory(Path directory) {
        Objects.requireNonNull(directory, "directory");
        List<Path> texFiles;
        try (Stream<Path> paths = Files.walk(directory)) {
            texFiles = paths.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".tex"))
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            throw new FixException("Failed to list LaTeX files under " + directory, ex);
        }
        Map<Path, FixResult> results = new LinkedHashMap<>();
        for (Path texFile : texFiles) {
            FixResult result = smartFix(texFile);
            if (result.fixed()) {
                results.put(texFile, result);
            }
        }
        return results;
    }

    public void restoreBackup(Path file) {
        backupManager.restore(file);
    }

    public void cleanupBackup(Path file) {
        backupManager.cleanup(file);
    }

    /**
     * Applies the catalog in memory. Pure; the returned result carries no backup path.
     */
    public FixResult fixContent(String content, ValidationResult validationResult) {
        return fixContent(content, validationResult, FixScope.ALL);
    }

    /**
     * Applies the part of the catalog allowed by {@code scope} in memory.
     */
    public FixResult fixContent(String content, ValidationResult validationResult, FixScope scope) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(validationResult, "validationResult");
        Objects.requireNonNull(scope, "scope");
        List<String> fixes = new ArrayList<>();
        String current = correctTypos(content, fixes);
        current = normalizeLineEndings(current, fixes);
        if (scope == FixScope.LINE_PRESERVING) {
            current = trimTrailingWhitespace(current, fixes);
            return fixes.isEmpty() ? FixResult.unchanged(content) : new FixResult(true, fixes, Optional.empty(), current);
        }

        boolean contentAfterEnd = validationResult.has(IssueCode.CONTENT_AFTER_END_DOCUMENT);
        List<String> lines = LatexLines.split(current);
        Set<String> keptTail = contentAfterEnd ? Set.of() : quietTail(lines);
        Optional<DocumentTerminators.Collapse> collapse = DocumentTerminators.collapseDuplicates(lines, keptTail);
        if (collapse.isPresent()) {
            lines = new ArrayList<>(collapse.get().lines());
            fixes.add("Removed " + collapse.get().removedTerminators() + " duplicate \\end{document}");
        }
        if (contentAfterEnd) {
            Optional<List<String>> truncated = DocumentTerminators.truncateAfterFirst(lines);
            if (truncated.isPresent()) {
                lines = new ArrayList<>(truncated.get());
                fixes.add("Removed content after \\end{document}");
            }
        }
        current = LatexLines.join(lines);

        Optional<ValidationIssue> braceIssue = genericBraceIssue(validator.validate(current));
        if (braceIssue.isPresent()) {
            Optional<String> balanced = fixUnbalancedBraces(current, braceIssue.get());
            if (balanced.isPresent()) {
                current = balanced.get();
                int delta = braceIssue.get().delta().orElse(0);
                fixes.add(delta > 0
                        ? "Added " + delta + " missing closing brace(s)"
                        : "Removed " + -delta + " extra closing brace(s)");
            }
        }

        current = normalizeFinalNewline(trimTrailingWhitespace(current, fixes), fixes);
        if (fixes.isEmpty()) {
            return FixResult.unchanged(content);
        }
        return new FixResult(true, fixes, Optional.empty(), current);
    }

    /**
     * Coarse brace repair driven by the numeric delta of a brace finding: a positive delta closes the
     * missing groups right before {@code \end{document}} (or at the end), a negative delta removes
     * the same number of {@code }} from the tail of the document body.
     */
    public Optional<String> fixUnbalancedBraces(String content, ValidationIssue issue) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(issue, "issue");
        if (issue.type() != IssueType.BRACE || issue.delta().isEmpty() || issue.delta().get() == 0) {
            return Optional.empty();
        }
        int delta = issue.delta().get();
        List<String> lines = LatexLines.split(content);
        int terminator = DocumentTerminators.firstLine(lines);
        if (delta > 0) {
            String closers = "}".repeat(delta);
            if (terminator >= 0) {
                lines.add(terminator, closers);
            } else {
                int last = lines.size() - 1;
                if (lines.get(last).isEmpty() && last > 0) {
                    lines.add(last, closers);
                } else {
                    lines.add(closers);
                }
            }
            return Optional.of(LatexLines.join(lines));
        }
        int end = terminator >= 0 ? offsetOfLine(content, terminator) : content.length();
        return removeTrailingClosers(content, end, -delta);
    }

    private Optional<String> removeTrailingClosers(String content, int end, int count) {
        int index = end;
        int removed = 0;
        StringBuilder builder = new StringBuilder(content);
        while (index > 0 && removed < count) {
            char c = builder.charAt(index - 1);
            if (c == '}' && (index < 2 || builder.charAt(index - 2) != '\\')) {
                builder.deleteCharAt(index - 1);
                removed++;
            } else if (!Character.isWhitespace(c)) {
                break;
            }
            index--;
        }
        return removed == count ? Optional.of(builder.toString()) : Optional.empty();
    }

    private static int offsetOfLine(String content, int lineIndex) {
        int offset = 0;
        for (int i = 0; i < lineIndex; i++) {
            offset = content.indexOf('\n', offset) + 1;
        }
        return offset;
    }

    private static Optional<ValidationIssue> genericBraceIssue(ValidationResult result) {
        List<ValidationIssue> braceIssues = result.issuesOfType(IssueType.BRACE).stream()
                .filter(issue -> issue.code() == IssueCode.UNMATCHED_OPENING || issue.code() == IssueCode.UNMATCHED_CLOSING)
                .toList();
        if (braceIssues.isEmpty()) {
            return Optional.empty();
        }
        IssueCode code = braceIssues.get(0).code();
        if (braceIssues.stream().anyMatch(issue -> issue.code() != code)) {
            // mixed directions: misplaced braces, not a simple surplus
            return Optional.empty();
        }
        return Optional.of(braceIssues.get(0));
    }

    private static String correctTypos(String content, List<String> fixes) {
        String current = content;
        for (TypoCorrection correction : TYPO_CORRECTIONS) {
            Matcher matcher = correction.pattern().matcher(current);
            int count = 0;
            StringBuilder builder = new StringBuilder();
            while (matcher.find()) {
                count++;
                matcher.appendReplacement(builder, Matcher.quoteReplacement(correction.replacement()));
            }
            matcher.appendTail(builder);
            if (count > 0) {
                current = builder.toString();
                fixes.add("Corrected " + count + " occurrence(s) of " + correction.typo() + " to " + correction.replacement());
            }
        }
        return current;
    }

    private static String normalizeLineEndings(String content, List<String> fixes) {
        if (content.indexOf('\r') < 0) {
            return content;
        }
        fixes.add("Normalized line endings");
        return content.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Blank and comment lines after the first terminator, which compile to nothing.
     */
    private static Set<String> quietTail(List<String> lines) {
        int first = DocumentTerminators.firstLine(lines);
        if (first < 0) {
            return Set.of();
        }
        Set<String> tail = new HashSet<>();
        for (String line : lines.subList(first + 1, lines.size())) {
            if (line.isBlank() || LatexLines.isCommentLine(line)) {
                tail.add(line);
            }
        }
        return tail;
    }

    private static String trimTrailingWhitespace(String content, List<String> fixes) {
        List<String> lines = LatexLines.split(content);
        boolean trimmed = false;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String stripped = TRAILING_WHITESPACE.matcher(line).replaceFirst("");
            if (stripped.endsWith("\\") && !line.equals(stripped)) {
                // keep the control space "\ "
                stripped = stripped + " ";
            }
            if (!stripped.equals(line)) {
                lines.set(i, stripped);
                trimmed = true;
            }
        }
        if (trimmed) {
            fixes.add("Trimmed trailing whitespace");
        }
        return LatexLines.join(lines);
    }

    private static String normalizeFinalNewline(String joined, List<String> fixes) {
        String body = joined.replaceAll("\\n+$", "");
        String normalized = body.isEmpty() ? body : body + "\n";
        if (!normalized.equals(joined)) {
            fixes.add("Normalized final newline");
        }
        return normalized;
    }

    private record TypoCorrection(String typo, String replacement) {

        Pattern pattern() {
            return Pattern.compile(Pattern.quote(typo) + "(?![A-Za-z])");
        }
    }
}

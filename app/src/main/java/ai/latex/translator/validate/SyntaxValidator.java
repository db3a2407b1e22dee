package ai.latex.translator.validate;

import ai.latex.translator.llm.ConfigurationException;
import ai.latex.translator.llm.LlmSyntaxFixer;
import ai.latex.translator.scan.Delimiter;
import ai.latex.translator.scan.LatexLines;
import ai.latex.translator.scan.LatexScanner;
import ai.latex.translator.scan.ScanListener;
import ai.latex.translator.scan.SourcePosition;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the structural well-formedness of LaTeX sources.
 *
 * <p>Braces, brackets, math delimiters and environments are balanced independently. In document
 * mode the preamble and the {@code document} environment are checked as well. Validation is pure:
 * it never touches the input and returns findings instead of throwing.
 */
public class SyntaxValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(SyntaxValidator.class);

    static final int MAX_BRACE_DEPTH = 100;
    static final int DEFINITION_WINDOW_LINES = 10;

    private static final Map<String, String> KNOWN_TYPOS = Map.of(
            "begn", "begin",
            "ened", "end",
            "docmentclass", "documentclass");
    private static final Set<String> DEFINITION_COMMANDS = Set.of("newcommand", "renewcommand", "providecommand");
    private static final Set<String> INCLUDE_COMMANDS = Set.of("input", "include");

    private final LatexScanner scanner;
    private final IncludeChecker includeChecker;
    private final Optional<LlmSyntaxFixer> fixer;

    public SyntaxValidator() {
        this(new LatexScanner(), new IncludeChecker(), Optional.empty());
    }

    public SyntaxValidator(LlmSyntaxFixer fixer) {
        this(new LatexScanner(), new IncludeChecker(), Optional.of(fixer));
    }

    public SyntaxValidator(LatexScanner scanner, IncludeChecker includeChecker, Optional<LlmSyntaxFixer> fixer) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.includeChecker = Objects.requireNonNull(includeChecker, "includeChecker");
        this.fixer = fixer == null ? Optional.empty() : fixer;
    }

    public ValidationResult validate(String content) {
        return run(content, true, null);
    }

    /**
     * Validates a complete document and resolves {@code \input}/{@code \include} targets against
     * {@code documentDirectory}.
     */
    public ValidationResult validate(String content, Path documentDirectory) {
        return run(content, true, documentDirectory);
    }

    /**
     * Validates a fragment such as an included chapter: no preamble or {@code document} checks.
     */
    public ValidationResult validateFragment(String content) {
        return run(content, false, null);
    }

    public ValidationResult validateFile(Path file) {
        Objects.requireNonNull(file, "file");
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + file, ex);
        }
        Path directory = file.toAbsolutePath().getParent();
        return run(content, true, directory);
    }

    /**
     * Hands the document and its findings to the configured LLM fixer.
     *
     * @throws ConfigurationException when no fixer is configured
     */
    public String fix(String content, List<SyntaxError> errors) {
        LlmSyntaxFixer configured = fixer.orElseThrow(
                () -> new ConfigurationException("LLM fixer is not configured"));
        return configured.fix(content, errors);
    }

    private ValidationResult run(String content, boolean documentMode, Path documentDirectory) {
        Objects.requireNonNull(content, "content");
        if (content.isEmpty()) {
            return ValidationResult.of(List.of());
        }
        StructureCollector collector = new StructureCollector(content, documentMode, documentDirectory);
        scanner.scan(content, collector);
        List<ValidationIssue> issues = collector.issues();
        issues.sort(Comparator.comparingInt(ValidationIssue::line).thenComparingInt(ValidationIssue::column));
        ValidationResult result = ValidationResult.of(issues);
        if (!result.valid()) {
            LOGGER.debug("Validation found {}", result.summary());
        }
        return result;
    }

    private static IssueType typeOf(Delimiter delimiter) {
        return switch (delimiter) {
            case BRACE -> IssueType.BRACE;
            case BRACKET -> IssueType.BRACKET;
            case PAREN_MATH, BRACKET_MATH -> IssueType.MATH;
        };
    }

    private static Severity severityOf(Delimiter delimiter) {
        return delimiter == Delimiter.BRACKET ? Severity.WARNING : Severity.ERROR;
    }

    private final class StructureCollector implements ScanListener {

        private final String content;
        private final boolean documentMode;
        private final Path documentDirectory;
        private final List<ValidationIssue> issues = new ArrayList<>();
        private final Map<Delimiter, Deque<SourcePosition>> openings = new EnumMap<>(Delimiter.class);
        private final Map<Delimiter, List<SourcePosition>> strayClosings = new EnumMap<>(Delimiter.class);
        private final Deque<EnvironmentStackEntry> environments = new ArrayDeque<>();
        private final List<SourcePosition> definitions = new ArrayList<>();
        private SourcePosition inlineMath;
        private SourcePosition displayMath;
        private boolean sawDocumentClass;
        private boolean sawBeginDocument;
        private boolean deepNestingReported;
        private int endDocumentTokenEnd = -1;
        private int endDocumentLine;

        StructureCollector(String content, boolean documentMode, Path documentDirectory) {
            this.content = content;
            this.documentMode = documentMode;
            this.documentDirectory = documentDirectory;
            for (Delimiter delimiter : Delimiter.values()) {
                openings.put(delimiter, new ArrayDeque<>());
                strayClosings.put(delimiter, new ArrayList<>());
            }
        }

        List<ValidationIssue> issues() {
            return issues;
        }

        @Override
        public void onOpen(Delimiter delimiter, SourcePosition position) {
            Deque<SourcePosition> stack = openings.get(delimiter);
            stack.push(position);
            if (delimiter == Delimiter.BRACE && stack.size() > MAX_BRACE_DEPTH && !deepNestingReported) {
                deepNestingReported = true;
                issues.add(ValidationIssue.warning(IssueType.BRACE, IssueCode.DEEP_NESTING,
                        position.line(), position.column(),
                        "Brace nesting deeper than " + MAX_BRACE_DEPTH + " levels"));
            }
        }

        @Override
        public void onClose(Delimiter delimiter, SourcePosition position) {
            Deque<SourcePosition> stack = openings.get(delimiter);
            if (stack.isEmpty()) {
                strayClosings.get(delimiter).add(position);
            } else {
                stack.pop();
            }
        }

        @Override
        public void onInlineMathToggle(SourcePosition position) {
            inlineMath = inlineMath == null ? position : null;
        }

        @Override
        public void onDisplayMathToggle(SourcePosition position) {
            displayMath = displayMath == null ? position : null;
        }

        @Override
        public void onCommand(String name, SourcePosition position, int nameEnd) {
            if ("documentclass".equals(name)) {
                sawDocumentClass = true;
            }
            String correction = KNOWN_TYPOS.get(name);
            if (correction != null) {
                issues.add(ValidationIssue.error(IssueType.TYPO, IssueCode.KNOWN_TYPO,
                        position.line(), position.column(),
                        "Unknown command \\" + name + ", did you mean \\" + correction + "?"));
            }
            if (DEFINITION_COMMANDS.contains(name)) {
                definitions.add(position);
            }
            if (documentDirectory != null && INCLUDE_COMMANDS.contains(name)) {
                LatexScanner.readGroupArgument(content, nameEnd).ifPresent(argument -> {
                    if (!includeChecker.exists(documentDirectory, argument.value())) {
                        issues.add(ValidationIssue.warning(IssueType.INCLUDE, IssueCode.MISSING_INCLUDE,
                                position.line(), position.column(),
                                "Included file not found: " + argument.value()));
                    }
                });
            }
        }

        @Override
        public void onBeginEnvironment(String name, SourcePosition position) {
            if ("document".equals(name)) {
                sawBeginDocument = true;
            }
            environments.push(new EnvironmentStackEntry(name, position.line(), position.column()));
        }

        @Override
        public void onEndEnvironment(String name, SourcePosition position, int tokenEnd) {
            if ("document".equals(name) && endDocumentTokenEnd < 0) {
                endDocumentTokenEnd = tokenEnd;
                endDocumentLine = position.line();
            }
            if (environments.isEmpty()) {
                issues.add(ValidationIssue.error(IssueType.ENVIRONMENT, IssueCode.UNMATCHED_END,
                        position.line(), position.column(),
                        "\\end{" + name + "} without matching \\begin{" + name + "}"));
                return;
            }
            EnvironmentStackEntry top = environments.peek();
            if (top.name().equals(name)) {
                environments.pop();
                return;
            }
            issues.add(ValidationIssue.error(IssueType.ENVIRONMENT, IssueCode.ENVIRONMENT_MISMATCH,
                    top.line(), top.column(),
                    "\\begin{" + top.name() + "} is closed by \\end{" + name + "}"));
            issues.add(ValidationIssue.error(IssueType.ENVIRONMENT, IssueCode.ENVIRONMENT_MISMATCH,
                    position.line(), position.column(),
                    "\\end{" + name + "} does not match \\begin{" + top.name() + "} opened at line " + top.line()));
            environments.pop();
            if (environments.stream().anyMatch(entry -> entry.name().equals(name))) {
                // resynchronise on the deeper environment this \end actually closes
                EnvironmentStackEntry skipped = environments.pop();
                while (!skipped.name().equals(name)) {
                    issues.add(unclosed(skipped));
                    skipped = environments.pop();
                }
            }
        }

        @Override
        public void onEnd(SourcePosition position) {
            for (Delimiter delimiter : Delimiter.values()) {
                reportDelimiter(delimiter);
            }
            if (inlineMath != null) {
                issues.add(ValidationIssue.error(IssueType.MATH, IssueCode.UNMATCHED_OPENING,
                        inlineMath.line(), inlineMath.column(), "Unclosed inline math '$'"));
            }
            if (displayMath != null) {
                issues.add(ValidationIssue.error(IssueType.MATH, IssueCode.UNMATCHED_OPENING,
                        displayMath.line(), displayMath.column(), "Unclosed display math '$$'"));
            }
            Iterator<EnvironmentStackEntry> remaining = environments.descendingIterator();
            while (remaining.hasNext()) {
                issues.add(unclosed(remaining.next()));
            }
            if (documentMode) {
                checkDocumentStructure();
            }
            checkContentAfterEnd();
            checkDefinitions();
        }

        private void reportDelimiter(Delimiter delimiter) {
            Deque<SourcePosition> unclosed = openings.get(delimiter);
            List<SourcePosition> stray = strayClosings.get(delimiter);
            int delta = unclosed.size() - stray.size();
            Iterator<SourcePosition> bottomUp = unclosed.descendingIterator();
            while (bottomUp.hasNext()) {
                SourcePosition position = bottomUp.next();
                issues.add(delimiterIssue(delimiter, IssueCode.UNMATCHED_OPENING, position,
                        "Unclosed '" + delimiter.opening() + "'", delta));
            }
            for (SourcePosition position : stray) {
                issues.add(delimiterIssue(delimiter, IssueCode.UNMATCHED_CLOSING, position,
                        "Unexpected '" + delimiter.closing() + "' without matching '" + delimiter.opening() + "'",
                        delta));
            }
        }

        private ValidationIssue delimiterIssue(Delimiter delimiter, IssueCode code, SourcePosition position,
                                               String message, int delta) {
            String details = delta > 0
                    ? delta + " unclosed opening " + delimiter.opening()
                    : -delta + " unexpected closing " + delimiter.closing();
            return new ValidationIssue(severityOf(delimiter), typeOf(delimiter), code,
                    position.line(), position.column(), message, details, Optional.of(delta));
        }

        private ValidationIssue unclosed(EnvironmentStackEntry entry) {
            String message = "Unclosed environment \\begin{" + entry.name() + "}";
            if ("document".equals(entry.name())) {
                return ValidationIssue.error(IssueType.ENVIRONMENT, IssueCode.UNCLOSED_ENVIRONMENT,
                        entry.line(), entry.column(), message);
            }
            return ValidationIssue.warning(IssueType.ENVIRONMENT, IssueCode.UNCLOSED_ENVIRONMENT,
                    entry.line(), entry.column(), message);
        }

        private void checkDocumentStructure() {
            if (!sawDocumentClass) {
                issues.add(ValidationIssue.error(IssueType.DOCUMENT, IssueCode.MISSING_DOCUMENTCLASS, 0, 0,
                        "Missing \\documentclass"));
                return;
            }
            if (!sawBeginDocument) {
                issues.add(ValidationIssue.error(IssueType.DOCUMENT, IssueCode.MISSING_BEGIN_DOCUMENT, 0, 0,
                        "Missing \\begin{document}"));
            }
            if (endDocumentTokenEnd < 0) {
                issues.add(ValidationIssue.error(IssueType.DOCUMENT, IssueCode.MISSING_END_DOCUMENT, 0, 0,
                        "Missing " + LatexLines.END_DOCUMENT));
            }
        }

        private void checkContentAfterEnd() {
            if (endDocumentTokenEnd < 0) {
                return;
            }
            List<String> tail = LatexLines.split(content.substring(endDocumentTokenEnd));
            for (int i = 0; i < tail.size(); i++) {
                String code = LatexLines.code(tail.get(i));
                if (!code.isBlank()) {
                    int line = endDocumentLine + i;
                    int column = i == 0
                            ? endDocumentTokenEnd - content.lastIndexOf('\n', endDocumentTokenEnd - 1)
                            : 1;
                    column += code.length() - code.stripLeading().length();
                    issues.add(ValidationIssue.error(IssueType.DOCUMENT, IssueCode.CONTENT_AFTER_END_DOCUMENT,
                            line, column, "Content after " + LatexLines.END_DOCUMENT));
                    return;
                }
            }
        }

        private void checkDefinitions() {
            for (SourcePosition definition : definitions) {
                int balance = 0;
                boolean closed = false;
                int lineStart = definition.offset();
                for (int i = 0; i < DEFINITION_WINDOW_LINES && !closed && lineStart <= content.length(); i++) {
                    int lineEnd = content.indexOf('\n', lineStart);
                    if (lineEnd < 0) {
                        lineEnd = content.length();
                    }
                    balance += LatexLines.braceBalance(content.substring(lineStart, lineEnd));
                    closed = balance <= 0;
                    lineStart = lineEnd + 1;
                }
                if (!closed) {
                    issues.add(ValidationIssue.warning(IssueType.COMMAND, IssueCode.INCOMPLETE_DEFINITION,
                            definition.line(), definition.column(),
                            "Command definition is not closed within " + DEFINITION_WINDOW_LINES + " lines"));
                }
            }
        }
    }
}

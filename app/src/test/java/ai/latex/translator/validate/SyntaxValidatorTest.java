package ai.latex.translator.validate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;

import ai.latex.translator.llm.ConfigurationException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SyntaxValidatorTest {

    private static final String MINIMAL_DOCUMENT =
            "\\documentclass{article}\n\\begin{document}\nHello\n\\end{document}";

    private final SyntaxValidator validator = new SyntaxValidator();

    @TempDir
    Path tempDir;

    @Test
    void acceptsMinimalDocument() {
        ValidationResult result = validator.validate(MINIMAL_DOCUMENT);

        assertThat(result.valid()).isTrue();
        assertThat(result.issues()).isEmpty();
    }

    @Test
    void emptyContentIsValid() {
        ValidationResult result = validator.validate("");

        assertThat(result.valid()).isTrue();
        assertThat(result.issues()).isEmpty();
    }

    @Test
    void reportsMismatchedEnvironments() {
        ValidationResult result = validator.validate("\\begin{itemize}\n\\item x\n\\end{enumerate}");

        assertThat(result.valid()).isFalse();
        assertThat(result.issuesOfType(IssueType.ENVIRONMENT)).isNotEmpty();
    }

    @Test
    void reportsMismatchAtBothEndsAndResynchronises() {
        ValidationResult result = validator.validateFragment("\\begin{a}\n\\begin{b}\n\\end{a}");

        assertThat(result.issues())
                .extracting(ValidationIssue::code, ValidationIssue::line)
                .containsExactly(
                        tuple(IssueCode.ENVIRONMENT_MISMATCH, 2),
                        tuple(IssueCode.ENVIRONMENT_MISMATCH, 3));
    }

    @Test
    void reportsEndWithoutBegin() {
        ValidationResult result = validator.validateFragment("text\n\\end{table}");

        assertThat(result.valid()).isFalse();
        assertThat(result.has(IssueCode.UNMATCHED_END)).isTrue();
    }

    @Test
    @DisplayName("Unclosed openings are reported where they occur, carrying the net surplus")
    void reportsUnclosedBracesWithDelta() {
        ValidationResult result = validator.validateFragment("{{{\n}");

        List<ValidationIssue> braces = result.issuesOfType(IssueType.BRACE);
        assertThat(result.valid()).isFalse();
        assertThat(braces).hasSize(2);
        assertThat(braces).allSatisfy(issue -> {
            assertThat(issue.code()).isEqualTo(IssueCode.UNMATCHED_OPENING);
            assertThat(issue.delta()).contains(2);
            assertThat(issue.line()).isEqualTo(1);
        });
        assertThat(braces).extracting(ValidationIssue::column).containsExactly(1, 2);
    }

    @Test
    void reportsStrayClosingBracesWithNegativeDelta() {
        ValidationResult result = validator.validateFragment("text}}");

        List<ValidationIssue> braces = result.issuesOfType(IssueType.BRACE);
        assertThat(braces).hasSize(2);
        assertThat(braces).allSatisfy(issue -> {
            assertThat(issue.code()).isEqualTo(IssueCode.UNMATCHED_CLOSING);
            assertThat(issue.delta()).contains(-2);
        });
    }

    @Test
    void reportsOneBraceIssuePerSurplusBrace() {
        for (int opens = 0; opens <= 4; opens++) {
            for (int closes = 0; closes <= 4; closes++) {
                String content = "{".repeat(opens) + "text" + "}".repeat(closes);

                ValidationResult result = validator.validateFragment(content);

                assertThat(result.issuesOfType(IssueType.BRACE))
                        .as("%d openings, %d closings", opens, closes)
                        .hasSize(Math.abs(opens - closes));
            }
        }
    }

    @Test
    void unbalancedTokensInsideCommentsNeverChangeValidity() {
        List<String> tokens = List.of("{", "}", "[", "]", "$", "$$", "\\(", "\\]", "\\begin{table}", "\\end{figure}");

        for (String token : tokens) {
            String content = "\\documentclass{article}\n\\begin{document}\n% " + token + "\nHello\n\\end{document}";

            assertThat(validator.validate(content).valid()).as("comment holding %s", token).isTrue();
        }
    }

    @Test
    void ignoresBracesInCommentsAndEscapes() {
        ValidationResult result = validator.validateFragment("Costs \\{50\\%\\} % {{{ [ $\n\\\\ done");

        assertThat(result.valid()).isTrue();
        assertThat(result.issues()).isEmpty();
    }

    @Test
    void unmatchedBracketIsOnlyAWarning() {
        ValidationResult result = validator.validateFragment("\\item[label text");

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).extracting(ValidationIssue::type).containsExactly(IssueType.BRACKET);
    }

    @Test
    void reportsUnclosedMath() {
        assertThat(validator.validateFragment("Let $x be").issuesOfType(IssueType.MATH)).hasSize(1);
        assertThat(validator.validateFragment("$$a$$ \\(b").issuesOfType(IssueType.MATH)).hasSize(1);
        assertThat(validator.validateFragment("\\[a\\] $b$").valid()).isTrue();
    }

    @Test
    void unclosedInnerEnvironmentIsAWarning() {
        ValidationResult result = validator.validateFragment("\\begin{figure}\ncontent");

        assertThat(result.valid()).isTrue();
        assertThat(result.has(IssueCode.UNCLOSED_ENVIRONMENT)).isTrue();
    }

    @Test
    void unclosedDocumentIsAnError() {
        ValidationResult result = validator.validate("\\documentclass{article}\n\\begin{document}\nHello");

        assertThat(result.valid()).isFalse();
        assertThat(result.has(IssueCode.UNCLOSED_ENVIRONMENT)).isTrue();
        assertThat(result.has(IssueCode.MISSING_END_DOCUMENT)).isTrue();
    }

    @Test
    void missingDocumentClassSuppressesOtherDocumentChecks() {
        ValidationResult result = validator.validate("Hello world");

        assertThat(result.issues()).extracting(ValidationIssue::code).containsExactly(IssueCode.MISSING_DOCUMENTCLASS);
        assertThat(validator.validateFragment("Hello world").issues()).isEmpty();
    }

    @Test
    void reportsMissingBeginDocument() {
        ValidationResult result = validator.validate("\\documentclass{article}\nHello");

        assertThat(result.has(IssueCode.MISSING_BEGIN_DOCUMENT)).isTrue();
        assertThat(result.has(IssueCode.MISSING_END_DOCUMENT)).isTrue();
    }

    @Test
    void reportsContentAfterEndDocument() {
        ValidationResult result = validator.validate(MINIMAL_DOCUMENT + "\n% a comment is fine\n  trailing}");

        ValidationIssue issue = result.issues().stream()
                .filter(candidate -> candidate.code() == IssueCode.CONTENT_AFTER_END_DOCUMENT)
                .findFirst()
                .orElseThrow();
        assertThat(issue.line()).isEqualTo(6);
        assertThat(issue.column()).isEqualTo(3);
        assertThat(result.valid()).isFalse();
    }

    @Test
    void duplicateEndDocumentIsReported() {
        ValidationResult result = validator.validate(MINIMAL_DOCUMENT + "\n\\end{document}");

        assertThat(result.has(IssueCode.CONTENT_AFTER_END_DOCUMENT)).isTrue();
        assertThat(result.has(IssueCode.UNMATCHED_END)).isTrue();
    }

    @Test
    void reportsKnownTypos() {
        ValidationResult result = validator.validateFragment("\\begn{itemize}\n\\item a\n\\end{itemize}");

        assertThat(result.valid()).isFalse();
        assertThat(result.issuesOfType(IssueType.TYPO)).singleElement()
                .satisfies(issue -> assertThat(issue.message()).contains("\\begin"));
    }

    @Test
    void syntaxErrorsKeepOnlyStructuralFindings() {
        ValidationResult fragment = validator.validateFragment("\\begn{itemize}\n\\item {a\n\\end{itemize}");
        ValidationResult document = validator.validate("Hello}");

        assertThat(fragment.issuesOfType(IssueType.TYPO)).isNotEmpty();
        assertThat(fragment.toSyntaxErrors()).extracting(SyntaxError::type)
                .containsOnly(IssueType.BRACE, IssueType.ENVIRONMENT);
        assertThat(document.issuesOfType(IssueType.DOCUMENT)).isNotEmpty();
        assertThat(document.toSyntaxErrors()).singleElement()
                .satisfies(error -> assertThat(error.type()).isEqualTo(IssueType.BRACE));
    }

    @Test
    void warnsAboutVeryDeepNesting() {
        String content = "{".repeat(SyntaxValidator.MAX_BRACE_DEPTH + 1) + "}".repeat(SyntaxValidator.MAX_BRACE_DEPTH + 1);

        ValidationResult result = validator.validateFragment(content);

        assertThat(result.valid()).isTrue();
        assertThat(result.has(IssueCode.DEEP_NESTING)).isTrue();
    }

    @Test
    void warnsAboutIncompleteCommandDefinition() {
        ValidationResult result = validator.validateFragment("\\newcommand{\\highlight}[1]{\\textbf{#1}\n\nText");

        assertThat(result.has(IssueCode.INCOMPLETE_DEFINITION)).isTrue();
        assertThat(validator.validateFragment("\\newcommand{\\highlight}[1]{\\textbf{#1}}").issues()).isEmpty();
    }

    @Test
    void definitionMayCloseWithinTenLines() {
        String closedOnTenthLine = "Intro\n  \\newcommand{\\x}{\n" + "a\n".repeat(8) + "}";
        String closedOnEleventhLine = "Intro\n  \\newcommand{\\x}{\n" + "a\n".repeat(9) + "}";
        String manyDefinitions = "\\newcommand{\\m}{m}\n".repeat(2_000);

        assertThat(validator.validateFragment(closedOnTenthLine).issues()).isEmpty();
        assertThat(validator.validateFragment(closedOnEleventhLine).issues())
                .extracting(ValidationIssue::code, ValidationIssue::line, ValidationIssue::column)
                .containsExactly(tuple(IssueCode.INCOMPLETE_DEFINITION, 2, 3));
        assertThat(validator.validateFragment(manyDefinitions).issues()).isEmpty();
    }

    @Test
    void warnsAboutMissingIncludesRelativeToDocumentDirectory() throws Exception {
        Files.writeString(tempDir.resolve("present.tex"), "Chapter", StandardCharsets.UTF_8);
        String content = "\\documentclass{article}\n\\begin{document}\n\\input{present}\n\\include{absent}\n\\end{document}";

        ValidationResult result = validator.validate(content, tempDir);

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo(IssueCode.MISSING_INCLUDE);
            assertThat(issue.line()).isEqualTo(4);
        });
    }

    @Test
    void validateFileReadsFromDisk() throws Exception {
        Path file = tempDir.resolve("paper.tex");
        Files.writeString(file, MINIMAL_DOCUMENT, StandardCharsets.UTF_8);

        assertThat(validator.validateFile(file).valid()).isTrue();
        assertThat(catchThrowable(() -> validator.validateFile(tempDir.resolve("missing.tex"))))
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void validationLeavesInputUntouchedAndIsRepeatable() {
        String content = "\\begin{itemize}\n{\n\\end{enumerate}";

        ValidationResult first = validator.validate(content);
        ValidationResult second = validator.validate(content);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void fixWithoutConfiguredFixerFails() {
        Throwable thrown = catchThrowable(() -> validator.fix("{", List.of()));

        assertThat(thrown).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void issuesAreOrderedByPosition() {
        ValidationResult result = validator.validateFragment("}\n$x\n{");

        assertThat(result.issues()).extracting(ValidationIssue::line).containsExactly(1, 2, 3);
    }
}

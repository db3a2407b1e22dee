package ai.latex.translator.pipeline;

import ai.latex.translator.fix.BackupManager;
import ai.latex.translator.fix.DocumentWriter;
import ai.latex.translator.fix.FixResult;
import ai.latex.translator.fix.FixScope;
import ai.latex.translator.fix.SimpleFixer;
import ai.latex.translator.llm.LlmFixException;
import ai.latex.translator.logging.LogContext;
import ai.latex.translator.reference.LineFixResult;
import ai.latex.translator.reference.ReferenceBasedFixer;
import ai.latex.translator.validate.SyntaxValidator;
import ai.latex.translator.validate.ValidationResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the repair stages on one document: rule-based fixes, reference-based repair and, when enabled,
 * the LLM fixer. With a reference only the line-preserving rules run before the reference repair;
 * the rest of the catalog is a fallback for what the reference repair leaves invalid. The document is re-validated after every stage and each accepted stage output is
 * written atomically.
 */
public class RepairPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(RepairPipeline.class);

    private final SyntaxValidator validator;
    private final SimpleFixer simpleFixer;
    private final ReferenceBasedFixer referenceFixer;
    private final BackupManager backupManager;
    private final DocumentWriter documentWriter;
    private final boolean llmFixEnabled;
    private final boolean restoreOnFailure;

    public RepairPipeline(SyntaxValidator validator,
                          SimpleFixer simpleFixer,
                          ReferenceBasedFixer referenceFixer,
                          BackupManager backupManager,
                          DocumentWriter documentWriter,
                          boolean llmFixEnabled,
                          boolean restoreOnFailure) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.simpleFixer = Objects.requireNonNull(simpleFixer, "simpleFixer");
        this.referenceFixer = Objects.requireNonNull(referenceFixer, "referenceFixer");
        this.backupManager = Objects.requireNonNull(backupManager, "backupManager");
        this.documentWriter = Objects.requireNonNull(documentWriter, "documentWriter");
        this.llmFixEnabled = llmFixEnabled;
        this.restoreOnFailure = restoreOnFailure;
    }

    public RepairReport repair(Path file, Optional<String> original) {
        Objects.requireNonNull(file, "file");
        Optional<String> reference = original == null ? Optional.empty() : original.filter(value -> !value.isEmpty());
        try (MDC.MDCCloseable ignored = LogContext.document(file.getFileName())) {
            return runStages(file, reference);
        }
    }

    private RepairReport runStages(Path file, Optional<String> reference) {
        Path directory = file.toAbsolutePath().getParent();
        List<RepairStage> stages = new ArrayList<>();
        List<String> fixes = new ArrayList<>();

        String content = documentWriter.read(file);
        ValidationResult result = validator.validate(content, directory);
        if (result.valid() && reference.isEmpty()) {
            LOGGER.info("{} is valid; nothing to repair", file);
            return new RepairReport(true, stages, fixes, result.issues(), content);
        }
        backupManager.createBackup(file);

        if (!result.valid()) {
            // with a reference the line layout must survive for the aligned repair
            FixScope scope = reference.isPresent() ? FixScope.LINE_PRESERVING : FixScope.ALL;
            FixResult simple;
            try (MDC.MDCCloseable ignored = LogContext.stage(RepairStage.SIMPLE_FIX.label())) {
                simple = simpleFixer.tryFixFile(file, result, scope);
            }
            if (simple.fixed()) {
                content = simple.content();
                stages.add(RepairStage.SIMPLE_FIX);
                fixes.addAll(simple.fixesApplied());
                result = validator.validate(content, directory);
            }
        }

        if (reference.isPresent()) {
            LineFixResult repaired;
            try (MDC.MDCCloseable ignored = LogContext.stage(RepairStage.REFERENCE_FIX.label())) {
                repaired = referenceFixer.repair(content, reference.get());
            }
            if (repaired.changed()) {
                documentWriter.write(file, repaired.content());
                content = repaired.content();
                stages.add(RepairStage.REFERENCE_FIX);
                fixes.addAll(repaired.fixDetails());
                result = validator.validate(content, directory);
            }
        }

        if (!result.valid() && reference.isPresent()) {
            FixResult fallback;
            try (MDC.MDCCloseable ignored = LogContext.stage(RepairStage.SIMPLE_FIX.label())) {
                fallback = simpleFixer.fixContent(content, result, FixScope.ALL);
            }
            if (fallback.fixed()) {
                documentWriter.write(file, fallback.content());
                content = fallback.content();
                stages.add(RepairStage.SIMPLE_FIX);
                fixes.addAll(fallback.fixesApplied());
                result = validator.validate(content, directory);
            }
        }

        if (!result.valid() && llmFixEnabled) {
            try (MDC.MDCCloseable ignored = LogContext.stage(RepairStage.LLM_FIX.label())) {
                String proposed = validator.fix(content, result.toSyntaxErrors());
                ValidationResult proposedResult = validator.validate(proposed, directory);
                if (proposedResult.errors().size() < result.errors().size()) {
                    documentWriter.write(file, proposed);
                    content = proposed;
                    result = proposedResult;
                    stages.add(RepairStage.LLM_FIX);
                    fixes.add("Applied LLM fix");
                } else {
                    LOGGER.warn("LLM fix did not reduce the number of errors; discarding it");
                }
            } catch (LlmFixException ex) {
                LOGGER.warn("LLM fix unavailable: {}", ex.getMessage());
            }
        }

        if (result.valid()) {
            backupManager.cleanup(file);
            LOGGER.info("{} is valid after {}", file, stages.isEmpty() ? "validation" : stages);
        } else if (restoreOnFailure && backupManager.hasBackup(file)) {
            backupManager.restore(file);
            backupManager.cleanup(file);
            content = documentWriter.read(file);
            result = validator.validate(content, directory);
            stages.add(RepairStage.RESTORED_BACKUP);
            LOGGER.warn("{} is still invalid; restored the original content", file);
        } else {
            LOGGER.warn("{} is still invalid: {}", file, result.summary());
        }
        return new RepairReport(result.valid(), stages, fixes, result.issues(), content);
    }
}

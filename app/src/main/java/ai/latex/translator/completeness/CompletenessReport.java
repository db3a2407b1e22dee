package ai.latex.translator.completeness;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * @param score completeness score between 0 and 100
 */
public record CompletenessReport(boolean complete,
                                 double score,
                                 Optional<PageCountResult> pageCount,
                                 List<SectionInfo> originalSections,
                                 List<SectionInfo> translatedSections,
                                 List<SectionInfo> missingSections,
                                 List<String> warnings) {

    public CompletenessReport {
        pageCount = pageCount == null ? Optional.empty() : pageCount;
        originalSections = List.copyOf(Objects.requireNonNull(originalSections, "originalSections"));
        translatedSections = List.copyOf(Objects.requireNonNull(translatedSections, "translatedSections"));
        missingSections = List.copyOf(Objects.requireNonNull(missingSections, "missingSections"));
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
    }
}

package ai.latex.translator.completeness;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares a compiled original with its compiled translation to spot lost content: page count drop,
 * missing numbered headings, missing appendices and missing special sections. This is a signal, not
 * a repair.
 */
public class ContentCompletenessValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContentCompletenessValidator.class);

    static final double PAGE_DROP_PENALTY = 20.0;
    static final double ALL_APPENDICES_MISSING_PENALTY = 15.0;
    static final double APPENDIX_MISSING_PENALTY = 5.0;
    static final double COMPLETE_THRESHOLD = 70.0;

    private static final int MAX_HEADING_LENGTH = 150;
    private static final int MAX_TITLE_WORDS = 12;

    private static final List<HeadingPattern> HEADING_PATTERNS = List.of(
            new HeadingPattern("^(\\d+\\.\\d+\\.\\d+)\\s*\\.?\\s+(.+)$", SectionType.SUBSUBSECTION),
            new HeadingPattern("^(\\d+\\.\\d+)\\s*\\.?\\s+(.+)$", SectionType.SUBSECTION),
            new HeadingPattern("^(\\d+)\\s*\\.?\\s+(.+)$", SectionType.SECTION),
            new HeadingPattern("^Section\\s+(\\d+)[:\\s]*(.*)$", SectionType.SECTION),
            new HeadingPattern("^([A-Z]\\.\\d+)\\s*\\.?\\s+(.+)$", SectionType.APPENDIX_SUBSECTION),
            new HeadingPattern("^Appendix\\s+([A-Z])[:.\\s]*(.*)$", SectionType.APPENDIX),
            new HeadingPattern("^([A-Z])\\s*\\.\\s*Appendix[:\\s]*(.*)$", SectionType.APPENDIX),
            new HeadingPattern("^附录\\s*([A-Z]?)[:：\\s]*(.*)$", SectionType.APPENDIX),
            new HeadingPattern("^(?:Abstract|摘要)$", SectionType.ABSTRACT),
            new HeadingPattern("^(?:Introduction|引言)$", SectionType.INTRODUCTION),
            new HeadingPattern("^(?:Conclusions?|结论)$", SectionType.CONCLUSION),
            new HeadingPattern("^(?:References?|Bibliography|参考文献)$", SectionType.REFERENCES),
            new HeadingPattern("^(?:Acknowledge?ments?|致谢)$", SectionType.ACKNOWLEDGMENTS));

    private static final Map<String, List<String>> TITLE_TRANSLATIONS = titleTranslations();

    private final PdfTextSource textSource;

    public ContentCompletenessValidator() {
        this(new PdfBoxTextSource());
    }

    public ContentCompletenessValidator(PdfTextSource textSource) {
        this.textSource = Objects.requireNonNull(textSource, "textSource");
    }

    public CompletenessReport validate(Path originalPdf, Path translatedPdf) {
        Objects.requireNonNull(originalPdf, "originalPdf");
        Objects.requireNonNull(translatedPdf, "translatedPdf");
        LOGGER.info("Checking content completeness of {} against {}", translatedPdf, originalPdf);
        int originalPages = -1;
        int translatedPages = -1;
        try {
            originalPages = textSource.pageCount(originalPdf);
            translatedPages = textSource.pageCount(translatedPdf);
        } catch (UncheckedIOException ex) {
            LOGGER.warn("Failed to count pages: {}", ex.getMessage());
        }
        List<TextBlock> originalBlocks = textSource.extractBlocks(originalPdf);
        List<TextBlock> translatedBlocks = textSource.extractBlocks(translatedPdf);
        CompletenessReport report = compare(originalPages, translatedPages, originalBlocks, translatedBlocks);
        LOGGER.info("Completeness check finished: complete={}, score={}, missing sections={}",
                report.complete(), report.score(), report.missingSections().size());
        return report;
    }

    /**
     * Pure comparison core. A negative page count means the count is unknown.
     */
    public CompletenessReport compare(int originalPages, int translatedPages,
                                      List<TextBlock> originalBlocks, List<TextBlock> translatedBlocks) {
        List<String> warnings = new ArrayList<>();
        double score = 100.0;

        Optional<PageCountResult> pageCount = Optional.empty();
        if (originalPages >= 0 && translatedPages >= 0) {
            PageCountResult pages = PageCountResult.of(originalPages, translatedPages);
            pageCount = Optional.of(pages);
            if (pages.suspicious()) {
                warnings.add(pages.describe());
                score -= PAGE_DROP_PENALTY;
            }
        }

        List<SectionInfo> originalSections = extractSections(originalBlocks);
        List<SectionInfo> translatedSections = extractSections(translatedBlocks);
        List<SectionInfo> missing = findMissing(originalSections, translatedSections);

        if (!originalSections.isEmpty()) {
            int matched = originalSections.size() - missing.size();
            double sectionScore = (double) matched / originalSections.size() * 80.0;
            score = Math.min(score, sectionScore + 20.0);
        } else if (pageCount.isPresent() && pageCount.get().suspicious()) {
            score = Math.max(0.0, 100.0 - pageCount.get().dropRatio() * 100.0);
        }

        for (SectionInfo section : missing) {
            warnings.add("Missing " + section.describe());
        }

        long originalAppendices = originalSections.stream().filter(section -> section.type() == SectionType.APPENDIX).count();
        long translatedAppendices = translatedSections.stream().filter(section -> section.type() == SectionType.APPENDIX).count();
        if (originalAppendices > 0 && translatedAppendices == 0) {
            warnings.add("Original has " + originalAppendices + " appendix section(s) but none were found in the translation");
            score -= ALL_APPENDICES_MISSING_PENALTY;
        } else if (originalAppendices > translatedAppendices) {
            long lost = originalAppendices - translatedAppendices;
            warnings.add("Translation is missing " + lost + " appendix section(s)");
            score -= lost * APPENDIX_MISSING_PENALTY;
        }

        score = Math.max(0.0, score);
        boolean complete = missing.isEmpty() && score >= COMPLETE_THRESHOLD;
        return new CompletenessReport(complete, score, pageCount, originalSections, translatedSections, missing, warnings);
    }

    List<SectionInfo> extractSections(List<TextBlock> blocks) {
        List<SectionInfo> sections = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        boolean inAppendix = false;
        for (TextBlock block : blocks) {
            String text = block.text().strip();
            if (text.length() < 2 || text.length() > MAX_HEADING_LENGTH) {
                continue;
            }
            if (text.toLowerCase(Locale.ROOT).startsWith("appendix") || text.startsWith("附录")) {
                inAppendix = true;
            }
            for (HeadingPattern heading : HEADING_PATTERNS) {
                Matcher matcher = heading.pattern().matcher(text);
                if (!matcher.matches()) {
                    continue;
                }
                String number = matcher.groupCount() >= 1 ? matcher.group(1) : "";
                String title = matcher.groupCount() >= 2 ? matcher.group(2).strip() : "";
                if (title.isEmpty()) {
                    title = text;
                }
                if (heading.type().numbered() && !block.heading() && !plausibleTitle(title)) {
                    break;
                }
                SectionInfo section = new SectionInfo(heading.type(), number, title, block.page(),
                        inAppendix || heading.type().isAppendix());
                if (seen.add(section.key())) {
                    sections.add(section);
                }
                break;
            }
        }
        sections.sort(Comparator.comparingInt(SectionInfo::page).thenComparing(SectionInfo::number));
        return sections;
    }

    /**
     * Body lines that start with a number look like numbered headings; a heading title starts with a
     * capital or a non-Latin letter, is short and does not end a sentence.
     */
    private static boolean plausibleTitle(String title) {
        int first = title.codePointAt(0);
        boolean startsLikeHeading = Character.isUpperCase(first) || (Character.isLetter(first) && first > 0x2E80);
        return startsLikeHeading
                && title.split("\\s+").length <= MAX_TITLE_WORDS
                && !title.endsWith(".")
                && !title.endsWith("。");
    }

    private List<SectionInfo> findMissing(List<SectionInfo> original, List<SectionInfo> translated) {
        Set<String> translatedKeys = new HashSet<>();
        translated.forEach(section -> translatedKeys.add(section.key()));
        List<SectionInfo> missing = new ArrayList<>();
        for (SectionInfo section : original) {
            if (translatedKeys.contains(section.key())) {
                continue;
            }
            boolean found = translated.stream().anyMatch(candidate -> sectionsMatch(section, candidate));
            if (!found) {
                missing.add(section);
            }
        }
        return missing;
    }

    private boolean sectionsMatch(SectionInfo original, SectionInfo translated) {
        if (original.type() != translated.type()) {
            return false;
        }
        if (!original.number().isEmpty() && original.number().equals(translated.number())) {
            return true;
        }
        return Math.abs(original.page() - translated.page()) <= 2
                && titlesSimilar(original.title(), translated.title());
    }

    static boolean titlesSimilar(String first, String second) {
        if (first.equalsIgnoreCase(second)) {
            return true;
        }
        String firstLower = first.toLowerCase(Locale.ROOT);
        String secondLower = second.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : TITLE_TRANSLATIONS.entrySet()) {
            String english = entry.getKey();
            for (String translation : entry.getValue()) {
                if (firstLower.contains(english) && second.contains(translation)) {
                    return true;
                }
                if (first.contains(translation) && secondLower.contains(english)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Map<String, List<String>> titleTranslations() {
        Map<String, List<String>> mappings = new LinkedHashMap<>();
        mappings.put("introduction", List.of("引言", "介绍", "简介"));
        mappings.put("background", List.of("背景"));
        mappings.put("related work", List.of("相关工作", "相关研究"));
        mappings.put("method", List.of("方法"));
        mappings.put("experiment", List.of("实验"));
        mappings.put("result", List.of("结果"));
        mappings.put("discussion", List.of("讨论"));
        mappings.put("conclusion", List.of("结论", "总结"));
        mappings.put("abstract", List.of("摘要"));
        mappings.put("reference", List.of("参考文献", "引用"));
        mappings.put("acknowledg", List.of("致谢", "鸣谢"));
        mappings.put("appendix", List.of("附录"));
        mappings.put("evaluation", List.of("评估", "评价"));
        mappings.put("analysis", List.of("分析"));
        mappings.put("implementation", List.of("实现"));
        mappings.put("limitation", List.of("局限", "限制"));
        mappings.put("future work", List.of("未来工作", "展望"));
        return mappings;
    }

    private record HeadingPattern(Pattern pattern, SectionType type) {

        HeadingPattern(String regex, SectionType type) {
            this(Pattern.compile(regex), type);
        }
    }
}

package ai.latex.translator.completeness;

import java.util.Locale;
import java.util.Objects;

/**
 * A heading recognised in extracted PDF text.
 *
 * @param number heading number such as {@code 2.1} or {@code A}; empty for unnumbered headings
 */
public record SectionInfo(SectionType type, String number, String title, int page, boolean inAppendix) {

    public SectionInfo {
        Objects.requireNonNull(type, "type");
        number = number == null ? "" : number;
        title = title == null ? "" : title;
    }

    String key() {
        return type.name() + ":" + (number.isEmpty() ? title.toLowerCase(Locale.ROOT) : number);
    }

    public String describe() {
        String label = type.name().toLowerCase(Locale.ROOT).replace('_', ' ');
        String heading = number.isEmpty() ? title : number + " " + title;
        return label + " '" + heading.strip() + "' (page " + page + ")";
    }
}

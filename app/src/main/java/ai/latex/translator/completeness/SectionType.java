package ai.latex.translator.completeness;

public enum SectionType {
    SECTION(1, true),
    SUBSECTION(2, true),
    SUBSUBSECTION(3, true),
    APPENDIX(1, true),
    APPENDIX_SUBSECTION(2, true),
    ABSTRACT(0, false),
    INTRODUCTION(1, false),
    CONCLUSION(1, false),
    REFERENCES(1, false),
    ACKNOWLEDGMENTS(1, false);

    private final int level;
    private final boolean numbered;

    SectionType(int level, boolean numbered) {
        this.level = level;
        this.numbered = numbered;
    }

    public int level() {
        return level;
    }

    public boolean numbered() {
        return numbered;
    }

    public boolean isAppendix() {
        return this == APPENDIX || this == APPENDIX_SUBSECTION;
    }
}

package info.isaksson.erland.xdlc.ast;

public enum DeclarationKind {
    ENUM("enum"),
    STRUCT("struct"),
    CLASS("class"),
    UNION("union"),
    INTERFACE("interface");

    private final String keyword;

    DeclarationKind(String keyword) {
        this.keyword = keyword;
    }

    /** Source keyword. */
    public String keyword() {
        return keyword;
    }

    /** Keyword used in generated headers; interfaces become {@code struct}. */
    public String emittedKeyword() {
        return this == INTERFACE ? "struct" : keyword;
    }
}

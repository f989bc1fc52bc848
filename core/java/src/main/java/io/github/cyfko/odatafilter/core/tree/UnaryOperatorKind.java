package io.github.cyfko.odatafilter.core.tree;

/**
 * Unary operators of the filter language.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum UnaryOperatorKind {
    NOT("not", "Not");

    private final String keyword;
    private final String displayName;

    UnaryOperatorKind(String keyword, String displayName) {
        this.keyword = keyword;
        this.displayName = displayName;
    }

    public String keyword() {
        return keyword;
    }

    public String displayName() {
        return displayName;
    }
}

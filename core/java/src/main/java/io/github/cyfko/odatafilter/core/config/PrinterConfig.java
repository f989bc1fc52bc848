package io.github.cyfko.odatafilter.core.config;

import java.util.Objects;

/**
 * Layout settings of {@link io.github.cyfko.odatafilter.core.printing.QueryNodePrinter}.
 * <p>
 * The indentation unit is repeated once per nesting level. It must be either a single tab or a group of
 * spaces, so that every nesting level has the same fixed width.
 * </p>
 */
public final class PrinterConfig {

    private final String indentUnit;

    private PrinterConfig(Builder builder) {
        this.indentUnit = builder.indentUnit;
    }

    public static Builder builder() { return new Builder(); }

    /** One tab per nesting level. */
    public static PrinterConfig defaults() { return builder().build(); }

    public static PrinterConfig spaces(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Indentation width must be positive, got: " + width);
        }
        return builder().indentUnit(" ".repeat(width)).build();
    }

    public String getIndentUnit() { return indentUnit; }

    public static final class Builder {
        private String indentUnit = "\t"; // default

        public Builder indentUnit(String unit) {
            Objects.requireNonNull(unit, "indentUnit");
            if (!unit.equals("\t") && (unit.isEmpty() || !unit.chars().allMatch(c -> c == ' '))) {
                throw new IllegalArgumentException("Indentation unit must be a tab or a group of spaces");
            }
            this.indentUnit = unit;
            return this;
        }

        public PrinterConfig build() { return new PrinterConfig(this); }
    }
}

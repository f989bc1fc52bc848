package io.github.cyfko.odatafilter.core.config;

import java.util.regex.Pattern;

/**
 * Pre-compiled patterns for the names accepted by an {@link io.github.cyfko.odatafilter.core.edm.EdmModel}.
 * <p>
 * Simple identifiers start with a letter or underscore, followed by letters, digits or underscores, with a
 * maximum length of 128 characters. Qualified names are dot-separated sequences of simple identifiers.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class PatternConfig {
    private PatternConfig () {}

    private static final String SIMPLE_FORM = "[\\p{L}_][\\p{L}\\p{Nd}_]{0,127}";

    /**
     * Property and entity set names.
     * <p>
     * Example valid: "Home", "first_name", "_id"
     * Example invalid: "1st", "home-address", "geo.distance"
     * </p>
     */
    public static final Pattern SIMPLE_IDENTIFIER_PATTERN = Pattern.compile("^" + SIMPLE_FORM + "$");

    /**
     * Type and function names: one or more simple identifiers joined by dots.
     * <p>
     * Example valid: "Test.Person", "geo.distance", "contains"
     * </p>
     */
    public static final Pattern QUALIFIED_NAME_PATTERN = Pattern.compile("^" + SIMPLE_FORM + "(\\." + SIMPLE_FORM + ")*$");

    /**
     * Range variable names: {@code $} followed by a simple identifier.
     */
    public static final Pattern RANGE_VARIABLE_PATTERN = Pattern.compile("^\\$" + SIMPLE_FORM + "$");
}

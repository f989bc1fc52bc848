package io.github.cyfko.odatafilter.core.model;

/**
 * The implicit "current item" of a filter, such as {@code $it} ranging over the {@code People} entity set.
 * <p>
 * One instance is bound per query scope. Every
 * {@link io.github.cyfko.odatafilter.core.tree.RangeVariableReferenceNode} of a parsed filter points at
 * that same instance.
 * </p>
 *
 * @param name             variable name, {@code $}-prefixed
 * @param navigationSource name of the entity set the variable ranges over
 * @param typeReference    entity type of the items
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RangeVariable(String name, String navigationSource, TypeReference typeReference) {

    /** Name of the implicit range variable of a {@code $filter} query option. */
    public static final String IT = "$it";

    public RangeVariable {
        if (name == null || !name.startsWith("$") || name.length() < 2) {
            throw new IllegalArgumentException("Range variable name must be '$'-prefixed, got: " + name);
        }
        if (navigationSource == null || navigationSource.isBlank()) {
            throw new IllegalArgumentException("Navigation source is required for range variable " + name);
        }
        if (typeReference == null) {
            throw new IllegalArgumentException("Type reference is required for range variable " + name);
        }
    }
}

package io.github.cyfko.odatafilter.core.edm;

import io.github.cyfko.odatafilter.core.config.PatternConfig;
import io.github.cyfko.odatafilter.core.model.TypeReference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entity or complex type of an {@link EdmModel}: a qualified name and its single-valued properties.
 *
 * <pre>{@code
 * EdmStructuredType person = EdmStructuredType.entity("Test.Person")
 *     .property("Name", TypeReference.of(EdmPrimitiveTypes.STRING))
 *     .property("Home", TypeReference.geography(EdmPrimitiveTypes.GEOGRAPHY_POINT, 4326))
 *     .property("Address", TypeReference.of("Test.Address"))
 *     .build();
 * }</pre>
 *
 * @param name       qualified type name
 * @param kind       entity or complex
 * @param properties declared properties, in declaration order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EdmStructuredType(String name, Kind kind, Map<String, TypeReference> properties) {

    public enum Kind { ENTITY, COMPLEX }

    public EdmStructuredType {
        if (name == null || !PatternConfig.QUALIFIED_NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid structured type name: " + name);
        }
        if (name.startsWith("Edm.")) {
            throw new IllegalArgumentException("The Edm namespace is reserved for primitive types: " + name);
        }
        Objects.requireNonNull(kind, "kind");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static Builder entity(String name) {
        return new Builder(name, Kind.ENTITY);
    }

    public static Builder complex(String name) {
        return new Builder(name, Kind.COMPLEX);
    }

    public Optional<TypeReference> property(String propertyName) {
        return Optional.ofNullable(properties.get(propertyName));
    }

    public static final class Builder {
        private final String name;
        private final Kind kind;
        private final Map<String, TypeReference> properties = new LinkedHashMap<>();

        private Builder(String name, Kind kind) {
            this.name = name;
            this.kind = kind;
        }

        public Builder property(String propertyName, TypeReference type) {
            if (propertyName == null || !PatternConfig.SIMPLE_IDENTIFIER_PATTERN.matcher(propertyName).matches()) {
                throw new IllegalArgumentException("Invalid property name '" + propertyName + "' on type " + name);
            }
            Objects.requireNonNull(type, "type");
            if (properties.putIfAbsent(propertyName, type) != null) {
                throw new IllegalArgumentException("Property [" + propertyName + "] is already declared on type " + name);
            }
            return this;
        }

        public EdmStructuredType build() {
            return new EdmStructuredType(name, kind, properties);
        }
    }
}

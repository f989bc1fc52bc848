package io.github.cyfko.odatafilter.core.config;

/**
 * Limits applied by the filter parser to protect against excessively large or deeply nested input.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the filter text (default: 5000)</li>
 *   <li><strong>maxDepth</strong>: Maximum nesting of parentheses and function calls (default: 100)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * ParserPolicy policy = ParserPolicy.defaults();
 *
 * // Strict (for public APIs with untrusted input)
 * ParserPolicy policy = ParserPolicy.strict();
 *
 * // Relaxed (for internal trusted systems)
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * // Custom
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxExpressionLength(10000)
 *     .maxDepth(16)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violation messages
 * @param maxExpressionLength maximum character length of the filter text
 * @param maxDepth            maximum nesting depth of parenthesized expressions and function calls
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
    String policyName,
    int maxExpressionLength,
    int maxDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
    }

    /**
     * Default configuration for balanced protection and usability.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Depth: 100</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 100);
    }

    /**
     * Strict configuration for public APIs and untrusted input.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Depth: 32</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 1000, 32);
    }

    /**
     * Relaxed configuration for internal trusted systems.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Depth: 256</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 256);
    }

    /**
     * Creates a custom configuration. Builder parameters start from the default values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder{
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxDepth = 100;

        private Builder(){}

        public ParserPolicy build(){
            return new ParserPolicy(_policyName, _maxExpressionLength, _maxDepth);
        }

        public Builder policyName(String policyName){ this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength){ this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxDepth(int maxDepth){ this._maxDepth = maxDepth; return this; }
    }

    public enum PolicyName{
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}

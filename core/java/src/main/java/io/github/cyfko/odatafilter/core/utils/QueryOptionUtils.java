package io.github.cyfko.odatafilter.core.utils;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Helpers for extracting system query options from a request URI.
 */
public class QueryOptionUtils {

    public static final String FILTER_OPTION = "$filter";

    /**
     * Private constructor to prevent instantiation of utility class.
     */
    private QueryOptionUtils() {
        // Utility class - no instantiation allowed
    }

    /**
     * Extracts the percent-decoded value of the {@code $filter} option of {@code requestUri}.
     * <p>
     * A literal {@code +} is kept as is: it is a sign or an exponent sign in filter text, never an encoded space.
     * The option name may itself be percent-encoded ({@code %24filter}).
     * </p>
     *
     * @param requestUri the request URI
     * @return the filter text, or empty when the URI has no {@code $filter} option
     * @throws IllegalArgumentException if {@code $filter} appears more than once or is malformed
     */
    public static Optional<String> filterOption(URI requestUri) {
        Objects.requireNonNull(requestUri, "Request URI cannot be null");

        String query = requestUri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return Optional.empty();
        }

        String filter = null;
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) continue;

            int eq = pair.indexOf('=');
            String name = decode(eq < 0 ? pair : pair.substring(0, eq));
            if (!FILTER_OPTION.equals(name)) continue;

            if (filter != null) {
                throw new IllegalArgumentException("Query option " + FILTER_OPTION + " must not be repeated: " + requestUri);
            }
            filter = eq < 0 ? "" : decode(pair.substring(eq + 1));
        }
        return Optional.ofNullable(filter);
    }

    private static String decode(String raw) {
        return URLDecoder.decode(raw.replace("+", "%2B"), StandardCharsets.UTF_8);
    }
}

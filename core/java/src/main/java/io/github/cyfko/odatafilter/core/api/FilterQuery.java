package io.github.cyfko.odatafilter.core.api;

import io.github.cyfko.odatafilter.core.exception.FilterException;
import io.github.cyfko.odatafilter.core.model.FilterQueryOption;

import java.net.URI;
import java.util.Optional;

/**
 * High-level entry point combining a {@link FilterParser} with the diagnostic printer.
 * <p>
 * Instances are created through {@link io.github.cyfko.odatafilter.core.FilterQueryFactory} and are
 * thread-safe.
 * </p>
 *
 * <pre>{@code
 * FilterQuery query = FilterQueryFactory.of(model);
 *
 * FilterQueryOption filter = query.parse("Age gt 18");
 * Optional<FilterQueryOption> fromUri = query.parse(URI.create("http://host/svc/People?$filter=Age%20gt%2018"));
 * String dump = query.explain("geo.distance(Home, Office) lt 0.5");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FilterQuery {

    /**
     * Parses a filter over the {@code $it} range variable.
     *
     * @throws FilterException on the first parse error
     */
    FilterQueryOption parse(String filterText) throws FilterException;

    /**
     * Extracts the {@code $filter} query option of a request URI and parses it.
     *
     * @param requestUri the request URI
     * @return the parsed filter, or empty if the URI has no {@code $filter} option
     * @throws FilterException on the first parse error
     * @throws IllegalArgumentException if {@code $filter} is given more than once
     */
    Optional<FilterQueryOption> parse(URI requestUri) throws FilterException;

    /**
     * Renders a parsed filter as indented diagnostic text.
     */
    String render(FilterQueryOption filter);

    /**
     * Parses then renders a filter.
     */
    default String explain(String filterText) throws FilterException {
        return render(parse(filterText));
    }
}

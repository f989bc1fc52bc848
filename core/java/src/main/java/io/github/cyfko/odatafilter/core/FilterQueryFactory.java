package io.github.cyfko.odatafilter.core;

import io.github.cyfko.odatafilter.core.api.FilterParser;
import io.github.cyfko.odatafilter.core.api.FilterQuery;
import io.github.cyfko.odatafilter.core.api.SchemaResolver;
import io.github.cyfko.odatafilter.core.config.ParserPolicy;
import io.github.cyfko.odatafilter.core.config.PrinterConfig;
import io.github.cyfko.odatafilter.core.edm.EdmModel;
import io.github.cyfko.odatafilter.core.edm.ModelSchemaResolver;
import io.github.cyfko.odatafilter.core.exception.FilterException;
import io.github.cyfko.odatafilter.core.impl.RecursiveDescentFilterParser;
import io.github.cyfko.odatafilter.core.model.FilterQueryOption;
import io.github.cyfko.odatafilter.core.printing.QueryNodePrinter;
import io.github.cyfko.odatafilter.core.utils.QueryOptionUtils;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;


/**
 * High-level facade for turning {@code $filter} text into a typed, printable filter.
 * <p>
 * The FilterQueryFactory wires a {@link SchemaResolver}, a {@link RecursiveDescentFilterParser} and a
 * {@link QueryNodePrinter} behind the {@link FilterQuery} interface.
 * </p>
 *
 * <p><strong>Architecture Overview:</strong></p>
 * <ol>
 *   <li><strong>Extract:</strong> Read the {@code $filter} option of a request URI (optional step)</li>
 *   <li><strong>Parse:</strong> Transform the filter text into a typed tree, consulting the resolver</li>
 *   <li><strong>Render:</strong> Dump the tree as indented diagnostic text</li>
 * </ol>
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * EdmModel model = EdmModel.builder()
 *     .structuredType(EdmStructuredType.entity("Test.Person")
 *         .property("Home", TypeReference.geography(EdmPrimitiveTypes.GEOGRAPHY_POINT, 4326))
 *         .property("Office", TypeReference.geography(EdmPrimitiveTypes.GEOGRAPHY_POINT, 4326))
 *         .build())
 *     .entitySet("People", "Test.Person")
 *     .rangeVariable(RangeVariable.IT, "People")
 *     .withBuiltInFunctions()
 *     .build();
 *
 * FilterQuery query = FilterQueryFactory.of(model);
 *
 * FilterQueryOption filter = query.parse("geo.distance(Home, Office) lt 0.5");
 * String dump = query.render(filter);
 *
 * Optional<FilterQueryOption> fromUri = query.parse(URI.create("/People?$filter=Name%20eq%20%27Ann%27"));
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link FilterException} subclasses - lexical, syntax, resolution and type errors, with the source offset</li>
 *   <li>{@link IllegalArgumentException} - repeated {@code $filter} option in a URI</li>
 * </ul>
 *
 * <p>Instances are immutable and may be shared across threads.</p>
 *
 * @see FilterParser
 * @see SchemaResolver
 * @see QueryNodePrinter
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterQueryFactory {

    private FilterQueryFactory() {}

    /**
     * Creates a {@link FilterQuery} over the given model, with default policy and printer settings.
     *
     * @param model the entity data model. Must not be null.
     * @return a new FilterQuery
     * @throws NullPointerException if model is null
     */
    public static FilterQuery of(EdmModel model) {
        return of(new ModelSchemaResolver(Objects.requireNonNull(model, "Model cannot be null")));
    }

    /**
     * Creates a {@link FilterQuery} with the given resolver and default policy and printer settings.
     *
     * @param resolver the schema resolver. Must not be null.
     * @return a new FilterQuery
     */
    public static FilterQuery of(SchemaResolver resolver) {
        return of(resolver, ParserPolicy.defaults(), PrinterConfig.defaults());
    }

    /**
     * Creates a {@link FilterQuery} with the given resolver, parser policy and printer settings.
     *
     * @param resolver      the schema resolver. Must not be null.
     * @param parserPolicy  the size and nesting limits. Must not be null.
     * @param printerConfig the dump settings. Must not be null.
     * @return a new FilterQuery
     * @throws IllegalArgumentException if resolver or parserPolicy is null
     * @throws NullPointerException     if printerConfig is null
     */
    public static FilterQuery of(SchemaResolver resolver, ParserPolicy parserPolicy, PrinterConfig printerConfig) {
        return new DefaultFilterQuery(new RecursiveDescentFilterParser(resolver, parserPolicy), new QueryNodePrinter(printerConfig));
    }

    /**
     * Default implementation of {@link FilterQuery}.
     *
     * @param parser  the parser for filter text
     * @param printer the printer for parsed filters
     */
    private record DefaultFilterQuery(FilterParser parser, QueryNodePrinter printer) implements FilterQuery {

        private static final Logger log = Logger.getLogger(DefaultFilterQuery.class.getName());

        private DefaultFilterQuery {
            Objects.requireNonNull(parser, "Filter parser cannot be null");
            Objects.requireNonNull(printer, "Printer cannot be null");
        }

        @Override
        public FilterQueryOption parse(String filterText) {
            return parser.parse(filterText);
        }

        @Override
        public Optional<FilterQueryOption> parse(URI requestUri) {
            Optional<String> filterText = QueryOptionUtils.filterOption(requestUri);
            if (filterText.isEmpty()) {
                log.fine(() -> String.format("No %s option in %s", QueryOptionUtils.FILTER_OPTION, requestUri));
                return Optional.empty();
            }
            return Optional.of(parser.parse(filterText.get()));
        }

        @Override
        public String render(FilterQueryOption filter) {
            return printer.render(filter);
        }
    }
}

package io.github.cyfko.odatafilter.core.api;

import io.github.cyfko.odatafilter.core.exception.FilterException;
import io.github.cyfko.odatafilter.core.model.FilterQueryOption;
import io.github.cyfko.odatafilter.core.model.RangeVariable;

/**
 * Parser turning the text of a {@code $filter} query option into a fully typed {@link FilterQueryOption}.
 *
 * <h2>Grammar (EBNF)</h2>
 * <pre>
 * filter       := expr EOF
 * expr         := orExpr
 * orExpr       := andExpr ('or' andExpr)*
 * andExpr      := notExpr ('and' notExpr)*
 * notExpr      := ['not'] comparison
 * comparison   := primary [compOp primary]
 * compOp       := 'eq' | 'ne' | 'lt' | 'le' | 'gt' | 'ge'
 * primary      := literal | 'true' | 'false' | propertyPath | functionCall | '(' expr ')'
 * propertyPath := identifier ('/' identifier)*
 * functionCall := identifier '(' [primary (',' primary)*] ')'
 * </pre>
 *
 * <table border="1">
 * <caption>Operator precedence</caption>
 * <thead>
 * <tr><th>Operator</th><th>Precedence</th><th>Associativity</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>( ), function call, property path</td><td>Highest</td><td>N/A</td></tr>
 * <tr><td>eq ne lt le gt ge</td><td>4</td><td>None: {@code a lt b lt c} is rejected</td></tr>
 * <tr><td>not</td><td>3</td><td>Prefix, once</td></tr>
 * <tr><td>and</td><td>2</td><td>Left</td></tr>
 * <tr><td>or</td><td>1</td><td>Left</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * FilterParser parser = new RecursiveDescentFilterParser(new ModelSchemaResolver(model));
 *
 * FilterQueryOption nearby = parser.parse("geo.distance(Home, Office) lt 0.5");
 * FilterQueryOption adults = parser.parse("Age ge 18 and not (Name eq 'root')");
 * FilterQueryOption cities = parser.parse("$it/Address/City eq 'Paris'");
 * }</pre>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Every node of the returned tree carries a resolved type</li>
 *   <li>Parsing is all-or-nothing: the first error aborts it and nothing else is returned</li>
 *   <li>Identical input and resolver answers produce identical trees</li>
 * </ul>
 *
 * @see FilterException
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FilterParser {

    /**
     * Parses a filter whose current item is bound to {@code rangeVariable}.
     *
     * @param filterText    text of the filter, e.g. {@code geo.distance(Home, Office) lt 0.5}
     * @param rangeVariable variable bound to the current item of the enclosing query
     * @return the typed filter
     * @throws FilterException describing the first lexical, syntactic, resolution or typing error
     */
    FilterQueryOption parse(String filterText, RangeVariable rangeVariable) throws FilterException;

    /**
     * Parses a filter whose current item is the {@value RangeVariable#IT} variable known to the schema resolver.
     *
     * @param filterText text of the filter
     * @return the typed filter
     * @throws FilterException describing the first error, including an unbound {@code $it}
     */
    FilterQueryOption parse(String filterText) throws FilterException;
}

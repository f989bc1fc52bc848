package io.github.cyfko.odatafilter.core.impl;

import io.github.cyfko.odatafilter.core.api.FilterParser;
import io.github.cyfko.odatafilter.core.api.SchemaResolver;
import io.github.cyfko.odatafilter.core.config.ParserPolicy;
import io.github.cyfko.odatafilter.core.edm.EdmPrimitiveTypes;
import io.github.cyfko.odatafilter.core.edm.EdmTypeFamily;
import io.github.cyfko.odatafilter.core.exception.FilterException;
import io.github.cyfko.odatafilter.core.exception.FilterSyntaxException;
import io.github.cyfko.odatafilter.core.exception.TypeMismatchException;
import io.github.cyfko.odatafilter.core.exception.UnknownIdentifierException;
import io.github.cyfko.odatafilter.core.model.FilterQueryOption;
import io.github.cyfko.odatafilter.core.model.FunctionResolution;
import io.github.cyfko.odatafilter.core.model.RangeVariable;
import io.github.cyfko.odatafilter.core.model.Token;
import io.github.cyfko.odatafilter.core.model.TokenKind;
import io.github.cyfko.odatafilter.core.model.TypeReference;
import io.github.cyfko.odatafilter.core.parsing.FilterLexer;
import io.github.cyfko.odatafilter.core.tree.BinaryOperatorKind;
import io.github.cyfko.odatafilter.core.tree.BinaryOperatorNode;
import io.github.cyfko.odatafilter.core.tree.FunctionCallNode;
import io.github.cyfko.odatafilter.core.tree.LiteralNode;
import io.github.cyfko.odatafilter.core.tree.PropertyAccessNode;
import io.github.cyfko.odatafilter.core.tree.QueryNode;
import io.github.cyfko.odatafilter.core.tree.RangeVariableReferenceNode;
import io.github.cyfko.odatafilter.core.tree.UnaryOperatorKind;
import io.github.cyfko.odatafilter.core.tree.UnaryOperatorNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Recursive-descent implementation of {@link FilterParser} with one token of lookahead.
 * <p>
 * The parser builds the typed tree eagerly: every operand is resolved against the {@link SchemaResolver}
 * and type-checked as soon as it is complete, so a node never exists without its type. Resolver calls
 * happen in strict left-to-right, depth-first order; function arguments are fully typed before the function
 * itself is resolved.
 * </p>
 *
 * <h2>Phases of a parse</h2>
 * <ol>
 *   <li><strong>Guards</strong>: blank text and text longer than {@link ParserPolicy#maxExpressionLength()}
 *       are rejected before scanning</li>
 *   <li><strong>Descent</strong>: tokens are pulled from a {@link FilterLexer} on demand while the grammar
 *       productions build nodes bottom-up</li>
 *   <li><strong>Root check</strong>: the root must be {@code Edm.Boolean}</li>
 * </ol>
 *
 * <h2>Error anchoring</h2>
 * <p>
 * Resolver exceptions carry no position. They are anchored at the token that caused the lookup: the
 * property segment, the function name or the range variable. Type errors are anchored at the operator token.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * FilterParser parser = new RecursiveDescentFilterParser(new ModelSchemaResolver(model));
 * FilterQueryOption filter = parser.parse("geo.distance(Home, Office) lt 0.5");
 *
 * // Strict configuration (for public APIs)
 * FilterParser strictParser = new RecursiveDescentFilterParser(resolver, ParserPolicy.strict());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RecursiveDescentFilterParser implements FilterParser {

    private static final Logger log = Logger.getLogger(RecursiveDescentFilterParser.class.getName());

    private static final String FILTER_ROOT = "$filter";

    private final SchemaResolver resolver;
    private final ParserPolicy parserPolicy;

    /**
     * Constructor applying {@link ParserPolicy#defaults()}.
     *
     * @param resolver the schema resolver consulted for identifiers, properties and functions
     */
    public RecursiveDescentFilterParser(SchemaResolver resolver) {
        this(resolver, ParserPolicy.defaults());
    }

    /**
     * @param resolver     the schema resolver consulted for identifiers, properties and functions
     * @param parserPolicy the size and nesting limits
     * @throws IllegalArgumentException if an argument is null
     */
    public RecursiveDescentFilterParser(SchemaResolver resolver, ParserPolicy parserPolicy) {
        if (resolver == null) {
            throw new IllegalArgumentException("Schema resolver is required");
        }
        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        this.resolver = resolver;
        this.parserPolicy = parserPolicy;
    }

    public ParserPolicy getParserPolicy() {
        return parserPolicy;
    }

    @Override
    public FilterQueryOption parse(String filterText) {
        checkText(filterText);
        RangeVariable it;
        try {
            it = resolver.resolveRangeVariable(RangeVariable.IT);
        } catch (FilterException e) {
            throw e.anchorAt(0);
        }
        return parse(filterText, it);
    }

    @Override
    public FilterQueryOption parse(String filterText, RangeVariable rangeVariable) {
        Objects.requireNonNull(rangeVariable, "Range variable cannot be null");
        checkText(filterText);

        long start = System.nanoTime();
        QueryNode root = new Session(filterText, rangeVariable).parseFilter();
        long durationMicros = (System.nanoTime() - start) / 1_000;

        log.fine(() -> String.format("Parsed filter over %s (%s) in %d µs: %s",
                rangeVariable.name(), rangeVariable.navigationSource(), durationMicros, filterText));

        return new FilterQueryOption(rangeVariable.typeReference(), rangeVariable, root);
    }

    private void checkText(String filterText) {
        if (filterText == null || filterText.isBlank()) {
            throw new FilterSyntaxException("Filter expression cannot be null or empty", 0, "an expression", "end of input");
        }
        if (filterText.length() > parserPolicy.maxExpressionLength()) {
            throw new FilterSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    filterText.length(), parserPolicy.maxExpressionLength(), parserPolicy.policyName()),
                    parserPolicy.maxExpressionLength(), "end of input", "more characters");
        }
    }

    /**
     * State of a single parse: the token stream, the bound range variable and the current nesting depth.
     * A new session is created for every call, so parses never share mutable state.
     */
    private final class Session {
        private final FilterLexer lexer;
        private final RangeVariable rangeVariable;
        private int depth;

        Session(String text, RangeVariable rangeVariable) {
            this.lexer = new FilterLexer(text);
            this.rangeVariable = rangeVariable;
        }

        QueryNode parseFilter() {
            QueryNode root = parseOr();

            Token trailing = lexer.peek();
            if (!trailing.isEof()) {
                throw unexpected(trailing, "'and', 'or' or end of input");
            }
            if (!root.typeReference().hasName(EdmPrimitiveTypes.BOOLEAN)) {
                throw TypeMismatchException.forOperand(FILTER_ROOT, root.typeReference(), EdmPrimitiveTypes.BOOLEAN, 0);
            }
            return root;
        }

        private QueryNode parseOr() {
            QueryNode left = parseAnd();
            while (lexer.peek().is(TokenKind.OPERATOR, BinaryOperatorKind.OR.keyword())) {
                Token operator = lexer.next();
                QueryNode right = parseAnd();
                left = logical(BinaryOperatorKind.OR, left, right, operator);
            }
            return left;
        }

        private QueryNode parseAnd() {
            QueryNode left = parseNot();
            while (lexer.peek().is(TokenKind.OPERATOR, BinaryOperatorKind.AND.keyword())) {
                Token operator = lexer.next();
                QueryNode right = parseNot();
                left = logical(BinaryOperatorKind.AND, left, right, operator);
            }
            return left;
        }

        private QueryNode parseNot() {
            if (!lexer.peek().is(TokenKind.OPERATOR, UnaryOperatorKind.NOT.keyword())) {
                return parseComparison();
            }
            Token operator = lexer.next();
            QueryNode operand = parseComparison();
            if (!operand.typeReference().hasName(EdmPrimitiveTypes.BOOLEAN)) {
                throw TypeMismatchException.forOperand(operator.text(), operand.typeReference(),
                        EdmPrimitiveTypes.BOOLEAN, operator.offset());
            }
            return new UnaryOperatorNode(UnaryOperatorKind.NOT, operand, booleanResult(operand.typeReference().nullable()));
        }

        private QueryNode parseComparison() {
            QueryNode left = parsePrimary();

            Optional<BinaryOperatorKind> comparison = comparisonAhead();
            if (comparison.isEmpty()) {
                return left;
            }
            Token operator = lexer.next();
            QueryNode right = parsePrimary();

            BinaryOperatorKind kind = comparison.get();
            if (!EdmTypeFamily.areComparable(kind, left.typeReference(), right.typeReference())) {
                throw TypeMismatchException.forOperands(operator.text(), left.typeReference(), right.typeReference(),
                        operator.offset());
            }
            QueryNode node = new BinaryOperatorNode(kind, left, right,
                    booleanResult(left.typeReference().nullable() || right.typeReference().nullable()));

            if (comparisonAhead().isPresent()) {
                Token chained = lexer.peek();
                throw new FilterSyntaxException("Chained comparison: comparison operators are not associative, found "
                        + chained.describe(), chained.offset(), "'and', 'or', ')' or end of input", chained.describe());
            }
            return node;
        }

        private QueryNode parsePrimary() {
            Token token = lexer.peek();
            switch (token.kind()) {
                case NUMBER_LITERAL:
                    return numberLiteral(lexer.next());
                case STRING_LITERAL:
                    return stringLiteral(lexer.next());
                case IDENTIFIER:
                    return identifierExpression(lexer.next());
                case PUNCTUATION:
                    if (token.isPunctuation('(')) {
                        return parenthesized(lexer.next());
                    }
                    throw unexpected(token, "an operand");
                default:
                    throw unexpected(token, "an operand");
            }
        }

        private QueryNode parenthesized(Token open) {
            return nested(open, () -> {
                QueryNode inner = parseOr();
                expectPunctuation(')', "')'");
                return inner;
            });
        }

        private QueryNode identifierExpression(Token identifier) {
            String text = identifier.text();
            if (text.equals("true") || text.equals("false")) {
                return new LiteralNode(text, Boolean.valueOf(text), TypeReference.of(EdmPrimitiveTypes.BOOLEAN, false));
            }
            if (text.equals("null")) {
                throw new FilterSyntaxException("The null literal is not supported, found 'null'",
                        identifier.offset(), "a property, function call or non-null literal", identifier.describe());
            }
            if (lexer.peek().isPunctuation('(')) {
                return functionCall(identifier, lexer.next());
            }
            return propertyPath(identifier);
        }

        private QueryNode functionCall(Token name, Token open) {
            return nested(open, () -> {
                List<QueryNode> arguments = new ArrayList<>();
                if (lexer.peek().isPunctuation(')')) {
                    lexer.next();
                } else {
                    while (true) {
                        arguments.add(parsePrimary());
                        Token separator = lexer.peek();
                        if (separator.isPunctuation(',')) {
                            lexer.next();
                        } else if (separator.isPunctuation(')')) {
                            lexer.next();
                            break;
                        } else {
                            throw unexpected(separator, "',' or ')'");
                        }
                    }
                }

                List<TypeReference> argumentTypes = arguments.stream().map(QueryNode::typeReference).toList();
                FunctionResolution resolution = resolve(name, () -> resolver.resolveFunction(name.text(), argumentTypes));
                return new FunctionCallNode(name.text(), resolution.returnType(), arguments, resolution.matchedSignature());
            });
        }

        private QueryNode propertyPath(Token first) {
            QueryNode node;
            if (first.text().startsWith("$")) {
                if (!first.text().equals(rangeVariable.name())) {
                    throw new UnknownIdentifierException(first.text()).anchorAt(first.offset());
                }
                node = new RangeVariableReferenceNode(rangeVariable);
            } else {
                node = property(new RangeVariableReferenceNode(rangeVariable), first);
            }

            while (lexer.peek().isPunctuation('/')) {
                lexer.next();
                Token segment = lexer.peek();
                if (segment.kind() != TokenKind.IDENTIFIER || segment.text().startsWith("$")) {
                    throw unexpected(segment, "a property name");
                }
                node = property(node, lexer.next());
            }
            return node;
        }

        private QueryNode property(QueryNode source, Token name) {
            TypeReference type = resolve(name, () -> resolver.resolveProperty(source.typeReference(), name.text()));
            return new PropertyAccessNode(source, name.text(), type);
        }

        private QueryNode numberLiteral(Token literal) {
            String text = literal.text();
            if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
                double value = Double.parseDouble(text);
                if (Double.isInfinite(value) || (value == 0.0 && hasNonZeroDigit(text))) {
                    throw new FilterSyntaxException("Numeric literal " + literal.describe()
                            + " is out of range for " + EdmPrimitiveTypes.DOUBLE,
                            literal.offset(), "a representable number", literal.describe());
                }
                return new LiteralNode(text, value, TypeReference.of(EdmPrimitiveTypes.DOUBLE, false));
            }
            BigDecimal value = new BigDecimal(text);
            try {
                return new LiteralNode(text, value.intValueExact(), TypeReference.of(EdmPrimitiveTypes.INT32, false));
            } catch (ArithmeticException notAnInt) {
                try {
                    return new LiteralNode(text, value.longValueExact(), TypeReference.of(EdmPrimitiveTypes.INT64, false));
                } catch (ArithmeticException notALong) {
                    return new LiteralNode(text, value, TypeReference.of(EdmPrimitiveTypes.DECIMAL, false));
                }
            }
        }

        private QueryNode stringLiteral(Token literal) {
            String raw = literal.text();
            String value = raw.substring(1, raw.length() - 1).replace("''", "'");
            return new LiteralNode(raw, value, TypeReference.of(EdmPrimitiveTypes.STRING, false));
        }

        private QueryNode logical(BinaryOperatorKind kind, QueryNode left, QueryNode right, Token operator) {
            if (!left.typeReference().hasName(EdmPrimitiveTypes.BOOLEAN) || !right.typeReference().hasName(EdmPrimitiveTypes.BOOLEAN)) {
                throw TypeMismatchException.forOperands(operator.text(), left.typeReference(), right.typeReference(),
                        operator.offset());
            }
            return new BinaryOperatorNode(kind, left, right,
                    booleanResult(left.typeReference().nullable() || right.typeReference().nullable()));
        }

        private Optional<BinaryOperatorKind> comparisonAhead() {
            Token token = lexer.peek();
            if (token.kind() != TokenKind.OPERATOR) {
                return Optional.empty();
            }
            return BinaryOperatorKind.fromKeyword(token.text()).filter(BinaryOperatorKind::isComparison);
        }

        private QueryNode nested(Token open, Supplier<QueryNode> production) {
            if (++depth > parserPolicy.maxDepth()) {
                throw new FilterSyntaxException(String.format(
                        "Expression nested too deeply (max depth: %d). Policy applied: %s",
                        parserPolicy.maxDepth(), parserPolicy.policyName()),
                        open.offset(), "a shallower expression", open.describe());
            }
            QueryNode node = production.get();
            depth--;
            return node;
        }

        private void expectPunctuation(char symbol, String expected) {
            Token token = lexer.peek();
            if (!token.isPunctuation(symbol)) {
                throw unexpected(token, expected);
            }
            lexer.next();
        }

        private <T> T resolve(Token token, Supplier<T> lookup) {
            try {
                return lookup.get();
            } catch (FilterException e) {
                throw e.anchorAt(token.offset());
            }
        }
    }

    private static TypeReference booleanResult(boolean nullable) {
        return TypeReference.of(EdmPrimitiveTypes.BOOLEAN, nullable);
    }

    private static boolean hasNonZeroDigit(String number) {
        for (int i = 0; i < number.length(); i++) {
            char c = number.charAt(i);
            if (c == 'e' || c == 'E') {
                return false;
            }
            if (c >= '1' && c <= '9') {
                return true;
            }
        }
        return false;
    }

    private static FilterSyntaxException unexpected(Token token, String expected) {
        String message = token.isEof()
                ? "Unexpected end of input, expected " + expected
                : "Unexpected " + token.describe() + ", expected " + expected;
        return new FilterSyntaxException(message, token.offset(), expected, token.describe());
    }
}

package io.github.cyfko.odatafilter.core.printing;

import io.github.cyfko.odatafilter.core.TestModels;
import io.github.cyfko.odatafilter.core.config.PrinterConfig;
import io.github.cyfko.odatafilter.core.edm.ModelSchemaResolver;
import io.github.cyfko.odatafilter.core.impl.RecursiveDescentFilterParser;
import io.github.cyfko.odatafilter.core.model.FilterQueryOption;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryNodePrinter Tests")
class QueryNodePrinterTest {

    private RecursiveDescentFilterParser parser;
    private QueryNodePrinter printer;

    @BeforeEach
    void setUp() {
        parser = new RecursiveDescentFilterParser(new ModelSchemaResolver(TestModels.people()));
        printer = new QueryNodePrinter();
    }

    private static String golden(String name) throws IOException {
        try (InputStream in = QueryNodePrinterTest.class.getResourceAsStream("/golden/" + name)) {
            assertNotNull(in, "Missing golden file " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    @DisplayName("Should render the canonical example exactly as the golden dump")
    void shouldMatchGoldenDump() throws IOException {
        // When
        String dump = printer.render(parser.parse("geo.distance(Home, Office) lt 0.5"));

        // Then
        assertEquals(golden("geo-distance-filter.txt"), dump);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "geo.distance(Home, Office) lt 0.5",
            "a eq 1 and b eq 2 or c eq 3",
            "not contains(Name, 'O''Neil') and Address/City ne 'Paris'",
            "Test.IsNear(Home, Address/Location)"
    })
    @DisplayName("Rendering should be deterministic across parses")
    void renderingIsDeterministic(String filter) {
        // When
        String first = printer.render(parser.parse(filter));
        String second = new QueryNodePrinter().render(parser.parse(filter));

        // Then
        assertEquals(first, second);
        assertTrue(first.endsWith("\n"));
        assertFalse(first.contains("\r"));
    }

    @Test
    @DisplayName("Should render unary operators with their operand")
    void shouldRenderUnaryOperator() {
        // When
        String dump = printer.render(parser.parse("not IsActive").expression());

        // Then
        assertEquals("""
                UnaryOperatorNode
                \tTypeReference = [Edm.Boolean Nullable=False]
                \tOperatorKind = Not
                \tOperand = \n\
                \tSingleValuePropertyAccessNode
                \t\tProperty = IsActive
                \t\tTypeReference = [Edm.Boolean Nullable=False]
                \t\tSource = \n\
                \t\tEntityRangeVariableReferenceNode
                \t\t\tName = $it
                \t\t\tNavigationSource = People
                \t\t\tTypeReference = [Test.Person Nullable=False]
                """, dump);
    }

    @Test
    @DisplayName("Should print the signature of model-declared functions only")
    void shouldPrintDeclaredSignature() {
        // When
        String declared = printer.render(parser.parse("Test.IsNear(Home, Office)"));
        String builtIn = printer.render(parser.parse("contains(Name, 'a')"));

        // Then
        assertTrue(declared.contains("Function = Test.IsNear(Edm.GeographyPoint, Edm.GeographyPoint) -> Edm.Boolean\n"));
        assertTrue(builtIn.contains("Function = \n"));
    }

    @Test
    @DisplayName("Should print string constants unquoted and unescaped")
    void shouldPrintStringConstant() {
        // When
        String dump = printer.render(parser.parse("Name eq 'O''Neil'"));

        // Then
        assertTrue(dump.contains("LiteralText = 'O''Neil'\n"));
        assertTrue(dump.contains("Value = O'Neil\n"));
    }

    @Test
    @DisplayName("Should escape line breaks in constants so each attribute stays on one line")
    void shouldEscapeControlCharacters() {
        // When
        String dump = printer.render(parser.parse("Name eq 'a\nConstantNode\tb\\c'"));

        // Then
        assertTrue(dump.contains("\tLiteralText = 'a\\nConstantNode\\tb\\\\c'\n"));
        assertTrue(dump.contains("\tValue = a\\nConstantNode\\tb\\\\c\n"));
        assertEquals(1, dump.lines().filter(line -> line.strip().equals("ConstantNode")).count());
    }

    @Test
    @DisplayName("Should indent with the configured unit")
    void shouldIndentWithConfiguredUnit() throws IOException {
        // Given
        QueryNodePrinter spaced = new QueryNodePrinter(PrinterConfig.spaces(2));
        FilterQueryOption filter = parser.parse("geo.distance(Home, Office) lt 0.5");

        // When
        String dump = spaced.render(filter);

        // Then
        assertEquals(golden("geo-distance-filter.txt").replace("\t", "  "), dump);
    }

    @Test
    @DisplayName("Should reject null inputs")
    void shouldRejectNullInputs() {
        assertThrows(NullPointerException.class, () -> new QueryNodePrinter(null));
        assertThrows(NullPointerException.class, () -> printer.render((FilterQueryOption) null));
    }
}

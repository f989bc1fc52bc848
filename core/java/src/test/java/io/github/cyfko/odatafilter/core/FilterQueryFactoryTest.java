package io.github.cyfko.odatafilter.core;

import io.github.cyfko.odatafilter.core.api.FilterQuery;
import io.github.cyfko.odatafilter.core.api.SchemaResolver;
import io.github.cyfko.odatafilter.core.config.ParserPolicy;
import io.github.cyfko.odatafilter.core.config.PrinterConfig;
import io.github.cyfko.odatafilter.core.edm.EdmModel;
import io.github.cyfko.odatafilter.core.edm.ModelSchemaResolver;
import io.github.cyfko.odatafilter.core.exception.FilterSyntaxException;
import io.github.cyfko.odatafilter.core.exception.UnknownPropertyException;
import io.github.cyfko.odatafilter.core.model.FilterQueryOption;
import io.github.cyfko.odatafilter.core.model.RangeVariable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.net.URI;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("FilterQueryFactory Tests")
class FilterQueryFactoryTest {

    @Mock
    private SchemaResolver mockResolver;

    private FilterQuery query;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        query = FilterQueryFactory.of(TestModels.people());
    }

    @Test
    @DisplayName("Should parse and explain filter text")
    void shouldParseAndExplain() {
        // When
        FilterQueryOption filter = query.parse("geo.distance(Home, Office) lt 0.5");
        String explained = query.explain("geo.distance(Home, Office) lt 0.5");

        // Then
        assertEquals(query.render(filter), explained);
        assertTrue(explained.startsWith("FilterQueryOption\n"));
    }

    @Test
    @DisplayName("Should parse the $filter option of a request URI")
    void shouldParseUri() {
        // When
        Optional<FilterQueryOption> filter = query.parse(URI.create("/People?$filter=Name%20eq%20%27Ann%27"));

        // Then
        assertTrue(filter.isPresent());
        assertEquals(TestModels.PEOPLE, filter.get().rangeVariable().navigationSource());
    }

    @Test
    @DisplayName("Should return empty for a URI without $filter")
    void shouldReturnEmptyForUriWithoutFilter() {
        assertTrue(query.parse(URI.create("/People?$top=10")).isEmpty());
    }

    @Test
    @DisplayName("Should propagate parse errors from URIs")
    void shouldPropagateUriErrors() {
        assertThrows(UnknownPropertyException.class,
                () -> query.parse(URI.create("/People?$filter=Nope%20eq%201")));
    }

    @Test
    @DisplayName("Should honor the supplied policy and printer settings")
    void shouldHonorSettings() {
        // Given
        FilterQuery custom = FilterQueryFactory.of(new ModelSchemaResolver(TestModels.people()),
                ParserPolicy.builder().maxExpressionLength(10).build(), PrinterConfig.spaces(2));

        // Then
        assertThrows(FilterSyntaxException.class, () -> custom.parse("a eq 1 and b eq 2"));
        assertTrue(custom.explain("a eq 1").contains("\n  ItemType = "));
    }

    @Test
    @DisplayName("Should delegate name resolution to the supplied resolver")
    void shouldDelegateToResolver() {
        // Given
        when(mockResolver.resolveRangeVariable(RangeVariable.IT)).thenReturn(TestModels.it());
        FilterQuery mocked = FilterQueryFactory.of(mockResolver);

        // When
        FilterQueryOption filter = mocked.parse("true");

        // Then
        verify(mockResolver).resolveRangeVariable(RangeVariable.IT);
        verifyNoMoreInteractions(mockResolver);
        assertEquals(RangeVariable.IT, filter.rangeVariable().name());
    }

    @Test
    @DisplayName("Should reject missing collaborators")
    void shouldRejectMissingCollaborators() {
        assertThrows(IllegalArgumentException.class, () -> FilterQueryFactory.of((SchemaResolver) null));
        assertThrows(NullPointerException.class, () -> FilterQueryFactory.of((EdmModel) null));
        assertThrows(NullPointerException.class,
                () -> FilterQueryFactory.of(mockResolver, ParserPolicy.defaults(), null));
    }
}

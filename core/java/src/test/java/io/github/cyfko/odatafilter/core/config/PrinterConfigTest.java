package io.github.cyfko.odatafilter.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PrinterConfig Tests")
class PrinterConfigTest {

    @Test
    @DisplayName("Should indent with one tab by default")
    void shouldDefaultToTab() {
        assertEquals("\t", PrinterConfig.defaults().getIndentUnit());
        assertEquals("\t", PrinterConfig.builder().build().getIndentUnit());
    }

    @Test
    @DisplayName("Should build a space-based indentation unit")
    void shouldBuildSpaces() {
        assertEquals("    ", PrinterConfig.spaces(4).getIndentUnit());
        assertEquals("  ", PrinterConfig.builder().indentUnit("  ").build().getIndentUnit());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "\t\t", " \t", "-"})
    @DisplayName("Should reject units that are neither a tab nor spaces")
    void shouldRejectInvalidUnits(String unit) {
        assertThrows(IllegalArgumentException.class, () -> PrinterConfig.builder().indentUnit(unit));
    }

    @Test
    @DisplayName("Should reject a non-positive width")
    void shouldRejectNonPositiveWidth() {
        assertThrows(IllegalArgumentException.class, () -> PrinterConfig.spaces(0));
        assertThrows(NullPointerException.class, () -> PrinterConfig.builder().indentUnit(null));
    }
}

package com.pricecheck.common.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ProductNameNormalizerTest {

    @Test
    @DisplayName("strips the first retailer prefix and collapses litres")
    void prefixAndLitres() {
        assertEquals("full cream milk 2l",
            ProductNameNormalizer.normalize("Woolworths Full Cream Milk 2 Litres"));
    }

    @Test
    @DisplayName("collapses whitespace and descriptor prefixes")
    void whitespace() {
        assertEquals("eggs 12 pack", ProductNameNormalizer.normalize("  Organic   Eggs 12 pack "));
    }

    @Test
    @DisplayName("unit spellings")
    void units() {
        assertEquals("500g", ProductNameNormalizer.normalize("500 grams"));
        assertEquals("1.5kg", ProductNameNormalizer.normalize("1.5 kilograms"));
        assertEquals("250ml", ProductNameNormalizer.normalize("250 ml"));
        assertEquals("2 large eggs", ProductNameNormalizer.normalize("2 large eggs"));
    }

    @Test
    @DisplayName("keywords drop stop words and single characters")
    void keywords() {
        assertEquals(List.of("milk", "bread"), ProductNameNormalizer.keywords("the milk and a bread x"));
    }

    @Test
    @DisplayName("decimal sizes stay one token")
    void decimalToken() {
        assertEquals(List.of("1.5l", "milk"), ProductNameNormalizer.tokens("1.5 litre milk"));
    }

    @Test
    @DisplayName("size tokens carry value and unit")
    void sizes() {
        List<ProductNameNormalizer.SizeToken> sizes = ProductNameNormalizer.sizes("Milk 2 Litres twin 500ml");
        assertEquals(2, sizes.size());
        assertEquals("2l", sizes.get(0).text());
        assertEquals("ml", sizes.get(1).unit());
    }

    @Test
    @DisplayName("lower-casing ignores the default locale")
    void turkishDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals("milk 2l", ProductNameNormalizer.normalize("MILK 2 LITRES"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("null → empty")
    void nullInput() {
        assertEquals("", ProductNameNormalizer.normalize(null));
    }
}

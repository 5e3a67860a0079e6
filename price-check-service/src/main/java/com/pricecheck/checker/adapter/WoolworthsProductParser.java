package com.pricecheck.checker.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.pricecheck.common.model.ProductCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a Woolworths product search response into {@link ProductCandidate}s.
 *
 * <p>The payload nests products two levels deep: {@code Products[].Products[]}. Every
 * field is read through {@link JsonNode#path}, so missing fields never throw. A product
 * that cannot be read is skipped; the rest of the page is kept.
 */
public class WoolworthsProductParser {

    private static final Logger log = LoggerFactory.getLogger(WoolworthsProductParser.class);

    static final String PRODUCT_URL = "https://www.woolworths.com.au/shop/productdetails/";
    static final String DISAMBIGUATOR_PREFIX = "WOW:";

    private final String sourceName;

    public WoolworthsProductParser(String sourceName) {
        this.sourceName = sourceName;
    }

    public List<ProductCandidate> parse(JsonNode payload) {
        List<ProductCandidate> candidates = new ArrayList<>();
        JsonNode groups = payload == null ? null : payload.path("Products");
        if (groups == null || !groups.isArray()) {
            return candidates;
        }
        for (JsonNode group : groups) {
            for (JsonNode product : group.path("Products")) {
                try {
                    ProductCandidate candidate = parseProduct(product);
                    if (candidate != null) {
                        candidates.add(candidate);
                    }
                } catch (RuntimeException e) {
                    log.warn("PRODUCT_PARSE_FAILED source={} stockcode={} error={}",
                        sourceName, product.path("Stockcode").asText(""), e.getMessage());
                }
            }
        }
        return candidates;
    }

    /** Returns {@code null} for an entry without any name. */
    ProductCandidate parseProduct(JsonNode product) {
        String rawName = firstNonBlank(text(product, "DisplayName"), text(product, "Name"));
        if (rawName == null) {
            return null;
        }
        String size = firstNonBlank(text(product, "PackageSize"), text(product, "Size"));
        String name = rawName;
        if (size != null && !rawName.toLowerCase(Locale.ROOT).contains(size.toLowerCase(Locale.ROOT))) {
            name = (rawName + " " + size).trim();
        }

        String stockcode = text(product, "Stockcode");

        Double price = number(product, "Price");
        Double was   = number(product, "WasPrice");
        if (was != null && (was <= 0 || was.equals(price))) {
            was = null;
        }

        boolean promoFlag = product.path("IsOnSpecial").asBoolean(false)
                         || product.path("IsHalfPrice").asBoolean(false);

        String promoText = null;
        Double savings = number(product, "SavingsAmount");
        if (savings != null && savings > 0) {
            promoText = String.format(Locale.ROOT, "Save $%.2f", savings);
        }

        String url = null;
        if (stockcode != null) {
            String slug = text(product, "UrlFriendlyName");
            url = PRODUCT_URL + stockcode + (slug == null ? "" : "/" + slug);
        }

        return new ProductCandidate(name, price, was, promoFlag, promoText, url, inStock(product),
            sourceName, stockcode == null ? null : DISAMBIGUATOR_PREFIX + stockcode);
    }

    private static Boolean inStock(JsonNode product) {
        JsonNode available = product.path("IsAvailable");
        JsonNode inStock   = product.path("IsInStock");
        if (available.asBoolean(false) || inStock.asBoolean(false)) {
            return true;
        }
        if (available.isBoolean() || inStock.isBoolean()) {
            return false;
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String firstNonBlank(String a, String b) {
        return a != null ? a : b;
    }
}

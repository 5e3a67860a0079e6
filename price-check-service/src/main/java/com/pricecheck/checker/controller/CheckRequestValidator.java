package com.pricecheck.checker.controller;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates and normalizes {@link CheckItemsRequest}s.
 *
 * <ul>
 *   <li>postcode: exactly four digits</li>
 *   <li>items: 1 to {@value #MAX_ITEMS} comma-separated, non-blank entries</li>
 *   <li>each item: {@value #MIN_ITEM_LENGTH} to {@value #MAX_ITEM_LENGTH} characters after
 *       trimming, no markup or script fragments</li>
 * </ul>
 */
@Component
public class CheckRequestValidator {

    static final int MAX_ITEMS = 20;
    static final int MIN_ITEM_LENGTH = 2;
    static final int MAX_ITEM_LENGTH = 200;

    private static final Pattern POSTCODE = Pattern.compile("^\\d{4}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<Pattern> SUSPICIOUS = List.of(
        Pattern.compile("<script[^>]*>", Pattern.CASE_INSENSITIVE),
        Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
        Pattern.compile("on\\w+\\s*=", Pattern.CASE_INSENSITIVE),
        Pattern.compile("<%.*?%>"),
        Pattern.compile("\\$\\{.*?}")
    );

    public record ValidatedCheck(List<String> items, String postcode) {}

    public ValidatedCheck validate(CheckItemsRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Request body is required");
        }
        List<String> violations = new ArrayList<>();

        String postcode = request.postcode() == null ? "" : request.postcode().trim();
        if (postcode.isEmpty()) {
            violations.add("Postcode is required");
        } else if (!POSTCODE.matcher(postcode).matches()) {
            violations.add("Invalid postcode format. Must be 4 digits, got: " + request.postcode());
        }

        List<String> items = new ArrayList<>();
        if (request.items() == null || request.items().isBlank()) {
            violations.add("At least one item is required");
        } else {
            for (String raw : request.items().split(",")) {
                String item = WHITESPACE.matcher(raw.trim()).replaceAll(" ");
                if (!item.isEmpty()) {
                    items.add(item);
                }
            }
            if (items.isEmpty()) {
                violations.add("At least one item is required");
            } else if (items.size() > MAX_ITEMS) {
                violations.add("Too many items: " + items.size() + " (maximum " + MAX_ITEMS + ")");
            }
            for (String item : items) {
                checkItem(item, violations);
            }
        }

        if (!violations.isEmpty()) {
            throw new InvalidRequestException(violations);
        }
        return new ValidatedCheck(List.copyOf(items), postcode);
    }

    private static void checkItem(String item, List<String> violations) {
        if (item.length() < MIN_ITEM_LENGTH) {
            violations.add("Item '" + item + "' must be at least " + MIN_ITEM_LENGTH + " characters long");
        } else if (item.length() > MAX_ITEM_LENGTH) {
            violations.add("Item must be at most " + MAX_ITEM_LENGTH + " characters long");
        } else if (SUSPICIOUS.stream().anyMatch(p -> p.matcher(item).find())) {
            violations.add("Item '" + item + "' contains disallowed content");
        }
    }
}

package com.patentintel.status.service;

import com.patentintel.status.exception.InvalidIdentifierFormatException;
import com.patentintel.status.model.CanonicalIdentifier;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns user input such as "ep 1.234.567 b1" or "US-10,000,000" into a {@link CanonicalIdentifier}.
 *
 * Accepted shape after cleanup: two-letter jurisdiction, digits, optional kind code (letter plus
 * optional digit). The digit count is checked per jurisdiction.
 */
@Component
public class IdentifierNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s.,/_-]");
    private static final Pattern SHAPE = Pattern.compile("^([A-Z]{2})(\\d+)([A-Z]\\d?)?$");

    private static final Map<String, DigitRule> RULES = Map.of(
            "EP", new DigitRule(7, 7),
            "US", new DigitRule(7, 8)
    );

    public CanonicalIdentifier normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidIdentifierFormatException(raw == null ? "" : raw, "identifier is empty");
        }

        String cleaned = SEPARATORS.matcher(raw).replaceAll("").toUpperCase(Locale.ROOT);
        Matcher m = SHAPE.matcher(cleaned);
        if (!m.matches()) {
            throw new InvalidIdentifierFormatException(raw, "not a jurisdiction-prefixed patent number");
        }

        String jurisdiction = m.group(1);
        String digits = m.group(2);
        DigitRule rule = RULES.get(jurisdiction);
        if (rule == null) {
            throw new InvalidIdentifierFormatException(raw, "unsupported jurisdiction " + jurisdiction);
        }
        if (!rule.accepts(digits.length())) {
            throw new InvalidIdentifierFormatException(raw,
                    jurisdiction + " numbers have " + rule.describe() + " digits, got " + digits.length());
        }

        return new CanonicalIdentifier(jurisdiction, digits, m.group(3));
    }

    private record DigitRule(int min, int max) {

        boolean accepts(int length) {
            return length >= min && length <= max;
        }

        String describe() {
            return min == max ? String.valueOf(min) : min + "-" + max;
        }
    }
}

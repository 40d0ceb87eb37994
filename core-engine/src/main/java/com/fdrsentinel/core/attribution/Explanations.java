package com.fdrsentinel.core.attribution;

import com.fdrsentinel.core.model.Driver;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Human-facing text derived from feature names and drivers.
 *
 * @since 1.0.0
 */
public final class Explanations {

    static final String BASE_TEXT =
            "Unusual behavior pattern compared to learned normal behavior for this flight.";
    static final String REVIEW_PREFIX = "Review recommended. ";

    private Explanations() {
        // utility class
    }

    /**
     * @param drivers ranked drivers; the first {@code named} are listed
     * @param named   how many drivers to name
     * @param review  whether the segment came from the review fallback
     */
    public static String explain(List<Driver> drivers, int named, boolean review) {
        String text = BASE_TEXT;
        if (!drivers.isEmpty()) {
            text += " Top drivers: " + drivers.stream()
                    .limit(named)
                    .map(Driver::getParameter)
                    .collect(Collectors.joining(", ")) + ".";
        }
        return review ? REVIEW_PREFIX + text : text;
    }

    /**
     * Extract the physical unit from a name like {@code "Oil Temp (deg C)"}.
     *
     * @return the trimmed text inside the first parentheses, or an empty string
     */
    public static String unitOf(String parameter) {
        if (parameter == null || parameter.isEmpty()) {
            return "";
        }
        int open = parameter.indexOf('(');
        if (open < 0) {
            return "";
        }
        int close = parameter.indexOf(')', open + 1);
        return close > open ? parameter.substring(open + 1, close).trim() : "";
    }
}

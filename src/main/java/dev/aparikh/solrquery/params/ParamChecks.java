package dev.aparikh.solrquery.params;

import dev.aparikh.solrquery.exception.SolrQueryConfigurationException;
import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Construction-time checks shared by the parameter builders.
 */
public final class ParamChecks {

    private ParamChecks() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String requireText(@Nullable String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            throw new SolrQueryConfigurationException(name + " cannot be null or empty");
        }
        return value;
    }

    public static <T> T requirePresent(@Nullable T value, String name) {
        if (value == null) {
            throw new SolrQueryConfigurationException(name + " is required");
        }
        return value;
    }

    public static void requireNonNegative(@Nullable Number value, String name) {
        requireNumber(value, name);
        if (value != null && value.doubleValue() < 0) {
            throw new SolrQueryConfigurationException(name + " must be >= 0, got " + value);
        }
    }

    public static void requirePositive(@Nullable Number value, String name) {
        requireNumber(value, name);
        if (value != null && value.doubleValue() <= 0) {
            throw new SolrQueryConfigurationException(name + " must be greater than 0, got " + value);
        }
    }

    public static void requireRange(@Nullable Number value, double min, double max, String name) {
        requireNumber(value, name);
        if (value != null && (value.doubleValue() < min || value.doubleValue() > max)) {
            throw new SolrQueryConfigurationException(
                    name + " must be within [" + min + ", " + max + "], got " + value);
        }
    }

    public static void requireFinite(@Nullable Number value, String name) {
        requireNumber(value, name);
        if (value != null && Double.isInfinite(value.doubleValue())) {
            throw new SolrQueryConfigurationException(name + " must be finite, got " + value);
        }
    }

    private static void requireNumber(@Nullable Number value, String name) {
        if (value != null && Double.isNaN(value.doubleValue())) {
            throw new SolrQueryConfigurationException(name + " must be a number, got NaN");
        }
    }

    /**
     * Copies a list, rejecting blank entries. Returns null for null input.
     */
    public static @Nullable List<String> copyTexts(@Nullable Collection<String> values, String name) {
        if (values == null) {
            return null;
        }
        for (String value : values) {
            requireText(value, name + " entry");
        }
        return List.copyOf(values);
    }

    /**
     * Validates a field-to-boost mapping: non-blank names, non-negative boosts.
     */
    public static void requireWeights(@Nullable Map<String, Double> weights, String name) {
        if (weights == null) {
            return;
        }
        weights.forEach((field, boost) -> {
            requireText(field, name + " field");
            requirePresent(boost, name + " boost for '" + field + "'");
            requireNonNegative(boost, name + " boost for '" + field + "'");
        });
    }
}

package dev.aparikh.solrquery.params;

import dev.aparikh.solrquery.exception.ParamSerializationException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Utility class for rendering parameter values in Solr's wire format.
 *
 * <p>Every method is pure: the same input always yields the same string.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public final class ParamFormat {

    private ParamFormat() {
        // Private constructor to prevent instantiation
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Renders a single scalar value.
     *
     * <p>Booleans become {@code true}/{@code false}, never {@code 1}/{@code 0}.</p>
     *
     * @param value a {@link String}, {@link Number}, {@link Boolean} or {@link WireValue}
     * @return the wire string
     * @throws ParamSerializationException if the value has no wire form
     */
    public static String render(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "true" : "false";
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof WireValue) {
            return ((WireValue) value).wireValue();
        }
        throw new ParamSerializationException(
                "No wire representation for value of type " + value.getClass().getName());
    }

    /**
     * Joins values into a single comma-separated value, e.g. {@code id,title,score}.
     */
    public static String commaJoin(List<?> values) {
        return values.stream()
                .map(ParamFormat::render)
                .collect(Collectors.joining(","));
    }

    /**
     * Renders a field-to-boost mapping as space-separated {@code field^weight} tokens.
     *
     * <p>Converts {@code {title=2.0, body=1.0}} to {@code "title^2.0 body^1.0"}, the syntax
     * used by {@code qf}, {@code pf}, {@code pf2} and {@code pf3}. Iteration order of the
     * map is kept.</p>
     *
     * @param weights field names mapped to boosts
     * @return the weighted-field string
     */
    public static String weightedFields(Map<String, ? extends Number> weights) {
        return weights.entrySet().stream()
                .map(e -> e.getKey() + "^" + render(e.getValue()))
                .collect(Collectors.joining(" "));
    }

    /**
     * Renders a coordinate pair as {@code "lat,lon"}.
     */
    public static String point(double latitude, double longitude) {
        return render(latitude) + "," + render(longitude);
    }

    /**
     * Converts a vector to the format expected by Solr's dense vector parsers.
     *
     * <p>Converts a list like {@code [0.1, 0.2, 0.3]} to the string {@code "[0.1,0.2,0.3]"}.</p>
     *
     * @param vector the vector components
     * @return the bracketed, comma-separated vector
     */
    public static String vector(List<Float> vector) {
        return vector.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(",", "[", "]"));
    }

    /**
     * Reads back a vector rendered by {@link #vector(List)}.
     *
     * @param text a bracketed vector such as {@code [0.1,0.2]}
     * @return the vector components
     * @throws IllegalArgumentException if the text is not a bracketed list of numbers
     */
    public static List<Float> parseVector(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("[") || !trimmed.endsWith("]")) {
            throw new IllegalArgumentException("Not a vector literal: " + text);
        }
        String inner = trimmed.substring(1, trimmed.length() - 1).trim();
        List<Float> result = new ArrayList<>();
        if (inner.isEmpty()) {
            return result;
        }
        for (String part : inner.split(",")) {
            result.add(Float.parseFloat(part.trim()));
        }
        return result;
    }
}

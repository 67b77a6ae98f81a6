package dev.aparikh.solrquery.params;

import dev.aparikh.solrquery.exception.ParamSerializationException;
import org.apache.solr.common.params.ModifiableSolrParams;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flat, immutable mapping from Solr wire key to value.
 *
 * <p>Values are {@link String}, {@link Number}, {@link Boolean} or an immutable
 * {@code List<String>} for keys that repeat ({@code fq=a&fq=b}). Absent values are never
 * stored: putting {@code null} or an empty collection is a no-op, so an unset option never
 * reaches the wire as a null token.</p>
 *
 * <p>Key order follows insertion order but carries no meaning; {@link #equals(Object)}
 * compares keys and values only.</p>
 */
public final class WireParams {

    private static final WireParams EMPTY = new WireParams(Map.of());

    private final Map<String, Object> values;

    private WireParams(Map<String, Object> values) {
        this.values = values;
    }

    public static WireParams empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates wire params from a caller-supplied mapping, normalizing each value.
     */
    public static WireParams of(Map<String, ?> values) {
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    public @Nullable Object get(String key) {
        return values.get(key);
    }

    /**
     * Returns the value as it would be sent: repeated values are comma-joined here only for
     * display; use {@link #getAll(String)} for the individual values.
     */
    public @Nullable String getString(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof List) {
            return ParamFormat.commaJoin((List<?>) value);
        }
        return ParamFormat.render(value);
    }

    public List<String> getAll(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List) {
            @SuppressWarnings("unchecked")
            List<String> list = (List<String>) value;
            return list;
        }
        return List.of(ParamFormat.render(value));
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Returns a copy of these params with {@code overrides} applied on top; on key collision
     * the override wins.
     */
    public WireParams merge(@Nullable WireParams overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        return toBuilder().putAll(overrides).build();
    }

    public Builder toBuilder() {
        return new Builder().putAll(this);
    }

    /**
     * Converts to SolrJ params: scalars are rendered with {@link ParamFormat#render(Object)},
     * lists become repeated values of the same key.
     */
    public ModifiableSolrParams toSolrParams() {
        ModifiableSolrParams params = new ModifiableSolrParams();
        values.forEach((key, value) -> {
            if (value instanceof List) {
                for (Object item : (List<?>) value) {
                    params.add(key, ParamFormat.render(item));
                }
            } else {
                params.set(key, ParamFormat.render(value));
            }
        });
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WireParams)) {
            return false;
        }
        return values.equals(((WireParams) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "WireParams" + values;
    }

    public static class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        /**
         * Sets a key, replacing any previous value. Null and empty collections are ignored.
         *
         * @throws ParamSerializationException if the value has no wire representation
         */
        public Builder put(String key, @Nullable Object value) {
            Object normalized = normalize(key, value);
            if (normalized != null) {
                values.put(key, normalized);
            }
            return this;
        }

        /**
         * Appends values to a repeated key, keeping any values already present.
         */
        public Builder append(String key, @Nullable Object value) {
            Object normalized = normalize(key, value);
            if (normalized == null) {
                return this;
            }
            List<String> merged = new ArrayList<>();
            Object existing = values.get(key);
            if (existing instanceof List) {
                for (Object item : (List<?>) existing) {
                    merged.add((String) item);
                }
            } else if (existing != null) {
                merged.add(ParamFormat.render(existing));
            }
            if (normalized instanceof List) {
                for (Object item : (List<?>) normalized) {
                    merged.add((String) item);
                }
            } else {
                merged.add(ParamFormat.render(normalized));
            }
            values.put(key, List.copyOf(merged));
            return this;
        }

        public Builder putIfAbsent(String key, @Nullable Object value) {
            if (!values.containsKey(key)) {
                put(key, value);
            }
            return this;
        }

        public Builder putAll(WireParams params) {
            values.putAll(params.values);
            return this;
        }

        public boolean containsKey(String key) {
            return values.containsKey(key);
        }

        public WireParams build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new WireParams(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }

        private static @Nullable Object normalize(String key, @Nullable Object value) {
            if (key == null || key.isEmpty()) {
                throw new ParamSerializationException("Wire key cannot be null or empty");
            }
            if (value == null) {
                return null;
            }
            if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                return value;
            }
            if (value instanceof WireValue) {
                return ((WireValue) value).wireValue();
            }
            if (value instanceof Collection) {
                Collection<?> items = (Collection<?>) value;
                if (items.isEmpty()) {
                    return null;
                }
                List<String> rendered = new ArrayList<>(items.size());
                for (Object item : items) {
                    if (item == null) {
                        throw new ParamSerializationException("Null entry in list value for '" + key + "'");
                    }
                    rendered.add(ParamFormat.render(item));
                }
                return List.copyOf(rendered);
            }
            throw new ParamSerializationException("No wire representation for '" + key + "' of type "
                    + value.getClass().getName());
        }
    }
}

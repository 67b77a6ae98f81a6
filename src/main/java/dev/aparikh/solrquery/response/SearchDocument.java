package dev.aparikh.solrquery.response;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for documents returned by Solr.
 *
 * <p>Subclasses declare the fields they care about as ordinary Jackson properties; every other
 * stored field (including {@code score} and {@code _version_}) is kept in
 * {@link #getAdditionalFields()}, so nothing in the response is lost. Mark a field
 * {@code @JsonProperty(required = true)} on a {@code @JsonCreator} to make decoding fail when
 * Solr omits it.</p>
 *
 * <pre>{@code
 * public class Product extends SearchDocument {
 *     private final String id;
 *
 *     @JsonCreator
 *     public Product(@JsonProperty(value = "id", required = true) String id) {
 *         this.id = id;
 *     }
 * }
 * }</pre>
 */
public class SearchDocument {

    private final Map<String, Object> additionalFields = new LinkedHashMap<>();

    @JsonAnySetter
    public void setAdditionalField(String name, @Nullable Object value) {
        additionalFields.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditionalFields() {
        return Collections.unmodifiableMap(additionalFields);
    }

    /**
     * Value of a field not mapped to a declared property, or null when absent.
     */
    public @Nullable Object get(String name) {
        return additionalFields.get(name);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + additionalFields;
    }
}

package dev.aparikh.solrquery.response;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Test document with a required {@code id} and an optional {@code name}.
 */
public class Product extends SearchDocument {

    private final String id;
    private final String name;

    @JsonCreator
    public Product(@JsonProperty(value = "id", required = true) String id,
                   @JsonProperty("name") String name) {
        this.id = id;
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }
}

package dev.aparikh.solrquery.params;

/**
 * A constant whose wire spelling differs from its Java name, e.g. {@code fastVector}.
 */
public interface WireValue {

    String wireValue();
}

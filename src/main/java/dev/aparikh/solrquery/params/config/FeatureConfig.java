package dev.aparikh.solrquery.params.config;

import dev.aparikh.solrquery.params.WireParams;

/**
 * An optional, namespaced parameter block attachable to a lexical query.
 *
 * <p>Attaching a block turns its feature on: {@link #flatten()} always emits
 * {@code enableKey()=true}, even when no option was set. Blocks use disjoint prefixes and
 * never read each other.</p>
 */
public interface FeatureConfig {

    /**
     * Top-level switch, e.g. {@code facet} or {@code hl}.
     */
    String enableKey();

    /**
     * Namespace of the options, e.g. {@code facet.} or {@code hl.}.
     */
    String prefix();

    WireParams flatten();
}

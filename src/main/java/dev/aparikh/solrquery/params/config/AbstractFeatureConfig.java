package dev.aparikh.solrquery.params.config;

import dev.aparikh.solrquery.params.WireParams;
import org.jspecify.annotations.Nullable;

/**
 * Base for feature blocks: writes the enable key, then each option under the block's prefix.
 */
abstract class AbstractFeatureConfig implements FeatureConfig {

    private final String enableKey;

    protected AbstractFeatureConfig(String enableKey) {
        this.enableKey = enableKey;
    }

    @Override
    public final String enableKey() {
        return enableKey;
    }

    @Override
    public final String prefix() {
        return enableKey + ".";
    }

    @Override
    public final WireParams flatten() {
        WireParams.Builder params = WireParams.builder().put(enableKey, Boolean.TRUE);
        contribute(params);
        return params.build();
    }

    /**
     * Emits the options that are set.
     */
    protected abstract void contribute(WireParams.Builder params);

    protected final void option(WireParams.Builder params, String name, @Nullable Object value) {
        params.put(prefix() + name, value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + flatten().asMap();
    }
}

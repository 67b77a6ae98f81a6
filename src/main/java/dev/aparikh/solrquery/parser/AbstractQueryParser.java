package dev.aparikh.solrquery.parser;

import dev.aparikh.solrquery.params.CommonParams;
import dev.aparikh.solrquery.params.WireParams;

import java.util.List;

/**
 * Base for all parser families: common params first, then the family's own fields, which win
 * on key collision.
 */
public abstract class AbstractQueryParser implements QueryParser {

    public static final String QUERY = "q";
    public static final String DEF_TYPE = "defType";

    private final CommonParams commonParams;

    protected AbstractQueryParser(Builder<?, ?> builder) {
        this.commonParams = builder.common.build();
    }

    @Override
    public final WireParams build() {
        WireParams.Builder params = WireParams.builder().putAll(commonParams.flatten());
        contribute(params);
        return params.build();
    }

    @Override
    public CommonParams commonParams() {
        return commonParams;
    }

    protected abstract void contribute(WireParams.Builder params);

    @Override
    public String toString() {
        return getClass().getSimpleName() + build().asMap();
    }

    /**
     * Builder carrying the shared common-params setters.
     *
     * @param <P> the parser built
     * @param <B> the concrete builder, returned by every setter
     */
    public abstract static class Builder<P extends AbstractQueryParser, B extends Builder<P, B>> {

        private CommonParams.Builder common = CommonParams.builder();

        protected abstract B self();

        public abstract P build();

        /**
         * Replaces all common params at once.
         */
        public B commonParams(CommonParams commonParams) {
            this.common = commonParams.toBuilder();
            return self();
        }

        public B sort(String sort) {
            common.sort(sort);
            return self();
        }

        public B start(int start) {
            common.start(start);
            return self();
        }

        public B rows(int rows) {
            common.rows(rows);
            return self();
        }

        public B filters(String... filters) {
            common.filters(filters);
            return self();
        }

        public B filters(List<String> filters) {
            common.filters(filters);
            return self();
        }

        public B fieldList(String... fields) {
            common.fieldList(fields);
            return self();
        }

        public B debug(String... debug) {
            common.debug(debug);
            return self();
        }

        public B timeAllowed(int timeAllowedMillis) {
            common.timeAllowed(timeAllowedMillis);
            return self();
        }

        public B omitHeader(boolean omitHeader) {
            common.omitHeader(omitHeader);
            return self();
        }
    }
}

package dev.aparikh.solrquery.compose;

import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.WireParams;
import dev.aparikh.solrquery.parser.AbstractQueryParser;
import dev.aparikh.solrquery.parser.QueryParser;
import org.jspecify.annotations.Nullable;

/**
 * Turns a query model into the final request parameters.
 *
 * <p>The parser's own params come first, caller overrides are applied on top (the override
 * wins on any shared key), and {@code wt=json} is added only if neither side set {@code wt}.
 * Stateless, so one instance can be shared across threads.</p>
 */
public class QueryComposer {

    public static final String WRITER_TYPE = "wt";
    public static final String JSON = "json";

    public WireParams compose(QueryParser parser) {
        return compose(parser, null);
    }

    public WireParams compose(QueryParser parser, @Nullable WireParams overrides) {
        return finish(parser.build(), overrides);
    }

    /**
     * Composes a raw Lucene-syntax query with no parser model.
     */
    public WireParams compose(String rawQuery, @Nullable WireParams overrides) {
        ParamChecks.requireText(rawQuery, "Query (q)");
        WireParams base = WireParams.builder().put(AbstractQueryParser.QUERY, rawQuery).build();
        return finish(base, overrides);
    }

    private WireParams finish(WireParams base, @Nullable WireParams overrides) {
        return base.merge(overrides)
                .toBuilder()
                .putIfAbsent(WRITER_TYPE, JSON)
                .build();
    }
}

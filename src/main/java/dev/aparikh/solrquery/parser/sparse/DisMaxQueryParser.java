package dev.aparikh.solrquery.parser.sparse;

/**
 * DisMax: simple user-entered queries spread across several weighted fields.
 *
 * <pre>{@code
 * DisMaxQueryParser parser = DisMaxQueryParser.builder()
 *     .query("wireless mouse")
 *     .queryFields(Map.of("title", 2.0, "description", 1.0))
 *     .minimumMatch("75%")
 *     .tie(0.1)
 *     .build();
 * }</pre>
 *
 * @see <a href="https://solr.apache.org/guide/solr/latest/query-guide/dismax-query-parser.html">DisMax Query Parser</a>
 */
public final class DisMaxQueryParser extends AbstractDisMaxQueryParser {

    private DisMaxQueryParser(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected String defType() {
        return "dismax";
    }

    public static final class Builder extends AbstractBuilder<DisMaxQueryParser, Builder> {

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public DisMaxQueryParser build() {
            return new DisMaxQueryParser(this);
        }
    }
}

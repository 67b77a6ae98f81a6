package dev.aparikh.solrquery.parser.sparse;

import dev.aparikh.solrquery.params.WireParams;

/**
 * Solr's default Lucene query syntax, e.g. {@code title:mouse AND price:[0 TO 50]}.
 *
 * <p>{@code defType} is left unset since {@code lucene} is already Solr's default.</p>
 */
public final class StandardQueryParser extends SparseQueryParser {

    private StandardQueryParser(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StandardQueryParser of(String query) {
        return builder().query(query).build();
    }

    @Override
    protected void contributeQuery(WireParams.Builder params) {
        // lucene is the default parser
    }

    public static final class Builder extends SparseQueryParser.Builder<StandardQueryParser, Builder> {

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public StandardQueryParser build() {
            return new StandardQueryParser(this);
        }
    }
}

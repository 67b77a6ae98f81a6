package dev.aparikh.solrquery.parser.sparse;

import dev.aparikh.solrquery.exception.SolrQueryConfigurationException;
import dev.aparikh.solrquery.params.CommonParams;
import dev.aparikh.solrquery.params.LocalParams;
import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.WireParams;
import dev.aparikh.solrquery.params.WireValue;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * Filters on a set of exact terms in one field, e.g. a list of product ids.
 *
 * <p>The term set goes into an extra filter query {@code {!terms f=id separator=,}a,b,c}
 * after any common filters; {@code q} defaults to {@code *:*}.</p>
 */
public final class TermsQueryParser extends SparseQueryParser {

    public static final String MATCH_ALL = "*:*";
    public static final String DEFAULT_SEPARATOR = ",";

    private final String field;
    private final List<String> terms;
    private final String separator;
    private final @Nullable Method method;

    private TermsQueryParser(Builder builder) {
        super(builder);
        this.field = ParamChecks.requireText(builder.field, "Terms field");
        if (builder.terms == null || builder.terms.isEmpty()) {
            throw new SolrQueryConfigurationException("Terms list cannot be null or empty");
        }
        this.terms = ParamChecks.copyTexts(builder.terms, "Term");
        if (builder.separator.isEmpty()) {
            throw new SolrQueryConfigurationException("Terms separator cannot be empty");
        }
        this.separator = builder.separator;
        for (String term : terms) {
            if (term.contains(separator)) {
                throw new SolrQueryConfigurationException(
                        "Term '" + term + "' contains the separator '" + separator + "'");
            }
        }
        this.method = builder.method;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected void contributeQuery(WireParams.Builder params) {
        params.append(CommonParams.FILTER_QUERY, termsFilter().render());
    }

    LocalParams termsFilter() {
        return LocalParams.builder("terms")
                .param("f", field)
                .param("separator", separator)
                .param("method", method)
                .body(String.join(separator, terms))
                .build();
    }

    public String field() {
        return field;
    }

    public List<String> terms() {
        return terms;
    }

    public enum Method implements WireValue {
        TERMS_FILTER("termsFilter"),
        BOOLEAN_QUERY("booleanQuery"),
        AUTOMATON("automaton"),
        DOC_VALUES_TERMS_FILTER("docValuesTermsFilter"),
        DOC_VALUES_TERMS_FILTER_PER_SEGMENT("docValuesTermsFilterPerSegment"),
        DOC_VALUES_TERMS_FILTER_TOP_LEVEL("docValuesTermsFilterTopLevel");

        private final String wireValue;

        Method(String wireValue) {
            this.wireValue = wireValue;
        }

        @Override
        public String wireValue() {
            return wireValue;
        }
    }

    public static final class Builder extends SparseQueryParser.Builder<TermsQueryParser, Builder> {

        private @Nullable String field;
        private @Nullable List<String> terms;
        private String separator = DEFAULT_SEPARATOR;
        private @Nullable Method method;

        private Builder() {
            query(MATCH_ALL);
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder field(String field) {
            this.field = field;
            return this;
        }

        public Builder terms(String... terms) {
            this.terms = Arrays.asList(terms);
            return this;
        }

        public Builder terms(List<String> terms) {
            this.terms = terms;
            return this;
        }

        public Builder separator(String separator) {
            this.separator = separator;
            return this;
        }

        public Builder method(Method method) {
            this.method = method;
            return this;
        }

        @Override
        public TermsQueryParser build() {
            return new TermsQueryParser(this);
        }
    }
}

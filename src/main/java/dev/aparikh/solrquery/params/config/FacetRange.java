package dev.aparikh.solrquery.params.config;

import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.WireParams;
import dev.aparikh.solrquery.params.WireValue;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * One range facet, sent as {@code facet.range=<field>} plus per-field
 * {@code f.<field>.facet.range.*} options so several ranges can coexist in one request.
 *
 * @param field   numeric or date field to bucket
 * @param start   lower bound, e.g. {@code 0} or {@code NOW/YEAR-5YEARS}
 * @param end     upper bound
 * @param gap     bucket size, e.g. {@code 100} or {@code +1YEAR}
 * @param hardEnd use {@code end} as the hard upper bound of the last bucket
 * @param other   extra buckets to count beyond the ranges
 * @param include which bounds are inclusive
 * @param method  range faceting implementation
 */
public record FacetRange(
        String field,
        String start,
        String end,
        String gap,
        @Nullable Boolean hardEnd,
        @Nullable List<Other> other,
        @Nullable List<Include> include,
        @Nullable Method method
) {

    public FacetRange {
        ParamChecks.requireText(field, "Range facet field");
        ParamChecks.requireText(start, "Range facet start for '" + field + "'");
        ParamChecks.requireText(end, "Range facet end for '" + field + "'");
        ParamChecks.requireText(gap, "Range facet gap for '" + field + "'");
        other = other == null ? null : List.copyOf(other);
        include = include == null ? null : List.copyOf(include);
    }

    public FacetRange(String field, String start, String end, String gap) {
        this(field, start, end, gap, null, null, null, null);
    }

    public FacetRange withOther(Other... other) {
        return new FacetRange(field, start, end, gap, hardEnd, List.of(other), include, method);
    }

    public FacetRange withInclude(Include... include) {
        return new FacetRange(field, start, end, gap, hardEnd, other, List.of(include), method);
    }

    public FacetRange withHardEnd(boolean hardEnd) {
        return new FacetRange(field, start, end, gap, hardEnd, other, include, method);
    }

    public FacetRange withMethod(Method method) {
        return new FacetRange(field, start, end, gap, hardEnd, other, include, method);
    }

    void contribute(WireParams.Builder params) {
        params.append("facet.range", field);
        String prefix = "f." + field + ".facet.range.";
        params.put(prefix + "start", start)
                .put(prefix + "end", end)
                .put(prefix + "gap", gap)
                .put(prefix + "hardend", hardEnd)
                .put(prefix + "other", other)
                .put(prefix + "include", include)
                .put(prefix + "method", method);
    }

    /**
     * Additional buckets beyond start/end.
     */
    public enum Other implements WireValue {
        BEFORE, AFTER, BETWEEN, NONE, ALL;

        @Override
        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Range boundaries to include. Solr's default is {@code lower}: {@code [lower, upper)}.
     */
    public enum Include implements WireValue {
        LOWER, UPPER, EDGE, OUTER, ALL;

        @Override
        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Method implements WireValue {
        FILTER, DV;

        @Override
        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}

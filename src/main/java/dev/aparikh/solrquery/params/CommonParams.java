package dev.aparikh.solrquery.params;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * Paging, sorting, filtering and request-budget parameters shared by every query parser.
 *
 * <p>Every component defaults to unset ({@code null}) and an unset component never appears
 * on the wire; Solr then applies its own default (e.g. {@code rows=10}, {@code fl=*}).</p>
 *
 * @param sort                  sort expression, e.g. {@code "price asc, score desc"} ({@code sort})
 * @param start                 offset into the result set, &gt;= 0 ({@code start})
 * @param rows                  number of documents to return, &gt;= 0 ({@code rows})
 * @param filters               filter queries, sent as repeated {@code fq}
 * @param fieldList             fields to return, sent comma-joined as {@code fl}
 * @param debug                 debug sections ({@code query}, {@code timing}, {@code results}, {@code all}), repeated {@code debug}
 * @param timeAllowed           search time budget in milliseconds ({@code timeAllowed})
 * @param omitHeader            exclude the response header ({@code omitHeader})
 * @param canCancel             make the query cancellable ({@code canCancel})
 * @param queryUuid             custom id for a cancellable query ({@code queryUUID})
 * @param explainOther          query whose matches get explain info ({@code explainOther})
 * @param partialResults        return partial results when a limit is hit ({@code partialResults})
 * @param cpuAllowed            CPU budget in milliseconds ({@code cpuAllowed})
 * @param maxHitsAllowed        max hits to iterate ({@code maxHitsAllowed})
 * @param memAllowed            memory budget in MiB ({@code memAllowed})
 * @param segmentTerminateEarly early segment termination ({@code segmentTerminateEarly})
 * @param multiThreaded         multi-threaded search ({@code multiThreaded})
 * @param echoParams            which request params to echo in the header ({@code echoParams})
 * @param minExactCount         count hits exactly up to this value ({@code minExactCount})
 * @param logParamsList         comma-separated allowlist of params to log ({@code logParamsList})
 */
public record CommonParams(
        @Nullable String sort,
        @Nullable Integer start,
        @Nullable Integer rows,
        @Nullable List<String> filters,
        @Nullable List<String> fieldList,
        @Nullable List<String> debug,
        @Nullable Integer timeAllowed,
        @Nullable Boolean omitHeader,
        @Nullable Boolean canCancel,
        @Nullable String queryUuid,
        @Nullable String explainOther,
        @Nullable Boolean partialResults,
        @Nullable Integer cpuAllowed,
        @Nullable Integer maxHitsAllowed,
        @Nullable Double memAllowed,
        @Nullable Boolean segmentTerminateEarly,
        @Nullable Boolean multiThreaded,
        @Nullable EchoParams echoParams,
        @Nullable Integer minExactCount,
        @Nullable String logParamsList
) {

    public static final String SORT = "sort";
    public static final String START = "start";
    public static final String ROWS = "rows";
    public static final String FILTER_QUERY = "fq";
    public static final String FIELD_LIST = "fl";
    public static final String DEBUG = "debug";
    public static final String TIME_ALLOWED = "timeAllowed";
    public static final String OMIT_HEADER = "omitHeader";

    private static final CommonParams UNSET = builder().build();

    public CommonParams {
        ParamChecks.requireNonNegative(start, "start");
        ParamChecks.requireNonNegative(rows, "rows");
        ParamChecks.requireNonNegative(timeAllowed, "timeAllowed");
        ParamChecks.requireNonNegative(cpuAllowed, "cpuAllowed");
        ParamChecks.requireNonNegative(maxHitsAllowed, "maxHitsAllowed");
        ParamChecks.requireNonNegative(memAllowed, "memAllowed");
        ParamChecks.requireNonNegative(minExactCount, "minExactCount");
        filters = ParamChecks.copyTexts(filters, "filters");
        fieldList = ParamChecks.copyTexts(fieldList, "fieldList");
        debug = ParamChecks.copyTexts(debug, "debug");
    }

    /**
     * Parameters with nothing set.
     */
    public static CommonParams none() {
        return UNSET;
    }

    /**
     * Renames each set component to its wire key.
     *
     * @return the wire params for every component that is set
     */
    public WireParams flatten() {
        WireParams.Builder params = WireParams.builder()
                .put(SORT, sort)
                .put(START, start)
                .put(ROWS, rows)
                .put(FILTER_QUERY, filters)
                .put(FIELD_LIST, fieldList == null || fieldList.isEmpty() ? null : ParamFormat.commaJoin(fieldList))
                .put(DEBUG, debug)
                .put(TIME_ALLOWED, timeAllowed)
                .put(OMIT_HEADER, omitHeader)
                .put("canCancel", canCancel)
                .put("queryUUID", queryUuid)
                .put("explainOther", explainOther)
                .put("partialResults", partialResults)
                .put("cpuAllowed", cpuAllowed)
                .put("maxHitsAllowed", maxHitsAllowed)
                .put("memAllowed", memAllowed)
                .put("segmentTerminateEarly", segmentTerminateEarly)
                .put("multiThreaded", multiThreaded)
                .put("echoParams", echoParams)
                .put("minExactCount", minExactCount)
                .put("logParamsList", logParamsList);
        return params.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.sort = sort;
        b.start = start;
        b.rows = rows;
        b.filters = filters;
        b.fieldList = fieldList;
        b.debug = debug;
        b.timeAllowed = timeAllowed;
        b.omitHeader = omitHeader;
        b.canCancel = canCancel;
        b.queryUuid = queryUuid;
        b.explainOther = explainOther;
        b.partialResults = partialResults;
        b.cpuAllowed = cpuAllowed;
        b.maxHitsAllowed = maxHitsAllowed;
        b.memAllowed = memAllowed;
        b.segmentTerminateEarly = segmentTerminateEarly;
        b.multiThreaded = multiThreaded;
        b.echoParams = echoParams;
        b.minExactCount = minExactCount;
        b.logParamsList = logParamsList;
        return b;
    }

    /**
     * Values for {@code echoParams}.
     */
    public enum EchoParams implements WireValue {
        EXPLICIT("explicit"),
        ALL("all"),
        NONE("none");

        private final String wireValue;

        EchoParams(String wireValue) {
            this.wireValue = wireValue;
        }

        @Override
        public String wireValue() {
            return wireValue;
        }
    }

    public static class Builder {
        private @Nullable String sort;
        private @Nullable Integer start;
        private @Nullable Integer rows;
        private @Nullable List<String> filters;
        private @Nullable List<String> fieldList;
        private @Nullable List<String> debug;
        private @Nullable Integer timeAllowed;
        private @Nullable Boolean omitHeader;
        private @Nullable Boolean canCancel;
        private @Nullable String queryUuid;
        private @Nullable String explainOther;
        private @Nullable Boolean partialResults;
        private @Nullable Integer cpuAllowed;
        private @Nullable Integer maxHitsAllowed;
        private @Nullable Double memAllowed;
        private @Nullable Boolean segmentTerminateEarly;
        private @Nullable Boolean multiThreaded;
        private @Nullable EchoParams echoParams;
        private @Nullable Integer minExactCount;
        private @Nullable String logParamsList;

        public Builder sort(@Nullable String sort) {
            this.sort = sort;
            return this;
        }

        public Builder start(int start) {
            this.start = start;
            return this;
        }

        public Builder rows(int rows) {
            this.rows = rows;
            return this;
        }

        public Builder filters(@Nullable List<String> filters) {
            this.filters = filters;
            return this;
        }

        public Builder filters(String... filters) {
            return filters(Arrays.asList(filters));
        }

        public Builder fieldList(@Nullable List<String> fieldList) {
            this.fieldList = fieldList;
            return this;
        }

        public Builder fieldList(String... fields) {
            return fieldList(Arrays.asList(fields));
        }

        public Builder debug(@Nullable List<String> debug) {
            this.debug = debug;
            return this;
        }

        public Builder debug(String... debug) {
            return debug(Arrays.asList(debug));
        }

        public Builder timeAllowed(int timeAllowedMillis) {
            this.timeAllowed = timeAllowedMillis;
            return this;
        }

        public Builder omitHeader(boolean omitHeader) {
            this.omitHeader = omitHeader;
            return this;
        }

        public Builder canCancel(boolean canCancel) {
            this.canCancel = canCancel;
            return this;
        }

        public Builder queryUuid(@Nullable String queryUuid) {
            this.queryUuid = queryUuid;
            return this;
        }

        public Builder explainOther(@Nullable String explainOther) {
            this.explainOther = explainOther;
            return this;
        }

        public Builder partialResults(boolean partialResults) {
            this.partialResults = partialResults;
            return this;
        }

        public Builder cpuAllowed(int cpuAllowedMillis) {
            this.cpuAllowed = cpuAllowedMillis;
            return this;
        }

        public Builder maxHitsAllowed(int maxHitsAllowed) {
            this.maxHitsAllowed = maxHitsAllowed;
            return this;
        }

        public Builder memAllowed(double memAllowedMib) {
            this.memAllowed = memAllowedMib;
            return this;
        }

        public Builder segmentTerminateEarly(boolean segmentTerminateEarly) {
            this.segmentTerminateEarly = segmentTerminateEarly;
            return this;
        }

        public Builder multiThreaded(boolean multiThreaded) {
            this.multiThreaded = multiThreaded;
            return this;
        }

        public Builder echoParams(@Nullable EchoParams echoParams) {
            this.echoParams = echoParams;
            return this;
        }

        public Builder minExactCount(int minExactCount) {
            this.minExactCount = minExactCount;
            return this;
        }

        public Builder logParamsList(@Nullable String logParamsList) {
            this.logParamsList = logParamsList;
            return this;
        }

        public CommonParams build() {
            return new CommonParams(sort, start, rows, filters, fieldList, debug, timeAllowed, omitHeader,
                    canCancel, queryUuid, explainOther, partialResults, cpuAllowed, maxHitsAllowed,
                    memAllowed, segmentTerminateEarly, multiThreaded, echoParams, minExactCount,
                    logParamsList);
        }
    }
}

package dev.aparikh.solrquery.parser.spatial;

import dev.aparikh.solrquery.exception.SolrQueryConfigurationException;
import dev.aparikh.solrquery.params.LocalParams;
import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.WireParams;
import dev.aparikh.solrquery.params.WireValue;
import dev.aparikh.solrquery.parser.AbstractQueryParser;
import org.jspecify.annotations.Nullable;

/**
 * Location queries around a center point. The field, point and distance are sent as top-level
 * {@code sfield}, {@code pt} and {@code d}; {@code q} carries only the parser name and its
 * score, filter and cache flags.
 */
public abstract class SpatialQueryParser extends AbstractQueryParser {

    public static final String SPATIAL_FIELD = "sfield";
    public static final String POINT = "pt";
    public static final String DISTANCE = "d";

    private final String spatialField;
    private final GeoPoint center;
    private final double distance;
    private final @Nullable ScoreMode score;
    private final @Nullable Boolean filter;
    private final @Nullable Boolean cache;

    protected SpatialQueryParser(Builder<?, ?> builder) {
        super(builder);
        this.spatialField = ParamChecks.requireText(builder.spatialField, "Spatial field (sfield)");
        this.center = ParamChecks.requirePresent(builder.center, "Center point (pt)");
        Double d = ParamChecks.requirePresent(builder.distance, "Distance (d)");
        if (d.isNaN() || d < 0) {
            throw new SolrQueryConfigurationException("Distance (d) must be >= 0, got " + d);
        }
        this.distance = d;
        this.score = builder.score;
        this.filter = builder.filter;
        this.cache = builder.cache;
    }

    /**
     * Local-params type, {@code geofilt} or {@code bbox}.
     */
    protected abstract String type();

    @Override
    protected final void contribute(WireParams.Builder params) {
        params.put(SPATIAL_FIELD, spatialField)
                .put(POINT, center.render())
                .put(DISTANCE, distance)
                .put(QUERY, localParams().render());
    }

    public LocalParams localParams() {
        return LocalParams.builder(type())
                .param("score", score)
                .param("filter", filter)
                .param("cache", cache)
                .build();
    }

    public String spatialField() {
        return spatialField;
    }

    public GeoPoint center() {
        return center;
    }

    /**
     * Radial distance in kilometers.
     */
    public double distance() {
        return distance;
    }

    /**
     * What the query contributes to the document score.
     */
    public enum ScoreMode implements WireValue {
        NONE("none"),
        KILOMETERS("kilometers"),
        MILES("miles"),
        DEGREES("degrees"),
        DISTANCE("distance"),
        RECIP_DISTANCE("recipDistance"),
        OVERLAP_RATIO("overlapRatio"),
        AREA("area"),
        AREA_2D("area2D");

        private final String wireValue;

        ScoreMode(String wireValue) {
            this.wireValue = wireValue;
        }

        @Override
        public String wireValue() {
            return wireValue;
        }
    }

    public abstract static class Builder<P extends SpatialQueryParser, B extends Builder<P, B>>
            extends AbstractQueryParser.Builder<P, B> {

        private @Nullable String spatialField;
        private @Nullable GeoPoint center;
        private @Nullable Double distance;
        private @Nullable ScoreMode score;
        private @Nullable Boolean filter;
        private @Nullable Boolean cache;

        public B spatialField(String spatialField) {
            this.spatialField = spatialField;
            return self();
        }

        public B center(GeoPoint center) {
            this.center = center;
            return self();
        }

        public B center(double latitude, double longitude) {
            return center(new GeoPoint(latitude, longitude));
        }

        /**
         * Distance in kilometers; {@code 0} matches only the center point.
         */
        public B distance(double distance) {
            this.distance = distance;
            return self();
        }

        public B score(ScoreMode score) {
            this.score = score;
            return self();
        }

        /**
         * {@code false} to use the query for scoring only, without filtering.
         */
        public B filter(boolean filter) {
            this.filter = filter;
            return self();
        }

        public B cache(boolean cache) {
            this.cache = cache;
            return self();
        }
    }
}

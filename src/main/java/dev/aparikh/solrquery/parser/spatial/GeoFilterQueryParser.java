package dev.aparikh.solrquery.parser.spatial;

/**
 * Matches documents within a radius of the center point ({@code geofilt}).
 */
public final class GeoFilterQueryParser extends SpatialQueryParser {

    public static final String GEOFILT = "geofilt";

    private GeoFilterQueryParser(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected String type() {
        return GEOFILT;
    }

    public static final class Builder extends SpatialQueryParser.Builder<GeoFilterQueryParser, Builder> {

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public GeoFilterQueryParser build() {
            return new GeoFilterQueryParser(this);
        }
    }
}

package dev.aparikh.solrquery.parser.spatial;

/**
 * Matches documents inside the box enclosing the {@code geofilt} circle ({@code bbox}). Cheaper
 * than {@link GeoFilterQueryParser} but may include points slightly outside the radius.
 */
public final class BoundingBoxQueryParser extends SpatialQueryParser {

    public static final String BBOX = "bbox";

    private BoundingBoxQueryParser(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected String type() {
        return BBOX;
    }

    public static final class Builder extends SpatialQueryParser.Builder<BoundingBoxQueryParser, Builder> {

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public BoundingBoxQueryParser build() {
            return new BoundingBoxQueryParser(this);
        }
    }
}

package dev.aparikh.solrquery.parser.spatial;

import dev.aparikh.solrquery.exception.SolrQueryConfigurationException;
import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.ParamFormat;

/**
 * Latitude/longitude pair in degrees.
 *
 * @param latitude  in [-90, 90]
 * @param longitude in [-180, 180]
 */
public record GeoPoint(double latitude, double longitude) {

    public GeoPoint {
        if (Double.isNaN(latitude) || Double.isNaN(longitude)) {
            throw new SolrQueryConfigurationException("Coordinates cannot be NaN");
        }
        ParamChecks.requireRange(latitude, -90.0, 90.0, "latitude");
        ParamChecks.requireRange(longitude, -180.0, 180.0, "longitude");
    }

    /**
     * Renders as Solr's {@code pt} value, {@code lat,lon}.
     */
    public String render() {
        return ParamFormat.point(latitude, longitude);
    }
}

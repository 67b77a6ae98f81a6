package dev.aparikh.solrquery.parser.spatial;

import dev.aparikh.solrquery.exception.SolrQueryConfigurationException;
import dev.aparikh.solrquery.params.WireParams;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpatialQueryParserTest {

    @Test
    void shouldSendFieldPointAndDistanceAtTopLevel() {
        WireParams params = GeoFilterQueryParser.builder()
                .spatialField("location")
                .center(40.7128, -74.006)
                .distance(5)
                .rows(10)
                .build()
                .build();

        assertThat(params.get("sfield")).isEqualTo("location");
        assertThat(params.get("pt")).isEqualTo("40.7128,-74.006");
        assertThat(params.get("d")).isEqualTo(5.0);
        assertThat(params.get("q")).isEqualTo("{!geofilt}");
        assertThat(params.get("rows")).isEqualTo(10);
    }

    @Test
    void shouldCarryScoreFilterAndCacheInQuery() {
        WireParams params = BoundingBoxQueryParser.builder()
                .spatialField("location")
                .center(new GeoPoint(51.5, -0.12))
                .distance(2.5)
                .score(SpatialQueryParser.ScoreMode.KILOMETERS)
                .filter(false)
                .cache(true)
                .build()
                .build();

        assertThat(params.get("q")).isEqualTo("{!bbox score=kilometers filter=false cache=true}");
    }

    @Test
    void shouldAcceptZeroDistance() {
        GeoFilterQueryParser parser = GeoFilterQueryParser.builder()
                .spatialField("location")
                .center(0, 0)
                .distance(0)
                .build();

        assertThat(parser.distance()).isZero();
        assertThat(parser.build().get("d")).isEqualTo(0.0);
    }

    @Test
    void shouldRejectNegativeDistance() {
        assertThatThrownBy(() -> GeoFilterQueryParser.builder()
                .spatialField("location")
                .center(0, 0)
                .distance(-0.1)
                .build())
                .isInstanceOf(SolrQueryConfigurationException.class)
                .hasMessageContaining("Distance");
    }

    @Test
    void shouldRequireCenterAndField() {
        assertThatThrownBy(() -> GeoFilterQueryParser.builder().spatialField("location").distance(1).build())
                .isInstanceOf(SolrQueryConfigurationException.class);
        assertThatThrownBy(() -> GeoFilterQueryParser.builder().center(0, 0).distance(1).build())
                .isInstanceOf(SolrQueryConfigurationException.class);
        assertThatThrownBy(() -> GeoFilterQueryParser.builder().spatialField("location").center(0, 0).build())
                .isInstanceOf(SolrQueryConfigurationException.class);
    }

    @Test
    void shouldValidateCoordinates() {
        assertThat(new GeoPoint(90, 180).render()).isEqualTo("90.0,180.0");
        assertThat(new GeoPoint(-90, -180).render()).isEqualTo("-90.0,-180.0");
        assertThatThrownBy(() -> new GeoPoint(90.5, 0)).isInstanceOf(SolrQueryConfigurationException.class);
        assertThatThrownBy(() -> new GeoPoint(0, -180.1)).isInstanceOf(SolrQueryConfigurationException.class);
        assertThatThrownBy(() -> new GeoPoint(Double.NaN, 0)).isInstanceOf(SolrQueryConfigurationException.class);
    }
}

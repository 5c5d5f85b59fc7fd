package com.supplyplanner.solver;

import com.supplyplanner.domain.Location;
import com.supplyplanner.domain.LocationKind;
import com.supplyplanner.domain.TravelMatrix;
import com.supplyplanner.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TravelMatricesTest {

    @Test
    void haversine_newYorkToLosAngeles() {
        TravelMatrix m = TravelMatrices.haversine(List.of(
            Location.builder().id("nyc").kind(LocationKind.WAREHOUSE).latitude(40.7128).longitude(-74.0060).build(),
            Location.builder().id("la").kind(LocationKind.STORE).latitude(34.0522).longitude(-118.2437).build()));

        assertThat(m.get("nyc", "la")).isCloseTo(3936.0, within(5.0));
        assertThat(m.get("la", "nyc")).isEqualTo(m.get("nyc", "la"));
        assertThat(m.get("nyc", "nyc")).isZero();
    }

    @Test
    void haversine_missingCoordinates_throwsValidationException() {
        assertThatThrownBy(() -> TravelMatrices.haversine(List.of(
            Location.builder().id("w").kind(LocationKind.WAREHOUSE).build(),
            Location.builder().id("s").kind(LocationKind.STORE).latitude(1.0).longitude(1.0).build())))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void minutesAtSpeed_convertsAndKeepsBlockedEdges() {
        TravelMatrix km = TravelMatrix.of(List.of("a", "b"), new double[][]{{0, 50}, {Double.POSITIVE_INFINITY, 0}});

        TravelMatrix minutes = TravelMatrices.minutesAtSpeed(km, 50.0);

        assertThat(minutes.get("a", "b")).isCloseTo(60.0, within(1e-9));
        assertThat(minutes.get("b", "a")).isInfinite();
    }
}

package com.fdrsentinel.core.attribution;

import com.fdrsentinel.core.model.Driver;
import com.fdrsentinel.core.model.TimelineScore;
import com.fdrsentinel.core.segmentation.RowSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link DriverRanking}.
 */
class DriverRankingTest {

    private static final List<String> FEATURES = List.of("Pitch (deg)", "Roll (deg)", "Oil Press (psi)");

    @Test
    @DisplayName("Mean error ranking should average over the span and keep feature order on ties")
    void shouldRankByMeanError() {
        TimelineScore timeline = new TimelineScore(new double[4], new double[][] {
                { 9, 9, 9 },
                { 1, 3, 3 },
                { 1, 1, 1 },
                { 9, 9, 9 } });

        List<Driver> drivers = DriverRanking.byMeanError(timeline, FEATURES, 3).rank(new RowSpan(1, 2, false));

        assertThat(drivers)
                .extracting(Driver::getParameter, Driver::getError)
                .containsExactly(
                        tuple("Roll (deg)", 2.0),
                        tuple("Oil Press (psi)", 2.0),
                        tuple("Pitch (deg)", 1.0));
        assertThat(drivers).allSatisfy(d -> assertThat(d.getMaxRobustZ()).isNull());
    }

    @Test
    @DisplayName("Robust ranking should use the largest absolute z and respect the limit")
    void shouldRankByMaxRobustZ() {
        double[][] z = {
                { 0.5, -12.0, 3.0 },
                { 1.0, 2.0, 9.0 } };

        List<Driver> drivers = DriverRanking.byMaxRobustZ(z, FEATURES, 2).rank(new RowSpan(0, 1, false));

        assertThat(drivers)
                .extracting(Driver::getParameter, Driver::getMaxRobustZ)
                .containsExactly(tuple("Roll (deg)", 12.0), tuple("Oil Press (psi)", 9.0));
        assertThat(drivers.get(0).magnitude()).isEqualTo(12.0);
    }
}

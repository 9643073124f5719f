package com.kpisentinel.detection.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.kpisentinel.detection.model.AnomalySeverity;
import com.kpisentinel.detection.model.MetricSeries;
import com.kpisentinel.detection.model.Trend;
import com.kpisentinel.detection.model.TrendChange;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class TrendAnalyzerTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private final TrendAnalyzer analyzer = new TrendAnalyzer();

    @Test
    void reportsMonthOverMonthGrowth() {
        Trend trend = analyzer.analyzeTrend(linear(30, 100, 10), Trend.Period.MOM);

        assertThat(trend.direction()).isEqualTo(Trend.Direction.UP);
        assertThat(trend.significant()).isTrue();
        assertThat(trend.startValue()).isEqualTo(100d);
        assertThat(trend.endValue()).isEqualTo(390d);
        assertThat(trend.absoluteChange()).isEqualTo(290d);
        assertThat(trend.percentageChange()).isCloseTo(290d, within(1e-9));
        assertThat(trend.windowSamples()).isEqualTo(30);
        assertThat(trend.slope()).isCloseTo(10d, within(1e-9));
        assertThat(trend.trendStrength()).isCloseTo(1d, within(1e-9));
        assertThat(trend.severity()).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(trend.confidence()).isBetween(0d, 1d);
    }

    @Test
    void weekOverWeekStartsAtFirstPointInsideWindow() {
        Trend trend = analyzer.analyzeTrend(linear(30, 100, 10), Trend.Period.WOW);

        assertThat(trend.startValue()).isEqualTo(320d);
        assertThat(trend.startTimestamp()).isEqualTo(START.plus(Duration.ofDays(22)));
        assertThat(trend.endTimestamp()).isEqualTo(START.plus(Duration.ofDays(29)));
        assertThat(trend.windowSamples()).isEqualTo(8);
        assertThat(trend.percentageChange()).isCloseTo(21.875, within(1e-9));
    }

    @Test
    void reportsDecline() {
        Trend trend = analyzer.analyzeTrend(linear(14, 200, -5), Trend.Period.WOW);

        assertThat(trend.direction()).isEqualTo(Trend.Direction.DOWN);
        assertThat(trend.absoluteChange()).isEqualTo(-35d);
        assertThat(trend.percentageChange()).isNegative();
    }

    @Test
    void smallChangeIsNotSignificant() {
        MetricSeries series = MetricSeries.daily("m", START, 100, 101, 102, 103, 104, 105);

        Trend trend = analyzer.analyzeTrend(series, Trend.Period.WOW);

        assertThat(trend.direction()).isEqualTo(Trend.Direction.UP);
        assertThat(trend.percentageChange()).isCloseTo(5d, within(1e-9));
        assertThat(trend.significant()).isFalse();
    }

    @Test
    void flatSeriesIsStable() {
        Trend trend = analyzer.analyzeTrend(MetricSeries.daily("m", START, 5, 5, 5, 5), Trend.Period.WOW);

        assertThat(trend.direction()).isEqualTo(Trend.Direction.STABLE);
        assertThat(trend.percentageChange()).isZero();
        assertThat(trend.significant()).isFalse();
    }

    @Test
    void zeroStartValueYieldsZeroPercent() {
        Trend trend = analyzer.analyzeTrend(MetricSeries.daily("m", START, 0, 3, 8), Trend.Period.WOW);

        assertThat(trend.direction()).isEqualTo(Trend.Direction.UP);
        assertThat(trend.absoluteChange()).isEqualTo(8d);
        assertThat(trend.percentageChange()).isZero();
        assertThat(trend.significant()).isFalse();
        assertThat(Double.isFinite(trend.confidence())).isTrue();
    }

    @Test
    void tooFewPointsYieldFlatTrend() {
        Trend empty = analyzer.analyzeTrend(MetricSeries.daily("m", START), Trend.Period.MOM);
        Trend single = analyzer.analyzeTrend(MetricSeries.daily("m", START, 42), Trend.Period.MOM);

        assertThat(empty.significant()).isFalse();
        assertThat(empty.absoluteChange()).isZero();
        assertThat(single.direction()).isEqualTo(Trend.Direction.STABLE);
        assertThat(single.percentageChange()).isZero();
        assertThat(single.startValue()).isEqualTo(42d);
    }

    @Test
    void analyzesEachRequestedPeriod() {
        List<Trend> trends = analyzer.analyzeTrends(linear(100, 50, 1), List.of(Trend.Period.WOW, Trend.Period.MOM, Trend.Period.YOY));

        assertThat(trends).extracting(Trend::period)
                .containsExactly(Trend.Period.WOW, Trend.Period.MOM, Trend.Period.YOY);
        assertThat(trends).allSatisfy(trend -> assertThat(trend.confidence()).isBetween(0d, 1d));
    }

    @Test
    void confidenceGrowsWithChangeAndCoverage() {
        assertThat(analyzer.calculateConfidence(40, 0.5, 10)).isGreaterThan(analyzer.calculateConfidence(20, 0.5, 10));
        assertThat(analyzer.calculateConfidence(20, 0.5, 25)).isGreaterThan(analyzer.calculateConfidence(20, 0.5, 10));
        assertThat(analyzer.calculateConfidence(-1e6, 1.0, 1_000)).isBetween(0d, 1d);
        assertThat(analyzer.calculateConfidence(0, 0, 0)).isZero();
    }

    @Test
    void findsSlopeReversal() {
        double[] values = new double[20];
        for (int i = 0; i < values.length; i++) {
            values[i] = i < 10 ? 10 - i : i - 8;
        }

        List<TrendChange> changes = analyzer.detectTrendChanges(MetricSeries.daily("m", START, values), 4);

        assertThat(changes)
                .filteredOn(change -> change.index() == 10)
                .singleElement()
                .satisfies(change -> {
                    assertThat(change.previousSlope()).isNegative();
                    assertThat(change.nextSlope()).isPositive();
                });
        assertThat(analyzer.detectTrendChanges(linear(30, 1, 1), 4)).isEmpty();
        assertThat(analyzer.detectTrendChanges(linear(7, 1, 1), 4)).isEmpty();
        assertThatThrownBy(() -> analyzer.detectTrendChanges(linear(7, 1, 1), 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reportsZeroPercentWhenStartValueIsTooSmallForARatio() {
        Trend trend = analyzer.analyzeTrend(MetricSeries.daily("m", START, 1e-320, 5), Trend.Period.WOW);

        assertThat(trend.percentageChange()).isZero();
        assertThat(trend.significant()).isFalse();
        assertThat(trend.direction()).isEqualTo(Trend.Direction.UP);
    }

    @Test
    void findsReversalAtTheLastPossibleIndex() {
        List<TrendChange> changes = analyzer.detectTrendChanges(
                MetricSeries.daily("m", START, 4, 3, 2, 1, 2, 3, 4, 5), 4);

        assertThat(changes).extracting(TrendChange::index).containsExactly(4);
    }

    @Test
    void forecastsAlongFittedLine() {
        assertThat(analyzer.forecastNextValue(linear(30, 100, 10), 1)).isCloseTo(400d, within(1e-6));
        assertThat(analyzer.forecastNextValue(MetricSeries.daily("m", START), 3)).isZero();
    }

    private static MetricSeries linear(int size, double intercept, double step) {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = intercept + i * step;
        }
        return MetricSeries.daily("m", START, values);
    }
}

package com.phillippitts.scalogram.service.render;

import com.phillippitts.scalogram.domain.AxisTick;
import com.phillippitts.scalogram.domain.ScaleSet;
import com.phillippitts.scalogram.domain.VerticalAxis;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AxisTickCalculatorTest {

    @Test
    void timeTicksShouldUseRoundSteps() {
        List<AxisTick> ticks = AxisTickCalculator.timeTicks(1001, 100.0, 1001);

        assertThat(ticks).extracting(AxisTick::label).containsExactly("0", "2", "4", "6", "8", "10");
        assertThat(ticks).extracting(AxisTick::pixel).containsExactly(0, 200, 400, 600, 800, 1000);
    }

    @Test
    void timeTickPixelsShouldFollowPooledWidth() {
        List<AxisTick> ticks = AxisTickCalculator.timeTicks(1001, 100.0, 100);

        assertThat(ticks.get(ticks.size() - 1).pixel()).isEqualTo(99);
        assertThat(ticks.get(1).pixel()).isEqualTo(19);
    }

    @Test
    void subSecondDurationsShouldGetDecimals() {
        List<AxisTick> ticks = AxisTickCalculator.timeTicks(101, 1000.0, 101);

        assertThat(ticks).extracting(AxisTick::label).startsWith("0.00", "0.02");
    }

    @Test
    void singleSampleShouldYieldOriginTick() {
        assertThat(AxisTickCalculator.timeTicks(1, 10.0, 1)).containsExactly(new AxisTick(0, 0.0, "0"));
    }

    @Test
    void niceStepShouldRoundUpToOneTwoOrFive() {
        assertThat(AxisTickCalculator.niceStep(1.667)).isCloseTo(2.0, within(1e-12));
        assertThat(AxisTickCalculator.niceStep(0.3)).isCloseTo(0.5, within(1e-12));
        assertThat(AxisTickCalculator.niceStep(7.0)).isCloseTo(10.0, within(1e-12));
        assertThat(AxisTickCalculator.niceStep(100.0)).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void verticalTicksShouldSpanAllRows() {
        ScaleSet scales = ScaleSet.geometric(1.0, 128.0, 8);

        List<AxisTick> ticks = AxisTickCalculator.verticalTicks(scales, VerticalAxis.SCALE, 1.0, 100.0);

        assertThat(ticks).hasSize(AxisTickCalculator.MAX_VERTICAL_TICKS);
        assertThat(ticks.get(0).pixel()).isZero();
        assertThat(ticks.get(0).value()).isCloseTo(128.0, within(1e-9));
        assertThat(ticks.get(0).label()).isEqualTo("128");
        assertThat(ticks.get(ticks.size() - 1).pixel()).isEqualTo(scales.size() - 1);
        assertThat(ticks.get(ticks.size() - 1).label()).isEqualTo("1.00");
    }

    @Test
    void frequencyTicksShouldStartAtHighestFrequency() {
        ScaleSet scales = ScaleSet.of(1.0, 2.0, 4.0);

        List<AxisTick> ticks = AxisTickCalculator.verticalTicks(scales, VerticalAxis.FREQUENCY, 0.5, 100.0);

        assertThat(ticks).extracting(AxisTick::value).containsExactly(50.0, 25.0, 12.5);
        assertThat(ticks).extracting(AxisTick::label).containsExactly("50.0", "25.0", "12.5");
    }

    @Test
    void scaleIndexForRowShouldDependOnAxis() {
        assertThat(AxisTickCalculator.scaleIndexForRow(0, 5, VerticalAxis.SCALE)).isEqualTo(4);
        assertThat(AxisTickCalculator.scaleIndexForRow(0, 5, VerticalAxis.FREQUENCY)).isZero();
    }
}

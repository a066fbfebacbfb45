package com.aquifer.wellfield.engine;

import com.aquifer.wellfield.domain.AquiferParameters;
import com.aquifer.wellfield.domain.ConstraintPoint;
import com.aquifer.wellfield.domain.DrawdownMethod;
import com.aquifer.wellfield.domain.PumpingWell;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SuperpositionEngineTest {

    private static final AquiferParameters AQUIFER = AquiferParameters.of(500.0, 0.0002);
    private static final double TOL = 1e-12;

    private static List<PumpingWell> threeWells(double scale) {
        return List.of(
                new PumpingWell(0, 0, 1000 * scale),
                new PumpingWell(300, 0, 800 * scale),
                new PumpingWell(150, 260, 900 * scale));
    }

    @Test
    @DisplayName("Two-well scenario: total at (250,0), t=10 equals the sum of individual Theis drawdowns")
    void twoWellScenario() {
        PumpingWell w1 = new PumpingWell(0, 0, 1000);
        PumpingWell w2 = new PumpingWell(500, 0, 800);

        double total = SuperpositionEngine.drawdown(List.of(w1, w2), 250, 0, 10.0, AQUIFER, DrawdownMethod.THEIS);

        double s1 = WellFunctions.theis(250.0, 10.0, 1000, 500.0, 0.0002);
        double s2 = WellFunctions.theis(250.0, 10.0, 800, 500.0, 0.0002);
        assertEquals(s1 + s2, total, TOL);
        assertEquals(1.948391152532447, total, 1e-9);
    }

    @ParameterizedTest
    @EnumSource(DrawdownMethod.class)
    @DisplayName("Linearity: drawdown(alpha Q) == alpha drawdown(Q)")
    void linearityInRate(DrawdownMethod method) {
        double base = SuperpositionEngine.drawdown(threeWells(1.0), 200, 100, 10.0, AQUIFER, method);
        for (double alpha : new double[]{0.25, 1.7, 10.0}) {
            double scaled = SuperpositionEngine.drawdown(threeWells(alpha), 200, 100, 10.0, AQUIFER, method);
            assertEquals(alpha * base, scaled, Math.abs(alpha * base) * 1e-12);
        }
    }

    @ParameterizedTest
    @EnumSource(DrawdownMethod.class)
    @DisplayName("Additivity: field drawdown equals the sum over single-well fields")
    void additivity(DrawdownMethod method) {
        PumpingWell a = new PumpingWell(0, 0, 1200);
        PumpingWell b = new PumpingWell(400, -50, 600);
        double[][] points = {{100, 0}, {-300, 250}, {400, -50}, {1000, 1000}};
        for (double[] p : points) {
            double both = SuperpositionEngine.drawdown(List.of(a, b), p[0], p[1], 30.0, AQUIFER, method);
            double sum = SuperpositionEngine.drawdown(List.of(a), p[0], p[1], 30.0, AQUIFER, method)
                    + SuperpositionEngine.drawdown(List.of(b), p[0], p[1], 30.0, AQUIFER, method);
            assertEquals(sum, both, 1e-12);
        }
    }

    @Test
    @DisplayName("Monotonicity: raising one well's rate never lowers drawdown anywhere")
    void monotoneInSingleRate() {
        double[] xs = {-500, 0, 150, 300, 800};
        double[] ys = {0, 100, 260, -40, 800};
        double[] before = SuperpositionEngine.drawdown(threeWells(1.0), xs, ys, 10.0, AQUIFER, DrawdownMethod.THEIS);

        List<PumpingWell> raised = List.of(
                new PumpingWell(0, 0, 1000),
                new PumpingWell(300, 0, 1600),
                new PumpingWell(150, 260, 900));
        double[] after = SuperpositionEngine.drawdown(raised, xs, ys, 10.0, AQUIFER, DrawdownMethod.THEIS);

        for (int j = 0; j < xs.length; j++) {
            assertTrue(after[j] >= before[j], "point " + j);
        }
    }

    @Test
    @DisplayName("Distance is floored at the well radius, so drawdown at the well is finite")
    void distanceFlooredAtRadius() {
        PumpingWell well = PumpingWell.builder().x(10).y(10).rate(1000).radius(0.15).build();
        double atCentre = SuperpositionEngine.drawdown(List.of(well), 10, 10, 1.0, AQUIFER, DrawdownMethod.THEIS);
        double atRadius = WellFunctions.theis(0.15, 1.0, 1000, 500.0, 0.0002);
        assertEquals(atRadius, atCentre, TOL);
        assertTrue(Double.isFinite(atCentre));
    }

    @Test
    @DisplayName("Parallel evaluation over points gives identical values")
    void parallelMatchesSequential() {
        int n = 200;
        double[] xs = new double[n];
        double[] ys = new double[n];
        for (int j = 0; j < n; j++) {
            xs[j] = -1000 + 10.0 * j;
            ys[j] = 0.5 * j;
        }
        double[] sequential = SuperpositionEngine.drawdown(threeWells(1.0), xs, ys, 5.0, AQUIFER,
                DrawdownMethod.THEIS, false);
        double[] parallel = SuperpositionEngine.drawdown(threeWells(1.0), xs, ys, 5.0, AQUIFER,
                DrawdownMethod.THEIS, true);
        assertArrayEquals(sequential, parallel, 0.0);
    }

    @Test
    @DisplayName("Unit response times rates reproduces drawdown at constraint points")
    void unitResponseConsistentWithDrawdown() {
        List<PumpingWell> wells = threeWells(1.0);
        List<ConstraintPoint> points = List.of(
                ConstraintPoint.withMinHead(250, 200, 45),
                ConstraintPoint.withMinHead(400, 400, 45));
        double[] rates = {1000, 800, 900};

        double[][] a = SuperpositionEngine.unitResponse(wells, points, 100.0, AQUIFER, DrawdownMethod.COOPER_JACOB);
        double[] s = SuperpositionEngine.drawdownAtPoints(wells, rates, points, 100.0, AQUIFER,
                DrawdownMethod.COOPER_JACOB);

        for (int j = 0; j < points.size(); j++) {
            double expected = 0.0;
            for (int i = 0; i < wells.size(); i++) {
                expected += a[j][i] * rates[i];
            }
            assertEquals(expected, s[j], 1e-10);
            assertEquals(SuperpositionEngine.drawdown(wells, points.get(j).getX(), points.get(j).getY(), 100.0,
                    AQUIFER, DrawdownMethod.COOPER_JACOB), s[j], 1e-10);
        }
    }

    @Test
    @DisplayName("Mismatched coordinate arrays are rejected")
    void mismatchedArraysRejected() {
        assertThrows(IllegalArgumentException.class, () -> SuperpositionEngine.drawdown(threeWells(1.0),
                new double[]{1, 2}, new double[]{1}, 1.0, AQUIFER, DrawdownMethod.THEIS));
    }
}

package com.aquifer.wellfield;

import com.aquifer.wellfield.domain.AllocationEvaluation;
import com.aquifer.wellfield.domain.AllocationProblem;
import com.aquifer.wellfield.domain.AquiferParameters;
import com.aquifer.wellfield.domain.ConstraintPoint;
import com.aquifer.wellfield.domain.DrawdownMethod;
import com.aquifer.wellfield.domain.FeasibleRegion;
import com.aquifer.wellfield.domain.OptimizationMethod;
import com.aquifer.wellfield.domain.OptimizationResult;
import com.aquifer.wellfield.domain.PumpingWell;
import com.aquifer.wellfield.domain.SitingProblem;
import com.aquifer.wellfield.domain.SitingResult;
import com.aquifer.wellfield.domain.WellField;
import com.aquifer.wellfield.service.WellfieldService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Water-supply scenario: four wells, three ecologically sensitive points, 100 days of pumping.
 * Enabled with {@code wellfield.demo.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "wellfield.demo.enabled", havingValue = "true")
public class DemoRunner implements CommandLineRunner {

    private final WellfieldService service;

    public DemoRunner(WellfieldService service) {
        this.service = service;
    }

    @Override
    public void run(String... args) {
        System.out.println("=== WELLFIELD ALLOCATION DEMO ===");

        AquiferParameters aquifer = AquiferParameters.of(500.0, 0.0002); // T m2/day, S
        double h0 = 50.0;
        double hMin = 45.0;
        double t = 100.0;

        WellField field = WellField.of("Supply field",
                new PumpingWell("W1", 0, 0, 1500, null),
                new PumpingWell("W2", 500, 0, 1500, null),
                new PumpingWell("W3", 250, 433, 1500, null),
                new PumpingWell("W4", 500, 866, 1500, null));
        double[] maxRates = {1500, 1500, 1500, 1500};

        List<ConstraintPoint> points = List.of(
                ConstraintPoint.withMinHead("P1", 250, 200, hMin),
                ConstraintPoint.withMinHead("P2", 400, 400, hMin),
                ConstraintPoint.withMinHead("P3", 250, 650, hMin));

        // 1. Every well at Q_max, no optimization
        AllocationEvaluation unconstrained = service.evaluateAllocation(field, aquifer, h0, points, t,
                DrawdownMethod.COOPER_JACOB);
        System.out.printf("%nAll wells at Q_max: total %.0f m3/day%n", unconstrained.getTotalRate());
        printHeads(points, unconstrained.getConstraintHeads(), hMin);

        AllocationProblem problem = AllocationProblem.builder()
                .wellField(field)
                .aquifer(aquifer)
                .initialHead(h0)
                .maxRates(maxRates)
                .constraintPoints(points)
                .time(t)
                .build();

        // 2. Linear program (Cooper-Jacob)  3. Sequential LP (Theis)
        for (OptimizationMethod method : OptimizationMethod.values()) {
            OptimizationResult result = service.optimizeAllocation(problem, method, null);
            System.out.printf("%n--- %s: %s ---%n", method, result.getStatus());
            System.out.println(result.getMessage());
            if (result.isSuccess()) {
                double[] rates = result.getRates();
                for (int i = 0; i < rates.length; i++) {
                    System.out.printf("  %s: %.0f m3/day%n", field.getWells().get(i).getName(), rates[i]);
                }
                System.out.printf("  Total: %.0f m3/day%n", result.getTotalRate());
                printHeads(points, result.getConstraintHeads(), hMin);
            }
        }

        // 4. Siting: where should 3 wells go to deliver 3000 m3/day?
        SitingProblem siting = SitingProblem.builder()
                .wellCount(3)
                .region(new FeasibleRegion(-1000, 1500, -1000, 1500))
                .totalDemand(3000)
                .aquifer(aquifer)
                .initialHead(h0)
                .constraintPoints(points)
                .time(t)
                .maxIterations(2000)
                .build();
        SitingResult sited = service.searchSiting(siting, null, 42L);
        System.out.printf("%n--- SITING ---%n%s%n", sited.getMessage());
        sited.getWells().forEach(w -> System.out.printf("  %s at (%.0f, %.0f), Q=%.0f%n",
                w.getName(), w.getX(), w.getY(), w.getRate()));
    }

    private static void printHeads(List<ConstraintPoint> points, double[] heads, double hMin) {
        for (int j = 0; j < heads.length; j++) {
            System.out.printf("  %s: h = %.2f m %s%n", points.get(j).getName(), heads[j],
                    heads[j] >= hMin - 1e-6 ? "OK" : "VIOLATED");
        }
    }
}

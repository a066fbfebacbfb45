package com.aquifer.wellfield.domain;

import com.aquifer.wellfield.exception.InvalidParameterException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WellFieldTest {

    private static final AquiferParameters AQUIFER = AquiferParameters.of(500.0, 0.0002);

    private WellField field;

    @BeforeEach
    void setUp() {
        field = new WellField("Example field");
        field.addWell(new PumpingWell("Well-1", 0, 0, 1000, null));
        field.addWell(new PumpingWell("Well-2", 300, 0, 800, null));
        field.addWell(new PumpingWell("Well-3", 150, 260, 900, null));
    }

    @Test
    @DisplayName("Total pumping is the sum of member rates")
    void totalPumping() {
        assertEquals(2700.0, field.getTotalPumping(), 1e-12);
        assertEquals(3, field.size());
    }

    @Test
    @DisplayName("Coordinate and rate arrays follow insertion order")
    void arrays() {
        assertArrayEquals(new double[]{0, 300, 150}, field.xs());
        assertArrayEquals(new double[]{0, 0, 260}, field.ys());
        assertArrayEquals(new double[]{1000, 800, 900}, field.rates());
        assertArrayEquals(new double[]{0.1, 0.1, 0.1}, field.radii());
    }

    @Test
    @DisplayName("Unnamed wells get a generated name; duplicate names are rejected")
    void naming() {
        PumpingWell stored = field.addWell(new PumpingWell(900, 900, 100));
        assertEquals("Well-4", stored.getName());
        assertTrue(field.getWell("Well-4").isPresent());

        assertThrows(InvalidParameterException.class,
                () -> field.addWell(new PumpingWell("Well-1", 5, 5, 10, null)));
    }

    @Test
    @DisplayName("Generated names skip names already taken by the caller")
    void generatedNameSkipsTakenNames() {
        WellField request = new WellField("request", List.of(
                new PumpingWell("Well-2", 0, 0, 10, null),
                new PumpingWell(100, 0, 10)));

        assertEquals(2, request.size());
        assertTrue(request.getWell("Well-2").isPresent());
        assertTrue(request.getWell("Well-3").isPresent());
    }

    @Test
    @DisplayName("Generated names stay unique after a removal")
    void generatedNameAfterRemoval() {
        field.removeWell("Well-1");
        PumpingWell stored = field.addWell(new PumpingWell(900, 900, 100));

        assertEquals("Well-4", stored.getName());
        assertEquals(3, field.size());
    }

    @Test
    @DisplayName("Changing the rate does not change a well's identity")
    void rateNotPartOfIdentity() {
        PumpingWell well = field.getWell("Well-1").orElseThrow();
        Set<PumpingWell> set = new HashSet<>(List.of(well));
        int hash = well.hashCode();

        well.setRate(1234.0);

        assertEquals(hash, well.hashCode());
        assertTrue(set.contains(well));
        assertEquals(well, well.withRate(1.0));
    }

    @Test
    @DisplayName("Removing a well updates the total")
    void removeWell() {
        assertTrue(field.removeWell("Well-2"));
        assertFalse(field.removeWell("missing"));
        assertEquals(1900.0, field.getTotalPumping(), 1e-12);
    }

    @Test
    @DisplayName("withRates returns a new field and leaves the original untouched")
    void withRates() {
        WellField updated = field.withRates(new double[]{1, 2, 3});
        assertArrayEquals(new double[]{1, 2, 3}, updated.rates());
        assertArrayEquals(new double[]{1000, 800, 900}, field.rates());
        assertThrows(InvalidParameterException.class, () -> field.withRates(new double[]{1}));
    }

    @Test
    @DisplayName("Total drawdown equals the sum of each well's own contribution")
    void totalDrawdownIsSumOfContributions() {
        double x = 200;
        double y = 100;
        double total = field.computeTotalDrawdown(x, y, 10.0, AQUIFER, DrawdownMethod.THEIS);
        double sum = field.getWells().stream()
                .mapToDouble(w -> w.drawdownAt(x, y, 10.0, AQUIFER, DrawdownMethod.THEIS))
                .sum();
        assertEquals(sum, total, 1e-12);

        double[] arrayTotal = field.computeTotalDrawdown(new double[]{x}, new double[]{y}, 10.0, AQUIFER,
                DrawdownMethod.THEIS);
        assertEquals(total, arrayTotal[0], 1e-12);
    }

    @Test
    @DisplayName("An empty field cannot be solved")
    void emptyFieldRejected() {
        WellField empty = new WellField("empty");
        assertThrows(InvalidParameterException.class,
                () -> empty.computeTotalDrawdown(0, 0, 1.0, AQUIFER, DrawdownMethod.THEIS));
    }
}

package com.aquifer.wellfield.domain;

import com.aquifer.wellfield.engine.SuperpositionEngine;
import com.aquifer.wellfield.exception.InvalidParameterException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered collection of pumping wells with unique names. Owns no aquifer state.
 */
public class WellField {

    @Getter
    private final String name;
    private final List<PumpingWell> wells = new ArrayList<>();

    public WellField(String name) {
        this.name = name;
    }

    public WellField(String name, List<PumpingWell> wells) {
        this(name);
        wells.forEach(this::addWell);
    }

    /**
     * Adds a well, naming it {@code Well-<n>} when it has no name, with n the first index from
     * {@code size() + 1} upward that no other well uses.
     *
     * @return the stored well
     * @throws InvalidParameterException if another well already uses the name
     */
    public PumpingWell addWell(PumpingWell well) {
        InvalidParameterException.require(well != null, "Well cannot be null");
        PumpingWell stored = well;
        if (well.getName() == null || well.getName().isBlank()) {
            int index = wells.size() + 1;
            while (getWell("Well-" + index).isPresent()) {
                index++;
            }
            stored = well.withName("Well-" + index);
        }
        String wellName = stored.getName();
        InvalidParameterException.require(getWell(wellName).isEmpty(),
                "Duplicate well name in field: " + wellName);
        wells.add(stored);
        return stored;
    }

    public boolean removeWell(String wellName) {
        return wells.removeIf(w -> w.getName().equals(wellName));
    }

    public Optional<PumpingWell> getWell(String wellName) {
        return wells.stream().filter(w -> w.getName().equals(wellName)).findFirst();
    }

    public List<PumpingWell> getWells() {
        return Collections.unmodifiableList(wells);
    }

    public int size() {
        return wells.size();
    }

    public boolean isEmpty() {
        return wells.isEmpty();
    }

    public double getTotalPumping() {
        return wells.stream().mapToDouble(PumpingWell::getRate).sum();
    }

    public double[] xs() {
        return wells.stream().mapToDouble(PumpingWell::getX).toArray();
    }

    public double[] ys() {
        return wells.stream().mapToDouble(PumpingWell::getY).toArray();
    }

    public double[] rates() {
        return wells.stream().mapToDouble(PumpingWell::getRate).toArray();
    }

    public double[] radii() {
        return wells.stream().mapToDouble(PumpingWell::getRadius).toArray();
    }

    /**
     * Same geometry, new rate vector. This field is left untouched.
     */
    public WellField withRates(double[] newRates) {
        InvalidParameterException.require(newRates != null && newRates.length == wells.size(),
                "Rate vector length must equal well count " + wells.size());
        WellField copy = new WellField(name);
        for (int i = 0; i < wells.size(); i++) {
            copy.wells.add(wells.get(i).withRate(newRates[i]));
        }
        return copy;
    }

    public double computeTotalDrawdown(double x, double y, double t, AquiferParameters aquifer, DrawdownMethod method) {
        requireWells();
        return SuperpositionEngine.drawdown(wells, x, y, t, aquifer, method);
    }

    public double[] computeTotalDrawdown(double[] xs, double[] ys, double t, AquiferParameters aquifer,
                                         DrawdownMethod method) {
        requireWells();
        return SuperpositionEngine.drawdown(wells, xs, ys, t, aquifer, method);
    }

    private void requireWells() {
        InvalidParameterException.require(!wells.isEmpty(), "Well field '" + name + "' has no wells");
    }

    public static WellField of(String name, PumpingWell... wells) {
        return new WellField(name, List.of(wells));
    }
}

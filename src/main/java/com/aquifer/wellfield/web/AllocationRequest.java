package com.aquifer.wellfield.web;

import com.aquifer.wellfield.domain.AllocationProblem;
import com.aquifer.wellfield.domain.AquiferParameters;
import com.aquifer.wellfield.domain.ConstraintPoint;
import com.aquifer.wellfield.domain.OptimizationMethod;
import com.aquifer.wellfield.domain.WellField;
import com.aquifer.wellfield.exception.InvalidParameterException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AllocationRequest {
    private OptimizationMethod method; // LINEAR when absent
    private List<WellDto> wells;
    private double transmissivity;
    private double storativity;
    private double initialHead;
    private double[] maxRates;
    private List<ConstraintPointDto> constraintPoints;
    private double time;
    private SolverSettingsDto settings; // configured defaults for absent fields

    public AllocationProblem toProblem() {
        InvalidParameterException.require(wells != null && !wells.isEmpty(), "Allocation requires at least one well");
        InvalidParameterException.require(constraintPoints != null, "Allocation requires constraint points");
        WellField field = new WellField("request",
                wells.stream().map(WellDto::toDomain).collect(Collectors.toList()));
        List<ConstraintPoint> points = constraintPoints.stream()
                .map(ConstraintPointDto::toDomain)
                .collect(Collectors.toList());
        return AllocationProblem.builder()
                .wellField(field)
                .aquifer(AquiferParameters.of(transmissivity, storativity))
                .initialHead(initialHead)
                .maxRates(maxRates)
                .constraintPoints(points)
                .time(time)
                .build();
    }
}

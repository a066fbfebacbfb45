package com.aquifer.wellfield.web;

import com.aquifer.wellfield.domain.AquiferParameters;
import com.aquifer.wellfield.domain.FeasibleRegion;
import com.aquifer.wellfield.domain.SitingProblem;
import com.aquifer.wellfield.exception.InvalidParameterException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SitingRequest {
    private int wellCount;
    private double minX;
    private double maxX;
    private double minY;
    private double maxY;
    private double totalDemand;
    private double[] rateShares;
    private double transmissivity;
    private double storativity;
    private double initialHead;
    private List<ConstraintPointDto> constraintPoints;
    private double time;
    private int maxIterations; // configured default when 0
    private Long seed;
    private SolverSettingsDto settings; // configured defaults for absent fields

    public SitingProblem toProblem() {
        InvalidParameterException.require(constraintPoints != null, "Siting requires constraint points");
        return SitingProblem.builder()
                .wellCount(wellCount)
                .region(new FeasibleRegion(minX, maxX, minY, maxY))
                .totalDemand(totalDemand)
                .rateShares(rateShares)
                .aquifer(AquiferParameters.of(transmissivity, storativity))
                .initialHead(initialHead)
                .constraintPoints(constraintPoints.stream()
                        .map(ConstraintPointDto::toDomain)
                        .collect(Collectors.toList()))
                .time(time)
                .maxIterations(maxIterations)
                .build();
    }
}

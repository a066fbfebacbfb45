package com.aquifer.wellfield.web;

import com.aquifer.wellfield.domain.AquiferParameters;
import com.aquifer.wellfield.domain.OptimizationMethod;
import com.aquifer.wellfield.domain.OptimizationResult;
import com.aquifer.wellfield.domain.SitingResult;
import com.aquifer.wellfield.domain.SolverSettings;
import com.aquifer.wellfield.domain.WellField;
import com.aquifer.wellfield.exception.InvalidParameterException;
import com.aquifer.wellfield.service.WellfieldService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class WellfieldController {

    private final WellfieldService wellfieldService;

    // Infeasible / not converged is still 200: the result body carries success=false
    @PostMapping("/allocation")
    public ResponseEntity<OptimizationResult> optimize(@RequestBody AllocationRequest request) {
        OptimizationResult result = wellfieldService.optimizeAllocation(
                request.toProblem(),
                request.getMethod() == null ? OptimizationMethod.LINEAR : request.getMethod(),
                resolveSettings(request.getSettings())
        );
        return ResponseEntity.ok(result);
    }

    @PostMapping("/siting")
    public ResponseEntity<SitingResult> site(@RequestBody SitingRequest request) {
        SitingResult result = wellfieldService.searchSiting(
                request.toProblem(),
                resolveSettings(request.getSettings()),
                request.getSeed()
        );
        return ResponseEntity.ok(result);
    }

    @PostMapping("/drawdown")
    public ResponseEntity<DrawdownResponse> drawdown(@RequestBody DrawdownRequest request) {
        InvalidParameterException.require(request.getWells() != null && !request.getWells().isEmpty(),
                "At least one well is required");
        InvalidParameterException.require(request.getXs() != null && request.getYs() != null,
                "Observation coordinates are required");
        WellField field = new WellField("request",
                request.getWells().stream().map(WellDto::toDomain).collect(Collectors.toList()));
        double[] s = wellfieldService.drawdown(field, request.getXs(), request.getYs(), request.getTime(),
                AquiferParameters.of(request.getTransmissivity(), request.getStorativity()), request.getMethod());
        return ResponseEntity.ok(new DrawdownResponse(field.getTotalPumping(), s));
    }

    private SolverSettings resolveSettings(SolverSettingsDto overrides) {
        return overrides == null ? null : overrides.applyTo(wellfieldService.defaultSettings());
    }
}

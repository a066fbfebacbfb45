package com.aquifer.wellfield.web;

import com.aquifer.wellfield.domain.PumpingWell;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WellDto {
    private String name;
    private double x;
    private double y;
    private double rate;
    private Double radius; // defaults to PumpingWell.DEFAULT_RADIUS

    public PumpingWell toDomain() {
        return new PumpingWell(name, x, y, rate, radius);
    }
}

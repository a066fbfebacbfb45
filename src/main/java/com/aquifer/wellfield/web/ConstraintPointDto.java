package com.aquifer.wellfield.web;

import com.aquifer.wellfield.domain.ConstraintPoint;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConstraintPointDto {
    private String name;
    private double x;
    private double y;
    // exactly one of the two
    private Double minHead;
    private Double maxDrawdown;

    public ConstraintPoint toDomain() {
        return ConstraintPoint.of(name, x, y, minHead, maxDrawdown);
    }
}

package com.aquifer.wellfield.web;

import com.aquifer.wellfield.domain.DrawdownMethod;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DrawdownRequest {
    private List<WellDto> wells;
    private double transmissivity;
    private double storativity;
    private double[] xs;
    private double[] ys;
    private double time;
    private DrawdownMethod method; // THEIS when absent
}

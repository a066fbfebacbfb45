package com.aquifer.wellfield.web;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DrawdownResponse {
    private double totalPumping;
    private double[] drawdown;
}

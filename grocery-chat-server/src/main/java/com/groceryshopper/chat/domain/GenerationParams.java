package com.groceryshopper.chat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationParams {

    public static final double DEFAULT_TEMPERATURE = 0.2;
    public static final int DEFAULT_MAX_TOKENS = 512;

    private double temperature;
    private int maxTokens;

    public static GenerationParams defaults() {
        return new GenerationParams(DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS);
    }
}

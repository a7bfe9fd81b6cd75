package com.example.casa.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 精子活力分级
 */
public enum MotilityClass {

    @JsonProperty("progressive")
    PROGRESSIVE("progressive"),

    @JsonProperty("non_progressive")
    NON_PROGRESSIVE("non_progressive"),

    @JsonProperty("immotile")
    IMMOTILE("immotile");

    private final String label;

    MotilityClass(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isMotile() {
        return this != IMMOTILE;
    }
}

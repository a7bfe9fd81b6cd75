package com.example.casa.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ReferenceStatus {

    @JsonProperty("normal")
    NORMAL,

    @JsonProperty("below_reference")
    BELOW_REFERENCE
}

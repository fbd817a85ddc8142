package com.keyhive.participant.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ScanType {
    @JsonProperty("includeDefeated")
    INCLUDE_DEFEATED,

    @JsonProperty("excludeDefeated")
    EXCLUDE_DEFEATED,

    @JsonProperty("customRange")
    CUSTOM_RANGE
}

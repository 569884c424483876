package com.example.leafmachine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RegionOfInterest(
        @JsonProperty("ac:xFrac") double xFrac,
        @JsonProperty("ac:yFrac") double yFrac,
        @JsonProperty("ac:widthFrac") double widthFrac,
        @JsonProperty("ac:heightFrac") double heightFrac) {
}

package com.example.leafmachine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Motivation {

    CLASSIFYING("oa:classifying"),
    COMMENTING("oa:commenting");

    private final String value;

    Motivation(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

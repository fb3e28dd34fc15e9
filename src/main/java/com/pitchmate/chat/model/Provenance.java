package com.pitchmate.chat.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 세그먼트/도메인 결정 경로
 */
public enum Provenance {

    PARAM("param"),
    RULE("rule"),
    ZERO_SHOT("zero-shot"),
    DEFAULT("default"),
    UNRELATED("unrelated"),
    EXPLICIT("explicit");

    private final String label;

    Provenance(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}

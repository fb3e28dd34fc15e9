package com.pitchmate.chat.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 필드 길이 정책 종류
 */
public enum PolicyKind {
    TEXT,
    CODE,
    LIST;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PolicyKind fromLabel(String label) {
        return label == null ? TEXT : valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}

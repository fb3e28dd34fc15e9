package com.pitchmate.chat.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 스크립트 엔진 출력 모드
 */
public enum ScriptMode {
    NOTICE,
    ASK,
    END;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

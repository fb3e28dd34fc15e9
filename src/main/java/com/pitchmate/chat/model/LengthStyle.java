package com.pitchmate.chat.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 길이 스타일 프리셋 (문자 상한 / 토큰 상한)
 */
public enum LengthStyle {

    ONE_LINE(140, 50),
    SHORT(400, 120),
    MEDIUM(1200, 300),
    LONG(4000, 1000);

    private final int charCap;
    private final int tokenCap;

    LengthStyle(int charCap, int tokenCap) {
        this.charCap = charCap;
        this.tokenCap = tokenCap;
    }

    public int charCap() {
        return charCap;
    }

    public int tokenCap() {
        return tokenCap;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 라벨(one_line/short/medium/long)을 스타일로 변환. 알 수 없으면 null.
     */
    @JsonCreator
    public static LengthStyle fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String key = label.trim().toLowerCase(Locale.ROOT);
        for (LengthStyle s : values()) {
            if (s.label().equals(key)) {
                return s;
            }
        }
        return null;
    }
}

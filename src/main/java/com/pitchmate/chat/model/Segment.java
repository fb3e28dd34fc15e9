package com.pitchmate.chat.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 여행·레저 세그먼트
 * <p>
 * NONE 은 "세그먼트 미결정" 을 뜻하며 JSON 으로는 null 로 직렬화된다.
 */
public enum Segment {

    CAMPING("camping", "캠핑/글램핑"),
    EXPERIENCE("experience", "현지체험/액티비티"),
    SPORTS("sports", "레저 스포츠(서핑/등산 등)"),
    NONE(null, "여행·레저");

    private final String label;
    private final String displayName;

    Segment(String label, String displayName) {
        this.label = label;
        this.displayName = displayName;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isResolved() {
        return this != NONE;
    }

    /**
     * 라벨 문자열을 세그먼트로 변환한다. 알 수 없는 값(및 "none")은 NONE.
     */
    @JsonCreator
    public static Segment fromLabel(String label) {
        if (label == null) {
            return NONE;
        }
        String key = label.trim().toLowerCase(Locale.ROOT);
        for (Segment s : values()) {
            if (s.label != null && s.label.equals(key)) {
                return s;
            }
        }
        return NONE;
    }
}

package com.pitchmate.chat.model;

/**
 * 필드명 단위 길이 정책
 *
 * @param kind     text / code / list
 * @param maxChars 텍스트 문자 상한 (null 이면 스타일 상한)
 * @param maxEach  리스트 항목별 문자 상한
 * @param maxCount 리스트 최대 항목 수
 * @param tail     잘린 항목 수 표시("… (+K more)") 여부
 */
public record LengthPolicy(
        PolicyKind kind,
        Integer maxChars,
        Integer maxEach,
        Integer maxCount,
        boolean tail) {

    public static final int DEFAULT_MAX_EACH = 250;
    public static final int DEFAULT_MAX_COUNT = 7;

    public LengthPolicy {
        if (kind == null) {
            kind = PolicyKind.TEXT;
        }
    }

    public static LengthPolicy text() {
        return new LengthPolicy(PolicyKind.TEXT, null, null, null, false);
    }

    public static LengthPolicy list() {
        return new LengthPolicy(PolicyKind.LIST, null, null, null, false);
    }

    public boolean isCode() {
        return kind == PolicyKind.CODE;
    }
}

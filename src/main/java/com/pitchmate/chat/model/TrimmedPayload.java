package com.pitchmate.chat.model;

/**
 * 길이 제어가 적용된 페이로드와 적용된 상한
 */
public record TrimmedPayload(
        PayloadNode payload,
        LengthStyle style,
        int charCap,
        Integer tokenCap) {

    public Object toPlain() {
        return payload == null ? null : payload.toPlain();
    }
}

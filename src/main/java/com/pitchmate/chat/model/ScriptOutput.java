package com.pitchmate.chat.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 스크립트 엔진 출력
 * <p>
 * notice: 오프토픽 안내 (진행도 변경 없음)
 * ask: 다음 질문과 호출자가 되돌려 보낼 진행도
 * end: 모든 섹션 소진
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScriptOutput(
        ScriptMode mode,
        String message,
        String question,
        @JsonProperty("slot_key") String slotKey,
        Section section,
        @JsonInclude(JsonInclude.Include.ALWAYS) Progress progress) {

    public static ScriptOutput notice(String message) {
        return new ScriptOutput(ScriptMode.NOTICE, message, null, null, null, null);
    }

    public static ScriptOutput ask(String question, String slotKey, Progress progress) {
        return new ScriptOutput(ScriptMode.ASK, null, question, slotKey, progress.section(), progress);
    }

    public static ScriptOutput end(String message) {
        return new ScriptOutput(ScriptMode.END, message, null, null, null, null);
    }
}

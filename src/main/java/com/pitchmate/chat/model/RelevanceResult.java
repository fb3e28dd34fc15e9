package com.pitchmate.chat.model;

/**
 * 관련성 필터 결과
 */
public record RelevanceResult(boolean related) {
}

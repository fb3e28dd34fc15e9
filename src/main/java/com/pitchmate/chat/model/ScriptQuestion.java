package com.pitchmate.chat.model;

/**
 * 현재 질문 (슬롯 ID + 세그먼트가 반영된 문구)
 */
public record ScriptQuestion(String slotId, Section section, String text) {
}

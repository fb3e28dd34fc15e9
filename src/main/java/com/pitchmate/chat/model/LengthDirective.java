package com.pitchmate.chat.model;

/**
 * 생성 프롬프트에 붙일 길이 지시문과 스타일 토큰 상한
 */
public record LengthDirective(String text, int tokenCap) {
}

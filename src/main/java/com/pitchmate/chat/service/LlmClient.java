package com.pitchmate.chat.service;

/**
 * LLM 호출 클라이언트 (텍스트 분류 기능)
 * 프롬프트 + 시스템 지시를 보내고 자유 텍스트를 받는다.
 */
public interface LlmClient {

    /**
     * 단건 호출 (Non-Streaming)
     *
     * @param prompt      사용자 프롬프트
     * @param system      시스템 지시 (null 허용)
     * @param temperature 온도 (0.0-1.0)
     * @param maxTokens   최대 생성 토큰 수
     * @return 모델 응답 텍스트
     * @throws RuntimeException 호출 실패 시
     */
    String call(String prompt, String system, double temperature, int maxTokens);

    /**
     * LLM 서비스 사용 가능 여부
     */
    boolean isAvailable();
}

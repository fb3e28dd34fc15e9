package com.pitchmate.chat.service;

import com.pitchmate.chat.model.ConversationContext;
import com.pitchmate.chat.model.LengthDirective;
import com.pitchmate.chat.model.LengthStyle;
import com.pitchmate.chat.model.PayloadNode;
import com.pitchmate.chat.model.TrimmedPayload;

/**
 * 길이 제어 서비스 인터페이스
 */
public interface LengthGovernorService {

    /**
     * 길이 스타일 결정: 명시 스타일 → 사용자 지시 힌트 → 보조 자동 분류 → medium
     *
     * @param userQuery     사용자 메시지
     * @param explicitStyle 호출자가 지정한 스타일 라벨 (null 허용, 알 수 없는 라벨은 무시)
     */
    LengthStyle resolveStyle(String userQuery, String explicitStyle);

    /**
     * 생성 프롬프트용 길이 지시문
     */
    LengthDirective lengthDirective(LengthStyle style);

    /**
     * 토큰 상한 적용 (코드가 아닌 텍스트 전용)
     *
     * @param maxTokens null 또는 0 이하면 그대로 반환
     */
    String enforceTokenCap(String text, Integer maxTokens);

    /**
     * 페이로드 트리 전체에 길이 상한 적용 (순수 함수)
     *
     * @param payload   원본 페이로드
     * @param style     스타일 (null 허용)
     * @param maxChars  전역 문자 상한 (null / 0 이하면 기본값)
     * @param maxTokens 호출자 토큰 상한 (null / 0 이하면 없음)
     */
    TrimmedPayload trimPayload(PayloadNode payload, LengthStyle style, Integer maxChars, Integer maxTokens);

    /**
     * 컨텍스트 파라미터로 스타일/상한을 정해 페이로드를 자르고, 결정된 스타일을 파라미터에 기록한다.
     */
    TrimmedPayload apply(ConversationContext context, PayloadNode payload);
}

package com.pitchmate.chat.service;

import com.pitchmate.chat.model.ConversationContext;
import com.pitchmate.chat.model.RelevanceResult;

/**
 * 관련성 필터 서비스 인터페이스
 * 초단문/무의미 입력을 걸러낸다.
 */
public interface RelevanceService {

    /**
     * 메시지가 명백히 무관한지 판단
     *
     * @param message 사용자 메시지
     * @return 공백 제거 후 2자 미만이거나 라틴/한글 영숫자가 없으면 true
     */
    boolean isUnrelated(String message);

    /**
     * 최근 사용자 발화를 검사하고 결과를 컨텍스트에 기록
     */
    RelevanceResult check(ConversationContext context);
}

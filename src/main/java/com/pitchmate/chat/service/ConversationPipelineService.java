package com.pitchmate.chat.service;

import com.pitchmate.chat.model.ConversationContext;

/**
 * 대화 파이프라인 서비스 인터페이스
 * 관련성 필터 → 도메인 라우터 → 스크립트 엔진 → 길이 제어 순으로 한 턴을 처리한다.
 */
public interface ConversationPipelineService {

    /**
     * 한 턴 처리
     *
     * @param context 요청 단위 컨텍스트 (제자리에서 갱신됨)
     * @return 같은 컨텍스트. 잘린 응답은 {@link ConversationContext#getTrimmed()}
     */
    ConversationContext process(ConversationContext context);
}

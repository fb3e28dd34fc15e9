package com.pitchmate.chat.service;

import com.pitchmate.chat.model.ConversationContext;
import com.pitchmate.chat.model.DomainDecision;
import com.pitchmate.chat.model.Segment;

/**
 * 도메인/세그먼트 라우터 서비스 인터페이스
 */
public interface DomainRouterService {

    /**
     * 룰 기반 세그먼트 판정
     *
     * @param message 사용자 메시지
     * @return 키워드 히트가 가장 많은 세그먼트 (동점이면 우선순위), 히트가 없으면 NONE
     */
    Segment ruleSegment(String message);

    /**
     * 여행·레저 관련도 점수 [0,1]
     */
    double onTopicScore(String message);

    /**
     * 현재 턴의 라우팅 결정을 내리고 컨텍스트에 기록
     * (관련성 필터 결과가 컨텍스트에 먼저 있어야 하며, 없으면 관련 있음으로 본다)
     */
    DomainDecision route(ConversationContext context);
}

package com.pitchmate.chat.service;

import com.pitchmate.chat.model.ConversationContext;
import com.pitchmate.chat.model.Progress;
import com.pitchmate.chat.model.ScriptOutput;
import com.pitchmate.chat.model.ScriptQuestion;
import com.pitchmate.chat.model.Segment;

/**
 * 스크립트 인터뷰 엔진 인터페이스
 * <p>
 * 진행도는 호출자가 보관하고 매 턴 재전송한다. 엔진은 상태를 저장하지 않는다.
 */
public interface ScriptEngineService {

    /**
     * 시작 진행도 {A, 0, {}}
     */
    Progress firstProgress();

    /**
     * 선형 진행: 섹션 내 다음 슬롯, 섹션 끝이면 다음 섹션 0번.
     *
     * @return D 섹션 이후면 null
     */
    Progress nextProgress(Progress progress);

    /**
     * 현재 질문
     *
     * @return index 가 섹션 범위를 벗어나면 null
     */
    ScriptQuestion currentQuestion(Progress progress, Segment segment);

    /**
     * 같은 섹션의 현재 이후 미답변 슬롯 중 키워드 점수가 가장 높은 곳으로 점프.
     * 점수가 모두 0 이면 {@link #nextProgress(Progress)} 와 같다.
     */
    Progress chooseNextProgress(Progress progress, String userText);

    /**
     * 한 턴 처리 (순수 함수)
     *
     * @param progress 재전송된 진행도 (null 이면 시작 진행도)
     * @param userText 최근 사용자 발화
     * @param lastSlot 직전에 물어본 슬롯 ID
     * @param segment  질문 문구에 쓸 세그먼트
     * @param onTopic  라우터의 온토픽 판정
     */
    ScriptOutput advance(Progress progress, String userText, String lastSlot, Segment segment, boolean onTopic);

    /**
     * 컨텍스트 기반 한 턴 처리. 결과를 컨텍스트에 기록한다.
     */
    ScriptOutput process(ConversationContext context);
}

package com.pitchmate.chat.service;

import com.pitchmate.chat.model.Segment;

/**
 * 제로샷 세그먼트 분류 서비스 인터페이스
 */
public interface SegmentClassifierService {

    /**
     * LLM 으로 세그먼트를 1회 분류한다. 재시도하지 않는다.
     *
     * @param message 사용자 메시지
     * @param history 최근 대화 기록 ("role: content" 줄)
     * @return 분류된 세그먼트. 실패/모호/none 이면 {@link Segment#NONE}
     */
    Segment classify(String message, String history);
}

package com.pitchmate.chat.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 도메인/세그먼트 라우팅 결과
 * <p>
 * 불변식: onTopic 이 false 이면 provenance 는 UNRELATED, confidence 는 0.30 이하.
 *
 * @param intent       라우팅된 플로우 (단일 플로우: script_qna)
 * @param domain       1차 도메인 (travel 고정)
 * @param segment      세그먼트
 * @param confidence   신뢰도 [0,1]
 * @param provenance   결정 경로
 * @param onTopic      여행·레저 주제 여부
 * @param onTopicScore 키워드 기반 관련도 점수 [0,1]
 * @param routedStep   명시적 라우팅일 때 호출자가 지정한 step
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DomainDecision(
        String intent,
        String domain,
        Segment segment,
        double confidence,
        @JsonProperty("via") Provenance provenance,
        @JsonProperty("isOnTopic") boolean onTopic,
        double onTopicScore,
        String routedStep) {

    public static final String SCRIPT_INTENT = "script_qna";
    public static final String TRAVEL_DOMAIN = "travel";
    public static final double UNRELATED_CONFIDENCE = 0.30;

    public DomainDecision {
        if (segment == null) {
            segment = Segment.NONE;
        }
        if (!onTopic && (provenance != Provenance.UNRELATED || confidence > UNRELATED_CONFIDENCE)) {
            throw new IllegalArgumentException(
                    "off-topic decision must be 'unrelated' with confidence <= 0.30: " + provenance + "/" + confidence);
        }
    }

    public static DomainDecision unrelated() {
        return new DomainDecision(SCRIPT_INTENT, TRAVEL_DOMAIN, Segment.NONE,
                UNRELATED_CONFIDENCE, Provenance.UNRELATED, false, 0.0, null);
    }

    public static DomainDecision explicit(String routedStep) {
        return new DomainDecision(routedStep, TRAVEL_DOMAIN, Segment.NONE,
                1.0, Provenance.EXPLICIT, true, 1.0, routedStep);
    }

    /**
     * 하위 호환용 필드 (segment 복제)
     */
    @JsonProperty("subdomain")
    public String subdomain() {
        return segment.label();
    }
}

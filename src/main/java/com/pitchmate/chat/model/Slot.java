package com.pitchmate.chat.model;

import java.util.List;

/**
 * 인터뷰 슬롯 (질문 1개)
 *
 * @param id       슬롯 ID (예: A1_problem)
 * @param section  소속 섹션
 * @param ordinal  섹션 내 위치 (0부터)
 * @param question 질문 문구. {@value #SEGMENT_PLACEHOLDER} 를 포함하면 세그먼트별 문구
 * @param keywords 점프 판단용 키워드
 */
public record Slot(
        String id,
        Section section,
        int ordinal,
        String question,
        List<String> keywords) {

    public static final String SEGMENT_PLACEHOLDER = "{segment}";

    public Slot {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public boolean isSegmentParameterized() {
        return question != null && question.contains(SEGMENT_PLACEHOLDER);
    }

    public String questionFor(Segment segment) {
        if (question == null) {
            return "";
        }
        if (!isSegmentParameterized()) {
            return question;
        }
        Segment s = segment == null ? Segment.NONE : segment;
        return question.replace(SEGMENT_PLACEHOLDER, s.displayName());
    }
}

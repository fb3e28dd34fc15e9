package com.pitchmate.chat.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pitchmate.chat.model.Segment;
import com.pitchmate.chat.service.LlmClient;
import com.pitchmate.chat.service.SegmentClassifierService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

/**
 * 제로샷 세그먼트 분류 서비스 구현 (Zero-shot Segment Classifier)
 * <p>
 * 기능:
 * 룰 기반 매칭으로 세그먼트를 정하지 못했을 때만 쓰이는 폴백.
 * LLM 에게 단일 키 JSON ({"segment": "..."}) 답을 요구하고 첫 번째 중괄호 블록을 파싱한다.
 * <p>
 * 어떤 실패(예외, 타임아웃, 파싱 오류, 허용되지 않은 라벨)도 {@link Segment#NONE} 으로 수렴한다.
 */
@Service
public class SegmentClassifierServiceImpl implements SegmentClassifierService {

    private static final Logger logger = LoggerFactory.getLogger(SegmentClassifierServiceImpl.class);

    static final int HISTORY_TURNS = 3;
    static final double TEMPERATURE = 0.0;
    static final int MAX_TOKENS = 16;

    static final String SYSTEM_PROMPT = """
            You are a classifier for a travel/leisure chatbot. \
            Decide which segment the USER is asking about. \
            Valid labels: camping, experience, sports, none. \
            Focus on the travel/leisure meanings, not generic sports news. \
            Respond ONLY compact JSON like: {"segment":"camping"}""";

    @Lazy
    @Autowired
    private LlmClient llmClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public Segment classify(String message, String history) {
        String prompt = String.format("""
                History (last %d turns):
                %s

                USER: %s

                Return JSON with a single key 'segment' in ["camping","experience","sports","none"].""",
                HISTORY_TURNS, history == null ? "" : history, message == null ? "" : message);

        try {
            String response = llmClient.call(prompt, SYSTEM_PROMPT, TEMPERATURE, MAX_TOKENS);
            Segment segment = parseSegment(response);
            logger.debug("zero-shot segment: {}", segment);
            return segment;
        } catch (Exception e) {
            logger.warn("제로샷 세그먼트 분류 실패: {}", e.getMessage());
            return Segment.NONE;
        }
    }

    /**
     * 세그먼트 응답 파싱
     * <p>
     * 첫 '{' 부터 마지막 '}' 까지를 JSON 으로 보고 `segment` 키를 읽는다.
     */
    Segment parseSegment(String response) {
        if (response == null) {
            return Segment.NONE;
        }
        try {
            int start = response.indexOf('{');
            int end = response.lastIndexOf('}') + 1;
            if (start >= 0 && end > start) {
                JsonNode node = objectMapper.readTree(response.substring(start, end));
                JsonNode seg = node.get("segment");
                if (seg != null && seg.isTextual()) {
                    return Segment.fromLabel(seg.asText());
                }
            }
        } catch (Exception e) {
            logger.warn("세그먼트 응답 파싱 실패: {}", e.getMessage());
        }
        return Segment.NONE;
    }
}

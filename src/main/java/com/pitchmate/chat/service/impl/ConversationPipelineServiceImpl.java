package com.pitchmate.chat.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pitchmate.chat.model.ConversationContext;
import com.pitchmate.chat.model.DomainDecision;
import com.pitchmate.chat.model.PayloadNode;
import com.pitchmate.chat.model.ScriptOutput;
import com.pitchmate.chat.model.TrimmedPayload;
import com.pitchmate.chat.service.ConversationPipelineService;
import com.pitchmate.chat.service.DomainRouterService;
import com.pitchmate.chat.service.LengthGovernorService;
import com.pitchmate.chat.service.RelevanceService;
import com.pitchmate.chat.service.ScriptEngineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 대화 파이프라인 구현 (Conversation Pipeline)
 * <p>
 * 기능:
 * 요청 단위 컨텍스트 하나를 네 단계에 순서대로 통과시킨다. 단계 사이에 병렬 처리는 없다.
 * <p>
 * 흐름:
 * 1. {@link RelevanceService}: 초단문/무의미 입력 표시.
 * 2. {@link DomainRouterService}: 세그먼트와 온토픽 판정 (필요 시 제로샷 1회).
 * 3. {@link ScriptEngineService}: 다음 질문 또는 안내/종료.
 * 4. {@link LengthGovernorService}: 생성 출력 + 단계 출력을 합친 응답 페이로드에 길이 제어 적용.
 */
@Service
public class ConversationPipelineServiceImpl implements ConversationPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(ConversationPipelineServiceImpl.class);

    static final String OUT_RELEVANCE = "relevance";
    static final String OUT_DOMAIN = "domain";
    static final String OUT_SCRIPT = "script";

    @Autowired
    private RelevanceService relevanceService;

    @Autowired
    private DomainRouterService domainRouterService;

    @Autowired
    private ScriptEngineService scriptEngineService;

    @Autowired
    private LengthGovernorService lengthGovernorService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public ConversationContext process(ConversationContext context) {
        final long t0 = System.nanoTime();

        relevanceService.check(context);
        DomainDecision domain = domainRouterService.route(context);
        ScriptOutput script = scriptEngineService.process(context);
        TrimmedPayload trimmed = lengthGovernorService.apply(context, buildPayload(context));

        long totalMs = (System.nanoTime() - t0) / 1_000_000;
        logger.info("turn processed: segment={}, via={}, mode={}, slot={}, style={}, totalMs={}",
                domain.segment().label(), domain.provenance().label(), script.mode().label(),
                script.slotKey(), trimmed.style() == null ? null : trimmed.style().label(), totalMs);
        return context;
    }

    /**
     * 응답 페이로드 구성: 생성 출력 + 단계 출력(relevance, domain, script)
     */
    private PayloadNode buildPayload(ConversationContext context) {
        Map<String, Object> payload = new LinkedHashMap<>(context.getOutputs());
        payload.put(OUT_RELEVANCE, toMap(context.getRelevance()));
        payload.put(OUT_DOMAIN, toMap(context.getDomain()));
        payload.put(OUT_SCRIPT, toMap(context.getScript()));
        return PayloadNode.of(payload);
    }

    private Map<String, Object> toMap(Object stageOutput) {
        if (stageOutput == null) {
            return null;
        }
        return objectMapper.convertValue(stageOutput, new TypeReference<LinkedHashMap<String, Object>>() {});
    }
}

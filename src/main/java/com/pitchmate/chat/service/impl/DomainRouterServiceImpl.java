package com.pitchmate.chat.service.impl;

import com.pitchmate.chat.model.ConversationContext;
import com.pitchmate.chat.model.DomainDecision;
import com.pitchmate.chat.model.Provenance;
import com.pitchmate.chat.model.RelevanceResult;
import com.pitchmate.chat.model.RequestParams;
import com.pitchmate.chat.model.Segment;
import com.pitchmate.chat.repository.RoutingVocabularyRepository;
import com.pitchmate.chat.service.DomainRouterService;
import com.pitchmate.chat.service.RuntimeConfigService;
import com.pitchmate.chat.service.SegmentClassifierService;
import com.pitchmate.chat.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 도메인/세그먼트 라우터 구현 (Domain/Segment Router)
 * <p>
 * 기능:
 * 1차 도메인은 여행·레저로 고정하고, 세그먼트(캠핑/체험/스포츠)와 온토픽 여부를 결정한다.
 * <p>
 * 결정 순서:
 * 1. 명시적 라우팅 라벨(step)이 있으면 그대로 통과 (explicit).
 * 2. 관련성 필터가 무관으로 판정하면 고정 결과 (unrelated).
 * 3. 파라미터 세그먼트(0.95) → 룰 기반 키워드(0.90) → 허용 시 제로샷 1회(0.65) → 기본값(0.50).
 * 4. 관련도 점수가 임계값 이상이거나 세그먼트가 정해졌으면 온토픽. 아니면 unrelated 로 덮고 신뢰도를 0.30 이하로 제한.
 */
@Service
public class DomainRouterServiceImpl implements DomainRouterService {

    private static final Logger logger = LoggerFactory.getLogger(DomainRouterServiceImpl.class);

    static final double CONF_PARAM = 0.95;
    static final double CONF_STRONG_RULE = 0.90;
    static final double CONF_ZERO_SHOT = 0.65;
    static final double CONF_DEFAULT = 0.50;
    static final int ON_TOPIC_HIT_SCALE = 5;
    static final int MAX_HISTORY_TURNS = 3;

    @Autowired
    private RoutingVocabularyRepository vocabulary;

    @Autowired
    private SegmentClassifierService segmentClassifier;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Override
    public Segment ruleSegment(String message) {
        String text = TextNormalizer.normalize(message);
        if (text.isEmpty()) {
            return Segment.NONE;
        }
        Segment best = Segment.NONE;
        int bestHits = 0;
        // 우선순위 순으로 돌며 "더 큰" 경우에만 교체하므로 동점이면 앞쪽이 남는다
        for (Segment segment : runtimeConfigService.getSegmentPriority()) {
            int hits = TextNormalizer.countHits(text, vocabulary.keywordsFor(segment));
            if (hits > bestHits) {
                best = segment;
                bestHits = hits;
            }
        }
        return best;
    }

    @Override
    public double onTopicScore(String message) {
        String text = TextNormalizer.normalize(message);
        if (text.isEmpty()) {
            return 0.0;
        }
        int hits = TextNormalizer.countHits(text, vocabulary.onTopicHints());
        for (List<String> keywords : vocabulary.segmentKeywords().values()) {
            if (TextNormalizer.countHits(text, keywords) > 0) {
                hits++;
                break;
            }
        }
        return Math.min((double) hits / ON_TOPIC_HIT_SCALE, 1.0);
    }

    @Override
    public DomainDecision route(ConversationContext context) {
        DomainDecision decision = decide(context);
        context.setDomain(decision);
        logger.debug("domain: segment={}, via={}, confidence={}, onTopic={}, score={}",
                decision.segment(), decision.provenance().label(), decision.confidence(),
                decision.onTopic(), decision.onTopicScore());
        return decision;
    }

    private DomainDecision decide(ConversationContext context) {
        String step = context.getStep();
        if (step != null && vocabulary.knownIntents().contains(step)) {
            return DomainDecision.explicit(step);
        }

        RelevanceResult relevance = context.getRelevance();
        if (relevance != null && !relevance.related()) {
            return DomainDecision.unrelated();
        }

        String message = context.lastUserText();
        RequestParams params = context.getParams();

        // A) 파라미터 세그먼트
        Segment segment = Segment.fromLabel(params.getSegment());
        Provenance via = segment.isResolved() ? Provenance.PARAM : null;
        double confidence = segment.isResolved() ? CONF_PARAM : 0.0;

        // B) 룰 기반 키워드
        if (!segment.isResolved()) {
            segment = ruleSegment(message);
            if (segment.isResolved()) {
                via = Provenance.RULE;
                confidence = CONF_STRONG_RULE;
            }
        }

        // C) 제로샷 폴백 (요청 플래그 + 전역 스위치가 모두 켜졌을 때 1회)
        if (!segment.isResolved() && params.isAllowZeroShot() && runtimeConfigService.isZeroShotEnabled()) {
            Segment zeroShot = segmentClassifier.classify(message, context.shortHistory(MAX_HISTORY_TURNS));
            if (zeroShot != null && zeroShot.isResolved()) {
                segment = zeroShot;
                via = Provenance.ZERO_SHOT;
                confidence = Math.max(confidence, CONF_ZERO_SHOT);
            }
        }

        // D) 기본값
        if (!segment.isResolved()) {
            via = via == null ? Provenance.DEFAULT : via;
            confidence = Math.max(confidence, CONF_DEFAULT);
        }

        double score = onTopicScore(message);
        boolean onTopic = score >= runtimeConfigService.getOnTopicThreshold() || segment.isResolved();
        if (!onTopic) {
            via = Provenance.UNRELATED;
            confidence = Math.min(confidence, DomainDecision.UNRELATED_CONFIDENCE);
        }

        return new DomainDecision(
                DomainDecision.SCRIPT_INTENT,
                DomainDecision.TRAVEL_DOMAIN,
                segment,
                confidence,
                via,
                onTopic,
                Math.round(score * 100.0) / 100.0,
                null);
    }
}

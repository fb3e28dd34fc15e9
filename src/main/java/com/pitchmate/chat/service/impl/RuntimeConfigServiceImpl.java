package com.pitchmate.chat.service.impl;

import com.pitchmate.chat.model.Segment;
import com.pitchmate.chat.service.RuntimeConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 실행 중 설정 서비스 (Runtime Configuration Service)
 * <p>
 * 기능:
 * 서버 재시작 없이 라우터 임계값과 길이 제어 기본값을 조정한다.
 * <p>
 * 방식:
 * 1. 변경 값(Override)은 `AtomicReference` 에 보관한다.
 * 2. 읽을 때 Override 가 있으면 그 값을, 없으면 `application.properties` 기본값을 돌려준다.
 */
@Service
public class RuntimeConfigServiceImpl implements RuntimeConfigService {

    private static final Logger logger = LoggerFactory.getLogger(RuntimeConfigServiceImpl.class);

    @Value("${router.on-topic-threshold:0.28}")
    private double onTopicThresholdDefault = 0.28;

    @Value("${router.segment-priority:camping,experience,sports}")
    private String segmentPriorityDefault = "camping,experience,sports";

    @Value("${router.zero-shot-enabled:true}")
    private boolean zeroShotEnabledDefault = true;

    @Value("${length.default-max-chars:4000}")
    private int defaultMaxCharsDefault = 4000;

    private final AtomicReference<Double> onTopicThresholdOverride = new AtomicReference<>();
    private final AtomicReference<List<Segment>> segmentPriorityOverride = new AtomicReference<>();
    private final AtomicReference<Boolean> zeroShotEnabledOverride = new AtomicReference<>();
    private final AtomicReference<Integer> defaultMaxCharsOverride = new AtomicReference<>();

    @Override
    public double getOnTopicThreshold() {
        Double v = onTopicThresholdOverride.get();
        return v != null ? v : onTopicThresholdDefault;
    }

    @Override
    public List<Segment> getSegmentPriority() {
        List<Segment> v = segmentPriorityOverride.get();
        return v != null ? v : parsePriority(segmentPriorityDefault);
    }

    @Override
    public boolean isZeroShotEnabled() {
        Boolean v = zeroShotEnabledOverride.get();
        return v != null ? v : zeroShotEnabledDefault;
    }

    @Override
    public int getDefaultMaxChars() {
        Integer v = defaultMaxCharsOverride.get();
        return v != null ? v : defaultMaxCharsDefault;
    }

    /**
     * 라우터 설정 변경 (Update Router Configuration)
     * <p>
     * 임계값은 [0,1] 범위만 받는다. 우선순위 목록에서 빠진 세그먼트는 뒤쪽에 기본 순서로 붙는다.
     */
    @Override
    public void updateRouter(Double onTopicThreshold, List<Segment> segmentPriority, Boolean zeroShotEnabled) {
        if (onTopicThreshold != null) {
            if (onTopicThreshold < 0.0 || onTopicThreshold > 1.0) {
                throw new IllegalArgumentException("onTopicThreshold must be within [0,1]: " + onTopicThreshold);
            }
            onTopicThresholdOverride.set(onTopicThreshold);
        }
        if (segmentPriority != null) {
            segmentPriorityOverride.set(complete(segmentPriority));
        }
        if (zeroShotEnabled != null) {
            zeroShotEnabledOverride.set(zeroShotEnabled);
        }
        logger.info("Router config updated: threshold={}, priority={}, zeroShot={}",
                getOnTopicThreshold(), getSegmentPriority(), isZeroShotEnabled());
    }

    @Override
    public void updateLength(Integer defaultMaxChars) {
        if (defaultMaxChars != null) {
            if (defaultMaxChars <= 0) {
                throw new IllegalArgumentException("defaultMaxChars must be positive: " + defaultMaxChars);
            }
            defaultMaxCharsOverride.set(defaultMaxChars);
        }
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> out = new HashMap<>();

        Map<String, Object> router = new HashMap<>();
        router.put("onTopicThreshold", getOnTopicThreshold());
        router.put("segmentPriority", getSegmentPriority().stream().map(Segment::label).toList());
        router.put("zeroShotEnabled", isZeroShotEnabled());
        out.put("router", router);

        Map<String, Object> length = new HashMap<>();
        length.put("defaultMaxChars", getDefaultMaxChars());
        out.put("length", length);

        return out;
    }

    private static List<Segment> parsePriority(String csv) {
        List<Segment> parsed = new ArrayList<>();
        if (csv != null) {
            for (String label : csv.split(",")) {
                Segment s = Segment.fromLabel(label);
                if (s.isResolved()) {
                    parsed.add(s);
                }
            }
        }
        return complete(parsed);
    }

    private static List<Segment> complete(List<Segment> priority) {
        Set<Segment> ordered = new LinkedHashSet<>();
        for (Segment s : priority) {
            if (s != null && s.isResolved()) {
                ordered.add(s);
            }
        }
        ordered.add(Segment.CAMPING);
        ordered.add(Segment.EXPERIENCE);
        ordered.add(Segment.SPORTS);
        return List.copyOf(ordered);
    }
}

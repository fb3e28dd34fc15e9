package com.pitchmate.chat.service;

import com.pitchmate.chat.model.Segment;

import java.util.List;
import java.util.Map;

public interface RuntimeConfigService {

    double getOnTopicThreshold();

    /**
     * 동점 세그먼트 우선순위 (앞쪽이 우선)
     */
    List<Segment> getSegmentPriority();

    boolean isZeroShotEnabled();

    int getDefaultMaxChars();

    void updateRouter(Double onTopicThreshold, List<Segment> segmentPriority, Boolean zeroShotEnabled);

    void updateLength(Integer defaultMaxChars);

    Map<String, Object> snapshot();
}

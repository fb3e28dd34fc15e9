package com.pitchmate.chat.repository;

import com.pitchmate.chat.model.Segment;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 라우팅 어휘 (세그먼트 키워드, 여행·레저 일반 힌트, 명시적 라우팅 라벨)
 */
public interface RoutingVocabularyRepository {

    Map<Segment, List<String>> segmentKeywords();

    List<String> keywordsFor(Segment segment);

    List<String> onTopicHints();

    Set<String> knownIntents();
}

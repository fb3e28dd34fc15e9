package com.pitchmate.chat.repository.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pitchmate.chat.model.Segment;
import com.pitchmate.chat.repository.RoutingVocabularyRepository;
import com.pitchmate.chat.util.JsonLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import jakarta.annotation.PostConstruct;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Repository
public class JsonRoutingVocabularyRepository implements RoutingVocabularyRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonRoutingVocabularyRepository.class);

    @Value("${catalog.routing-vocabulary:routing-vocabulary.json}")
    private String resource = "routing-vocabulary.json";

    private volatile Map<Segment, List<String>> segmentKeywords = Map.of();
    private volatile List<String> onTopicHints = List.of();
    private volatile Set<String> knownIntents = Set.of();

    @PostConstruct
    public void init() {
        VocabularyFile file = JsonLoader.loadResource(resource, new TypeReference<VocabularyFile>() {});

        Map<Segment, List<String>> keywords = new EnumMap<>(Segment.class);
        if (file.segments() != null) {
            file.segments().forEach((label, words) -> {
                Segment segment = Segment.fromLabel(label);
                if (!segment.isResolved()) {
                    throw new IllegalStateException("Unknown segment in " + resource + ": " + label);
                }
                keywords.put(segment, words == null ? List.of() : List.copyOf(words));
            });
        }

        this.segmentKeywords = Collections.unmodifiableMap(keywords);
        this.onTopicHints = file.onTopicHints() == null ? List.of() : List.copyOf(file.onTopicHints());
        this.knownIntents = file.intents() == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(file.intents()));

        logger.info("Routing vocabulary loaded: segments={}, hints={}, intents={}",
                segmentKeywords.size(), onTopicHints.size(), knownIntents.size());
    }

    @Override
    public Map<Segment, List<String>> segmentKeywords() {
        return segmentKeywords;
    }

    @Override
    public List<String> keywordsFor(Segment segment) {
        return segmentKeywords.getOrDefault(segment, List.of());
    }

    @Override
    public List<String> onTopicHints() {
        return onTopicHints;
    }

    @Override
    public Set<String> knownIntents() {
        return knownIntents;
    }

    private record VocabularyFile(
            Map<String, List<String>> segments,
            List<String> onTopicHints,
            List<String> intents) {
    }
}

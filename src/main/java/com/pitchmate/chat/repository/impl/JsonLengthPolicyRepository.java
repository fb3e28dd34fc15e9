package com.pitchmate.chat.repository.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pitchmate.chat.model.LengthPolicy;
import com.pitchmate.chat.model.LengthStyle;
import com.pitchmate.chat.repository.LengthPolicyRepository;
import com.pitchmate.chat.util.JsonLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import jakarta.annotation.PostConstruct;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Repository
public class JsonLengthPolicyRepository implements LengthPolicyRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonLengthPolicyRepository.class);

    @Value("${catalog.length-policy:length-policy.json}")
    private String resource = "length-policy.json";

    private volatile Map<LengthStyle, List<String>> userHints = Map.of();
    private volatile Map<LengthStyle, List<String>> autoHints = Map.of();
    private volatile Map<String, LengthPolicy> fields = Map.of();
    private volatile Set<String> skipKeys = Set.of();

    @PostConstruct
    public void init() {
        PolicyFile file = JsonLoader.loadResource(resource, new TypeReference<PolicyFile>() {});

        this.userHints = toStyleMap(file.userHints());
        this.autoHints = toStyleMap(file.autoHints());
        this.fields = file.fields() == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(file.fields()));
        this.skipKeys = file.skipKeys() == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(file.skipKeys()));

        logger.info("Length policy loaded: fields={}, skipKeys={}", fields.keySet(), skipKeys);
    }

    // 파일 순서가 곧 우선순위
    private Map<LengthStyle, List<String>> toStyleMap(Map<String, List<String>> raw) {
        if (raw == null) {
            return Map.of();
        }
        Map<LengthStyle, List<String>> out = new LinkedHashMap<>();
        raw.forEach((label, hints) -> {
            LengthStyle style = LengthStyle.fromLabel(label);
            if (style == null) {
                throw new IllegalStateException("Unknown length style in " + resource + ": " + label);
            }
            out.put(style, hints == null ? List.of() : List.copyOf(hints));
        });
        return Collections.unmodifiableMap(out);
    }

    @Override
    public Map<LengthStyle, List<String>> userHints() {
        return userHints;
    }

    @Override
    public Map<LengthStyle, List<String>> autoHints() {
        return autoHints;
    }

    @Override
    public LengthPolicy policyFor(String fieldName) {
        return fieldName == null ? null : fields.get(fieldName);
    }

    @Override
    public Set<String> skipKeys() {
        return skipKeys;
    }

    private record PolicyFile(
            Map<String, List<String>> userHints,
            Map<String, List<String>> autoHints,
            Map<String, LengthPolicy> fields,
            List<String> skipKeys) {
    }
}

package com.pitchmate.chat.repository.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pitchmate.chat.model.Section;
import com.pitchmate.chat.model.Slot;
import com.pitchmate.chat.repository.ScriptCatalogRepository;
import com.pitchmate.chat.util.JsonLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Repository
public class JsonScriptCatalogRepository implements ScriptCatalogRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonScriptCatalogRepository.class);

    @Value("${catalog.script:script-catalog.json}")
    private String resource = "script-catalog.json";

    private volatile Map<Section, List<Slot>> slotsBySection = Map.of();
    private volatile String offTopicNotice = "";
    private volatile String endMessage = "";

    /**
     * 카탈로그 로드
     * <p>
     * 모든 섹션(A~D)이 비어 있지 않아야 하고 슬롯 ID 는 전체에서 유일해야 한다.
     */
    @PostConstruct
    public void init() {
        CatalogFile file = JsonLoader.loadResource(resource, new TypeReference<CatalogFile>() {});
        if (file.sections() == null) {
            throw new IllegalStateException("No sections in " + resource);
        }

        Map<Section, List<Slot>> bySection = new EnumMap<>(Section.class);
        Set<String> seen = new HashSet<>();
        for (Section section : Section.values()) {
            List<SlotEntry> entries = file.sections().get(section.name());
            if (entries == null || entries.isEmpty()) {
                throw new IllegalStateException("Section " + section + " is empty in " + resource);
            }
            List<Slot> slots = new ArrayList<>(entries.size());
            for (int i = 0; i < entries.size(); i++) {
                SlotEntry e = entries.get(i);
                if (!seen.add(e.id())) {
                    throw new IllegalStateException("Duplicate slot id " + e.id() + " in " + resource);
                }
                slots.add(new Slot(e.id(), section, i, e.question(), e.keywords()));
            }
            bySection.put(section, Collections.unmodifiableList(slots));
        }

        this.slotsBySection = Collections.unmodifiableMap(bySection);
        this.offTopicNotice = file.offTopicNotice() == null ? "" : file.offTopicNotice();
        this.endMessage = file.endMessage() == null ? "" : file.endMessage();

        logger.info("Script catalog loaded: {} slots ({})", seen.size(), describe());
    }

    private String describe() {
        StringBuilder sb = new StringBuilder();
        slotsBySection.forEach((s, list) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(s).append('=').append(list.size());
        });
        return sb.toString();
    }

    @Override
    public List<Slot> slots(Section section) {
        return slotsBySection.getOrDefault(section, List.of());
    }

    @Override
    public int totalSlots() {
        return slotsBySection.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public String offTopicNotice() {
        return offTopicNotice;
    }

    @Override
    public String endMessage() {
        return endMessage;
    }

    private record SlotEntry(String id, String question, List<String> keywords) {
    }

    private record CatalogFile(
            Map<String, List<SlotEntry>> sections,
            String offTopicNotice,
            String endMessage) {
    }
}

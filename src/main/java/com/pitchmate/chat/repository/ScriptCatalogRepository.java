package com.pitchmate.chat.repository;

import com.pitchmate.chat.model.Section;
import com.pitchmate.chat.model.Slot;

import java.util.List;

/**
 * 인터뷰 슬롯 카탈로그
 */
public interface ScriptCatalogRepository {

    /**
     * 섹션의 슬롯 목록 (순서 보장)
     */
    List<Slot> slots(Section section);

    int totalSlots();

    String offTopicNotice();

    String endMessage();
}

package com.pitchmate.chat.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 인터뷰 진행도 (호출자 소유)
 * <p>
 * 엔진은 진행도를 받아 새 진행도를 돌려줄 뿐 저장하지 않는다.
 * index 가 섹션 길이와 같으면 해당 섹션이 소진된 상태다.
 */
public record Progress(Section section, int index, Set<String> answered) {

    public Progress {
        if (section == null) {
            section = Section.A;
        }
        if (index < 0) {
            index = 0;
        }
        answered = answered == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(answered));
    }

    public static Progress first() {
        return new Progress(Section.A, 0, Set.of());
    }

    public Progress withIndex(int newIndex) {
        return new Progress(section, newIndex, answered);
    }

    public Progress withAnswered(String slotId) {
        Set<String> next = new LinkedHashSet<>(answered);
        next.add(slotId);
        return new Progress(section, index, next);
    }

    public boolean isAnswered(String slotId) {
        return answered.contains(slotId);
    }
}

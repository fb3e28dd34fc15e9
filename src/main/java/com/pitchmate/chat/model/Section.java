package com.pitchmate.chat.model;

/**
 * 인터뷰 섹션 (A → B → C → D)
 */
public enum Section {

    A("사업 주제 선정"),
    B("사업 정의"),
    C("시장 조사 및 분석"),
    D("비즈니스 모델 수립");

    private final String title;

    Section(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }

    /**
     * 다음 섹션. D 이후에는 null.
     */
    public Section next() {
        int i = ordinal() + 1;
        return i < values().length ? values()[i] : null;
    }
}

package com.pitchmate.chat.util;

import java.util.ArrayList;
import java.util.List;

/**
 * 공백 분할 근사 토크나이저 (정확한 인코더가 없을 때의 폴백)
 */
public class WhitespaceTokenizer implements TextTokenizer {

    @Override
    public List<String> encode(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return List.of(text.strip().split("\\s+"));
    }

    @Override
    public String decode(List<?> units) {
        List<String> words = new ArrayList<>(units.size());
        for (Object u : units) {
            words.add(String.valueOf(u));
        }
        return String.join(" ", words);
    }

    @Override
    public boolean isExact() {
        return false;
    }
}

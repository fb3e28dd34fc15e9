package com.pitchmate.chat.util;

import java.text.Normalizer;
import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 키워드 비교용 텍스트 정규화
 * NFKC → 소문자 → 구두점을 공백으로 → 공백 압축
 */
public final class TextNormalizer {

    private static final Pattern PUNCT = Pattern.compile("[\"'`.,:;()\\[\\]{}<>~^\\-_/\\\\]");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String s = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT).strip();
        s = PUNCT.matcher(s).replaceAll(" ");
        s = SPACES.matcher(s).replaceAll(" ");
        return s.strip();
    }

    /**
     * 정규화된 텍스트에 (정규화된) 키워드가 부분 문자열로 포함되는지
     */
    public static boolean containsKeyword(String normalizedText, String keyword) {
        String k = normalize(keyword);
        return !k.isEmpty() && normalizedText.contains(k);
    }

    /**
     * 포함된 키워드 개수
     */
    public static int countHits(String normalizedText, Collection<String> keywords) {
        if (normalizedText == null || normalizedText.isEmpty() || keywords == null) {
            return 0;
        }
        int hits = 0;
        for (String k : keywords) {
            if (containsKeyword(normalizedText, k)) {
                hits++;
            }
        }
        return hits;
    }
}

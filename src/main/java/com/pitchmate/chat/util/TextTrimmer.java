package com.pitchmate.chat.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 경계 인식 텍스트 자르기 유틸리티
 * <p>
 * 문장/줄바꿈/닫는 따옴표 경계를 우선하고, 없으면 단어 경계, 그래도 없으면 강제 절단한다.
 * 코드 펜스(``` / ~~~) 내부에서는 자르지 않고, 링크 토큰 직후에서 자르지 않는다.
 * 말줄임표는 상한 안에 포함되므로 결과 길이는 상한을 넘지 않는다.
 */
public final class TextTrimmer {

    public static final String ELLIPSIS = "…";

    static final String FENCE_TRIPLE = "```";
    static final String FENCE_TILDES = "~~~";

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?。！？…]+|\\n+|[”’\"'」』)\\]]");
    private static final Pattern WORD_BOUNDARY = Pattern.compile("[\\s,;:/·\\-–—]+");
    private static final String[] LINK_TOKENS = {"](", "http://", "https://", "://"};
    private static final int LINK_LOOKBEHIND = 6;

    private static final Pattern TAIL_MARKER = Pattern.compile("^… \\(\\+(\\d+) more\\)$");

    private TextTrimmer() {
    }

    /**
     * 문자 상한 적용
     *
     * @param text     원문
     * @param maxChars 문자 상한
     * @param isCode   코드/JSON 이면 말줄임표 없이 강제 절단
     */
    public static String enforceCharCap(String text, int maxChars, boolean isCode) {
        if (text == null) {
            return null;
        }
        if (text.length() <= maxChars) {
            return balanceFences(text);
        }
        return isCode ? hardCut(text, maxChars) : softCut(text, maxChars, true);
    }

    /**
     * 경계 인식 절단
     */
    public static String softCut(String text, int maxChars, boolean addEllipsis) {
        if (text == null || text.length() <= maxChars) {
            return balanceFences(text);
        }
        int budget = addEllipsis ? maxChars - ELLIPSIS.length() : maxChars;
        budget = safeEnd(text, Math.max(1, budget));
        String snippet = text.substring(0, budget);

        // 1) 문장부호/줄바꿈/닫는 기호
        int cut = lastMatchEnd(SENTENCE_END, snippet);

        // 2) 단어 경계
        if (cut < 0) {
            cut = lastMatchStart(WORD_BOUNDARY, snippet);
        }

        // 3) 강제 절단
        if (cut < 0) {
            cut = snippet.length();
        }

        while (cut > 0 && insideCodeBlock(text, cut)) {
            cut = openFenceStart(text, cut);
        }
        cut = backoffLinkBoundary(text, cut);
        // 펜스가 0번 위치에서 열리면 첫 글자 하나만 남는다
        cut = Math.max(1, Math.min(cut, snippet.length()));

        String out = balanceFences(text.substring(0, cut).stripTrailing());
        return addEllipsis ? out + ELLIPSIS : out;
    }

    /**
     * 코드/JSON 용 강제 절단 (말줄임표 없음, 펜스 내부 회피)
     */
    public static String hardCut(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return balanceFences(text);
        }
        int i = safeEnd(text, Math.max(0, maxChars));
        while (i > 0 && insideCodeBlock(text, i)) {
            i = openFenceStart(text, i);
        }
        return balanceFences(text.substring(0, Math.max(1, i)).stripTrailing());
    }

    /**
     * 열린 채 끝난 코드 펜스를 닫는다.
     */
    public static String balanceFences(String text) {
        if (text == null) {
            return null;
        }
        String out = text;
        if (countOccurrences(out, FENCE_TRIPLE) % 2 == 1) {
            out += "\n" + FENCE_TRIPLE;
        }
        if (countOccurrences(out, FENCE_TILDES) % 2 == 1) {
            out += "\n" + FENCE_TILDES;
        }
        return out;
    }

    /**
     * idx 위치가 열린 코드 블록 안인지 (idx 이전 펜스 수가 홀수)
     */
    public static boolean insideCodeBlock(String text, int idx) {
        String before = text.substring(0, Math.max(0, Math.min(idx, text.length())));
        return countOccurrences(before, FENCE_TRIPLE) % 2 == 1
                || countOccurrences(before, FENCE_TILDES) % 2 == 1;
    }

    /**
     * idx 이전에서 열려 있는 펜스의 시작 위치. 펜스 일부만 남기지 않도록 펜스 앞까지 물린다.
     */
    public static int openFenceStart(String text, int idx) {
        String before = text.substring(0, Math.max(0, Math.min(idx, text.length())));
        int start = -1;
        if (countOccurrences(before, FENCE_TRIPLE) % 2 == 1) {
            start = before.lastIndexOf(FENCE_TRIPLE);
        }
        if (countOccurrences(before, FENCE_TILDES) % 2 == 1) {
            start = Math.max(start, before.lastIndexOf(FENCE_TILDES));
        }
        return start >= 0 && start < idx ? start : idx - 1;
    }

    /**
     * 절단 지점 직전에 링크 토큰이 있으면 가장 가까운 앞쪽 단어 경계로 물린다.
     */
    static int backoffLinkBoundary(String text, int cut) {
        int start = Math.max(0, cut - LINK_LOOKBEHIND);
        String window = text.substring(start, cut);
        for (String token : LINK_TOKENS) {
            if (window.contains(token)) {
                int boundary = lastMatchStart(WORD_BOUNDARY, text.substring(0, cut));
                return boundary >= 0 ? boundary : cut;
            }
        }
        return cut;
    }

    /**
     * 문자열 리스트 상한: 최대 항목 수 + 항목별 문자 상한.
     * 잘린 항목이 있고 tail 이면 "… (+K more)" 를 붙인다. 이미 붙어 있던 표시는 K 에 합산한다.
     */
    public static List<String> enforceBullets(List<String> items, int maxEach, int maxCount, boolean tail) {
        List<String> source = items;
        int carried = 0;
        if (tail && !items.isEmpty()) {
            String last = items.get(items.size() - 1);
            Matcher m = last == null ? null : TAIL_MARKER.matcher(last);
            if (m != null && m.matches()) {
                carried = Integer.parseInt(m.group(1));
                source = items.subList(0, items.size() - 1);
            }
        }

        int keep = Math.min(Math.max(0, maxCount), source.size());
        List<String> out = new ArrayList<>(keep + 1);
        for (String s : source.subList(0, keep)) {
            out.add(enforceCharCap(s, maxEach, false));
        }
        int remain = source.size() - keep + carried;
        if (tail && remain > 0) {
            out.add(tailMarker(remain));
        }
        return out;
    }

    public static String tailMarker(int remain) {
        return ELLIPSIS + " (+" + remain + " more)";
    }

    static int countOccurrences(String text, String token) {
        int count = 0;
        int from = 0;
        while (true) {
            int i = text.indexOf(token, from);
            if (i < 0) {
                return count;
            }
            count++;
            from = i + token.length();
        }
    }

    private static int lastMatchEnd(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int end = -1;
        while (m.find()) {
            end = m.end();
        }
        return end;
    }

    private static int lastMatchStart(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int start = -1;
        while (m.find()) {
            start = m.start();
        }
        return start;
    }

    // 서로게이트 쌍 중간에서 자르지 않는다
    private static int safeEnd(String text, int end) {
        int e = Math.min(end, text.length());
        if (e > 1 && e < text.length() && Character.isHighSurrogate(text.charAt(e - 1))) {
            return e - 1;
        }
        return e;
    }
}

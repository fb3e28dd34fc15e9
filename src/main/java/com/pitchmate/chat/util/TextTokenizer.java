package com.pitchmate.chat.util;

import java.util.List;

/**
 * 토크나이저 추상화
 * <p>
 * 토큰 단위는 구현마다 다르다 (정확한 BPE 구현은 정수 ID, 근사 구현은 공백 분할 단어).
 * 정확한 인코더가 없으면 {@link WhitespaceTokenizer} 로 근사한다.
 */
public interface TextTokenizer {

    List<?> encode(String text);

    /**
     * 단위 목록을 텍스트로 되돌린다.
     *
     * @throws RuntimeException 단위 형식이 맞지 않거나 복원에 실패한 경우
     */
    String decode(List<?> units);

    boolean isExact();
}

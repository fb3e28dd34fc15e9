package com.pitchmate.chat.repository;

import com.pitchmate.chat.model.LengthPolicy;
import com.pitchmate.chat.model.LengthStyle;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 길이 제어 정책 테이블 (스타일 힌트, 필드별 정책, 통과 키)
 */
public interface LengthPolicyRepository {

    /**
     * 사용자 지시 힌트 그룹 (one_line → short → medium → long 순서)
     */
    Map<LengthStyle, List<String>> userHints();

    /**
     * 보조 자동 분류 힌트 (one_line → short → long 순서)
     */
    Map<LengthStyle, List<String>> autoHints();

    /**
     * 필드명에 대응하는 정책. 없으면 null.
     */
    LengthPolicy policyFor(String fieldName);

    Set<String> skipKeys();
}

package com.pitchmate.chat.test;

import com.pitchmate.chat.model.LengthPolicy;
import com.pitchmate.chat.model.LengthStyle;
import com.pitchmate.chat.model.PolicyKind;
import com.pitchmate.chat.model.Section;
import com.pitchmate.chat.model.Segment;
import com.pitchmate.chat.model.Slot;
import com.pitchmate.chat.repository.impl.JsonLengthPolicyRepository;
import com.pitchmate.chat.repository.impl.JsonRoutingVocabularyRepository;
import com.pitchmate.chat.repository.impl.JsonScriptCatalogRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * JSON 리소스 저장소 테스트
 * 클래스패스 리소스 로드와 검증 규칙을 확인한다.
 */
public class JsonRepositoriesTest {

    @Test
    @DisplayName("스크립트 카탈로그: A4 B5 C7 D10, 총 26 슬롯")
    public void scriptCatalogShape() {
        JsonScriptCatalogRepository catalog = new JsonScriptCatalogRepository();
        catalog.init();

        assertEquals(4, catalog.slots(Section.A).size());
        assertEquals(5, catalog.slots(Section.B).size());
        assertEquals(7, catalog.slots(Section.C).size());
        assertEquals(10, catalog.slots(Section.D).size());
        assertEquals(26, catalog.totalSlots());
        assertFalse(catalog.offTopicNotice().isBlank());
        assertFalse(catalog.endMessage().isBlank());

        Slot c4 = catalog.slots(Section.C).get(3);
        assertEquals("C4_market_size", c4.id());
        assertEquals(3, c4.ordinal());
        assertTrue(c4.isSegmentParameterized());
        assertTrue(c4.keywords().contains("시장 규모"));
        assertTrue(catalog.slots(Section.A).get(0).keywords().isEmpty());
    }

    @Test
    @DisplayName("리소스가 없으면 기동 실패")
    public void missingResourceFailsFast() {
        JsonScriptCatalogRepository catalog = new JsonScriptCatalogRepository();
        ReflectionTestUtils.setField(catalog, "resource", "no-such-catalog.json");

        assertThrows(IllegalStateException.class, catalog::init);
    }

    @Test
    @DisplayName("라우팅 어휘: 세그먼트 3개, 힌트, 알려진 라우팅 라벨")
    public void routingVocabulary() {
        JsonRoutingVocabularyRepository vocabulary = new JsonRoutingVocabularyRepository();
        vocabulary.init();

        assertEquals(3, vocabulary.segmentKeywords().size());
        assertTrue(vocabulary.keywordsFor(Segment.CAMPING).contains("캠핑"));
        assertTrue(vocabulary.keywordsFor(Segment.NONE).isEmpty());
        assertTrue(vocabulary.onTopicHints().contains("여행"));
        assertTrue(vocabulary.knownIntents().contains("summary"));
        assertTrue(vocabulary.knownIntents().contains("script_qna"));
    }

    @Test
    @DisplayName("길이 정책: 필드별 정책과 힌트 순서")
    public void lengthPolicy() {
        JsonLengthPolicyRepository policies = new JsonLengthPolicyRepository();
        policies.init();

        LengthPolicy bullets = policies.policyFor("bullets");
        assertEquals(PolicyKind.LIST, bullets.kind());
        assertEquals(7, bullets.maxCount());
        assertTrue(bullets.tail());
        assertEquals(140, policies.policyFor("one_liner").maxChars());
        assertTrue(policies.policyFor("code").isCode());
        assertNull(policies.policyFor("unknown_field"));
        assertNull(policies.policyFor(null));

        assertEquals(List.of(LengthStyle.ONE_LINE, LengthStyle.SHORT, LengthStyle.MEDIUM, LengthStyle.LONG),
                List.copyOf(policies.userHints().keySet()));
        assertEquals(List.of(LengthStyle.ONE_LINE, LengthStyle.SHORT, LengthStyle.LONG),
                List.copyOf(policies.autoHints().keySet()));
        assertTrue(policies.skipKeys().contains("domain"));
        assertTrue(policies.skipKeys().contains("progress"));
    }
}

package com.pitchmate.chat.test;

import com.pitchmate.chat.model.ConversationContext;
import com.pitchmate.chat.model.DomainDecision;
import com.pitchmate.chat.model.Progress;
import com.pitchmate.chat.model.Provenance;
import com.pitchmate.chat.model.RequestParams;
import com.pitchmate.chat.model.ScriptMode;
import com.pitchmate.chat.model.ScriptOutput;
import com.pitchmate.chat.model.Section;
import com.pitchmate.chat.model.Segment;
import com.pitchmate.chat.repository.impl.JsonScriptCatalogRepository;
import com.pitchmate.chat.service.impl.ScriptEngineServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 스크립트 엔진 테스트
 * 실제 카탈로그(A4, B5, C7, D10)를 로드해 진행 규칙을 확인한다.
 */
public class ScriptEngineServiceTest {

    private static final String PLAIN_ANSWER = "네 그렇습니다";

    private ScriptEngineServiceImpl engine;
    private JsonScriptCatalogRepository catalog;

    @BeforeEach
    public void setUp() {
        catalog = new JsonScriptCatalogRepository();
        catalog.init();

        engine = new ScriptEngineServiceImpl();
        ReflectionTestUtils.setField(engine, "catalog", catalog);
    }

    // ========== 진행 ==========

    @Test
    @DisplayName("시작 진행도는 A1")
    public void firstTurnAsksA1() {
        ScriptOutput out = engine.advance(null, "캠핑으로 할래요", null, Segment.CAMPING, true);

        assertEquals(ScriptMode.ASK, out.mode());
        assertEquals("A1_problem", out.slotKey());
        assertEquals(Section.A, out.section());
        assertEquals(0, out.progress().index());
        assertTrue(out.progress().answered().isEmpty());
    }

    @Test
    @DisplayName("키워드 없는 답으로 끝까지 가면 26개 질문 후 end")
    public void linearWalkVisitsEverySlotOnce() {
        List<String> asked = new ArrayList<>();
        ScriptOutput out = engine.advance(null, "캠핑으로 할래요", null, Segment.CAMPING, true);
        while (out.mode() == ScriptMode.ASK) {
            asked.add(out.slotKey());
            out = engine.advance(out.progress(), PLAIN_ANSWER, out.slotKey(), Segment.CAMPING, true);
        }

        assertEquals(ScriptMode.END, out.mode());
        assertEquals(catalog.endMessage(), out.message());
        assertNull(out.progress());
        assertEquals(26, asked.size());
        assertEquals(26, Set.copyOf(asked).size());
        assertEquals("A1_problem", asked.get(0));
        assertEquals("B1_core_service", asked.get(4));
        assertEquals("C1_consumer", asked.get(9));
        assertEquals("D10_trust", asked.get(25));
    }

    @Test
    @DisplayName("같은 섹션 뒤쪽 슬롯 키워드가 맞으면 점프 (B1 → B4)")
    public void jumpsToKeywordSlot() {
        Progress atB1 = new Progress(Section.B, 0, Set.of("A1_problem"));

        ScriptOutput out = engine.advance(atB1, "차별화 포인트가 중요해요", "B1_core_service", Segment.CAMPING, true);

        assertEquals("B4_diff", out.slotKey());
        assertEquals("경쟁사와의 차별화 포인트는?", out.question());
        assertTrue(out.progress().isAnswered("B1_core_service"));
    }

    @Test
    @DisplayName("시장 규모 언급 시 C1 → C4 점프, 세그먼트 문구 치환")
    public void jumpsToMarketSizeWithSegmentText() {
        Progress atC1 = new Progress(Section.C, 0, Set.of());

        ScriptOutput out = engine.advance(atC1, "시장 규모가 커지고 있어요", "C1_consumer", Segment.CAMPING, true);

        assertEquals("C4_market_size", out.slotKey());
        assertEquals("캠핑/글램핑 시장 규모와 최근 성장 추세에 대해 알고 있나요?", out.question());
    }

    @Test
    @DisplayName("이미 답한 슬롯으로는 점프하지 않는다")
    public void answeredSlotsAreNotJumpTargets() {
        Progress atB1 = new Progress(Section.B, 0, Set.of("B4_diff"));

        ScriptOutput out = engine.advance(atB1, "차별화 포인트가 중요해요", "B1_core_service", Segment.CAMPING, true);

        assertEquals("B2_value", out.slotKey());
    }

    @Test
    @DisplayName("세그먼트가 없으면 기본 표시명")
    public void segmentParameterizedQuestionWithoutSegment() {
        String text = engine.currentQuestion(new Progress(Section.C, 3, null), Segment.NONE).text();

        assertEquals("여행·레저 시장 규모와 최근 성장 추세에 대해 알고 있나요?", text);
        assertTrue(engine.currentQuestion(new Progress(Section.C, 3, null), Segment.SPORTS).text()
                .startsWith("레저 스포츠(서핑/등산 등) 시장 규모"));
    }

    // ========== 재질문 / 경계 ==========

    @Test
    @DisplayName("lastSlot 이 현재 슬롯과 다르면 같은 질문 재출력")
    public void mismatchedLastSlotRepeatsQuestion() {
        Progress atA2 = new Progress(Section.A, 1, Set.of("A1_problem"));

        ScriptOutput out = engine.advance(atA2, PLAIN_ANSWER, "A1_problem", Segment.CAMPING, true);

        assertEquals("A2_pain", out.slotKey());
        assertEquals(atA2, out.progress());
    }

    @Test
    @DisplayName("빈 답은 진행하지 않는다")
    public void blankAnswerRepeatsQuestion() {
        ScriptOutput out = engine.advance(Progress.first(), "   ", "A1_problem", Segment.CAMPING, true);

        assertEquals("A1_problem", out.slotKey());
        assertTrue(out.progress().answered().isEmpty());
    }

    @Test
    @DisplayName("오프토픽이면 notice, 진행도 변경 없음")
    public void offTopicGivesNotice() {
        ScriptOutput out = engine.advance(new Progress(Section.B, 2, Set.of()), "a", "B3_features", Segment.NONE, false);

        assertEquals(ScriptMode.NOTICE, out.mode());
        assertEquals(catalog.offTopicNotice(), out.message());
        assertNull(out.progress());
        assertNull(out.slotKey());
    }

    @Test
    @DisplayName("D10 답변 후 end, 소진 진행도를 다시 보내도 end")
    public void lastSlotEndsInterview() {
        Progress atD10 = new Progress(Section.D, 9, Set.of());

        ScriptOutput out = engine.advance(atD10, "좋아요", "D10_trust", Segment.SPORTS, true);
        ScriptOutput again = engine.advance(new Progress(Section.D, 10, Set.of("D10_trust")), "또", "D10_trust",
                Segment.SPORTS, true);

        assertEquals(ScriptMode.END, out.mode());
        assertEquals(ScriptMode.END, again.mode());
    }

    @Test
    @DisplayName("소진된 중간 섹션을 다시 보내면 다음 섹션 첫 질문")
    public void exhaustedSectionRollsOver() {
        ScriptOutput out = engine.advance(new Progress(Section.A, 4, Set.of()), PLAIN_ANSWER, null, Segment.CAMPING, true);

        assertEquals("B1_core_service", out.slotKey());
        assertEquals(Section.B, out.section());
    }

    @Test
    @DisplayName("선형 진행은 섹션 끝에서 다음 섹션 0번, D 끝이면 null")
    public void nextProgressCrossesSections() {
        assertEquals(new Progress(Section.B, 0, Set.of()), engine.nextProgress(new Progress(Section.A, 3, Set.of())));
        assertNull(engine.nextProgress(new Progress(Section.D, 9, Set.of())));
        assertNull(engine.currentQuestion(new Progress(Section.D, 10, Set.of()), Segment.NONE));
    }

    // ========== 컨텍스트 처리 ==========

    @Test
    @DisplayName("라우터 세그먼트가 없으면 파라미터 세그먼트로 문구 결정")
    public void processFallsBackToParamSegment() {
        RequestParams params = new RequestParams();
        params.setSegment("experience");
        params.setScriptProgress(new Progress(Section.C, 2, Set.of()));
        params.setLastSlot("C3_paincases");
        ConversationContext context = ConversationContext.ofUserMessage("시장 규모도 궁금해요", params);
        context.setDomain(new DomainDecision(DomainDecision.SCRIPT_INTENT, DomainDecision.TRAVEL_DOMAIN,
                Segment.NONE, 0.5, Provenance.DEFAULT, true, 0.4, null));

        ScriptOutput out = engine.process(context);

        assertNotNull(out);
        assertSame(out, context.getScript());
        assertEquals("C4_market_size", out.slotKey());
        assertTrue(out.question().startsWith("현지체험/액티비티"));
    }
}

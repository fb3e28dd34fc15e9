package com.pitchmate.chat.test;

import com.pitchmate.chat.model.ConversationContext;
import com.pitchmate.chat.model.Provenance;
import com.pitchmate.chat.model.RequestParams;
import com.pitchmate.chat.model.ScriptMode;
import com.pitchmate.chat.model.Segment;
import com.pitchmate.chat.service.ConversationPipelineService;
import com.pitchmate.chat.service.LlmClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * 대화 파이프라인 통합 테스트
 * <p>
 * 실제 리소스와 빈 구성을 사용하고 LLM 클라이언트만 Mock 으로 대체한다.
 */
@SpringBootTest
public class ConversationPipelineServiceTest {

    @Autowired
    private ConversationPipelineService pipeline;

    @MockBean
    private LlmClient llmClient;

    @Test
    @DisplayName("\"캠핑으로 할래요\" → camping, A1 질문, medium")
    public void firstTurnRoutesAndAsks() {
        RequestParams params = new RequestParams();
        ConversationContext context = pipeline.process(ConversationContext.ofUserMessage("캠핑으로 할래요", params));

        assertTrue(context.getRelevance().related());
        assertEquals(Segment.CAMPING, context.getDomain().segment());
        assertEquals(Provenance.RULE, context.getDomain().provenance());
        assertEquals(ScriptMode.ASK, context.getScript().mode());
        assertEquals("A1_problem", context.getScript().slotKey());
        assertEquals("medium", params.getLengthStyle());
        verifyNoInteractions(llmClient);

        Map<?, ?> payload = (Map<?, ?>) context.getTrimmed().toPlain();
        Map<?, ?> domain = (Map<?, ?>) payload.get("domain");
        Map<?, ?> script = (Map<?, ?>) payload.get("script");
        assertEquals("camping", domain.get("segment"));
        assertEquals("rule", domain.get("via"));
        assertEquals(true, domain.get("isOnTopic"));
        assertEquals("ask", script.get("mode"));
        assertEquals("A1_problem", script.get("slot_key"));
        assertNotNull(script.get("progress"));
    }

    @Test
    @DisplayName("\"a\" → 오프토픽 안내")
    public void singleCharacterGetsNotice() {
        ConversationContext context = pipeline.process(ConversationContext.ofUserMessage("a", new RequestParams()));

        assertFalse(context.getRelevance().related());
        assertFalse(context.getDomain().onTopic());
        assertEquals(ScriptMode.NOTICE, context.getScript().mode());
        assertTrue(context.getScript().message().contains("여행·레저"));
    }

    @Test
    @DisplayName("제로샷 허용 시 LLM 1회 호출로 세그먼트 결정")
    public void zeroShotFlow() {
        when(llmClient.call(anyString(), anyString(), anyDouble(), anyInt())).thenReturn("{\"segment\":\"sports\"}");
        RequestParams params = new RequestParams();
        params.setAllowZeroShot(true);

        ConversationContext context = pipeline.process(ConversationContext.ofUserMessage("주말에 뭐 하면 좋을까요", params));

        assertEquals(Segment.SPORTS, context.getDomain().segment());
        assertEquals(Provenance.ZERO_SHOT, context.getDomain().provenance());
        assertEquals(0.65, context.getDomain().confidence(), 1e-9);
        assertEquals(ScriptMode.ASK, context.getScript().mode());
        verify(llmClient, times(1)).call(anyString(), anyString(), anyDouble(), anyInt());
    }

    @Test
    @DisplayName("진행도를 재전송하면 다음 질문으로 이어진다")
    public void resubmittedProgressAdvances() {
        RequestParams params = new RequestParams();
        ConversationContext first = pipeline.process(ConversationContext.ofUserMessage("캠핑으로 할래요", params));

        RequestParams next = new RequestParams();
        next.setSegment("camping");
        next.setScriptProgress(first.getScript().progress());
        next.setLastSlot(first.getScript().slotKey());
        ConversationContext second = pipeline.process(
                ConversationContext.ofUserMessage("초보 캠퍼들이 장비 고르기를 어려워해요", next));

        assertEquals("A2_pain", second.getScript().slotKey());
        assertTrue(second.getScript().progress().isAnswered("A1_problem"));
    }

    @Test
    @DisplayName("생성 출력도 길이 제어를 받는다")
    public void generationOutputsAreTrimmed() {
        RequestParams params = new RequestParams();
        ConversationContext context = ConversationContext.ofUserMessage("캠핑 사업 간단히 요약해줘", params);
        List<String> bullets = new ArrayList<>();
        for (int i = 1; i <= 9; i++) {
            bullets.add("캠핑 포인트 " + i);
        }
        context.putOutput("answer", "캠핑장 예약 플랫폼을 만듭니다. ".repeat(100));
        context.putOutput("bullets", bullets);

        pipeline.process(context);

        assertEquals("short", params.getLengthStyle());
        Map<?, ?> payload = (Map<?, ?>) context.getTrimmed().toPlain();
        assertTrue(((String) payload.get("answer")).length() <= 400);
        List<?> trimmedBullets = (List<?>) payload.get("bullets");
        assertEquals(8, trimmedBullets.size());
        assertEquals("… (+2 more)", trimmedBullets.get(7));
    }

    @Test
    @DisplayName("명시적 라우팅 라벨은 그대로 통과")
    public void explicitStepPassesThrough() {
        ConversationContext context = ConversationContext.ofUserMessage("정리해 주세요", new RequestParams());
        context.setStep("summary");

        pipeline.process(context);

        assertEquals(Provenance.EXPLICIT, context.getDomain().provenance());
        assertEquals("summary", context.getDomain().routedStep());
        verifyNoInteractions(llmClient);
    }
}

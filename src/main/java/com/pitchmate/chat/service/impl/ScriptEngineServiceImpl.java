package com.pitchmate.chat.service.impl;

import com.pitchmate.chat.model.ConversationContext;
import com.pitchmate.chat.model.DomainDecision;
import com.pitchmate.chat.model.Progress;
import com.pitchmate.chat.model.RequestParams;
import com.pitchmate.chat.model.ScriptOutput;
import com.pitchmate.chat.model.ScriptQuestion;
import com.pitchmate.chat.model.Section;
import com.pitchmate.chat.model.Segment;
import com.pitchmate.chat.model.Slot;
import com.pitchmate.chat.repository.ScriptCatalogRepository;
import com.pitchmate.chat.service.ScriptEngineService;
import com.pitchmate.chat.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 스크립트 인터뷰 엔진 구현 (Script Engine)
 * <p>
 * 기능:
 * 섹션 A~D 로 묶인 슬롯 카탈로그 위의 순수 상태 기계.
 * <p>
 * 한 턴 흐름:
 * 1. 오프토픽이면 안내(notice)만 돌려주고 진행도는 그대로 둔다.
 * 2. 직전 질문 슬롯이 현재 슬롯과 같고 답이 비어 있지 않으면 답변 처리 후 다음 진행도를 고른다.
 *    - 같은 섹션의 이후 미답변 슬롯 중 키워드가 맞는 곳이 있으면 점프, 없으면 선형 진행.
 *    - D 섹션까지 끝나면 D 섹션 소진 상태(index = 슬롯 수)로 둔다.
 * 3. 현재 질문이 있으면 ask, 없으면 end.
 */
@Service
public class ScriptEngineServiceImpl implements ScriptEngineService {

    private static final Logger logger = LoggerFactory.getLogger(ScriptEngineServiceImpl.class);

    @Autowired
    private ScriptCatalogRepository catalog;

    @Override
    public Progress firstProgress() {
        return Progress.first();
    }

    @Override
    public Progress nextProgress(Progress progress) {
        List<Slot> order = catalog.slots(progress.section());
        int index = progress.index() + 1;
        if (index < order.size()) {
            return progress.withIndex(index);
        }
        Section next = progress.section().next();
        if (next == null) {
            return null;
        }
        return new Progress(next, 0, progress.answered());
    }

    @Override
    public ScriptQuestion currentQuestion(Progress progress, Segment segment) {
        if (progress == null) {
            return null;
        }
        List<Slot> order = catalog.slots(progress.section());
        int index = progress.index();
        if (index < 0 || index >= order.size()) {
            return null;
        }
        Slot slot = order.get(index);
        String text = slot.questionFor(segment);
        if (text.isEmpty()) {
            return null;
        }
        return new ScriptQuestion(slot.id(), slot.section(), text);
    }

    @Override
    public Progress chooseNextProgress(Progress progress, String userText) {
        List<Slot> order = catalog.slots(progress.section());
        String text = TextNormalizer.normalize(userText);

        Slot top = null;
        int topScore = 0;
        for (int i = progress.index() + 1; i < order.size(); i++) {
            Slot candidate = order.get(i);
            if (progress.isAnswered(candidate.id())) {
                continue;
            }
            int score = TextNormalizer.countHits(text, candidate.keywords());
            if (score > topScore) {
                top = candidate;
                topScore = score;
            }
        }

        if (top != null) {
            logger.debug("keyword jump: {} -> {} (score={})", progress.index(), top.id(), topScore);
            return progress.withIndex(top.ordinal());
        }
        return nextProgress(progress);
    }

    @Override
    public ScriptOutput advance(Progress progress, String userText, String lastSlot, Segment segment, boolean onTopic) {
        if (!onTopic) {
            return ScriptOutput.notice(catalog.offTopicNotice());
        }

        Progress current = rollOver(progress == null ? firstProgress() : progress);
        String answer = userText == null ? "" : userText.strip();

        ScriptQuestion asked = currentQuestion(current, segment);
        if (lastSlot != null && asked != null && lastSlot.equals(asked.slotId()) && !answer.isEmpty()) {
            Progress answered = current.withAnswered(lastSlot);
            Progress next = chooseNextProgress(answered, answer);
            current = next != null ? next : exhausted(answered);
        }

        ScriptQuestion question = currentQuestion(current, segment);
        if (question == null) {
            return ScriptOutput.end(catalog.endMessage());
        }
        return ScriptOutput.ask(question.text(), question.slotId(), current);
    }

    @Override
    public ScriptOutput process(ConversationContext context) {
        RequestParams params = context.getParams();
        DomainDecision domain = context.getDomain();
        boolean onTopic = domain == null || domain.onTopic();

        ScriptOutput output = advance(
                params.getScriptProgress(),
                context.lastUserText(),
                params.getLastSlot(),
                resolveSegment(domain, params),
                onTopic);

        context.setScript(output);
        logger.debug("script: mode={}, section={}, slot={}", output.mode().label(),
                output.section() == null ? null : output.section().title(), output.slotKey());
        return output;
    }

    private static Segment resolveSegment(DomainDecision domain, RequestParams params) {
        if (domain != null && domain.segment().isResolved()) {
            return domain.segment();
        }
        return Segment.fromLabel(params.getSegment());
    }

    // 소진된 섹션(index == 슬롯 수)이 재전송되면 다음 섹션 0번으로 넘긴다
    private Progress rollOver(Progress progress) {
        Progress p = progress;
        while (p.index() >= catalog.slots(p.section()).size() && p.section().next() != null) {
            p = new Progress(p.section().next(), 0, p.answered());
        }
        return p;
    }

    private Progress exhausted(Progress progress) {
        Section last = Section.values()[Section.values().length - 1];
        return new Progress(last, catalog.slots(last).size(), progress.answered());
    }
}

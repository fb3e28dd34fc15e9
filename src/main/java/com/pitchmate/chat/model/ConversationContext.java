package com.pitchmate.chat.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 요청 단위 대화 컨텍스트
 * <p>
 * 요청마다 생성되어 각 단계가 제자리에서 갱신하고, 응답 후 버려진다.
 * 요청 간 공유 상태는 없다.
 */
public class ConversationContext {

    private final List<Turn> turns;
    private final RequestParams params;
    private final Map<String, Object> outputs = new LinkedHashMap<>();
    private String step;

    private RelevanceResult relevance;
    private DomainDecision domain;
    private ScriptOutput script;
    private TrimmedPayload trimmed;

    public ConversationContext(List<Turn> turns, RequestParams params) {
        this.turns = turns == null ? new ArrayList<>() : new ArrayList<>(turns);
        this.params = params == null ? new RequestParams() : params;
    }

    public static ConversationContext ofUserMessage(String message, RequestParams params) {
        return new ConversationContext(List.of(Turn.user(message)), params);
    }

    public List<Turn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    /**
     * 가장 최근 사용자 발화. 없으면 빈 문자열.
     */
    public String lastUserText() {
        for (int i = turns.size() - 1; i >= 0; i--) {
            Turn t = turns.get(i);
            if (t.isUser()) {
                return t.content() == null ? "" : t.content();
            }
        }
        return "";
    }

    /**
     * 최근 k 개 턴을 "role: content" 줄로 묶는다.
     */
    public String shortHistory(int k) {
        int from = Math.max(0, turns.size() - k);
        StringBuilder sb = new StringBuilder();
        for (Turn t : turns.subList(from, turns.size())) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(t.role()).append(": ").append(t.content());
        }
        return sb.toString();
    }

    public RequestParams getParams() {
        return params;
    }

    /**
     * 생성 단계 출력 (answer, bullets 등 임의의 JSON 형태 값)
     */
    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public void putOutput(String name, Object value) {
        outputs.put(name, value);
    }

    public String getStep() {
        return step;
    }

    public void setStep(String step) {
        this.step = step;
    }

    public RelevanceResult getRelevance() {
        return relevance;
    }

    public void setRelevance(RelevanceResult relevance) {
        this.relevance = relevance;
    }

    public DomainDecision getDomain() {
        return domain;
    }

    public void setDomain(DomainDecision domain) {
        this.domain = domain;
    }

    public ScriptOutput getScript() {
        return script;
    }

    public void setScript(ScriptOutput script) {
        this.script = script;
    }

    public TrimmedPayload getTrimmed() {
        return trimmed;
    }

    public void setTrimmed(TrimmedPayload trimmed) {
        this.trimmed = trimmed;
    }
}

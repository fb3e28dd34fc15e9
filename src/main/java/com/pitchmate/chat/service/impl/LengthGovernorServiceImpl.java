package com.pitchmate.chat.service.impl;

import com.pitchmate.chat.model.ConversationContext;
import com.pitchmate.chat.model.LengthDirective;
import com.pitchmate.chat.model.LengthPolicy;
import com.pitchmate.chat.model.LengthStyle;
import com.pitchmate.chat.model.PayloadNode;
import com.pitchmate.chat.model.RequestParams;
import com.pitchmate.chat.model.TrimmedPayload;
import com.pitchmate.chat.repository.LengthPolicyRepository;
import com.pitchmate.chat.service.LengthGovernorService;
import com.pitchmate.chat.service.RuntimeConfigService;
import com.pitchmate.chat.util.NumericParams;
import com.pitchmate.chat.util.TextTokenizer;
import com.pitchmate.chat.util.TextTrimmer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 길이 제어 서비스 구현 (Length Governor)
 * <p>
 * 기능:
 * 응답 페이로드(맵/리스트/스칼라 트리)를 스타일별 문자/토큰 상한에 맞춰 재귀적으로 자른다.
 * <p>
 * 흐름:
 * 1. 스타일 결정 후 유효 상한 계산 (문자: 호출자 값 또는 기본 4000, 토큰: 호출자 값과 스타일 값 중 작은 값).
 * 2. 문자열은 필드명 정책으로 처리: 코드가 아니면 토큰 상한 → 문자 상한 순.
 * 3. 문자열만 담은 리스트는 항목 수/항목별 길이 제한, 그 외 리스트는 항목별 재귀.
 * 4. 맵은 값별 재귀. 메타데이터 키(relevance, faq, domain)와 진행도(progress)는 그대로 통과.
 */
@Service
public class LengthGovernorServiceImpl implements LengthGovernorService {

    private static final Logger logger = LoggerFactory.getLogger(LengthGovernorServiceImpl.class);

    static final int APPROX_CHARS_PER_TOKEN = 4;

    @Autowired
    private LengthPolicyRepository policyRepository;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Lazy
    @Autowired
    private TextTokenizer tokenizer;

    @Override
    public LengthStyle resolveStyle(String userQuery, String explicitStyle) {
        LengthStyle explicit = LengthStyle.fromLabel(explicitStyle);
        if (explicit != null) {
            return explicit;
        }
        String q = userQuery == null ? "" : userQuery;
        LengthStyle detected = firstMatching(policyRepository.userHints(), q);
        if (detected != null) {
            return detected;
        }
        LengthStyle auto = firstMatching(policyRepository.autoHints(), q);
        return auto != null ? auto : LengthStyle.MEDIUM;
    }

    private static LengthStyle firstMatching(Map<LengthStyle, List<String>> groups, String query) {
        for (Map.Entry<LengthStyle, List<String>> group : groups.entrySet()) {
            for (String hint : group.getValue()) {
                if (query.contains(hint)) {
                    return group.getKey();
                }
            }
        }
        return null;
    }

    @Override
    public LengthDirective lengthDirective(LengthStyle style) {
        LengthStyle s = style == null ? LengthStyle.MEDIUM : style;
        String text = "Write with explicit length control:\n"
                + "- Target length: '" + s.label() + "'.\n"
                + "- Hard limits: ≤" + s.charCap() + " characters or the allowed token budget.\n"
                + "- Be concise. Avoid filler words.\n";
        return new LengthDirective(text, s.tokenCap());
    }

    /**
     * 토큰 상한 적용 (Enforce Token Cap)
     * <p>
     * 앞쪽 maxTokens 개 단위를 텍스트로 복원한다. 절단 지점이 코드 펜스 안이면 펜스 앞까지 물리고,
     * 펜스 앞에 남는 글이 없으면 펜스를 닫은 결과가 상한 안에 들어올 때까지 단위를 줄인다.
     * 복원에 실패하면 근사 단위(단어)를 공백으로 잇거나 토큰당 4자로 어림해 자른다.
     */
    @Override
    public String enforceTokenCap(String text, Integer maxTokens) {
        if (text == null || maxTokens == null || maxTokens <= 0) {
            return text;
        }
        List<?> units = tokenizer.encode(text);
        if (units.size() <= maxTokens) {
            return text;
        }
        String head;
        try {
            head = tokenizer.decode(units.subList(0, maxTokens));
        } catch (RuntimeException e) {
            logger.warn("토큰 복원 실패, 근사 절단 사용: {}", e.getMessage());
            return approximateCut(text, units, maxTokens);
        }
        if (!TextTrimmer.insideCodeBlock(head, head.length())) {
            return head;
        }

        String before = head.substring(0, TextTrimmer.openFenceStart(head, head.length())).stripTrailing();
        if (!before.isEmpty()) {
            return before;
        }
        for (int k = maxTokens - 1; k > 0; k--) {
            String candidate;
            try {
                candidate = TextTrimmer.balanceFences(tokenizer.decode(units.subList(0, k)).stripTrailing());
            } catch (RuntimeException e) {
                logger.debug("토큰 {}개 복원 실패: {}", k, e.getMessage());
                continue;
            }
            if (tokenizer.encode(candidate).size() <= maxTokens) {
                return candidate;
            }
        }
        return "";
    }

    private String approximateCut(String text, List<?> units, int maxTokens) {
        if (!tokenizer.isExact()) {
            List<String> words = new ArrayList<>(maxTokens);
            for (Object u : units.subList(0, maxTokens)) {
                words.add(String.valueOf(u));
            }
            return String.join(" ", words);
        }
        return text.substring(0, Math.min(text.length(), maxTokens * APPROX_CHARS_PER_TOKEN));
    }

    @Override
    public TrimmedPayload trimPayload(PayloadNode payload, LengthStyle style, Integer maxChars, Integer maxTokens) {
        int globalCap = NumericParams.positiveIntOrDefault(maxChars, runtimeConfigService.getDefaultMaxChars());
        Integer callerTokens = NumericParams.positiveIntOrNull(maxTokens);

        Integer styleChars = style == null ? null : style.charCap();
        Integer tokenCap = callerTokens;
        if (style != null) {
            tokenCap = callerTokens == null ? style.tokenCap() : Math.min(callerTokens, style.tokenCap());
        }

        Budget budget = new Budget(styleChars, globalCap, tokenCap);
        PayloadNode trimmed = payload == null ? null : trimNode(null, payload, budget);
        return new TrimmedPayload(trimmed, style, globalCap, tokenCap);
    }

    @Override
    public TrimmedPayload apply(ConversationContext context, PayloadNode payload) {
        RequestParams params = context.getParams();
        LengthStyle style = resolveStyle(context.lastUserText(), params.getLengthStyle());
        Integer maxChars = NumericParams.positiveIntOrNull(params.getMaxChars());
        Integer maxTokens = NumericParams.positiveIntOrNull(params.getMaxTokens());

        TrimmedPayload result = trimPayload(payload, style, maxChars, maxTokens);
        params.setLengthStyle(style.label());
        context.setTrimmed(result);
        logger.debug("length: style={}, charCap={}, tokenCap={}", style.label(), result.charCap(), result.tokenCap());
        return result;
    }

    private PayloadNode trimNode(String key, PayloadNode node, Budget budget) {
        if (node instanceof PayloadNode.Text text) {
            return PayloadNode.text(trimText(key, text.value(), budget));
        }
        if (node instanceof PayloadNode.Sequence seq) {
            if (seq.isAllText()) {
                return trimTextList(key, seq.texts(), budget);
            }
            List<PayloadNode> items = new ArrayList<>(seq.items().size());
            for (PayloadNode item : seq.items()) {
                items.add(trimNode(key, item, budget));
            }
            return new PayloadNode.Sequence(items);
        }
        if (node instanceof PayloadNode.Mapping map) {
            Map<String, PayloadNode> entries = new LinkedHashMap<>();
            map.entries().forEach((k, v) -> entries.put(k,
                    policyRepository.skipKeys().contains(k) ? v : trimNode(k, v, budget)));
            return new PayloadNode.Mapping(entries);
        }
        return node;
    }

    private String trimText(String key, String value, Budget budget) {
        if (value == null) {
            return null;
        }
        LengthPolicy policy = policyOrDefault(key, LengthPolicy.text());
        boolean isCode = policy.isCode();

        String text = value;
        if (!isCode && budget.tokenCap() != null) {
            text = enforceTokenCap(TextTrimmer.balanceFences(text), budget.tokenCap());
        }

        int fallback = budget.styleChars() != null ? budget.styleChars() : budget.globalCap();
        int capChars = Math.min(policy.maxChars() != null ? policy.maxChars() : fallback, budget.globalCap());
        return TextTrimmer.enforceCharCap(text, capChars, isCode);
    }

    private PayloadNode trimTextList(String key, List<String> values, Budget budget) {
        LengthPolicy policy = policyOrDefault(key, LengthPolicy.list());
        int fallbackEach = budget.styleChars() != null ? budget.styleChars() : LengthPolicy.DEFAULT_MAX_EACH;
        int each = Math.min(policy.maxEach() != null ? policy.maxEach() : fallbackEach, LengthPolicy.DEFAULT_MAX_EACH);
        int count = policy.maxCount() != null ? policy.maxCount() : LengthPolicy.DEFAULT_MAX_COUNT;

        List<PayloadNode> items = new ArrayList<>();
        for (String s : TextTrimmer.enforceBullets(values, each, count, policy.tail())) {
            items.add(PayloadNode.text(s));
        }
        return new PayloadNode.Sequence(items);
    }

    private LengthPolicy policyOrDefault(String key, LengthPolicy defaultPolicy) {
        LengthPolicy policy = policyRepository.policyFor(key);
        return policy != null ? policy : defaultPolicy;
    }

    private record Budget(Integer styleChars, int globalCap, Integer tokenCap) {
    }
}

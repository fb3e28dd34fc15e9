package com.pitchmate.chat.service.impl;

import com.pitchmate.chat.model.ConversationContext;
import com.pitchmate.chat.model.RelevanceResult;
import com.pitchmate.chat.service.RelevanceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

@Service
public class RelevanceServiceImpl implements RelevanceService {

    private static final Logger logger = LoggerFactory.getLogger(RelevanceServiceImpl.class);

    static final int UNRELATED_MIN_LEN = 2;

    private static final Pattern LATIN_OR_HANGUL_ALNUM = Pattern.compile("[A-Za-z0-9가-힣]");

    @Override
    public boolean isUnrelated(String message) {
        if (message == null || message.strip().length() < UNRELATED_MIN_LEN) {
            return true;
        }
        return !LATIN_OR_HANGUL_ALNUM.matcher(message).find();
    }

    @Override
    public RelevanceResult check(ConversationContext context) {
        RelevanceResult result = new RelevanceResult(!isUnrelated(context.lastUserText()));
        context.setRelevance(result);
        logger.debug("relevance: related={}", result.related());
        return result;
    }
}

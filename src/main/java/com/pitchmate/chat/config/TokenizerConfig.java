package com.pitchmate.chat.config;

import com.pitchmate.chat.util.JtokkitTokenizer;
import com.pitchmate.chat.util.TextTokenizer;
import com.pitchmate.chat.util.WhitespaceTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * 토크나이저 설정
 * <p>
 * 정확한 인코더(jtokkit cl100k_base)는 처음 쓰일 때 한 번 만들어져 프로세스 동안 공유된다.
 * 생성에 실패하면 공백 분할 근사 토크나이저를 쓴다.
 */
@Configuration
public class TokenizerConfig {

    private static final Logger logger = LoggerFactory.getLogger(TokenizerConfig.class);

    @Bean
    @Lazy
    public TextTokenizer textTokenizer() {
        try {
            TextTokenizer tokenizer = new JtokkitTokenizer();
            logger.info("Tokenizer initialized: jtokkit cl100k_base, exact={}", tokenizer.isExact());
            return tokenizer;
        } catch (RuntimeException | LinkageError e) {
            logger.warn("jtokkit 초기화 실패, 공백 분할 토크나이저로 대체: {}", e.getMessage());
            return new WhitespaceTokenizer();
        }
    }
}

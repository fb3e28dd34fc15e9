package com.pitchmate.chat.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

/**
 * JSON 리소스 로더
 * 클래스패스(resources)의 JSON 파일을 읽어 지정한 타입으로 변환한다.
 */
public class JsonLoader {

    private static final Logger logger = LoggerFactory.getLogger(JsonLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonLoader() {
    }

    /**
     * 클래스패스 JSON 리소스를 읽는다.
     * <p>
     * 어휘/카탈로그 리소스는 없으면 동작할 수 없으므로 빈 값으로 대체하지 않고 예외를 던진다.
     *
     * @param resource 리소스 경로 (resources 기준)
     * @param type     대상 타입
     * @return 변환된 값
     * @throws IllegalStateException 리소스가 없거나 파싱에 실패한 경우
     */
    public static <T> T loadResource(String resource, TypeReference<T> type) {
        String path = resource.startsWith("/") ? resource : "/" + resource;
        try (InputStream is = JsonLoader.class.getResourceAsStream(path)) {
            if (is == null) {
                logger.error("리소스를 찾을 수 없음: {}", resource);
                throw new IllegalStateException("Missing classpath resource: " + resource);
            }
            T value = MAPPER.readValue(is, type);
            logger.info("리소스 로드 완료: {}", resource);
            return value;
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            logger.error("JSON 리소스 파싱 실패 {}: {}", resource, e.getMessage());
            throw new IllegalStateException("Failed to load " + resource, e);
        }
    }
}

package com.pitchmate.chat.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pitchmate.chat.service.LlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Ollama LLM 클라이언트 (Ollama LLM Client)
 * <p>
 * 기능:
 * Ollama `/api/generate` 를 stream=false 로 호출한다. 연결/읽기 타임아웃으로 호출 시간을 제한한다.
 * <p>
 * 흐름:
 * 1. JSON Body 구성 (model, prompt, system, options.temperature, options.num_predict).
 * 2. POST 후 응답 줄마다 `response` 필드를 이어 붙인다.
 */
@Lazy
@Service
public class OllamaLlmClient implements LlmClient {

    private static final Logger logger = LoggerFactory.getLogger(OllamaLlmClient.class);

    @Value("${ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${ollama.model:ministral:8b}")
    private String model;

    @Value("${ollama.timeout:10000}")
    private int timeout;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String call(String prompt, String system, double temperature, int maxTokens) {
        try {
            Map<String, Object> request = new HashMap<>();
            request.put("model", model);
            request.put("prompt", prompt);
            if (system != null && !system.isBlank()) {
                request.put("system", system);
            }
            request.put("stream", false);

            Map<String, Object> options = new HashMap<>();
            options.put("temperature", temperature);
            if (maxTokens > 0) {
                options.put("num_predict", maxTokens);
            }
            request.put("options", options);

            HttpURLConnection conn = createConnection("/api/generate");
            conn.setRequestMethod("POST");
            conn.setDoOutput(true);
            conn.setRequestProperty("Content-Type", "application/json");

            try (OutputStream os = conn.getOutputStream()) {
                os.write(objectMapper.writeValueAsBytes(request));
            }

            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(conn.getInputStream(), StandardCharsets.UTF_8))) {
                StringBuilder sb = new StringBuilder();
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    JsonNode node = objectMapper.readTree(line);
                    if (node.has("response")) {
                        sb.append(node.get("response").asText());
                    }
                }
                return sb.toString();
            }
        } catch (Exception e) {
            logger.error("Ollama API 호출 실패: {}", e.getMessage());
            throw new RuntimeException("LLM 호출 실패", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpURLConnection conn = createConnection("/api/tags");
            conn.setRequestMethod("GET");
            conn.setConnectTimeout(Math.min(timeout, 5000));
            return conn.getResponseCode() == 200;
        } catch (Exception e) {
            logger.debug("Ollama 사용 불가: {}", e.getMessage());
            return false;
        }
    }

    private HttpURLConnection createConnection(String path) throws Exception {
        URI uri = URI.create(baseUrl + path);
        HttpURLConnection conn = (HttpURLConnection) uri.toURL().openConnection();
        conn.setConnectTimeout(timeout);
        conn.setReadTimeout(timeout);
        return conn;
    }
}

package com.sqlopt.optimizer.service.llm;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chat Completions client for OpenAI (or any endpoint speaking the same API via
 * {@code openai.base-url}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAIService implements LLMService {

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;

  @Value("${openai.api-key:}")
  private String openaiApiKey;

  @Value("${openai.model:gpt-4.1-mini}")
  private String model;

  @Value("${openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${openai.max-tokens:4096}")
  private int maxTokens;

  @Value("${openai.temperature:0.0}")
  private double temperature;

  @Value("${openai.retry.max-attempts:2}")
  private int maxRetryAttempts;

  @Override
  public boolean isConfigured() {
    return openaiApiKey != null && !openaiApiKey.trim().isEmpty();
  }

  @Override
  public String complete(String systemPrompt, String userPrompt) throws Exception {
    if (!isConfigured()) {
      throw new IllegalStateException(
          "OpenAI API key not configured. Please set OPENAI_API_KEY environment variable.");
    }

    log.info("OpenAI request model={}, maxTokens={}, temperature={}", model, maxTokens, temperature);

    ObjectNode requestBody = objectMapper.createObjectNode();
    requestBody.put("model", model);
    requestBody.put("max_tokens", maxTokens);
    requestBody.put("temperature", temperature);

    ArrayNode messages = requestBody.putArray("messages");
    if (systemPrompt != null && !systemPrompt.isEmpty()) {
      messages.addObject().put("role", "system").put("content", systemPrompt);
    }
    messages.addObject().put("role", "user").put("content", userPrompt);

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setBearerAuth(openaiApiKey);

    HttpEntity<String> entity = new HttpEntity<>(requestBody.toString(), headers);
    String url = baseUrl + "/chat/completions";

    int attempt = 0;
    while (true) {
      try {
        ResponseEntity<String> response =
            restTemplate.exchange(url, HttpMethod.POST, entity, String.class);
        return extractContent(response);
      } catch (Exception e) {
        attempt++;
        log.warn("OpenAI API call attempt {} failed: {}", attempt, e.getMessage());

        if (attempt >= maxRetryAttempts) {
          throw new RuntimeException(
              "OpenAI API call failed after " + attempt + " attempt(s): " + e.getMessage(), e);
        }

        // Simple linear backoff
        try {
          Thread.sleep(1000L * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new RuntimeException("Interrupted during retry", ie);
        }
      }
    }
  }

  private String extractContent(ResponseEntity<String> response) throws Exception {
    if (response.getBody() != null) {
      JsonNode responseJson = objectMapper.readTree(response.getBody());
      JsonNode choices = responseJson.get("choices");

      if (choices != null && choices.isArray() && choices.size() > 0) {
        JsonNode messageNode = choices.get(0).get("message");
        if (messageNode != null && messageNode.has("content")) {
          String content = messageNode.get("content").asText();
          log.info("OpenAI response content length={} chars", content.length());
          return content;
        }
      }
    }

    log.error(
        "Invalid response format from OpenAI API: status={}, bodyPresent={}",
        response.getStatusCode(),
        response.getBody() != null);
    throw new IllegalStateException("Invalid response format from OpenAI API");
  }

  @Override
  public String getCurrentModelId() {
    return model;
  }
}

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
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Anthropic Messages API client. */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnthropicService implements LLMService {

  private static final String API_VERSION = "2023-06-01";

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;

  @Value("${anthropic.api-key:}")
  private String apiKey;

  @Value("${anthropic.model:claude-3-5-sonnet-latest}")
  private String model;

  @Value("${anthropic.base-url:https://api.anthropic.com/v1}")
  private String baseUrl;

  @Value("${anthropic.max-tokens:4096}")
  private int maxTokens;

  @Value("${anthropic.temperature:0.0}")
  private double temperature;

  @Override
  public boolean isConfigured() {
    return apiKey != null && !apiKey.trim().isEmpty();
  }

  @Override
  public String complete(String systemPrompt, String userPrompt) throws Exception {
    if (!isConfigured()) {
      throw new IllegalStateException(
          "Anthropic API key not configured. Please set ANTHROPIC_API_KEY environment variable.");
    }

    log.info("Anthropic request model={}, maxTokens={}", model, maxTokens);

    ObjectNode requestBody = objectMapper.createObjectNode();
    requestBody.put("model", model);
    requestBody.put("max_tokens", maxTokens);
    requestBody.put("temperature", temperature);
    if (systemPrompt != null && !systemPrompt.isEmpty()) {
      requestBody.put("system", systemPrompt);
    }
    requestBody.putArray("messages").addObject().put("role", "user").put("content", userPrompt);

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.set("x-api-key", apiKey);
    headers.set("anthropic-version", API_VERSION);

    ResponseEntity<String> response =
        restTemplate.exchange(
            baseUrl + "/messages",
            HttpMethod.POST,
            new HttpEntity<>(requestBody.toString(), headers),
            String.class);

    if (response.getBody() != null) {
      JsonNode content = objectMapper.readTree(response.getBody()).get("content");
      if (content != null && content.isArray()) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
          if ("text".equals(block.path("type").asText())) {
            text.append(block.path("text").asText());
          }
        }
        if (text.length() > 0) {
          log.info("Anthropic response content length={} chars", text.length());
          return text.toString();
        }
      }
    }

    log.error(
        "Invalid response format from Anthropic API: status={}, bodyPresent={}",
        response.getStatusCode(),
        response.getBody() != null);
    throw new IllegalStateException("Invalid response format from Anthropic API");
  }

  @Override
  public String getCurrentModelId() {
    return model;
  }
}

package com.sqlopt.optimizer.service.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
@DisplayName("OpenAIService Tests")
class OpenAIServiceTest {

  private static final String URL = "https://api.openai.com/v1/chat/completions";

  @Mock private RestTemplate restTemplate;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private OpenAIService openAIService;

  @BeforeEach
  void setUp() {
    openAIService = new OpenAIService(objectMapper, restTemplate);
    ReflectionTestUtils.setField(openAIService, "openaiApiKey", "test-key");
    ReflectionTestUtils.setField(openAIService, "model", "gpt-4.1-mini");
    ReflectionTestUtils.setField(openAIService, "baseUrl", "https://api.openai.com/v1");
    ReflectionTestUtils.setField(openAIService, "maxTokens", 1024);
    ReflectionTestUtils.setField(openAIService, "temperature", 0.0);
    ReflectionTestUtils.setField(openAIService, "maxRetryAttempts", 1);
  }

  @Test
  @DisplayName("Should send system and user messages and return the reply content")
  @SuppressWarnings("unchecked")
  void shouldReturnReplyContent() throws Exception {
    when(restTemplate.exchange(eq(URL), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
        .thenReturn(
            new ResponseEntity<>(
                "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"{\\\"optimized_sql\\\":\\\"SELECT 1\\\"}\"}}]}",
                HttpStatus.OK));

    String reply = openAIService.complete("rules", "optimize");

    assertThat(reply).isEqualTo("{\"optimized_sql\":\"SELECT 1\"}");

    ArgumentCaptor<HttpEntity<String>> captor = ArgumentCaptor.forClass(HttpEntity.class);
    verify(restTemplate).exchange(eq(URL), eq(HttpMethod.POST), captor.capture(), eq(String.class));
    JsonNode body = objectMapper.readTree(captor.getValue().getBody());
    assertThat(body.get("model").asText()).isEqualTo("gpt-4.1-mini");
    assertThat(body.get("messages").get(0).get("role").asText()).isEqualTo("system");
    assertThat(body.get("messages").get(0).get("content").asText()).isEqualTo("rules");
    assertThat(body.get("messages").get(1).get("content").asText()).isEqualTo("optimize");
    assertThat(captor.getValue().getHeaders().getFirst("Authorization")).isEqualTo("Bearer test-key");
  }

  @Test
  @DisplayName("Should report failure after the configured attempts")
  void shouldFailAfterRetries() {
    when(restTemplate.exchange(eq(URL), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
        .thenThrow(new ResourceAccessException("Connection refused"));

    assertThatThrownBy(() -> openAIService.complete("rules", "optimize"))
        .isInstanceOf(RuntimeException.class)
        .hasMessage("OpenAI API call failed after 1 attempt(s): Connection refused");
    verify(restTemplate, times(1))
        .exchange(eq(URL), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class));
  }

  @Test
  @DisplayName("Should refuse to call without an API key")
  void shouldRequireApiKey() {
    ReflectionTestUtils.setField(openAIService, "openaiApiKey", "");

    assertThat(openAIService.isConfigured()).isFalse();
    assertThatThrownBy(() -> openAIService.complete("rules", "optimize"))
        .isInstanceOf(IllegalStateException.class);
    verifyNoInteractions(restTemplate);
  }
}

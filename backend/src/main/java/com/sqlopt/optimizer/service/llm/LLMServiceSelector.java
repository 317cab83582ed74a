package com.sqlopt.optimizer.service.llm;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses the LLM backend from {@code llm.provider}, falling back to any backend that is
 * configured.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LLMServiceSelector {

  private final OpenAIService openAIService;
  private final AnthropicService anthropicService;
  private final AwsBedrockService awsBedrockService;

  @Value("${llm.provider:openai}")
  private String preferredProvider;

  /**
   * Gets the appropriate LLM service based on configuration and availability.
   * @return The configured LLM service
   * @throws IllegalStateException if no service is configured
   */
  public LLMService getLLMService() {
    if ("openai".equalsIgnoreCase(preferredProvider) && openAIService.isConfigured()) {
      log.debug("Using OpenAI service for LLM calls");
      return openAIService;
    }

    if ("anthropic".equalsIgnoreCase(preferredProvider) && anthropicService.isConfigured()) {
      log.debug("Using Anthropic service for LLM calls");
      return anthropicService;
    }

    if ("bedrock".equalsIgnoreCase(preferredProvider) && awsBedrockService.isConfigured()) {
      log.debug("Using AWS Bedrock service for LLM calls");
      return awsBedrockService;
    }

    // Fallback: try any available service
    if (openAIService.isConfigured()) {
      log.warn("Preferred provider '{}' not available, falling back to OpenAI", preferredProvider);
      return openAIService;
    }

    if (anthropicService.isConfigured()) {
      log.warn(
          "Preferred provider '{}' not available, falling back to Anthropic", preferredProvider);
      return anthropicService;
    }

    if (awsBedrockService.isConfigured()) {
      log.warn(
          "Preferred provider '{}' not available, falling back to AWS Bedrock", preferredProvider);
      return awsBedrockService;
    }

    throw new IllegalStateException(
        "No LLM service is configured. Set OPENAI_API_KEY, ANTHROPIC_API_KEY or enable AWS Bedrock.");
  }

  /**
   * Gets the currently active provider name
   * @return The provider name ("openai", "anthropic" or "bedrock")
   */
  public String getActiveProvider() {
    LLMService service = getLLMService();
    if (service instanceof OpenAIService) {
      return "openai";
    } else if (service instanceof AnthropicService) {
      return "anthropic";
    } else if (service instanceof AwsBedrockService) {
      return "bedrock";
    }
    return "unknown";
  }
}

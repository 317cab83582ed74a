package com.sqlopt.optimizer.service.llm;

/**
 * Common interface for LLM backends (OpenAI, Anthropic, AWS Bedrock).
 */
public interface LLMService {

  /**
   * Sends one system + user message pair and returns the model's text reply.
   * @param systemPrompt Fixed instructions for the model
   * @param userPrompt The task prompt
   * @return The raw text of the reply
   * @throws Exception if the call fails
   */
  String complete(String systemPrompt, String userPrompt) throws Exception;

  /**
   * Gets the current model ID being used
   * @return The model identifier
   */
  String getCurrentModelId();

  /**
   * Checks if the service is properly configured
   * @return true if configured, false otherwise
   */
  boolean isConfigured();
}

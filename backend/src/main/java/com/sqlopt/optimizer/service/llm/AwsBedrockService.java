package com.sqlopt.optimizer.service.llm;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.AccessDeniedException;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.Message;
import software.amazon.awssdk.services.bedrockruntime.model.SystemContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ThrottlingException;
import software.amazon.awssdk.services.bedrockruntime.model.ValidationException;

/**
 * AWS Bedrock backend using the model-agnostic Converse API. Credentials come from the default
 * AWS provider chain; the client is only built when {@code aws.bedrock.enabled} is true.
 */
@Slf4j
@Service
public class AwsBedrockService implements LLMService {

  private BedrockRuntimeClient bedrockRuntimeClient;

  @Value("${aws.bedrock.enabled:false}")
  private boolean enabled;

  @Value("${aws.bedrock.model-id:}")
  private String modelId;

  @Value("${aws.region:us-east-1}")
  private String region;

  @Value("${aws.bedrock.retry.max-attempts:5}")
  private int maxRetryAttempts;

  @Value("${aws.bedrock.retry.initial-delay-ms:1000}")
  private long initialRetryDelayMs;

  @Value("${aws.bedrock.retry.max-delay-ms:60000}")
  private long maxRetryDelayMs;

  @Value("${aws.bedrock.max-tokens:4096}")
  private int maxTokens;

  @Value("${aws.bedrock.temperature:0}")
  private double temperature;

  @PostConstruct
  void initializeClient() {
    if (!enabled) {
      log.debug("AWS Bedrock disabled");
      return;
    }
    bedrockRuntimeClient =
        BedrockRuntimeClient.builder()
            .region(Region.of(region))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .build();
    log.info("AWS Bedrock client initialized for region: {} with model: {}", region, modelId);
  }

  @PreDestroy
  void closeClient() {
    if (bedrockRuntimeClient != null) {
      bedrockRuntimeClient.close();
      bedrockRuntimeClient = null;
    }
  }

  @Override
  public boolean isConfigured() {
    return bedrockRuntimeClient != null && modelId != null && !modelId.trim().isEmpty();
  }

  @Override
  public String getCurrentModelId() {
    return modelId;
  }

  /**
   * Invokes the model using the unified Converse API. This method works with all Bedrock models
   * without requiring model-specific formats.
   *
   * @param systemPrompt Fixed instructions for the model
   * @param userPrompt The prompt to send to the model
   * @return The model's response text
   * @throws Exception if the invocation fails
   */
  @Override
  public String complete(String systemPrompt, String userPrompt) throws Exception {
    if (bedrockRuntimeClient == null) {
      throw new IllegalStateException(
          "AWS Bedrock client not initialized. Set aws.bedrock.enabled=true and provide AWS credentials.");
    }

    if (modelId == null || modelId.trim().isEmpty()) {
      throw new IllegalStateException("No Bedrock model configured. Please set aws.bedrock.model-id.");
    }

    log.debug("Sending prompt to AWS Bedrock model {}", modelId);

    Message userMessage =
        Message.builder()
            .role(ConversationRole.USER)
            .content(ContentBlock.builder().text(userPrompt).build())
            .build();

    InferenceConfiguration inferenceConfig =
        InferenceConfiguration.builder()
            .maxTokens(maxTokens)
            .temperature((float) temperature)
            .build();

    ConverseRequest.Builder requestBuilder =
        ConverseRequest.builder()
            .modelId(modelId)
            .messages(List.of(userMessage))
            .inferenceConfig(inferenceConfig);
    if (systemPrompt != null && !systemPrompt.isEmpty()) {
      requestBuilder.system(SystemContentBlock.builder().text(systemPrompt).build());
    }
    ConverseRequest converseRequest = requestBuilder.build();

    // Retry with exponential backoff on throttling only
    int attempt = 0;
    long retryDelay = initialRetryDelayMs;

    while (true) {
      try {
        ConverseResponse response = bedrockRuntimeClient.converse(converseRequest);

        Message responseMessage = response.output().message();
        if (responseMessage != null && !responseMessage.content().isEmpty()) {
          ContentBlock responseContent = responseMessage.content().get(0);
          if (responseContent.text() != null) {
            return responseContent.text();
          }
        }

        throw new IllegalStateException("No content in model response");

      } catch (ThrottlingException e) {
        attempt++;
        if (attempt >= maxRetryAttempts) {
          log.error("Max retry attempts ({}) reached for AWS Bedrock throttling", maxRetryAttempts);
          throw new RuntimeException(
              String.format(
                  "AWS Bedrock throttling error after %d retry attempts", maxRetryAttempts),
              e);
        }

        log.warn(
            "AWS Bedrock throttling detected. Retrying in {} ms (attempt {}/{})",
            retryDelay,
            attempt,
            maxRetryAttempts);

        try {
          Thread.sleep(retryDelay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new RuntimeException("Retry interrupted", ie);
        }

        retryDelay = Math.min(retryDelay * 2, maxRetryDelayMs);

      } catch (AccessDeniedException e) {
        log.error("Access denied to AWS Bedrock model: {}", modelId, e);
        throw new RuntimeException(
            String.format(
                "You don't have access to the model '%s' in region %s", modelId, region),
            e);
      } catch (ValidationException e) {
        log.error("Validation error for model: {}", modelId, e);
        throw new RuntimeException(
            String.format(
                "Model '%s' validation error. It may not be available in region %s",
                modelId, region),
            e);
      }
    }
  }
}

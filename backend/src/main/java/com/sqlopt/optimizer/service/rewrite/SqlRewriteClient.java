package com.sqlopt.optimizer.service.rewrite;

import org.springframework.stereotype.Service;

import com.sqlopt.optimizer.dto.rewrite.RewriteResult;
import com.sqlopt.optimizer.service.llm.LLMService;
import com.sqlopt.optimizer.service.prompt.RewritePromptBuilder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Generative-model handle used by the optimizer: prompt in, parsed {@link RewriteResult} out. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SqlRewriteClient {

  private final LLMService llmService;
  private final RewritePromptBuilder promptBuilder;
  private final RewriteResponseParser responseParser;

  /** Never throws; a failed call or unusable output is a failed result. */
  public RewriteResult rewrite(String userPrompt) {
    String raw;
    try {
      raw = llmService.complete(promptBuilder.systemPrompt(), userPrompt);
    } catch (Exception e) {
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      log.warn("LLM call failed: {}", message);
      return RewriteResult.failure("LLM call failed: " + message);
    }
    log.debug(
        "LLM raw output (first 500 chars): {}",
        raw != null && raw.length() > 500 ? raw.substring(0, 500) + "…" : raw);
    return responseParser.parse(raw);
  }
}

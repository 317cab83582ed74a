package com.sqlopt.optimizer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import com.sqlopt.optimizer.service.llm.LLMService;
import com.sqlopt.optimizer.service.llm.LLMServiceSelector;

import lombok.extern.slf4j.Slf4j;

/** Resolves the model backend once at startup; everything downstream sees a single LLMService. */
@Slf4j
@Configuration
public class LlmConfig {

  @Bean
  @Primary
  public LLMService activeLlmService(LLMServiceSelector selector) {
    LLMService service = selector.getLLMService();
    log.info(
        "Using LLM provider '{}' with model {}",
        selector.getActiveProvider(),
        service.getCurrentModelId());
    return service;
  }
}

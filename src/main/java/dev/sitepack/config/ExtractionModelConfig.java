package dev.sitepack.config;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.sitepack.llm.ExtractionProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Chat model used for relevance judgments and deep extraction. */
@Configuration
public class ExtractionModelConfig {

  @Bean
  @ConditionalOnMissingBean
  public ChatModel extractionChatModel(ExtractionProperties properties) {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new IllegalStateException(
          "sitepack.extraction.api-key is not set (export ANTHROPIC_API_KEY)");
    }
    return AnthropicChatModel.builder()
        .apiKey(properties.apiKey())
        .modelName(properties.modelName())
        .maxTokens(properties.maxTokens())
        .temperature(properties.temperature())
        .timeout(properties.requestTimeout())
        .build();
  }
}

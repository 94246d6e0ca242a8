package com.cario.valuation.app.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * ChatGPT configuration for Spring AI.
 *
 * <p>The {@link OpenAiChatModel} is autoconfigured from {@code spring.ai.openai.*}; this exposes
 * the {@link ChatClient.Builder} the price-discovery service builds its client from.
 */
@Configuration
public class ChatGptConfig {

  @Bean
  public ChatClient.Builder chatClientBuilder(OpenAiChatModel openAiChatModel) {
    return ChatClient.builder(openAiChatModel);
  }
}

package com.cario.valuation.app.service;

import com.cario.valuation.app.prompt.PromptConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/** Loads prompt templates from a Spring resource location (classpath by default). */
@Log4j2
@RequiredArgsConstructor
public class PromptLoaderService {

  private final ResourceLoader resourceLoader;

  private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
  private final ObjectMapper jsonMapper = new ObjectMapper();
  private final Map<String, PromptConfig> loaded = new ConcurrentHashMap<>();

  /** Loads and memoizes the prompt at {@code location}, e.g. {@code classpath:prompts/x.json}. */
  public PromptConfig load(String location) {
    return loaded.computeIfAbsent(location, this::read);
  }

  private PromptConfig read(String location) {
    String raw;
    Resource resource = resourceLoader.getResource(location);
    try (InputStream in = resource.getInputStream()) {
      raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.error("Failed to load prompt from {}", location, e);
      throw new IllegalStateException("Failed to load prompt from " + location, e);
    }

    // YAML first; JSON documents are valid YAML as well
    try {
      Map<String, Object> map = yamlMapper.readValue(raw, new TypeReference<>() {});
      PromptConfig cfg = new PromptConfig();
      cfg.setSystemTemplate(asString(map.get("system")));
      cfg.setUserTemplate(asString(map.get("user")));
      cfg.setRules(toStringMap(map.get("rules")));
      log.info("Prompt loaded from {} (YAML)", location);
      return cfg;
    } catch (Exception yamlErr) {
      log.warn("YAML parse failed, trying JSON. Reason={}", yamlErr.getMessage());
    }

    try {
      PromptConfig cfg = jsonMapper.readValue(raw, PromptConfig.class);
      if (cfg.getRules() == null) cfg.setRules(Map.of());
      log.info("Prompt loaded from {} (JSON)", location);
      return cfg;
    } catch (IOException e) {
      throw new IllegalStateException("Unparseable prompt at " + location, e);
    }
  }

  private static String asString(Object o) {
    return (o == null) ? null : o.toString();
  }

  private static Map<String, String> toStringMap(Object node) {
    if (!(node instanceof Map<?, ?> src)) return Map.of();
    Map<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : src.entrySet()) {
      String v = (e.getValue() == null) ? null : e.getValue().toString();
      out.put(Objects.toString(e.getKey(), ""), v);
    }
    return out;
  }
}

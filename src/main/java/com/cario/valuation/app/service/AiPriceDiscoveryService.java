package com.cario.valuation.app.service;

import com.cario.valuation.app.exception.CollaboratorException;
import com.cario.valuation.app.model.PriceDiscovery;
import com.cario.valuation.app.model.PriceDiscoveryResponse;
import com.cario.valuation.app.model.VehicleRecord;
import com.cario.valuation.app.prompt.PromptConfig;
import com.cario.valuation.app.util.LlmJsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.chat.prompt.SystemPromptTemplate;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;

/**
 * Price discovery backed by an OpenAI chat model. The answer is constrained to the {@link
 * PriceDiscoveryResponse} JSON schema and still parsed leniently, since nothing the model says is
 * trusted until the IDV validator has seen it.
 */
@Log4j2
public class AiPriceDiscoveryService implements PriceDiscoveryClient {

  static final String FAILURE_MESSAGE = "Price discovery failed";

  private final ChatClient chat;
  private final PromptLoaderService promptLoader;
  private final String promptLocation;
  private final String model;
  private final double temperature;
  private final ObjectMapper om = new ObjectMapper();
  private final Map<String, Object> schema;

  public AiPriceDiscoveryService(
      ChatClient.Builder builder,
      PromptLoaderService promptLoader,
      String promptLocation,
      String model,
      double temperature) {
    this.chat = builder.build();
    this.promptLoader = promptLoader;
    this.promptLocation = promptLocation;
    this.model = model;
    this.temperature = temperature;
    this.schema = buildResponseSchema();
  }

  @Override
  public PriceDiscovery discover(VehicleRecord vehicle) {
    PromptConfig cfg = promptLoader.load(promptLocation);
    Map<String, Object> vars = promptVariables(vehicle, cfg);

    Message systemMsg = new SystemPromptTemplate(cfg.getSystemTemplate()).createMessage(vars);
    Message userMsg = new PromptTemplate(cfg.getUserTemplate()).createMessage(vars);

    OpenAiChatOptions options =
        OpenAiChatOptions.builder()
            .model(model)
            .temperature(temperature)
            .responseFormat(
                ResponseFormat.builder()
                    .type(ResponseFormat.Type.JSON_SCHEMA)
                    .jsonSchema(
                        ResponseFormat.JsonSchema.builder()
                            .name("PriceDiscoveryResponse")
                            .schema(schema)
                            .strict(true)
                            .build())
                    .build())
            .build();

    String raw;
    try {
      raw = chat.prompt().messages(List.of(systemMsg, userMsg)).options(options).call().content();
    } catch (RuntimeException e) {
      log.error("pricediscovery.call failed key={}", vehicle.cacheKey(), e);
      throw new CollaboratorException(FAILURE_MESSAGE, e);
    }
    log.debug("pricediscovery.rawJson={}", truncate(raw, 800));
    PriceDiscovery discovery = parse(raw, model);
    log.info(
        "pricediscovery.done key={} onRoad={} median={} variantGuess={}",
        vehicle.cacheKey(),
        discovery.getOnRoadPrice(),
        discovery.getMarketMedianEstimate(),
        discovery.getVariantGuess());
    return discovery;
  }

  /**
   * Turns model output into a {@link PriceDiscovery}.
   *
   * @throws CollaboratorException when the text is not a JSON object or the on-road price is
   *     missing or not positive
   */
  static PriceDiscovery parse(String raw, String source) {
    Map<String, Object> json = LlmJsonUtils.parseObject(raw, new ObjectMapper());
    if (json == null) {
      throw new CollaboratorException(FAILURE_MESSAGE);
    }
    Double onRoad = LlmJsonUtils.number(json, "on_road_price");
    if (onRoad == null || onRoad <= 0) {
      log.warn("pricediscovery.invalid onRoad={}", onRoad);
      throw new CollaboratorException(FAILURE_MESSAGE);
    }
    Double median = LlmJsonUtils.number(json, "market_median_estimate");
    Object variant = json.get("variant_guess");
    return PriceDiscovery.builder()
        .onRoadPrice(onRoad)
        .marketMedianEstimate(median != null && median > 0 ? median : null)
        .variantGuess(variant == null ? null : variant.toString())
        .confidenceHint(LlmJsonUtils.number(json, "confidence_hint"))
        .source(source)
        .build();
  }

  static Map<String, Object> promptVariables(VehicleRecord v, PromptConfig cfg) {
    Map<String, Object> vars = new HashMap<>();
    if (cfg.getRules() != null) vars.putAll(cfg.getRules());
    vars.put("make", v.getMake());
    vars.put("model", v.getFullModel() == null ? v.getBaseModel() : v.getFullModel());
    vars.put("variant", v.getVariant() == null ? "unknown" : v.getVariant());
    vars.put("fuel", v.getFuelType() == null ? "unknown" : v.getFuelType().getLabel());
    vars.put("vehicle_class", v.getVehicleClass() == null ? "4W" : v.getVehicleClass().getCode());
    vars.put("manufacturing_date", v.getManufacturingDate().toString());
    vars.put("year", v.getManufacturingYear());
    vars.put("city", v.getCity());
    return vars;
  }

  private Map<String, Object> buildResponseSchema() {
    SchemaGeneratorConfigBuilder cfgBuilder =
        new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON);
    cfgBuilder.with(new JacksonModule());
    SchemaGenerator generator = new SchemaGenerator(cfgBuilder.build());
    JsonNode schemaNode = generator.generateSchema(PriceDiscoveryResponse.class);

    Map<String, Object> out =
        om.convertValue(schemaNode, new TypeReference<Map<String, Object>>() {});
    out.remove("$schema");
    out.remove("$id");
    out.put("type", "object");
    out.put("additionalProperties", false);
    if (out.get("properties") instanceof Map<?, ?> props) {
      // strict mode wants every property listed as required
      out.put("required", List.copyOf(props.keySet()));
    }
    return out;
  }

  private static String truncate(String s, int max) {
    if (s == null) return null;
    return s.length() <= max ? s : s.substring(0, max) + "...";
  }
}

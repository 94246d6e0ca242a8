package com.cario.valuation.app.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.log4j.Log4j2;

/**
 * Lenient parsing of JSON objects returned by chat models.
 *
 * <p>Models sometimes wrap the object in markdown fences, prepend prose, leave raw newlines inside
 * strings or trail a comma. Each of those is repaired before giving up.
 */
@Log4j2
public final class LlmJsonUtils {

  private static final Pattern FENCED = Pattern.compile("(?s)```(?:json)?\\s*(\\{.*?\\})\\s*```");

  private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

  private LlmJsonUtils() {}

  /**
   * Parses the JSON object in {@code content}: the last fenced block if there is one, otherwise
   * the text between the first opening and the last closing brace.
   *
   * @return the object as a map, or {@code null} when nothing parseable was found
   */
  public static Map<String, Object> parseObject(String content, ObjectMapper mapper) {
    String json = extractJsonString(content);
    if (json == null || json.isBlank()) return null;
    try {
      return readObject(mapper, json);
    } catch (Exception first) {
      String repaired = stripTrailingCommas(escapeNewlinesInsideStrings(removeBOM(json)));
      try {
        return readObject(mapper, repaired);
      } catch (Exception second) {
        log.warn("llm.json parse failed len={} reason={}", json.length(), second.toString());
        return null;
      }
    }
  }

  /** Reads a numeric field that may arrive as a number or a string like {@code "7,50,000"}. */
  public static Double number(Map<String, Object> m, String field) {
    Object v = m == null ? null : m.get(field);
    if (v == null) return null;
    if (v instanceof Number n) return n.doubleValue();
    Matcher num = NUMBER.matcher(v.toString().replace(",", ""));
    if (!num.find()) return null;
    try {
      return Double.parseDouble(num.group());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  static String extractJsonString(String content) {
    if (content == null) return null;
    String s = content.trim();
    Matcher m = FENCED.matcher(s);
    String candidate = null;
    while (m.find()) {
      candidate = m.group(1);
    }
    if (candidate != null) return candidate;

    int first = s.indexOf('{');
    int last = s.lastIndexOf('}');
    if (first >= 0 && last > first) {
      return s.substring(first, last + 1);
    }
    return s;
  }

  private static Map<String, Object> readObject(ObjectMapper mapper, String json)
      throws Exception {
    JsonNode node = mapper.readTree(json);
    if (node == null || !node.isObject()) return null;
    return mapper.convertValue(node, new TypeReference<Map<String, Object>>() {});
  }

  private static String removeBOM(String s) {
    if (s.startsWith("\uFEFF")) return s.substring(1);
    return s;
  }

  /** Escapes literal CR/LF that appear inside JSON strings. */
  private static String escapeNewlinesInsideStrings(String s) {
    StringBuilder out = new StringBuilder(s.length());
    boolean inStr = false;
    boolean esc = false;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (!inStr) {
        if (c == '"') inStr = true;
        out.append(c);
        continue;
      }
      if (esc) {
        esc = false;
        out.append(c);
      } else if (c == '\\') {
        esc = true;
        out.append(c);
      } else if (c == '"') {
        inStr = false;
        out.append(c);
      } else if (c == '\n') {
        out.append("\\n");
      } else if (c == '\r') {
        out.append("\\r");
      } else {
        out.append(c);
      }
    }
    return out.toString();
  }

  private static String stripTrailingCommas(String s) {
    return s.replaceAll(",\\s*([}\\]])", "$1");
  }
}

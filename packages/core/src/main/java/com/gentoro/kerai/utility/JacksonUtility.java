package com.gentoro.kerai.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.gentoro.kerai.exception.SerializationException;
import java.util.Map;
import java.util.TreeMap;

public class JacksonUtility {
  private static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(
          new YAMLFactory()
              .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
              .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
              .disable(YAMLGenerator.Feature.SPLIT_LINES)
              .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

  // Compact and key-sorted: journal lines and signed payloads must serialize identically
  // on every peer.
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  public static ObjectMapper getYamlMapper() {
    return YAML_MAPPER;
  }

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  public static <T> T fromJson(String json, Class<T> type) {
    try {
      return JSON_MAPPER.readValue(json, type);
    } catch (Exception e) {
      throw new SerializationException(
          "Failed to deserialize JSON into " + type.getSimpleName(), e);
    }
  }

  /** Canonical JSON for a map: keys sorted at every level, no whitespace. */
  public static String toCanonicalJson(Map<String, ?> map) {
    return toJson(map == null ? new TreeMap<>() : new TreeMap<>(map));
  }

  public static Map<String, Object> toMap(String json) {
    try {
      return JSON_MAPPER.readValue(json, MAP_TYPE);
    } catch (Exception e) {
      throw new SerializationException("Failed to deserialize JSON object", e);
    }
  }

  public static String toYaml(Object object) {
    try {
      return YAML_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to YAML", e);
    }
  }
}

package com.github.spud.sample.ai.stylist.infrastructure.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;
import java.util.Map;
import org.springframework.boot.json.AbstractJsonParser;
import org.springframework.boot.json.JsonParseException;

/**
 * Shared Jackson mapper. Failures surface as {@link JsonParseException}.
 */
public class JsonUtils extends AbstractJsonParser {

  private static final ObjectMapper objectMapper = JsonMapper.builder()
    .addModule(new JavaTimeModule())
    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
    .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
    .build();

  private static final JsonUtils INSTANCE = new JsonUtils();

  public static String toJson(Object obj) {
    return INSTANCE.tryParse(() -> objectMapper.writeValueAsString(obj), Exception.class);
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json, clazz), Exception.class);
  }

  public static <T> T fromJson(String json, TypeReference<T> typeReference) {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json, typeReference), Exception.class);
  }

  @Override
  public Map<String, Object> parseMap(String json) throws JsonParseException {
    return parseMap(json, text -> fromJson(text, new TypeReference<Map<String, Object>>() {
    }));
  }

  @Override
  public List<Object> parseList(String json) throws JsonParseException {
    return parseList(json, text -> fromJson(text, new TypeReference<List<Object>>() {
    }));
  }

}

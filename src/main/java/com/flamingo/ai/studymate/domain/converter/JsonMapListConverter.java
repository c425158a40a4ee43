package com.flamingo.ai.studymate.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/** JPA converter for lists of JSON objects, e.g. struggle records or interaction history. */
@Converter
@Slf4j
public class JsonMapListConverter
    implements AttributeConverter<List<Map<String, Object>>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();
  private static final TypeReference<ArrayList<Map<String, Object>>> LIST_TYPE =
      new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<Map<String, Object>> attribute) {
    if (attribute == null || attribute.isEmpty()) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize json list: {}", e.getMessage());
      return null;
    }
  }

  @Override
  public List<Map<String, Object>> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return new ArrayList<>();
    }
    try {
      return MAPPER.readValue(dbData, LIST_TYPE);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize json list: {}", e.getMessage());
      return new ArrayList<>();
    }
  }
}

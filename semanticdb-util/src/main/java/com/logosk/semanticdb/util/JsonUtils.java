package com.logosk.semanticdb.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Holder for the shared Jackson mappers: a YAML mapper for human readable
 * documents and a canonical JSON mapper (properties and map entries ordered by key)
 * used wherever a stable byte representation is hashed.
 */
public class JsonUtils {
   private static final JsonUtils instance = new JsonUtils();
   protected ObjectMapper yamlMapper;
   protected ObjectMapper canonicalMapper;

   private JsonUtils() {
      yamlMapper = YAMLMapper.builder(new YAMLFactory()
                      .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                      .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                      .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS))
              .addModule(new JavaTimeModule())
              .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
              .enable(SerializationFeature.INDENT_OUTPUT)
              .build();
      canonicalMapper = JsonMapper.builder()
              .addModule(new JavaTimeModule())
              .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
              .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
              .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
              .build();
   }

   public static JsonUtils instance() {
      return instance;
   }

   public ObjectMapper yaml() {
      return yamlMapper;
   }

   public ObjectMapper canonical() {
      return canonicalMapper;
   }

   /**
    * Serialises the value as compact JSON with keys sorted, so equal content
    * always yields equal text.
    */
   public String toCanonicalJson(Object value) throws JsonProcessingException {
      return canonicalMapper.writeValueAsString(value);
   }
}

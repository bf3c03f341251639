package com.e2eq.amper.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;

/**
 * Holds the single {@link ObjectMapper} used to read and write policy documents.
 * Output is compact, so {@link #compactSize(Object)} reflects the size a cloud provider measures.
 */
public class JSONUtils {
   private static final JSONUtils instance = new JSONUtils();
   protected ObjectMapper mapper;

   private JSONUtils() {
      mapper = new ObjectMapper();
      mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
      mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
      mapper.configure(SerializationFeature.INDENT_OUTPUT, false);
   }

   public static JSONUtils instance() {
      return instance;
   }

   public ObjectMapper mapper() {
      return mapper;
   }

   public String toJson(Object value) throws JsonProcessingException {
      return mapper.writeValueAsString(value);
   }

   public <T> T fromJson(String json, Class<T> type) throws JsonProcessingException {
      return mapper.readValue(json, type);
   }

   /**
    * Number of UTF-8 bytes of the compact JSON form of {@code value}.
    */
   public int compactSize(Object value) throws JsonProcessingException {
      return mapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8).length;
   }
}

/*
 * どこで: 共通 JSON エンコーダ
 * 何を: キー順が安定した空白なしの JSON バイト列を生成する
 * なぜ: 同じ内容の監査エントリが常に同じバイト列になるようにするため
 */
package com.insurancecost.common.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;

public final class CompactJson {

  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
          .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
          .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
          .disable(SerializationFeature.INDENT_OUTPUT)
          .addModule(finiteNumbersModule())
          .build();

  private CompactJson() {}

  public static byte[] encode(Object value) {
    try {
      return MAPPER.writeValueAsBytes(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("failed to encode compact json", ex);
    }
  }

  public static String encodeToString(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("failed to encode compact json", ex);
    }
  }

  // NaN/Infinity は JSON で表現できないため、文字列化せずエンコード失敗にする
  private static SimpleModule finiteNumbersModule() {
    final SimpleModule module = new SimpleModule("compact-json-finite-numbers");
    module.addSerializer(Double.class, new FiniteDoubleSerializer());
    module.addSerializer(Double.TYPE, new FiniteDoubleSerializer());
    return module;
  }

  private static final class FiniteDoubleSerializer extends StdSerializer<Double> {

    private FiniteDoubleSerializer() {
      super(Double.class);
    }

    @Override
    public void serialize(Double value, JsonGenerator generator, SerializerProvider provider)
        throws IOException {
      if (!Double.isFinite(value)) {
        throw JsonMappingException.from(
            generator, "non-finite number is not representable: " + value);
      }
      generator.writeNumber(value);
    }
  }
}

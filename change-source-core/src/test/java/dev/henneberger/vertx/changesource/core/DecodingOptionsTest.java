package dev.henneberger.vertx.changesource.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DecodingOptionsTest {

  @Test
  void defaultsAreSentInFixedOrder() {
    Map<String, String> params = new DecodingOptions().toParameters();

    assertEquals(List.of("expected_encoding", "min_proto_version", "max_proto_version", "startup_params_format"),
      new ArrayList<>(params.keySet()));
    assertEquals("UTF8", params.get("expected_encoding"));
    assertEquals("1", params.get("min_proto_version"));
    assertEquals("1", params.get("max_proto_version"));
    assertEquals("1", params.get("startup_params_format"));
  }

  @Test
  void overridingOneFieldKeepsTheOthers() {
    Map<String, String> params = new DecodingOptions().setExpectedEncoding("SQL_ASCII").toParameters();

    assertEquals("SQL_ASCII", params.get("expected_encoding"));
    assertEquals("1", params.get("startup_params_format"));
  }

  @Test
  void absentFieldsAreOmitted() {
    Map<String, String> params = new DecodingOptions()
      .setMinProtocolVersion(null)
      .setMaxProtocolVersion(null)
      .toParameters();

    assertFalse(params.containsKey("min_proto_version"));
    assertFalse(params.containsKey("max_proto_version"));
    assertFalse(params.containsValue(null));
    assertTrue(DecodingOptions.withoutProtocolParameters().toParameters().isEmpty());
  }

  @Test
  void pluginOptionsFollowProtocolParameters() {
    Map<String, String> params = DecodingOptions.withoutProtocolParameters()
      .putPluginOption("include-xids", "0")
      .putPluginOption("skip-empty-xacts", "1")
      .toParameters();

    assertEquals(List.of("include-xids", "skip-empty-xacts"), new ArrayList<>(params.keySet()));
  }

  @Test
  void readsJsonWithNumbersAndExplicitNulls() {
    DecodingOptions options = new DecodingOptions(new JsonObject()
      .put("maxProtocolVersion", 2)
      .putNull("startupParamsFormat")
      .put("pluginOptions", new JsonObject().put("include-xids", 0)));

    assertEquals("UTF8", options.getExpectedEncoding());
    assertEquals("2", options.getMaxProtocolVersion());
    assertNull(options.getStartupParamsFormat());
    assertEquals("0", options.getPluginOptions().get("include-xids"));
  }

  @Test
  void mergeOverridesOnlyGivenKeys() {
    DecodingOptions base = new DecodingOptions().setExpectedEncoding("LATIN1");

    DecodingOptions merged = base.merge(new JsonObject().putNull("minProtocolVersion"));

    assertEquals("LATIN1", merged.getExpectedEncoding());
    assertNull(merged.getMinProtocolVersion());
    assertEquals("1", base.getMinProtocolVersion());
  }

  @Test
  void jsonRoundTripKeepsAbsentFields() {
    DecodingOptions options = new DecodingOptions().setExpectedEncoding(null).putPluginOption("a", "b");

    DecodingOptions copy = new DecodingOptions(options.toJson());

    assertEquals(options.toParameters(), copy.toParameters());
  }
}

package dev.henneberger.vertx.changesource.core;

import io.vertx.core.json.JsonObject;
import java.util.LinkedHashMap;
import java.util.Map;

final class DecodingOptionsConverter {

  private DecodingOptionsConverter() {
  }

  static void fromJson(JsonObject json, DecodingOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("expectedEncoding")) {
      options.setExpectedEncoding(json.getString("expectedEncoding"));
    }
    if (json.containsKey("minProtocolVersion")) {
      options.setMinProtocolVersion(asString(json.getValue("minProtocolVersion")));
    }
    if (json.containsKey("maxProtocolVersion")) {
      options.setMaxProtocolVersion(asString(json.getValue("maxProtocolVersion")));
    }
    if (json.containsKey("startupParamsFormat")) {
      options.setStartupParamsFormat(asString(json.getValue("startupParamsFormat")));
    }

    JsonObject pluginOptionsJson = json.getJsonObject("pluginOptions");
    if (pluginOptionsJson != null) {
      Map<String, String> pluginOptions = new LinkedHashMap<>();
      for (String name : pluginOptionsJson.fieldNames()) {
        pluginOptions.put(name, asString(pluginOptionsJson.getValue(name)));
      }
      options.setPluginOptions(pluginOptions);
    }
  }

  static void toJson(DecodingOptions options, JsonObject json) {
    json.put("expectedEncoding", options.getExpectedEncoding());
    json.put("minProtocolVersion", options.getMinProtocolVersion());
    json.put("maxProtocolVersion", options.getMaxProtocolVersion());
    json.put("startupParamsFormat", options.getStartupParamsFormat());

    JsonObject pluginOptions = new JsonObject();
    options.getPluginOptions().forEach(pluginOptions::put);
    json.put("pluginOptions", pluginOptions);
  }

  // protocol versions are often written as numbers in config files
  private static String asString(Object value) {
    return value == null ? null : String.valueOf(value);
  }
}

package dev.henneberger.vertx.changesource.core;

import io.vertx.codegen.annotations.DataObject;
import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Startup parameters handed to the output plugin when changes are requested.
 *
 * <p>Every field has a default; a field set to {@code null} is absent and is left out of the
 * parameters sent to the server.
 */
@DataObject
public class DecodingOptions {

  public static final String DEFAULT_EXPECTED_ENCODING = "UTF8";
  public static final String DEFAULT_MIN_PROTOCOL_VERSION = "1";
  public static final String DEFAULT_MAX_PROTOCOL_VERSION = "1";
  public static final String DEFAULT_STARTUP_PARAMS_FORMAT = "1";

  static final String EXPECTED_ENCODING = "expected_encoding";
  static final String MIN_PROTO_VERSION = "min_proto_version";
  static final String MAX_PROTO_VERSION = "max_proto_version";
  static final String STARTUP_PARAMS_FORMAT = "startup_params_format";

  private String expectedEncoding;
  private String minProtocolVersion;
  private String maxProtocolVersion;
  private String startupParamsFormat;
  private Map<String, String> pluginOptions;

  public DecodingOptions() {
    init();
  }

  public DecodingOptions(JsonObject json) {
    init();
    DecodingOptionsConverter.fromJson(json, this);
  }

  public DecodingOptions(DecodingOptions other) {
    this.expectedEncoding = other.expectedEncoding;
    this.minProtocolVersion = other.minProtocolVersion;
    this.maxProtocolVersion = other.maxProtocolVersion;
    this.startupParamsFormat = other.startupParamsFormat;
    this.pluginOptions = new LinkedHashMap<>(other.pluginOptions);
  }

  /**
   * Options with none of the protocol parameters set, for plugins that reject unknown parameters.
   */
  public static DecodingOptions withoutProtocolParameters() {
    return new DecodingOptions()
      .setExpectedEncoding(null)
      .setMinProtocolVersion(null)
      .setMaxProtocolVersion(null)
      .setStartupParamsFormat(null);
  }

  public String getExpectedEncoding() {
    return expectedEncoding;
  }

  public DecodingOptions setExpectedEncoding(String expectedEncoding) {
    this.expectedEncoding = expectedEncoding;
    return this;
  }

  public String getMinProtocolVersion() {
    return minProtocolVersion;
  }

  public DecodingOptions setMinProtocolVersion(String minProtocolVersion) {
    this.minProtocolVersion = minProtocolVersion;
    return this;
  }

  public String getMaxProtocolVersion() {
    return maxProtocolVersion;
  }

  public DecodingOptions setMaxProtocolVersion(String maxProtocolVersion) {
    this.maxProtocolVersion = maxProtocolVersion;
    return this;
  }

  public String getStartupParamsFormat() {
    return startupParamsFormat;
  }

  public DecodingOptions setStartupParamsFormat(String startupParamsFormat) {
    this.startupParamsFormat = startupParamsFormat;
    return this;
  }

  public Map<String, String> getPluginOptions() {
    return Collections.unmodifiableMap(pluginOptions);
  }

  public DecodingOptions setPluginOptions(Map<String, String> pluginOptions) {
    this.pluginOptions = pluginOptions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(pluginOptions);
    return this;
  }

  public DecodingOptions putPluginOption(String name, String value) {
    this.pluginOptions.put(name, value);
    return this;
  }

  /**
   * Wire parameters in a stable order, absent values omitted.
   */
  public Map<String, String> toParameters() {
    Map<String, String> params = new LinkedHashMap<>();
    putIfPresent(params, EXPECTED_ENCODING, expectedEncoding);
    putIfPresent(params, MIN_PROTO_VERSION, minProtocolVersion);
    putIfPresent(params, MAX_PROTO_VERSION, maxProtocolVersion);
    putIfPresent(params, STARTUP_PARAMS_FORMAT, startupParamsFormat);
    pluginOptions.forEach((name, value) -> putIfPresent(params, name, value));
    return params;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    DecodingOptionsConverter.toJson(this, json);
    return json;
  }

  public DecodingOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new DecodingOptions(json);
  }

  private static void putIfPresent(Map<String, String> params, String name, String value) {
    if (value != null) {
      params.put(name, value);
    }
  }

  private void init() {
    expectedEncoding = DEFAULT_EXPECTED_ENCODING;
    minProtocolVersion = DEFAULT_MIN_PROTOCOL_VERSION;
    maxProtocolVersion = DEFAULT_MAX_PROTOCOL_VERSION;
    startupParamsFormat = DEFAULT_STARTUP_PARAMS_FORMAT;
    pluginOptions = new LinkedHashMap<>();
  }
}

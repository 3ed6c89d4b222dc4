package dev.henneberger.vertx.changesource.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Transport independent settings of a change source.
 */
public class ChangeSourceSettings {

  public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(1);
  public static final Duration DEFAULT_DROP_TIMEOUT = Duration.ofSeconds(5);

  private String slotName;
  private String outputPlugin;
  private Duration readTimeout = DEFAULT_READ_TIMEOUT;
  private Duration dropTimeout = DEFAULT_DROP_TIMEOUT;

  public ChangeSourceSettings() {
  }

  public ChangeSourceSettings(ChangeSourceSettings other) {
    this.slotName = other.slotName;
    this.outputPlugin = other.outputPlugin;
    this.readTimeout = other.readTimeout;
    this.dropTimeout = other.dropTimeout;
  }

  public String getSlotName() {
    return slotName;
  }

  public ChangeSourceSettings setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  public String getOutputPlugin() {
    return outputPlugin;
  }

  public ChangeSourceSettings setOutputPlugin(String outputPlugin) {
    this.outputPlugin = outputPlugin;
    return this;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public ChangeSourceSettings setReadTimeout(Duration readTimeout) {
    this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
    return this;
  }

  public Duration getDropTimeout() {
    return dropTimeout;
  }

  public ChangeSourceSettings setDropTimeout(Duration dropTimeout) {
    this.dropTimeout = Objects.requireNonNull(dropTimeout, "dropTimeout");
    return this;
  }

  public void validate() {
    OptionValidation.requireSlotName(slotName);
    OptionValidation.require("outputPlugin", outputPlugin);
    OptionValidation.requirePositive("readTimeout", readTimeout);
    OptionValidation.requirePositive("dropTimeout", dropTimeout);
  }
}

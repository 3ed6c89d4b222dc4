/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.pg.changesource;

import dev.henneberger.vertx.changesource.core.DecodingOptions;
import java.util.Objects;

public final class ChangeSourceOptionPresets {

  public static final String PGLOGICAL_OUTPUT = "pglogical_output";
  public static final String TEST_DECODING = "test_decoding";

  private ChangeSourceOptionPresets() {
  }

  /**
   * Configures the {@code pglogical_output} plugin and returns the decoding options it expects.
   */
  public static DecodingOptions applyPgLogicalDefaults(PostgresChangeSourceOptions options) {
    Objects.requireNonNull(options, "options");
    options.setPlugin(PGLOGICAL_OUTPUT);
    return new DecodingOptions();
  }

  /**
   * Configures the built-in {@code test_decoding} plugin, which rejects the pglogical startup
   * parameters, and returns matching decoding options.
   */
  public static DecodingOptions applyTestDecodingDefaults(PostgresChangeSourceOptions options) {
    Objects.requireNonNull(options, "options");
    options.setPlugin(TEST_DECODING);
    return DecodingOptions.withoutProtocolParameters()
      .putPluginOption("include-xids", "0")
      .putPluginOption("skip-empty-xacts", "1");
  }
}

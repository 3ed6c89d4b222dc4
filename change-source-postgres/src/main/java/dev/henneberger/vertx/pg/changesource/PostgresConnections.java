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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import org.postgresql.PGProperty;

final class PostgresConnections {

  private PostgresConnections() {
  }

  static Connection openStandardConnection(PostgresChangeSourceOptions options) throws SQLException {
    Connection conn = DriverManager.getConnection(jdbcUrl(options), connectionProperties(options));
    conn.setAutoCommit(true);
    return conn;
  }

  static Connection openReplicationConnection(PostgresChangeSourceOptions options) throws SQLException {
    Properties props = connectionProperties(options);
    PGProperty.REPLICATION.set(props, "database");
    PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "9.4");
    return DriverManager.getConnection(jdbcUrl(options), props);
  }

  static String jdbcUrl(PostgresChangeSourceOptions options) {
    return "jdbc:postgresql://" + options.getHost() + ':' + options.getPort() + '/' + options.getDatabase();
  }

  private static Properties connectionProperties(PostgresChangeSourceOptions options) {
    Properties props = new Properties();
    PGProperty.USER.set(props, options.getUser());

    String password = resolvePassword(options);
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }

    if (Boolean.TRUE.equals(options.getSsl())) {
      props.setProperty("ssl", "true");
    }
    return props;
  }

  static String resolvePassword(PostgresChangeSourceOptions options) {
    String password = options.getPassword();
    if (password == null || password.isBlank()) {
      String envName = options.getPasswordEnv();
      if (envName != null && !envName.isBlank()) {
        password = System.getenv(envName);
      }
    }
    return password;
  }
}

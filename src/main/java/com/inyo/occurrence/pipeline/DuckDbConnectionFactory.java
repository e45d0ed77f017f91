/*
 * Copyright 2025 Inyo Contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.inyo.occurrence.pipeline;

import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import org.duckdb.DuckDBConnection;

/**
 * Owns the in-memory DuckDB instance that writes and reopens Parquet files. Consumers get
 * duplicated connections to the same instance.
 */
public class DuckDbConnectionFactory {

  private final ConverterConfig config;
  private DuckDBConnection conn;

  public DuckDbConnectionFactory(ConverterConfig config) {
    this.config = config;
  }

  public void create() throws SQLException {
    if (this.conn != null) {
      return;
    }
    final Properties properties = new Properties();
    int threadCount = config.getDuckDbThreads();
    properties.setProperty("threads", String.valueOf(threadCount));
    this.conn = (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:", properties);
  }

  public DuckDBConnection getConnection() {
    if (conn == null) {
      throw new IllegalStateException("Connection not initialized. Call create() first.");
    }
    try {
      return (DuckDBConnection) conn.duplicate();
    } catch (SQLException e) {
      throw new RuntimeException("Failed to duplicate DuckDB connection", e);
    }
  }

  public void close() {
    if (conn != null) {
      try {
        conn.close();
      } catch (SQLException e) {
        throw new RuntimeException("Failed to close DuckDB connection", e);
      } finally {
        conn = null;
      }
    }
  }
}

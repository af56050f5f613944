/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.executor;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.common.setting.Settings;

/**
 * Settings of an embedded engine. Defaults come from the {@value #DEFAULTS_RESOURCE} classpath
 * resource; keys missing there fall back to built-in values. Overrides are given by key name and
 * may be strings or already typed values.
 */
@Log4j2
public class EngineSettings extends Settings {

  @VisibleForTesting static final String DEFAULTS_RESOURCE = "tsquery-default.properties";

  private final Map<Key, Object> values;

  public EngineSettings() {
    this(ImmutableMap.of());
  }

  /**
   * Creates settings with {@code overrides} applied over the defaults.
   *
   * @throws IllegalArgumentException on an unknown key or a value of the wrong type
   */
  public EngineSettings(Map<String, ?> overrides) {
    Map<Key, Object> resolved = new EnumMap<>(Key.class);
    for (Key key : Key.values()) {
      resolved.put(key, builtInDefault(key));
    }
    Properties properties = loadDefaults();
    for (String name : properties.stringPropertyNames()) {
      Key key = Key.of(name).orElse(null);
      if (key == null) {
        log.warn("Ignoring unknown setting {} in {}", name, DEFAULTS_RESOURCE);
        continue;
      }
      resolved.put(key, parse(key, properties.getProperty(name)));
    }
    for (Map.Entry<String, ?> override : overrides.entrySet()) {
      Key key =
          Key.of(override.getKey())
              .orElseThrow(
                  () -> new IllegalArgumentException("unknown setting: " + override.getKey()));
      resolved.put(key, parse(key, override.getValue()));
    }
    this.values = ImmutableMap.copyOf(resolved);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  @Override
  public List<?> getSettings() {
    return ImmutableList.copyOf(values.entrySet());
  }

  private static Object builtInDefault(Key key) {
    switch (key) {
      case STAGE_ENABLED:
        return true;
      case STAGE_CONCURRENCY:
        return 4;
      case EXECUTOR_WORKERS:
        return Runtime.getRuntime().availableProcessors();
      case QUERY_MEMORY_LIMIT:
        return Long.MAX_VALUE;
      default:
        throw new IllegalStateException("no default for setting " + key.getKeyValue());
    }
  }

  private static Object parse(Key key, Object value) {
    if (value == null) {
      throw new IllegalArgumentException("setting " + key.getKeyValue() + " must not be null");
    }
    String text = value.toString().trim();
    try {
      switch (key) {
        case STAGE_ENABLED:
          if (value instanceof Boolean) {
            return value;
          }
          if (!"true".equalsIgnoreCase(text) && !"false".equalsIgnoreCase(text)) {
            throw new IllegalArgumentException(
                "setting " + key.getKeyValue() + " must be true or false: " + text);
          }
          return Boolean.parseBoolean(text);
        case STAGE_CONCURRENCY:
        case EXECUTOR_WORKERS:
          return positive(key, Integer.parseInt(text));
        case QUERY_MEMORY_LIMIT:
          return positive(key, Long.parseLong(text));
        default:
          throw new IllegalStateException("unhandled setting " + key.getKeyValue());
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "setting " + key.getKeyValue() + " is not a number: " + text, e);
    }
  }

  private static <N extends Number> N positive(Key key, N value) {
    if (value.longValue() <= 0) {
      throw new IllegalArgumentException(
          "setting " + key.getKeyValue() + " must be positive: " + value);
    }
    return value;
  }

  private static Properties loadDefaults() {
    Properties properties = new Properties();
    try (InputStream in =
        EngineSettings.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in != null) {
        properties.load(in);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("failed to read " + DEFAULTS_RESOURCE, e);
    }
    return properties;
  }
}

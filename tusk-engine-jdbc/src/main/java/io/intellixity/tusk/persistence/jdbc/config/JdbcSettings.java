package io.intellixity.tusk.persistence.jdbc.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection and pool settings.\n
 *
 * Read from a Java Properties file ({@code tusk.properties} on the classpath by default). Any key may be
 * overridden by a JVM system property of the same name.\n
 *
 * <pre>
 * tusk.jdbc.url=jdbc:postgresql://localhost:5432/app
 * tusk.jdbc.username=app
 * tusk.jdbc.password=secret
 * tusk.jdbc.schema=public
 * tusk.jdbc.pool.maxSize=10
 * tusk.jdbc.pool.minIdle=1
 * tusk.jdbc.pool.connectionTimeoutMs=30000
 * </pre>
 */
public record JdbcSettings(String url,
                           String username,
                           String password,
                           String schema,
                           int poolMaxSize,
                           int poolMinIdle,
                           long connectionTimeoutMs) {
  public static final String RESOURCE = "tusk.properties";

  public static final String URL = "tusk.jdbc.url";
  public static final String USERNAME = "tusk.jdbc.username";
  public static final String PASSWORD = "tusk.jdbc.password";
  public static final String SCHEMA = "tusk.jdbc.schema";
  public static final String POOL_MAX_SIZE = "tusk.jdbc.pool.maxSize";
  public static final String POOL_MIN_IDLE = "tusk.jdbc.pool.minIdle";
  public static final String CONNECTION_TIMEOUT_MS = "tusk.jdbc.pool.connectionTimeoutMs";

  static final int DEFAULT_POOL_MAX_SIZE = 10;
  static final int DEFAULT_POOL_MIN_IDLE = 1;
  static final long DEFAULT_CONNECTION_TIMEOUT_MS = 30_000L;

  public JdbcSettings {
    Objects.requireNonNull(url, "url");
    if (poolMaxSize <= 0) throw new IllegalStateException(POOL_MAX_SIZE + " must be positive, got " + poolMaxSize);
    if (poolMinIdle < 0) throw new IllegalStateException(POOL_MIN_IDLE + " must not be negative, got " + poolMinIdle);
  }

  /** Loads {@value #RESOURCE} from the context class loader; system properties alone suffice if it is absent. */
  public static JdbcSettings load() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = JdbcSettings.class.getClassLoader();
    Properties p = new Properties();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in != null) p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE + " from classpath", e);
    }
    return from(p);
  }

  public static JdbcSettings load(Path file) {
    Objects.requireNonNull(file, "file");
    Properties p = new Properties();
    try (InputStream in = Files.newInputStream(file)) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load settings from " + file, e);
    }
    return from(p);
  }

  /** Builds settings from {@code file}, letting system properties win. */
  public static JdbcSettings from(Properties file) {
    Properties merged = new Properties();
    if (file != null) merged.putAll(file);
    for (String key : System.getProperties().stringPropertyNames()) {
      if (key.startsWith("tusk.")) merged.setProperty(key, System.getProperty(key));
    }

    String url = trimToNull(merged.getProperty(URL));
    if (url == null) throw new IllegalStateException("Missing required setting: " + URL);

    return new JdbcSettings(
        url,
        trimToNull(merged.getProperty(USERNAME)),
        merged.getProperty(PASSWORD),
        trimToNull(merged.getProperty(SCHEMA)),
        intValue(merged, POOL_MAX_SIZE, DEFAULT_POOL_MAX_SIZE),
        intValue(merged, POOL_MIN_IDLE, DEFAULT_POOL_MIN_IDLE),
        longValue(merged, CONNECTION_TIMEOUT_MS, DEFAULT_CONNECTION_TIMEOUT_MS));
  }

  @Override
  public String toString() {
    return "JdbcSettings[url=" + url + ", username=" + username + ", schema=" + schema
        + ", poolMaxSize=" + poolMaxSize + ", poolMinIdle=" + poolMinIdle
        + ", connectionTimeoutMs=" + connectionTimeoutMs + "]";
  }

  private static int intValue(Properties p, String key, int def) {
    String v = trimToNull(p.getProperty(key));
    if (v == null) return def;
    try {
      return Integer.parseInt(v);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Setting " + key + " is not an integer: " + v, e);
    }
  }

  private static long longValue(Properties p, String key, long def) {
    String v = trimToNull(p.getProperty(key));
    if (v == null) return def;
    try {
      return Long.parseLong(v);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Setting " + key + " is not a number: " + v, e);
    }
  }

  private static String trimToNull(String s) {
    if (s == null) return null;
    String t = s.trim();
    return t.isEmpty() ? null : t;
  }
}

package org.groupscholar.planner.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.groupscholar.planner.logging.Logs;
import org.groupscholar.planner.validation.Numbers;
import org.groupscholar.planner.validation.Strings;

/**
 * <strong>What:</strong> Connection settings for the PostgreSQL run store.
 * <p><strong>Why:</strong> Credentials come from the environment rather than CLI arguments so they never appear
 * in shell history or process listings.</p>
 * <p><strong>Sources:</strong> {@code GS_DB_DSN} in JDBC ({@code jdbc:postgresql://...}) or libpq URI
 * ({@code postgres[ql]://user:pass@host:port/db}) form, otherwise {@code GS_DB_HOST}, {@code GS_DB_PORT},
 * {@code GS_DB_NAME}, {@code GS_DB_USER} and {@code GS_DB_PASSWORD}.</p>
 *
 * @param jdbcUrl JDBC URL without embedded credentials when they were split out
 * @param user login user when known
 * @param password login password when known
 * @since 0.1.0
 */
public record DatabaseSettings(String jdbcUrl, Optional<String> user, Optional<String> password) {
  private static final int DEFAULT_PORT = 5432;

  public DatabaseSettings {
    jdbcUrl = Strings.requireNonBlank("jdbcUrl", jdbcUrl);
    if (!jdbcUrl.startsWith("jdbc:")) {
      throw new IllegalArgumentException("jdbcUrl must start with jdbc: (was " + Logs.redactCredentials(jdbcUrl) + ")");
    }
    user = user == null ? Optional.empty() : user;
    password = password == null ? Optional.empty() : password;
  }

  /**
   * Resolves settings from the process environment.
   *
   * @return settings, or empty when no database variables are set
   * @throws IllegalArgumentException when a DSN is present but malformed
   */
  public static Optional<DatabaseSettings> fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Resolves settings from the supplied environment map.
   *
   * @param env environment variables
   * @return settings, or empty when neither a DSN nor the host/name/user/password set is complete
   * @throws IllegalArgumentException when a DSN is present but malformed
   */
  public static Optional<DatabaseSettings> fromEnvironment(Map<String, String> env) {
    Objects.requireNonNull(env, "env");
    String dsn = value(env, "GS_DB_DSN");
    if (!dsn.isEmpty()) {
      return Optional.of(fromDsn(dsn, value(env, "GS_DB_USER"), value(env, "GS_DB_PASSWORD")));
    }
    String host = value(env, "GS_DB_HOST");
    String name = value(env, "GS_DB_NAME");
    String user = value(env, "GS_DB_USER");
    String password = value(env, "GS_DB_PASSWORD");
    if (host.isEmpty() || name.isEmpty() || user.isEmpty() || password.isEmpty()) {
      return Optional.empty();
    }
    String portRaw = value(env, "GS_DB_PORT");
    int port = portRaw.isEmpty() ? DEFAULT_PORT : Numbers.parseInt("GS_DB_PORT", portRaw);
    Numbers.requireRange("GS_DB_PORT", port, 1, 65_535);
    return Optional.of(new DatabaseSettings(
        "jdbc:postgresql://" + host + ":" + port + "/" + name, Optional.of(user), Optional.of(password)));
  }

  /**
   * Converts a DSN to settings.
   *
   * @param dsn JDBC URL or libpq URI
   * @param fallbackUser user applied when the DSN carries none; may be blank
   * @param fallbackPassword password applied when the DSN carries none; may be blank
   * @return settings
   * @throws IllegalArgumentException when the DSN is neither form or lacks a host or database
   */
  static DatabaseSettings fromDsn(String dsn, String fallbackUser, String fallbackPassword) {
    if (dsn.startsWith("jdbc:")) {
      return new DatabaseSettings(dsn, nonBlank(fallbackUser), nonBlank(fallbackPassword));
    }
    if (!dsn.startsWith("postgres://") && !dsn.startsWith("postgresql://")) {
      throw new IllegalArgumentException(
          "GS_DB_DSN must be a jdbc: URL or postgres:// URI (was " + Logs.redactCredentials(dsn) + ")");
    }
    URI uri;
    try {
      uri = new URI(dsn);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("GS_DB_DSN is not a valid URI: " + Logs.redactCredentials(dsn), ex);
    }
    String host = uri.getHost();
    String path = uri.getPath() == null ? "" : uri.getPath();
    String database = path.startsWith("/") ? path.substring(1) : path;
    if (host == null || host.isBlank() || database.isBlank()) {
      throw new IllegalArgumentException("GS_DB_DSN must name a host and database: " + Logs.redactCredentials(dsn));
    }
    int port = uri.getPort() < 0 ? DEFAULT_PORT : uri.getPort();
    String url = "jdbc:postgresql://" + host + ":" + port + "/" + database
        + (uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery());

    Optional<String> user = nonBlank(fallbackUser);
    Optional<String> password = nonBlank(fallbackPassword);
    String userInfo = uri.getRawUserInfo();
    if (userInfo != null && !userInfo.isEmpty()) {
      int colon = userInfo.indexOf(':');
      String rawUser = colon < 0 ? userInfo : userInfo.substring(0, colon);
      user = nonBlank(decode(rawUser));
      if (colon >= 0) {
        password = nonBlank(decode(userInfo.substring(colon + 1)));
      }
    }
    return new DatabaseSettings(url, user, password);
  }

  /**
   * Returns the URL with credentials masked for logging.
   *
   * @return redacted JDBC URL
   */
  public String redactedUrl() {
    return Logs.redactCredentials(jdbcUrl);
  }

  @Override
  public String toString() {
    return "DatabaseSettings[jdbcUrl=" + redactedUrl() + ", user=" + user.orElse("<none>") + ", password="
        + (password.isPresent() ? Logs.redact(password.get()) : "<none>") + "]";
  }

  private static String decode(String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }

  private static Optional<String> nonBlank(String value) {
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
  }

  private static String value(Map<String, String> env, String key) {
    String raw = env.get(key);
    return raw == null ? "" : raw.trim();
  }
}

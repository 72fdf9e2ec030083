package com.codeheadsystems.keyward.config;

import com.codeheadsystems.keyward.crypto.common.RandomProvider;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-backed settings, bound with Jackson. Missing fields fall back to the bundled
 * {@value #DEFAULTS_RESOURCE}.
 *
 * @param dataDirectory        data directory path
 * @param masterKdfIterations  master password PBKDF2 iterations
 * @param keyWrapKdfIterations passphrase PBKDF2 iterations
 * @param defaultKeyBits       RSA key size
 * @param deletePasses         secure delete overwrite passes
 * @param formatVersion        stored file format version
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeywardSettings(@JsonProperty("dataDirectory") String dataDirectory,
                              @JsonProperty("masterKdfIterations") Integer masterKdfIterations,
                              @JsonProperty("keyWrapKdfIterations") Integer keyWrapKdfIterations,
                              @JsonProperty("defaultKeyBits") Integer defaultKeyBits,
                              @JsonProperty("deletePasses") Integer deletePasses,
                              @JsonProperty("formatVersion") String formatVersion) {

  public static final String DEFAULTS_RESOURCE = "keyward-defaults.json";

  private static final Logger log = LoggerFactory.getLogger(KeywardSettings.class);

  /**
   * Reads the bundled defaults.
   */
  public static KeywardSettings defaults(final ObjectMapper mapper) {
    try (InputStream in = KeywardSettings.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Missing resource " + DEFAULTS_RESOURCE);
      }
      return mapper.readValue(in, KeywardSettings.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + DEFAULTS_RESOURCE, e);
    }
  }

  /**
   * Reads settings from a JSON file and fills unset fields from the bundled defaults.
   */
  public static KeywardSettings load(final Path file, final ObjectMapper mapper) {
    log.info("load({})", file);
    try {
      KeywardSettings fromFile = mapper.readValue(Files.readAllBytes(file), KeywardSettings.class);
      return fromFile.withFallback(defaults(mapper));
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read settings file " + file, e);
    }
  }

  public KeywardSettings withFallback(final KeywardSettings fallback) {
    return new KeywardSettings(
        dataDirectory != null ? dataDirectory : fallback.dataDirectory,
        masterKdfIterations != null ? masterKdfIterations : fallback.masterKdfIterations,
        keyWrapKdfIterations != null ? keyWrapKdfIterations : fallback.keyWrapKdfIterations,
        defaultKeyBits != null ? defaultKeyBits : fallback.defaultKeyBits,
        deletePasses != null ? deletePasses : fallback.deletePasses,
        formatVersion != null ? formatVersion : fallback.formatVersion);
  }

  /**
   * Converts to a runtime config. A leading {@code ~} in the data directory expands to the user home.
   */
  public KeywardConfig toConfig() {
    if (dataDirectory == null || masterKdfIterations == null || keyWrapKdfIterations == null
        || defaultKeyBits == null || deletePasses == null) {
      throw new IllegalStateException("Incomplete settings: " + this);
    }
    String dir = dataDirectory.startsWith("~")
        ? System.getProperty("user.home") + dataDirectory.substring(1)
        : dataDirectory;
    return new KeywardConfig(Path.of(dir), masterKdfIterations, keyWrapKdfIterations, defaultKeyBits,
        deletePasses, formatVersion, new RandomProvider());
  }
}

package com.codeheadsystems.keyward.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * On-disk wrapper for every file written by the storage layer.
 *
 * @param version   file format version
 * @param encrypted always true for files written by keyward
 * @param data      the sealed token
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"version", "encrypted", "data"})
public record EncryptedFileRecord(@JsonProperty("version") String version,
                                  @JsonProperty("encrypted") boolean encrypted,
                                  @JsonProperty("data") String data) {

  public static final String CURRENT_VERSION = "2.1";
}

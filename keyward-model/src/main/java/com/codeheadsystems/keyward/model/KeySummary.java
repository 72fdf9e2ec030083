package com.codeheadsystems.keyward.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Listing view of a key record without key material.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeySummary(@JsonProperty("fingerprint") String fingerprint,
                         @JsonProperty("keyid") String keyId,
                         @JsonProperty("uids") List<String> uids,
                         @JsonProperty("length") String length,
                         @JsonProperty("algo") String algo,
                         @JsonProperty("created") long created,
                         @JsonProperty("expires") String expires,
                         @JsonProperty("trust") String trust) {

  public KeySummary {
    uids = uids == null ? List.of() : List.copyOf(uids);
  }
}

package com.codeheadsystems.keyward.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KeyRingTest {

  private KeyRing ring;

  @BeforeEach
  void setUp() {
    ring = new KeyRing();
  }

  @Test
  void publicKeys_preserveInsertionOrder() {
    ring.putPublic(publicRecord("CCCC", "carol"));
    ring.putPublic(publicRecord("AAAA", "alice"));
    ring.putPublic(publicRecord("BBBB", "bob"));

    assertThat(ring.publicKeys()).extracting(PublicKeyRecord::fingerprint)
        .containsExactly("CCCC", "AAAA", "BBBB");
  }

  @Test
  void putPublic_sameFingerprint_replacesAndReturnsPrevious() {
    ring.putPublic(publicRecord("AAAA", "first"));

    assertThat(ring.putPublic(publicRecord("AAAA", "second")))
        .get().extracting(r -> r.uids().get(0)).isEqualTo("first");
    assertThat(ring.publicKeys()).hasSize(1);
    assertThat(ring.publicKey("AAAA")).get().extracting(r -> r.uids().get(0)).isEqualTo("second");
  }

  @Test
  void summaries_selectRingBySecretFlag() {
    ring.putPublic(publicRecord("AAAA", "alice"));
    ring.putPublic(publicRecord("BBBB", "bob"));
    ring.putPrivate(privateRecord("AAAA"));

    assertThat(ring.summaries(false)).extracting(KeySummary::fingerprint).containsExactly("AAAA", "BBBB");
    assertThat(ring.summaries(true)).extracting(KeySummary::fingerprint).containsExactly("AAAA");
  }

  @Test
  void remove_andClear() {
    ring.putPublic(publicRecord("AAAA", "alice"));
    ring.putPrivate(privateRecord("AAAA"));

    assertThat(ring.removePrivate("AAAA")).isPresent();
    assertThat(ring.removePrivate("AAAA")).isEmpty();
    assertThat(ring.isEmpty()).isFalse();

    ring.clear();
    assertThat(ring.isEmpty()).isTrue();
  }

  static PublicKeyRecord publicRecord(String fingerprint, String name) {
    return new PublicKeyRecord(fingerprint, fingerprint, List.of(name), "2048", "RSA", 1L, "",
        PublicKeyRecord.TRUST_ULTIMATE, "pem");
  }

  static PrivateKeyRecord privateRecord(String fingerprint) {
    return new PrivateKeyRecord(fingerprint, fingerprint, List.of("x"), "2048", "RSA", 1L, "",
        PublicKeyRecord.TRUST_ULTIMATE, "blob", PrivateKeyFormat.WRAPPED);
  }
}

package com.codeheadsystems.keyward.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keyward.crypto.common.RandomProvider;
import com.codeheadsystems.keyward.model.error.KeywardException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MasterKeyDeriverTest {

  @TempDir
  Path dir;

  @Test
  void deriveKey_createsSaltOnce_andIsStableAcrossInstances() throws Exception {
    byte[] first = new MasterKeyDeriver(dir, 1_000, new RandomProvider()).deriveKey("pw");
    byte[] salt = Files.readAllBytes(dir.resolve(MasterKeyDeriver.SALT_FILE));

    byte[] second = new MasterKeyDeriver(dir, 1_000, new RandomProvider()).deriveKey("pw");

    assertThat(first).hasSize(32).isEqualTo(second);
    assertThat(salt).hasSize(MasterKeyDeriver.SALT_SIZE);
    assertThat(Files.readAllBytes(dir.resolve(MasterKeyDeriver.SALT_FILE))).isEqualTo(salt);
  }

  @Test
  void deriveKey_differsByPassword() {
    MasterKeyDeriver deriver = new MasterKeyDeriver(dir, 1_000, new RandomProvider());
    assertThat(deriver.deriveKey("a")).isNotEqualTo(deriver.deriveKey("b"));
  }

  @Test
  void deriveKey_emptySaltFileFails() throws Exception {
    Files.write(dir.resolve(MasterKeyDeriver.SALT_FILE), new byte[0]);
    MasterKeyDeriver deriver = new MasterKeyDeriver(dir, 1_000, new RandomProvider());

    assertThatThrownBy(() -> deriver.deriveKey("pw")).isInstanceOf(KeywardException.class);
  }
}

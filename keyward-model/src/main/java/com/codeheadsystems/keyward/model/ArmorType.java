package com.codeheadsystems.keyward.model;

import java.util.Optional;

/**
 * Armor labels written by keyward. Decoding keeps any other label verbatim.
 */
public enum ArmorType {
  PUBLIC_KEY_BLOCK("PUBLIC KEY BLOCK"),
  PRIVATE_KEY_BLOCK("PRIVATE KEY BLOCK"),
  MESSAGE("MESSAGE");

  private final String label;

  ArmorType(final String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public static Optional<ArmorType> fromLabel(final String label) {
    for (ArmorType type : values()) {
      if (type.label.equals(label)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}

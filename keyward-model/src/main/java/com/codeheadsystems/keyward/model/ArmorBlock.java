package com.codeheadsystems.keyward.model;

/**
 * A decoded ASCII armor block.
 *
 * @param label   text between {@code -----BEGIN PGP } and the closing dashes
 * @param payload base64 body with line breaks removed
 */
public record ArmorBlock(String label, String payload) {

  public static ArmorBlock of(final ArmorType type, final String payload) {
    return new ArmorBlock(type.label(), payload);
  }

  public boolean isMessage() {
    return label.contains(ArmorType.MESSAGE.label());
  }

  /**
   * Matches any label naming a private key, not only the exact {@code PRIVATE KEY BLOCK}.
   */
  public boolean isPrivateKey() {
    return label.contains("PRIVATE KEY");
  }
}

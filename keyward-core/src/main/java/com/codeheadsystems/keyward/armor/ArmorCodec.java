package com.codeheadsystems.keyward.armor;

import com.codeheadsystems.keyward.model.ArmorBlock;
import com.codeheadsystems.keyward.model.error.ErrorKind;
import com.codeheadsystems.keyward.model.error.KeywardException;
import java.util.ArrayList;
import java.util.List;

/**
 * ASCII armor encoding.
 * <pre>
 *   -----BEGIN PGP &lt;TYPE&gt;-----
 *
 *   &lt;base64, 64 characters per line&gt;
 *   -----END PGP &lt;TYPE&gt;-----
 * </pre>
 * Lines are joined with {@code \n} and there is no trailing newline.
 */
public class ArmorCodec {

  public static final int LINE_LENGTH = 64;

  static final String BEGIN_PREFIX = "-----BEGIN PGP ";
  static final String END_PREFIX = "-----END PGP ";
  private static final String DASHES = "-----";

  private ArmorCodec() {
  }

  public static String encode(final ArmorBlock block) {
    String payload = block.payload();
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < payload.length(); i += LINE_LENGTH) {
      lines.add(payload.substring(i, Math.min(payload.length(), i + LINE_LENGTH)));
    }
    return BEGIN_PREFIX + block.label() + DASHES + "\n\n"
        + String.join("\n", lines)
        + "\n" + END_PREFIX + block.label() + DASHES;
  }

  /**
   * Decodes the first armor block in {@code text}.
   *
   * @param text armored text, possibly surrounded by other content
   * @return the label and the joined payload
   * @throws KeywardException with {@link ErrorKind#INVALID_ARMOR_FORMAT} if either marker is missing
   */
  public static ArmorBlock decode(final String text) {
    if (text == null) {
      throw invalid();
    }
    String[] lines = text.strip().split("\n", -1);
    int begin = -1;
    String label = null;
    for (int i = 0; i < lines.length; i++) {
      String line = stripTrailing(lines[i]);
      if (line.startsWith(BEGIN_PREFIX)) {
        begin = i;
        label = line.substring(BEGIN_PREFIX.length()).replace(DASHES, "");
        break;
      }
    }
    if (begin < 0) {
      throw invalid();
    }
    StringBuilder payload = new StringBuilder();
    for (int i = begin + 1; i < lines.length; i++) {
      String line = lines[i].strip();
      if (line.startsWith(END_PREFIX)) {
        return new ArmorBlock(label, payload.toString());
      }
      if (!line.isEmpty()) {
        payload.append(line);
      }
    }
    throw invalid();
  }

  private static String stripTrailing(final String line) {
    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }

  private static KeywardException invalid() {
    return new KeywardException(ErrorKind.INVALID_ARMOR_FORMAT, "Invalid ASCII armor format");
  }
}

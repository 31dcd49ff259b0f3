package com.flamingo.ai.memoryengine.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/** String helpers shared by the pipeline stages. */
public final class TextUtils {

  private TextUtils() {}

  /** Truncates with a trailing ellipsis when the text is longer than {@code maxLength}. */
  public static String truncate(String content, int maxLength) {
    if (content == null) {
      return "";
    }
    return content.length() > maxLength ? content.substring(0, maxLength) + "..." : content;
  }

  /** Collapses runs of whitespace into single spaces and trims the ends. */
  public static String collapseWhitespace(String content) {
    if (content == null) {
      return "";
    }
    return content.trim().replaceAll("\\s+", " ");
  }

  /** Case- and padding-insensitive form used for exact duplicate detection. */
  public static String normalizeForComparison(String content) {
    return content == null ? "" : content.strip().toLowerCase(Locale.ROOT);
  }

  /** Lower-case hex SHA-256 of the UTF-8 bytes of {@code text}. */
  public static String sha256Hex(String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      // Every JRE ships SHA-256.
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}

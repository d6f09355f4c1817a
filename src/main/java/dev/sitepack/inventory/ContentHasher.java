package dev.sitepack.inventory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Static utility for computing SHA-256 content hashes. Used to cluster pages whose text is the
 * same under different URLs.
 */
public final class ContentHasher {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private ContentHasher() {
    // utility class
  }

  /**
   * Compute the SHA-256 hash of the given content.
   *
   * @param content the content to hash
   * @return lowercase hex string of the SHA-256 hash
   */
  public static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /**
   * Hash page text after collapsing whitespace runs and trimming, so reflowed copies of the same
   * text share a fingerprint.
   */
  public static String fingerprint(String text) {
    return sha256(WHITESPACE.matcher(text == null ? "" : text).replaceAll(" ").trim());
  }
}

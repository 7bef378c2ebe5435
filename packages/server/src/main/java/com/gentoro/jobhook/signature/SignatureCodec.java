package com.gentoro.jobhook.signature;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 signing and verification over raw payload bytes, in the {@code sha256=<hex>} header
 * form used by both inbound webhooks and outbound callbacks.
 *
 * <p>Callers must pass the exact bytes that were received or are about to be transmitted. The
 * codec never re-serializes anything.
 */
public final class SignatureCodec {

  /** Canonical header carrying the signature, inbound and outbound. */
  public static final String HEADER = "X-Webhook-Signature";

  public static final String PREFIX = "sha256=";

  private static final String ALGORITHM = "HmacSHA256";
  private static final int DIGEST_LENGTH = 32;
  private static final HexFormat HEX = HexFormat.of();

  private SignatureCodec() {}

  /** Lowercase hex HMAC-SHA256 of {@code payload} keyed with {@code secret}. */
  public static String sign(String secret, byte[] payload) {
    return HEX.formatHex(hmac(secret, payload));
  }

  /** Full header value, {@code sha256=<hex>}. */
  public static String headerValue(String secret, byte[] payload) {
    return PREFIX + sign(secret, payload);
  }

  /**
   * Check a presented header value against the payload. Returns {@code false} for a missing
   * prefix, non-hex characters or a digest that does not decode to 32 bytes; never throws for
   * malformed input. The digest comparison is constant-time.
   */
  public static boolean verify(String secret, byte[] payload, String presented) {
    if (secret == null || presented == null || payload == null || !presented.startsWith(PREFIX)) {
      return false;
    }
    String hex = presented.substring(PREFIX.length());
    if (hex.length() != DIGEST_LENGTH * 2) {
      return false;
    }

    byte[] candidate;
    try {
      candidate = HEX.parseHex(hex);
    } catch (IllegalArgumentException e) {
      return false;
    }
    return MessageDigest.isEqual(hmac(secret, payload), candidate);
  }

  private static byte[] hmac(String secret, byte[] payload) {
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(payload, "payload");
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      byte[] key = secret.getBytes(StandardCharsets.UTF_8);
      // HMAC zero-pads the key, so an empty key equals a single zero byte
      mac.init(new SecretKeySpec(key.length == 0 ? new byte[1] : key, ALGORITHM));
      return mac.doFinal(payload);
    } catch (GeneralSecurityException e) {
      // HmacSHA256 is mandatory on every JRE
      throw new IllegalStateException("HMAC-SHA256 unavailable", e);
    }
  }
}

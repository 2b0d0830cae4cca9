package com.scholary.video2mp3.resolver;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Produces the anti-replay headers the parser API expects.
 *
 * <p>Each request carries the epoch-millis timestamp, 32 random ASCII letters, and those letters
 * Vigenère-shifted by a key derived from the timestamp: every digit {@code d} maps to the letter
 * {@code 'a' + d}. Case is preserved and non-letters pass through.
 */
public class ParserRequestSigner {

  static final int NONCE_LENGTH = 32;
  private static final String LETTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

  private final Random random;

  public ParserRequestSigner() {
    this(new SecureRandom());
  }

  ParserRequestSigner(Random random) {
    this.random = random;
  }

  public SignedHeaders sign(long epochMillis) {
    String timestamp = Long.toString(epochMillis);
    String nonce = randomLetters(NONCE_LENGTH);
    return new SignedHeaders(timestamp, nonce, vigenere(nonce, timestampKey(timestamp)));
  }

  static String timestampKey(String timestamp) {
    StringBuilder key = new StringBuilder(timestamp.length());
    for (char c : timestamp.toCharArray()) {
      key.append(c >= '0' && c <= '9' ? (char) ('a' + (c - '0')) : '?');
    }
    return key.toString();
  }

  static String vigenere(String text, String key) {
    if (key.isEmpty()) {
      return text;
    }
    StringBuilder out = new StringBuilder(text.length());
    int keyIndex = 0;
    for (char c : text.toCharArray()) {
      boolean upper = c >= 'A' && c <= 'Z';
      boolean lower = c >= 'a' && c <= 'z';
      if (!upper && !lower) {
        out.append(c);
        continue;
      }
      char base = upper ? 'A' : 'a';
      int shift = Character.toLowerCase(key.charAt(keyIndex % key.length())) - 'a';
      out.append((char) (Math.floorMod(c - base + shift, 26) + base));
      keyIndex++;
    }
    return out.toString();
  }

  private String randomLetters(int n) {
    StringBuilder sb = new StringBuilder(n);
    for (int i = 0; i < n; i++) {
      sb.append(LETTERS.charAt(random.nextInt(LETTERS.length())));
    }
    return sb.toString();
  }

  /** Values for the {@code X-Timestamp}, {@code X-GCLT-Text} and {@code X-EGCT-Text} headers. */
  public record SignedHeaders(String timestamp, String nonce, String encryptedNonce) {}
}

package io.github.behaviorcache.cache;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Hex digests of files and byte arrays.
 */
public final class FileDigests {

  private static final int BUFFER_SIZE = 64 * 1024;

  private FileDigests() {
  }

  /**
   * Digest a file.
   *
   * @param path      the path
   * @param algorithm a MessageDigest algorithm name
   * @return lowercase hex
   * @throws IOException if the file cannot be read
   */
  public static String hex(final Path path, final String algorithm) throws IOException {
    final MessageDigest digest = newDigest(algorithm);
    final byte[] buffer = new byte[BUFFER_SIZE];
    try (InputStream in = Files.newInputStream(path)) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        digest.update(buffer, 0, read);
      }
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  /**
   * Digest bytes.
   *
   * @param bytes     the bytes
   * @param algorithm the algorithm
   * @return lowercase hex
   */
  public static String hex(final byte[] bytes, final String algorithm) {
    return HexFormat.of().formatHex(newDigest(algorithm).digest(bytes));
  }

  /**
   * Case-insensitive comparison of hex digests.
   *
   * @param expected the expected
   * @param actual   the actual
   * @return true if equal
   */
  public static boolean matches(final String expected, final String actual) {
    return expected != null && expected.trim().equalsIgnoreCase(actual);
  }

  private static MessageDigest newDigest(final String algorithm) {
    try {
      return MessageDigest.getInstance(algorithm);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalArgumentException("Unsupported hash algorithm " + algorithm, e);
    }
  }
}

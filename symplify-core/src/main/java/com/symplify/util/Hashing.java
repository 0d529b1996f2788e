package com.symplify.util;

import java.nio.charset.StandardCharsets;

/**
 * Static hash functions used to compute structural hashes of expression trees.
 */
public final class Hashing {

  /**
   * Initial hash for the FNV-1a 64-bit hash function.
   */
  public static final long FNV1_64_INIT = 0xcbf29ce484222325L;
  private static final long FNV1_PRIME_64 = 1099511628211L;

  private Hashing() {}

  /**
   * Computes the hash using the FNV-1a 64-bit hash function, starting with the initial hash.
   * <p>
   * The hash generation must always start with {@link #FNV1_64_INIT} as initial hash but this version comes in handy
   * when generating the hash for multiple values consecutively in a loop.
   *
   * @param initHash the initial hash
   * @param data     the data to generate the hash for
   * @return the generated hash
   */
  public static long fnv1a64(long initHash, byte... data) {
    long hash = initHash;
    if (data == null) {
      return hash;
    }
    for (byte datum : data) {
      hash ^= (datum & 0xff);
      hash *= FNV1_PRIME_64;
    }
    return hash;
  }

  /**
   * Computes the hash using the FNV-1a 64-bit hash function, feeding the 8 bytes of {@code value} little-end first.
   *
   * @param initHash the initial hash
   * @param value    the value to mix into the hash
   * @return the generated hash
   */
  public static long fnv1a64(long initHash, long value) {
    long hash = initHash;
    for (int i = 0; i < 8; i++) {
      hash ^= (value >>> (i * 8)) & 0xff;
      hash *= FNV1_PRIME_64;
    }
    return hash;
  }

  /** Computes the FNV-1a 64-bit hash of the UTF-8 bytes of {@code string}, starting with the initial hash. */
  public static long fnv1a64(long initHash, String string) {
    return fnv1a64(initHash, string.getBytes(StandardCharsets.UTF_8));
  }
}

package com.symplify.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HashingTest {

  @Test
  void testFnv1a64OfString() {
    assertEquals(Hashing.FNV1_64_INIT, Hashing.fnv1a64(Hashing.FNV1_64_INIT, ""));
    assertEquals(0xaf63dc4c8601ec8cL, Hashing.fnv1a64(Hashing.FNV1_64_INIT, "a"));
    assertEquals(0x85944171f73967e8L, Hashing.fnv1a64(Hashing.FNV1_64_INIT, "foobar"));
  }

  @Test
  void testLongIsHashedLittleEndFirst() {
    assertEquals(
      Hashing.fnv1a64(Hashing.FNV1_64_INIT, "a\0\0\0\0\0\0\0"),
      Hashing.fnv1a64(Hashing.FNV1_64_INIT, 0x61L)
    );
  }

  @Test
  void testChainedHashDependsOnOrder() {
    long ab = Hashing.fnv1a64(Hashing.fnv1a64(Hashing.FNV1_64_INIT, 1L), 2L);
    long ba = Hashing.fnv1a64(Hashing.fnv1a64(Hashing.FNV1_64_INIT, 2L), 1L);
    assertNotEquals(ab, ba);
  }
}

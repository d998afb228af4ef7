package org.chaincraft.store;

import org.chaincraft.crypto.Sha256CryptoProvider;
import org.chaincraft.model.Digest;
import org.junit.Assert;
import org.junit.Test;

import static org.chaincraft.TestUtils.bytes;

public class MemoryObjectStoreTest {

  @Test
  public void readsItsOwnWrites() {
    MemoryObjectStore store = new MemoryObjectStore();
    Digest digest = new Sha256CryptoProvider().hash(bytes("value"));
    Assert.assertFalse(store.contains(digest));
    Assert.assertNull(store.get(digest));
    byte[] value = bytes("value");
    store.put(digest, value);
    value[0] = 'X';
    Assert.assertTrue(store.contains(digest));
    Assert.assertArrayEquals(bytes("value"), store.get(digest));
    store.get(digest)[0] = 'Y';
    Assert.assertArrayEquals(bytes("value"), store.get(digest));
    Assert.assertEquals(1, store.size());
  }
}

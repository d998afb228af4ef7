package org.chaincraft.manager;

import org.chaincraft.crypto.Sha256CryptoProvider;
import org.chaincraft.model.Digest;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.chaincraft.TestUtils.bytes;

public class DedupCacheTest {

  private final Sha256CryptoProvider crypto = new Sha256CryptoProvider();
  private final ManualClock clock = new ManualClock();

  private List<Digest> digests(int n) {
    List<Digest> out = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      out.add(crypto.hash(bytes("object-" + i)));
    }
    return out;
  }

  @Test
  public void insertReportsFirstSighting() {
    DedupCache cache = new DedupCache(10, 60_000, clock);
    Digest d = crypto.hash(bytes("a"));
    Assert.assertFalse(cache.contains(d));
    Assert.assertTrue(cache.insert(d));
    Assert.assertFalse(cache.insert(d));
    Assert.assertTrue(cache.contains(d));
    Assert.assertEquals(1, cache.size());
  }

  @Test
  public void overflowEvictsExactlyTheOldest() {
    int capacity = 5;
    DedupCache cache = new DedupCache(capacity, 60_000, clock);
    List<Digest> digests = digests(capacity + 1);
    for (Digest d : digests) {
      Assert.assertTrue(cache.insert(d));
      clock.advance(1);
    }
    Assert.assertEquals(capacity, cache.size());
    Assert.assertFalse(cache.contains(digests.get(0)));
    for (int i = 1; i <= capacity; i++) {
      Assert.assertTrue(cache.contains(digests.get(i)));
    }
  }

  @Test
  public void evictedDigestIsNovelAgain() {
    DedupCache cache = new DedupCache(2, 60_000, clock);
    List<Digest> digests = digests(3);
    for (Digest d : digests) {
      cache.insert(d);
    }
    Assert.assertTrue("evicted digest must be accepted as new", cache.insert(digests.get(0)));
    Assert.assertFalse(cache.contains(digests.get(1)));
  }

  @Test
  public void entriesExpireByAge() {
    DedupCache cache = new DedupCache(100, 1000, clock);
    List<Digest> digests = digests(3);
    cache.insert(digests.get(0));
    clock.advance(600);
    cache.insert(digests.get(1));
    clock.advance(400);
    Assert.assertFalse(cache.contains(digests.get(0)));
    Assert.assertTrue(cache.contains(digests.get(1)));
    Assert.assertEquals(0, cache.purgeExpired());
    clock.advance(600);
    Assert.assertEquals(1, cache.purgeExpired());
    Assert.assertEquals(0, cache.size());
  }

  @Test
  public void expiredEntryCanBeReinsertedAndIsNotEvictedByItsStaleQueueSlot() {
    DedupCache cache = new DedupCache(100, 1000, clock);
    Digest d = crypto.hash(bytes("again"));
    cache.insert(d);
    clock.advance(1000);
    Assert.assertTrue(cache.insert(d));
    Assert.assertEquals(0, cache.purgeExpired());
    Assert.assertTrue(cache.contains(d));
  }

  @Test
  public void concurrentInsertsOfOneDigestHaveOneWinner() throws Exception {
    DedupCache cache = new DedupCache(100, 60_000, new SystemClock());
    Digest d = crypto.hash(bytes("contended"));
    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    CountDownLatch done = new CountDownLatch(threads);
    AtomicInteger winners = new AtomicInteger();
    for (int i = 0; i < threads; i++) {
      new Thread(() -> {
        try {
          start.await();
          if (cache.insert(d)) {
            winners.incrementAndGet();
          }
        } catch (InterruptedException ignore) {
        } finally {
          done.countDown();
        }
      }).start();
    }
    start.countDown();
    done.await();
    Assert.assertEquals(1, winners.get());
  }

  @Test
  public void sizeNeverExceedsCapacityUnderLoad() throws Exception {
    int capacity = 50;
    DedupCache cache = new DedupCache(capacity, 60_000, new SystemClock());
    List<Digest> digests = digests(1000);
    Thread[] workers = new Thread[4];
    for (int t = 0; t < workers.length; t++) {
      final int offset = t;
      workers[t] = new Thread(() -> {
        for (int i = offset; i < digests.size(); i += workers.length) {
          cache.insert(digests.get(i));
        }
      });
      workers[t].start();
    }
    for (Thread worker : workers) {
      worker.join();
    }
    Assert.assertTrue("size " + cache.size(), cache.size() <= capacity);
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsZeroCapacity() {
    new DedupCache(0, 1000, clock);
  }
}

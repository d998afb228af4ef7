package org.chaincraft.manager;

import org.chaincraft.crypto.Sha256CryptoProvider;
import org.chaincraft.model.Digest;
import org.chaincraft.model.ObjectKind;
import org.chaincraft.model.SharedObject;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static org.chaincraft.TestUtils.bytes;

public class DeferredObjectsTest {

  private final Sha256CryptoProvider crypto = new Sha256CryptoProvider();
  private final ManualClock clock = new ManualClock();

  private SharedObject object(String payload) {
    return new SharedObject(crypto.hash(bytes(payload)), ObjectKind.TRANSACTION, bytes(payload), null,
        clock.currentTimeMillis());
  }

  @Test
  public void releaseReturnsWaitersInParkOrder() {
    DeferredObjects deferred = new DeferredObjects(3, 60_000, 100, clock);
    Digest missing = crypto.hash(bytes("missing"));
    SharedObject first = object("first");
    SharedObject second = object("second");
    Assert.assertTrue(deferred.park(first, missing));
    Assert.assertTrue(deferred.park(second, missing));
    Assert.assertTrue(deferred.isWaitingOn(missing));
    Assert.assertEquals(2, deferred.size());

    List<SharedObject> released = deferred.release(missing);
    Assert.assertEquals(2, released.size());
    Assert.assertEquals(first, released.get(0));
    Assert.assertEquals(second, released.get(1));
    Assert.assertEquals(0, deferred.size());
    Assert.assertTrue(deferred.release(missing).isEmpty());
  }

  @Test
  public void givesUpAfterMaxRetries() {
    DeferredObjects deferred = new DeferredObjects(2, 60_000, 100, clock);
    Digest missing = crypto.hash(bytes("missing"));
    SharedObject o = object("o");
    Assert.assertTrue(deferred.park(o, missing));
    deferred.release(missing);
    Assert.assertTrue(deferred.park(o, missing));
    deferred.release(missing);
    Assert.assertFalse(deferred.park(o, missing));
    Assert.assertEquals(0, deferred.size());
  }

  @Test
  public void forgetResetsRetries() {
    DeferredObjects deferred = new DeferredObjects(1, 60_000, 100, clock);
    Digest missing = crypto.hash(bytes("missing"));
    SharedObject o = object("o");
    Assert.assertTrue(deferred.park(o, missing));
    deferred.release(missing);
    deferred.forget(o.getDigest());
    Assert.assertTrue(deferred.park(o, missing));
  }

  @Test
  public void boundedByMaxPending() {
    DeferredObjects deferred = new DeferredObjects(3, 60_000, 2, clock);
    Digest missing = crypto.hash(bytes("missing"));
    Assert.assertTrue(deferred.park(object("a"), missing));
    Assert.assertTrue(deferred.park(object("b"), missing));
    Assert.assertFalse(deferred.park(object("c"), missing));
    Assert.assertEquals(2, deferred.size());
  }

  @Test
  public void purgeDropsExpiredObjects() {
    DeferredObjects deferred = new DeferredObjects(3, 1000, 100, clock);
    Digest missing = crypto.hash(bytes("missing"));
    SharedObject old = object("old");
    deferred.park(old, missing);
    clock.advance(600);
    SharedObject young = object("young");
    deferred.park(young, missing);
    clock.advance(500);

    List<SharedObject> dropped = deferred.purgeExpired();
    Assert.assertEquals(1, dropped.size());
    Assert.assertEquals(old, dropped.get(0));
    Assert.assertEquals(1, deferred.size());
    Assert.assertEquals(young, deferred.release(missing).get(0));
  }
}

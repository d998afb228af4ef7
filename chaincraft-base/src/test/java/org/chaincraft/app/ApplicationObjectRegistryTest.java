package org.chaincraft.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.chaincraft.crypto.Sha256CryptoProvider;
import org.chaincraft.model.ObjectKind;
import org.chaincraft.model.SharedObject;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.chaincraft.TestUtils.bytes;

public class ApplicationObjectRegistryTest {

  private final Sha256CryptoProvider crypto = new Sha256CryptoProvider();

  private SharedObject object(String payload) {
    return new SharedObject(crypto.hash(bytes(payload)), ObjectKind.TRANSACTION, bytes(payload), null, 0);
  }

  /** Remembers the order indexes it saw and throws on a chosen payload. */
  private static class Recorder implements ApplicationObject {
    private final List<Long> seen = new ArrayList<>();
    private final String poison;

    Recorder(String poison) {
      this.poison = poison;
    }

    @Override
    public String getTypeName() {
      return "Recorder";
    }

    @Override
    public boolean isValid(SharedObject object) {
      return true;
    }

    @Override
    public void apply(SharedObject object, long orderIndex) {
      if (poison.equals(new String(object.getPayload()))) {
        throw new IllegalArgumentException("poisoned");
      }
      seen.add(orderIndex);
    }

    @Override
    public JsonNode getState() {
      return JsonNodeFactory.instance.numberNode(seen.size());
    }

    @Override
    public void reset() {
      seen.clear();
    }
  }

  @Test
  public void objectsAreLookedUpByIdAndType() {
    ApplicationObjectRegistry registry = new ApplicationObjectRegistry();
    SimpleSharedNumber number = new SimpleSharedNumber();
    String numberId = registry.register(number);
    String recorderId = registry.register(new Recorder("x"));

    Assert.assertNotEquals(numberId, recorderId);
    Assert.assertEquals(2, registry.size());
    Assert.assertEquals(Arrays.asList(numberId, recorderId), registry.ids());
    Assert.assertSame(number, registry.get(numberId));
    Assert.assertEquals(Collections.singletonList(number), registry.getByType(SimpleSharedNumber.TYPE_NAME));

    Assert.assertSame(number, registry.remove(numberId));
    Assert.assertNull(registry.get(numberId));
    Assert.assertTrue(registry.getByType(SimpleSharedNumber.TYPE_NAME).isEmpty());
  }

  @Test
  public void onlyInterestedObjectsConsumeAnObject() {
    ApplicationObjectRegistry registry = new ApplicationObjectRegistry();
    SimpleSharedNumber number = new SimpleSharedNumber();
    Recorder recorder = new Recorder("x");
    String numberId = registry.register(number);
    String recorderId = registry.register(recorder);

    Assert.assertEquals(Arrays.asList(numberId, recorderId), registry.process(object("3"), 0));
    Assert.assertEquals(Collections.singletonList(recorderId), registry.process(object("text"), 1));
    Assert.assertEquals(3, number.getNumber());
    Assert.assertEquals(Arrays.asList(0L, 1L), recorder.seen);
  }

  @Test
  public void aFailingObjectDoesNotStopTheOthers() {
    ApplicationObjectRegistry registry = new ApplicationObjectRegistry();
    Recorder failing = new Recorder("9");
    SimpleSharedNumber number = new SimpleSharedNumber();
    registry.register(failing);
    String numberId = registry.register(number);

    Assert.assertEquals(Collections.singletonList(numberId), registry.process(object("9"), 0));
    Assert.assertEquals(9, number.getNumber());
    Assert.assertTrue(failing.seen.isEmpty());
  }
}

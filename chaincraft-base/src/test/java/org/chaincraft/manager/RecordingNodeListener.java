package org.chaincraft.manager;

import org.chaincraft.event.NodeListener;
import org.chaincraft.model.Digest;
import org.chaincraft.model.SharedObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class RecordingNodeListener implements NodeListener {

  private final Map<Digest, Long> accepted = new ConcurrentHashMap<>();
  private final Map<Digest, List<String>> rejected = new ConcurrentHashMap<>();
  private final List<Throwable> fatal = new ArrayList<>();

  @Override
  public void objectAccepted(SharedObject object, long orderIndex) {
    accepted.put(object.getDigest(), orderIndex);
  }

  @Override
  public void objectRejected(SharedObject object, String reason) {
    rejected.computeIfAbsent(object.getDigest(), d -> new ArrayList<>()).add(reason);
  }

  @Override
  public synchronized void fatalError(Throwable cause) {
    fatal.add(cause);
  }

  public boolean isAccepted(Digest digest) {
    return accepted.containsKey(digest);
  }

  public long indexOf(Digest digest) {
    return accepted.getOrDefault(digest, -1L);
  }

  public int acceptedCount() {
    return accepted.size();
  }

  public List<String> rejections(Digest digest) {
    return rejected.getOrDefault(digest, new ArrayList<>());
  }

  public synchronized List<Throwable> fatalErrors() {
    return new ArrayList<>(fatal);
  }
}

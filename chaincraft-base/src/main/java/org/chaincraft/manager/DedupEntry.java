package org.chaincraft.manager;

import org.chaincraft.model.Digest;

/**
 * Membership record of the dedup cache. Equality is identity, so a stale entry left in the eviction
 * queue never removes a newer entry for the same digest.
 */
public final class DedupEntry {

  private final Digest digest;
  private final long firstSeen;

  DedupEntry(Digest digest, long firstSeen) {
    this.digest = digest;
    this.firstSeen = firstSeen;
  }

  public Digest getDigest() {
    return digest;
  }

  public long getFirstSeen() {
    return firstSeen;
  }

  @Override
  public String toString() {
    return "DedupEntry [digest=" + digest + ", firstSeen=" + firstSeen + "]";
  }
}

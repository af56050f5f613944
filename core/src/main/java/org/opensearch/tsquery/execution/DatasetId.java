/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.tsquery.execution.table.GroupKey;

/**
 * Identity of one runtime dataflow node instance.
 *
 * <p>IDs are name-based (RFC 4122 version 5) UUIDs, so deriving an ID from the same inputs always
 * yields the same value: {@link #fromNodeId(String)} names a plan node, {@link #derive(GroupKey)}
 * names the nested pipeline a stage node spawns for one group key.
 */
@Getter
@EqualsAndHashCode
public final class DatasetId {

  /** Namespace of IDs derived from plan-node IDs. */
  private static final UUID NODE_NAMESPACE = new UUID(0L, 0L);

  private final UUID uuid;

  public DatasetId(UUID uuid) {
    this.uuid = uuid;
  }

  /** Returns the ID of the runtime node that executes the plan node {@code nodeId}. */
  public static DatasetId fromNodeId(String nodeId) {
    return new DatasetId(nameBased(NODE_NAMESPACE, nodeId.getBytes(StandardCharsets.UTF_8)));
  }

  /** Returns the ID of the child named {@code name} in the namespace of this ID. */
  public DatasetId derive(String name) {
    return new DatasetId(nameBased(uuid, name.getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * Returns the ID of the nested pipeline this node runs for {@code key}. Keys that are not equal
   * derive distinct IDs.
   */
  public DatasetId derive(GroupKey key) {
    return new DatasetId(nameBased(uuid, key.encode()));
  }

  private static UUID nameBased(UUID namespace, byte[] name) {
    MessageDigest sha1;
    try {
      sha1 = MessageDigest.getInstance("SHA-1");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-1 is not available", e);
    }
    ByteBuffer ns = ByteBuffer.allocate(16);
    ns.putLong(namespace.getMostSignificantBits());
    ns.putLong(namespace.getLeastSignificantBits());
    sha1.update(ns.array());
    byte[] hash = sha1.digest(name);
    hash[6] &= 0x0f;
    hash[6] |= 0x50;
    hash[8] &= 0x3f;
    hash[8] |= (byte) 0x80;
    ByteBuffer bytes = ByteBuffer.wrap(hash, 0, 16);
    return new UUID(bytes.getLong(), bytes.getLong());
  }

  @Override
  public String toString() {
    return uuid.toString();
  }
}

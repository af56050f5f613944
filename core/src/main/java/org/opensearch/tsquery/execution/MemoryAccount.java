/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

import java.util.concurrent.atomic.AtomicLong;
import org.opensearch.tsquery.exception.ResourceExhaustedException;

/**
 * Tracks the bytes retained by the tables of one query against its memory budget. Nested
 * pipelines get a {@link #child()} account that reports its own usage but draws from the budget
 * of the parent.
 */
public class MemoryAccount {

  /** Account for tables that are not charged to any query. */
  public static final MemoryAccount UNBOUNDED = new MemoryAccount(Long.MAX_VALUE);

  private final long limitBytes;
  private final MemoryAccount parent;
  private final AtomicLong allocatedBytes = new AtomicLong();

  public MemoryAccount(long limitBytes) {
    this(limitBytes, null);
  }

  private MemoryAccount(long limitBytes, MemoryAccount parent) {
    if (limitBytes <= 0) {
      throw new IllegalArgumentException("memory limit must be positive: " + limitBytes);
    }
    this.limitBytes = limitBytes;
    this.parent = parent;
  }

  /** Returns an account sharing this account's budget. */
  public MemoryAccount child() {
    return this == UNBOUNDED ? UNBOUNDED : new MemoryAccount(limitBytes, this);
  }

  /**
   * Charges {@code bytes} to this account.
   *
   * @throws ResourceExhaustedException if the budget would be exceeded
   */
  public void allocate(long bytes) {
    if (this == UNBOUNDED || bytes == 0) {
      return;
    }
    if (bytes < 0) {
      throw new IllegalArgumentException("cannot allocate a negative amount: " + bytes);
    }
    if (parent != null) {
      parent.allocate(bytes);
      allocatedBytes.addAndGet(bytes);
      return;
    }
    long updated = allocatedBytes.addAndGet(bytes);
    if (updated > limitBytes) {
      allocatedBytes.addAndGet(-bytes);
      throw new ResourceExhaustedException(
          "memory limit of "
              + limitBytes
              + " bytes exceeded: requested "
              + bytes
              + " with "
              + (updated - bytes)
              + " in use");
    }
  }

  /** Returns {@code bytes} previously charged with {@link #allocate(long)}. */
  public void free(long bytes) {
    if (this == UNBOUNDED || bytes == 0) {
      return;
    }
    allocatedBytes.addAndGet(-bytes);
    if (parent != null) {
      parent.free(bytes);
    }
  }

  public long getAllocatedBytes() {
    return allocatedBytes.get();
  }

  public long getLimitBytes() {
    return limitBytes;
  }
}

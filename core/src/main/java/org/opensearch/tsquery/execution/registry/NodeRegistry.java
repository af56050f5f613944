/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.registry;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.opensearch.tsquery.exception.UnsupportedOperationKindException;

/**
 * Kind to constructor mapping for runtime nodes, shared by top-level and nested pipeline
 * construction. Populated once through {@link Builder} and immutable afterwards.
 */
public class NodeRegistry {

  private final Map<String, SourceFactory> sources;
  private final Map<String, TransformationFactory> transformations;

  private NodeRegistry(
      Map<String, SourceFactory> sources, Map<String, TransformationFactory> transformations) {
    this.sources = ImmutableMap.copyOf(sources);
    this.transformations = ImmutableMap.copyOf(transformations);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the source constructor of {@code kind}.
   *
   * @throws UnsupportedOperationKindException if none is registered
   */
  public SourceFactory getSourceFactory(String kind) {
    SourceFactory factory = sources.get(kind);
    if (factory == null) {
      throw new UnsupportedOperationKindException(kind);
    }
    return factory;
  }

  /**
   * Returns the transformation constructor of {@code kind}.
   *
   * @throws UnsupportedOperationKindException if none is registered
   */
  public TransformationFactory getTransformationFactory(String kind) {
    TransformationFactory factory = transformations.get(kind);
    if (factory == null) {
      throw new UnsupportedOperationKindException(kind);
    }
    return factory;
  }

  public Set<String> getSourceKinds() {
    return sources.keySet();
  }

  public Set<String> getTransformationKinds() {
    return transformations.keySet();
  }

  /**
   * Collects registrations. Registering the same constructor for a kind twice is a no-op;
   * registering a different one fails.
   */
  public static class Builder {
    private final Map<String, SourceFactory> sources = new LinkedHashMap<>();
    private final Map<String, TransformationFactory> transformations = new LinkedHashMap<>();

    public Builder registerSource(String kind, SourceFactory factory) {
      register(sources, kind, factory, "source");
      return this;
    }

    public Builder registerTransformation(String kind, TransformationFactory factory) {
      register(transformations, kind, factory, "transformation");
      return this;
    }

    public NodeRegistry build() {
      return new NodeRegistry(sources, transformations);
    }

    private static <T> void register(Map<String, T> target, String kind, T factory, String what) {
      T existing = target.putIfAbsent(kind, factory);
      if (existing != null && existing != factory) {
        throw new IllegalStateException(
            "duplicate " + what + " registration for kind " + kind);
      }
    }
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.executor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.common.response.ResponseListener;
import org.opensearch.tsquery.common.setting.Settings;
import org.opensearch.tsquery.exception.QueryCancelledException;
import org.opensearch.tsquery.exception.QueryEngineException;
import org.opensearch.tsquery.execution.AccumulationMode;
import org.opensearch.tsquery.execution.DatasetId;
import org.opensearch.tsquery.execution.ExecutionState;
import org.opensearch.tsquery.execution.MemoryAccount;
import org.opensearch.tsquery.execution.PipelineBuilder;
import org.opensearch.tsquery.execution.PipelineContext;
import org.opensearch.tsquery.execution.Source;
import org.opensearch.tsquery.execution.dispatch.PoolDispatcher;
import org.opensearch.tsquery.execution.table.Table;
import org.opensearch.tsquery.planner.PhysicalPlan;
import org.opensearch.tsquery.planner.PhysicalPlanner;
import org.opensearch.tsquery.planner.PlanNode;
import org.opensearch.tsquery.planner.stage.StagePlanner;
import org.opensearch.tsquery.spec.QuerySpec;
import org.opensearch.tsquery.spec.ResourceManagement;

/**
 * Runs query graphs on a worker pool shared by all queries.
 *
 * <p>Execution flow:
 *
 * <pre>
 * 1. rewrite push-down chains into stages (if enabled)
 * 2. plan the graph and instantiate it, one result collector per leaf
 * 3. run every source on the dispatcher of the query
 * 4. report once all collectors have finished
 * </pre>
 *
 * <p>Planning and construction failures are reported before anything runs. Once running, the
 * first error recorded by the dispatcher aborts the query and is reported to the listener right
 * away; tables that reach a collector afterwards are released.
 */
@Log4j2
public class QueryExecutor implements AutoCloseable {

  private final OperationCatalog catalog;
  private final Settings settings;
  private final ExecutorService pool;
  private final StagePlanner stagePlanner;
  private final PhysicalPlanner physicalPlanner;
  private final Map<String, RunningQuery> running = new ConcurrentHashMap<>();

  public QueryExecutor(OperationCatalog catalog, Settings settings) {
    this.catalog = catalog;
    this.settings = settings;
    int workers = settings.getSettingValue(Settings.Key.EXECUTOR_WORKERS);
    this.pool =
        Executors.newFixedThreadPool(
            workers,
            new ThreadFactoryBuilder().setNameFormat("tsquery-worker-%d").setDaemon(true).build());
    this.stagePlanner = new StagePlanner(catalog.getPushDownClassifier());
    this.physicalPlanner = new PhysicalPlanner(catalog.getProcedureRegistry());
  }

  /**
   * Starts {@code spec} and reports its result to {@code listener}.
   *
   * @return the ID of the query, usable with {@link #cancel(String)}
   */
  public String execute(QuerySpec spec, ResponseListener<QueryResult> listener) {
    String queryId = UUID.randomUUID().toString();
    log.info("Starting query {}", queryId);

    PhysicalPlan plan;
    try {
      boolean stageEnabled = settings.getSettingValue(Settings.Key.STAGE_ENABLED);
      QuerySpec rewritten = stageEnabled ? stagePlanner.plan(spec) : spec;
      plan = physicalPlanner.plan(rewritten);
      log.info("Planned query {} into {} nodes", queryId, plan.size());
    } catch (RuntimeException e) {
      log.error("Failed to plan query {}", queryId, e);
      listener.onFailure(e);
      return queryId;
    }
    if (plan.size() == 0) {
      listener.onResponse(new QueryResult(queryId, Map.of()));
      return queryId;
    }

    PipelineContext context = new PipelineContext();
    PoolDispatcher dispatcher = new PoolDispatcher(pool, context);
    ExecutionState state =
        new ExecutionState(
            DatasetId.fromNodeId(queryId),
            dispatcher,
            catalog.getNodeRegistry(),
            new MemoryAccount(memoryLimit(spec.getResources())),
            context,
            spec.getResources(),
            stageConcurrency(spec.getResources()),
            AccumulationMode.DISCARDING);
    RunningQuery query =
        new RunningQuery(queryId, context, dispatcher, listener, plan.getLeaves().size());
    dispatcher.addAbortListener(error -> query.complete());
    try {
      new PipelineBuilder(state).build(plan, query::collector);
    } catch (RuntimeException e) {
      log.error("Failed to build query {}", queryId, e);
      context.setFailed(e.getMessage());
      query.releaseAll();
      listener.onFailure(e);
      return queryId;
    }

    running.put(queryId, query);
    context.setRunning();
    for (Source source : state.getSources()) {
      try {
        dispatcher.schedule(() -> source.run(context));
      } catch (IllegalStateException e) {
        log.debug("Query {} aborted before all sources were scheduled", queryId, e);
        break;
      }
    }
    return queryId;
  }

  /**
   * Cancels a running query. Its listener receives a {@link QueryCancelledException}.
   *
   * @return false if no such query is running
   */
  public boolean cancel(String queryId) {
    RunningQuery query = running.get(queryId);
    if (query == null) {
      return false;
    }
    log.info("Cancelling query {}", queryId);
    query.context.cancel(new QueryCancelledException("query " + queryId + " cancelled"));
    return true;
  }

  /** Cancels running queries and stops the worker pool. */
  @Override
  public void close() {
    running.keySet().forEach(this::cancel);
    pool.shutdown();
    try {
      if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
        pool.shutdownNow();
      }
    } catch (InterruptedException e) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private int stageConcurrency(ResourceManagement resources) {
    if (resources.getConcurrencyQuota() > 0) {
      return resources.getConcurrencyQuota();
    }
    return settings.getSettingValue(Settings.Key.STAGE_CONCURRENCY);
  }

  private long memoryLimit(ResourceManagement resources) {
    if (resources.getMemoryBytesQuota() > 0) {
      return resources.getMemoryBytesQuota();
    }
    return settings.getSettingValue(Settings.Key.QUERY_MEMORY_LIMIT);
  }

  /** Bookkeeping of one query between start and its single report. */
  private class RunningQuery {
    private final String queryId;
    private final PipelineContext context;
    private final PoolDispatcher dispatcher;
    private final ResponseListener<QueryResult> listener;
    private final Map<String, ResultCollector> collectors = new LinkedHashMap<>();
    private final AtomicInteger pending;
    private final AtomicBoolean reported = new AtomicBoolean(false);

    RunningQuery(
        String queryId,
        PipelineContext context,
        PoolDispatcher dispatcher,
        ResponseListener<QueryResult> listener,
        int leaves) {
      this.queryId = queryId;
      this.context = context;
      this.dispatcher = dispatcher;
      this.listener = listener;
      this.pending = new AtomicInteger(leaves);
    }

    synchronized ResultCollector collector(PlanNode leaf) {
      ResultCollector collector = new ResultCollector(leaf.getId(), this::collectorFinished);
      collectors.put(leaf.getId(), collector);
      return collector;
    }

    private void collectorFinished(ResultCollector collector) {
      if (pending.decrementAndGet() == 0) {
        complete();
      }
    }

    /**
     * Reports the query once. Runs when the last collector finishes, or as soon as the dispatcher
     * records an error, since nodes downstream of a failed one may never finish.
     */
    void complete() {
      if (!reported.compareAndSet(false, true)) {
        return;
      }
      running.remove(queryId);
      dispatcher.stop();
      Throwable error = dispatcher.getError();
      if (error == null) {
        error = context.getCause();
      }
      if (error == null) {
        error =
            collectors.values().stream()
                .map(ResultCollector::getError)
                .filter(e -> e != null)
                .findFirst()
                .orElse(null);
      }
      if (error != null) {
        log.error("Query {} failed", queryId, error);
        context.setFailed(error.getMessage());
        releaseAll();
        listener.onFailure(asException(error));
        return;
      }
      context.setFinished();
      Map<String, List<Table>> tables =
          collectors.entrySet().stream()
              .collect(
                  Collectors.toMap(
                      Map.Entry::getKey,
                      e -> e.getValue().getTables(),
                      (a, b) -> a,
                      LinkedHashMap::new));
      log.info("Query {} finished", queryId);
      listener.onResponse(new QueryResult(queryId, tables));
    }

    void releaseAll() {
      collectors.values().forEach(ResultCollector::release);
    }
  }

  private static Exception asException(Throwable error) {
    if (error instanceof Exception) {
      return (Exception) error;
    }
    return new QueryEngineException(error.getMessage(), error);
  }
}

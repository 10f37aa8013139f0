package com.verlumen.treeopt.evaluation;

import com.google.common.base.Throwables;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.verlumen.treeopt.model.Allocation;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Memoizes successful evaluations by allocation. Failures are not cached, so a candidate that hit
 * a dying worker gets another chance later.
 */
public final class CachingEvaluator implements Evaluator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Evaluator delegate;
  private final Cache<Allocation, EvaluationResult> cache;
  private final AtomicLong dispatched = new AtomicLong();
  private final AtomicLong hits = new AtomicLong();

  private CachingEvaluator(Evaluator delegate, long maximumSize) {
    this.delegate = delegate;
    this.cache = CacheBuilder.newBuilder().maximumSize(maximumSize).build();
  }

  public static CachingEvaluator create(Evaluator delegate, long maximumSize) {
    return new CachingEvaluator(delegate, maximumSize);
  }

  /**
   * Concurrent calls for the same allocation share one delegate evaluation. A failed evaluation is
   * handed to every caller waiting on it and then forgotten.
   */
  @Override
  public EvaluationResult evaluate(Allocation allocation, Duration timeout) {
    AtomicBoolean loaded = new AtomicBoolean();
    EvaluationResult result;
    try {
      result =
          cache.get(
              allocation,
              () -> {
                loaded.set(true);
                dispatched.incrementAndGet();
                EvaluationResult evaluated = delegate.evaluate(allocation, timeout);
                if (!evaluated.success()) {
                  throw new UncachedFailure(evaluated);
                }
                return evaluated;
              });
    } catch (ExecutionException e) {
      if (e.getCause() instanceof UncachedFailure) {
        return ((UncachedFailure) e.getCause()).result;
      }
      throw new EvaluatorUnavailableException("Evaluation failed", e.getCause());
    } catch (UncheckedExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw e;
    }
    if (!loaded.get()) {
      hits.incrementAndGet();
    }
    return result;
  }

  /** Sends each distinct uncached allocation to the delegate once. */
  @Override
  public ImmutableList<EvaluationResult> evaluateAll(
      List<Allocation> allocations, Duration timeout) {
    Map<Allocation, EvaluationResult> known = new HashMap<>();
    Set<Allocation> missing = new LinkedHashSet<>();
    for (Allocation allocation : allocations) {
      EvaluationResult cached = cache.getIfPresent(allocation);
      if (cached != null) {
        hits.incrementAndGet();
        known.put(allocation, cached);
      } else {
        missing.add(allocation);
      }
    }
    if (!missing.isEmpty()) {
      List<Allocation> batch = new ArrayList<>(missing);
      dispatched.addAndGet(batch.size());
      ImmutableList<EvaluationResult> results = delegate.evaluateAll(batch, timeout);
      for (int i = 0; i < batch.size(); i++) {
        remember(batch.get(i), results.get(i));
        known.put(batch.get(i), results.get(i));
      }
    }
    logger.atFine().log(
        "Batch of %d: %d dispatched, %d cached", allocations.size(), missing.size(),
        allocations.size() - missing.size());
    return allocations.stream().map(known::get).collect(ImmutableList.toImmutableList());
  }

  @Override
  public Duration defaultTimeout() {
    return delegate.defaultTimeout();
  }

  /** Number of allocations handed to the delegate. */
  public long dispatchCount() {
    return dispatched.get();
  }

  public long hitCount() {
    return hits.get();
  }

  public long size() {
    return cache.size();
  }

  @Override
  public void close() {
    logger.atInfo().log(
        "Evaluation cache: %d entries, %d hits, %d dispatched", cache.size(), hits.get(),
        dispatched.get());
    delegate.close();
  }

  private void remember(Allocation allocation, EvaluationResult result) {
    if (result.success()) {
      cache.asMap().putIfAbsent(allocation, result);
    }
  }

  /** Carries a failed evaluation out of a cache load so that it is not stored. */
  private static final class UncachedFailure extends Exception {
    private static final long serialVersionUID = 1L;

    private final transient EvaluationResult result;

    UncachedFailure(EvaluationResult result) {
      super(result.error(), null, false, false);
      this.result = result;
    }
  }
}

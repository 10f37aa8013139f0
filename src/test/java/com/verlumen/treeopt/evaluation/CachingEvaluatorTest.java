package com.verlumen.treeopt.evaluation;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.testing.FakeEvaluator;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class CachingEvaluatorTest {
  private static final Allocation FIRST = Allocation.of(0, ImmutableSet.of(0, 1, 2));
  private static final Allocation SECOND = Allocation.of(0, ImmutableSet.of(0, 1));

  @Rule public MockitoRule mocks = MockitoJUnit.rule();

  @Mock private Evaluator slowDelegate;

  private final FakeEvaluator delegate = new FakeEvaluator();
  private final CachingEvaluator evaluator = CachingEvaluator.create(delegate, 100);

  @Test
  public void evaluate_sameAllocationTwice_dispatchesOnce() {
    // Act
    EvaluationResult first = evaluator.evaluate(FIRST);
    EvaluationResult second = evaluator.evaluate(Allocation.of(0, ImmutableSet.of(2, 1, 0)));

    // Assert
    assertThat(second).isEqualTo(first);
    assertThat(delegate.calls()).isEqualTo(1);
    assertThat(evaluator.hitCount()).isEqualTo(1);
  }

  @Test
  public void evaluate_differentMasterySelection_isNotACacheHit() {
    Allocation withMastery = Allocation.of(0, ImmutableSet.of(0, 1), ImmutableMap.of(1, 10));

    evaluator.evaluate(withMastery);
    evaluator.evaluate(withMastery.withSelection(1, 11));

    assertThat(delegate.calls()).isEqualTo(2);
  }

  @Test
  public void evaluateAll_duplicates_dispatchedOnceEach() {
    // Act
    ImmutableList<EvaluationResult> results =
        evaluator.evaluateAll(ImmutableList.of(FIRST, SECOND, FIRST, SECOND, FIRST));

    // Assert
    assertThat(results).hasSize(5);
    assertThat(results.get(4)).isEqualTo(results.get(0));
    assertThat(delegate.calls()).isEqualTo(2);
    assertThat(evaluator.dispatchCount()).isEqualTo(2);
    assertThat(evaluator.size()).isEqualTo(2);
  }

  @Test
  public void evaluate_failure_isNotCached() {
    delegate.failWhen(allocation -> true);

    evaluator.evaluate(FIRST);
    evaluator.evaluate(FIRST);

    assertThat(delegate.calls()).isEqualTo(2);
    assertThat(evaluator.size()).isEqualTo(0);
  }

  @Test
  public void evaluate_concurrentCallsForTheSameAllocation_dispatchOnce() throws Exception {
    // Arrange
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch proceed = new CountDownLatch(1);
    when(slowDelegate.defaultTimeout()).thenReturn(Duration.ofSeconds(1));
    when(slowDelegate.evaluate(eq(FIRST), any()))
        .thenAnswer(
            invocation -> {
              entered.countDown();
              proceed.await(5, TimeUnit.SECONDS);
              return delegate.evaluate(FIRST);
            });
    CachingEvaluator caching = CachingEvaluator.create(slowDelegate, 100);
    ExecutorService callers = Executors.newFixedThreadPool(2);
    try {
      // Act
      Future<EvaluationResult> first = callers.submit(() -> caching.evaluate(FIRST));
      entered.await(5, TimeUnit.SECONDS);
      Future<EvaluationResult> second = callers.submit(() -> caching.evaluate(FIRST));
      Thread.sleep(100);
      proceed.countDown();

      // Assert
      assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo(first.get(5, TimeUnit.SECONDS));
      verify(slowDelegate, times(1)).evaluate(eq(FIRST), any());
      assertThat(caching.dispatchCount()).isEqualTo(1);
      assertThat(caching.hitCount()).isEqualTo(1);
    } finally {
      callers.shutdownNow();
    }
  }

  @Test
  public void evaluate_unavailableDelegate_propagatesUnwrapped() {
    delegate.unavailableAfter(0);

    assertThrows(EvaluatorUnavailableException.class, () -> evaluator.evaluate(FIRST));
    assertThat(evaluator.size()).isEqualTo(0);
  }
}

package dev.sitepack.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.google.common.util.concurrent.RateLimiter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class RateLimitGateTest {

  @Test
  void budgetIsNeverOverdrawn() {
    RateLimitGate gate = RateLimitGate.create(2.0, 2);

    assertThat(gate.tryAcquire()).isTrue();
    assertThat(gate.tryAcquire()).isTrue();
    assertThat(gate.tryAcquire()).isFalse();
    assertThat(gate.remaining()).isZero();
  }

  @Test
  void zeroBudgetRefusesImmediately() {
    RateLimitGate gate = RateLimitGate.create(2.0, 0);

    assertThat(gate.tryAcquire()).isFalse();
  }

  @Test
  void concurrentCallersShareOneBudget() throws Exception {
    RateLimitGate gate = RateLimitGate.create(2.0, 3);
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Callable<Boolean>> calls = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        calls.add(gate::tryAcquire);
      }
      long granted = 0;
      for (Future<Boolean> f : pool.invokeAll(calls)) {
        if (f.get()) {
          granted++;
        }
      }
      assertThat(granted).isEqualTo(3);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void paceTakesAPermitButLeavesTheBudgetAlone() {
    RateLimiter limiter = mock(RateLimiter.class);
    RateLimitGate gate = new RateLimitGate(limiter, 2);

    gate.pace();
    gate.pace();

    verify(limiter, times(2)).acquire();
    assertThat(gate.remaining()).isEqualTo(2);
  }

  @Test
  void pacesRequestsAtConfiguredRate() {
    RateLimitGate gate = RateLimitGate.create(2.0, 3);

    long start = System.nanoTime();
    gate.tryAcquire();
    gate.tryAcquire();
    gate.tryAcquire();
    long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

    // first permit is immediate, the next two wait ~500 ms each
    assertThat(elapsedMillis).isGreaterThanOrEqualTo(800);
  }
}

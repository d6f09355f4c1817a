package dev.sitepack.crawl;

import com.google.common.util.concurrent.RateLimiter;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Token gate shared by every request of one crawl: a page budget held in a single atomic
 * counter, and request pacing through a Guava {@link RateLimiter}. Sitemap requests are paced
 * but do not count against the page budget.
 */
public final class RateLimitGate {

  private final RateLimiter rateLimiter;
  private final AtomicInteger remaining;

  RateLimitGate(RateLimiter rateLimiter, int budget) {
    this.rateLimiter = rateLimiter;
    this.remaining = new AtomicInteger(Math.max(budget, 0));
  }

  public static RateLimitGate create(double requestsPerSecond, int budget) {
    return new RateLimitGate(RateLimiter.create(requestsPerSecond), budget);
  }

  /**
   * Take one unit of budget and wait for a rate permit.
   *
   * @return false once the budget is spent; no permit is consumed in that case
   */
  public boolean tryAcquire() {
    int left = remaining.getAndUpdate(n -> n > 0 ? n - 1 : 0);
    if (left <= 0) {
      return false;
    }
    rateLimiter.acquire();
    return true;
  }

  /** Wait for a rate permit without touching the page budget. Used for sitemap requests. */
  public void pace() {
    rateLimiter.acquire();
  }

  public int remaining() {
    return remaining.get();
  }
}

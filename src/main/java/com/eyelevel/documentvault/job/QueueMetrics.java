package com.eyelevel.documentvault.job;

/**
 * Point-in-time counters of a {@link JobQueue}, captured atomically.
 *
 * @param waiting               jobs queued and ready to run.
 * @param active                occupied worker slots, including timed-out attempts whose handler has not
 *                              returned yet; never exceeds {@code concurrency}.
 * @param delayed               failed jobs waiting out their retry backoff.
 * @param completed             jobs that finished successfully since startup.
 * @param failed                jobs that exhausted their attempts and were dead-lettered since startup.
 * @param retries               retry attempts scheduled since startup.
 * @param concurrency           configured worker count.
 * @param averageDurationMillis mean execution time over the most recent attempts.
 * @param accepting             whether the queue currently accepts new jobs.
 */
public record QueueMetrics(int waiting, int active, int delayed, long completed, long failed, long retries,
                           int concurrency, double averageDurationMillis, boolean accepting) {
}

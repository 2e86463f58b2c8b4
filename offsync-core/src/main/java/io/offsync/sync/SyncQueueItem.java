package io.offsync.sync;

import io.offsync.util.JsonCodec;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one queued write.
 *
 * <p>{@code attempts} counts executions started, so it is {@code 0} until the first pass
 * picks the item up. {@code nextAttemptAt} is only set while {@link SyncStatus#RETRYING};
 * {@code lastError} only while {@link SyncStatus#RETRYING} or {@link SyncStatus#FAILED}.
 *
 * @param id             unique, time-ordered identifier
 * @param operationType  caller-chosen label, also used to look up a handler after a restart
 * @param payloadJson    payload captured as JSON at enqueue time
 * @param priority       processing priority
 * @param status         lifecycle status
 * @param attempts       executions started so far
 * @param enqueuedAt     when the item was added
 * @param lastAttemptAt  when the most recent execution started, or {@code null}
 * @param nextAttemptAt  earliest time of the next execution, or {@code null}
 * @param lastError      description of the most recent failure, or {@code null}
 */
public record SyncQueueItem(
    String id,
    String operationType,
    String payloadJson,
    SyncPriority priority,
    SyncStatus status,
    int attempts,
    Instant enqueuedAt,
    Instant lastAttemptAt,
    Instant nextAttemptAt,
    String lastError
) {
  public SyncQueueItem {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(operationType, "operationType");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    if (priority == null) {
      priority = SyncPriority.NORMAL;
    }
    if (payloadJson == null) {
      payloadJson = "null";
    }
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0");
    }
  }

  static SyncQueueItem pending(String id, String operationType, String payloadJson,
      SyncPriority priority, Instant enqueuedAt) {
    return new SyncQueueItem(id, operationType, payloadJson, priority, SyncStatus.PENDING,
        0, enqueuedAt, null, null, null);
  }

  /**
   * Decodes the payload with {@link JsonCodec#getDefault()}. Queues built with a custom codec
   * should decode through {@link SyncQueue#payload(SyncQueueItem, Class)} instead.
   *
   * @param type payload type
   * @param <T> payload type
   * @return the decoded payload
   */
  public <T> T payload(Class<T> type) {
    return payload(type, JsonCodec.getDefault());
  }

  public <T> T payload(Class<T> type, JsonCodec codec) {
    return Objects.requireNonNull(codec, "codec").fromJson(payloadJson, type);
  }

  SyncQueueItem syncing(Instant now) {
    return new SyncQueueItem(id, operationType, payloadJson, priority, SyncStatus.SYNCING,
        attempts + 1, enqueuedAt, now, null, null);
  }

  SyncQueueItem retrying(Instant nextAt, String error) {
    return new SyncQueueItem(id, operationType, payloadJson, priority, SyncStatus.RETRYING,
        attempts, enqueuedAt, lastAttemptAt, nextAt, error);
  }

  SyncQueueItem failed(String error) {
    return new SyncQueueItem(id, operationType, payloadJson, priority, SyncStatus.FAILED,
        attempts, enqueuedAt, lastAttemptAt, null, error);
  }

  SyncQueueItem completed() {
    return new SyncQueueItem(id, operationType, payloadJson, priority, SyncStatus.COMPLETED,
        attempts, enqueuedAt, lastAttemptAt, null, null);
  }

  /** Back to PENDING after an execution was cut short by a restart; attempts are kept. */
  SyncQueueItem interrupted() {
    return new SyncQueueItem(id, operationType, payloadJson, priority, SyncStatus.PENDING,
        attempts, enqueuedAt, lastAttemptAt, null, null);
  }

  /** Back to PENDING with a fresh retry budget. */
  SyncQueueItem reset() {
    return new SyncQueueItem(id, operationType, payloadJson, priority, SyncStatus.PENDING,
        0, enqueuedAt, lastAttemptAt, null, null);
  }
}

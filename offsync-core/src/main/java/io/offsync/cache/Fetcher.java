package io.offsync.cache;

import java.util.concurrent.CompletionStage;

/**
 * Loads the value for one cache key, typically with a remote read.
 *
 * @param <V> value type
 */
@FunctionalInterface
public interface Fetcher<V> {

    CompletionStage<V> fetch() throws Exception;
}

package io.offsync.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for one sync operation type.
 *
 * <p>The annotated bean must implement {@link io.offsync.sync.SyncOperation}. Handlers are
 * what lets items restored after a restart run again, since the operation passed at enqueue
 * time is not persisted.
 *
 * <pre>{@code
 * @Component
 * @SyncHandler("updateProfile")
 * public class UpdateProfileHandler implements SyncOperation {
 *   public CompletionStage<?> execute(SyncQueueItem item) {
 *     return api.updateProfile(item.payload(Profile.class));
 *   }
 * }
 * }</pre>
 *
 * @see SyncHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface SyncHandler {

    /**
     * Operation type this bean handles.
     */
    String value();
}

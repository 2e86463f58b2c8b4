package io.offsync.spring.boot;

import io.offsync.sync.DefaultSyncHandlerRegistry;
import io.offsync.sync.SyncOperation;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link SyncHandler} and registers them in the
 * {@link DefaultSyncHandlerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * which is before {@link OffsyncLifecycle} starts the queue.
 */
public class SyncHandlerRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(SyncHandlerRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final DefaultSyncHandlerRegistry registry;

    public SyncHandlerRegistrar(ListableBeanFactory beanFactory, DefaultSyncHandlerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(SyncHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof SyncOperation operation)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @SyncHandler must implement SyncOperation, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation on the target class
            SyncHandler annotation = AnnotationUtils.findAnnotation(bean.getClass(), SyncHandler.class);
            if (annotation == null) {
                annotation = beanFactory.findAnnotationOnBean(beanName, SyncHandler.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @SyncHandler annotation on " + bean.getClass().getName());
            }
            String operationType = annotation.value();
            if (operationType.isEmpty()) {
                throw new BeanCreationException(beanName, "@SyncHandler must name an operation type");
            }

            try {
                registry.register(operationType, operation);
            } catch (IllegalStateException e) {
                throw new BeanCreationException(beanName, e.getMessage(), e);
            }
            logger.fine(() -> "Registered sync handler " + beanName + " for " + operationType);
        }
    }
}

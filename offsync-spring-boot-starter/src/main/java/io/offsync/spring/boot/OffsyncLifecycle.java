package io.offsync.spring.boot;

import io.offsync.Offsync;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the {@link Offsync} composite once the context is refreshed, so the first sync
 * pass sees every {@link SyncHandler} bean. Stopping closes it; the bean's destroy method
 * then finds it already closed.
 */
public class OffsyncLifecycle implements SmartLifecycle {

  private final Offsync offsync;
  private volatile boolean running;

  public OffsyncLifecycle(Offsync offsync) {
    this.offsync = offsync;
  }

  @Override
  public void start() {
    offsync.start();
    running = true;
  }

  @Override
  public void stop() {
    running = false;
    offsync.close();
  }

  @Override
  public boolean isRunning() {
    return running;
  }
}

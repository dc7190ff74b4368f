/*
 * どこで: プロビジョニングのサービス層
 * 何を: エンジンの処理をすべて専用のループスレッド 1 本で実行する
 * なぜ: どのスレッドから投入された処理も直列化し、呼び出し側は結果を待つため
 */
package com.example.ip_provisioner.service;

import com.example.ip_provisioner.model.ExecutionMode;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

public class EventLoopExecutionDriver implements ExecutionDriver {

  private static final Logger logger = LoggerFactory.getLogger(EventLoopExecutionDriver.class);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  private final ExecutorService loop;
  private volatile Thread loopThread;

  public EventLoopExecutionDriver(String threadName) {
    final ThreadFactory delegate =
        new ThreadFactoryBuilder().setNameFormat(threadName).setDaemon(true).build();
    this.loop =
        Executors.newSingleThreadExecutor(
            runnable -> {
              final Thread thread = delegate.newThread(runnable);
              loopThread = thread;
              return thread;
            });
  }

  @Override
  public ExecutionMode mode() {
    return ExecutionMode.EVENT_LOOP;
  }

  @Override
  public <T> T run(Supplier<T> task) {
    // 入れ子の処理は自スレッド待ちでデッドロックするため、その場で実行する
    if (Thread.currentThread() == loopThread) {
      return task.get();
    }
    final Map<String, String> context = MDC.getCopyOfContextMap();
    final Future<T> future =
        loop.submit(
            () -> {
              if (context != null) {
                MDC.setContextMap(context);
              }
              try {
                return task.get();
              } finally {
                MDC.clear();
              }
            });
    try {
      return future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new ProvisioningFailedException("interrupted while waiting for the event loop", ex);
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new ProvisioningFailedException("event loop task failed", cause);
    }
  }

  @Override
  public void close() {
    loop.shutdown();
    try {
      if (!loop.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        logger.warn("event loop did not stop within {}s", SHUTDOWN_TIMEOUT_SECONDS);
        loop.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      loop.shutdownNow();
    }
  }
}

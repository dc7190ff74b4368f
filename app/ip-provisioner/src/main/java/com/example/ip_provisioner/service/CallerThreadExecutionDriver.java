package com.example.ip_provisioner.service;

import com.example.ip_provisioner.model.ExecutionMode;
import java.util.function.Supplier;

public class CallerThreadExecutionDriver implements ExecutionDriver {

  @Override
  public ExecutionMode mode() {
    return ExecutionMode.BLOCKING;
  }

  @Override
  public <T> T run(Supplier<T> task) {
    return task.get();
  }
}

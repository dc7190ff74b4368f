package com.example.ip_provisioner.service;

import com.example.ip_provisioner.model.ExecutionMode;
import java.util.function.Supplier;

/**
 * 役割: エンジンの処理をどのスレッドで実行するかを決める。
 * 動作: 呼び出し側は {@code task} の完了まで待ち、結果または例外をそのまま受け取る。
 */
public interface ExecutionDriver extends AutoCloseable {

  ExecutionMode mode();

  <T> T run(Supplier<T> task);

  @Override
  default void close() {}
}

package com.example.ip_provisioner.config;

import com.example.ip_provisioner.service.CallerThreadExecutionDriver;
import com.example.ip_provisioner.service.EventLoopExecutionDriver;
import com.example.ip_provisioner.service.ExecutionDriver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class ExecutionConfig {

  @Bean
  ExecutionDriver executionDriver(ProvisionerProperties properties) {
    return switch (properties.executionMode()) {
      case BLOCKING -> new CallerThreadExecutionDriver();
      case EVENT_LOOP -> new EventLoopExecutionDriver("provisioner-loop");
    };
  }
}

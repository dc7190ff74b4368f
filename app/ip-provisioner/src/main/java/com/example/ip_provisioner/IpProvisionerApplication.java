package com.example.ip_provisioner;

import com.example.common.config.TimeConfig;
import com.example.ip_provisioner.cli.CliOptions;
import com.example.ip_provisioner.cli.ExitCode;
import com.example.ip_provisioner.cli.ProvisionCommand;
import com.example.ip_provisioner.cli.ProvisionLauncher;
import com.example.ip_provisioner.service.ProvisioningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Import;
import picocli.CommandLine;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class IpProvisionerApplication {

  private static final Logger logger = LoggerFactory.getLogger(IpProvisionerApplication.class);

  public static void main(String[] args) {
    System.exit(execute(args));
  }

  static int execute(String... args) {
    final CommandLine commandLine = new CommandLine(new ProvisionCommand(IpProvisionerApplication::run));
    commandLine.setCaseInsensitiveEnumValuesAllowed(true);
    commandLine.setExecutionExceptionHandler(
        (ex, cmd, parseResult) -> {
          final ExitCode exitCode = ExitCode.of(ex);
          if (exitCode == ExitCode.UNEXPECTED) {
            logger.error("ip-provisioner failed to start", ex);
          } else {
            logger.error("ip-provisioner failed to start: {}", failureMessage(ex));
          }
          return exitCode.code();
        });
    return commandLine.execute(args);
  }

  static int run(CliOptions options) {
    final ApplicationContextInitializer<ConfigurableApplicationContext> registerOptions =
        context -> context.getBeanFactory().registerSingleton("cliOptions", options);
    final SpringApplicationBuilder builder =
        new SpringApplicationBuilder(IpProvisionerApplication.class)
            .web(WebApplicationType.NONE)
            .initializers(registerOptions);
    if (options.debug()) {
      builder.properties("logging.level.com.example.ip_provisioner=DEBUG");
    }
    try (ConfigurableApplicationContext context = builder.run()) {
      return context.getBean(ProvisionLauncher.class).launch(options).code();
    }
  }

  private static String failureMessage(Throwable ex) {
    for (Throwable current = ex; current != null; current = current.getCause()) {
      if (current instanceof ProvisioningException) {
        return current.getMessage();
      }
    }
    return ex.getMessage();
  }
}

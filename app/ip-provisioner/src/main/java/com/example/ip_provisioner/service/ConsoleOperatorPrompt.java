package com.example.ip_provisioner.service;

import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class ConsoleOperatorPrompt implements OperatorPrompt {

  private static final Set<String> YES = Set.of("y", "yes");

  private final BufferedReader input;
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "the prompt writes to the process console stream it is given")
  private final PrintStream output;

  public ConsoleOperatorPrompt() {
    this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
  }

  @VisibleForTesting
  ConsoleOperatorPrompt(BufferedReader input, PrintStream output) {
    this.input = input;
    this.output = output;
  }

  /** 動作: 明示的な yes 以外は入力終端も含めてすべて拒否として扱う。 */
  @Override
  public boolean confirm(String question) {
    output.print(question + " [y/N]: ");
    output.flush();
    try {
      final String answer = input.readLine();
      return answer != null && YES.contains(answer.trim().toLowerCase(Locale.ROOT));
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to read operator answer", ex);
    }
  }
}

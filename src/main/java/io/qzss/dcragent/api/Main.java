package io.qzss.dcragent.api;

/**
 * JVM entry point of the QZSS DC Report agent.
 *
 * @since 0.1.0
 */
public final class Main {
  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = AgentCli.run(args);
    System.exit(exit.code());
  }
}

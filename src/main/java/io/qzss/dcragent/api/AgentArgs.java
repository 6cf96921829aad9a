package io.qzss.dcragent.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Agent command line split into the agent's own switches and {@code key=value} configuration overrides.
 *
 * <p>Switches: {@code --help} ({@code -h}, {@code help}), {@code --verbose} ({@code -v}), {@code --dry-run},
 * {@code --no-report} ({@code -n}), {@code --no-load-cache} and {@code --no-dump-cache}. The short options
 * {@code -c PATH}, {@code -r PATH} and {@code -l LEVEL} take their value from the next argument and become
 * {@code config=}, {@code report=} and {@code logLevel=} pairs. Every other argument must be {@code key=value}.</p>
 *
 * @param help usage requested
 * @param verbose DEBUG logging requested
 * @param dryRun validate and print the plan only
 * @param noReport disable the report file
 * @param noLoadCache start with an empty duplicate cache
 * @param noDumpCache skip the cache dump at termination
 * @param keyValueArgs remaining {@code key=value} arguments in order
 * @since 0.1.0
 */
record AgentArgs(
    boolean help,
    boolean verbose,
    boolean dryRun,
    boolean noReport,
    boolean noLoadCache,
    boolean noDumpCache,
    List<String> keyValueArgs) {

  private static final Map<String, String> VALUE_OPTIONS = Map.of("-c", "config", "-r", "report", "-l", "logLevel");

  AgentArgs {
    keyValueArgs = List.copyOf(keyValueArgs);
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments; may be {@code null}
   * @return parsed arguments
   * @throws IllegalArgumentException on an unknown switch or a short option without its value
   */
  static AgentArgs parse(String[] args) {
    boolean help = false;
    boolean verbose = false;
    boolean dryRun = false;
    boolean noReport = false;
    boolean noLoadCache = false;
    boolean noDumpCache = false;
    List<String> kv = new ArrayList<>();
    if (args == null) {
      return new AgentArgs(false, false, false, false, false, false, kv);
    }
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (arg.isEmpty()) {
        continue;
      }
      String key = VALUE_OPTIONS.get(arg);
      if (key != null) {
        if (i + 1 >= args.length || args[i + 1] == null || args[i + 1].isBlank()) {
          throw new IllegalArgumentException(arg + " requires a value");
        }
        kv.add(key + "=" + args[++i].trim());
        continue;
      }
      if (arg.contains("=")) {
        kv.add(arg);
        continue;
      }
      switch (arg.toLowerCase(Locale.ROOT)) {
        case "--help", "-h", "help" -> help = true;
        case "--verbose", "-v" -> verbose = true;
        case "--dry-run" -> dryRun = true;
        case "--no-report", "-n" -> noReport = true;
        case "--no-load-cache" -> noLoadCache = true;
        case "--no-dump-cache" -> noDumpCache = true;
        default -> {
          if (arg.startsWith("-")) {
            throw new IllegalArgumentException("unknown option: " + arg);
          }
          kv.add(arg);
        }
      }
    }
    return new AgentArgs(help, verbose, dryRun, noReport, noLoadCache, noDumpCache, kv);
  }
}

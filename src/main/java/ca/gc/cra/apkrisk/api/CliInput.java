package ca.gc.cra.apkrisk.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed representation of CLI arguments split into flags and {@code key=value} tokens.
 *
 * @param keyValueArgs tokens left for {@link CliArgsParser}, in command-line order
 * @param flags normalized lower-case flags other than help and verbose
 * @param help whether a help flag was supplied
 * @param verbose whether DEBUG logging was requested
 */
record CliInput(List<String> keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments into flag and key/value partitions. Blank and {@code null} tokens are dropped.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          help = true;
        } else if (VERBOSE_FLAGS.contains(lower)) {
          verbose = true;
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, flags, help, verbose);
  }

  /**
   * Returns the tokens after the first one, used when the first token names a subcommand.
   *
   * @return remaining key/value tokens
   */
  CliInput dropFirst() {
    if (keyValueArgs.isEmpty()) {
      return this;
    }
    return new CliInput(keyValueArgs.subList(1, keyValueArgs.size()), flags, help, verbose);
  }

  /**
   * Fails when a dash-prefixed token was neither a help nor a verbose switch.
   *
   * @throws IllegalArgumentException naming the first unrecognised flag
   */
  void rejectUnknownFlags() {
    if (!flags.isEmpty()) {
      throw new IllegalArgumentException("unknown option: " + flags.iterator().next());
    }
  }
}

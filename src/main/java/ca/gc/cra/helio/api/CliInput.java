package ca.gc.cra.helio.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * CLI arguments split into {@code --flags} and positional or {@code key=value} tokens.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> remainder;
  private final Set<String> flags;

  private CliInput(List<String> remainder, Set<String> flags) {
    this.remainder = remainder;
    this.flags = flags;
  }

  /**
   * Parses raw arguments. Help and verbose aliases are normalized to {@code --help} and {@code --verbose}.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> rest = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_FLAGS.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          rest.add(arg);
        }
      }
    }
    return new CliInput(List.copyOf(rest), Set.copyOf(flags));
  }

  /**
   * Returns the non-flag arguments in their original order.
   *
   * @return copy of the remaining arguments
   */
  public String[] keyValueArgs() {
    return remainder.toArray(String[]::new);
  }

  /**
   * Returns the non-flag arguments after the first one (the subcommand).
   *
   * @return arguments for the subcommand
   */
  public String[] afterCommand() {
    String[] all = keyValueArgs();
    return all.length == 0 ? all : Arrays.copyOfRange(all, 1, all.length);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}

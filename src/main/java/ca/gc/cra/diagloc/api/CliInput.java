package ca.gc.cra.diagloc.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line arguments split into {@code key=value} pairs and normalized flags.
 *
 * <p>Short and legacy spellings are folded onto one canonical flag, so {@code -h}, {@code help} and
 * {@code --help} are indistinguishable to commands.</p>
 */
public final class CliInput {
  static final String HELP = "--help";
  static final String VERBOSE = "--verbose";
  static final String DEBUG_NAMES = "--debug-names";

  private static final Map<String, String> ALIASES = Map.of(
      "-h", HELP,
      "help", HELP,
      "-v", VERBOSE,
      "-n", DEBUG_NAMES);

  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, Set<String> flags) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments. Blank and {@code null} entries are ignored.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String flag = canonicalFlag(arg);
        if (flag != null) {
          flags.add(flag);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, flags);
  }

  private static String canonicalFlag(String arg) {
    String lower = arg.toLowerCase(Locale.ROOT);
    String alias = ALIASES.get(lower);
    if (alias != null) {
      return alias;
    }
    return lower.startsWith("-") && !lower.contains("=") ? lower : null;
  }

  /** @return copy of arguments intended for {@code key=value} parsing, in command-line order */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  /** @return {@code true} if help output was requested */
  public boolean help() {
    return flags.contains(HELP);
  }

  /** @return {@code true} when {@code --verbose} (or {@code -v}) was present */
  public boolean verbose() {
    return flags.contains(VERBOSE);
  }

  /**
   * Checks whether a flag such as {@code --debug-names} was provided.
   *
   * @param flag canonical flag to query (case-insensitive)
   * @return {@code true} if the flag or one of its aliases was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}

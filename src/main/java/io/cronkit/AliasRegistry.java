package io.cronkit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps alias names such as {@code @daily} to five-field CRON expressions.
 *
 * <p>Names are matched case insensitively and stored lowercase. Every registry starts with the
 * built-in aliases, which cannot be removed:
 *
 * <pre>
 * &#64;yearly, &#64;annually   0 0 1 1 *
 * &#64;monthly               0 0 1 * *
 * &#64;weekly                0 0 * * 0
 * &#64;daily, &#64;midnight    0 0 * * *
 * &#64;hourly                0 * * * *
 * </pre>
 *
 * <p>{@link #create()} returns a private registry. {@link #shared()} returns the process-wide
 * instance used by {@link Expression#parse(String)}.
 */
public final class AliasRegistry {
  private static final Logger logger = LoggerFactory.getLogger(AliasRegistry.class);

  private static final Pattern NAME = Pattern.compile("@[a-z0-9_]+");

  private static final Map<String, String> BUILT_INS = builtIns();

  private static final AliasRegistry SHARED = new AliasRegistry();

  private final Map<String, String> aliases = new LinkedHashMap<>(BUILT_INS);

  private AliasRegistry() {}

  /**
   * Creates a registry holding the built-in aliases only.
   *
   * @return a new registry
   */
  public static AliasRegistry create() {
    return new AliasRegistry();
  }

  /**
   * Returns the process-wide registry.
   *
   * @return the shared registry
   */
  public static AliasRegistry shared() {
    return SHARED;
  }

  /**
   * Registers an alias.
   *
   * @param name the alias name, {@code @} followed by letters, digits or underscores
   * @param expression the expression the alias stands for, stored in its five-field form
   * @throws CronException if the name is malformed or taken, or the expression is invalid
   */
  public void register(String name, String expression) throws CronException {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(expression, "expression");

    String key = name.toLowerCase(Locale.ROOT);
    if (!NAME.matcher(key).matches()) {
      throw CronException.syntax("The alias `" + name + "` is invalid");
    }

    Expression parsed = Expression.parse(expression, this);

    synchronized (aliases) {
      if (aliases.containsKey(key)) {
        throw CronException.syntax("The alias `" + name + "` is already registered");
      }
      aliases.put(key, parsed.toString());
    }
    logger.debug("Registered alias {} for `{}`", key, parsed);
  }

  /**
   * Removes a user-registered alias.
   *
   * @param name the alias name, case insensitive
   * @return true if the alias was registered and is now removed
   * @throws CronException if the alias is a built-in one
   */
  public boolean unregister(String name) throws CronException {
    String key = name.toLowerCase(Locale.ROOT);
    if (BUILT_INS.containsKey(key)) {
      throw CronException.syntax("The alias `" + name + "` is built-in and cannot be removed");
    }

    String removed;
    synchronized (aliases) {
      removed = aliases.remove(key);
    }
    if (removed == null) {
      return false;
    }
    logger.debug("Unregistered alias {}", key);
    return true;
  }

  /**
   * Tells whether an alias is registered.
   *
   * @param name the alias name, case insensitive
   * @return true if the alias is known
   */
  public boolean supports(String name) {
    return resolve(name).isPresent();
  }

  /**
   * Resolves an alias to its expression.
   *
   * @param name the alias name, case insensitive
   * @return the five-field expression, or empty if the alias is unknown
   */
  public Optional<String> resolve(String name) {
    if (name == null || !name.startsWith("@")) {
      return Optional.empty();
    }
    synchronized (aliases) {
      return Optional.ofNullable(aliases.get(name.toLowerCase(Locale.ROOT)));
    }
  }

  /**
   * Returns a snapshot of the registered aliases, built-ins first.
   *
   * @return the aliases keyed by lowercase name
   */
  public Map<String, String> aliases() {
    synchronized (aliases) {
      return Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }
  }

  /**
   * Returns the names of the aliases that cannot be removed.
   *
   * @return the built-in alias names
   */
  public static Set<String> builtInNames() {
    return BUILT_INS.keySet();
  }

  private static Map<String, String> builtIns() {
    Map<String, String> m = new LinkedHashMap<>();
    m.put("@yearly", "0 0 1 1 *");
    m.put("@annually", "0 0 1 1 *");
    m.put("@monthly", "0 0 1 * *");
    m.put("@weekly", "0 0 * * 0");
    m.put("@daily", "0 0 * * *");
    m.put("@midnight", "0 0 * * *");
    m.put("@hourly", "0 * * * *");
    return Collections.unmodifiableMap(m);
  }
}

package sbtext;

import java.util.HashMap;
import java.util.Map;

/**
 * Hands out synthetic IDs such as {@code block_7} or {@code gvar_2}. Each prefix counts up from 1
 * independently and no ID is ever handed out twice. One arena lives for exactly one compile.
 */
public class IdArena {
  private final Map<String, Integer> counters = new HashMap<>();

  public String next(String prefix) {
    int n = counters.merge(prefix, 1, Integer::sum);
    return prefix + "_" + n;
  }

  public String block() {
    return next("block");
  }
}

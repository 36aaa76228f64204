package dev.recipeflow.engine;

import dev.recipeflow.model.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A recipe regrouped by destination: every path is filed under the join point
 * it ends at, or under {@link Optional#empty()} when it ends at {@code <>}.
 * Also carries the problems found while building the map.
 *
 * <p>For the recipe
 * <pre>
 * sample {
 *   one -&gt; foo -&gt; $a;
 *   two -&gt; bar -&gt; $a;
 *   $a -&gt; baz -&gt; &lt;&gt;;
 *   three -&gt; quux -&gt; &lt;&gt;;
 * }
 * </pre>
 * the map is
 * <pre>
 * $a:    [one &lt;- foo, two &lt;- bar]
 * &lt;&gt;:    [$a &lt;- baz, three &lt;- quux]
 * </pre>
 *
 * <p>An analysis is single use: {@link TreeMaterializer} drains the map, and
 * any read afterwards fails.
 */
public final class Analysis {

    private final Map<Optional<Symbol>, List<Path>> map = new LinkedHashMap<>();
    private final List<Problem> problems = new ArrayList<>();
    private boolean drained;

    Analysis() {}

    void add(Optional<Symbol> key, Path path) {
        checkNotDrained();
        map.computeIfAbsent(key, k -> new ArrayList<>()).add(path);
    }

    void report(Problem problem) {
        problems.add(problem);
    }

    boolean contains(Optional<Symbol> key) {
        checkNotDrained();
        return map.containsKey(key);
    }

    /**
     * Remove and return the paths leading to {@code key}, or {@code null} if there are none.
     */
    List<Path> take(Optional<Symbol> key) {
        checkNotDrained();
        return map.remove(key);
    }

    void markDrained() {
        drained = true;
    }

    /**
     * Destinations in first-seen order.
     */
    public Set<Optional<Symbol>> keys() {
        checkNotDrained();
        return Collections.unmodifiableSet(map.keySet());
    }

    /**
     * Paths leading to {@code key} in source order; empty if nothing leads there.
     */
    public List<Path> paths(Optional<Symbol> key) {
        checkNotDrained();
        return Collections.unmodifiableList(map.getOrDefault(key, List.of()));
    }

    public List<Problem> problems() {
        return Collections.unmodifiableList(problems);
    }

    public boolean isValid() {
        return problems.isEmpty();
    }

    public boolean isDrained() {
        return drained;
    }

    private void checkNotDrained() {
        if (drained) {
            throw new IllegalStateException("Analysis has already been turned into a tree");
        }
    }
}

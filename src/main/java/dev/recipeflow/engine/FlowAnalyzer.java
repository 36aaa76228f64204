package dev.recipeflow.engine;

import dev.recipeflow.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Splits a recipe's rules into per-destination paths and checks the graph
 * invariants the tree builder depends on.
 */
public final class FlowAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FlowAnalyzer.class);

    private FlowAnalyzer() {}

    /**
     * Analyze a recipe. Never fails: problems are collected on the returned
     * {@link Analysis}, and an analysis with problems cannot become a tree.
     */
    public static Analysis analyze(RecipeStore store, Recipe recipe) {
        var analysis = new Analysis();

        for (RuleRef ref : recipe.rules()) {
            splitRule(store.rule(ref), analysis);
        }

        if (!analysis.contains(Optional.empty())) {
            analysis.report(new Problem.NoTerminal());
        } else {
            walkJoinPoints(analysis);
        }

        log.debug("Analyzed recipe '{}': {} destinations, {} problems",
            store.text(recipe.name()), analysis.keys().size(), analysis.problems().size());
        return analysis;
    }

    private static void splitRule(Rule rule, Analysis analysis) {
        Input start = rule.input();
        var pending = new ArrayList<Action.Step>();

        for (Action action : rule.actions()) {
            if (action instanceof Action.Step step) {
                pending.add(step);
            } else if (action instanceof Action.Join join) {
                Symbol point = join.point().symbol();
                analysis.add(Optional.of(point), new Path(start, pending));
                start = new Input.Join(join.point());
                pending = new ArrayList<>();
            } else {
                // anything after <> is unreachable
                analysis.add(Optional.empty(), new Path(start, pending));
                return;
            }
        }

        if (!pending.isEmpty()) {
            analysis.report(new Problem.DanglingChain(pending, start));
        }
    }

    /**
     * Depth-first walk over the join points reachable from {@code <>}, using one
     * shared visited set. Stops at the first join point seen twice and reports
     * it as a cycle; join points not reachable from {@code <>} are never visited.
     */
    private static void walkJoinPoints(Analysis analysis) {
        Deque<Symbol> frontier = new ArrayDeque<>();
        Set<Symbol> seen = new HashSet<>();

        pushJoinStarts(analysis.paths(Optional.empty()), frontier);

        while (!frontier.isEmpty()) {
            Symbol point = frontier.pop();
            if (!seen.add(point)) {
                analysis.report(new Problem.Cycle(point));
                break;
            }
            if (!analysis.contains(Optional.of(point))) {
                analysis.report(new Problem.UnresolvedJoin(point));
                continue;
            }
            pushJoinStarts(analysis.paths(Optional.of(point)), frontier);
        }
    }

    private static void pushJoinStarts(List<Path> paths, Deque<Symbol> frontier) {
        for (Path path : paths) {
            if (path.start() instanceof Input.Join join) {
                frontier.push(join.point().symbol());
            }
        }
    }
}

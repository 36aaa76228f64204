package dev.recipeflow.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.recipeflow.engine.Analysis;
import dev.recipeflow.engine.BackwardTree;
import dev.recipeflow.engine.Path;
import dev.recipeflow.model.Action;
import dev.recipeflow.model.IngredientRef;
import dev.recipeflow.model.RecipeStore;
import dev.recipeflow.model.Symbol;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * JSON views of the intermediate pipeline stages, with every symbol resolved to text.
 */
public final class DebugJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final String SINK_KEY = "<>";

    private final RecipeStore store;
    private final RecipePrinter printer;
    private final ProblemFormatter problems;

    public DebugJson(RecipeStore store) {
        this.store = store;
        this.printer = new RecipePrinter(store);
        this.problems = new ProblemFormatter(store);
    }

    /**
     * Paths grouped by destination, followed by the problem list. Must be
     * called before the analysis is turned into a tree.
     */
    public ObjectNode analysis(Analysis analysis) {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode map = root.putObject("map");
        for (Optional<Symbol> key : analysis.keys()) {
            ArrayNode paths = map.putArray(key.map(store::text).orElse(SINK_KEY));
            for (Path path : analysis.paths(key)) {
                ObjectNode node = paths.addObject();
                node.put("start", printer.input(path.start()));
                steps(node.putArray("actions"), path.actions());
            }
        }
        ArrayNode list = root.putArray("problems");
        problems.describeAll(analysis.problems()).forEach(list::add);
        return root;
    }

    /**
     * The tree as a flat node list in breadth-first order, so the JSON
     * nesting stays constant however deep the join chain goes. Node 0 is the
     * root; {@code children} holds node ids.
     */
    public ObjectNode tree(BackwardTree tree) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("size", tree.size());
        root.put("maxDepth", tree.maxDepth());
        ArrayNode nodes = root.putArray("nodes");

        Deque<BackwardTree> queue = new ArrayDeque<>();
        queue.add(tree);
        int nextId = 1;
        while (!queue.isEmpty()) {
            BackwardTree current = queue.poll();
            ObjectNode node = nodes.addObject();
            node.put("id", nodes.size() - 1);
            node.put("size", current.size());
            node.put("maxDepth", current.maxDepth());
            if (!current.actions().isEmpty()) {
                steps(node.putArray("actions"), current.actions());
            }
            if (!current.ingredients().isEmpty()) {
                ArrayNode ingredients = node.putArray("ingredients");
                for (IngredientRef ref : current.ingredients()) {
                    ingredients.add(printer.ingredient(ref));
                }
            }
            if (!current.children().isEmpty()) {
                ArrayNode children = node.putArray("children");
                for (BackwardTree child : current.children()) {
                    children.add(nextId++);
                    queue.add(child);
                }
            }
        }
        return root;
    }

    public static String pretty(ObjectNode node) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
    }

    private void steps(ArrayNode array, List<Action.Step> steps) {
        for (Action.Step step : steps) {
            array.add(printer.step(step));
        }
    }
}

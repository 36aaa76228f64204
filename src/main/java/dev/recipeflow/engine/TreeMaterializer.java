package dev.recipeflow.engine;

import dev.recipeflow.model.Action;
import dev.recipeflow.model.Input;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Turns a valid {@link Analysis} into a {@link BackwardTree}.
 */
public final class TreeMaterializer {

    private static final Logger log = LoggerFactory.getLogger(TreeMaterializer.class);

    private TreeMaterializer() {}

    /**
     * Build the tree by draining the analysis map from {@code <>} outwards.
     * Each join point's paths are removed from the map as they are resolved,
     * so every join point is expanded exactly once. The analysis cannot be
     * read afterwards.
     *
     * <p>Uses an explicit stack, so deep recipes do not grow the call stack.
     *
     * @throws InvalidRecipeException if the analysis recorded any problems
     */
    public static BackwardTree intoTree(Analysis analysis) throws InvalidRecipeException {
        if (analysis.isDrained()) {
            throw new IllegalStateException("Analysis has already been turned into a tree");
        }
        if (!analysis.isValid()) {
            throw new InvalidRecipeException(analysis.problems());
        }

        BackwardTree root = null;
        try {
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(null, analysis.take(Optional.empty())));

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.remaining.hasNext()) {
                    Path path = top.remaining.next();
                    if (path.start() instanceof Input.Ingredients ingredients) {
                        top.add(BackwardTree.leaf(path.actions(), ingredients.list()));
                    } else {
                        var point = ((Input.Join) path.start()).point().symbol();
                        List<Path> feeding = analysis.take(Optional.of(point));
                        if (feeding == null) {
                            throw new IllegalStateException("No paths left for join point " + point.id());
                        }
                        stack.push(new Frame(path, feeding));
                    }
                } else {
                    stack.pop();
                    BackwardTree node = top.build();
                    if (stack.isEmpty()) {
                        root = node;
                    } else {
                        stack.peek().add(node);
                    }
                }
            }
        } finally {
            analysis.markDrained();
        }

        log.debug("Built backward tree: size={}, maxDepth={}", root.size(), root.maxDepth());
        return root;
    }

    /**
     * A node under construction; {@code path} is null for the root.
     */
    private static final class Frame {
        private final Path path;
        private final Iterator<Path> remaining;
        private final List<BackwardTree> children = new ArrayList<>();
        private int size;
        private int childDepth;

        Frame(Path path, List<Path> feeding) {
            this.path = path;
            this.remaining = feeding.iterator();
        }

        void add(BackwardTree child) {
            children.add(child);
            size += child.size();
            childDepth = Math.max(childDepth, child.maxDepth());
        }

        BackwardTree build() {
            var actions = path == null ? List.<Action.Step>of() : path.actions();
            return new BackwardTree(actions, children, List.of(), size, actions.size() + childDepth);
        }
    }
}

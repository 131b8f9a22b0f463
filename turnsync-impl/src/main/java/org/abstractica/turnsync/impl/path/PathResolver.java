package org.abstractica.turnsync.impl.path;

import org.abstractica.turnsync.delta.DeltaOp;
import org.abstractica.turnsync.error.ErrorCode;
import org.abstractica.turnsync.error.PathException;
import org.abstractica.turnsync.error.ValidationException;
import org.abstractica.turnsync.state.StateValue;
import org.abstractica.turnsync.state.StateValue.ArrayValue;
import org.abstractica.turnsync.state.StateValue.ObjectValue;

import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates paths against immutable state trees.
 *
 * <p>Resolution never modifies a tree. {@link #mutate} rebuilds only the
 * nodes along the path and shares every other subtree with the input, so
 * the input tree stays valid for readers, rollback and undo.</p>
 *
 * <p>Intermediate containers are never created. A missing intermediate key
 * fails with {@link ErrorCode#MISSING_PARENT} for {@code set} and
 * {@code push} and with {@link ErrorCode#MISSING_KEY} for the other
 * operations; an index step that does not address an existing array
 * element fails with {@link ErrorCode#INDEX_OUT_OF_RANGE}.</p>
 */
public final class PathResolver
{
    private PathResolver()
    {
    }

    /**
     * Computes the replacement for the container addressed by a path's parent.
     */
    @FunctionalInterface
    public interface Terminal
    {
        /**
         * Returns the new container.
         *
         * @param container the current container of the last step
         * @param last      the last path step
         * @return the replacement container
         */
        StateValue apply(StateValue container, PathStep last);
    }

    /**
     * The container of a path's last step and the value found there.
     *
     * @param container the node the last step is applied to
     * @param last      the last step
     * @param current   the value at the path, empty if the slot does not exist
     */
    public record Location(StateValue container, PathStep last, Optional<StateValue> current)
    {
    }

    /**
     * Looks up the value at a path.
     *
     * @param tree the state tree
     * @param path the path
     * @return the value, or empty if any step does not resolve
     */
    public static Optional<StateValue> resolve(StateValue tree, Path path)
    {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(path, "path");
        StateValue node = tree;
        for (PathStep step : path.steps())
        {
            Optional<StateValue> next = child(node, step);
            if (next.isEmpty())
            {
                return Optional.empty();
            }
            node = next.get();
        }
        return Optional.of(node);
    }

    /**
     * Checks that a wildcard step appears only as the last step of a push.
     *
     * @param path the path
     * @param op   the operation
     * @throws PathException with {@link ErrorCode#INVALID_WILDCARD_USAGE}
     */
    public static void checkWildcard(Path path, DeltaOp op)
    {
        for (int i = 0; i < path.size(); i++)
        {
            if (!(path.get(i) instanceof PathStep.Append))
            {
                continue;
            }
            if (i != path.size() - 1)
            {
                throw new PathException(ErrorCode.INVALID_WILDCARD_USAGE, path.toString(),
                        "Wildcard must be the last step: " + path);
            }
            if (op != DeltaOp.PUSH)
            {
                throw new PathException(ErrorCode.INVALID_WILDCARD_USAGE, path.toString(),
                        "Wildcard is only valid with push, not " + op.wireName() + ": " + path);
            }
        }
    }

    /**
     * Walks to the container of the last step.
     *
     * @param tree the state tree
     * @param path a non-empty path
     * @param op   the operation, which selects the missing-key error code
     * @return the container, last step and current value
     * @throws PathException if an intermediate step does not resolve
     * @throws ValidationException with {@link ErrorCode#TYPE_MISMATCH} if a wildcard addresses a non-array
     */
    public static Location locate(StateValue tree, Path path, DeltaOp op)
    {
        Objects.requireNonNull(tree, "tree");
        requireNonEmpty(path);
        StateValue container = tree;
        for (int i = 0; i < path.size() - 1; i++)
        {
            container = descend(container, path.get(i), path, op);
        }

        PathStep last = path.last();
        if (last instanceof PathStep.Key key)
        {
            if (!(container instanceof ObjectValue object))
            {
                throw missingKey(path, op, key.name());
            }
            return new Location(container, last, object.get(key.name()));
        }
        if (last instanceof PathStep.Index index)
        {
            if (!(container instanceof ArrayValue array) || !array.isValidIndex(index.index()))
            {
                throw indexOutOfRange(path, index.index(), container);
            }
            return new Location(container, last, Optional.of(array.get(index.index())));
        }
        if (!(container instanceof ArrayValue))
        {
            throw new ValidationException(ErrorCode.TYPE_MISMATCH,
                    "Cannot append to " + container.typeName() + " at " + path.parent());
        }
        return new Location(container, last, Optional.empty());
    }

    /**
     * Rebuilds the tree with the container of the last step replaced.
     *
     * @param tree     the state tree, not modified
     * @param path     a non-empty path
     * @param op       the operation, which selects the missing-key error code
     * @param terminal computes the new container
     * @return the new tree, sharing all untouched subtrees with {@code tree}
     */
    public static StateValue mutate(StateValue tree, Path path, DeltaOp op, Terminal terminal)
    {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(terminal, "terminal");
        requireNonEmpty(path);
        return rebuild(tree, path, 0, op, terminal);
    }

    // ========== Internals ==========

    private static StateValue rebuild(StateValue node, Path path, int depth, DeltaOp op, Terminal terminal)
    {
        if (depth == path.size() - 1)
        {
            return terminal.apply(node, path.last());
        }
        PathStep step = path.get(depth);
        StateValue child = descend(node, step, path, op);
        StateValue newChild = rebuild(child, path, depth + 1, op, terminal);
        if (newChild == child)
        {
            return node;
        }
        if (step instanceof PathStep.Key key)
        {
            return ((ObjectValue) node).with(key.name(), newChild);
        }
        return ((ArrayValue) node).with(((PathStep.Index) step).index(), newChild);
    }

    private static StateValue descend(StateValue node, PathStep step, Path path, DeltaOp op)
    {
        if (step instanceof PathStep.Key key)
        {
            if (node instanceof ObjectValue object && object.containsKey(key.name()))
            {
                return object.entries().get(key.name());
            }
            throw missingKey(path, op, key.name());
        }
        if (step instanceof PathStep.Index index)
        {
            if (node instanceof ArrayValue array && array.isValidIndex(index.index()))
            {
                return array.get(index.index());
            }
            throw indexOutOfRange(path, index.index(), node);
        }
        throw new PathException(ErrorCode.INVALID_WILDCARD_USAGE, path.toString(),
                "Wildcard must be the last step: " + path);
    }

    private static Optional<StateValue> child(StateValue node, PathStep step)
    {
        if (step instanceof PathStep.Key key && node instanceof ObjectValue object)
        {
            return object.get(key.name());
        }
        if (step instanceof PathStep.Index index && node instanceof ArrayValue array
                && array.isValidIndex(index.index()))
        {
            return Optional.of(array.get(index.index()));
        }
        return Optional.empty();
    }

    private static PathException missingKey(Path path, DeltaOp op, String key)
    {
        if (op == DeltaOp.SET || op == DeltaOp.PUSH)
        {
            return new PathException(ErrorCode.MISSING_PARENT, path.toString(),
                    "Parent of '" + path + "' does not exist (missing key '" + key + "')");
        }
        return new PathException(ErrorCode.MISSING_KEY, path.toString(),
                "Key '" + key + "' not found in path '" + path + "'");
    }

    private static PathException indexOutOfRange(Path path, int index, StateValue node)
    {
        String detail = node instanceof ArrayValue array
                ? "index " + index + " out of range for length " + array.size()
                : "index " + index + " applied to " + node.typeName();
        return new PathException(ErrorCode.INDEX_OUT_OF_RANGE, path.toString(),
                "Bad index in path '" + path + "': " + detail);
    }

    private static void requireNonEmpty(Path path)
    {
        Objects.requireNonNull(path, "path");
        if (path.isEmpty())
        {
            throw new IllegalArgumentException("path must not be empty");
        }
    }
}

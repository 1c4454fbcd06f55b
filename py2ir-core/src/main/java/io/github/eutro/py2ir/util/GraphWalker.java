package io.github.eutro.py2ir.util;

import io.github.eutro.py2ir.ssa.BasicBlock;
import io.github.eutro.py2ir.ssa.Function;

import java.util.*;

/**
 * A class for walking a graph depth-first, in pre- or post-order.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    final T root;
    final java.util.function.Function<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     * <p>
     * Children are visited in the order the successor function yields them.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, java.util.function.Function<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the blocks of a function, from its entry.
     *
     * @param func The function.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(Function func) {
        return new GraphWalker<>(func.getEntry(), BasicBlock::successors);
    }

    /**
     * Get the pre-order traversal of the graph.
     *
     * @return The nodes, in pre-order.
     */
    public List<T> preOrder() {
        List<T> order = new ArrayList<>();
        Set<T> seen = new HashSet<>();
        Deque<Iterator<? extends T>> stack = new ArrayDeque<>();
        seen.add(root);
        order.add(root);
        stack.push(getChildren.apply(root).iterator());
        while (!stack.isEmpty()) {
            Iterator<? extends T> it = stack.peek();
            if (!it.hasNext()) {
                stack.pop();
                continue;
            }
            T next = it.next();
            if (seen.add(next)) {
                order.add(next);
                stack.push(getChildren.apply(next).iterator());
            }
        }
        return order;
    }

    /**
     * Get the post-order traversal of the graph.
     *
     * @return The nodes, in post-order.
     */
    public List<T> postOrder() {
        List<T> order = new ArrayList<>();
        Set<T> seen = new HashSet<>();
        Deque<T> nodes = new ArrayDeque<>();
        Deque<Iterator<? extends T>> stack = new ArrayDeque<>();
        seen.add(root);
        nodes.push(root);
        stack.push(getChildren.apply(root).iterator());
        while (!stack.isEmpty()) {
            Iterator<? extends T> it = stack.peek();
            if (!it.hasNext()) {
                stack.pop();
                order.add(nodes.pop());
                continue;
            }
            T next = it.next();
            if (seen.add(next)) {
                nodes.push(next);
                stack.push(getChildren.apply(next).iterator());
            }
        }
        return order;
    }

    /**
     * Get the reverse post-order of the graph, in which every node comes
     * before its successors, except along back-edges.
     *
     * @return The nodes, in reverse post-order.
     */
    public List<T> reversePostOrder() {
        List<T> order = postOrder();
        Collections.reverse(order);
        return order;
    }
}

package org.example.depscan.traversal;

import org.example.depscan.exception.MalformedNodeException;
import org.example.depscan.model.DependencyNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reports circular dependencies with a three-colour depth-first search.
 *
 * <p>A node is white until first reached, gray while it is on the current
 * chain and black once all of its descendants are done. Reaching a gray
 * node closes a cycle, reported from that node through the current chain
 * back to itself, e.g. {@code a@1.0.0 → b@1.0.0 → a@1.0.0}.</p>
 *
 * <p>The search keeps its chain on an explicit frame stack, so it is safe
 * on graphs of any depth. Instances hold no state between calls.</p>
 */
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    private static final String SEPARATOR = " → ";

    private final int maxCycles;

    /**
     * Creates a detector that reports every cycle it finds.
     */
    public CycleDetector() {
        this(Integer.MAX_VALUE);
    }

    /**
     * Creates a detector that stops after {@code maxCycles} cycles.
     */
    public CycleDetector(int maxCycles) {
        if (maxCycles <= 0) {
            throw new IllegalArgumentException("maxCycles must be positive, but was: " + maxCycles);
        }
        this.maxCycles = maxCycles;
    }

    /**
     * Finds the cycles reachable from the given roots.
     *
     * @param roots root nodes, null entries are rejected
     * @return cycle paths in discovery order
     * @throws MalformedNodeException if a root is null
     */
    public List<String> detectCycles(Collection<DependencyNode> roots) {
        List<String> cycles = new ArrayList<>();
        if (roots == null || roots.isEmpty()) {
            return cycles;
        }

        Set<String> done = new HashSet<>();
        int index = 0;
        for (DependencyNode root : roots) {
            if (root == null) {
                throw new MalformedNodeException("Root dependency node is null", "root-" + index);
            }
            index++;
            if (done.contains(root.getKey())) {
                continue;
            }
            if (!search(root, done, cycles)) {
                log.warn("Cycle report truncated after {} cycles", maxCycles);
                break;
            }
        }

        log.debug("Cycle detection found {} cycle(s)", cycles.size());
        return cycles;
    }

    /**
     * Runs one search from a white root.
     *
     * @return false if the cycle cap was reached
     */
    private boolean search(DependencyNode root, Set<String> done, List<String> cycles) {
        Deque<Frame> stack = new ArrayDeque<>();
        // gray nodes, mapped to their position on the current chain
        Map<String, Integer> onChain = new HashMap<>();
        List<String> chain = new ArrayList<>();

        enter(root, stack, onChain, chain);

        while (!stack.isEmpty()) {
            Frame top = stack.peek();

            if (!top.children.hasNext()) {
                stack.pop();
                String key = chain.remove(chain.size() - 1);
                onChain.remove(key);
                done.add(key);
                continue;
            }

            DependencyNode child = top.children.next();
            String childKey = child.getKey();

            Integer position = onChain.get(childKey);
            if (position != null) {
                List<String> cycle = new ArrayList<>(chain.subList(position, chain.size()));
                cycle.add(childKey);
                cycles.add(String.join(SEPARATOR, cycle));
                if (cycles.size() >= maxCycles) {
                    return false;
                }
            } else if (!done.contains(childKey)) {
                enter(child, stack, onChain, chain);
            }
        }
        return true;
    }

    private void enter(DependencyNode node, Deque<Frame> stack, Map<String, Integer> onChain, List<String> chain) {
        String key = node.getKey();
        onChain.put(key, chain.size());
        chain.add(key);
        stack.push(new Frame(node.getDependencies().values().iterator()));
    }

    private static final class Frame {
        private final Iterator<DependencyNode> children;

        private Frame(Iterator<DependencyNode> children) {
            this.children = children;
        }
    }
}

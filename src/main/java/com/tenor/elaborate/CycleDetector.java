package com.tenor.elaborate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Three-colour depth-first cycle search over an arena of named nodes.
 * Nodes are visited in insertion order and edges in the order they were added,
 * so the reported cycle is deterministic.
 */
final class CycleDetector {

    private static final byte WHITE = 0;
    private static final byte GRAY = 1;
    private static final byte BLACK = 2;

    /** A cycle path that starts and ends on the same node, plus the node whose edge closes it. */
    static final class Cycle {
        final List<String> path;
        final String closing;

        Cycle(List<String> path, String closing) {
            this.path = path;
            this.closing = closing;
        }

        String render() {
            return String.join(" → ", path);
        }
    }

    private final List<String> names = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();
    private final List<List<Integer>> edges = new ArrayList<>();

    int node(String name) {
        Integer i = index.get(name);
        if (i != null) return i;
        int id = names.size();
        names.add(name);
        index.put(name, id);
        edges.add(new ArrayList<>());
        return id;
    }

    boolean contains(String name) {
        return index.containsKey(name);
    }

    void edge(String from, String to) {
        int f = node(from);
        int t = node(to);
        edges.get(f).add(t);
    }

    Cycle findCycle() {
        byte[] color = new byte[names.size()];
        List<Integer> stack = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            if (color[i] == WHITE) {
                Cycle c = visit(i, color, stack);
                if (c != null) return c;
            }
        }
        return null;
    }

    private Cycle visit(int n, byte[] color, List<Integer> stack) {
        color[n] = GRAY;
        stack.add(n);
        for (int next : edges.get(n)) {
            if (color[next] == GRAY) {
                List<String> path = new ArrayList<>();
                for (int k = stack.indexOf(next); k < stack.size(); k++) path.add(names.get(stack.get(k)));
                path.add(names.get(next));
                return new Cycle(path, names.get(n));
            }
            if (color[next] == WHITE) {
                Cycle c = visit(next, color, stack);
                if (c != null) return c;
            }
        }
        stack.remove(stack.size() - 1);
        color[n] = BLACK;
        return null;
    }
}

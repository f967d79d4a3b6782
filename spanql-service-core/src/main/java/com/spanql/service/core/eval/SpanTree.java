package com.spanql.service.core.eval;

import com.spanql.telemetry.model.Span;
import com.spanql.telemetry.model.Trace;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Index-based view of one trace, built once per evaluation. Spans keep their position in the trace; parents
 * and children are array indexes, and a pre-order walk answers descendant and ancestor questions for a whole
 * set of spans in one pass.
 *
 * <p>A span whose parent id is not in the trace roots its own subtree. A span id may be shared by a client span
 * and the server span that names itself as parent: the server hangs under the client and children naming the
 * id resolve to the server. Any other duplicate span id, or a parent cycle, marks the tree corrupt and it must
 * not be evaluated.
 */
public final class SpanTree {
    private static final int[] NO_CHILDREN = new int[0];

    private final Trace trace;
    private final Span[] spans;
    private final int[] parents;
    private final int[][] children;
    private final int[] preorder;
    private final int danglingParents;
    private final String corruption;

    private SpanTree(
            Trace trace,
            Span[] spans,
            int[] parents,
            int[][] children,
            int[] preorder,
            int danglingParents,
            String corruption) {
        this.trace = trace;
        this.spans = spans;
        this.parents = parents;
        this.children = children;
        this.preorder = preorder;
        this.danglingParents = danglingParents;
        this.corruption = corruption;
    }

    public static SpanTree build(Trace trace) {
        List<Span> list = trace.getSpans();
        int n = list.size();
        Span[] spans = list.toArray(new Span[0]);
        Map<String, Integer> byId = new HashMap<>(n * 2);
        // server index -> client index for ids shared by a client span and its self-parented server span
        Map<Integer, Integer> sharedIds = new HashMap<>();
        String corruption = null;
        for (int i = 0; i < n; i++) {
            String id = spans[i].getSpanId();
            Integer previous = byId.putIfAbsent(id, i);
            if (previous == null) {
                continue;
            }
            if (sharedIds.containsKey(previous)) {
                if (corruption == null) {
                    corruption = "span id " + id + " appears more than twice";
                }
            } else if (isSelfParented(spans[i]) != isSelfParented(spans[previous])) {
                int server = isSelfParented(spans[i]) ? i : previous;
                int client = server == i ? previous : i;
                sharedIds.put(server, client);
                byId.put(id, server);
            } else if (corruption == null) {
                corruption = "duplicate span id " + id;
            }
        }

        int[] parents = new int[n];
        int[] childCounts = new int[n];
        int dangling = 0;
        for (int i = 0; i < n; i++) {
            Integer client = sharedIds.get(i);
            String parentId = spans[i].getParentSpanId();
            Integer p = client != null ? client : parentId == null ? null : byId.get(parentId);
            if (parentId != null && p == null) {
                dangling++;
            }
            parents[i] = p == null ? -1 : p;
            if (parents[i] == i && corruption == null) {
                corruption = "span " + spans[i].getSpanId() + " is its own parent";
            }
            if (parents[i] >= 0) {
                childCounts[parents[i]]++;
            }
        }

        int[][] children = new int[n][];
        int[] fill = new int[n];
        for (int i = 0; i < n; i++) {
            children[i] = childCounts[i] == 0 ? NO_CHILDREN : new int[childCounts[i]];
        }
        for (int i = 0; i < n; i++) {
            int p = parents[i];
            if (p >= 0) {
                children[p][fill[p]++] = i;
            }
        }

        int[] preorder = new int[n];
        int visited = 0;
        Deque<Integer> stack = new ArrayDeque<>();
        for (int root = 0; root < n; root++) {
            if (parents[root] >= 0) {
                continue;
            }
            stack.push(root);
            while (!stack.isEmpty()) {
                int current = stack.pop();
                preorder[visited++] = current;
                int[] kids = children[current];
                for (int k = kids.length - 1; k >= 0; k--) {
                    stack.push(kids[k]);
                }
            }
        }
        if (visited < n && corruption == null) {
            corruption = "parent cycle among " + (n - visited) + " spans";
        }
        return new SpanTree(trace, spans, parents, children, preorder, dangling, corruption);
    }

    private static boolean isSelfParented(Span span) {
        return span.getSpanId().equals(span.getParentSpanId());
    }

    public Trace trace() {
        return trace;
    }

    public int size() {
        return spans.length;
    }

    public Span span(int index) {
        return spans[index];
    }

    /** Parent index, or -1 for roots (including spans whose parent is missing). */
    public int parent(int index) {
        return parents[index];
    }

    public int childCount(int index) {
        return children[index].length;
    }

    public int danglingParents() {
        return danglingParents;
    }

    public boolean isCorrupt() {
        return corruption != null;
    }

    public String corruption() {
        return corruption;
    }

    // ---------------------------------------------------------------------
    // set relations: each takes a membership mask and returns a new mask
    // ---------------------------------------------------------------------

    /** Spans with a proper ancestor in {@code marked}. */
    public boolean[] descendantsOf(boolean[] marked) {
        boolean[] result = new boolean[spans.length];
        for (int i : preorder) {
            int p = parents[i];
            result[i] = p >= 0 && (marked[p] || result[p]);
        }
        return result;
    }

    /** Spans with a proper descendant in {@code marked}. */
    public boolean[] ancestorsOf(boolean[] marked) {
        boolean[] result = new boolean[spans.length];
        for (int k = preorder.length - 1; k >= 0; k--) {
            int i = preorder[k];
            int p = parents[i];
            if (p >= 0 && (marked[i] || result[i])) {
                result[p] = true;
            }
        }
        return result;
    }

    /** Spans whose parent is in {@code marked}. */
    public boolean[] childrenOf(boolean[] marked) {
        boolean[] result = new boolean[spans.length];
        for (int i = 0; i < spans.length; i++) {
            result[i] = parents[i] >= 0 && marked[parents[i]];
        }
        return result;
    }

    /** Spans with a child in {@code marked}. */
    public boolean[] parentsOf(boolean[] marked) {
        boolean[] result = new boolean[spans.length];
        for (int i = 0; i < spans.length; i++) {
            if (marked[i] && parents[i] >= 0) {
                result[parents[i]] = true;
            }
        }
        return result;
    }

    /** Spans sharing a parent with some other span in {@code marked}. Roots have no siblings. */
    public boolean[] siblingsOf(boolean[] marked) {
        int[] markedChildren = new int[spans.length];
        for (int i = 0; i < spans.length; i++) {
            if (marked[i] && parents[i] >= 0) {
                markedChildren[parents[i]]++;
            }
        }
        boolean[] result = new boolean[spans.length];
        for (int i = 0; i < spans.length; i++) {
            int p = parents[i];
            result[i] = p >= 0 && markedChildren[p] - (marked[i] ? 1 : 0) > 0;
        }
        return result;
    }
}

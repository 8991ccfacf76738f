package max.games.engine.hex;

import java.util.Arrays;

/**
 * Disjoint-set forest with path compression and union by rank. Sized for the board plus two virtual
 * terminal nodes standing for opposite board edges.
 */
public final class UnionFind {
    private final int[] parent;
    private final byte[] rank;

    public UnionFind(int size) {
        parent = new int[size];
        rank = new byte[size];
        for (int i = 0; i < size; i++) parent[i] = i;
    }

    private UnionFind(UnionFind other) {
        parent = Arrays.copyOf(other.parent, other.parent.length);
        rank = Arrays.copyOf(other.rank, other.rank.length);
    }

    public int size() {
        return parent.length;
    }

    public int find(int x) {
        int root = x;
        while (parent[root] != root) root = parent[root];
        // second pass: point every node on the path straight at the root
        while (parent[x] != root) {
            int next = parent[x];
            parent[x] = root;
            x = next;
        }
        return root;
    }

    public void union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb) return;
        if (rank[ra] < rank[rb]) {
            parent[ra] = rb;
        } else if (rank[ra] > rank[rb]) {
            parent[rb] = ra;
        } else {
            parent[rb] = ra;
            rank[ra]++;
        }
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    public UnionFind copy() {
        return new UnionFind(this);
    }
}

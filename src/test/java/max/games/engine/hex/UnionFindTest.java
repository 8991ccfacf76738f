package max.games.engine.hex;

import org.junit.jupiter.api.Test;

import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

public class UnionFindTest {

    @Test
    public void unionsAreTransitive() {
        UnionFind uf = new UnionFind(10);
        uf.union(1, 2);
        uf.union(3, 4);
        assertFalse(uf.connected(1, 4));
        uf.union(2, 3);
        assertTrue(uf.connected(1, 4), "1-2 and 3-4 joined through 2-3");
        assertFalse(uf.connected(1, 5));
    }

    @Test
    public void connectivityDoesNotDependOnUnionOrder() {
        int[][] pairs = {{0, 1}, {2, 3}, {1, 2}, {5, 6}, {7, 8}, {8, 9}, {6, 9}, {11, 12}};
        UnionFind reference = new UnionFind(14);
        for (int[] p : pairs) reference.union(p[0], p[1]);

        SplittableRandom rng = new SplittableRandom(7);
        for (int round = 0; round < 20; round++) {
            int[][] shuffled = pairs.clone();
            for (int i = shuffled.length - 1; i > 0; i--) {
                int j = rng.nextInt(i + 1);
                int[] t = shuffled[i]; shuffled[i] = shuffled[j]; shuffled[j] = t;
            }
            UnionFind uf = new UnionFind(14);
            for (int[] p : shuffled) {
                if (rng.nextBoolean()) uf.union(p[0], p[1]);
                else uf.union(p[1], p[0]);
            }
            for (int a = 0; a < 14; a++) {
                for (int b = 0; b < 14; b++) {
                    assertEquals(reference.connected(a, b), uf.connected(a, b), "pair " + a + "," + b);
                }
            }
        }
    }

    @Test
    public void copyIsIndependent() {
        UnionFind uf = new UnionFind(4);
        uf.union(0, 1);
        UnionFind copy = uf.copy();
        copy.union(1, 2);
        assertTrue(copy.connected(0, 2));
        assertFalse(uf.connected(0, 2), "union on the copy must not leak into the original");
    }
}

package max.games.engine.isolation.search;

import max.games.engine.common.Difficulty;
import max.games.engine.common.EngineProperties;
import max.games.engine.isolation.book.BookPolicy;
import max.games.engine.isolation.search.evaluator.EvalWeights;
import max.games.engine.isolation.search.transpositiontable.TranspositionTable;

public final class SearchConfig {

    public final int maxDepth;
    public final long defaultBudgetMs;
    public final EvalWeights weights;

    // TT
    public final boolean useTT;
    public final int ttEntries;

    // Aspiration window
    public final int aspirationMinDepth;
    public final int aspirationWindow;
    public final int aspirationMaxWindow;   // wider than this: fall back to a full window

    // Null move pruning
    public final boolean useNullMove;
    public final int nullMinDepth;
    public final int nullMaxReduction;
    public final int nullMinMobility;      // mover needs more slides than this
    public final int nullMinFreeCells;     // and the board more free cells than this

    // Principal variation search
    public final boolean usePVS;
    public final int pvsMinDepth;

    // Destroy candidates kept per slide, by number of destroyed cells
    public final int destroyCandidatesEarly;
    public final int destroyCandidatesMid;
    public final int destroyCandidatesLate;
    public final int destroyMidFrom;
    public final int destroyLateFrom;

    // Clock is read once per this many nodes (power of two minus one)
    public final int timeCheckMask;

    // Endgame solver
    public final boolean useEndgameSolver;
    public final int endgameRegionLimit;
    public final double endgameTimeShare;

    // Opening book
    public final BookPolicy bookPolicy;

    public final int criticalCacheCapacity;

    private SearchConfig(Builder b) {
        this.maxDepth = b.maxDepth;
        this.defaultBudgetMs = b.defaultBudgetMs;
        this.weights = b.weights;
        this.useTT = b.useTT;
        this.ttEntries = b.ttEntries;
        this.aspirationMinDepth = b.aspirationMinDepth;
        this.aspirationWindow = b.aspirationWindow;
        this.aspirationMaxWindow = b.aspirationMaxWindow;
        this.useNullMove = b.useNullMove;
        this.nullMinDepth = b.nullMinDepth;
        this.nullMaxReduction = b.nullMaxReduction;
        this.nullMinMobility = b.nullMinMobility;
        this.nullMinFreeCells = b.nullMinFreeCells;
        this.usePVS = b.usePVS;
        this.pvsMinDepth = b.pvsMinDepth;
        this.destroyCandidatesEarly = b.destroyCandidatesEarly;
        this.destroyCandidatesMid = b.destroyCandidatesMid;
        this.destroyCandidatesLate = b.destroyCandidatesLate;
        this.destroyMidFrom = b.destroyMidFrom;
        this.destroyLateFrom = b.destroyLateFrom;
        this.timeCheckMask = b.timeCheckMask;
        this.useEndgameSolver = b.useEndgameSolver;
        this.endgameRegionLimit = b.endgameRegionLimit;
        this.endgameTimeShare = b.endgameTimeShare;
        this.bookPolicy = b.bookPolicy;
        this.criticalCacheCapacity = b.criticalCacheCapacity;
    }

    public static Builder builder() { return new Builder(); }

    public static SearchConfig defaults() { return forDifficulty(Difficulty.NEXUS_7); }

    /** Preset table: NEXUS-3 depth 5 / 3 s, NEXUS-5 depth 7 / 12 s, NEXUS-7 depth 10 / 10 s. */
    public static SearchConfig forDifficulty(Difficulty difficulty) {
        Builder b = builder()
                .weights(EvalWeights.forDifficulty(difficulty))
                .ttEntries(EngineProperties.intProperty(EngineProperties.TT_ENTRIES, TranspositionTable.DEFAULT_ENTRIES))
                .bookPolicy(EngineProperties.booleanProperty(EngineProperties.BOOK_ENABLED, true)
                        ? BookPolicy.defaults() : BookPolicy.disabled());
        switch (difficulty) {
            case NEXUS_3 -> b.maxDepth(5).defaultBudgetMs(3_000);
            case NEXUS_5 -> b.maxDepth(7).defaultBudgetMs(12_000);
            default -> b.maxDepth(10).defaultBudgetMs(10_000);
        }
        return b.build();
    }

    public int destroyCandidates(int destroyedCount) {
        if (destroyedCount < destroyMidFrom) return destroyCandidatesEarly;
        if (destroyedCount < destroyLateFrom) return destroyCandidatesMid;
        return destroyCandidatesLate;
    }

    public static class Builder {
        private int maxDepth = 10;
        private long defaultBudgetMs = 10_000;
        private EvalWeights weights = EvalWeights.nexus7();

        private boolean useTT = true;
        private int ttEntries = TranspositionTable.DEFAULT_ENTRIES;

        private int aspirationMinDepth = 3;
        private int aspirationWindow = 50;
        private int aspirationMaxWindow = 500;

        private boolean useNullMove = true;
        private int nullMinDepth = 3;
        private int nullMaxReduction = 3;
        private int nullMinMobility = 3;
        private int nullMinFreeCells = 10;

        private boolean usePVS = true;
        private int pvsMinDepth = 3;

        private int destroyCandidatesEarly = 6;
        private int destroyCandidatesMid = 8;
        private int destroyCandidatesLate = 12;
        private int destroyMidFrom = 10;
        private int destroyLateFrom = 30;

        private int timeCheckMask = 4095;

        private boolean useEndgameSolver = true;
        private int endgameRegionLimit = 18;
        private double endgameTimeShare = 0.5;

        private BookPolicy bookPolicy = BookPolicy.defaults();

        private int criticalCacheCapacity = 1000;

        public Builder maxDepth(int v){maxDepth=v;return this;}
        public Builder defaultBudgetMs(long v){defaultBudgetMs=v;return this;}
        public Builder weights(EvalWeights v){weights=v;return this;}
        public Builder useTT(boolean v){useTT=v;return this;}
        public Builder ttEntries(int v){ttEntries=v;return this;}
        public Builder aspirationMinDepth(int v){aspirationMinDepth=v;return this;}
        public Builder aspirationWindow(int v){aspirationWindow=v;return this;}
        public Builder aspirationMaxWindow(int v){aspirationMaxWindow=v;return this;}
        public Builder useNullMove(boolean v){useNullMove=v;return this;}
        public Builder nullMinDepth(int v){nullMinDepth=v;return this;}
        public Builder nullMaxReduction(int v){nullMaxReduction=v;return this;}
        public Builder nullMinMobility(int v){nullMinMobility=v;return this;}
        public Builder nullMinFreeCells(int v){nullMinFreeCells=v;return this;}
        public Builder usePVS(boolean v){usePVS=v;return this;}
        public Builder pvsMinDepth(int v){pvsMinDepth=v;return this;}
        public Builder destroyCandidatesEarly(int v){destroyCandidatesEarly=v;return this;}
        public Builder destroyCandidatesMid(int v){destroyCandidatesMid=v;return this;}
        public Builder destroyCandidatesLate(int v){destroyCandidatesLate=v;return this;}
        public Builder destroyMidFrom(int v){destroyMidFrom=v;return this;}
        public Builder destroyLateFrom(int v){destroyLateFrom=v;return this;}
        public Builder timeCheckMask(int v){timeCheckMask=v;return this;}
        public Builder useEndgameSolver(boolean v){useEndgameSolver=v;return this;}
        public Builder endgameRegionLimit(int v){endgameRegionLimit=v;return this;}
        public Builder endgameTimeShare(double v){endgameTimeShare=v;return this;}
        public Builder bookPolicy(BookPolicy v){bookPolicy=v;return this;}
        public Builder criticalCacheCapacity(int v){criticalCacheCapacity=v;return this;}

        public SearchConfig build() {
            if (maxDepth < 1 || maxDepth >= SearchConstants.MAX_PLY) {
                throw new IllegalArgumentException("maxDepth must be in 1.." + (SearchConstants.MAX_PLY - 1));
            }
            if (Math.max(destroyCandidatesEarly, Math.max(destroyCandidatesMid, destroyCandidatesLate)) > SearchConstants.MAX_DESTROY_CANDIDATES
                    || Math.min(destroyCandidatesEarly, Math.min(destroyCandidatesMid, destroyCandidatesLate)) < 1) {
                throw new IllegalArgumentException("destroy candidate counts must be in 1.." + SearchConstants.MAX_DESTROY_CANDIDATES);
            }
            return new SearchConfig(this);
        }
    }
}

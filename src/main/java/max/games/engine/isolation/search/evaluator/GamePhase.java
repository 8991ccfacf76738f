package max.games.engine.isolation.search.evaluator;

/**
 * Phase of an isolation game, read from the number of destroyed cells (one per turn played).
 */
public enum GamePhase {
    OPENING(0.6, 1.0, 1.5, 0.8, 0.0),
    MIDGAME(1.0, 1.0, 1.0, 1.0, 0.0),
    ENDGAME(2.0, 0.5, 0.5, 1.4, 1.0);

    public static final int MIDGAME_FROM = 10;
    public static final int ENDGAME_FROM = 25;

    private final double partitionScale;
    private final double territoryScale;
    private final double positionalScale;
    private final double mobilityScale;
    private final double effectiveMobilityScale;

    GamePhase(double partitionScale, double territoryScale, double positionalScale,
              double mobilityScale, double effectiveMobilityScale) {
        this.partitionScale = partitionScale;
        this.territoryScale = territoryScale;
        this.positionalScale = positionalScale;
        this.mobilityScale = mobilityScale;
        this.effectiveMobilityScale = effectiveMobilityScale;
    }

    public static GamePhase of(int destroyedCount) {
        if (destroyedCount < MIDGAME_FROM) return OPENING;
        if (destroyedCount < ENDGAME_FROM) return MIDGAME;
        return ENDGAME;
    }

    public boolean isEndgame() {
        return this == ENDGAME;
    }

    /** Phase-adjusted copy of a difficulty's base weights. Partition weight never exceeds 1000. */
    public EvalWeights scale(EvalWeights w) {
        return new EvalWeights(
                w.territory() * territoryScale,
                w.mobility() * mobilityScale,
                w.mobilityPotential() * mobilityScale,
                w.center() * positionalScale,
                w.corner() * positionalScale,
                Math.min(EvalWeights.MAX_PARTITION_WEIGHT, w.partition() * partitionScale),
                w.critical(),
                w.openness() * positionalScale,
                w.parity(),
                w.trap(),
                w.effectiveMobility() * effectiveMobilityScale);
    }
}

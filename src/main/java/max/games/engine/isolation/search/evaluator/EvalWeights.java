package max.games.engine.isolation.search.evaluator;

import max.games.engine.common.Difficulty;

/**
 * One weight per evaluation component. The per-difficulty vectors are the base magnitudes;
 * {@link GamePhase#scale(EvalWeights)} reshapes them for the current phase.
 */
public record EvalWeights(double territory, double mobility, double mobilityPotential, double center,
                          double corner, double partition, double critical, double openness,
                          double parity, double trap, double effectiveMobility) {

    public static final double MAX_PARTITION_WEIGHT = 1000.0;

    public static EvalWeights nexus7() {
        return new EvalWeights(5.0, 8.0, 5.0, 2.0, 3.0, 500.0, 4.0, 1.0, 20.0, 150.0, 6.0);
    }

    public static EvalWeights nexus5() {
        return new EvalWeights(4.0, 7.0, 3.0, 2.0, 2.5, 300.0, 3.0, 0.8, 15.0, 100.0, 4.0);
    }

    public static EvalWeights nexus3() {
        return new EvalWeights(3.0, 5.0, 2.0, 1.5, 2.0, 100.0, 2.0, 0.5, 10.0, 60.0, 2.0);
    }

    public static EvalWeights forDifficulty(Difficulty difficulty) {
        return switch (difficulty) {
            case NEXUS_3 -> nexus3();
            case NEXUS_5 -> nexus5();
            default -> nexus7();
        };
    }

    /** Territory, mobility and partition replaced while a side is down to two moves or fewer. */
    public EvalWeights desperate() {
        return new EvalWeights(0.0, 50.0, mobilityPotential, center, corner, 0.0, critical, openness,
                parity, trap, effectiveMobility);
    }

    public double dot(EvalComponents c) {
        return c.territory() * territory
                + c.mobility() * mobility
                + c.mobilityPotential() * mobilityPotential
                + c.center() * center
                + c.corner() * corner
                + c.partition() * partition
                + c.critical() * critical
                + c.openness() * openness
                + c.parity() * parity
                + c.trap() * trap
                + c.effectiveMobility() * effectiveMobility;
    }
}

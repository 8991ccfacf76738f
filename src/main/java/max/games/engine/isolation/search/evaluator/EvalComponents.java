package max.games.engine.isolation.search.evaluator;

/**
 * Raw component values, all measured from the AI side (positive favours the AI).
 */
public record EvalComponents(double territory, double mobility, double mobilityPotential, double center,
                             double corner, double partition, double critical, double openness,
                             double parity, double trap, double effectiveMobility,
                             int humanMobility, int aiMobility, boolean partitioned) {

    public boolean desperate() {
        return aiMobility <= 2 || humanMobility <= 2;
    }
}

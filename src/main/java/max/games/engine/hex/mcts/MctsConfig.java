package max.games.engine.hex.mcts;

import max.games.engine.common.Difficulty;
import max.games.engine.common.EngineProperties;

public final class MctsConfig {

    public final int maxSimulations;
    public final double explorationConstant;
    public final double raveConstant;
    // probability that a playout step looks at a few candidates instead of playing uniformly at random
    public final double playoutHeuristicChance;
    // heuristic playout steps are only taken once fewer than this many cells are free
    public final int heuristicPlayoutMaxEmpty;
    public final int heuristicPlayoutSamples;
    public final double selectionTemperature;
    public final int expansionSampleSize;
    // virtual RAVE samples seeded from the expansion heuristic when a child is created
    public final double priorSamples;
    public final int candidatesReported;

    private MctsConfig(Builder b) {
        this.maxSimulations = b.maxSimulations;
        this.explorationConstant = b.explorationConstant;
        this.raveConstant = b.raveConstant;
        this.playoutHeuristicChance = b.playoutHeuristicChance;
        this.heuristicPlayoutMaxEmpty = b.heuristicPlayoutMaxEmpty;
        this.heuristicPlayoutSamples = b.heuristicPlayoutSamples;
        this.selectionTemperature = b.selectionTemperature;
        this.expansionSampleSize = b.expansionSampleSize;
        this.priorSamples = b.priorSamples;
        this.candidatesReported = b.candidatesReported;
    }

    public static Builder builder() { return new Builder(); }

    public static MctsConfig defaults() { return forDifficulty(Difficulty.NEXUS_7); }

    public static MctsConfig forDifficulty(Difficulty difficulty) {
        Builder b = builder()
                .raveConstant(EngineProperties.doubleProperty(EngineProperties.MCTS_RAVE, 300.0))
                .explorationConstant(EngineProperties.doubleProperty(EngineProperties.MCTS_EXPLORATION, 1.0));
        switch (difficulty) {
            case NEXUS_3 -> b.maxSimulations(30_000).playoutHeuristicChance(0.05).selectionTemperature(0.5);
            case NEXUS_5 -> b.maxSimulations(80_000).playoutHeuristicChance(0.15).selectionTemperature(0.1);
            default -> b.maxSimulations(1_000_000).playoutHeuristicChance(0.30).selectionTemperature(0.0);
        }
        return b.build();
    }

    public Builder toBuilder() {
        return builder()
                .maxSimulations(maxSimulations)
                .explorationConstant(explorationConstant)
                .raveConstant(raveConstant)
                .playoutHeuristicChance(playoutHeuristicChance)
                .heuristicPlayoutMaxEmpty(heuristicPlayoutMaxEmpty)
                .heuristicPlayoutSamples(heuristicPlayoutSamples)
                .selectionTemperature(selectionTemperature)
                .expansionSampleSize(expansionSampleSize)
                .priorSamples(priorSamples)
                .candidatesReported(candidatesReported);
    }

    public static class Builder {
        private int maxSimulations = 1_000_000;
        private double explorationConstant = 1.0;
        private double raveConstant = 300.0;
        private double playoutHeuristicChance = 0.30;
        private int heuristicPlayoutMaxEmpty = 80;
        private int heuristicPlayoutSamples = 5;
        private double selectionTemperature = 0.0;
        private int expansionSampleSize = 15;
        private double priorSamples = 10.0;
        private int candidatesReported = 5;

        public Builder maxSimulations(int v){maxSimulations=v;return this;}
        public Builder explorationConstant(double v){explorationConstant=v;return this;}
        public Builder raveConstant(double v){raveConstant=v;return this;}
        public Builder playoutHeuristicChance(double v){playoutHeuristicChance=v;return this;}
        public Builder heuristicPlayoutMaxEmpty(int v){heuristicPlayoutMaxEmpty=v;return this;}
        public Builder heuristicPlayoutSamples(int v){heuristicPlayoutSamples=v;return this;}
        public Builder selectionTemperature(double v){selectionTemperature=v;return this;}
        public Builder expansionSampleSize(int v){expansionSampleSize=v;return this;}
        public Builder priorSamples(double v){priorSamples=v;return this;}
        public Builder candidatesReported(int v){candidatesReported=v;return this;}

        public MctsConfig build() {
            if (maxSimulations < 1) throw new IllegalArgumentException("maxSimulations must be positive");
            if (expansionSampleSize < 1) throw new IllegalArgumentException("expansionSampleSize must be positive");
            if (selectionTemperature < 0) throw new IllegalArgumentException("selectionTemperature must not be negative");
            return new MctsConfig(this);
        }
    }
}

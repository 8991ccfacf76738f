package max.games.engine.isolation.analysis;

/**
 * Outcome of a partition check. Region sizes and masks are only filled when {@code partitioned} is true; each
 * region excludes the piece standing in it.
 */
public record PartitionResult(boolean partitioned, int humanRegionSize, int aiRegionSize,
                              long humanRegion, long aiRegion) {
    public static final PartitionResult CONNECTED = new PartitionResult(false, 0, 0, 0L, 0L);

    /** Region advantage from the AI side. */
    public int aiAdvantage() {
        return aiRegionSize - humanRegionSize;
    }
}

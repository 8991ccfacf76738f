package max.games.engine.isolation.search;

import max.games.engine.common.Difficulty;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SearchConfigTest {

    @Test
    public void presetsScaleWithDifficulty() {
        assertEquals(5, SearchConfig.forDifficulty(Difficulty.NEXUS_3).maxDepth);
        assertEquals(7, SearchConfig.forDifficulty(Difficulty.NEXUS_5).maxDepth);
        assertEquals(10, SearchConfig.forDifficulty(Difficulty.NEXUS_7).maxDepth);
        assertEquals(12_000, SearchConfig.forDifficulty(Difficulty.NEXUS_5).defaultBudgetMs);
    }

    @Test
    public void destroyCandidatesGrowAsTheBoardFills() {
        SearchConfig cfg = SearchConfig.defaults();
        assertEquals(6, cfg.destroyCandidates(0));
        assertEquals(8, cfg.destroyCandidates(10));
        assertEquals(12, cfg.destroyCandidates(30));
    }

    @Test
    public void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.builder().maxDepth(0).build());
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.builder().destroyCandidatesLate(13).build());
    }
}

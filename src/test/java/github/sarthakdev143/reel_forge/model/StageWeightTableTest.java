package github.sarthakdev143.reel_forge.model;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageWeightTableTest {

    @Test
    void defaultsSumToHundred() {
        StageWeightTable table = StageWeightTable.defaults();

        int sum = 0;
        for (GenerationStage stage : GenerationStage.values()) {
            sum += table.weightOf(stage);
        }
        assertThat(sum).isEqualTo(100);
        assertThat(table.weightOf(GenerationStage.GENERATING_IMAGES))
                .isGreaterThan(table.weightOf(GenerationStage.ANALYZING_PROMPT));
    }

    @Test
    void rejectsWeightsThatDoNotSumToHundred() {
        Map<GenerationStage, Integer> weights = new EnumMap<>(StageWeightTable.defaults().asMap());
        weights.put(GenerationStage.ASSEMBLING_VIDEO, 31);

        assertThatThrownBy(() -> StageWeightTable.of(weights))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sum to 100");
    }

    @Test
    void rejectsMissingStage() {
        Map<GenerationStage, Integer> weights = new EnumMap<>(StageWeightTable.defaults().asMap());
        weights.remove(GenerationStage.GENERATING_MUSIC);

        assertThatThrownBy(() -> StageWeightTable.of(weights))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("generating_music");
    }

    @Test
    void overallProgressIsWeightedAndFloored() {
        StageWeightTable table = StageWeightTable.defaults();
        Map<GenerationStage, Integer> progress = new EnumMap<>(GenerationStage.class);
        progress.put(GenerationStage.ANALYZING_PROMPT, 100);
        progress.put(GenerationStage.GENERATING_SCENES, 100);
        progress.put(GenerationStage.GENERATING_IMAGES, 50);

        // 5 + 10 + 12.5
        assertThat(table.overallProgress(progress)).isEqualTo(27);
    }
}

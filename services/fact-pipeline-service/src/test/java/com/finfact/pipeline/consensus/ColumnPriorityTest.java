package com.finfact.pipeline.consensus;

import static org.assertj.core.api.Assertions.assertThat;

import com.finfact.pipeline.config.PipelineProperties;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ColumnPriorityTest {

    private ColumnPriority priority;

    @BeforeEach
    void setUp() {
        PipelineProperties.Consensus settings = new PipelineProperties().getConsensus();
        priority = new ColumnPriority(settings.getCurrentPeriodLabels(), settings.getPriorPeriodLabels());
    }

    @Test
    void compositeLabelsAreMatchedBySegment() {
        assertThat(priority.rank("合并/本期金额")).isEqualTo(new ColumnPriority.Rank(4, 0));
        assertThat(priority.rank("母公司/期初余额")).isEqualTo(new ColumnPriority.Rank(0, 0));
    }

    @Test
    void currentBeatsYearsWhichBeatPositionsWhichBeatPrior() {
        List<String> labels = new ArrayList<>(List.of("期初余额", "col_2", "2022年", "附注", "本期", "col_1", "2023年12月31日"));

        labels.sort(priority.preferred());

        assertThat(labels).containsExactly("本期", "2023年12月31日", "2022年", "col_1", "col_2", "附注", "期初余额");
    }

    @Test
    void blankLabelIsUnknown() {
        assertThat(priority.rank(null).tier()).isEqualTo(1);
        assertThat(priority.rank(" ").tier()).isEqualTo(1);
    }
}

package com.gateprep.common.constants;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopicCodeTest {

    @Test
    void lookupIsCaseInsensitive() {
        assertThat(TopicCode.fromCode("steel")).contains(TopicCode.STEEL);
        assertThat(TopicCode.fromCode(" Hydro ")).contains(TopicCode.HYDRO);
        assertThat(TopicCode.displayNameOf("sm")).isEqualTo("Soil Mechanics");
    }

    @Test
    void unknownOrMissingCodesAreGeneral() {
        assertThat(TopicCode.fromCode("XYZ")).isEmpty();
        assertThat(TopicCode.displayNameOf(null)).isEqualTo(TopicCode.GENERAL);
        assertThat(TopicCode.displayNameOf("")).isEqualTo("General");
    }

    @Test
    void catalogueListsEveryTopicInOrder() {
        assertThat(TopicCode.catalogue())
            .hasSize(10)
            .containsEntry("RCC", "Reinforced Concrete Design");
        assertThat(List.copyOf(TopicCode.catalogue().keySet())).startsWith("SM", "FM", "SA");
        assertThatThrownBy(() -> TopicCode.catalogue().put("NEW", "New"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void contentKindAndDifficultyParsing() {
        assertThat(ContentKind.fromString("question")).isEqualTo(ContentKind.QUESTION);
        assertThat(ContentKind.fromString("LANGUAGE")).isEqualTo(ContentKind.LANGUAGE);
        assertThat(Difficulty.fromString("Hard")).isEqualTo(Difficulty.HARD);
        assertThatThrownBy(() -> ContentKind.fromString("poem")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Difficulty.fromString("extreme")).isInstanceOf(IllegalArgumentException.class);
    }
}

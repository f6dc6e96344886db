package com.liferx.brain.core;

import com.liferx.brain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NextActionSuggesterTest {

    private final NextActionSuggester suggester = new NextActionSuggester();

    @Test
    void suggest_searchAnswer_offersSearchFollowUps() {
        List<String> actions = suggester.suggest("I found 2 results about pricing.",
                List.of(Message.user("what did we decide on pricing?")));

        assertThat(actions).startsWith("Search for something else", "Save this information to my brain");
        assertThat(actions).hasSizeBetween(2, 4);
    }

    @Test
    void suggest_savedAnswer_offersSaveFollowUps() {
        List<String> actions = suggester.suggest("Saved the decision.",
                List.of(Message.user("please save this decision")));

        assertThat(actions).contains("View saved items", "Save another item");
        assertThat(actions).hasSize(4);
    }

    @Test
    void suggest_nothingMatches_returnsDefaults() {
        List<String> actions = suggester.suggest("Hello there.", List.of(Message.user("hi")));

        assertThat(actions).containsExactly(
                "Search my brain for related topics",
                "Save this as a new item",
                "Ask a follow-up question");
    }

    @Test
    void suggest_alwaysIncludesQuestionStyleActionWhenRoomAllows() {
        List<String> actions = suggester.suggest("Nothing here.",
                List.of(Message.user("find the onboarding SOP")));

        assertThat(actions).containsExactly(
                "Refine the search",
                "Search in a different category",
                "Ask me anything else");
    }

    @Test
    void suggest_usesLastUserMessage() {
        List<String> actions = suggester.suggest("Okay.", List.of(
                Message.user("search for pricing"),
                Message.builder().role(Message.Role.assistant).content("...").build(),
                Message.user("thanks")));

        assertThat(actions).doesNotContain("Refine the search");
    }
}

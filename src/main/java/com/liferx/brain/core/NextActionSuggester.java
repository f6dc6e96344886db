package com.liferx.brain.core;

import com.liferx.brain.model.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keyword rules that turn the final answer (and the user's last message)
 * into two to four follow-up suggestions.
 */
@Component
public class NextActionSuggester {

    public static final List<String> RETRY_ACTIONS = List.of("Try again", "Rephrase your question");

    private static final int MAX_ACTIONS = 4;

    public List<String> suggest(String content, List<Message> conversation) {
        String answer = content == null ? "" : content.toLowerCase();
        String lastUser = lastUserMessage(conversation);
        List<String> actions = new ArrayList<>();

        if (containsAny(answer, "found", "search", "result")) {
            actions.add("Search for something else");
            actions.add("Save this information to my brain");
        }
        if (containsAny(answer, "saved", "stored", "created")) {
            actions.add("View saved items");
            actions.add("Save another item");
        }
        if (containsAny(answer, "no results", "nothing found", "couldn't find")) {
            actions.add("Try a different search term");
            actions.add("Save this as new information");
        }
        if (containsAny(lastUser, "save", "store")) {
            actions.add("Confirm the item was saved correctly");
            actions.add("Add more details to this item");
        }
        if (containsAny(lastUser, "search", "find")) {
            actions.add("Refine the search");
            actions.add("Search in a different category");
        }

        if (actions.isEmpty()) {
            actions.add("Search my brain for related topics");
            actions.add("Save this as a new item");
            actions.add("Ask a follow-up question");
        }
        if (actions.stream().noneMatch(a -> a.toLowerCase().contains("question"))) {
            actions.add("Ask me anything else");
        }

        Set<String> unique = new LinkedHashSet<>(actions);
        return unique.stream().limit(MAX_ACTIONS).toList();
    }

    private static String lastUserMessage(List<Message> conversation) {
        if (conversation == null) return "";
        for (int i = conversation.size() - 1; i >= 0; i--) {
            Message m = conversation.get(i);
            if (m.getRole() == Message.Role.user && m.getContent() != null) {
                return m.getContent().toLowerCase();
            }
        }
        return "";
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) return true;
        }
        return false;
    }
}

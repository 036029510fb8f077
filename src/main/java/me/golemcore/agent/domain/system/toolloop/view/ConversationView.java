package me.golemcore.agent.domain.system.toolloop.view;

import me.golemcore.agent.domain.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Messages sent to the model in one step.
 *
 * <p>
 * Views are immutable; overrides produce a new view and never touch the
 * conversation they were built from.
 */
public record ConversationView(List<Message> messages) {

    public ConversationView {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static ConversationView ofMessages(List<Message> messages) {
        return new ConversationView(messages);
    }

    /**
     * Text of the leading system message, or null if there is none.
     */
    public String systemPrompt() {
        if (!messages.isEmpty() && messages.get(0).isSystemMessage()) {
            return messages.get(0).getText();
        }
        return null;
    }

    /**
     * Replaces the leading system message, or prepends one if there is none. An
     * empty prompt removes the system message.
     */
    public ConversationView withSystemPrompt(String system) {
        List<Message> result = new ArrayList<>(messages);
        boolean hasSystem = !result.isEmpty() && result.get(0).isSystemMessage();
        if (system.isEmpty()) {
            if (hasSystem) {
                result.remove(0);
            }
        } else if (hasSystem) {
            result.set(0, Message.system(system));
        } else {
            result.add(0, Message.system(system));
        }
        return new ConversationView(result);
    }

    public ConversationView append(List<Message> more) {
        List<Message> result = new ArrayList<>(messages);
        result.addAll(more);
        return new ConversationView(result);
    }
}

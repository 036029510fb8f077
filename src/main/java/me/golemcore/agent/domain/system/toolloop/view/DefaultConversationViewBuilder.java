package me.golemcore.agent.domain.system.toolloop.view;

import me.golemcore.agent.domain.exception.InvalidArgumentException;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.MessagePart;

import java.util.ArrayList;
import java.util.List;

/**
 * System message (when the prompt is set) + the caller's messages + a user
 * message with the prompt and attached files. Later steps append the response
 * messages of earlier ones.
 */
public class DefaultConversationViewBuilder implements ConversationViewBuilder {

    @Override
    public ConversationView buildInitialView(String systemPrompt, List<Message> messages, String prompt,
            List<MessagePart.FilePart> files) {
        if (prompt == null || prompt.isEmpty()) {
            throw new InvalidArgumentException("prompt", "prompt can't be empty");
        }

        List<Message> result = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            result.add(Message.system(systemPrompt));
        }
        if (messages != null) {
            result.addAll(messages);
        }
        result.add(Message.user(prompt, files));
        return ConversationView.ofMessages(result);
    }

    @Override
    public ConversationView buildStepView(ConversationView initial, List<Message> responseMessages) {
        return initial.append(responseMessages);
    }
}

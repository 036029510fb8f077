package me.golemcore.agent.domain.system.toolloop.view;

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.MessagePart;

import java.util.List;

/**
 * Builds the messages each step sends to the model.
 */
public interface ConversationViewBuilder {

    /**
     * Builds the input of the first step.
     *
     * @throws me.golemcore.agent.domain.exception.InvalidArgumentException
     *             if {@code prompt} is empty
     */
    ConversationView buildInitialView(String systemPrompt, List<Message> messages, String prompt,
            List<MessagePart.FilePart> files);

    /**
     * Builds the input of a later step from the first step's input and the
     * response messages of all completed steps.
     */
    ConversationView buildStepView(ConversationView initial, List<Message> responseMessages);
}

package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ResponseContent;

import java.util.List;

/**
 * Turns the content of a finished step into the messages that are sent back
 * to the model in the following steps.
 */
public interface ResponseMessageMapper {

    List<Message> toResponseMessages(ResponseContent content);
}

package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.Content;
import me.golemcore.agent.domain.model.FileContent;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.MessagePart;
import me.golemcore.agent.domain.model.ReasoningContent;
import me.golemcore.agent.domain.model.ResponseContent;
import me.golemcore.agent.domain.model.TextContent;
import me.golemcore.agent.domain.model.ToolCallContent;
import me.golemcore.agent.domain.model.ToolResultContent;

import java.util.ArrayList;
import java.util.List;

/**
 * One assistant message (text, reasoning, files, tool calls) followed by one
 * tool message (tool results). Sources are not sent back. Empty messages are
 * omitted.
 */
public class DefaultResponseMessageMapper implements ResponseMessageMapper {

    @Override
    public List<Message> toResponseMessages(ResponseContent content) {
        List<MessagePart> assistantParts = new ArrayList<>();
        List<MessagePart> toolParts = new ArrayList<>();

        for (Content item : content.items()) {
            if (item instanceof TextContent text) {
                assistantParts.add(new MessagePart.TextPart(text.getText(), text.getProviderMetadata()));
            } else if (item instanceof ReasoningContent reasoning) {
                assistantParts.add(new MessagePart.ReasoningPart(reasoning.getText(),
                        reasoning.getProviderMetadata()));
            } else if (item instanceof FileContent file) {
                assistantParts.add(new MessagePart.FilePart("", file.getData(), file.getMediaType(),
                        file.getProviderMetadata()));
            } else if (item instanceof ToolCallContent call) {
                assistantParts.add(new MessagePart.ToolCallPart(call.getToolCallId(), call.getToolName(),
                        call.getInput(), call.isProviderExecuted(), call.getProviderMetadata()));
            } else if (item instanceof ToolResultContent result) {
                toolParts.add(new MessagePart.ToolResultPart(result.getToolCallId(), result.getResult(),
                        result.getProviderMetadata()));
            }
        }

        List<Message> messages = new ArrayList<>();
        if (!assistantParts.isEmpty()) {
            messages.add(Message.assistant(assistantParts));
        }
        if (!toolParts.isEmpty()) {
            messages.add(Message.tool(toolParts));
        }
        return messages;
    }
}

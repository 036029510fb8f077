package me.golemcore.agent.domain.system.toolloop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.exception.ToolCallValidationException;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolCallContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Checks model-emitted tool calls against the offered tools and runs the
 * repair hook on failures.
 *
 * <p>
 * Checks, in order: the tool exists, the input is a JSON object, every required
 * property is present. A blank input is rejected like any other non-object.
 */
public class ToolCallValidator {

    private static final Logger log = LoggerFactory.getLogger(ToolCallValidator.class);

    private final ObjectMapper objectMapper;

    public ToolCallValidator() {
        this(new ObjectMapper());
    }

    public ToolCallValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ToolCallValidationException
     *             if the call does not match any tool's input contract
     */
    public void validate(ToolCallContent call, List<ToolComponent> tools) {
        ToolComponent tool = findTool(tools, call.getToolName());
        if (tool == null) {
            throw new ToolCallValidationException(call.getToolName(), "tool not found: " + call.getToolName());
        }

        String input = call.getInput();
        if (input == null || input.isBlank()) {
            throw new ToolCallValidationException(call.getToolName(), "invalid JSON input: empty input");
        }
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new ToolCallValidationException(call.getToolName(),
                    "invalid JSON input: " + e.getOriginalMessage(), e);
        }
        if (parsed == null || !parsed.isObject()) {
            throw new ToolCallValidationException(call.getToolName(), "invalid JSON input: not a JSON object");
        }

        List<String> required = tool.getInfo().getRequired();
        if (required != null) {
            for (String name : required) {
                if (!parsed.has(name)) {
                    throw new ToolCallValidationException(call.getToolName(),
                            "missing required parameter: " + name);
                }
            }
        }
    }

    /**
     * Validates {@code call}, trying {@code repair} when it fails.
     *
     * @return the call itself, the repaired call, or a copy flagged invalid
     *         with the validation error
     */
    public ToolCallContent validateAndRepair(AgentContext context, ToolCallContent call, List<ToolComponent> tools,
            String systemPrompt, List<Message> messages, RepairToolCallFunction repair) {
        ToolCallValidationException error;
        try {
            validate(call, tools);
            return call;
        } catch (ToolCallValidationException e) {
            error = e;
        }

        if (repair != null) {
            ToolCallContent repaired = repair.repair(context,
                    new ToolCallRepairOptions(call, error, List.copyOf(tools), systemPrompt, messages));
            if (repaired != null) {
                try {
                    validate(repaired, tools);
                    log.debug("[Tools] Repaired tool call {} ({})", call.getToolCallId(), call.getToolName());
                    return repaired.toBuilder().invalid(false).validationError(null).build();
                } catch (ToolCallValidationException e) {
                    log.debug("[Tools] Repaired tool call {} is still invalid: {}", call.getToolCallId(),
                            e.getMessage());
                }
            }
        }

        log.warn("[Tools] Invalid tool call {} ({}): {}", call.getToolCallId(), call.getToolName(),
                error.getMessage());
        return call.toBuilder().invalid(true).validationError(error.getMessage()).build();
    }

    static ToolComponent findTool(List<ToolComponent> tools, String name) {
        if (name == null) {
            return null;
        }
        for (ToolComponent tool : tools) {
            if (name.equals(tool.getToolName())) {
                return tool;
            }
        }
        return null;
    }
}

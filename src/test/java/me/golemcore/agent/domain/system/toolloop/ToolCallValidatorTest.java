package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.exception.ToolCallValidationException;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolCallContent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCallValidatorTest {

    private static final String TOOL_NAME = "weather";
    private static final String CALL_ID = "call-1";
    private static final String SYSTEM_PROMPT = "be brief";

    private ToolCallValidator validator;
    private List<ToolComponent> tools;
    private AgentContext context;

    @BeforeEach
    void setUp() {
        validator = new ToolCallValidator();
        tools = List.of(new RecordingTool(TOOL_NAME, "city"));
        context = AgentContext.create();
    }

    private static ToolCallContent call(String name, String input) {
        return ToolCallContent.builder().toolCallId(CALL_ID).toolName(name).input(input).build();
    }

    // ==================== validate ====================

    @Test
    void shouldAcceptCallWithRequiredParameters() {
        validator.validate(call(TOOL_NAME, "{\"city\":\"Paris\",\"unit\":\"C\"}"), tools);
    }

    @Test
    void shouldRejectUnknownTool() {
        ToolCallValidationException error = assertThrows(ToolCallValidationException.class,
                () -> validator.validate(call("missing", "{}"), tools));

        assertEquals("tool not found: missing", error.getMessage());
    }

    @Test
    void shouldRejectMalformedJson() {
        ToolCallValidationException error = assertThrows(ToolCallValidationException.class,
                () -> validator.validate(call(TOOL_NAME, "{\"city\":"), tools));

        assertTrue(error.getMessage().startsWith("invalid JSON input"));
    }

    @Test
    void shouldRejectNonObjectJson() {
        ToolCallValidationException error = assertThrows(ToolCallValidationException.class,
                () -> validator.validate(call(TOOL_NAME, "[1,2]"), tools));

        assertTrue(error.getMessage().startsWith("invalid JSON input"));
    }

    @Test
    void shouldRejectMissingRequiredParameter() {
        ToolCallValidationException error = assertThrows(ToolCallValidationException.class,
                () -> validator.validate(call(TOOL_NAME, "{\"unit\":\"C\"}"), tools));

        assertEquals("missing required parameter: city", error.getMessage());
    }

    @Test
    void shouldRejectBlankInputEvenWithoutRequiredParameters() {
        List<ToolComponent> noArgs = List.of(new RecordingTool("now"));

        ToolCallValidationException empty = assertThrows(ToolCallValidationException.class,
                () -> validator.validate(call("now", ""), noArgs));
        ToolCallValidationException whitespace = assertThrows(ToolCallValidationException.class,
                () -> validator.validate(call("now", "   "), noArgs));

        assertTrue(empty.getMessage().startsWith("invalid JSON input"));
        assertTrue(whitespace.getMessage().startsWith("invalid JSON input"));
    }

    @Test
    void shouldFlagBlankInputInvalidSoToolNeverRuns() {
        RecordingTool now = new RecordingTool("now");

        ToolCallContent result = validator.validateAndRepair(context, call("now", ""), List.of(now), SYSTEM_PROMPT,
                List.of(), null);

        assertTrue(result.isInvalid());
        assertTrue(result.getValidationError().startsWith("invalid JSON input"));
    }

    // ==================== validateAndRepair ====================

    @Test
    void shouldReturnValidCallUnchanged() {
        ToolCallContent original = call(TOOL_NAME, "{\"city\":\"Paris\"}");

        ToolCallContent result = validator.validateAndRepair(context, original, tools, SYSTEM_PROMPT, List.of(),
                null);

        assertSame(original, result);
        assertFalse(result.isInvalid());
    }

    @Test
    void shouldMarkInvalidWithoutRepairHook() {
        ToolCallContent result = validator.validateAndRepair(context, call(TOOL_NAME, "{}"), tools, SYSTEM_PROMPT,
                List.of(), null);

        assertTrue(result.isInvalid());
        assertEquals("missing required parameter: city", result.getValidationError());
        assertEquals("{}", result.getInput());
    }

    @Test
    void shouldUseRepairedCallWhenItValidates() {
        List<ToolCallRepairOptions> seen = new ArrayList<>();
        List<Message> messages = List.of(Message.user("what's the weather?"));

        ToolCallContent result = validator.validateAndRepair(context, call(TOOL_NAME, "{\"town\":\"Paris\"}"),
                tools, SYSTEM_PROMPT, messages, (ctx, options) -> {
                    seen.add(options);
                    return options.originalCall().toBuilder().input("{\"city\":\"Paris\"}").build();
                });

        assertFalse(result.isInvalid());
        assertNull(result.getValidationError());
        assertEquals("{\"city\":\"Paris\"}", result.getInput());
        assertEquals(1, seen.size());
        ToolCallRepairOptions options = seen.get(0);
        assertEquals("missing required parameter: city", options.validationError().getMessage());
        assertEquals(SYSTEM_PROMPT, options.systemPrompt());
        assertEquals(messages, options.messages());
        assertEquals(1, options.availableTools().size());
    }

    @Test
    void shouldMarkInvalidWhenRepairedCallStillFails() {
        ToolCallContent result = validator.validateAndRepair(context, call(TOOL_NAME, "{}"), tools, SYSTEM_PROMPT,
                List.of(), (ctx, options) -> call(TOOL_NAME, "{\"still\":\"wrong\"}"));

        assertTrue(result.isInvalid());
        assertEquals("missing required parameter: city", result.getValidationError());
        assertEquals("{}", result.getInput());
    }

    @Test
    void shouldMarkInvalidWhenRepairGivesUp() {
        ToolCallContent result = validator.validateAndRepair(context, call("missing", "{}"), tools, SYSTEM_PROMPT,
                List.of(), (ctx, options) -> null);

        assertTrue(result.isInvalid());
        assertEquals("tool not found: missing", result.getValidationError());
    }

    @Test
    void shouldPropagateRepairHookFailure() {
        IllegalStateException failure = new IllegalStateException("repair model down");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> validator.validateAndRepair(context, call(TOOL_NAME, "{}"), tools, SYSTEM_PROMPT, List.of(),
                        (ctx, options) -> {
                            throw failure;
                        }));

        assertSame(failure, thrown);
    }
}

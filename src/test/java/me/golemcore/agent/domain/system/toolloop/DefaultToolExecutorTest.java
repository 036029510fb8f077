package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.exception.AgentCancelledException;
import me.golemcore.agent.domain.exception.ToolExecutionException;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.ToolCall;
import me.golemcore.agent.domain.model.ToolCallContent;
import me.golemcore.agent.domain.model.ToolInfo;
import me.golemcore.agent.domain.model.ToolResponse;
import me.golemcore.agent.domain.model.ToolResultContent;
import me.golemcore.agent.domain.model.ToolResultOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultToolExecutorTest {

    private static final String ECHO = "echo";
    private static final String BROKEN = "broken";

    private DefaultToolExecutor executor;
    private AgentContext context;
    private RecordingTool echo;
    private RecordingTool broken;
    private List<ToolResultContent> notified;

    @BeforeEach
    void setUp() {
        executor = new DefaultToolExecutor(Duration.ofSeconds(5));
        context = AgentContext.create();
        echo = new RecordingTool(ECHO, "text").respondingWith(
                ToolResponse.text("echoed").withMetadata(Map.of("source", "test")));
        broken = new RecordingTool(BROKEN).failingWith(new IllegalStateException("disk on fire"));
        notified = new ArrayList<>();
    }

    private static ToolCallContent call(String id, String name, String input) {
        return ToolCallContent.builder().toolCallId(id).toolName(name).input(input).build();
    }

    @Test
    void shouldRunCallsInOrderAndNotifyEachResult() {
        List<ToolComponent> tools = List.of(echo);
        List<ToolCallContent> calls = List.of(call("c1", ECHO, "{\"text\":\"a\"}"),
                call("c2", ECHO, "{\"text\":\"b\"}"));

        List<ToolResultContent> results = executor.execute(context, tools, calls, notified::add);

        assertEquals(List.of("c1", "c2"), results.stream().map(ToolResultContent::getToolCallId).toList());
        assertEquals(List.of("{\"text\":\"a\"}", "{\"text\":\"b\"}"),
                echo.getCalls().stream().map(ToolCall::input).toList());
        assertEquals(results, notified);
        assertEquals(new ToolResultOutput.Text("echoed"), results.get(0).getResult());
        assertEquals("{\"source\":\"test\"}", results.get(0).getClientMetadata());
    }

    @Test
    void shouldAnswerInvalidCallWithoutRunningTool() {
        ToolCallContent invalid = call("c1", ECHO, "{}").toBuilder()
                .invalid(true)
                .validationError("missing required parameter: text")
                .build();

        List<ToolResultContent> results = executor.execute(context, List.of(echo), List.of(invalid), notified::add);

        assertTrue(echo.getCalls().isEmpty());
        assertEquals(new ToolResultOutput.Error("missing required parameter: text"), results.get(0).getResult());
        assertEquals(1, notified.size());
    }

    @Test
    void shouldKeepToolErrorResponseAsResult() {
        RecordingTool failing = new RecordingTool("lookup").respondingWith(ToolResponse.error("not found"));

        List<ToolResultContent> results = executor.execute(context, List.of(failing),
                List.of(call("c1", "lookup", "{}")), null);

        assertTrue(results.get(0).isError());
        assertEquals(new ToolResultOutput.Error("not found"), results.get(0).getResult());
    }

    @Test
    void shouldAbortOnExecutionFaultAfterNotifying() {
        List<ToolCallContent> calls = List.of(call("c1", BROKEN, "{}"), call("c2", ECHO, "{\"text\":\"a\"}"));

        ToolExecutionException error = assertThrows(ToolExecutionException.class,
                () -> executor.execute(context, List.of(broken, echo), calls, notified::add));

        assertEquals("c1", error.getToolCallId());
        assertEquals(BROKEN, error.getToolName());
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(echo.getCalls().isEmpty());
        assertEquals(1, notified.size());
        assertEquals(new ToolResultOutput.Error("disk on fire"), notified.get(0).getResult());
    }

    @Test
    void shouldTreatTimeoutAsExecutionFault() {
        ToolComponent slow = new ToolComponent() {
            @Override
            public ToolInfo getInfo() {
                return ToolInfo.builder().name("slow").build();
            }

            @Override
            public CompletableFuture<ToolResponse> execute(AgentContext ctx, ToolCall call) {
                return new CompletableFuture<>();
            }
        };
        DefaultToolExecutor impatient = new DefaultToolExecutor(Duration.ofMillis(20));

        assertThrows(ToolExecutionException.class,
                () -> impatient.execute(context, List.of(slow), List.of(call("c1", "slow", "{}")), null));
    }

    @Test
    void shouldPropagateListenerFailure() {
        IllegalArgumentException failure = new IllegalArgumentException("listener broke");

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> executor.execute(context, List.of(echo), List.of(call("c1", ECHO, "{\"text\":\"a\"}")),
                        result -> {
                            throw failure;
                        }));

        assertSame(failure, thrown);
    }

    @Test
    void shouldSkipProviderExecutedCalls() {
        ToolCallContent providerCall = call("c1", "web_search", "{}").toBuilder().providerExecuted(true).build();

        List<ToolResultContent> results = executor.execute(context, List.of(echo), List.of(providerCall), null);

        assertTrue(results.isEmpty());
    }

    @Test
    void shouldFailWhenContextCancelled() {
        context.cancel();

        assertThrows(AgentCancelledException.class, () -> executor.execute(context, List.of(echo),
                List.of(call("c1", ECHO, "{\"text\":\"a\"}")), null));
    }
}

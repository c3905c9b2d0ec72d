package dev.agentsdk.claude.hooks;

import dev.agentsdk.claude.exceptions.ControlProtocolException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HookDispatcherTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static HookCallback returning(Object output) {
        return (input, toolUseId, context) -> CompletableFuture.completedFuture(output);
    }

    @Test
    void buildConfigAssignsSequentialIdsAndTimeoutInSeconds() {
        Map<String, List<HookMatcher>> hooks = new LinkedHashMap<>();
        hooks.put("PreToolUse", List.of(
                new HookMatcher("Bash", List.of(returning(null), returning(null))),
                new HookMatcher("Write|Edit", List.of(returning(null)), Duration.ofMillis(1500))));
        hooks.put("Stop", List.of(new HookMatcher(null, List.of(returning(null)))));
        HookDispatcher dispatcher = new HookDispatcher(hooks, mapper);

        ObjectNode config = dispatcher.buildConfig();

        JsonNode preToolUse = config.path("PreToolUse");
        assertThat(preToolUse.get(0).path("hookCallbackIds").toString()).isEqualTo("[\"hook_0\",\"hook_1\"]");
        assertThat(preToolUse.get(0).has("timeout")).isFalse();
        assertThat(preToolUse.get(1).path("hookCallbackIds").get(0).asText()).isEqualTo("hook_2");
        assertThat(preToolUse.get(1).path("timeout").asDouble()).isEqualTo(1.5);
        assertThat(config.path("Stop").get(0).path("matcher").isNull()).isTrue();
        assertThat(dispatcher.hasCallback("hook_3")).isTrue();
        assertThat(dispatcher.buildConfig()).isSameAs(config);
    }

    @Test
    void buildConfigWithoutHooksIsNull() {
        assertThat(new HookDispatcher(null, mapper).buildConfig()).isNull();
        assertThat(new HookDispatcher(Map.of("Stop", List.of()), mapper).buildConfig()).isNull();
    }

    @Test
    void preToolUseInputIsTyped() {
        HookDispatcher dispatcher = new HookDispatcher(null, mapper);
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("hook_event_name", "PreToolUse");
        raw.put("session_id", "s1");
        raw.put("tool_name", "Bash");
        raw.put("tool_input", Map.of("command", "ls"));
        raw.put("future_field", 42);

        HookInput input = dispatcher.parseInput(raw);

        assertThat(input).isInstanceOf(PreToolUseHookInput.class);
        PreToolUseHookInput preToolUse = (PreToolUseHookInput) input;
        assertThat(preToolUse.getToolName()).isEqualTo("Bash");
        assertThat(preToolUse.getToolInput()).containsEntry("command", "ls");
        assertThat(preToolUse.getSessionId()).isEqualTo("s1");
        assertThat(preToolUse.getEvent()).isEqualTo(HookEvent.PRE_TOOL_USE);
        assertThat(preToolUse.getRawInput()).containsEntry("future_field", 42);
    }

    @Test
    void postToolUseFailureMapsInterruptFlag() {
        HookDispatcher dispatcher = new HookDispatcher(null, mapper);
        HookInput input = dispatcher.parseInput(Map.of(
                "hook_event_name", "PostToolUseFailure",
                "tool_name", "Bash",
                "error", "exit 1",
                "is_interrupt", true));

        assertThat(input).isInstanceOf(PostToolUseFailureHookInput.class);
        assertThat(((PostToolUseFailureHookInput) input).getInterrupt()).isTrue();
        assertThat(((PostToolUseFailureHookInput) input).getError()).isEqualTo("exit 1");
    }

    @Test
    void unknownEventKeepsBaseShape() {
        HookDispatcher dispatcher = new HookDispatcher(null, mapper);
        HookInput input = dispatcher.parseInput(Map.of("hook_event_name", "TimeTravel", "cwd", "/tmp", "x", 1));

        assertThat(input.getClass()).isEqualTo(HookInput.class);
        assertThat(input.getEvent()).isNull();
        assertThat(input.getCwd()).isEqualTo("/tmp");
        assertThat(input.getRawInput()).containsEntry("x", 1);
    }

    @Test
    void mapOutputKeysAreRenamedForTheWire() {
        HookDispatcher dispatcher = new HookDispatcher(null, mapper);
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("async_", true);
        output.put("async_timeout", 30);
        output.put("continue_", false);
        output.put("suppress_output", true);
        output.put("system_message", "careful");
        output.put("hook_specific_output", PreToolUseHookSpecificOutput.builder()
                .permissionDecision("deny")
                .permissionDecisionReason("dangerous")
                .build());
        output.put("decision", "block");

        Map<String, Object> wire = dispatcher.toWire(output);

        assertThat(wire).containsOnlyKeys("async", "asyncTimeout", "continue", "suppressOutput",
                "systemMessage", "hookSpecificOutput", "decision");
        assertThat(wire.get("continue")).isEqualTo(false);
        @SuppressWarnings("unchecked")
        Map<String, Object> specific = (Map<String, Object>) wire.get("hookSpecificOutput");
        assertThat(specific).containsEntry("hookEventName", "PreToolUse")
                .containsEntry("permissionDecision", "deny")
                .doesNotContainKey("updatedInput");
    }

    @Test
    void typedOutputUsesWireNames() {
        HookDispatcher dispatcher = new HookDispatcher(null, mapper);
        SyncHookOutput output = SyncHookOutput.builder()
                .continueExecution(false)
                .stopReason("done")
                .hookSpecificOutput(UserPromptSubmitHookSpecificOutput.builder()
                        .additionalContext("today is Monday")
                        .build())
                .build();

        Map<String, Object> wire = dispatcher.toWire(output);

        assertThat(wire).containsEntry("continue", false).containsEntry("stopReason", "done")
                .doesNotContainKey("decision");
        assertThat(wire.get("hookSpecificOutput").toString()).contains("today is Monday");
    }

    @Test
    void dispatchPassesToolUseIdAndSignal() throws Exception {
        AtomicReference<String> toolUseId = new AtomicReference<>();
        AtomicReference<AbortSignal> signal = new AtomicReference<>();
        HookCallback callback = (input, id, context) -> {
            toolUseId.set(id);
            signal.set(context.getSignal());
            return CompletableFuture.completedFuture(Map.of("continue_", true));
        };
        HookDispatcher dispatcher = new HookDispatcher(
                Map.of("PreToolUse", List.of(new HookMatcher(null, List.of(callback)))), mapper);
        dispatcher.buildConfig();
        AbortSignal requestSignal = new AbortSignal();

        Map<String, Object> result = dispatcher.dispatch(mapper.readTree(
                "{\"callback_id\":\"hook_0\",\"tool_use_id\":\"tu_9\",\"input\":{}}"), requestSignal);

        assertThat(result).containsEntry("continue", true);
        assertThat(toolUseId.get()).isEqualTo("tu_9");
        assertThat(signal.get()).isSameAs(requestSignal);
    }

    @Test
    void dispatchUnknownIdFails() {
        HookDispatcher dispatcher = new HookDispatcher(null, mapper);

        assertThatThrownBy(() -> dispatcher.dispatch(
                mapper.readTree("{\"callback_id\":\"hook_5\",\"input\":{}}"), new AbortSignal()))
                .isInstanceOf(ControlProtocolException.class)
                .hasMessage("No hook callback found for ID: hook_5");
    }
}

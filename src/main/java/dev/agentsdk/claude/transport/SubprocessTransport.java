package dev.agentsdk.claude.transport;

import dev.agentsdk.claude.exceptions.CLIConnectionException;
import dev.agentsdk.claude.exceptions.CLINotFoundException;
import dev.agentsdk.claude.exceptions.ProcessException;
import dev.agentsdk.claude.mcp.SdkMcpServer;
import dev.agentsdk.claude.types.options.AgentDefinition;
import dev.agentsdk.claude.types.options.ClaudeAgentOptions;
import dev.agentsdk.claude.types.options.SettingSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Subprocess-based transport implementation.
 * Manages Claude Code CLI process lifecycle and I/O streams.
 */
public class SubprocessTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(SubprocessTransport.class);

    public static final String SDK_VERSION = "0.1.0";
    private static final String MINIMUM_CLAUDE_CODE_VERSION = "2.0.0";
    private static final Pattern SEMVER = Pattern.compile("([0-9]+\\.[0-9]+\\.[0-9]+)");
    private static final int WINDOWS_CMD_LIMIT = 8000;
    private static final int DEFAULT_CMD_LIMIT = 100000;
    private static final int STDERR_TAIL_LINES = 50;

    @Nullable
    private final String prompt;
    private final boolean streamingMode;
    private final ClaudeAgentOptions options;
    private final String cliPath;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final int maxBufferSize;
    private final ExecutorService executor;
    private final List<Path> tempFiles = new ArrayList<>();
    private final Deque<String> stderrTail = new ArrayDeque<>();
    @Nullable
    private final Consumer<String> stderrConsumer;
    private final Object writeLock = new Object();

    private Process process;
    private BufferedReader stdoutReader;
    private BufferedWriter stdinWriter;
    private BufferedReader stderrReader;
    private volatile boolean ready;

    /**
     * One-shot transport: the prompt is passed on the command line and stdin is closed.
     */
    public SubprocessTransport(String prompt, ClaudeAgentOptions options) {
        this(prompt, options, false);
    }

    /**
     * Transport whose input is written as stream-json messages.
     */
    public SubprocessTransport(ClaudeAgentOptions options) {
        this(null, options, true);
    }

    private SubprocessTransport(@Nullable String prompt, ClaudeAgentOptions options, boolean streamingMode) {
        this.prompt = prompt;
        this.streamingMode = streamingMode;
        this.options = options;
        this.cliPath = options.getCliPath() != null ? options.getCliPath().toString() : CLIFinder.findCLI();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "claude-cli-io");
            thread.setDaemon(true);
            return thread;
        });
        this.maxBufferSize = options.getMaxBufferSize() != null && options.getMaxBufferSize() > 0
                ? options.getMaxBufferSize()
                : JsonLineDecoder.DEFAULT_MAX_BUFFER_SIZE;
        this.stderrConsumer = options.getStderr();
    }

    @Override
    public CompletableFuture<Void> connect() {
        return CompletableFuture.runAsync(() -> {
            if (options.getCwd() != null && !Files.isDirectory(options.getCwd())) {
                throw new CLIConnectionException("Working directory does not exist: " + options.getCwd());
            }
            if (!shouldSkipVersionCheck()) {
                checkCliVersion();
            }

            List<String> command = buildCommand();
            ProcessBuilder pb = new ProcessBuilder(command);

            Map<String, String> env = pb.environment();
            env.putAll(options.getEnv());
            env.put("CLAUDE_CODE_ENTRYPOINT", options.getEntrypoint());
            env.put("CLAUDE_AGENT_SDK_VERSION", SDK_VERSION);
            if (options.isEnableFileCheckpointing()) {
                env.put("CLAUDE_CODE_ENABLE_SDK_FILE_CHECKPOINTING", "true");
            }
            if (options.getCwd() != null) {
                pb.directory(options.getCwd().toFile());
                env.put("PWD", options.getCwd().toString());
            }

            pb.redirectInput(ProcessBuilder.Redirect.PIPE);
            pb.redirectOutput(ProcessBuilder.Redirect.PIPE);
            pb.redirectError(ProcessBuilder.Redirect.PIPE);

            try {
                logger.debug("Starting Claude Code CLI: {}", String.join(" ", command));
                process = pb.start();
            } catch (IOException e) {
                cleanupTempFiles();
                if (!Files.exists(Path.of(cliPath))) {
                    throw new CLINotFoundException("Claude Code not found at", cliPath, e);
                }
                throw new CLIConnectionException("Failed to start Claude Code: " + e.getMessage(), e);
            }

            stdoutReader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
            stdinWriter = new BufferedWriter(
                    new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
            stderrReader = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8));

            executor.submit(this::readStderr);

            if (!streamingMode) {
                closeStdin();
            }

            ready = true;
            logger.debug("Claude Code CLI started");
        }, executor);
    }

    @Override
    public CompletableFuture<Void> write(String line) {
        synchronized (writeLock) {
            if (!ready || stdinWriter == null) {
                return CompletableFuture.failedFuture(
                        new CLIConnectionException("Transport is not ready for writing"));
            }
            if (!process.isAlive()) {
                return CompletableFuture.failedFuture(
                        new CLIConnectionException("Cannot write to terminated process (exit code: "
                                + process.exitValue() + ")"));
            }
            try {
                stdinWriter.write(line);
                stdinWriter.newLine();
                stdinWriter.flush();
                return CompletableFuture.completedFuture(null);
            } catch (IOException e) {
                ready = false;
                return CompletableFuture.failedFuture(
                        new CLIConnectionException("Failed to write to process stdin", e));
            }
        }
    }

    /**
     * Decoded stdout messages. After stdout ends the process exit code is checked,
     * and a non-zero code is raised as {@link ProcessException}.
     */
    @Override
    public Stream<JsonNode> readMessages() {
        if (process == null || stdoutReader == null) {
            throw new CLIConnectionException("Not connected");
        }
        Iterator<JsonNode> iterator = new MessageIterator(new JsonLineDecoder(objectMapper, maxBufferSize));
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public CompletableFuture<Void> endInput() {
        closeStdin();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void close() {
        ready = false;
        closeStdin();
        try {
            if (stdoutReader != null) {
                stdoutReader.close();
            }
            if (stderrReader != null) {
                stderrReader.close();
            }
        } catch (IOException e) {
            logger.warn("Error closing streams", e);
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }

        executor.shutdownNow();
        cleanupTempFiles();
    }

    /**
     * Build CLI command with all arguments.
     */
    List<String> buildCommand() {
        List<String> cmd = new ArrayList<>();
        cmd.add(cliPath);
        cmd.add("--output-format");
        cmd.add("stream-json");
        cmd.add("--verbose");

        cmd.add("--system-prompt");
        cmd.add(options.getSystemPrompt() != null ? options.getSystemPrompt() : "");

        if (!options.getAllowedTools().isEmpty()) {
            cmd.add("--allowedTools");
            cmd.add(String.join(",", options.getAllowedTools()));
        }
        if (options.getMaxTurns() != null) {
            cmd.add("--max-turns");
            cmd.add(options.getMaxTurns().toString());
        }
        if (!options.getDisallowedTools().isEmpty()) {
            cmd.add("--disallowedTools");
            cmd.add(String.join(",", options.getDisallowedTools()));
        }
        if (options.getModel() != null) {
            cmd.add("--model");
            cmd.add(options.getModel());
        }
        if (options.getFallbackModel() != null) {
            cmd.add("--fallback-model");
            cmd.add(options.getFallbackModel());
        }
        if (options.getPermissionPromptToolName() != null) {
            cmd.add("--permission-prompt-tool");
            cmd.add(options.getPermissionPromptToolName());
        }
        if (options.getPermissionMode() != null) {
            cmd.add("--permission-mode");
            cmd.add(options.getPermissionMode().getValue());
        }
        if (options.isContinueConversation()) {
            cmd.add("--continue");
        }
        if (options.getResume() != null) {
            cmd.add("--resume");
            cmd.add(options.getResume());
        }
        if (options.getSettings() != null) {
            cmd.add("--settings");
            cmd.add(options.getSettings());
        }
        if (options.getUser() != null) {
            cmd.add("--user");
            cmd.add(options.getUser());
        }
        if (options.getMaxBudgetUsd() != null) {
            cmd.add("--max-budget-usd");
            cmd.add(options.getMaxBudgetUsd().toString());
        }
        if (options.getMaxThinkingTokens() != null) {
            cmd.add("--max-thinking-tokens");
            cmd.add(options.getMaxThinkingTokens().toString());
        }
        if (options.isEnableFileCheckpointing()) {
            cmd.add("--enable-file-checkpointing");
        }
        for (Path dir : options.getAddDirs()) {
            cmd.add("--add-dir");
            cmd.add(dir.toString());
        }

        Map<String, Object> servers = sanitizeMcpServers(options.getMcpServers());
        if (!servers.isEmpty()) {
            cmd.add("--mcp-config");
            cmd.add(toJson(Collections.singletonMap("mcpServers", servers), "MCP config"));
        }

        if (options.isIncludePartialMessages()) {
            cmd.add("--include-partial-messages");
        }
        if (options.isForkSession()) {
            cmd.add("--fork-session");
        }

        String agentsJson = null;
        if (!options.getAgents().isEmpty()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            for (Map.Entry<String, AgentDefinition> entry : options.getAgents().entrySet()) {
                AgentDefinition definition = entry.getValue();
                payload.put(entry.getKey(), definition != null ? definition.toMap() : Collections.emptyMap());
            }
            agentsJson = toJson(payload, "agents");
            cmd.add("--agents");
            cmd.add(agentsJson);
        }

        cmd.add("--setting-sources");
        cmd.add(options.getSettingSources().stream()
                .map(SettingSource::getValue)
                .collect(Collectors.joining(",")));

        for (Map.Entry<String, String> entry : options.getExtraArgs().entrySet()) {
            cmd.add("--" + entry.getKey());
            if (entry.getValue() != null) {
                cmd.add(entry.getValue());
            }
        }

        if (streamingMode) {
            cmd.add("--input-format");
            cmd.add("stream-json");
        } else {
            cmd.add("--print");
            cmd.add("--");
            cmd.add(prompt != null ? prompt : "");
        }

        maybeExternalizeAgents(cmd, agentsJson);
        return cmd;
    }

    private final class MessageIterator implements Iterator<JsonNode> {

        private final JsonLineDecoder decoder;
        private final Deque<JsonNode> decoded = new ArrayDeque<>();
        private boolean exhausted;

        private MessageIterator(JsonLineDecoder decoder) {
            this.decoder = decoder;
        }

        @Override
        public boolean hasNext() {
            while (decoded.isEmpty() && !exhausted) {
                String line = readLine();
                if (line == null) {
                    exhausted = true;
                    checkExitStatus();
                } else {
                    decoded.addAll(decoder.decode(line));
                }
            }
            return !decoded.isEmpty();
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return decoded.poll();
        }

        @Nullable
        private String readLine() {
            try {
                return stdoutReader.readLine();
            } catch (IOException e) {
                if (!ready) {
                    return null;
                }
                throw new UncheckedIOException("Failed to read CLI output", e);
            }
        }
    }

    private void checkExitStatus() {
        if (!ready || process == null) {
            return;
        }
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (exitCode != 0) {
            String stderr;
            synchronized (stderrTail) {
                stderr = stderrTail.isEmpty() ? "Check stderr output for details" : String.join("\n", stderrTail);
            }
            throw new ProcessException("Command failed", exitCode, stderr);
        }
    }

    private void readStderr() {
        try {
            String line;
            while ((line = stderrReader.readLine()) != null) {
                if (line.isEmpty()) {
                    continue;
                }
                synchronized (stderrTail) {
                    if (stderrTail.size() == STDERR_TAIL_LINES) {
                        stderrTail.removeFirst();
                    }
                    stderrTail.addLast(line);
                }
                if (stderrConsumer != null) {
                    stderrConsumer.accept(line);
                } else {
                    logger.debug("CLI stderr: {}", line);
                }
            }
        } catch (IOException e) {
            if (ready) {
                logger.error("Error reading stderr", e);
            }
        }
    }

    private void closeStdin() {
        synchronized (writeLock) {
            if (stdinWriter == null) {
                return;
            }
            try {
                stdinWriter.close();
            } catch (IOException e) {
                logger.warn("Error closing stdin", e);
            } finally {
                stdinWriter = null;
            }
        }
    }

    static Map<String, Object> sanitizeMcpServers(Map<String, Object> servers) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : servers.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof SdkMcpServer) {
                sanitized.put(entry.getKey(), ((SdkMcpServer) value).toCliConfig());
            } else if (value instanceof Map<?, ?>) {
                Map<String, Object> normalized = new LinkedHashMap<>();
                for (Map.Entry<?, ?> inner : ((Map<?, ?>) value).entrySet()) {
                    if (inner.getKey() instanceof String && !"instance".equals(inner.getKey())) {
                        normalized.put((String) inner.getKey(), inner.getValue());
                    }
                }
                sanitized.put(entry.getKey(), normalized);
            } else if (value != null) {
                sanitized.put(entry.getKey(), value);
            }
        }
        return sanitized;
    }

    private String toJson(Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CLIConnectionException("Failed to serialize " + what, e);
        }
    }

    private boolean shouldSkipVersionCheck() {
        String value = System.getenv("CLAUDE_AGENT_SDK_SKIP_VERSION_CHECK");
        if (value == null) {
            return false;
        }
        return "1".equals(value) || Boolean.parseBoolean(value);
    }

    private void checkCliVersion() {
        Process versionProcess = null;
        try {
            versionProcess = new ProcessBuilder(cliPath, "-v")
                    .redirectErrorStream(true)
                    .start();
            if (!versionProcess.waitFor(2, TimeUnit.SECONDS)) {
                return;
            }
            String output = new String(versionProcess.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            String version = extractSemanticVersion(output);
            if (version != null && compareVersions(version, MINIMUM_CLAUDE_CODE_VERSION) < 0) {
                logger.warn("Claude Code version {} is below the minimum supported version {}. "
                        + "Some features may not work.", version, MINIMUM_CLAUDE_CODE_VERSION);
            }
        } catch (IOException e) {
            logger.debug("Failed to check Claude CLI version", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (versionProcess != null) {
                versionProcess.destroy();
            }
        }
    }

    @Nullable
    static String extractSemanticVersion(@Nullable String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = SEMVER.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    static int compareVersions(String v1, String v2) {
        String[] left = v1.split("\\.");
        String[] right = v2.split("\\.");
        for (int i = 0; i < Math.min(left.length, right.length); i++) {
            int a = Integer.parseInt(left[i]);
            int b = Integer.parseInt(right[i]);
            if (a != b) {
                return Integer.compare(a, b);
            }
        }
        return Integer.compare(left.length, right.length);
    }

    private void maybeExternalizeAgents(List<String> cmd, @Nullable String agentsJson) {
        if (agentsJson == null || String.join(" ", cmd).length() <= commandLengthLimit()) {
            return;
        }
        try {
            Path temp = Files.createTempFile("claude-agents-", ".json");
            Files.writeString(temp, agentsJson, StandardCharsets.UTF_8);
            tempFiles.add(temp);
            int idx = cmd.indexOf("--agents");
            cmd.set(idx + 1, "@" + temp);
            logger.info("Command length exceeded limit ({}). Using temp file for --agents: {}",
                    commandLengthLimit(), temp);
        } catch (IOException e) {
            logger.warn("Failed to externalize agents configuration", e);
        }
    }

    private int commandLengthLimit() {
        return System.getProperty("os.name").toLowerCase().contains("win") ? WINDOWS_CMD_LIMIT : DEFAULT_CMD_LIMIT;
    }

    private void cleanupTempFiles() {
        for (Path tempFile : tempFiles) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException e) {
                logger.debug("Failed to delete temp file {}", tempFile, e);
            }
        }
        tempFiles.clear();
    }
}

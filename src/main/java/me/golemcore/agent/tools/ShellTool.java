/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.agent.tools;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ConfirmationRequirer;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ApprovalMode;
import me.golemcore.agent.domain.model.ConfirmDetails;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.Allowlist;
import me.golemcore.agent.domain.tool.ToolExecutionContext;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Runs a shell command inside the workspace via {@code /bin/sh -c}.
 *
 * <p>
 * Security:
 * <ul>
 * <li>Working directory sandboxed to workspace
 * <li>Blocked commands: rm -rf /, sudo, mkfs, shutdown, etc.
 * <li>Environment reduced to a small safe set
 * <li>Timeout (default from {@code agent.tools.shell-timeout-seconds}, max 300s)
 * </ul>
 *
 * <p>
 * Every call needs an EXEC confirmation unless the approval mode is YOLO or the
 * command's root program (e.g. {@code git} for {@code git status}) was allowed
 * always earlier in the session.
 */
@Component
@Slf4j
public class ShellTool implements ToolComponent, ConfirmationRequirer {

    static final String NAME = "Shell";
    private static final String PARAM_COMMAND = "command";
    private static final int MAX_TIMEOUT_SECONDS = 300;

    private static final Set<String> BLOCKED_COMMANDS = Set.of(
            "rm -rf /", "rm -rf /*", "mkfs", "dd if=/dev", ":(){ :|:& };:",
            "shutdown", "reboot", "halt", "poweroff", "sudo ", "su -");

    private static final List<Pattern> BLOCKED_PATTERNS = List.of(
            Pattern.compile(">(\\s*)/dev/sd"),
            Pattern.compile("curl.*\\|.*sh"),
            Pattern.compile("wget.*\\|.*sh"),
            Pattern.compile("/etc/shadow"));

    // Control operators, redirections and substitutions chain further programs
    private static final Pattern COMPOUND_SYNTAX = Pattern.compile("[;&|`<>\\n\\r]|\\$\\(");

    private static final Set<String> ALLOWED_ENV_VARS = Set.of(
            "PATH", "LANG", "LC_ALL", "LC_CTYPE", "TERM", "TMPDIR", "TZ", "SHELL", "USER", "LOGNAME");

    private final Workspace workspace;
    private final ProcessRunner processRunner;
    private final AgentProperties.ToolsProperties config;

    public ShellTool(Workspace workspace, ProcessRunner processRunner, AgentProperties properties) {
        this.workspace = workspace;
        this.processRunner = processRunner;
        this.config = properties.getTools();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Execute a shell command in the workspace directory.
                        Use for running scripts, builds, tests or git commands.
                        Commands run with timeout protection. Dangerous system commands are blocked.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_COMMAND, ToolArguments.property("string", "Shell command to execute"),
                                "timeout", ToolArguments.property("integer", "Timeout in seconds (max 300)"),
                                "workdir", ToolArguments.property("string",
                                        "Working directory relative to workspace (optional)")),
                        "required", List.of(PARAM_COMMAND)))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return config.isShellEnabled();
    }

    @Override
    public String getCategory() {
        return "exec";
    }

    @Override
    public Optional<ConfirmDetails> shouldConfirmExecute(Map<String, Object> parameters, ApprovalMode mode,
            ToolExecutionContext context, Allowlist allowlist) {
        if (mode == ApprovalMode.YOLO) {
            return Optional.empty();
        }
        String command = ToolArguments.string(parameters, PARAM_COMMAND);
        String key = allowlistKey(command);
        if (key != null && allowlist.has(key)) {
            log.debug("[Shell] '{}' allowed by allowlist", key);
            return Optional.empty();
        }
        return Optional.of(ConfirmDetails.exec("Run shell command", command, key));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> run(parameters, context));
    }

    private ToolResult run(Map<String, Object> parameters, ToolExecutionContext context) {
        String command = ToolArguments.string(parameters, PARAM_COMMAND);
        if (command == null || command.isBlank()) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Missing required parameter: command");
        }
        if (isBlocked(command)) {
            log.warn("[Shell] Blocked command: {}", command);
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Command blocked for security reasons");
        }

        int timeout = Math.max(1, Math.min(
                ToolArguments.integer(parameters, "timeout", config.getShellTimeoutSeconds()), MAX_TIMEOUT_SECONDS));

        String workdirStr = ToolArguments.string(parameters, "workdir");
        Optional<Path> workDir = workspace.resolve(workdirStr);
        if (workDir.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Working directory must be within workspace");
        }
        if (!Files.isDirectory(workDir.get())) {
            return ToolResult.failure("Working directory does not exist: " + workdirStr);
        }

        log.info("[Shell] Executing: {}", command);
        long start = System.currentTimeMillis();
        ProcessRunner.ProcessOutcome outcome;
        try {
            outcome = processRunner.run(List.of("/bin/sh", "-c", command), workDir.get(), environment(workDir.get()),
                    timeout, config.getMaxOutputChars(), context.getSignal());
        } catch (IOException e) {
            return ToolResult.failure("Failed to execute command: " + e.getMessage());
        }
        long duration = System.currentTimeMillis() - start;

        String output = outcome.output();
        if (outcome.truncated()) {
            output = output + "[Output truncated...]\n";
        }

        return switch (outcome.status()) {
        case CANCELLED -> ToolResult.failure(ToolFailureKind.CANCELLED, "Command cancelled");
        case TIMED_OUT -> ToolResult.failure("Command timed out after " + timeout + " seconds");
        case EXITED -> {
            Map<String, Object> data = Map.of(
                    "exitCode", outcome.exitCode(),
                    "duration", duration,
                    PARAM_COMMAND, command);
            if (outcome.exitCode() == 0) {
                yield ToolResult.success(output.isEmpty() ? "(no output)" : output, data);
            }
            yield ToolResult.builder()
                    .success(false)
                    .output(output)
                    .data(data)
                    .error("Command failed with exit code " + outcome.exitCode() + "\n" + output)
                    .failureKind(ToolFailureKind.EXECUTION_FAILED)
                    .build();
        }
        };
    }

    /**
     * Allowlist key for the command's root program. Null for an empty command
     * and for compound commands, which are always confirmed. Leading
     * {@code VAR=value} assignments and directories are skipped.
     */
    static String allowlistKey(String command) {
        if (isCompound(command)) {
            return null;
        }
        String root = commandRoot(command);
        return root != null ? "shell:" + root : null;
    }

    static String commandRoot(String command) {
        if (command == null) {
            return null;
        }
        for (String token : command.trim().split("\\s+")) {
            if (token.isEmpty() || token.matches("[A-Za-z_][A-Za-z0-9_]*=.*")) {
                continue;
            }
            int slash = token.lastIndexOf('/');
            String root = (slash >= 0 ? token.substring(slash + 1) : token).replaceAll("[;,&|]+$", "");
            return root.isEmpty() ? null : root;
        }
        return null;
    }

    static boolean isCompound(String command) {
        return command != null && COMPOUND_SYNTAX.matcher(command).find();
    }

    private static boolean isBlocked(String command) {
        String normalized = command.toLowerCase(Locale.ROOT).trim();
        for (String blocked : BLOCKED_COMMANDS) {
            if (normalized.contains(blocked)) {
                return true;
            }
        }
        for (Pattern pattern : BLOCKED_PATTERNS) {
            if (pattern.matcher(command).find()) {
                return true;
            }
        }
        return false;
    }

    private Map<String, String> environment(Path workDir) {
        Map<String, String> env = new HashMap<>();
        for (Map.Entry<String, String> entry : System.getenv().entrySet()) {
            if (ALLOWED_ENV_VARS.contains(entry.getKey())) {
                env.put(entry.getKey(), entry.getValue());
            }
        }
        env.put("HOME", workspace.getRoot().toString());
        env.put("PWD", workDir.toString());
        return env;
    }
}

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

package me.golemcore.agent.domain.tool;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ConfirmationRequirer;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.context.ToolOutputSummarizer;
import me.golemcore.agent.domain.exception.OperationCancelledException;
import me.golemcore.agent.domain.execution.ExecutionStreamManager;
import me.golemcore.agent.domain.model.ApprovalMode;
import me.golemcore.agent.domain.model.ConfirmDetails;
import me.golemcore.agent.domain.model.ConfirmOutcome;
import me.golemcore.agent.domain.model.SchedulerToolCallRecord;
import me.golemcore.agent.domain.model.ToolCallRequest;
import me.golemcore.agent.domain.model.ToolCallStatus;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.port.outbound.ConfirmationPort;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives each tool call through
 * {@code validating -> [awaiting_approval] -> scheduled -> executing -> success | error | cancelled}
 * and emits the matching execution events.
 *
 * <p>
 * A batch runs in parallel only when it has more than one call and every target
 * tool is read-only; otherwise all calls run serially in request order with a
 * fixed delay between them. In a parallel batch every {@code tool:validating}
 * event is emitted before any call starts executing.
 *
 * <p>
 * Calls that need approval block on the {@link ConfirmationPort}. Without a
 * port the call is cancelled, never executed unconfirmed.
 */
@Slf4j
public class ToolScheduler {

    static final String USER_CANCELLED = "User cancelled";
    static final String NO_CONFIRMATION_HANDLER = "Confirmation required but no confirmation handler is available";
    static final String ABORTED = "Execution aborted";
    private static final int PARAMS_SUMMARY_MAX = 120;
    private static final int RESULT_PREVIEW_MAX = 200;

    private final String sessionId;
    private final ToolRegistry registry;
    private final Allowlist allowlist;
    private final ConfirmationPort confirmationPort;
    private final ExecutionStreamManager stream;
    private final ToolOutputSummarizer outputSummarizer;
    private final ArgumentParser argumentParser;
    private final Executor parallelExecutor;
    private final SchedulerSettings settings;
    private final Clock clock;

    private volatile ApprovalMode approvalMode;
    private final Map<String, SchedulerToolCallRecord> records = new LinkedHashMap<>();

    public ToolScheduler(String sessionId, ToolRegistry registry, Allowlist allowlist,
            ConfirmationPort confirmationPort, ExecutionStreamManager stream, ToolOutputSummarizer outputSummarizer,
            ArgumentParser argumentParser, Executor parallelExecutor, SchedulerSettings settings, Clock clock) {
        this.sessionId = sessionId;
        this.registry = registry;
        this.allowlist = allowlist;
        this.confirmationPort = confirmationPort;
        this.stream = stream;
        this.outputSummarizer = outputSummarizer;
        this.argumentParser = argumentParser;
        this.parallelExecutor = parallelExecutor;
        this.settings = settings;
        this.clock = clock;
        this.approvalMode = settings.approvalMode() != null ? settings.approvalMode() : ApprovalMode.DEFAULT;
    }

    // ==================== SCHEDULING ====================

    /**
     * Runs one call to a terminal state.
     */
    public SchedulerToolCallRecord schedule(ToolCallRequest request, CancellationSignal signal) {
        return run(prepare(request), signal);
    }

    /**
     * Runs all calls requested in one model turn. Only the first call carries
     * {@code thinkingContent}.
     *
     * @return one terminal record per request, in request order
     */
    public List<SchedulerToolCallRecord> scheduleBatch(List<ToolCallRequest> requests, String thinkingContent,
            CancellationSignal signal) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }

        List<ToolCallRequest> batch = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            batch.add(requests.get(i).toBuilder().thinkingContent(i == 0 ? thinkingContent : null).build());
        }

        if (canRunInParallel(batch)) {
            log.debug("[Scheduler] Running {} read-only calls in parallel", batch.size());
            return runParallel(batch, signal);
        }
        log.debug("[Scheduler] Running {} calls serially", batch.size());
        return runSerial(batch, signal);
    }

    boolean canRunInParallel(List<ToolCallRequest> batch) {
        if (batch.size() <= 1) {
            return false;
        }
        for (ToolCallRequest request : batch) {
            if (!registry.isReadOnly(sanitizeToolName(request.getToolName()))) {
                return false;
            }
        }
        return true;
    }

    private List<SchedulerToolCallRecord> runSerial(List<ToolCallRequest> batch, CancellationSignal signal) {
        List<SchedulerToolCallRecord> results = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            if (i > 0 && !signal.isCancelled()) {
                pause(signal);
            }
            results.add(schedule(batch.get(i), signal));
        }
        return results;
    }

    private List<SchedulerToolCallRecord> runParallel(List<ToolCallRequest> batch, CancellationSignal signal) {
        List<PreparedCall> prepared = new ArrayList<>(batch.size());
        for (ToolCallRequest request : batch) {
            prepared.add(prepare(request));
        }

        List<CompletableFuture<SchedulerToolCallRecord>> futures = new ArrayList<>(prepared.size());
        for (PreparedCall call : prepared) {
            futures.add(CompletableFuture.supplyAsync(() -> run(call, signal), parallelExecutor));
        }

        List<SchedulerToolCallRecord> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            SchedulerToolCallRecord callRecord = prepared.get(i).callRecord();
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                signal.cancel("Interrupted");
                cancel(callRecord, ABORTED, ToolFailureKind.CANCELLED);
                results.add(callRecord);
            } catch (ExecutionException e) {
                log.error("[Scheduler] Parallel call {} failed unexpectedly", callRecord.getCallId(), e);
                fail(callRecord, "Tool execution failed: " + safeCauseMessage(e), ToolFailureKind.EXECUTION_FAILED,
                        true);
                results.add(callRecord);
            }
        }
        return results;
    }

    private void pause(CancellationSignal signal) {
        try {
            signal.sleep(settings.serialDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            signal.cancel("Interrupted");
        }
    }

    // ==================== LIFECYCLE ====================

    /**
     * Creates the record, parses arguments and emits {@code tool:validating}.
     */
    private PreparedCall prepare(ToolCallRequest request) {
        SchedulerToolCallRecord callRecord = new SchedulerToolCallRecord(request, clock.instant());
        synchronized (records) {
            records.put(request.getCallId(), callRecord);
        }

        Map<String, Object> arguments = null;
        String parseError = null;
        try {
            arguments = request.getArguments() != null
                    ? argumentParser.deepParseMap(request.getArguments())
                    : argumentParser.parse(request.getRawArguments());
        } catch (IllegalArgumentException e) {
            parseError = e.getMessage();
        }

        String toolName = sanitizeToolName(request.getToolName());
        Optional<ToolComponent> tool = registry.get(toolName);
        String category = request.getCategory() != null ? request.getCategory()
                : tool.map(ToolComponent::getCategory).orElse("unknown");
        String paramsSummary = request.getParamsSummary() != null ? request.getParamsSummary()
                : summarizeParams(arguments, request.getRawArguments());

        stream.toolValidating(request.getCallId(), request.getToolName(), category, paramsSummary,
                request.getThinkingContent());

        if (parseError != null) {
            log.warn("[Scheduler] Invalid arguments for {} ({}): {}", request.getToolName(), request.getCallId(),
                    parseError);
            fail(callRecord, parseError, ToolFailureKind.INVALID_ARGUMENTS, false);
        }
        return new PreparedCall(callRecord, tool.orElse(null), arguments);
    }

    private SchedulerToolCallRecord run(PreparedCall call, CancellationSignal signal) {
        SchedulerToolCallRecord callRecord = call.callRecord();
        if (callRecord.getStatus().isTerminal()) {
            return callRecord;
        }
        String toolName = callRecord.getToolName();
        if (call.tool() == null) {
            String available = String.join(", ", registry.getDefinitions().stream().map(d -> d.getName()).toList());
            fail(callRecord, "Unknown tool: " + toolName + ". Available tools: " + available,
                    ToolFailureKind.UNKNOWN_TOOL, false);
            return callRecord;
        }
        if (signal.isCancelled()) {
            cancel(callRecord, ABORTED, ToolFailureKind.CANCELLED);
            return callRecord;
        }

        ToolExecutionContext context = ToolExecutionContext.builder()
                .callId(callRecord.getCallId())
                .toolName(toolName)
                .sessionId(sessionId)
                .signal(signal)
                .progressReporter(progress -> stream.toolProgress(callRecord.getCallId(), toolName, progress))
                .build();

        try {
            if (!confirm(call, context, signal)) {
                return callRecord;
            }
            callRecord.setStatus(ToolCallStatus.SCHEDULED);
            execute(call, context, signal);
        } catch (RuntimeException e) {
            log.error("[Scheduler] Unexpected failure in {} ({}) with args {}", toolName, callRecord.getCallId(),
                    call.arguments(), e);
            fail(callRecord, "Tool execution failed: " + safeCauseMessage(e), ToolFailureKind.EXECUTION_FAILED, true);
        }
        return callRecord;
    }

    /**
     * @return false if the call ended (cancelled) during confirmation
     */
    private boolean confirm(PreparedCall call, ToolExecutionContext context, CancellationSignal signal) {
        SchedulerToolCallRecord callRecord = call.callRecord();
        Optional<ConfirmDetails> required = checkConfirmation(call.tool(), call.arguments(), context);
        if (required.isEmpty()) {
            return true;
        }

        ConfirmDetails details = required.get();
        callRecord.setConfirmDetails(details);
        callRecord.setStatus(ToolCallStatus.AWAITING_APPROVAL);
        stream.toolAwaitingApproval(callRecord.getCallId(), callRecord.getToolName(), details);

        if (confirmationPort == null || !confirmationPort.isAvailable()) {
            log.info("[Scheduler] {} needs confirmation but no handler is available, cancelling",
                    callRecord.getToolName());
            cancel(callRecord, NO_CONFIRMATION_HANDLER, ToolFailureKind.CONFIRMATION_DENIED);
            return false;
        }

        log.info("[Scheduler] Requesting confirmation for '{}': {}", callRecord.getToolName(), details.describe());
        ConfirmOutcome outcome;
        try {
            outcome = signal.await(
                    confirmationPort.requestConfirmation(callRecord.getCallId(), callRecord.getToolName(), details), 0,
                    TimeUnit.MILLISECONDS);
        } catch (OperationCancelledException e) {
            cancel(callRecord, ABORTED, ToolFailureKind.CANCELLED);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(callRecord, ABORTED, ToolFailureKind.CANCELLED);
            return false;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Scheduler] Confirmation request failed, denying: {}", safeCauseMessage(e));
            cancel(callRecord, "Confirmation failed: " + safeCauseMessage(e), ToolFailureKind.CONFIRMATION_DENIED);
            return false;
        }

        if (outcome == null || outcome == ConfirmOutcome.CANCEL) {
            cancel(callRecord, USER_CANCELLED, ToolFailureKind.CONFIRMATION_DENIED);
            notifyConfirmed(details, ConfirmOutcome.CANCEL);
            return false;
        }
        if (outcome == ConfirmOutcome.ALLOW_ALWAYS && details.getAllowlistKey() != null) {
            allowlist.add(details.getAllowlistKey());
            log.info("[Scheduler] Added '{}' to allowlist", details.getAllowlistKey());
        }
        notifyConfirmed(details, outcome);
        return true;
    }

    Optional<ConfirmDetails> checkConfirmation(ToolComponent tool, Map<String, Object> arguments,
            ToolExecutionContext context) {
        ApprovalMode mode = approvalMode;
        if (mode == ApprovalMode.YOLO) {
            return Optional.empty();
        }
        if (tool instanceof ConfirmationRequirer requirer) {
            Optional<ConfirmDetails> details = requirer.shouldConfirmExecute(arguments, mode, context, allowlist);
            return details != null ? details : Optional.empty();
        }
        if (ToolRegistry.isReadOnly(tool)) {
            return Optional.empty();
        }
        String allowlistKey = "tool:" + tool.getToolName();
        if (allowlist.has(allowlistKey)) {
            return Optional.empty();
        }
        ConfirmDetails details = ConfirmDetails.other("Run " + tool.getToolName(),
                "Allow " + tool.getToolName() + " with " + summarizeParams(arguments, null) + "?");
        details.setAllowlistKey(allowlistKey);
        return Optional.of(details);
    }

    private void notifyConfirmed(ConfirmDetails details, ConfirmOutcome outcome) {
        if (details.getOnConfirm() == null) {
            return;
        }
        try {
            details.getOnConfirm().accept(outcome);
        } catch (RuntimeException e) {
            log.warn("[Scheduler] onConfirm callback failed: {}", e.getMessage());
        }
    }

    private void execute(PreparedCall call, ToolExecutionContext context, CancellationSignal signal) {
        SchedulerToolCallRecord callRecord = call.callRecord();
        callRecord.setStatus(ToolCallStatus.EXECUTING);
        stream.toolExecuting(callRecord.getCallId(), callRecord.getToolName());

        CompletableFuture<ToolResult> future = call.tool().execute(call.arguments(), context);
        ToolResult result;
        try {
            result = signal.await(future, settings.toolTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (OperationCancelledException e) {
            cancel(callRecord, ABORTED, ToolFailureKind.CANCELLED);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            cancel(callRecord, ABORTED, ToolFailureKind.CANCELLED);
            return;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Scheduler] {} timed out after {}s", callRecord.getToolName(), settings.toolTimeoutSeconds());
            fail(callRecord, "Tool execution timed out after " + settings.toolTimeoutSeconds() + "s",
                    ToolFailureKind.EXECUTION_FAILED, true);
            return;
        } catch (ExecutionException e) {
            if (signal.isCancelled() && e.getCause() instanceof CancellationException) {
                cancel(callRecord, ABORTED, ToolFailureKind.CANCELLED);
                return;
            }
            log.error("[Scheduler] Tool {} ({}) threw with args {}", callRecord.getToolName(), callRecord.getCallId(),
                    call.arguments(), e.getCause());
            fail(callRecord, "Tool execution failed: " + safeCauseMessage(e), ToolFailureKind.EXECUTION_FAILED, true);
            return;
        }
        complete(callRecord, result);
    }

    private void complete(SchedulerToolCallRecord callRecord, ToolResult result) {
        if (result == null) {
            fail(callRecord, "Tool returned no result", ToolFailureKind.EXECUTION_FAILED, true);
            return;
        }
        callRecord.setResult(result);

        if (!result.isSuccess()) {
            if (result.getFailureKind() == ToolFailureKind.CANCELLED) {
                cancel(callRecord, result.getError() != null ? result.getError() : ABORTED, ToolFailureKind.CANCELLED);
                return;
            }
            callRecord.setError(result.getError());
            callRecord.setModelContent(result.toModelContent());
            finish(callRecord, ToolCallStatus.ERROR);
            log.debug("[Scheduler] {} reported failure: {}", callRecord.getToolName(), result.getError());
            stream.toolError(callRecord.getCallId(), callRecord.getToolName(), result.getError(), false,
                    callRecord.getDurationMs());
            return;
        }

        callRecord.setModelContent(postProcess(callRecord.getToolName(), result.toModelContent()));
        finish(callRecord, ToolCallStatus.SUCCESS);
        log.debug("[Scheduler] {} completed in {}ms", callRecord.getToolName(), callRecord.getDurationMs());
        stream.toolComplete(callRecord.getCallId(), callRecord.getToolName(),
                preview(callRecord.getModelContent()), callRecord.getDurationMs());
    }

    private String postProcess(String toolName, String content) {
        if (!settings.summarizeOutput() || outputSummarizer == null || content == null) {
            return content;
        }
        int threshold = settings.summaryThresholdTokens();
        if (!outputSummarizer.needsTruncation(content) && !outputSummarizer.needsSummary(content, threshold)) {
            return content;
        }
        return outputSummarizer.process(content, toolName, threshold).output();
    }

    private void fail(SchedulerToolCallRecord callRecord, String error, ToolFailureKind kind, boolean exceptional) {
        if (callRecord.getStatus().isTerminal()) {
            return;
        }
        if (callRecord.getResult() == null) {
            callRecord.setResult(ToolResult.failure(kind, error));
        }
        callRecord.setError(error);
        callRecord.setModelContent("Error: " + error);
        finish(callRecord, ToolCallStatus.ERROR);
        stream.toolError(callRecord.getCallId(), callRecord.getToolName(), error, exceptional,
                callRecord.getDurationMs());
    }

    private void cancel(SchedulerToolCallRecord callRecord, String reason, ToolFailureKind kind) {
        if (callRecord.getStatus().isTerminal()) {
            return;
        }
        callRecord.setResult(ToolResult.failure(kind, reason));
        callRecord.setError(reason);
        finish(callRecord, ToolCallStatus.CANCELLED);
        log.info("[Scheduler] {} ({}) cancelled: {}", callRecord.getToolName(), callRecord.getCallId(), reason);
        stream.toolCancelled(callRecord.getCallId(), callRecord.getToolName(), reason);
    }

    private void finish(SchedulerToolCallRecord callRecord, ToolCallStatus status) {
        callRecord.setEndTime(clock.instant());
        callRecord.setDurationMs(Duration.between(callRecord.getStartTime(), callRecord.getEndTime()).toMillis());
        callRecord.setStatus(status);
    }

    // ==================== STATE ====================

    public List<SchedulerToolCallRecord> getRecords() {
        synchronized (records) {
            return List.copyOf(records.values());
        }
    }

    public Optional<SchedulerToolCallRecord> getRecord(String callId) {
        synchronized (records) {
            return Optional.ofNullable(records.get(callId));
        }
    }

    public void clearRecords() {
        synchronized (records) {
            records.clear();
        }
    }

    public ApprovalMode getApprovalMode() {
        return approvalMode;
    }

    public void setApprovalMode(ApprovalMode approvalMode) {
        this.approvalMode = approvalMode != null ? approvalMode : ApprovalMode.DEFAULT;
        log.info("[Scheduler] Approval mode set to {}", this.approvalMode);
    }

    public Allowlist getAllowlist() {
        return allowlist;
    }

    public void clearAllowlist() {
        allowlist.clear();
    }

    // ==================== HELPERS ====================

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Scheduler] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private static String summarizeParams(Map<String, Object> arguments, String rawArguments) {
        String text;
        if (arguments != null) {
            StringBuilder sb = new StringBuilder();
            for (Map.Entry<String, Object> entry : arguments.entrySet()) {
                if (sb.length() > 0) {
                    sb.append(", ");
                }
                sb.append(entry.getKey()).append('=').append(entry.getValue());
            }
            text = sb.toString();
        } else {
            text = rawArguments != null ? rawArguments : "";
        }
        return text.length() > PARAMS_SUMMARY_MAX ? text.substring(0, PARAMS_SUMMARY_MAX) + "..." : text;
    }

    private static String preview(String content) {
        if (content == null) {
            return "";
        }
        return content.length() > RESULT_PREVIEW_MAX ? content.substring(0, RESULT_PREVIEW_MAX) + "..." : content;
    }

    private record PreparedCall(SchedulerToolCallRecord callRecord, ToolComponent tool, Map<String, Object> arguments) {
    }
}

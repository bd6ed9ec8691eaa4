package com.ryuqq.orchestration.adapter.runner;

import com.ryuqq.orchestration.application.coordinator.CancellationSignal;
import com.ryuqq.orchestration.application.coordinator.Coordinator;
import com.ryuqq.orchestration.application.coordinator.ExecutionSummary;
import com.ryuqq.orchestration.application.coordinator.RunOptions;
import com.ryuqq.orchestration.application.routing.Router;
import com.ryuqq.orchestration.core.budget.BudgetReservation;
import com.ryuqq.orchestration.core.budget.DegradationConfig;
import com.ryuqq.orchestration.core.error.ActionError;
import com.ryuqq.orchestration.core.error.ErrorKind;
import com.ryuqq.orchestration.core.exception.CyclicDependencyException;
import com.ryuqq.orchestration.core.model.Action;
import com.ryuqq.orchestration.core.model.ActionId;
import com.ryuqq.orchestration.core.model.ActionResult;
import com.ryuqq.orchestration.core.model.CostEstimate;
import com.ryuqq.orchestration.core.model.ExecutionPlan;
import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.provider.ProviderRequest;
import com.ryuqq.orchestration.core.provider.ProviderRequestResult;
import com.ryuqq.orchestration.core.provider.ProviderResponse;
import com.ryuqq.orchestration.core.statemachine.ActionState;
import com.ryuqq.orchestration.core.statemachine.ActionTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Execution Coordinator 구현.
 *
 * <p>레벨 단위로 Action을 고정 크기 스레드 풀에 제출하고, 레벨의 모든 Action이
 * 종료 상태가 될 때까지 기다린 뒤 다음 레벨로 진행합니다.</p>
 *
 * <p><strong>Action 시도 흐름:</strong></p>
 * <pre>
 * PENDING
 *   ├─ 취소 → CANCELLED
 *   ├─ 예산 HALT → FAILED (BUDGET_EXCEEDED)
 *   └─ DISPATCHED → Router.route(...)
 *        ├─ Ok → SUCCEEDED (예산 반영)
 *        ├─ transient + 시도 여유 → RETRYING → backoff → 다음 후보 Provider로 재전송
 *        └─ 그 외 → FAILED
 * </pre>
 *
 * <p>Action이 성공하면 예산 장부에는 응답 모델(없으면 요청 모델) 기준 단가로 비용이
 * 반영되고, {@link ActionResult#costUsd()}에는 Provider 비용 모델 기준 비용이 기록됩니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class ExecutionCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    static final String ESTIMATED_TIME_KEY = "estimated_time";
    static final String UNKNOWN_MODEL = "unknown";

    private final Router router;
    private final CoordinatorConfig config;
    private final BackoffCalculator backoff;
    private final ExecutorService executor;

    public ExecutionCoordinator(Router router, CoordinatorConfig config) {
        this(router, config, new BackoffCalculator());
    }

    /**
     * 생성자.
     *
     * @param router Provider Router
     * @param config Coordinator 설정
     * @param backoff Action 재시도 지연 계산기
     */
    public ExecutionCoordinator(Router router, CoordinatorConfig config, BackoffCalculator backoff) {
        if (router == null) {
            throw new IllegalArgumentException("router cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        this.router = router;
        this.config = config;
        this.backoff = backoff;
        this.executor = Executors.newFixedThreadPool(config.maxConcurrency());
    }

    @Override
    public ExecutionPlan plan(List<Action> actions) {
        if (actions == null) {
            throw new IllegalArgumentException("actions cannot be null");
        }

        Map<ActionId, Action> byId = new LinkedHashMap<>();
        for (Action action : actions) {
            if (action == null) {
                throw new IllegalArgumentException("actions cannot contain null");
            }
            if (byId.putIfAbsent(action.id(), action) != null) {
                throw new IllegalArgumentException("duplicate action id: " + action.id());
            }
        }
        for (Action action : actions) {
            for (ActionId dependency : action.dependencies()) {
                if (!byId.containsKey(dependency)) {
                    throw new IllegalArgumentException(
                        "action " + action.id() + " depends on unknown action " + dependency);
                }
            }
        }

        List<List<Action>> levels = new ArrayList<>();
        Set<ActionId> placed = new HashSet<>();
        List<Action> remaining = new ArrayList<>(actions);
        while (!remaining.isEmpty()) {
            List<Action> level = new ArrayList<>();
            for (Action action : remaining) {
                if (placed.containsAll(action.dependencies())) {
                    level.add(action);
                }
            }
            if (level.isEmpty()) {
                Set<ActionId> unresolved = new LinkedHashSet<>();
                remaining.forEach(a -> unresolved.add(a.id()));
                throw new CyclicDependencyException(unresolved);
            }
            level.forEach(a -> placed.add(a.id()));
            remaining.removeAll(level);
            levels.add(level);
        }

        long estimatedTimeMs = levels.stream()
            .mapToLong(level -> level.stream().mapToLong(this::estimatedTimeMs).max().orElse(0L))
            .reduce(0L, ExecutionCoordinator::saturatedAdd);
        log.debug("Planned {} actions into {} levels (estimated {}ms)", actions.size(), levels.size(),
            estimatedTimeMs);
        return ExecutionPlan.of(levels, estimatedTimeMs);
    }

    @Override
    public ExecutionSummary run(ExecutionPlan plan, RunOptions options) {
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        CancellationSignal cancellation = options.cancellation();
        Map<ActionId, List<ActionResult>> attempts = new ConcurrentHashMap<>();
        List<List<ActionResult>> levelResults = new ArrayList<>();
        boolean skipRemaining = false;
        boolean interrupted = false;

        for (int index = 0; index < plan.getLevelCount(); index++) {
            List<Action> level = plan.getLevel(index);
            List<ActionResult> results = new ArrayList<>(level.size());

            if (cancellation.isCancelled()) {
                level.forEach(a -> results.add(notDispatched(a, ActionState.CANCELLED,
                    ActionError.of(ErrorKind.CANCELLED, "Batch cancelled before dispatch"))));
            } else if (skipRemaining) {
                level.forEach(a -> results.add(notDispatched(a, ActionState.SKIPPED,
                    ActionError.of(ErrorKind.SKIPPED_DUE_TO_UPSTREAM_FAILURE,
                        "Skipped due to upstream failure"))));
            } else {
                log.debug("Dispatching level {} ({} actions)", index, level.size());
                List<Future<ActionResult>> futures = new ArrayList<>(level.size());
                for (Action action : level) {
                    futures.add(executor.submit(() -> executeAction(action, options, attempts)));
                }
                for (int i = 0; i < futures.size(); i++) {
                    AwaitResult awaited = await(futures.get(i), level.get(i), cancellation);
                    interrupted |= awaited.interrupted();
                    results.add(awaited.result());
                }
            }

            levelResults.add(results);
            if (options.stopOnFailure() && results.stream().anyMatch(r -> !r.success())) {
                if (!skipRemaining && index + 1 < plan.getLevelCount()) {
                    log.info("Level {} has failures, skipping remaining levels", index);
                }
                skipRemaining = true;
            }
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        ExecutionSummary summary = ExecutionSummary.of(levelResults, attempts);
        log.info("Run completed: {}/{} succeeded, cost ${}", summary.getSuccessful(), summary.getTotal(),
            summary.getTotalCostUsd());
        return summary;
    }

    /**
     * 스레드 풀 종료.
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
    }

    public CoordinatorConfig getConfig() {
        return config;
    }

    private ActionResult executeAction(Action action, RunOptions options,
                                       Map<ActionId, List<ActionResult>> attempts) {
        ActionState state = ActionState.PENDING;
        int attempt = 0;
        long lastLatency = 0L;
        ProviderId lastProvider = null;

        while (true) {
            if (options.cancellation().isCancelled()) {
                ActionTransition.validate(state, ActionState.CANCELLED);
                return new ActionResult(action.id(), false, null,
                    ActionError.of(ErrorKind.CANCELLED, "Batch cancelled"), lastLatency, lastProvider, 0.0,
                    attempt, ActionState.CANCELLED);
            }

            Action effective = action;
            BudgetReservation reservation = null;
            if (options.hasBudget()) {
                reservation = options.budget().reserve(action.estimate());
                if (reservation.isHalted()) {
                    state = ActionTransition.transition(state, ActionState.FAILED);
                    log.warn("Action {} halted by budget: {}", action.id(), reservation.error().message());
                    return attempt == 0
                        ? ActionResult.notDispatched(action.id(), reservation.error(), state)
                        : ActionResult.failure(action.id(), reservation.error(), lastLatency, lastProvider,
                            attempt, state);
                }
                if (reservation.degradation() != null && !reservation.degradation().isEmpty()) {
                    effective = degrade(action, reservation.degradation());
                }
            }

            state = ActionTransition.transition(state, ActionState.DISPATCHED);
            attempt++;
            ProviderRequest request = ProviderRequest.from(effective);
            ProviderRequestResult routed;
            try {
                routed = router.route(request, config.providerMaxRetries(), lastProvider);
            } catch (RuntimeException e) {
                if (reservation != null) {
                    options.budget().release(reservation);
                }
                throw e;
            }
            if (routed.lastProvider() != null) {
                lastProvider = routed.lastProvider();
            }
            lastLatency = routed.latencyMs();

            if (routed.isSuccess()) {
                ProviderResponse response = routed.response();
                if (reservation != null) {
                    options.budget().updateAfterCall(reservation, modelOf(response, request), action.type(),
                        response.inputTokens(), response.outputTokens());
                }
                state = ActionTransition.transition(state, ActionState.SUCCEEDED);
                ActionResult result = ActionResult.success(action.id(), response, routed.latencyMs(),
                    lastProvider, routed.costUsd(), attempt);
                record(attempts, result);
                log.debug("Action {} succeeded on {} (attempt {})", action.id(), lastProvider, attempt);
                return result;
            }

            if (reservation != null) {
                options.budget().release(reservation);
            }
            ActionError error = routed.toError();
            boolean retry = error.isTransient()
                && action.retryPolicy().hasAttemptsLeft(attempt)
                && !options.cancellation().isCancelled();
            if (!retry) {
                state = ActionTransition.transition(state, ActionState.FAILED);
                ActionResult result = ActionResult.failure(action.id(), error, routed.latencyMs(), lastProvider,
                    attempt, state);
                record(attempts, result);
                log.info("Action {} failed after {} attempts: {}", action.id(), attempt, error.message());
                return result;
            }

            state = ActionTransition.transition(state, ActionState.RETRYING);
            record(attempts, ActionResult.failure(action.id(), error, routed.latencyMs(), lastProvider,
                attempt, state));
            long delay = backoff.calculate(action.retryPolicy(), attempt);
            log.debug("Action {} attempt {} failed ({}), retrying in {}ms", action.id(), attempt, error.kind(),
                delay);
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                options.cancellation().cancel();
            }
        }
    }

    private AwaitResult await(Future<ActionResult> future, Action action, CancellationSignal cancellation) {
        boolean interrupted = false;
        while (true) {
            try {
                return new AwaitResult(future.get(), interrupted);
            } catch (InterruptedException e) {
                interrupted = true;
                if (cancellation.cancel()) {
                    log.info("Run interrupted, cancelling remaining actions");
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Action {} terminated unexpectedly", action.id(), cause);
                String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
                return new AwaitResult(ActionResult.notDispatched(action.id(),
                    ActionError.of(ErrorKind.PERMANENT_PROVIDER_ERROR, message), ActionState.FAILED), interrupted);
            }
        }
    }

    private static Action degrade(Action action, DegradationConfig degradation) {
        Action degraded = action;
        if (degradation.switchesModel()) {
            CostEstimate estimate = action.estimate() == null
                ? CostEstimate.of(degradation.model(), 0, 0)
                : action.estimate().withModel(degradation.model());
            degraded = degraded.withEstimate(estimate);
        }
        if (degradation.reducesContext()) {
            Map<String, Object> parameters = new HashMap<>(action.parameters());
            parameters.put(DegradationConfig.MAX_CONTEXT_TOKENS_KEY, degradation.maxContextTokens());
            degraded = degraded.withParameters(parameters);
        }
        return degraded;
    }

    private static String modelOf(ProviderResponse response, ProviderRequest request) {
        if (response.model() != null) {
            return response.model();
        }
        return request.model() != null ? request.model() : UNKNOWN_MODEL;
    }

    private static void record(Map<ActionId, List<ActionResult>> attempts, ActionResult result) {
        attempts.computeIfAbsent(result.actionId(), id -> new CopyOnWriteArrayList<>()).add(result);
    }

    private static ActionResult notDispatched(Action action, ActionState state, ActionError error) {
        ActionTransition.validate(ActionState.PENDING, state);
        return ActionResult.notDispatched(action.id(), error, state);
    }

    private long estimatedTimeMs(Action action) {
        Object value = action.parameters().get(ESTIMATED_TIME_KEY);
        double seconds;
        if (value instanceof Number number) {
            seconds = number.doubleValue();
        } else if (value instanceof String text) {
            try {
                seconds = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric estimated_time on {}: {}", action.id(), text);
                return config.defaultEstimatedTimeMs();
            }
        } else {
            return config.defaultEstimatedTimeMs();
        }
        if (!Double.isFinite(seconds)) {
            log.debug("Ignoring non-finite estimated_time on {}: {}", action.id(), value);
            return config.defaultEstimatedTimeMs();
        }
        // 음수는 0, double → long 변환은 Long.MAX_VALUE에서 포화
        return (long) (Math.max(0.0, seconds) * 1000);
    }

    private static long saturatedAdd(long left, long right) {
        long sum = left + right;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    private record AwaitResult(ActionResult result, boolean interrupted) {
    }
}

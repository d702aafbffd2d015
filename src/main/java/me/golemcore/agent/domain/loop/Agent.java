package me.golemcore.agent.domain.loop;


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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.AgentTool;
import me.golemcore.agent.domain.component.OutputValidator;
import me.golemcore.agent.domain.model.AgentNode;
import me.golemcore.agent.domain.model.AgentResult;
import me.golemcore.agent.domain.model.AgentStreamEvent;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.OutputType;
import me.golemcore.agent.domain.model.PausedAgentRun;
import me.golemcore.agent.domain.model.ResolvedTool;
import me.golemcore.agent.domain.service.ToolCatalog;
import me.golemcore.agent.domain.system.toolloop.DefaultHistoryWriter;
import me.golemcore.agent.domain.system.toolloop.HistoryWriter;
import me.golemcore.agent.domain.system.toolloop.IteratingLoopObserver;
import me.golemcore.agent.domain.system.toolloop.ModelErrorClassifier;
import me.golemcore.agent.domain.system.toolloop.NoOpLoopObserver;
import me.golemcore.agent.domain.system.toolloop.ResponseHandler;
import me.golemcore.agent.domain.system.toolloop.ResumeManager;
import me.golemcore.agent.domain.system.toolloop.RetryingCompletion;
import me.golemcore.agent.domain.system.toolloop.RunLoop;
import me.golemcore.agent.domain.system.toolloop.RunState;
import me.golemcore.agent.domain.system.toolloop.StreamingLoopObserver;
import me.golemcore.agent.domain.system.toolloop.StreamingModelAdapter;
import me.golemcore.agent.domain.system.toolloop.ToolExecutionEngine;
import me.golemcore.agent.domain.system.toolloop.UsageLimiter;
import me.golemcore.agent.port.outbound.ModelPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An agent: a model, a tool catalog, a declared output type and a loop
 * configuration. Immutable once built; any number of runs may execute
 * concurrently, each with its own state.
 *
 * <p>
 * Four entry points share one {@link RunLoop}:
 * <ul>
 * <li>{@link #run} blocks the caller thread until the run ends</li>
 * <li>{@link #stream} emits model deltas, tool results, usage updates and the
 * final result</li>
 * <li>{@link #iterate} emits one {@link AgentNode} per loop step</li>
 * <li>{@link #resume} continues a run paused on deferred tool calls</li>
 * </ul>
 * Stream and iterate runs execute on the agent's executor; disposing the
 * subscription interrupts the run.
 *
 * @param <D>
 *            dependency type passed to tools and validators
 * @param <O>
 *            output type
 */
@Slf4j
public final class Agent<D, O> {

    private static final AtomicInteger WORKER_COUNTER = new AtomicInteger();
    private static final ExecutorService DEFAULT_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "agent-worker-" + WORKER_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final ModelPort model;
    private final AgentLoopConfig config;
    private final ExecutorService executor;
    private final Clock clock;
    private final HistoryWriter historyWriter;
    private final RetryingCompletion retryingCompletion;
    private final RunLoop<D, O> runLoop;
    private final ResumeManager<D> resumeManager;

    @Builder
    private Agent(ModelPort model, OutputType<O> outputType, @Singular List<AgentTool<D>> tools,
            @Singular List<OutputValidator<D, O>> validators, AgentLoopConfig config, ExecutorService executor,
            ObjectMapper objectMapper, ModelErrorClassifier errorClassifier, Clock clock) {
        this.model = Objects.requireNonNull(model, "model");
        Objects.requireNonNull(outputType, "outputType");
        this.config = config != null ? config.copy() : AgentLoopConfig.defaultConfig();
        this.executor = executor != null ? executor : DEFAULT_EXECUTOR;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.historyWriter = new DefaultHistoryWriter();

        ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();
        ModelErrorClassifier classifier = errorClassifier != null ? errorClassifier : new ModelErrorClassifier();
        ToolCatalog<D> catalog = new ToolCatalog<>(tools,
                outputType.isText() ? null : this.config.getOutputToolName());
        UsageLimiter limiter = new UsageLimiter(this.config.getUsageLimits());
        ToolExecutionEngine<D> engine = new ToolExecutionEngine<>(catalog, this.config.getToolTimeout(),
                this.executor);

        this.retryingCompletion = new RetryingCompletion(this.model, this.config.getRetryPolicy(), classifier);
        ResponseHandler<D, O> responseHandler = new ResponseHandler<>(this.model, outputType, validators,
                this.config, mapper, engine, limiter, historyWriter, this.clock);
        this.runLoop = new RunLoop<>(catalog, outputType, this.config, responseHandler, limiter, historyWriter,
                this.clock);
        this.resumeManager = new ResumeManager<>(this.model, engine, limiter, historyWriter, this.clock);
    }

    public AgentResult<O> run(String prompt, D deps) {
        return run(prompt, deps, List.of());
    }

    /**
     * Runs to completion on the caller thread. Interrupting the thread cancels
     * the run.
     *
     * @throws me.golemcore.agent.domain.exception.HasDeferredToolsException
     *             when a tool deferred; resume the carried snapshot
     */
    public AgentResult<O> run(String prompt, D deps, List<Message> history) {
        return runLoop.run(newState(prompt, deps, history), retryingCompletion, NoOpLoopObserver.instance());
    }

    public Flux<AgentStreamEvent<O>> stream(String prompt, D deps) {
        return stream(prompt, deps, List.of());
    }

    public Flux<AgentStreamEvent<O>> stream(String prompt, D deps, List<Message> history) {
        return Flux.create(sink -> submit(sink, () -> {
            RunState<D> state = newState(prompt, deps, history);
            runLoop.run(state, new StreamingModelAdapter<>(model, retryingCompletion, sink),
                    new StreamingLoopObserver<>(sink));
        }));
    }

    public Flux<AgentNode<O>> iterate(String prompt, D deps) {
        return iterate(prompt, deps, List.of());
    }

    public Flux<AgentNode<O>> iterate(String prompt, D deps, List<Message> history) {
        return Flux.create(sink -> submit(sink, () -> {
            RunState<D> state = newState(prompt, deps, history);
            runLoop.run(state, retryingCompletion, new IteratingLoopObserver<>(sink));
        }));
    }

    /**
     * Continues a paused run with the caller's resolutions. Pending calls
     * without a resolution are treated as denied.
     *
     * <p>
     * Not idempotent: resuming the same snapshot twice executes approved tools
     * twice.
     */
    public AgentResult<O> resume(PausedAgentRun pausedRun, List<ResolvedTool> resolutions, D deps) {
        RunState<D> state = RunState.resume(pausedRun, deps, clock.instant());
        log.info("[AgentLoop] Resuming run {} with {} resolution(s)", state.getRunId(), resolutions.size());
        resumeManager.resolve(state, pausedRun, resolutions);
        return runLoop.run(state, retryingCompletion, NoOpLoopObserver.instance());
    }

    public ModelPort getModel() {
        return model;
    }

    /**
     * Copy of the configuration this agent runs with; changing it has no effect
     * on the agent.
     */
    public AgentLoopConfig getConfig() {
        return config.copy();
    }

    private RunState<D> newState(String prompt, D deps, List<Message> history) {
        RunState<D> state = RunState.start(deps, clock.instant());
        historyWriter.appendHistory(state, history);
        historyWriter.appendUserPrompt(state, prompt);
        return state;
    }

    private <T> void submit(FluxSink<T> sink, Runnable body) {
        Future<?> task = executor.submit(() -> {
            try {
                body.run();
                sink.complete();
            } catch (RuntimeException e) {
                log.debug("[AgentLoop] Run failed: {}", e.getMessage());
                sink.error(e);
            } catch (Error e) {
                log.error("[AgentLoop] Run aborted by {}", e.toString(), e);
                sink.error(e);
                throw e;
            }
        });
        sink.onDispose(() -> task.cancel(true));
    }
}

package io.github.hide212131.langchain4j.mentor.runtime.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hide212131.langchain4j.mentor.infra.config.OrchestratorSettings;
import io.github.hide212131.langchain4j.mentor.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.mentor.infra.observability.WorkflowTracer;
import io.github.hide212131.langchain4j.mentor.runtime.agent.Collaborator;
import io.github.hide212131.langchain4j.mentor.runtime.agent.CollaboratorException;
import io.github.hide212131.langchain4j.mentor.runtime.agent.CollaboratorInput;
import io.github.hide212131.langchain4j.mentor.runtime.agent.CollaboratorOutput;
import io.github.hide212131.langchain4j.mentor.runtime.agent.CollaboratorRegistry;
import io.github.hide212131.langchain4j.mentor.runtime.capability.CapabilityEntry;
import io.github.hide212131.langchain4j.mentor.runtime.capability.CapabilityGraph;
import io.github.hide212131.langchain4j.mentor.runtime.capability.CapabilityGraphLoader;
import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import io.github.hide212131.langchain4j.mentor.runtime.collaborator.DefaultCollaborators;
import io.github.hide212131.langchain4j.mentor.runtime.intent.FallbackIntentClassifier;
import io.github.hide212131.langchain4j.mentor.runtime.intent.IntentClassifier;
import io.github.hide212131.langchain4j.mentor.runtime.intent.IntentPattern;
import io.github.hide212131.langchain4j.mentor.runtime.intent.IntentPatternLoader;
import io.github.hide212131.langchain4j.mentor.runtime.intent.IntentResult;
import io.github.hide212131.langchain4j.mentor.runtime.intent.IntentSource;
import io.github.hide212131.langchain4j.mentor.runtime.intent.LlmIntentClassifier;
import io.github.hide212131.langchain4j.mentor.runtime.intent.RuleBasedIntentClassifier;
import io.github.hide212131.langchain4j.mentor.runtime.plan.AgentAvailability;
import io.github.hide212131.langchain4j.mentor.runtime.plan.ExecutionPlan;
import io.github.hide212131.langchain4j.mentor.runtime.plan.ExecutionPlanner;
import io.github.hide212131.langchain4j.mentor.runtime.plan.Task;
import io.github.hide212131.langchain4j.mentor.runtime.provider.LangChain4jLlmClient;
import io.github.hide212131.langchain4j.mentor.runtime.provider.LlmConfiguration;
import io.github.hide212131.langchain4j.mentor.runtime.provider.LlmProvider;
import io.github.hide212131.langchain4j.mentor.runtime.state.ConversationEntry;
import io.github.hide212131.langchain4j.mentor.runtime.state.InMemoryProjectStore;
import io.github.hide212131.langchain4j.mentor.runtime.state.JsonFileProjectStore;
import io.github.hide212131.langchain4j.mentor.runtime.state.ProjectRecord;
import io.github.hide212131.langchain4j.mentor.runtime.state.ProjectStore;
import io.github.hide212131.langchain4j.mentor.runtime.state.SelectionMode;
import io.github.hide212131.langchain4j.mentor.runtime.state.SessionLocks;
import io.github.hide212131.langchain4j.mentor.runtime.state.StateDelta;
import io.github.hide212131.langchain4j.mentor.runtime.state.StateManager;
import io.opentelemetry.api.trace.Span;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;

/**
 * Runs one conversational turn: classify, plan, execute the plan in order, record the exchange.
 *
 * <p>Tasks run sequentially on the calling thread and each one sees the artifacts written by the
 * tasks before it. A collaborator that is missing is skipped and one that fails is reported, but
 * neither stops the rest of the plan. Planning and persistence failures end the turn. Turns of the
 * same session are serialized.
 */
public final class Orchestrator implements AutoCloseable {

    private final WorkflowLogger logger = new WorkflowLogger(Orchestrator.class);
    private final StateManager stateManager;
    private final IntentClassifier classifier;
    private final ExecutionPlanner planner;
    private final CollaboratorRegistry registry;
    private final WorkflowTracer tracer;
    private final Executor executor;
    private final Clock clock;
    private final SessionLocks sessionLocks = new SessionLocks();
    private final ResponseSynthesizer synthesizer = new ResponseSynthesizer();

    public Orchestrator(
            StateManager stateManager,
            IntentClassifier classifier,
            ExecutionPlanner planner,
            CollaboratorRegistry registry,
            WorkflowTracer tracer) {
        this(stateManager, classifier, planner, registry, tracer, ForkJoinPool.commonPool(), Clock.systemUTC());
    }

    public Orchestrator(
            StateManager stateManager,
            IntentClassifier classifier,
            ExecutionPlanner planner,
            CollaboratorRegistry registry,
            WorkflowTracer tracer,
            Executor executor,
            Clock clock) {
        this.stateManager = Objects.requireNonNull(stateManager, "stateManager");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Wires the default components: the capability table and intent patterns named in
     * {@code settings}, the keyword classifier (backed by the LLM classifier when an OpenAI model is
     * configured), LLM or dry-run collaborators, and an in-memory or JSON-file store.
     */
    public static Orchestrator withDefaults(
            OrchestratorSettings settings, LlmConfiguration llmConfiguration, boolean dryRun, WorkflowTracer tracer) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(llmConfiguration, "llmConfiguration");
        CapabilityGraph graph = new CapabilityGraphLoader().load(settings.capabilitiesResource());
        List<IntentPattern> patterns = new IntentPatternLoader(graph).load(settings.intentsResource());
        IntentClassifier classifier = new RuleBasedIntentClassifier(patterns);

        Map<String, Supplier<Collaborator>> collaborators;
        if (dryRun || llmConfiguration.provider() == LlmProvider.MOCK) {
            collaborators = DefaultCollaborators.dryRun();
        } else {
            LangChain4jLlmClient client = LangChain4jLlmClient.from(llmConfiguration);
            collaborators = DefaultCollaborators.llm(client.chatModel());
            if (settings.llmClassifierEnabled()) {
                classifier = new FallbackIntentClassifier(
                        new LlmIntentClassifier(client, graph, patterns, new ObjectMapper()),
                        classifier,
                        settings.classifierTimeout());
            }
        }

        ProjectStore store = settings.storeDirectory() == null
                ? new InMemoryProjectStore()
                : new JsonFileProjectStore(Path.of(settings.storeDirectory()));
        return new Orchestrator(
                new StateManager(store),
                classifier,
                new ExecutionPlanner(graph, settings),
                new CollaboratorRegistry(collaborators),
                tracer);
    }

    /**
     * @throws io.github.hide212131.langchain4j.mentor.runtime.plan.PlanningException when no plan can be
     *     built; nothing has been executed or stored in that case
     * @throws io.github.hide212131.langchain4j.mentor.runtime.state.PersistenceException when the record
     *     cannot be stored; updates committed earlier in the turn remain
     */
    public OrchestratorResponse processRequest(OrchestratorRequest request) {
        Objects.requireNonNull(request, "request");
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("session.id", request.sessionId());
        attributes.put("selection.mode", request.mode().wireName());
        return sessionLocks.withLock(request.sessionId(),
                () -> tracer.traceWithSpan("orchestrator.turn", attributes, span -> runTurn(request, span)));
    }

    public CompletableFuture<OrchestratorResponse> processRequestAsync(OrchestratorRequest request) {
        Objects.requireNonNull(request, "request");
        return CompletableFuture.supplyAsync(() -> processRequest(request), executor);
    }

    /** Availability of every declared collaborator for the session's current record. */
    public List<AgentAvailability> availableAgents(String sessionId) {
        return planner.availableAgents(stateManager.load(sessionId));
    }

    /** Current record of a session, created with defaults when the session is new. */
    public ProjectRecord snapshot(String sessionId) {
        return stateManager.snapshot(sessionId);
    }

    /** Releases the classifier's worker threads, if it has any. */
    @Override
    public void close() {
        if (classifier instanceof FallbackIntentClassifier fallback) {
            fallback.close();
        }
    }

    private OrchestratorResponse runTurn(OrchestratorRequest request, Span span) {
        String sessionId = request.sessionId();
        ProjectRecord record = stateManager.load(sessionId);

        IntentResult intent = request.mode() == SelectionMode.AUTO
                ? classify(request.message(), record.phase())
                : IntentResult.manual(request.selectedAgentId());
        span.setAttribute("intent.primary", intent.primaryIntent());
        span.setAttribute("intent.confidence", intent.confidence());

        ExecutionPlan plan = planner.plan(request.mode(), intent, record);
        span.setAttribute("plan.size", (long) plan.tasks().size());
        if (plan.awaitingSelection()) {
            logger.info("Session {} is waiting for a collaborator selection", sessionId);
            List<AgentAvailability> available = planner.availableAgents(record);
            return new OrchestratorResponse(
                    synthesizer.selectionPrompt(available), record, plan, List.of(), available, intent);
        }
        logger.info("Session {} intent={} plan={}", sessionId, intent.primaryIntent(), plan.agentIds());

        List<AgentResult> results = new ArrayList<>();
        for (Task task : plan.tasks()) {
            TaskOutcome outcome = executeTask(sessionId, task, record, request.message());
            record = outcome.record();
            results.add(outcome.result());
        }

        String message = synthesizer.synthesize(results, planner.availableAgents(record));

        StateDelta.Builder exchange = StateDelta.builder()
                .append(ConversationEntry.user(request.message(), clock.instant()))
                .append(ConversationEntry.assistant(message, clock.instant()))
                .agentSelectionMode(request.mode())
                .selectedAgentId(request.mode() == SelectionMode.MANUAL ? request.selectedAgentId() : null);
        record = stateManager.update(sessionId, exchange.build());

        return new OrchestratorResponse(
                message, record, plan, results, planner.availableAgents(record), intent);
    }

    private IntentResult classify(String message, Phase phase) {
        try {
            return classifier.classify(message, phase);
        } catch (RuntimeException e) {
            logger.warn("Intent classification failed, continuing without an intent: {}", e.getMessage());
            return IntentResult.unknown(IntentSource.RULES);
        }
    }

    private TaskOutcome executeTask(String sessionId, Task task, ProjectRecord record, String userInput) {
        CapabilityGraph graph = planner.graph();
        CapabilityEntry entry = graph.get(task.agentId())
                .orElseThrow(() -> new IllegalStateException("Planned agent is not declared: " + task.agentId()));
        Map<String, Object> attributes = Map.of("agent.id", entry.id(), "session.id", sessionId);
        return tracer.traceWithSpan("orchestrator.task", attributes, span -> {
            TaskOutcome outcome = invoke(sessionId, task, entry, record, userInput);
            span.setAttribute("agent.status", outcome.result().status().wireName());
            logger.info("Agent {} finished with {}", entry.id(), outcome.result().status().wireName());
            return outcome;
        });
    }

    private TaskOutcome invoke(
            String sessionId, Task task, CapabilityEntry entry, ProjectRecord record, String userInput) {
        Optional<Collaborator> collaborator;
        try {
            collaborator = registry.getAgent(entry.id());
        } catch (CollaboratorException e) {
            logger.warn("Agent {} could not be created: {}", entry.id(), e.getMessage());
            return new TaskOutcome(AgentResult.error(entry.id(), entry.name(), summarize(e)), record);
        }
        if (collaborator.isEmpty()) {
            logger.debug("Agent {} is not registered; skipping", entry.id());
            return new TaskOutcome(AgentResult.skipped(entry.id(), entry.name()), record);
        }

        CollaboratorInput input = new CollaboratorInput(
                entry.id(),
                extractContext(record, task),
                task.requiredContext().isAll() ? record : null,
                task.inputOverride() != null ? task.inputOverride() : userInput,
                task.tools());

        CollaboratorOutput output;
        try {
            output = collaborator.get().process(input);
        } catch (RuntimeException e) {
            logger.warn("Agent {} failed: {}", entry.id(), e.getMessage());
            return new TaskOutcome(AgentResult.error(entry.id(), entry.name(), summarize(e)), record);
        }
        if (output == null) {
            return new TaskOutcome(AgentResult.error(entry.id(), entry.name(), "collaborator returned no output"), record);
        }
        if (output.isError()) {
            logger.warn("Agent {} reported an error: {}", entry.id(), output.error());
            return new TaskOutcome(AgentResult.error(entry.id(), entry.name(), output.error()), record);
        }

        StateDelta.Builder delta = StateDelta.builder().artifacts(output.stateDelta());
        entry.transition()
                .filter(target -> record.phase().advanceTo(target) != record.phase())
                .ifPresent(delta::phase);
        StateDelta built = delta.build();
        ProjectRecord updated = built.isEmpty() ? record : stateManager.update(sessionId, built);

        AgentResult result = new AgentResult(
                entry.id(), entry.name(), AgentStatus.SUCCESS, output.content(), output.stateDelta().keySet());
        return new TaskOutcome(result, updated);
    }

    private static Map<String, Object> extractContext(ProjectRecord record, Task task) {
        if (task.requiredContext().isAll()) {
            return record.artifacts();
        }
        Map<String, Object> context = new LinkedHashMap<>();
        for (String artifact : task.requiredContext().artifacts()) {
            context.put(artifact, record.artifacts().get(artifact));
        }
        return context;
    }

    private static String summarize(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private record TaskOutcome(AgentResult result, ProjectRecord record) {}
}

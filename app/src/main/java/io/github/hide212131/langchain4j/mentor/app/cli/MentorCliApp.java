package io.github.hide212131.langchain4j.mentor.app.cli;

import io.github.hide212131.langchain4j.mentor.infra.config.OrchestratorSettings;
import io.github.hide212131.langchain4j.mentor.infra.config.OrchestratorSettingsLoader;
import io.github.hide212131.langchain4j.mentor.infra.observability.ObservabilityConfig;
import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import io.github.hide212131.langchain4j.mentor.runtime.plan.AgentAvailability;
import io.github.hide212131.langchain4j.mentor.runtime.plan.PlanningException;
import io.github.hide212131.langchain4j.mentor.runtime.provider.LlmConfiguration;
import io.github.hide212131.langchain4j.mentor.runtime.provider.LlmConfigurationLoader;
import io.github.hide212131.langchain4j.mentor.runtime.state.PersistenceException;
import io.github.hide212131.langchain4j.mentor.runtime.state.SelectionMode;
import io.github.hide212131.langchain4j.mentor.runtime.workflow.AgentResult;
import io.github.hide212131.langchain4j.mentor.runtime.workflow.Orchestrator;
import io.github.hide212131.langchain4j.mentor.runtime.workflow.OrchestratorRequest;
import io.github.hide212131.langchain4j.mentor.runtime.workflow.OrchestratorResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Entry point that wires PicoCLI with the orchestrator.
 */
@Command(name = "mentor", mixinStandardHelpOptions = true,
        description = "Plan a software project with a team of specialist collaborators")
public final class MentorCliApp implements Runnable {

    static final int EXIT_PLANNING_ERROR = 2;
    static final int EXIT_PERSISTENCE_ERROR = 3;

    public static void main(String[] args) {
        int exitCode = commandLineInstance().execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static CommandLine commandLineInstance() {
        return commandLineInstance(MentorCliApp::defaultOrchestrator);
    }

    static CommandLine commandLineInstance(OrchestratorFactory factory) {
        CommandLine cmd = new CommandLine(new MentorCliApp());
        cmd.addSubcommand("chat", new ChatCommand(factory));
        cmd.addSubcommand("agents", new AgentsCommand(factory));
        return cmd;
    }

    private static Orchestrator defaultOrchestrator(OrchestratorSettings settings, boolean dryRun) {
        LlmConfiguration llm = dryRun ? LlmConfiguration.mock() : new LlmConfigurationLoader().load();
        return Orchestrator.withDefaults(settings, llm, dryRun, ObservabilityConfig.fromEnvironment().workflowTracer());
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /** Options shared by every subcommand that touches a session. */
    abstract static class SessionCommand implements Callable<Integer> {

        @Option(names = "--session", required = true, description = "Session id of the project")
        String sessionId;

        @Option(names = "--state-dir", description = "Directory for JSON session files (in-memory when omitted)")
        Path stateDir;

        @Option(names = "--config", description = "YAML file overriding orchestrator.yaml")
        Path configFile;

        @Option(names = "--dry-run", description = "Use offline collaborators without calling a model")
        boolean dryRun;

        @Spec
        CommandSpec commandSpec;

        private final OrchestratorFactory factory;

        SessionCommand(OrchestratorFactory factory) {
            this.factory = factory;
        }

        Orchestrator orchestrator() {
            OrchestratorSettings settings = new OrchestratorSettingsLoader().load(configFile);
            if (stateDir != null) {
                settings = settings.withStoreDirectory(stateDir.toAbsolutePath().normalize().toString());
            }
            return factory.create(settings, dryRun);
        }

        PrintWriter out() {
            return commandSpec.commandLine().getOut();
        }

        PrintWriter err() {
            return commandSpec.commandLine().getErr();
        }

        void printAvailability(List<AgentAvailability> agents) {
            for (AgentAvailability agent : agents) {
                StringBuilder line = new StringBuilder("  [")
                        .append(agent.available() ? 'x' : ' ')
                        .append("] ")
                        .append(agent.agentId())
                        .append(" - ")
                        .append(agent.agentName());
                if (!agent.phaseCompatible()) {
                    line.append(" (not in this phase)");
                } else if (!agent.missingArtifacts().isEmpty()) {
                    line.append(" (missing: ").append(String.join(", ", agent.missingArtifacts())).append(')');
                }
                out().println(line);
            }
        }
    }

    @Command(name = "chat", description = "Send one message to the project team")
    static final class ChatCommand extends SessionCommand {

        @Option(names = "--message", description = "Message to send")
        String message;

        @Option(names = "--message-file", description = "Read the message from a file")
        Path messageFile;

        @Option(names = "--mode", defaultValue = "auto", description = "auto or manual")
        String mode;

        @Option(names = "--agent", description = "Collaborator id to run in manual mode")
        String agentId;

        ChatCommand(OrchestratorFactory factory) {
            super(factory);
        }

        @Override
        public Integer call() {
            String text;
            SelectionMode selectionMode;
            try {
                text = resolveMessage();
                selectionMode = SelectionMode.from(mode);
            } catch (IllegalArgumentException e) {
                err().println("Error: " + e.getMessage());
                return 1;
            }

            OrchestratorResponse response;
            try (Orchestrator orchestrator = orchestrator()) {
                response = orchestrator.processRequest(
                        new OrchestratorRequest(sessionId, text, selectionMode, agentId));
            } catch (PlanningException e) {
                err().println("Planning failed: " + e.getMessage());
                return EXIT_PLANNING_ERROR;
            } catch (PersistenceException e) {
                err().println("Could not save the session: " + e.getMessage());
                return EXIT_PERSISTENCE_ERROR;
            }

            out().printf(Locale.ROOT, "Intent: %s (confidence %.2f, %s)%n",
                    response.intent().primaryIntent(),
                    response.intent().confidence(),
                    response.intent().source().name().toLowerCase(Locale.ROOT));
            if (response.awaitingSelection()) {
                out().println("Plan: awaiting selection");
                printAvailability(response.availableAgents());
            } else {
                out().println("Plan: " + (response.plan().isEmpty()
                        ? "(empty)"
                        : String.join(" -> ", response.plan().agentIds())));
                for (AgentResult result : response.agentResults()) {
                    String keys = result.stateDeltaKeys().isEmpty()
                            ? ""
                            : " [" + String.join(", ", result.stateDeltaKeys()) + "]";
                    out().println("  - " + result.agentId() + ": " + result.status().wireName() + keys);
                }
            }
            out().println("Phase: " + response.stateSnapshot().phase().wireName());
            out().println("Reply:");
            out().println(response.message());
            out().flush();
            return 0;
        }

        private String resolveMessage() {
            if (messageFile != null) {
                if (!Files.isRegularFile(messageFile)) {
                    throw new IllegalArgumentException("message file not found: " + messageFile);
                }
                try {
                    String content = Files.readString(messageFile).trim();
                    if (content.isEmpty()) {
                        throw new IllegalArgumentException("message file is empty: " + messageFile);
                    }
                    return content;
                } catch (IOException e) {
                    throw new IllegalArgumentException("cannot read message file: " + e.getMessage(), e);
                }
            }
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("either --message or --message-file must be provided");
            }
            return message.trim();
        }
    }

    @Command(name = "agents", description = "List collaborators and whether they can run now")
    static final class AgentsCommand extends SessionCommand {

        AgentsCommand(OrchestratorFactory factory) {
            super(factory);
        }

        @Override
        public Integer call() {
            Phase phase;
            List<AgentAvailability> agents;
            try (Orchestrator orchestrator = orchestrator()) {
                agents = orchestrator.availableAgents(sessionId);
                phase = orchestrator.snapshot(sessionId).phase();
            } catch (PersistenceException e) {
                err().println("Could not read the session: " + e.getMessage());
                return EXIT_PERSISTENCE_ERROR;
            }
            out().println("Phase: " + phase.wireName());
            printAvailability(agents);
            out().flush();
            return 0;
        }
    }

    @FunctionalInterface
    interface OrchestratorFactory {
        Orchestrator create(OrchestratorSettings settings, boolean dryRun);
    }
}

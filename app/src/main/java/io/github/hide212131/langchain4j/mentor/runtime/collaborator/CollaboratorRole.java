package io.github.hide212131.langchain4j.mentor.runtime.collaborator;

import java.util.List;
import java.util.Objects;

/**
 * Prompt material for one LLM collaborator.
 *
 * @param agentId      capability id the role is registered under
 * @param artifactName artifact the collaborator writes
 * @param role         one-line description of the specialist
 * @param instructions shape of the artifact and what to focus on
 */
public record CollaboratorRole(String agentId, String artifactName, String role, String instructions) {

    public CollaboratorRole {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(artifactName, "artifactName");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(instructions, "instructions");
    }

    static final CollaboratorRole REQUIREMENTS = new CollaboratorRole(
            "requirements_collector",
            "requirements",
            "Requirements analyst who turns a rough idea into clear requirements.",
            "Produce an object with the lists functional, non_functional, constraints, user_stories "
                    + "(each {as_a, i_want, so_that}) and gaps (open questions to ask the user).");

    static final CollaboratorRole ARCHITECTURE = new CollaboratorRole(
            "project_architect",
            "architecture",
            "Software architect who designs a pragmatic system for the gathered requirements.",
            "Produce an object with tech_stack (layer to technology), system_diagram (Mermaid flowchart), "
                    + "data_schema (Mermaid ER diagram), api_design (list of {method, path, purpose}) "
                    + "and deployment_strategy.");

    static final CollaboratorRole ROADMAP = new CollaboratorRole(
            "execution_planner",
            "roadmap",
            "Delivery lead who plans how the architecture gets built.",
            "Produce an object with milestones (list of {name, weeks, deliverables}), sprints "
                    + "(list of {number, goal, items}) and critical_path (Mermaid Gantt chart).");

    static final CollaboratorRole MOCKUPS = new CollaboratorRole(
            "mockup_agent",
            "mockups",
            "Product designer who sketches the main screens.",
            "Produce a list of screens, each {screen_name, wireframe_code (ASCII sketch), user_flow "
                    + "(Mermaid flowchart), interactions (list)}.");

    static List<CollaboratorRole> defaults() {
        return List.of(REQUIREMENTS, ARCHITECTURE, ROADMAP, MOCKUPS);
    }
}

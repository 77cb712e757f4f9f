package io.github.hide212131.langchain4j.mentor.runtime.collaborator;

import io.github.hide212131.langchain4j.mentor.runtime.agent.Collaborator;
import io.github.hide212131.langchain4j.mentor.runtime.agent.CollaboratorOutput;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic collaborators that never call a model. Artifacts are derived from the user message
 * and the upstream artifacts so that dependency order is visible in their output.
 */
public final class DryRunCollaborators {

    private DryRunCollaborators() {
    }

    public static Collaborator requirements() {
        return input -> {
            String need = input.userInput().strip();
            Map<String, Object> story = new LinkedHashMap<>();
            story.put("as_a", "user");
            story.put("i_want", need);
            story.put("so_that", "the project goal is met");
            Map<String, Object> requirements = new LinkedHashMap<>();
            requirements.put("functional", need.isEmpty() ? List.of() : List.of(need));
            requirements.put("non_functional", List.of());
            requirements.put("constraints", List.of());
            requirements.put("user_stories", need.isEmpty() ? List.of() : List.of(story));
            requirements.put("gaps", List.of("Who are the primary users?"));
            return CollaboratorOutput.success(
                    Map.of("requirements", requirements),
                    "[dry-run] Captured " + (need.isEmpty() ? 0 : 1) + " functional requirement(s).");
        };
    }

    public static Collaborator architecture() {
        return input -> {
            List<String> features = functionalRequirements(input.context().get("requirements"));
            Map<String, Object> techStack = new LinkedHashMap<>();
            techStack.put("frontend", "Web client");
            techStack.put("backend", "Java service");
            techStack.put("database", "PostgreSQL");
            List<Object> api = new ArrayList<>();
            api.add(endpoint("GET", "/api/health", "Liveness check"));
            for (int i = 0; i < features.size(); i++) {
                api.add(endpoint("POST", "/api/features/" + (i + 1), features.get(i)));
            }
            Map<String, Object> architecture = new LinkedHashMap<>();
            architecture.put("tech_stack", techStack);
            architecture.put("system_diagram", "flowchart LR\n  Client --> API\n  API --> Database");
            architecture.put("data_schema", "erDiagram\n  PROJECT ||--o{ FEATURE : has");
            architecture.put("api_design", api);
            architecture.put("deployment_strategy", "Single container behind a managed load balancer");
            return CollaboratorOutput.success(
                    Map.of("architecture", architecture),
                    "[dry-run] Drafted an architecture with " + api.size() + " endpoint(s).");
        };
    }

    public static Collaborator roadmap() {
        return input -> {
            int endpoints = listSize(mapValue(input.context().get("architecture"), "api_design"));
            List<Object> milestones = List.of(
                    milestone("Foundation", 2, List.of("Repository and CI", "Deployment pipeline")),
                    milestone("Core features", Math.max(1, endpoints), List.of("API endpoints", "Persistence")),
                    milestone("Launch", 1, List.of("Hardening", "Release")));
            Map<String, Object> sprint = new LinkedHashMap<>();
            sprint.put("number", 1);
            sprint.put("goal", "Walking skeleton");
            sprint.put("items", List.of("Health endpoint", "Database schema"));
            Map<String, Object> roadmap = new LinkedHashMap<>();
            roadmap.put("milestones", milestones);
            roadmap.put("sprints", List.of(sprint));
            roadmap.put("critical_path", "gantt\n  section Build\n  Foundation :a1, 0, 2w\n  Core features :after a1, "
                    + Math.max(1, endpoints) + "w");
            return CollaboratorOutput.success(
                    Map.of("roadmap", roadmap), "[dry-run] Planned " + milestones.size() + " milestones.");
        };
    }

    public static Collaborator mockups() {
        return input -> {
            List<String> features = functionalRequirements(input.context().get("requirements"));
            List<Object> screens = new ArrayList<>();
            screens.add(screen("Home", List.of("Open project", "Start new project")));
            for (String feature : features) {
                screens.add(screen(feature, List.of("Submit", "Cancel")));
            }
            return CollaboratorOutput.success(
                    Map.of("mockups", screens), "[dry-run] Sketched " + screens.size() + " screen(s).");
        };
    }

    private static Map<String, Object> endpoint(String method, String path, String purpose) {
        Map<String, Object> endpoint = new LinkedHashMap<>();
        endpoint.put("method", method);
        endpoint.put("path", path);
        endpoint.put("purpose", purpose);
        return endpoint;
    }

    private static Map<String, Object> milestone(String name, int weeks, List<String> deliverables) {
        Map<String, Object> milestone = new LinkedHashMap<>();
        milestone.put("name", name);
        milestone.put("weeks", weeks);
        milestone.put("deliverables", deliverables);
        return milestone;
    }

    private static Map<String, Object> screen(String name, List<String> interactions) {
        Map<String, Object> screen = new LinkedHashMap<>();
        screen.put("screen_name", name);
        String border = "+" + "-".repeat(name.length() + 2) + "+";
        screen.put("wireframe_code", border + "\n| " + name + " |\n" + border);
        screen.put("user_flow", "flowchart LR\n  Home --> Detail");
        screen.put("interactions", interactions);
        return screen;
    }

    private static List<String> functionalRequirements(Object requirements) {
        Object functional = mapValue(requirements, "functional");
        List<String> result = new ArrayList<>();
        if (functional instanceof List<?> list) {
            list.forEach(item -> result.add(String.valueOf(item)));
        }
        return result;
    }

    private static Object mapValue(Object value, String key) {
        return value instanceof Map<?, ?> map ? map.get(key) : null;
    }

    private static int listSize(Object value) {
        return value instanceof List<?> list ? list.size() : 0;
    }
}

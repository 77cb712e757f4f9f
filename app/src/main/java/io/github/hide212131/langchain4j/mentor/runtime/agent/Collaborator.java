package io.github.hide212131.langchain4j.mentor.runtime.agent;

/**
 * A specialist that turns context and the user message into artifact changes and reply text.
 *
 * <p>Failures are reported either by throwing {@link CollaboratorException} (any runtime exception is
 * treated the same way) or by returning {@link CollaboratorOutput#failure(String)}.
 */
@FunctionalInterface
public interface Collaborator {

    CollaboratorOutput process(CollaboratorInput input);
}

package eu.virtualparadox.laysum.rag.capability;

import java.util.Objects;

/**
 * One message of a generation request.
 *
 * @param role    who speaks
 * @param content message text
 */
public record GenerationMessage(Role role, String content) {

    public enum Role {
        SYSTEM,
        USER
    }

    public GenerationMessage {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static GenerationMessage system(final String content) {
        return new GenerationMessage(Role.SYSTEM, content);
    }

    public static GenerationMessage user(final String content) {
        return new GenerationMessage(Role.USER, content);
    }
}

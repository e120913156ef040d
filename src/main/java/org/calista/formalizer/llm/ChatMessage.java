package org.calista.formalizer.llm;

import java.util.Objects;

/** Role-tagged prompt message. */
public final class ChatMessage {

    public enum Role { SYSTEM, USER, ASSISTANT }

    public final Role role;
    public final String content;

    public ChatMessage(Role role, String content) {
        this.role = Objects.requireNonNull(role, "role");
        this.content = content == null ? "" : content;
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(Role.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(Role.USER, content);
    }

    public String wireRole() {
        return role.name().toLowerCase(java.util.Locale.ROOT);
    }

    @Override
    public String toString() {
        return role + ": " + (content.length() > 80 ? content.substring(0, 80) + "..." : content);
    }
}

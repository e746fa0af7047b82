package com.spatialassistant.session;

import java.util.Objects;

/**
 * One finished utterance in the conversation history.
 */
public final class TranscriptEntry {

    public enum Role {
        USER,
        MODEL
    }

    private final Role role;
    private final String text;

    public TranscriptEntry(Role role, String text) {
        this.role = Objects.requireNonNull(role, "role");
        this.text = Objects.requireNonNull(text, "text");
    }

    public Role getRole() {
        return role;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TranscriptEntry)) {
            return false;
        }
        TranscriptEntry other = (TranscriptEntry) o;
        return role == other.role && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, text);
    }

    @Override
    public String toString() {
        return role + ": " + text;
    }
}

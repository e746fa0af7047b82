package com.spatialassistant.transport;

import java.util.Objects;

/**
 * What the model is asked to be for one session.
 */
public final class SessionConfig {
    private final String model;
    private final String systemInstruction;
    private final String voiceName;

    public SessionConfig(String model, String systemInstruction, String voiceName) {
        this.model = Objects.requireNonNull(model, "model");
        this.systemInstruction = systemInstruction;
        this.voiceName = voiceName;
    }

    public String getModel() {
        return model;
    }

    public String getSystemInstruction() {
        return systemInstruction;
    }

    public String getVoiceName() {
        return voiceName;
    }
}

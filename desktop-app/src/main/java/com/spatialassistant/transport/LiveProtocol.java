package com.spatialassistant.transport;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.spatialassistant.audio.AudioChunk;
import com.spatialassistant.video.VideoFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * JSON messages of the Gemini Live bidirectional streaming API.
 */
final class LiveProtocol {
    private static final Logger LOG = LoggerFactory.getLogger(LiveProtocol.class);

    static final int DEFAULT_OUTPUT_RATE = 24000;
    private static final String PCM_MIME_PREFIX = "audio/pcm";

    private static final Gson GSON = new Gson();

    private LiveProtocol() {
    }

    /**
     * First message on a new socket: model, audio responses and both transcription streams.
     */
    static String setupMessage(SessionConfig config) {
        JsonObject setup = new JsonObject();
        String model = config.getModel();
        setup.addProperty("model", model.startsWith("models/") ? model : "models/" + model);

        JsonObject generationConfig = new JsonObject();
        JsonArray modalities = new JsonArray();
        modalities.add("AUDIO");
        generationConfig.add("responseModalities", modalities);
        if (config.getVoiceName() != null) {
            JsonObject prebuilt = new JsonObject();
            prebuilt.addProperty("voiceName", config.getVoiceName());
            JsonObject voiceConfig = new JsonObject();
            voiceConfig.add("prebuiltVoiceConfig", prebuilt);
            JsonObject speechConfig = new JsonObject();
            speechConfig.add("voiceConfig", voiceConfig);
            generationConfig.add("speechConfig", speechConfig);
        }
        setup.add("generationConfig", generationConfig);

        if (config.getSystemInstruction() != null) {
            JsonObject part = new JsonObject();
            part.addProperty("text", config.getSystemInstruction());
            JsonArray parts = new JsonArray();
            parts.add(part);
            JsonObject instruction = new JsonObject();
            instruction.add("parts", parts);
            setup.add("systemInstruction", instruction);
        }
        setup.add("inputAudioTranscription", new JsonObject());
        setup.add("outputAudioTranscription", new JsonObject());

        JsonObject message = new JsonObject();
        message.add("setup", setup);
        return GSON.toJson(message);
    }

    static String audioMessage(AudioChunk chunk) {
        return realtimeInput("audio", chunk.getData(), chunk.getMimeType());
    }

    static String videoMessage(VideoFrame frame) {
        return realtimeInput("video", frame.getData(), frame.getMimeType());
    }

    private static String realtimeInput(String kind, byte[] data, String mimeType) {
        JsonObject blob = new JsonObject();
        blob.addProperty("data", Base64.getEncoder().encodeToString(data));
        blob.addProperty("mimeType", mimeType);
        JsonObject input = new JsonObject();
        input.add(kind, blob);
        JsonObject message = new JsonObject();
        message.add("realtimeInput", input);
        return GSON.toJson(message);
    }

    /**
     * Translates one server message into channel events, in the order they should be handled.
     * Unknown or malformed messages produce no events.
     */
    static List<ChannelEvent> translate(String json) {
        List<ChannelEvent> events = new ArrayList<>();
        JsonObject message;
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject()) {
                LOG.warn("Ignoring non-object server message");
                return events;
            }
            message = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            LOG.warn("Ignoring malformed server message: {}", e.getMessage());
            return events;
        }

        if (message.has("setupComplete")) {
            events.add(ChannelEvent.opened());
        }
        if (message.has("goAway")) {
            LOG.warn("Server announced disconnect: {}", message.get("goAway"));
        }

        JsonObject content = object(message, "serverContent");
        if (content == null) {
            return events;
        }

        String output = transcriptionText(content, "outputTranscription");
        String input = transcriptionText(content, "inputTranscription");
        if (output != null) {
            events.add(ChannelEvent.outputTranscription(output));
        } else if (input != null) {
            events.add(ChannelEvent.inputTranscription(input));
        }

        if (flag(content, "turnComplete")) {
            events.add(ChannelEvent.turnComplete());
        }

        JsonObject modelTurn = object(content, "modelTurn");
        if (modelTurn != null && modelTurn.has("parts") && modelTurn.get("parts").isJsonArray()) {
            for (JsonElement part : modelTurn.getAsJsonArray("parts")) {
                ChannelEvent audio = audioPart(part);
                if (audio != null) {
                    events.add(audio);
                }
            }
        }

        if (flag(content, "interrupted")) {
            events.add(ChannelEvent.interrupted());
        }
        return events;
    }

    private static ChannelEvent audioPart(JsonElement part) {
        if (!part.isJsonObject()) {
            return null;
        }
        JsonObject inline = object(part.getAsJsonObject(), "inlineData");
        if (inline == null) {
            return null;
        }
        String data = string(inline, "data");
        if (data == null) {
            LOG.warn("Dropping inline data without a string payload");
            return null;
        }
        String mimeType = string(inline, "mimeType");
        if (mimeType == null) {
            mimeType = PCM_MIME_PREFIX;
        }
        if (!mimeType.startsWith(PCM_MIME_PREFIX)) {
            LOG.debug("Skipping inline data of type {}", mimeType);
            return null;
        }
        try {
            byte[] audio = Base64.getDecoder().decode(data);
            return ChannelEvent.audioSegment(audio, sampleRateOf(mimeType), 1);
        } catch (IllegalArgumentException e) {
            LOG.warn("Dropping audio part with invalid base64: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Reads the rate parameter of a mime type such as {@code audio/pcm;rate=24000}.
     */
    static int sampleRateOf(String mimeType) {
        for (String param : mimeType.split(";")) {
            String trimmed = param.trim();
            if (trimmed.startsWith("rate=")) {
                try {
                    return Integer.parseInt(trimmed.substring("rate=".length()));
                } catch (NumberFormatException e) {
                    LOG.warn("Invalid rate in mime type '{}', assuming {}", mimeType, DEFAULT_OUTPUT_RATE);
                }
            }
        }
        return DEFAULT_OUTPUT_RATE;
    }

    private static String transcriptionText(JsonObject content, String key) {
        JsonObject transcription = object(content, key);
        return transcription == null ? null : string(transcription, "text");
    }

    /**
     * String value of a field, or null when it is missing or not a JSON primitive.
     */
    private static String string(JsonObject parent, String key) {
        JsonElement element = parent.get(key);
        return element != null && element.isJsonPrimitive() ? element.getAsString() : null;
    }

    private static JsonObject object(JsonObject parent, String key) {
        JsonElement element = parent.get(key);
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
    }

    private static boolean flag(JsonObject parent, String key) {
        JsonElement element = parent.get(key);
        return element != null && element.isJsonPrimitive() && element.getAsBoolean();
    }
}

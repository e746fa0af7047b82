package com.spatialassistant.transport;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.spatialassistant.audio.AudioChunk;
import org.junit.Test;

import java.util.Base64;
import java.util.List;

import static org.junit.Assert.*;

public class LiveProtocolTest {

    @Test
    public void testSetupMessageRequestsAudioAndTranscriptions() {
        String json = LiveProtocol.setupMessage(new SessionConfig("gemini-test", "Find things.", "Kore"));

        JsonObject setup = JsonParser.parseString(json).getAsJsonObject().getAsJsonObject("setup");
        assertEquals("models/gemini-test", setup.get("model").getAsString());
        JsonObject generation = setup.getAsJsonObject("generationConfig");
        assertEquals("AUDIO", generation.getAsJsonArray("responseModalities").get(0).getAsString());
        assertEquals("Kore", generation.getAsJsonObject("speechConfig").getAsJsonObject("voiceConfig")
            .getAsJsonObject("prebuiltVoiceConfig").get("voiceName").getAsString());
        assertEquals("Find things.", setup.getAsJsonObject("systemInstruction").getAsJsonArray("parts")
            .get(0).getAsJsonObject().get("text").getAsString());
        assertTrue(setup.has("inputAudioTranscription"));
        assertTrue(setup.has("outputAudioTranscription"));
    }

    @Test
    public void testSetupMessageKeepsQualifiedModelName() {
        String json = LiveProtocol.setupMessage(new SessionConfig("models/x", null, null));

        JsonObject setup = JsonParser.parseString(json).getAsJsonObject().getAsJsonObject("setup");
        assertEquals("models/x", setup.get("model").getAsString());
        assertFalse(setup.has("systemInstruction"));
    }

    @Test
    public void testAudioMessageIsBase64RealtimeInput() {
        byte[] pcm = {1, 2, 3, 4};

        String json = LiveProtocol.audioMessage(new AudioChunk(pcm, 16000));

        JsonObject audio = JsonParser.parseString(json).getAsJsonObject()
            .getAsJsonObject("realtimeInput").getAsJsonObject("audio");
        assertEquals("audio/pcm;rate=16000", audio.get("mimeType").getAsString());
        assertArrayEquals(pcm, Base64.getDecoder().decode(audio.get("data").getAsString()));
    }

    @Test
    public void testSetupCompleteOpensChannel() {
        List<ChannelEvent> events = LiveProtocol.translate("{\"setupComplete\":{}}");

        assertEquals(1, events.size());
        assertEquals(ChannelEvent.Type.OPENED, events.get(0).getType());
    }

    @Test
    public void testTranslatesServerContent() {
        String audio = Base64.getEncoder().encodeToString(new byte[] {0, 1, 2, 3});
        String json = "{\"serverContent\":{"
            + "\"outputTranscription\":{\"text\":\"a cup [1, 2, 3, 4]\"},"
            + "\"modelTurn\":{\"parts\":[{\"inlineData\":{\"mimeType\":\"audio/pcm;rate=24000\",\"data\":\"" + audio + "\"}}]},"
            + "\"turnComplete\":true}}";

        List<ChannelEvent> events = LiveProtocol.translate(json);

        assertEquals(3, events.size());
        assertEquals(ChannelEvent.Type.OUTPUT_TRANSCRIPTION, events.get(0).getType());
        assertEquals("a cup [1, 2, 3, 4]", events.get(0).getText());
        assertEquals(ChannelEvent.Type.TURN_COMPLETE, events.get(1).getType());
        ChannelEvent segment = events.get(2);
        assertEquals(ChannelEvent.Type.AUDIO_SEGMENT, segment.getType());
        assertEquals(24000, segment.getSampleRate());
        assertEquals(1, segment.getChannels());
        assertArrayEquals(new byte[] {0, 1, 2, 3}, segment.getAudio());
    }

    @Test
    public void testTranslatesInputTranscriptionAndInterruption() {
        List<ChannelEvent> events = LiveProtocol.translate(
            "{\"serverContent\":{\"inputTranscription\":{\"text\":\"hello\"},\"interrupted\":true}}");

        assertEquals(2, events.size());
        assertEquals(ChannelEvent.Type.INPUT_TRANSCRIPTION, events.get(0).getType());
        assertEquals("hello", events.get(0).getText());
        assertEquals(ChannelEvent.Type.INTERRUPTED, events.get(1).getType());
    }

    @Test
    public void testSkipsNonAudioParts() {
        List<ChannelEvent> events = LiveProtocol.translate(
            "{\"serverContent\":{\"modelTurn\":{\"parts\":[{\"text\":\"thinking\"},"
                + "{\"inlineData\":{\"mimeType\":\"image/png\",\"data\":\"AAAA\"}}]}}}");

        assertTrue(events.isEmpty());
    }

    @Test
    public void testMalformedMessageProducesNoEvents() {
        assertTrue(LiveProtocol.translate("{\"serverContent\": {").isEmpty());
        assertTrue(LiveProtocol.translate("[1, 2]").isEmpty());
        assertTrue(LiveProtocol.translate("{\"usageMetadata\":{}}").isEmpty());
    }

    @Test
    public void testAudioPartWithObjectPayloadIsDropped() {
        List<ChannelEvent> events = LiveProtocol.translate(
            "{\"serverContent\":{\"modelTurn\":{\"parts\":[{\"inlineData\":{\"mimeType\":\"audio/pcm\",\"data\":{}}}]}}}");

        assertTrue(events.isEmpty());
    }

    @Test
    public void testAudioPartWithNullMimeTypeDefaultsToPcm() {
        List<ChannelEvent> events = LiveProtocol.translate(
            "{\"serverContent\":{\"modelTurn\":{\"parts\":[{\"inlineData\":{\"mimeType\":null,\"data\":\"AAAA\"}}]}}}");

        assertEquals(1, events.size());
        assertEquals(ChannelEvent.Type.AUDIO_SEGMENT, events.get(0).getType());
        assertEquals(LiveProtocol.DEFAULT_OUTPUT_RATE, events.get(0).getSampleRate());
    }

    @Test
    public void testTranscriptionWithObjectTextIsIgnored() {
        List<ChannelEvent> events = LiveProtocol.translate(
            "{\"serverContent\":{\"outputTranscription\":{\"text\":{}},\"turnComplete\":true}}");

        assertEquals(1, events.size());
        assertEquals(ChannelEvent.Type.TURN_COMPLETE, events.get(0).getType());
    }

    @Test
    public void testSampleRateOfMimeType() {
        assertEquals(16000, LiveProtocol.sampleRateOf("audio/pcm;rate=16000"));
        assertEquals(LiveProtocol.DEFAULT_OUTPUT_RATE, LiveProtocol.sampleRateOf("audio/pcm"));
        assertEquals(LiveProtocol.DEFAULT_OUTPUT_RATE, LiveProtocol.sampleRateOf("audio/pcm;rate=fast"));
    }
}

package com.coursecast.orchestrator.client;

import com.coursecast.orchestrator.config.CourseCastProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Google Cloud Text-to-Speech over REST.
 *
 * Requests LINEAR16 so the response is a WAV file whose length can be
 * measured locally from its header rather than estimated from word count.
 */
@Component
public class GoogleTextToSpeechClient extends JsonHttpClient implements SpeechSynthesisClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleTextToSpeechClient.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SynthesizeResponse(String audioContent) {}

    private final CourseCastProperties.Tts config;

    public GoogleTextToSpeechClient(CourseCastProperties props, ObjectMapper objectMapper) {
        super(objectMapper);
        this.config = props.tts();
    }

    @Override
    public SynthesizedAudio synthesize(String text) {
        Map<String, Object> body = Map.of(
                "input", Map.of("text", text),
                "voice", Map.of(
                        "languageCode", config.languageCode(),
                        "name",         config.voiceName()),
                "audioConfig", Map.of(
                        "audioEncoding", "LINEAR16",
                        "speakingRate",  config.speakingRate()));

        String url = config.url() + "?key=" + URLEncoder.encode(config.apiKey(), StandardCharsets.UTF_8);
        SynthesizeResponse resp = parse(
                postJson(url, body, config.timeout(), "Text-to-speech"),
                SynthesizeResponse.class, "Text-to-speech");

        if (resp.audioContent() == null || resp.audioContent().isEmpty()) {
            throw new CollaboratorException("Text-to-speech returned no audio", false);
        }
        byte[] audio = Base64.getDecoder().decode(resp.audioContent());
        double seconds = measureDuration(audio);
        log.debug("Synthesized {} chars into {}s of audio", text.length(), seconds);
        return new SynthesizedAudio(audio, seconds);
    }

    /** Playback length of a WAV file in seconds. */
    static double measureDuration(byte[] wav) {
        try (AudioInputStream in = AudioSystem.getAudioInputStream(new ByteArrayInputStream(wav))) {
            AudioFormat format = in.getFormat();
            long frames = in.getFrameLength();
            if (frames == AudioSystem.NOT_SPECIFIED || format.getFrameRate() <= 0) {
                throw new CollaboratorException("Text-to-speech audio has no measurable length", false);
            }
            return frames / (double) format.getFrameRate();
        } catch (UnsupportedAudioFileException | IOException e) {
            throw new CollaboratorException("Text-to-speech returned unreadable audio: " + e.getMessage(), false, e);
        }
    }
}

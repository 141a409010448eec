package com.coursecast.orchestrator.client;

public interface SpeechSynthesisClient {

    SynthesizedAudio synthesize(String text);
}

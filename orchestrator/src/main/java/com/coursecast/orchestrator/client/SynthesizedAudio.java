package com.coursecast.orchestrator.client;

/** WAV bytes plus their measured playback length. */
public record SynthesizedAudio(byte[] audio, double durationSeconds) {}

package com.coursecast.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * PDF-to-video pipeline service.
 *
 * To run locally (PostgreSQL on localhost:5432, render service on :3000):
 *   GEMINI_API_KEY=... GOOGLE_TTS_API_KEY=... mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CourseCastApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourseCastApplication.class, args);
    }
}

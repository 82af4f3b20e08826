package com.scholary.transcriber.config;

import com.scholary.transcriber.whisper.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the whisper.cpp recognizer.
 *
 * <p>Enables the WhisperProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(WhisperProperties.class)
public class WhisperConfig {}

package com.scholary.transcriber.config;

import com.scholary.transcriber.service.TranscriptWriter;
import java.nio.file.Path;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves persisted transcripts under {@code /downloads/<jobId>.txt}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final TranscriptionProperties properties;

  public WebConfig(TranscriptionProperties properties) {
    this.properties = properties;
  }

  @Override
  public void addResourceHandlers(ResourceHandlerRegistry registry) {
    String location = Path.of(properties.outputDir()).toAbsolutePath().toUri().toString();
    registry
        .addResourceHandler(TranscriptWriter.DOWNLOAD_PATH + "**")
        .addResourceLocations(location.endsWith("/") ? location : location + "/");
  }
}

package com.scholary.transcriber.whisper;

import com.scholary.transcriber.chunking.AudioChunk;
import com.scholary.transcriber.exception.OutputMissingException;
import com.scholary.transcriber.exception.TranscriptionException;
import com.scholary.transcriber.process.ProcessRunner;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link WhisperService} that shells out to the whisper.cpp CLI.
 *
 * <p>CLI contract:
 *
 * <pre>
 * ${binary} -m ${model} -l ${language} -t ${threads} -bo 1 -bs 1 [--prompt ${prompt}]
 *           -f ${chunk} -otxt -of ${outputBase} -nth 0.7 -et 2.0 -lpt -0.5
 * </pre>
 *
 * <p>The text lands in {@code ${outputBase}.txt}. A zero exit without that file is a failure.
 */
@Component
public class WhisperCliClient implements WhisperService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperCliClient.class);

  private final ProcessRunner processRunner;
  private final WhisperProperties properties;

  public WhisperCliClient(ProcessRunner processRunner, WhisperProperties properties) {
    this.processRunner = processRunner;
    this.properties = properties;

    LOGGER.info(
        "Initialized whisper client: binary={}, model={}, language={}",
        properties.binaryPath(),
        properties.modelPath(),
        properties.language());
  }

  @Override
  public String transcribe(AudioChunk chunk, Path outputBase, int threads) {
    processRunner.run(
        properties.binaryPath(),
        buildArguments(chunk.file(), outputBase, threads),
        "Failed to run whisper-cli on chunk " + (chunk.index() + 1));

    Path textFile = outputBase.resolveSibling(outputBase.getFileName() + ".txt");
    if (!Files.isRegularFile(textFile)) {
      throw new OutputMissingException(
          String.format("Transcript for chunk %d was not generated", chunk.index() + 1), textFile);
    }

    try {
      // whisper can cut a multibyte character at a token boundary; bad bytes become U+FFFD
      return new String(Files.readAllBytes(textFile), StandardCharsets.UTF_8).trim();
    } catch (IOException e) {
      throw new TranscriptionException(
          String.format("Could not read transcript for chunk %d", chunk.index() + 1), e);
    }
  }

  List<String> buildArguments(Path chunkFile, Path outputBase, int threads) {
    List<String> args = new ArrayList<>();
    args.add("-m");
    args.add(properties.modelPath());
    args.add("-l");
    args.add(properties.language());
    args.add("-t");
    args.add(String.valueOf(threads));
    args.add("-bo");
    args.add(String.valueOf(properties.bestOf()));
    args.add("-bs");
    args.add(String.valueOf(properties.beamSize()));
    if (properties.hasPrompt()) {
      args.add("--prompt");
      args.add(properties.prompt());
    }
    args.add("-f");
    args.add(chunkFile.toString());
    args.add("-otxt");
    args.add("-of");
    args.add(outputBase.toString());
    args.add("-nth");
    args.add(format(properties.noSpeechThreshold()));
    args.add("-et");
    args.add(format(properties.entropyThreshold()));
    args.add("-lpt");
    args.add(format(properties.logprobThreshold()));
    return args;
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }
}

package github.sarthakdev143.reel_forge.integration.media;

import github.sarthakdev143.reel_forge.integration.storage.AssetStorage;
import github.sarthakdev143.reel_forge.model.AssetRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Runs FFmpeg/ffprobe processes and moves rendered files into asset storage.
 */
@Component
public class FfmpegCommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegCommandRunner.class);
    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String FFPROBE_PATH_ENV = "FFPROBE_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
    private static final String DEFAULT_FFPROBE_BINARY = "ffprobe";
    private static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofMinutes(10);
    private static final int OUTPUT_TAIL_CHARS = 4000;

    private final AssetStorage assetStorage;
    private final Duration commandTimeout;

    @Autowired
    public FfmpegCommandRunner(AssetStorage assetStorage) {
        this(assetStorage, DEFAULT_COMMAND_TIMEOUT);
    }

    FfmpegCommandRunner(AssetStorage assetStorage, Duration commandTimeout) {
        this.assetStorage = assetStorage;
        this.commandTimeout = commandTimeout;
    }

    /**
     * Renders into a temporary file, stores it and returns the new reference.
     *
     * @param commandForOutput builds the full command line given the output path
     */
    public AssetRef renderAsset(String stage, String extension, Function<Path, List<String>> commandForOutput)
            throws IOException, InterruptedException {
        Path output = Files.createTempFile("reel-forge-" + stage.replace(' ', '-') + "-", "." + extension);
        try {
            run(commandForOutput.apply(output), stage);
            return assetStorage.putFile(output);
        } finally {
            deleteIfExists(output);
        }
    }

    /**
     * Runs the command to completion and returns its merged output. The process is killed when it outlives the
     * command timeout or when the calling thread is interrupted.
     */
    public String run(List<String> command, String stage) throws IOException, InterruptedException {
        logger.info("Running FFmpeg command for stage {}: {}", stage, String.join(" ", command));
        Path log = Files.createTempFile("reel-forge-ffmpeg-", ".log");
        Process process = null;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(log.toFile())
                    .start();

            boolean finished;
            try {
                finished = process.waitFor(commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                logger.info("FFmpeg command for stage {} interrupted, stopping it", stage);
                Thread.currentThread().interrupt();
                throw e;
            }
            if (!finished) {
                throw new IOException("FFmpeg timed out after " + commandTimeout.toSeconds() + "s during stage: " + stage);
            }

            String output = new String(Files.readAllBytes(log), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new IOException(
                        "FFmpeg failed during stage "
                                + stage
                                + " with exit code "
                                + process.exitValue()
                                + ". Output: "
                                + tail(output));
            }
            return output;
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteIfExists(log);
        }
    }

    public Path localPath(AssetRef ref) throws IOException {
        return assetStorage.localPath(ref);
    }

    public String ffmpegBinary() {
        return resolveBinary(FFMPEG_PATH_ENV, DEFAULT_FFMPEG_BINARY);
    }

    public String ffprobeBinary() {
        return resolveBinary(FFPROBE_PATH_ENV, DEFAULT_FFPROBE_BINARY);
    }

    static String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    static String formatDecimal(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }

    private static String tail(String output) {
        if (output.length() <= OUTPUT_TAIL_CHARS) {
            return output;
        }
        return "..." + output.substring(output.length() - OUTPUT_TAIL_CHARS);
    }

    private String resolveBinary(String envName, String fallback) {
        String configuredPath = System.getenv(envName);
        if (configuredPath != null && !configuredPath.isBlank()) {
            return configuredPath;
        }
        return fallback;
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete temporary FFmpeg file {}", path, e);
        }
    }
}

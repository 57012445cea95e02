package github.sarthakdev143.reel_forge.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Fails startup when FFmpeg or ffprobe cannot be run.
 */
@Component
@ConditionalOnProperty(name = "reel-forge.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final int BINARY_CHECK_TIMEOUT_SECONDS = 10;

    private final ReelForgeProperties properties;

    public StartupPreflightChecks(ReelForgeProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkBinary("FFmpeg", "FFMPEG_PATH", "ffmpeg");
        checkBinary("ffprobe", "FFPROBE_PATH", "ffprobe");
        checkStorageRoot();
    }

    private void checkBinary(String displayName, String envName, String defaultBinary) {
        String configuredPath = System.getenv(envName);
        if (configuredPath != null && !configuredPath.isBlank()) {
            Path binaryPath = Path.of(configuredPath);
            if (!Files.isRegularFile(binaryPath)) {
                throw new IllegalStateException(
                        displayName + " binary not found at " + binaryPath.toAbsolutePath()
                                + ". Set " + envName + " to a valid " + defaultBinary + " executable path.");
            }
            return;
        }

        try {
            Process process = new ProcessBuilder(defaultBinary, "-version")
                    .redirectErrorStream(true)
                    .start();
            boolean finished = process.waitFor(BINARY_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        displayName + " is not available on PATH. Install FFmpeg or set " + envName + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    displayName + " is not available on PATH. Install FFmpeg or set " + envName + ".",
                    e);
        }
    }

    private void checkStorageRoot() {
        Path root = Path.of(properties.storage().root());
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new IllegalStateException("Asset storage root " + root.toAbsolutePath() + " cannot be created.", e);
        }
        if (!Files.isWritable(root)) {
            throw new IllegalStateException("Asset storage root " + root.toAbsolutePath() + " is not writable.");
        }
    }
}

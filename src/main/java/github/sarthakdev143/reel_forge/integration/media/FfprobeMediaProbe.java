package github.sarthakdev143.reel_forge.integration.media;

import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.MediaKind;
import github.sarthakdev143.reel_forge.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

@Component
public class FfprobeMediaProbe implements MediaProbe {

    private static final Logger logger = LoggerFactory.getLogger(FfprobeMediaProbe.class);

    private final FfmpegCommandRunner commandRunner;

    public FfprobeMediaProbe(FfmpegCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public ProbeResult probe(AssetRef ref) {
        try {
            Path path = commandRunner.localPath(ref);
            String output = commandRunner.run(buildProbeCommand(path), "probe " + ref);
            return parseProbeOutput(output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.failed();
        } catch (IOException | RuntimeException e) {
            logger.warn("ffprobe failed for asset {}: {}", ref, e.getMessage());
            return ProbeResult.failed();
        }
    }

    List<String> buildProbeCommand(Path path) {
        return List.of(
                commandRunner.ffprobeBinary(),
                "-v",
                "error",
                "-show_entries",
                "format=duration,format_name:stream=codec_type",
                "-of",
                "default=noprint_wrappers=1",
                path.toString());
    }

    /**
     * Parses {@code key=value} lines. Still images report a video stream with no usable duration.
     */
    ProbeResult parseProbeOutput(String output) {
        boolean hasVideo = false;
        boolean hasAudio = false;
        boolean imageFormat = false;
        double duration = Double.NaN;

        for (String rawLine : output.split("\\R")) {
            String line = rawLine.trim();
            int separator = line.indexOf('=');
            if (separator < 0) {
                continue;
            }
            String key = line.substring(0, separator);
            String value = line.substring(separator + 1).trim().toLowerCase(Locale.ROOT);
            switch (key) {
                case "codec_type" -> {
                    hasVideo |= value.equals("video");
                    hasAudio |= value.equals("audio");
                }
                case "format_name" -> imageFormat = value.contains("image2") || value.endsWith("_pipe");
                case "duration" -> duration = parseDuration(value);
                default -> {
                    // other entries are not needed
                }
            }
        }

        if (hasVideo && (imageFormat || Double.isNaN(duration))) {
            return new ProbeResult(0.0, MediaKind.IMAGE, true);
        }
        if (Double.isNaN(duration) || duration < 0) {
            return ProbeResult.failed();
        }
        if (hasVideo) {
            return ProbeResult.of(duration, MediaKind.VIDEO);
        }
        if (hasAudio) {
            return ProbeResult.of(duration, MediaKind.AUDIO);
        }
        return ProbeResult.failed();
    }

    private double parseDuration(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}

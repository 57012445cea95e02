package github.sarthakdev143.reel_forge.integration.media;

import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.MediaKind;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static github.sarthakdev143.reel_forge.integration.media.FfmpegCommandRunner.formatDecimal;
import static github.sarthakdev143.reel_forge.integration.media.FfmpegCommandRunner.formatSeconds;

@Component
public class FfmpegMediaEditor implements MediaEditor {

    private static final double MIN_ATEMPO = 0.5;
    private static final double MAX_ATEMPO = 2.0;
    private static final int RESAMPLE_RATE = 44100;
    private static final String AUDIO_EXTENSION = "m4a";
    private static final String VIDEO_EXTENSION = "mp4";

    private final FfmpegCommandRunner commandRunner;

    public FfmpegMediaEditor(FfmpegCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public AssetRef trim(AssetRef source, MediaKind kind, double targetSec, FadePlan fades)
            throws IOException, InterruptedException {
        Path input = commandRunner.localPath(source);
        String extension = kind == MediaKind.VIDEO ? VIDEO_EXTENSION : AUDIO_EXTENSION;
        return commandRunner.renderAsset("trim", extension,
                output -> buildTrimCommand(input, kind, targetSec, fades, output));
    }

    @Override
    public AssetRef stretchAudio(AssetRef source, double speedFactor, boolean preservePitch, double targetSec, FadePlan fades)
            throws IOException, InterruptedException {
        Path input = commandRunner.localPath(source);
        return commandRunner.renderAsset("stretch audio", AUDIO_EXTENSION,
                output -> buildStretchAudioCommand(input, speedFactor, preservePitch, targetSec, fades, output));
    }

    @Override
    public AssetRef loopAudio(AssetRef source, double targetSec, FadePlan fades)
            throws IOException, InterruptedException {
        Path input = commandRunner.localPath(source);
        return commandRunner.renderAsset("loop audio", AUDIO_EXTENSION,
                output -> buildLoopAudioCommand(input, targetSec, fades, output));
    }

    @Override
    public AssetRef extendVideo(
            AssetRef source,
            double sourceSec,
            double targetSec,
            boolean stretchAudioTrack,
            boolean preservePitch,
            FadePlan fades) throws IOException, InterruptedException {
        Path input = commandRunner.localPath(source);
        return commandRunner.renderAsset("extend video", VIDEO_EXTENSION,
                output -> buildExtendVideoCommand(input, sourceSec, targetSec, stretchAudioTrack, preservePitch, fades, output));
    }

    List<String> buildTrimCommand(Path input, MediaKind kind, double targetSec, FadePlan fades, Path output) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        command.add("-i");
        command.add(input.toString());
        command.add("-t");
        command.add(formatSeconds(targetSec));

        List<String> audioFilters = audioFadeFilters(targetSec, fades);
        if (kind == MediaKind.VIDEO) {
            List<String> videoFilters = videoFadeFilters(targetSec, fades);
            if (!videoFilters.isEmpty()) {
                command.add("-vf");
                command.add(String.join(",", videoFilters));
            }
            command.add("-map");
            command.add("0:v:0");
            command.add("-map");
            command.add("0:a?");
            appendVideoCodec(command);
        }
        if (!audioFilters.isEmpty()) {
            command.add("-af");
            command.add(String.join(",", audioFilters));
        }
        appendAudioCodec(command);
        command.add(output.toString());
        return command;
    }

    List<String> buildStretchAudioCommand(
            Path input,
            double speedFactor,
            boolean preservePitch,
            double targetSec,
            FadePlan fades,
            Path output) {
        List<String> filters = new ArrayList<>(audioStretchFilters(speedFactor, preservePitch));
        filters.addAll(audioFadeFilters(targetSec, fades));

        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        command.add("-i");
        command.add(input.toString());
        command.add("-af");
        command.add(String.join(",", filters));
        command.add("-t");
        command.add(formatSeconds(targetSec));
        appendAudioCodec(command);
        command.add(output.toString());
        return command;
    }

    List<String> buildLoopAudioCommand(Path input, double targetSec, FadePlan fades, Path output) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        command.add("-stream_loop");
        command.add("-1");
        command.add("-i");
        command.add(input.toString());
        command.add("-t");
        command.add(formatSeconds(targetSec));

        List<String> filters = audioFadeFilters(targetSec, fades);
        if (!filters.isEmpty()) {
            command.add("-af");
            command.add(String.join(",", filters));
        }
        appendAudioCodec(command);
        command.add(output.toString());
        return command;
    }

    List<String> buildExtendVideoCommand(
            Path input,
            double sourceSec,
            double targetSec,
            boolean stretchAudioTrack,
            boolean preservePitch,
            FadePlan fades,
            Path output) {
        double holdSeconds = Math.max(0.0, targetSec - sourceSec);

        List<String> videoFilters = new ArrayList<>();
        videoFilters.add("tpad=stop_mode=clone:stop_duration=" + formatSeconds(holdSeconds));
        videoFilters.addAll(videoFadeFilters(targetSec, fades));

        List<String> audioFilters = new ArrayList<>();
        if (stretchAudioTrack && sourceSec > 0) {
            audioFilters.addAll(audioStretchFilters(sourceSec / targetSec, preservePitch));
        } else {
            audioFilters.add("apad=whole_dur=" + formatSeconds(targetSec));
        }
        audioFilters.addAll(audioFadeFilters(targetSec, fades));

        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        command.add("-i");
        command.add(input.toString());
        command.add("-vf");
        command.add(String.join(",", videoFilters));
        command.add("-af");
        command.add(String.join(",", audioFilters));
        command.add("-map");
        command.add("0:v:0");
        command.add("-map");
        command.add("0:a?");
        command.add("-t");
        command.add(formatSeconds(targetSec));
        appendVideoCodec(command);
        appendAudioCodec(command);
        command.add(output.toString());
        return command;
    }

    /**
     * {@code atempo} accepts factors in [0.5, 2.0]; larger changes are chained.
     */
    List<String> audioStretchFilters(double speedFactor, boolean preservePitch) {
        if (!(speedFactor > 0)) {
            throw new IllegalArgumentException("Speed factor must be positive: " + speedFactor);
        }

        List<String> filters = new ArrayList<>();
        if (!preservePitch) {
            filters.add("aresample=" + RESAMPLE_RATE);
            filters.add("asetrate=" + RESAMPLE_RATE + "*" + formatDecimal(speedFactor));
            filters.add("aresample=" + RESAMPLE_RATE);
            return filters;
        }

        double remaining = speedFactor;
        while (remaining < MIN_ATEMPO) {
            filters.add("atempo=" + formatDecimal(MIN_ATEMPO));
            remaining /= MIN_ATEMPO;
        }
        while (remaining > MAX_ATEMPO) {
            filters.add("atempo=" + formatDecimal(MAX_ATEMPO));
            remaining /= MAX_ATEMPO;
        }
        filters.add("atempo=" + formatDecimal(remaining));
        return filters;
    }

    private List<String> audioFadeFilters(double outputSec, FadePlan fades) {
        List<String> filters = new ArrayList<>();
        if (fades.fadeInSec() > 0) {
            filters.add("afade=t=in:st=0:d=" + formatSeconds(fades.fadeInSec()));
        }
        if (fades.fadeOutSec() > 0) {
            filters.add("afade=t=out:st=" + formatSeconds(outputSec - fades.fadeOutSec())
                    + ":d=" + formatSeconds(fades.fadeOutSec()));
        }
        return filters;
    }

    private List<String> videoFadeFilters(double outputSec, FadePlan fades) {
        List<String> filters = new ArrayList<>();
        if (fades.fadeInSec() > 0) {
            filters.add("fade=t=in:st=0:d=" + formatSeconds(fades.fadeInSec()));
        }
        if (fades.fadeOutSec() > 0) {
            filters.add("fade=t=out:st=" + formatSeconds(outputSec - fades.fadeOutSec())
                    + ":d=" + formatSeconds(fades.fadeOutSec()));
        }
        return filters;
    }

    private void appendVideoCodec(List<String> command) {
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-crf");
        command.add("23");
        command.add("-pix_fmt");
        command.add("yuv420p");
    }

    private void appendAudioCodec(List<String> command) {
        command.add("-c:a");
        command.add("aac");
        command.add("-b:a");
        command.add("192k");
    }
}

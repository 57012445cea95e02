package github.sarthakdev143.reel_forge.integration.media;

import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.OutputPreset;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class FfmpegMediaAssembler implements MediaAssembler {

    static final double MUSIC_BED_VOLUME = 0.3;

    private final FfmpegCommandRunner commandRunner;

    public FfmpegMediaAssembler(FfmpegCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public AssetRef mixAudio(AssetRef speech, AssetRef music) throws IOException, InterruptedException {
        Path speechPath = commandRunner.localPath(speech);
        Path musicPath = commandRunner.localPath(music);
        return commandRunner.renderAsset("mix audio", "m4a",
                output -> buildMixAudioCommand(speechPath, musicPath, output));
    }

    @Override
    public AssetRef muxScene(AssetRef video, AssetRef audio, OutputPreset preset) throws IOException, InterruptedException {
        Path videoPath = commandRunner.localPath(video);
        Path audioPath = commandRunner.localPath(audio);
        return commandRunner.renderAsset("mux scene", "mp4",
                output -> buildMuxSceneCommand(videoPath, audioPath, preset, output));
    }

    @Override
    public AssetRef concatScenes(List<AssetRef> sceneClips) throws IOException, InterruptedException {
        if (sceneClips.isEmpty()) {
            throw new IllegalArgumentException("At least one scene clip is required.");
        }
        List<Path> clipPaths = new ArrayList<>();
        for (AssetRef clip : sceneClips) {
            clipPaths.add(commandRunner.localPath(clip));
        }
        return commandRunner.renderAsset("concat scenes", "mp4",
                output -> buildConcatCommand(clipPaths, output));
    }

    List<String> buildMixAudioCommand(Path speechPath, Path musicPath, Path outputPath) {
        String filter = "[1:a]volume=" + MUSIC_BED_VOLUME + "[bed];"
                + "[0:a][bed]amix=inputs=2:duration=first:dropout_transition=0[a]";
        return List.of(
                commandRunner.ffmpegBinary(),
                "-y",
                "-i",
                speechPath.toString(),
                "-i",
                musicPath.toString(),
                "-filter_complex",
                filter,
                "-map",
                "[a]",
                "-c:a",
                "aac",
                "-b:a",
                "192k",
                outputPath.toString());
    }

    List<String> buildMuxSceneCommand(Path videoPath, Path audioPath, OutputPreset preset, Path outputPath) {
        String scalePad = "scale=" + preset.width() + ":" + preset.height()
                + ":force_original_aspect_ratio=decrease,pad=" + preset.width() + ":" + preset.height()
                + ":(ow-iw)/2:(oh-ih)/2,setsar=1,fps=30";
        return List.of(
                commandRunner.ffmpegBinary(),
                "-y",
                "-i",
                videoPath.toString(),
                "-i",
                audioPath.toString(),
                "-vf",
                scalePad,
                "-map",
                "0:v:0",
                "-map",
                "1:a:0",
                "-c:v",
                "libx264",
                "-preset",
                "veryfast",
                "-crf",
                "23",
                "-pix_fmt",
                "yuv420p",
                "-c:a",
                "aac",
                "-b:a",
                "192k",
                "-shortest",
                outputPath.toString());
    }

    List<String> buildConcatCommand(List<Path> sceneClips, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        for (Path sceneClip : sceneClips) {
            command.add("-i");
            command.add(sceneClip.toString());
        }

        StringBuilder filterBuilder = new StringBuilder();
        for (int index = 0; index < sceneClips.size(); index++) {
            filterBuilder.append("[").append(index).append(":v]")
                    .append("[").append(index).append(":a]");
        }
        filterBuilder.append("concat=n=").append(sceneClips.size()).append(":v=1:a=1[v][a]");

        command.add("-filter_complex");
        command.add(filterBuilder.toString());
        command.add("-map");
        command.add("[v]");
        command.add("-map");
        command.add("[a]");
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-crf");
        command.add("23");
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-c:a");
        command.add("aac");
        command.add("-b:a");
        command.add("192k");
        command.add(outputPath.toString());
        return command;
    }
}

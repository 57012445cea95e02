package github.sarthakdev143.reel_forge.integration.media;

import github.sarthakdev143.reel_forge.integration.storage.LocalAssetStorage;
import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.MediaKind;
import github.sarthakdev143.reel_forge.model.ProbeResult;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FfprobeMediaProbeTest {

    private final FfprobeMediaProbe probe =
            new FfprobeMediaProbe(new FfmpegCommandRunner(new LocalAssetStorage(Path.of("target/test-assets"))));

    @Test
    void videoWithAudioIsReportedAsVideo() {
        ProbeResult result = probe.parseProbeOutput(
                "codec_type=video\ncodec_type=audio\nformat_name=mov,mp4,m4a,3gp,3g2,mj2\nduration=6.040000\n");

        assertThat(result.ok()).isTrue();
        assertThat(result.kind()).isEqualTo(MediaKind.VIDEO);
        assertThat(result.durationSeconds()).isEqualTo(6.04);
    }

    @Test
    void audioOnlyIsReportedAsAudio() {
        ProbeResult result = probe.parseProbeOutput("codec_type=audio\nformat_name=mp3\nduration=3.5\n");

        assertThat(result).isEqualTo(ProbeResult.of(3.5, MediaKind.AUDIO));
    }

    @Test
    void stillImageHasNoDuration() {
        ProbeResult result = probe.parseProbeOutput("codec_type=video\nformat_name=png_pipe\nduration=N/A\n");

        assertThat(result.ok()).isTrue();
        assertThat(result.kind()).isEqualTo(MediaKind.IMAGE);
        assertThat(result.durationSeconds()).isZero();
    }

    @Test
    void unreadableOutputFails() {
        assertThat(probe.parseProbeOutput("").ok()).isFalse();
        assertThat(probe.parseProbeOutput("codec_type=audio\nduration=N/A\n").ok()).isFalse();
    }

    @Test
    void missingAssetFailsWithoutThrowing() {
        ProbeResult result = probe.probe(new AssetRef("local:00000000-0000-0000-0000-000000000000.mp4"));

        assertThat(result.ok()).isFalse();
        assertThat(result.durationSeconds()).isNaN();
    }
}

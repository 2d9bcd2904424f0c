package com.wear.stitch.service;

import com.wear.stitch.config.NativeLibraryLoader;
import com.wear.stitch.config.YamlConfig;
import com.wear.stitch.core.capture.CaptureException;
import com.wear.stitch.core.capture.CaptureSourceFactory;
import com.wear.stitch.core.frame.Frame;
import com.wear.stitch.core.frame.FrameCodec;
import com.wear.stitch.core.stitcher.FrameAlignment;
import com.wear.stitch.dto.SessionRequest;
import com.wear.stitch.dto.StitchFramesRequest;
import com.wear.stitch.dto.StitchResponse;
import com.wear.stitch.model.StitchRecord;
import com.wear.stitch.repository.StitchRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.Mockito.mock;

class StitchServiceTest {

    private static final int WIDTH = 24;
    private static final int HEIGHT = 24;

    @TempDir
    Path dataDir;

    @TempDir
    Path outDir;

    private StitchService stitchService;

    @BeforeEach
    void setUp() {
        YamlConfig yamlConfig = new YamlConfig();
        yamlConfig.getSystem().setDataDir(dataDir.toString());
        yamlConfig.getCapture().setOutDir(outDir.toString());
        yamlConfig.getStitching().setRound(false);

        StitchConfigService configService = new StitchConfigService();
        ReflectionTestUtils.setField(configService, "yamlConfig", yamlConfig);
        configService.init();

        CaptureService captureService = new CaptureService();
        ReflectionTestUtils.setField(captureService, "yamlConfig", yamlConfig);
        ReflectionTestUtils.setField(captureService, "captureSourceFactory", mock(CaptureSourceFactory.class));

        StitchRecordRepository repository = new StitchRecordRepository();
        ReflectionTestUtils.setField(repository, "yamlConfig", yamlConfig);
        repository.init();

        stitchService = new StitchService();
        ReflectionTestUtils.setField(stitchService, "yamlConfig", yamlConfig);
        ReflectionTestUtils.setField(stitchService, "stitchConfigService", configService);
        ReflectionTestUtils.setField(stitchService, "captureService", captureService);
        ReflectionTestUtils.setField(stitchService, "recordRepository", repository);
    }

    private static Frame window(int start) {
        return Frame.generate(WIDTH, HEIGHT, (x, y) -> 0xFF000000 | (start + y) << 8 | x * 7);
    }

    private static void assumeOpenCV() {
        NativeLibraryLoader.loadNativeLibraries();
        assumeTrue(NativeLibraryLoader.isLoaded(), "OpenCV native library not available");
    }

    @Test
    @DisplayName("Should reject a request without frames")
    void stitchFrames_NoFrames_Throws() {
        StitchFramesRequest request = new StitchFramesRequest();
        request.setFrames(List.of());

        assertThatThrownBy(() -> stitchService.stitchFrames(request))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should stitch uploaded frames, store the image and record the result")
    void stitchFrames_UploadedFrames_WritesImageAndRecord() {
        assumeOpenCV();
        StitchFramesRequest request = new StitchFramesRequest();
        request.setFrames(List.of(
                FrameCodec.encodeBase64Png(window(0)),
                FrameCodec.encodeBase64Png(window(10))));

        StitchResponse response = stitchService.stitchFrames(request);

        assertThat(response.getHeight()).isEqualTo(HEIGHT + 10);
        assertThat(response.getAlignments()).extracting(FrameAlignment::getOffset).containsExactly(0, 10);
        assertThat(response.getImageUrl()).startsWith("/api/images/").endsWith(".png");
        assertThat(response.getImage()).isNotBlank();
        assertThat(Path.of(response.getOutputPath())).exists();

        Optional<StitchRecord> record = stitchService.findRecord(response.getRecordId());
        assertThat(record).isPresent();
        assertThat(record.get().getSource()).isEqualTo(StitchService.SOURCE_FRAMES);
        assertThat(record.get().getOffsets()).containsExactly(0, 10);
    }

    @Test
    @DisplayName("Should stitch captures already on disk and clean them up afterwards")
    void runSession_NoCapture_StitchesExistingCaptures() throws Exception {
        assumeOpenCV();
        FrameCodec.writePng(window(0), outDir.resolve("watch_00.png"));
        FrameCodec.writePng(window(6), outDir.resolve("watch_01.png"));
        FrameCodec.writePng(window(13), outDir.resolve("watch_02.png"));

        SessionRequest request = new SessionRequest();
        request.setCapture(false);
        request.setFileName("watch.png");

        StitchResponse response = stitchService.runSession(request);

        assertThat(response.getFrameCount()).isEqualTo(3);
        assertThat(response.getHeight()).isEqualTo(HEIGHT + 13);
        assertThat(response.getImage()).isNull();

        Frame stitched = FrameCodec.read(outDir.resolve("watch.png"));
        assertThat(stitched.getHeight()).isEqualTo(HEIGHT + 13);
        for (int y = 0; y < stitched.getHeight(); y++) {
            assertThat(stitched.argb(3, y)).isEqualTo(0xFF000000 | y << 8 | 21);
        }
        assertThat(outDir.resolve("watch_00.png")).doesNotExist();
        assertThat(stitchService.findRecentRecords(5)).hasSize(1);
    }

    @Test
    @DisplayName("Should keep the captures when asked to")
    void runSession_KeepCaptures_LeavesFiles() throws Exception {
        assumeOpenCV();
        FrameCodec.writePng(window(0), outDir.resolve("watch_00.png"));

        SessionRequest request = new SessionRequest();
        request.setCapture(false);
        request.setFileName("watch.png");
        request.setKeepCaptures(true);

        stitchService.runSession(request);

        assertThat(outDir.resolve("watch_00.png")).exists();
        assertThat(outDir.resolve("watch.png")).exists();
    }

    @Test
    @DisplayName("Should fail when there is nothing to stitch")
    void runSession_NoCaptures_Throws() {
        SessionRequest request = new SessionRequest();
        request.setCapture(false);
        request.setFileName("empty.png");

        assertThatThrownBy(() -> stitchService.runSession(request))
                .isInstanceOf(CaptureException.class)
                .hasMessageContaining("No captures found");
        assertThat(Files.exists(outDir.resolve("empty.png"))).isFalse();
    }
}

package com.wear.stitch.service;

import com.wear.stitch.config.YamlConfig;
import com.wear.stitch.core.capture.CaptureException;
import com.wear.stitch.core.frame.Frame;
import com.wear.stitch.core.frame.FrameCodec;
import com.wear.stitch.core.stitcher.FrameAlignment;
import com.wear.stitch.core.stitcher.ScrollStitchStrategy;
import com.wear.stitch.core.stitcher.StitchException;
import com.wear.stitch.core.stitcher.StitchResult;
import com.wear.stitch.dto.SessionRequest;
import com.wear.stitch.dto.StitchFramesRequest;
import com.wear.stitch.dto.StitchResponse;
import com.wear.stitch.model.StitchRecord;
import com.wear.stitch.repository.StitchRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 拼接服务
 * <p>
 * 两种入口：
 * - 直接上传 Base64 截屏，结果保存在 {dataDir}/images/{日期}/ 并可通过 /api/images/** 访问
 * - 截屏会话：adb 采集（或使用已有截屏）后拼接，结果写到会话指定的输出文件
 * 每次拼接都会写入一条拼接记录。
 */
@Service
public class StitchService {
    private static final Logger logger = LoggerFactory.getLogger(StitchService.class);

    static final String SOURCE_FRAMES = "frames";
    static final String SOURCE_SESSION = "session";

    @Autowired
    private YamlConfig yamlConfig;

    @Autowired
    private StitchConfigService stitchConfigService;

    @Autowired
    private CaptureService captureService;

    @Autowired
    private StitchRecordRepository recordRepository;

    /**
     * 拼接上传的 Base64 截屏
     */
    public StitchResponse stitchFrames(StitchFramesRequest request) {
        if (request.getFrames() == null || request.getFrames().isEmpty()) {
            throw new IllegalArgumentException("Frames cannot be null or empty");
        }

        List<Frame> frames = new ArrayList<>(request.getFrames().size());
        for (int i = 0; i < request.getFrames().size(); i++) {
            try {
                frames.add(FrameCodec.decodeBase64(request.getFrames().get(i)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Frame " + i + " is not a valid Base64 image: " + e.getMessage(), e);
            }
        }

        String date = LocalDate.now().toString();
        String fileName = "stitch_" + System.currentTimeMillis() + ".png";
        Path output = Paths.get(yamlConfig.getSystem().getDataDir(), "images", date, fileName);

        ScrollStitchStrategy strategy = stitchConfigService.createStrategy(request.getRound(), request.getTransparency());
        StitchResponse response = stitch(frames, strategy, output, SOURCE_FRAMES, request.isIncludeImage());
        response.setImageUrl("/api/images/" + date + "/" + fileName);
        return response;
    }

    /**
     * 执行截屏会话并拼接
     */
    public StitchResponse runSession(SessionRequest request) {
        CaptureLayout layout = captureService.prepare(request);
        boolean capture = request.getCapture() == null || request.getCapture();
        boolean keepCaptures = request.getKeepCaptures() != null
                ? request.getKeepCaptures()
                : yamlConfig.getCapture().isKeepCaptures();

        int count = capture ? captureService.capture(layout, request) : layout.getAvailableCaptures();
        if (count == 0) {
            throw new CaptureException("No captures found for " + layout.getCaptureDir().resolve(layout.getCapturePrefix()) + "*.png");
        }

        List<Frame> frames = new ArrayList<>(count);
        for (Path path : layout.capturePaths(count)) {
            try {
                frames.add(FrameCodec.read(path));
            } catch (IOException e) {
                throw new CaptureException("Failed to read capture " + path, e);
            }
        }

        ScrollStitchStrategy strategy = stitchConfigService.createStrategy(request.getRound(), request.getTransparency());
        StitchResponse response = stitch(frames, strategy, layout.getOutputFile(), SOURCE_SESSION, false);
        logger.info("Wrote {}", layout.getOutputFile().toAbsolutePath());

        if (!keepCaptures) {
            captureService.cleanup(layout);
        }
        return response;
    }

    public List<StitchRecord> findRecentRecords(int limit) {
        return recordRepository.findRecent(limit);
    }

    public Optional<StitchRecord> findRecord(String id) {
        return recordRepository.findById(id);
    }

    StitchResponse stitch(List<Frame> frames, ScrollStitchStrategy strategy, Path output, String source,
                          boolean includeImage) {
        StitchResult result = strategy.stitch(frames);
        Frame stitched = result.getCanvas().toFrame();

        try {
            FrameCodec.writePng(stitched, output);
        } catch (IOException e) {
            throw new StitchException("Failed to write stitched image to " + output, e);
        }

        StitchRecord record = recordRepository.insert(toRecord(result, strategy, frames.size(), output, source));

        StitchResponse response = new StitchResponse();
        response.setRecordId(record.getId());
        response.setFrameCount(frames.size());
        response.setWidth(result.getWidth());
        response.setHeight(result.getHeight());
        response.setAlignments(result.getAlignments());
        response.setDegenerateFrames(result.getDegenerateFrames());
        response.setGapPixels(result.getGapPixels());
        response.setElapsedMs(result.getElapsedMs());
        response.setOutputPath(output.toAbsolutePath().toString());
        if (includeImage) {
            response.setImage(FrameCodec.encodeBase64Png(stitched));
        }
        return response;
    }

    private static StitchRecord toRecord(StitchResult result, ScrollStitchStrategy strategy, int frameCount,
                                         Path output, String source) {
        StitchRecord record = new StitchRecord();
        record.setTimestamp(LocalDateTime.now());
        record.setSource(source);
        record.setFrameCount(frameCount);
        record.setWidth(result.getWidth());
        record.setHeight(result.getHeight());
        record.setRound(strategy.getOptions().isCircularMask());
        record.setTransparency(strategy.getOptions().isTransparency());
        record.setOffsets(result.getAlignments().stream().map(FrameAlignment::getOffset).collect(Collectors.toList()));
        record.setScores(result.getAlignments().stream().map(FrameAlignment::getScore).collect(Collectors.toList()));
        record.setDegenerateFrames(result.getDegenerateFrames());
        record.setGapPixels(result.getGapPixels());
        record.setElapsedMs(result.getElapsedMs());
        record.setOutputPath(output.toAbsolutePath().toString());
        return record;
    }
}

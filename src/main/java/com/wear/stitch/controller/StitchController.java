package com.wear.stitch.controller;

import com.wear.stitch.core.stitcher.FrameInputException;
import com.wear.stitch.dto.SessionRequest;
import com.wear.stitch.dto.StitchFramesRequest;
import com.wear.stitch.dto.StitchResponse;
import com.wear.stitch.dto.StitchSettings;
import com.wear.stitch.dto.StitchSettingsRequest;
import com.wear.stitch.model.StitchRecord;
import com.wear.stitch.service.StitchConfigService;
import com.wear.stitch.service.StitchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 长截图拼接控制器
 * <p>
 * 提供截屏拼接、adb 截屏会话、拼接参数配置和拼接记录查询的 API
 */
@RestController
@RequestMapping("/api/stitch")
@Tag(name = "长截图拼接", description = "按行哈希对齐连续下滚的截屏并合成长图，参数自动持久化到 data/stitch-config.json")
public class StitchController {
    private static final Logger logger = LoggerFactory.getLogger(StitchController.class);

    @Autowired
    private StitchService stitchService;

    @Autowired
    private StitchConfigService stitchConfigService;

    /**
     * 拼接上传的截屏
     */
    @PostMapping("/frames")
    @Operation(
            summary = "拼接上传的截屏",
            description = """
                    按截取顺序上传 Base64 截屏（PNG/JPG，宽度必须一致），返回拼接结果。

                    **参数说明**：
                    | 字段 | 类型 | 说明 |
                    |------|------|------|
                    | frames | array | Base64 图像，可带 data:image/png;base64, 前缀 |
                    | round | boolean | 圆形屏幕，为空时使用当前配置 |
                    | transparency | boolean | 边缘无像素时填充透明，为空时使用当前配置 |
                    | includeImage | boolean | 是否在响应中返回 Base64 结果图，默认 true |
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "拼接成功",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "recordId": "3f1c...",
                                                "frameCount": 2,
                                                "width": 454,
                                                "height": 612,
                                                "alignments": [
                                                  {"frameIndex": 0, "score": 0, "offset": 0, "absoluteOffset": 0},
                                                  {"frameIndex": 1, "score": 296, "offset": 158, "absoluteOffset": 158}
                                                ],
                                                "imageUrl": "/api/images/2024-01-15/stitch_1705300600000.png"
                                              }
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> stitchFrames(@RequestBody StitchFramesRequest request) {
        try {
            StitchResponse result = stitchService.stitchFrames(request);
            return success(result);
        } catch (IllegalArgumentException | FrameInputException e) {
            logger.warn("Rejected stitch request: {}", e.getMessage());
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to stitch frames", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    /**
     * 执行 adb 截屏会话
     */
    @PostMapping("/session")
    @Operation(
            summary = "执行截屏会话",
            description = """
                    通过 adb 连续截屏并下滑，两张截屏完全相同时视为到底，然后拼接。
                    capture=false 时只拼接 outDir 中已有的 <fileName>_NN.png。

                    未提供的字段使用 application.yml 中 wear-stitch.capture 的默认值。
                    """
    )
    public ResponseEntity<Map<String, Object>> runSession(@RequestBody SessionRequest request) {
        try {
            return success(stitchService.runSession(request));
        } catch (IllegalArgumentException | FrameInputException e) {
            logger.warn("Rejected session request: {}", e.getMessage());
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            logger.error("Capture session failed", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @GetMapping("/config")
    @Operation(summary = "获取拼接配置", description = "当前拼接参数（round / transparency / parallel）及截屏默认值")
    public ResponseEntity<Map<String, Object>> getConfig() {
        try {
            return success(stitchConfigService.getAllConfigs());
        } catch (Exception e) {
            logger.error("Failed to get config", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @PutMapping("/config")
    @Operation(summary = "修改拼接配置", description = "只修改请求中提供的字段，修改后立即持久化")
    public ResponseEntity<Map<String, Object>> updateConfig(@RequestBody StitchSettingsRequest request) {
        try {
            StitchSettings updated = stitchConfigService.update(request);
            return success(updated);
        } catch (Exception e) {
            logger.error("Failed to update config", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @GetMapping("/records")
    @Operation(summary = "查询拼接记录", description = "按时间倒序返回最近的拼接记录")
    public ResponseEntity<Map<String, Object>> listRecords(
            @Parameter(description = "返回条数") @RequestParam(defaultValue = "20") int limit) {
        try {
            List<StitchRecord> records = stitchService.findRecentRecords(limit);
            return success(records);
        } catch (Exception e) {
            logger.error("Failed to list records", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @GetMapping("/records/{id}")
    @Operation(summary = "查询单条拼接记录")
    public ResponseEntity<Map<String, Object>> getRecord(@PathVariable String id) {
        try {
            Optional<StitchRecord> record = stitchService.findRecord(id);
            if (record.isEmpty()) {
                return error(HttpStatus.NOT_FOUND, "Record not found: " + id);
            }
            return success(record.get());
        } catch (Exception e) {
            logger.error("Failed to get record {}", id, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    private static ResponseEntity<Map<String, Object>> success(Object data) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", data);
        return ResponseEntity.ok(response);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}

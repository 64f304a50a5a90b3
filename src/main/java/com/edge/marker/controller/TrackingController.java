package com.edge.marker.controller;

import com.edge.marker.core.export.CornerPinTrack;
import com.edge.marker.core.export.ExportPoint;
import com.edge.marker.core.geometry.GeometryResult;
import com.edge.marker.core.model.FrameRecord;
import com.edge.marker.core.store.DataStore;
import com.edge.marker.dto.ExportRequest;
import com.edge.marker.dto.FrameDetectionInfo;
import com.edge.marker.dto.ProcessRequest;
import com.edge.marker.service.MarkerTrackingService;
import com.edge.marker.service.TrackingRunSummary;
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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 标记跟踪控制器
 * <p>
 * 检测运行、逐帧几何查询和 CornerPin2D 导出
 */
@RestController
@RequestMapping("/api/tracking")
@Tag(name = "标记跟踪", description = "四角 ArUco 标记逐帧检测、长宽比分析与 Nuke CornerPin2D 导出")
public class TrackingController {
    private static final Logger logger = LoggerFactory.getLogger(TrackingController.class);

    @Autowired
    private MarkerTrackingService trackingService;

    /**
     * 运行检测
     */
    @PostMapping("/process")
    @Operation(
            summary = "运行多阶段标记检测",
            description = """
                    对图像序列目录或视频文件逐帧检测 ID 0-3 四个标记，结果替换当前数据表。

                    **检测阶段**：
                    | 阶段 | 说明 |
                    |------|------|
                    | DEFAULT_PASS | 基准参数，原图 |
                    | QUICK_SCAN_PASS | 宽松阈值，原图 |
                    | DETAILED_SEARCH_PASS | 对比度增强 × 参数组合扫描 |

                    找不齐四个标记的帧会保留部分结果，导出时插值补全。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "检测完成",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "source": "img/aruco4",
                                                "workers": 4,
                                                "processedFrames": 120,
                                                "completeFrames": 117,
                                                "partialFrames": 3,
                                                "emptyFrames": 0,
                                                "failedFrames": [],
                                                "durationMs": 8421
                                              }
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> process(@RequestBody ProcessRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            TrackingRunSummary summary = trackingService.process(
                request.getSource(), request.getWorkers(), request.getMaxFrames());
            response.put("status", "success");
            response.put("data", summary);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return error(response, HttpStatus.BAD_REQUEST, e);
        } catch (Exception e) {
            logger.error("Failed to process frames", e);
            return error(response, HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * 逐帧检测表
     */
    @GetMapping("/frames")
    @Operation(summary = "获取逐帧检测结果", description = "每帧找到的标记、角点，以及产生该观测的阶段、参数和对比度等级")
    public ResponseEntity<Map<String, Object>> getFrames() {
        Map<String, Object> response = new HashMap<>();
        try {
            DataStore store = trackingService.getCurrentStore();
            List<FrameDetectionInfo> frames = new ArrayList<>();
            for (FrameRecord record : store.getRecords()) {
                frames.add(FrameDetectionInfo.from(record, store.getExpectedMarkers()));
            }
            response.put("status", "success");
            response.put("data", frames);
            return ResponseEntity.ok(response);
        } catch (IllegalStateException e) {
            return error(response, HttpStatus.CONFLICT, e);
        }
    }

    /**
     * 单帧几何
     */
    @GetMapping("/frames/{frame}/geometry")
    @Operation(summary = "获取单帧几何分析", description = "外角/内角/平均长宽比和对角线交点；标记不全时 available=false")
    public ResponseEntity<Map<String, Object>> getGeometry(
            @Parameter(description = "帧号", example = "5") @PathVariable("frame") int frame) {
        Map<String, Object> response = new HashMap<>();
        try {
            GeometryResult result = trackingService.analyzeFrame(frame);
            response.put("status", "success");
            response.put("data", result);
            return ResponseEntity.ok(response);
        } catch (IllegalStateException e) {
            return error(response, HttpStatus.CONFLICT, e);
        }
    }

    /**
     * 长宽比统计
     */
    @GetMapping("/geometry/summary")
    @Operation(summary = "获取长宽比统计", description = "所有几何可用帧的平均长宽比均值、极值、标准差")
    public ResponseEntity<Map<String, Object>> getGeometrySummary() {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("data", trackingService.summarizeGeometry());
            return ResponseEntity.ok(response);
        } catch (IllegalStateException e) {
            return error(response, HttpStatus.CONFLICT, e);
        }
    }

    /**
     * 获取轨迹
     */
    @GetMapping("/track")
    @Operation(summary = "获取插值后的轨迹", description = "每帧每个角色一个点（Y 轴向上），附带 OBSERVED/INTERPOLATED/CLAMPED 状态")
    public ResponseEntity<Map<String, Object>> getTrack(
            @Parameter(description = "导出点类型：center / outer / inner") @RequestParam(value = "pointType", required = false) String pointType,
            @RequestParam(value = "from", required = false) Integer from,
            @RequestParam(value = "to", required = false) Integer to) {
        Map<String, Object> response = new HashMap<>();
        try {
            CornerPinTrack track = trackingService.buildTrack(pointType, from, to);
            response.put("status", "success");
            response.put("data", track);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return error(response, HttpStatus.BAD_REQUEST, e);
        } catch (IllegalStateException e) {
            return error(response, HttpStatus.CONFLICT, e);
        }
    }

    /**
     * 导出 CornerPin2D
     */
    @PostMapping("/export")
    @Operation(
            summary = "导出 Nuke CornerPin2D",
            description = """
                    把当前数据表导出为 CornerPin2D 节点文件。

                    - 缺失帧按前后观测线性插值，序列首尾缺失取最近观测值
                    - 坐标转换为 Nuke 坐标系（原点左下，Y 向上）
                    - 插值/钳位的帧以 `#` 注释行列在文件开头
                    """
    )
    public ResponseEntity<Map<String, Object>> export(@RequestBody ExportRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            MarkerTrackingService.ExportResult result = trackingService.export(
                request.getPointType(), request.getOutputPath(), request.getFrom(), request.getTo());
            CornerPinTrack track = result.getTrack();

            Map<String, Object> data = new HashMap<>();
            data.put("path", result.getPath().toAbsolutePath().toString());
            data.put("pointType", track.getPointType());
            data.put("firstFrame", track.getFirstFrame());
            data.put("lastFrame", track.getLastFrame());
            data.put("observed", track.count(ExportPoint.FillStatus.OBSERVED));
            data.put("interpolated", track.count(ExportPoint.FillStatus.INTERPOLATED));
            data.put("clamped", track.count(ExportPoint.FillStatus.CLAMPED));
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return error(response, HttpStatus.BAD_REQUEST, e);
        } catch (IllegalStateException e) {
            return error(response, HttpStatus.CONFLICT, e);
        } catch (Exception e) {
            logger.error("Failed to export cornerpin", e);
            return error(response, HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    private static ResponseEntity<Map<String, Object>> error(Map<String, Object> response, HttpStatus status,
                                                             Exception e) {
        response.put("status", "error");
        response.put("message", e.getMessage());
        return ResponseEntity.status(status).body(response);
    }
}

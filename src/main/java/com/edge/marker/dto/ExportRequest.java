package com.edge.marker.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/**
 * CornerPin 导出请求
 */
@Data
@Schema(description = "CornerPin2D 导出请求")
public class ExportRequest {
    @Schema(description = "导出点类型：center / outer / inner，不填使用配置值", example = "outer")
    private String pointType;

    @Schema(description = "输出文件路径，不填写入配置的导出目录", example = "export/nuke_output.nk")
    private String outputPath;

    @Schema(description = "起始帧（含），不填为第一帧")
    private Integer from;

    @Schema(description = "结束帧（含），不填为最后一帧")
    private Integer to;
}

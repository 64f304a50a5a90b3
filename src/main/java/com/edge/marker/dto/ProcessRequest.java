package com.edge.marker.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/**
 * 检测运行请求
 */
@Data
@Schema(description = "检测运行请求")
public class ProcessRequest {
    @Schema(description = "帧来源：图像序列目录或视频文件路径", example = "img/aruco4")
    private String source;

    @Schema(description = "工作线程数，不填使用配置值", example = "4")
    private Integer workers;

    @Schema(description = "最多处理帧数，0 或不填表示全部", example = "0")
    private Integer maxFrames;
}

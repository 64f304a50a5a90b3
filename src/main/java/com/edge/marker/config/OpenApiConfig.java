package com.edge.marker.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI markerTrackOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Edge Marker Track API")
                        .description("""
                                四角 ArUco 标记跟踪服务 API 文档

                                ## 功能概述

                                对图像序列或视频逐帧检测四个角标记（ID 0-3），
                                计算矩形长宽比，并导出 Nuke CornerPin2D 轨迹。

                                ### 核心功能
                                - **多阶段检测**：默认参数 → 快速扫描 → 对比度增强精细搜索
                                - **几何分析**：外角/内角/平均长宽比，对角线交点中心
                                - **轨迹导出**：缺失帧线性插值，首尾钳位，Y 轴翻转

                                ### 标记布局
                                | ID | 角色 |
                                |----|------|
                                | 0 | 左上 TL |
                                | 1 | 右上 TR |
                                | 2 | 右下 BR |
                                | 3 | 左下 BL |

                                ### API 响应格式
                                所有接口返回统一的 JSON 格式：
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0"));
    }

    /**
     * 为所有接口添加统一的响应示例
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getGet() != null) {
                pathItem.getGet().getResponses().addApiResponse("200", createSuccessResponse());
            }
            if (pathItem.getPost() != null) {
                pathItem.getPost().getResponses().addApiResponse("200", createSuccessResponse());
                pathItem.getPost().getResponses().addApiResponse("400", createBadRequestResponse());
            }
        });
    }

    private ApiResponse createSuccessResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态: success/error").example("success"),
                "data", new Schema<>().type("object").description("响应数据")
        ));

        return new ApiResponse()
                .description("成功")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }

    private ApiResponse createBadRequestResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "message", new Schema<>().type("string").description("错误信息").example("请求参数错误")
        ));

        return new ApiResponse()
                .description("请求错误")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}

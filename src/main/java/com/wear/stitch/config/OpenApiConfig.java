package com.wear.stitch.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
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
    public OpenAPI wearStitchOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Wear Stitch API")
                        .description("""
                                手表长截图拼接服务 API 文档

                                ## 功能概述

                                将连续下滚得到的多张截屏按行哈希对齐，合成为一张完整的长图。

                                ### 核心功能
                                - **图像拼接**：上传 Base64 截屏，返回拼接结果与每帧偏移
                                - **截屏会话**：通过 adb 自动截屏、下滑，检测到底后拼接
                                - **拼接配置**：圆形屏幕遮罩、透明边缘，配置自动持久化
                                - **拼接记录**：查询历史拼接结果

                                ### API 响应格式
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("Apache License 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")));
    }

    /**
     * 为 POST 接口统一添加 400 响应说明
     */
    @Bean
    public OpenApiCustomizer badRequestResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getPost() != null) {
                pathItem.getPost().getResponses().addApiResponse("400", createBadRequestResponse());
            }
        });
    }

    private ApiResponse createBadRequestResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "message", new Schema<>().type("string").description("错误信息").example("Frames cannot be null or empty")
        ));

        return new ApiResponse()
                .description("请求错误")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}

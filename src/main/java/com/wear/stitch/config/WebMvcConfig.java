package com.wear.stitch.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Web MVC 配置
 * <p>
 * 拼接结果图片映射：/api/images/** -> {dataDir}/images/
 * 例如 data/images/2024-01-15/stitch_1705300600.png
 * 对应 http://服务器地址/api/images/2024-01-15/stitch_1705300600.png
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Autowired
    private YamlConfig yamlConfig;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String imagesDir = Paths.get(yamlConfig.getSystem().getDataDir(), "images")
                .toAbsolutePath().toUri().toString();
        registry.addResourceHandler("/api/images/**")
                .addResourceLocations(imagesDir);
    }
}

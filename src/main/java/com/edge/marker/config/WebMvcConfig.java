package com.edge.marker.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Web MVC 配置
 * <p>
 * 导出目录映射为静态资源，导出的 .nk 文件可直接下载：
 * - 导出路径：export/cornerpin_outer.nk
 * - 访问URL：http://服务器地址/api/exports/cornerpin_outer.nk
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Autowired
    private YamlConfig yamlConfig;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String dir = Paths.get(yamlConfig.getExport().getOutputDir()).toAbsolutePath().toUri().toString();
        registry.addResourceHandler("/api/exports/**")
                .addResourceLocations(dir.endsWith("/") ? dir : dir + "/");
    }
}

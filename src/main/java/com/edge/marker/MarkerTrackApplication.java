package com.edge.marker;

import com.edge.marker.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarkerTrackApplication {

    public static void main(String[] args) {
        // Mat 相关代码运行前先加载 OpenCV
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(MarkerTrackApplication.class, args);
    }
}

package com.edge.marker.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责在使用 OpenCV 之前加载 JNI 库
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    private NativeLibraryLoader() {
    }

    /**
     * 预加载 OpenCV native 库
     * 必须在任何使用 Mat 的代码之前调用，重复调用无副作用
     *
     * @throws IllegalStateException 加载失败
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        // openpnp 把对应平台的库解压到临时目录后 System.load
        logger.info("Loading OpenCV native library via openpnp...");
        try {
            nu.pattern.OpenCV.loadLocally();
            logger.info("OpenCV loaded successfully via openpnp");
        } catch (RuntimeException | UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV library", e);
            throw new IllegalStateException("OpenCV native library unavailable: " + e.getMessage(), e);
        }
        loaded = true;
    }

    public static synchronized boolean isLoaded() {
        return loaded;
    }
}

package com.edge.marker.core.detect;

import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * 对比度增强器
 * <p>
 * 为后期检测阶段生成图像变体，等级 0（不增强）到 100（最强）：
 * 1. 线性对比度拉伸：(v - 128) * (1 + level/100) + 128，饱和截断
 * 2. CLAHE 局部自适应直方图均衡，等级越高 clipLimit 越大、分块越细
 * <p>
 * 输出始终为新的单通道图像，输入不被修改。
 */
public class ContrastEnhancer {
    public static final int MIN_LEVEL = 0;
    public static final int MAX_LEVEL = 100;

    private final int baseTileSize;

    public ContrastEnhancer() {
        this(8);
    }

    public ContrastEnhancer(int baseTileSize) {
        if (baseTileSize < 1) {
            throw new IllegalArgumentException("Tile size must be positive: " + baseTileSize);
        }
        this.baseTileSize = baseTileSize;
    }

    /**
     * 生成指定等级的增强图像
     *
     * @param image 输入图像（BGR 或灰度）
     * @param level 对比度等级 [0, 100]
     * @return 增强后的灰度图像，调用方负责 release
     */
    public Mat enhance(Mat image, int level) {
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Input image is null or empty");
        }
        int clamped = Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, level));

        Mat gray = new Mat();
        if (image.channels() > 1) {
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
        } else {
            image.copyTo(gray);
        }
        if (clamped == MIN_LEVEL) {
            return gray;
        }

        // 线性拉伸
        double alpha = 1.0 + clamped / 100.0;
        double beta = 128.0 * (1.0 - alpha);
        Mat stretched = new Mat();
        gray.convertTo(stretched, -1, alpha, beta);
        gray.release();

        // CLAHE
        Mat result = new Mat();
        CLAHE clahe = Imgproc.createCLAHE(clipLimit(clamped), new Size(tileSize(clamped), tileSize(clamped)));
        clahe.apply(stretched, result);
        stretched.release();
        return result;
    }

    double clipLimit(int level) {
        return 1.0 + 3.0 * level / MAX_LEVEL;
    }

    int tileSize(int level) {
        return baseTileSize + (int) Math.round(baseTileSize * (double) level / MAX_LEVEL);
    }

    /**
     * 对比度扫描等级，从低到高
     */
    public static List<Integer> levels(int min, int max, int step) {
        if (step <= 0) {
            throw new IllegalArgumentException("Contrast step must be positive: " + step);
        }
        List<Integer> levels = new ArrayList<>();
        int lo = Math.max(MIN_LEVEL, min);
        int hi = Math.min(MAX_LEVEL, max);
        for (int level = lo; level <= hi; level += step) {
            levels.add(level);
        }
        return levels;
    }
}

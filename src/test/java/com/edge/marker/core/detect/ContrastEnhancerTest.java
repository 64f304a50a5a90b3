package com.edge.marker.core.detect;

import com.edge.marker.config.NativeLibraryLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContrastEnhancerTest {

    @BeforeAll
    static void loadOpenCv() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    /** 左半 100，右半 150 的低对比度灰度图 */
    private static Mat lowContrast() {
        Mat gray = new Mat(128, 128, CvType.CV_8UC1, new Scalar(100));
        gray.submat(new Rect(64, 0, 64, 128)).setTo(new Scalar(150));
        return gray;
    }

    private static double stdDev(Mat mat) {
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble std = new MatOfDouble();
        Core.meanStdDev(mat, mean, std);
        return std.toArray()[0];
    }

    @Test
    void levelZeroIsGrayCopy() {
        Mat bgr = new Mat(32, 48, CvType.CV_8UC3, new Scalar(90, 90, 90));
        ContrastEnhancer enhancer = new ContrastEnhancer();

        Mat out = enhancer.enhance(bgr, 0);

        assertThat(out.channels()).isEqualTo(1);
        assertThat(out.size()).isEqualTo(bgr.size());
        assertThat(Core.mean(out).val[0]).isEqualTo(90.0);
        assertThat(out.nativeObj).isNotEqualTo(bgr.nativeObj);
    }

    @Test
    void higherLevelIncreasesContrast() {
        Mat input = lowContrast();
        double before = stdDev(input);
        ContrastEnhancer enhancer = new ContrastEnhancer();

        Mat out = enhancer.enhance(input, 100);

        assertThat(out.type()).isEqualTo(CvType.CV_8UC1);
        assertThat(out.size()).isEqualTo(input.size());
        assertThat(stdDev(out)).isGreaterThan(before);
        // 输入不被修改
        assertThat(stdDev(input)).isEqualTo(before);
    }

    @Test
    void outOfRangeLevelIsClamped() {
        Mat input = lowContrast();
        ContrastEnhancer enhancer = new ContrastEnhancer();

        Mat negative = enhancer.enhance(input, -20);

        assertThat(stdDev(negative)).isEqualTo(stdDev(input));
    }

    @Test
    void tileSizeAndClipLimitGrowWithLevel() {
        ContrastEnhancer enhancer = new ContrastEnhancer(8);

        assertThat(enhancer.tileSize(0)).isEqualTo(8);
        assertThat(enhancer.tileSize(50)).isEqualTo(12);
        assertThat(enhancer.tileSize(100)).isEqualTo(16);
        assertThat(enhancer.clipLimit(0)).isEqualTo(1.0);
        assertThat(enhancer.clipLimit(100)).isEqualTo(4.0);
    }

    @Test
    void levelsFromLowToHigh() {
        assertThat(ContrastEnhancer.levels(0, 100, 25)).containsExactly(0, 25, 50, 75, 100);
        assertThat(ContrastEnhancer.levels(-10, 300, 50)).containsExactly(0, 50, 100);
        assertThatThrownBy(() -> ContrastEnhancer.levels(0, 100, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyInputIsRejected() {
        ContrastEnhancer enhancer = new ContrastEnhancer();

        assertThatThrownBy(() -> enhancer.enhance(new Mat(), 50)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> enhancer.enhance(null, 50)).isInstanceOf(IllegalArgumentException.class);
    }
}

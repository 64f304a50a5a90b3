package com.edge.marker.core.source;

import org.opencv.core.Mat;

/**
 * 一帧图像及其帧号
 */
public class Frame {
    private final Mat image;
    private final int frameNumber;

    public Frame(Mat image, int frameNumber) {
        this.image = image;
        this.frameNumber = frameNumber;
    }

    public Mat getImage() {
        return image;
    }

    public int getFrameNumber() {
        return frameNumber;
    }

    public void release() {
        if (image != null) {
            image.release();
        }
    }
}

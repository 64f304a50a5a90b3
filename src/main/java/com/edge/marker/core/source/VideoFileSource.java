package com.edge.marker.core.source;

import org.opencv.core.Mat;
import org.opencv.videoio.VideoCapture;
import org.opencv.videoio.Videoio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 视频文件帧来源，帧号 = 帧在视频中的位置
 */
public class VideoFileSource implements FrameSource {
    private static final Logger logger = LoggerFactory.getLogger(VideoFileSource.class);

    private final String path;
    private VideoCapture capture;
    private int nextPosition;
    private int frameCount = -1;

    public VideoFileSource(String path) {
        this.path = path;
    }

    @Override
    public boolean open() {
        capture = new VideoCapture(path);
        if (!capture.isOpened()) {
            logger.error("Failed to open video {}", path);
            capture.release();
            capture = null;
            return false;
        }
        double count = capture.get(Videoio.CAP_PROP_FRAME_COUNT);
        frameCount = count > 0 ? (int) count : -1;
        nextPosition = 0;
        logger.info("Video opened: {} ({} frames, {}x{})", path, frameCount,
            (int) capture.get(Videoio.CAP_PROP_FRAME_WIDTH),
            (int) capture.get(Videoio.CAP_PROP_FRAME_HEIGHT));
        return true;
    }

    @Override
    public Frame getFrame(int position) {
        if (capture == null || !capture.isOpened() || position < 0) {
            return null;
        }
        if (frameCount >= 0 && position >= frameCount) {
            return null;
        }
        if (position != nextPosition) {
            capture.set(Videoio.CAP_PROP_POS_FRAMES, position);
        }

        Mat frame = new Mat();
        boolean success = capture.read(frame);
        if (!success || frame.empty()) {
            frame.release();
            return null;
        }
        nextPosition = position + 1;
        return new Frame(frame, position);
    }

    @Override
    public int size() {
        return frameCount;
    }

    @Override
    public void close() {
        if (capture != null) {
            capture.release();
            capture = null;
        }
    }

    @Override
    public boolean isOpened() {
        return capture != null && capture.isOpened();
    }
}

package com.edge.marker.core.source;

import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 图像序列目录
 * <p>
 * 帧号取文件名中第一段数字（如 frame_00042.png → 42），按帧号排序；
 * 不含数字的文件忽略；帧号重复时只保留路径排序靠前的文件。
 */
public class ImageSequenceSource implements FrameSource {
    private static final Logger logger = LoggerFactory.getLogger(ImageSequenceSource.class);
    private static final Pattern FRAME_NUMBER = Pattern.compile("(\\d+)");

    private final Path directory;
    private final List<Entry> entries = new ArrayList<>();
    private boolean opened;

    public ImageSequenceSource(Path directory) {
        this.directory = directory;
    }

    @Override
    public boolean open() {
        entries.clear();
        if (!Files.isDirectory(directory)) {
            logger.error("Image directory not found: {}", directory);
            return false;
        }
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(Files::isRegularFile).forEach(file -> {
                Integer number = extractFrameNumber(file.getFileName().toString());
                if (number != null) {
                    entries.add(new Entry(file, number));
                }
            });
        } catch (IOException e) {
            logger.error("Failed to list image directory {}", directory, e);
            return false;
        }
        entries.sort(Comparator.comparingInt((Entry e) -> e.frameNumber).thenComparing(e -> e.path));
        Iterator<Entry> it = entries.iterator();
        Entry previous = null;
        while (it.hasNext()) {
            Entry entry = it.next();
            if (previous != null && previous.frameNumber == entry.frameNumber) {
                logger.warn("Duplicate frame number {}: keeping {}, ignoring {}",
                    entry.frameNumber, previous.path.getFileName(), entry.path.getFileName());
                it.remove();
            } else {
                previous = entry;
            }
        }
        opened = true;
        logger.info("Image sequence opened: {} ({} frames)", directory, entries.size());
        return true;
    }

    /**
     * 从文件名提取帧号
     * @return 帧号，文件名不含数字时返回 null
     */
    static Integer extractFrameNumber(String filename) {
        Matcher m = FRAME_NUMBER.matcher(filename);
        if (!m.find()) {
            return null;
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public Frame getFrame(int position) {
        if (!opened || position < 0 || position >= entries.size()) {
            return null;
        }
        Entry entry = entries.get(position);
        Mat image = Imgcodecs.imread(entry.path.toString());
        if (image.empty()) {
            logger.warn("Could not decode image {}", entry.path);
        }
        return new Frame(image, entry.frameNumber);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public void close() {
        entries.clear();
        opened = false;
    }

    @Override
    public boolean isOpened() {
        return opened;
    }

    List<Path> getPaths() {
        List<Path> paths = new ArrayList<>();
        for (Entry e : entries) {
            paths.add(e.path);
        }
        return paths;
    }

    private static final class Entry {
        final Path path;
        final int frameNumber;

        Entry(Path path, int frameNumber) {
            this.path = path;
            this.frameNumber = frameNumber;
        }
    }
}

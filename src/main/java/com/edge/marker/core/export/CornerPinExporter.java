package com.edge.marker.core.export;

import com.edge.marker.core.model.MarkerRole;
import com.edge.marker.core.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.StringJoiner;

/**
 * Nuke CornerPin2D 节点导出
 * <p>
 * 输出格式：
 * <pre>
 * # point type OUTER, frames 1..10
 * # to3 interpolated: 5
 * CornerPin2D {
 *  to1 {{curve x1 100.0 100.0 ...} {curve x1 980.0 980.0 ...}}
 *  ...
 *  from1 {0 0}
 *  from2 {1920 0}
 *  from3 {1920 1080}
 *  from4 {0 1080}
 *  invert true
 *  name CornerPin2D1
 *  xpos 0
 *  ypos 0
 * }
 * </pre>
 * 每帧都写出数值（插值/钳位后的值），不依赖 Nuke 自身的曲线插值；
 * 插值和钳位的帧以注释行列出，便于质量审计。
 */
public class CornerPinExporter {
    private static final Logger logger = LoggerFactory.getLogger(CornerPinExporter.class);

    public static final String DEFAULT_NODE_NAME = "CornerPin2D1";

    private final String nodeName;

    public CornerPinExporter() {
        this(DEFAULT_NODE_NAME);
    }

    public CornerPinExporter(String nodeName) {
        this.nodeName = nodeName == null || nodeName.isBlank() ? DEFAULT_NODE_NAME : nodeName;
    }

    /**
     * 写入文件
     *
     * @param track      轨迹
     * @param outputPath 输出路径，父目录不存在时自动创建
     */
    public void export(CornerPinTrack track, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            write(track, writer);
        }
        logger.info("CornerPin2D exported: {} ({} frames, type {})",
            outputPath, track.getFrameCount(), track.getPointType());
    }

    public String toNukeScript(CornerPinTrack track) {
        StringWriter writer = new StringWriter();
        try {
            write(track, writer);
        } catch (IOException e) {
            // StringWriter 不会抛出 IOException
            throw new IllegalStateException(e);
        }
        return writer.toString();
    }

    public void write(CornerPinTrack track, Writer out) throws IOException {
        List<MarkerRole> pins = track.getPinOrder();

        out.write("# point type " + track.getPointType() + ", frames "
            + track.getFirstFrame() + ".." + track.getLastFrame() + "\n");
        for (int i = 0; i < pins.size(); i++) {
            MarkerRole role = pins.get(i);
            writeAudit(out, i + 1, "interpolated", track.framesWithStatus(role, ExportPoint.FillStatus.INTERPOLATED));
            writeAudit(out, i + 1, "clamped", track.framesWithStatus(role, ExportPoint.FillStatus.CLAMPED));
        }

        out.write("CornerPin2D {\n");
        for (int i = 0; i < pins.size(); i++) {
            List<ExportPoint> points = track.getSeries(pins.get(i));
            StringBuilder xs = new StringBuilder("curve x").append(track.getFirstFrame());
            StringBuilder ys = new StringBuilder("curve x").append(track.getFirstFrame());
            for (ExportPoint p : points) {
                xs.append(' ').append(format(p.getPoint().x));
                ys.append(' ').append(format(p.getPoint().y));
            }
            out.write(" to" + (i + 1) + " {{" + xs + "} {" + ys + "}}\n");
        }
        for (int i = 0; i < pins.size(); i++) {
            Point from = track.sourceCorner(pins.get(i));
            out.write(" from" + (i + 1) + " {" + formatInt(from.x) + " " + formatInt(from.y) + "}\n");
        }
        out.write(" invert true\n");
        out.write(" name " + nodeName + "\n");
        out.write(" xpos 0\n");
        out.write(" ypos 0\n");
        out.write("}\n");
    }

    private static void writeAudit(Writer out, int pin, String label, List<Integer> frames) throws IOException {
        if (frames.isEmpty()) {
            return;
        }
        StringJoiner joiner = new StringJoiner(" ");
        for (int frame : frames) {
            joiner.add(String.valueOf(frame));
        }
        out.write("# to" + pin + " " + label + ": " + joiner + "\n");
    }

    /**
     * Double.toString 保证导入时精确还原
     */
    static String format(double value) {
        return Double.toString(value);
    }

    private static String formatInt(double value) {
        return String.valueOf((long) value);
    }
}

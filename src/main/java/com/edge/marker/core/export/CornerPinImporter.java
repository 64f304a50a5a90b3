package com.edge.marker.core.export;

import com.edge.marker.core.model.Point;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 读取 Nuke CornerPin2D 节点（{@link CornerPinExporter} 的逆过程）
 * <p>
 * 支持曲线中的 x&lt;frame&gt; 帧号跳转，其余非数值关键字忽略。
 */
public class CornerPinImporter {
    private static final Pattern TO_CURVE = Pattern.compile(
        "^\\s*to([1-4])\\s*\\{\\{curve([^}]*)}\\s*\\{curve([^}]*)}}\\s*$");
    private static final Pattern FROM_POINT = Pattern.compile(
        "^\\s*from([1-4])\\s*\\{\\s*(\\S+)\\s+(\\S+)\\s*}\\s*$");
    private static final Pattern NAME = Pattern.compile("^\\s*name\\s+(\\S+)\\s*$");

    public ImportedCornerPin read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public ImportedCornerPin parse(String script) {
        try {
            return read(new StringReader(script));
        } catch (IOException e) {
            // StringReader 不会抛出 IOException
            throw new IllegalStateException(e);
        }
    }

    public ImportedCornerPin read(Reader source) throws IOException {
        ImportedCornerPin result = new ImportedCornerPin();
        BufferedReader reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.trim().startsWith("#")) {
                continue;
            }
            Matcher m = TO_CURVE.matcher(line);
            if (m.matches()) {
                int pin = Integer.parseInt(m.group(1));
                List<Double> xs = new ArrayList<>();
                List<Integer> frames = new ArrayList<>();
                parseCurve(m.group(2), frames, xs, lineNo);
                List<Double> ys = new ArrayList<>();
                List<Integer> yFrames = new ArrayList<>();
                parseCurve(m.group(3), yFrames, ys, lineNo);
                if (!frames.equals(yFrames)) {
                    throw new IOException("Line " + lineNo + ": x and y curves of to" + pin + " have different keys");
                }
                NavigableMap<Integer, Point> points = new TreeMap<>();
                for (int i = 0; i < frames.size(); i++) {
                    points.put(frames.get(i), new Point(xs.get(i), ys.get(i)));
                }
                result.pins.put(pin, points);
                continue;
            }
            m = FROM_POINT.matcher(line);
            if (m.matches()) {
                result.sources.put(Integer.parseInt(m.group(1)),
                    new Point(parseNumber(m.group(2), lineNo), parseNumber(m.group(3), lineNo)));
                continue;
            }
            m = NAME.matcher(line);
            if (m.matches()) {
                result.nodeName = m.group(1);
            }
        }
        if (result.pins.isEmpty()) {
            throw new IOException("No CornerPin2D 'to' curves found");
        }
        return result;
    }

    private static void parseCurve(String body, List<Integer> frames, List<Double> values, int lineNo)
            throws IOException {
        int frame = 1;
        for (String token : body.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            if (token.charAt(0) == 'x' && token.length() > 1) {
                try {
                    frame = Integer.parseInt(token.substring(1));
                } catch (NumberFormatException e) {
                    throw new IOException("Line " + lineNo + ": bad frame key " + token, e);
                }
                continue;
            }
            if (!Character.isDigit(token.charAt(0)) && token.charAt(0) != '-' && token.charAt(0) != '.') {
                continue;
            }
            frames.add(frame);
            values.add(parseNumber(token, lineNo));
            frame++;
        }
    }

    private static double parseNumber(String token, int lineNo) throws IOException {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new IOException("Line " + lineNo + ": bad number " + token, e);
        }
    }

    /**
     * 导入结果：pin 编号（1..4）→ 帧号 → 坐标
     */
    public static class ImportedCornerPin {
        private final Map<Integer, NavigableMap<Integer, Point>> pins = new TreeMap<>();
        private final Map<Integer, Point> sources = new TreeMap<>();
        private String nodeName;

        public NavigableMap<Integer, Point> getPin(int pin) {
            NavigableMap<Integer, Point> points = pins.get(pin);
            return points == null ? Collections.emptyNavigableMap() : Collections.unmodifiableNavigableMap(points);
        }

        public Map<Integer, NavigableMap<Integer, Point>> getPins() {
            return Collections.unmodifiableMap(pins);
        }

        public Point getSource(int pin) {
            return sources.get(pin);
        }

        public String getNodeName() {
            return nodeName;
        }
    }
}

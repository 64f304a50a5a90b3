package com.edge.marker.core.export;

/**
 * 导出点类型
 */
public enum ExportPointType {
    /** 标记中心 */
    CENTER,
    /** 外角（远离矩形中心的角点） */
    OUTER,
    /** 内角（靠近矩形中心的角点） */
    INNER;

    /**
     * 解析配置或请求中的类型名（大小写不敏感）
     */
    public static ExportPointType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Point type cannot be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid point type: " + value + " (expected center, outer or inner)", e);
        }
    }
}

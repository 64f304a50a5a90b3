package com.edge.marker.core.model;

/**
 * 标记角色：标记 ID 与矩形角位置的固定绑定
 * <p>
 * 标记布局（与四角检测约定一致）：
 * TL: ID 0, TR: ID 1, BR: ID 2, BL: ID 3
 * <p>
 * 角点按检测器的固定绕序编号，标记正向粘贴时：
 * 外角 = 离矩形中心最远的角点，内角 = 最近的角点
 */
public enum MarkerRole {
    TOP_LEFT(0, 0, 2),
    TOP_RIGHT(1, 1, 3),
    BOTTOM_RIGHT(2, 2, 0),
    BOTTOM_LEFT(3, 3, 1);

    private final int markerId;
    private final int outerCorner;
    private final int innerCorner;

    MarkerRole(int markerId, int outerCorner, int innerCorner) {
        this.markerId = markerId;
        this.outerCorner = outerCorner;
        this.innerCorner = innerCorner;
    }

    public int getMarkerId() {
        return markerId;
    }

    public int getOuterCorner() {
        return outerCorner;
    }

    public int getInnerCorner() {
        return innerCorner;
    }

    /**
     * 对角的角色（TL↔BR, TR↔BL）
     */
    public MarkerRole opposite() {
        return values()[(ordinal() + 2) % 4];
    }

    public static MarkerRole fromMarkerId(int markerId) {
        for (MarkerRole role : values()) {
            if (role.markerId == markerId) {
                return role;
            }
        }
        throw new IllegalArgumentException("No role bound to marker id " + markerId);
    }
}

package io.github.samzhu.points.domain;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import io.github.samzhu.points.exception.InvalidActionException;

/**
 * 動作點數目錄：動作代碼 → 固定點數。
 *
 * <p>程序啟動時由 {@code points.actions} 配置載入一次，之後不可變。
 * 測試可直接建構替代的目錄注入到 {@link io.github.samzhu.points.service.PointsEngine}。
 *
 * <p>點數必須為正數：餘額不可為負，且等級只能單調遞增。
 */
public final class ActionCatalog {

    private final Map<String, Integer> points;

    public ActionCatalog(Map<String, Integer> points) {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("Action catalog cannot be empty");
        }
        Map<String, Integer> copy = new TreeMap<>();
        points.forEach((action, value) -> {
            if (action == null || action.isBlank()) {
                throw new IllegalArgumentException("Action code cannot be blank");
            }
            if (value == null || value <= 0) {
                throw new IllegalArgumentException(
                    "Points for action '" + action + "' must be positive: " + value);
            }
            copy.put(action, value);
        });
        this.points = Collections.unmodifiableMap(copy);
    }

    /**
     * 取得動作對應的點數。
     *
     * @param action 動作代碼
     * @return 點數 (> 0)
     * @throws InvalidActionException 如果動作不存在
     */
    public int pointsFor(String action) {
        Integer value = action == null ? null : points.get(action);
        if (value == null) {
            throw new InvalidActionException(action);
        }
        return value;
    }

    public boolean contains(String action) {
        return action != null && points.containsKey(action);
    }

    /**
     * @return 依動作代碼排序的唯讀視圖
     */
    public Map<String, Integer> entries() {
        return points;
    }
}

package io.github.samzhu.points.domain;

/**
 * 單一等級門檻。
 *
 * @param level 等級編號，從 1 開始
 * @param name 等級顯示名稱
 * @param pointsRequired 達到此等級所需的最低累計點數
 */
public record LevelThreshold(
    int level,
    String name,
    long pointsRequired
) {
    public LevelThreshold {
        if (name == null || name.isBlank()) {
            name = "Level " + level;
        }
    }
}

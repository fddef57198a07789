package io.github.samzhu.points.service;

import java.util.List;
import java.util.Optional;

import io.github.samzhu.points.domain.LevelThreshold;
import io.github.samzhu.points.domain.LevelThresholdTable;

/**
 * 等級計算：由累計點數推導等級與升級進度。
 *
 * <p>純函式，無狀態，執行緒安全。
 */
public class LevelCalculator {

    private final LevelThresholdTable table;

    public LevelCalculator(LevelThresholdTable table) {
        this.table = table;
    }

    /**
     * 計算累計點數對應的等級：門檻已達成的最高等級。
     *
     * @param points 累計點數
     * @return 等級 (≥ 1)
     */
    public int levelFor(long points) {
        return thresholdFor(points).level();
    }

    /**
     * 計算從當前等級門檻到下一等級門檻的進度。
     *
     * @param points 累計點數
     * @return [0, 1]；已達最高等級時為 1.0
     */
    public double progressToNextLevel(long points) {
        LevelThreshold current = thresholdFor(points);
        Optional<LevelThreshold> next = table.find(current.level() + 1);
        if (next.isEmpty()) {
            return 1.0;
        }
        long span = next.get().pointsRequired() - current.pointsRequired();
        double progress = (double) (points - current.pointsRequired()) / span;
        return Math.max(0.0, Math.min(1.0, progress));
    }

    /**
     * @param points 累計點數
     * @return 下一等級，已達最高等級時為 empty
     */
    public Optional<LevelThreshold> nextLevel(long points) {
        return table.find(levelFor(points) + 1);
    }

    /**
     * @param points 累計點數
     * @return 距下一等級所需點數，已達最高等級時為 0
     */
    public long pointsToNextLevel(long points) {
        return nextLevel(points)
            .map(next -> Math.max(0L, next.pointsRequired() - points))
            .orElse(0L);
    }

    /**
     * 取得等級顯示名稱；等級不在門檻表中時回傳 {@code Level n}。
     */
    public String nameOf(int level) {
        return table.find(level)
            .map(LevelThreshold::name)
            .orElse("Level " + level);
    }

    public int maxLevel() {
        return table.maxLevel();
    }

    private LevelThreshold thresholdFor(long points) {
        List<LevelThreshold> thresholds = table.thresholds();
        LevelThreshold reached = thresholds.get(0);
        for (LevelThreshold threshold : thresholds) {
            if (threshold.pointsRequired() > points) {
                break;
            }
            reached = threshold;
        }
        return reached;
    }
}

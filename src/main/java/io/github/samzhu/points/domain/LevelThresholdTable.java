package io.github.samzhu.points.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 等級門檻表：依等級排序的 (等級, 最低累計點數) 對照。
 *
 * <p>約束：
 * <ul>
 *   <li>第一筆必須是 (1, 0)</li>
 *   <li>等級編號連續遞增（1, 2, 3, ...）</li>
 *   <li>門檻點數嚴格遞增</li>
 * </ul>
 *
 * <p>程序啟動時由 {@code points.levels} 配置載入一次，之後不可變。
 */
public final class LevelThresholdTable {

    private final List<LevelThreshold> thresholds;

    public LevelThresholdTable(List<LevelThreshold> thresholds) {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new IllegalArgumentException("Level threshold table cannot be empty");
        }
        List<LevelThreshold> sorted = new ArrayList<>(thresholds);
        sorted.sort(Comparator.comparingInt(LevelThreshold::level));

        LevelThreshold first = sorted.get(0);
        if (first.level() != 1 || first.pointsRequired() != 0) {
            throw new IllegalArgumentException(
                "Level threshold table must start at (1, 0), got (" + first.level() + ", " + first.pointsRequired() + ")");
        }
        for (int i = 1; i < sorted.size(); i++) {
            LevelThreshold previous = sorted.get(i - 1);
            LevelThreshold current = sorted.get(i);
            if (current.level() != previous.level() + 1) {
                throw new IllegalArgumentException(
                    "Level numbers must be consecutive: " + previous.level() + " -> " + current.level());
            }
            if (current.pointsRequired() <= previous.pointsRequired()) {
                throw new IllegalArgumentException(
                    "Level thresholds must be strictly increasing: level " + current.level()
                        + " requires " + current.pointsRequired()
                        + " but level " + previous.level() + " requires " + previous.pointsRequired());
            }
        }
        this.thresholds = List.copyOf(sorted);
    }

    public List<LevelThreshold> thresholds() {
        return thresholds;
    }

    public int maxLevel() {
        return thresholds.get(thresholds.size() - 1).level();
    }

    /**
     * 取得指定等級的門檻。
     *
     * @param level 等級編號
     * @return 門檻（如存在）
     */
    public Optional<LevelThreshold> find(int level) {
        if (level < 1 || level > maxLevel()) {
            return Optional.empty();
        }
        return Optional.of(thresholds.get(level - 1));
    }
}

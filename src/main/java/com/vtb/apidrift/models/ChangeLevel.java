package com.vtb.apidrift.models;

/**
 * Уровни изменений между версиями API
 *
 * Полный порядок: BREAKING > WARNING > CHANGE
 */
public enum ChangeLevel {
    BREAKING("Ломающее изменение", 3),
    WARNING("Предупреждение", 2),
    CHANGE("Изменение", 1);
    
    private final String russianName;
    private final int priority;
    
    ChangeLevel(String russianName, int priority) {
        this.russianName = russianName;
        this.priority = priority;
    }
    
    public String getRussianName() {
        return russianName;
    }
    
    public int getPriority() {
        return priority;
    }
    
    /**
     * Не ниже ли этот уровень указанного
     */
    public boolean isAtLeast(ChangeLevel other) {
        return other == null || priority >= other.priority;
    }
    
    /**
     * Более серьезный из двух уровней
     */
    public static ChangeLevel max(ChangeLevel left, ChangeLevel right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return left.priority >= right.priority ? left : right;
    }
}

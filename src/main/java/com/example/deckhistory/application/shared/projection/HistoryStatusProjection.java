package com.example.deckhistory.application.shared.projection;

/**
 * 文件歷史狀態
 */
public record HistoryStatusProjection(boolean canUndo, boolean canRedo, int undoCount, int redoCount,
		int historySize, int maxHistory) {
}

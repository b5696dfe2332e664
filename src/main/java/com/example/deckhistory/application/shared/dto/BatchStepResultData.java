package com.example.deckhistory.application.shared.dto;

import java.util.List;

/**
 * 多步 undo / redo 結果
 */
public record BatchStepResultData(int requestedSteps, int completedSteps, List<String> descriptions,
		boolean canUndo, boolean canRedo) {
}

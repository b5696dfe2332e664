package com.example.deckhistory.application.shared.dto;

import java.util.UUID;

import com.example.deckhistory.application.shared.projection.SlideStateProjection;

/**
 * 單步 undo / redo 結果
 *
 * @param success        是否確實撤銷或重做了一個指令
 * @param description    被處理指令的描述，或 "Nothing to undo" / "Nothing to redo"
 * @param slideId        呼叫端關注的投影片
 * @param resultingState 該投影片處理後的狀態，投影片不存在時為 null
 */
public record UndoRedoResultData(boolean success, String description, UUID slideId,
		SlideStateProjection resultingState, boolean canUndo, boolean canRedo) {
}

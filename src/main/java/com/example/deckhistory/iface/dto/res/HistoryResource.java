package com.example.deckhistory.iface.dto.res;

import java.util.List;

import com.example.deckhistory.application.domain.history.command.HistoryEntry;
import com.example.deckhistory.application.shared.projection.HistoryStatusProjection;

/**
 * 文件歷史查詢結果：狀態與每一筆指令的摘要
 */
public record HistoryResource(String code, String message, HistoryStatusProjection status,
		List<HistoryEntry> entries) {

}

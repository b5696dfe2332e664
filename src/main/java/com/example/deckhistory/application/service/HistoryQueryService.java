package com.example.deckhistory.application.service;

import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.example.deckhistory.application.domain.history.command.CommandHistory;
import com.example.deckhistory.application.domain.history.command.HistoryEntry;
import com.example.deckhistory.application.domain.history.snapshot.CommandHistorySnapshot;
import com.example.deckhistory.application.port.DocumentHistoryRepositoryPort;
import com.example.deckhistory.application.port.SlideRepositoryPort;
import com.example.deckhistory.application.shared.projection.HistoryStatusProjection;
import com.example.deckhistory.infra.annotation.DocumentSerialized;

import lombok.AllArgsConstructor;

@Service
@AllArgsConstructor
public class HistoryQueryService {

	private final DocumentHistoryRepositoryPort historyRepository;

	@DocumentSerialized("status")
	public HistoryStatusProjection status(UUID documentId) {
		CommandHistory<SlideRepositoryPort> history = historyRepository.load(documentId);
		return new HistoryStatusProjection(history.canUndo(), history.canRedo(), history.getUndoCount(),
				history.getRedoCount(), history.getHistorySize(), history.getMaxHistory());
	}

	@DocumentSerialized("summary")
	public List<HistoryEntry> summary(UUID documentId) {
		return historyRepository.load(documentId).getHistorySummary();
	}

	/**
	 * 匯出文件歷史的序列化形式
	 */
	@DocumentSerialized("export")
	public CommandHistorySnapshot export(UUID documentId) {
		return historyRepository.load(documentId).toSnapshot();
	}
}

package com.example.deckhistory.application.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.example.deckhistory.application.domain.history.command.Command;
import com.example.deckhistory.application.domain.history.command.CommandHistory;
import com.example.deckhistory.application.domain.slide.aggregate.Slide;
import com.example.deckhistory.application.domain.slide.command.CreateSlideCommand;
import com.example.deckhistory.application.domain.slide.command.DeleteSlideCommand;
import com.example.deckhistory.application.domain.slide.command.MoveSlideCommand;
import com.example.deckhistory.application.domain.slide.command.UpdateSlideCommand;
import com.example.deckhistory.application.domain.slide.exception.SlideNotFoundException;
import com.example.deckhistory.application.port.DocumentHistoryRepositoryPort;
import com.example.deckhistory.application.port.HistorySnapshotBusPort;
import com.example.deckhistory.application.port.SlideRepositoryPort;
import com.example.deckhistory.application.shared.dto.BatchStepResultData;
import com.example.deckhistory.application.shared.dto.UndoRedoResultData;
import com.example.deckhistory.application.shared.projection.SlideStateProjection;
import com.example.deckhistory.infra.annotation.DocumentSerialized;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 投影片編輯服務
 *
 * <p>
 * 每個編輯都包成指令交給文件的 {@link CommandHistory} 執行，成功後把最新的歷史快照送進 RingBuffer 非同步保存。
 * 所有方法都經由 {@link DocumentSerialized} 依文件序列化，第一個參數必須是文件 ID。
 * </p>
 */
@Slf4j
@Service
@AllArgsConstructor
public class SlideEditService {

	static final String NOTHING_TO_UNDO = "Nothing to undo";
	static final String NOTHING_TO_REDO = "Nothing to redo";

	private final DocumentHistoryRepositoryPort historyRepository;
	private final SlideRepositoryPort slideRepository;
	private final HistorySnapshotBusPort snapshotBus;

	/**
	 * 新增投影片
	 *
	 * @param documentId    文件 ID
	 * @param initialFields 初始欄位值
	 * @param orderIndex    排序位置，null 代表附加到末端
	 * @return 新增後的投影片狀態
	 */
	@DocumentSerialized("createSlide")
	public SlideStateProjection createSlide(UUID documentId, Map<String, Object> initialFields, Integer orderIndex) {
		CreateSlideCommand command = new CreateSlideCommand(documentId, initialFields, orderIndex);
		execute(documentId, command);
		return currentState(command.getCreatedSlideId());
	}

	@DocumentSerialized("updateSlide")
	public SlideStateProjection updateSlide(UUID documentId, UUID slideId, Map<String, Object> updates) {
		requireSlideInDocument(documentId, slideId);
		execute(documentId, new UpdateSlideCommand(slideId, updates));
		return currentState(slideId);
	}

	/**
	 * 刪除投影片，刪除後沒有可回傳的狀態
	 */
	@DocumentSerialized("deleteSlide")
	public void deleteSlide(UUID documentId, UUID slideId) {
		requireSlideInDocument(documentId, slideId);
		execute(documentId, new DeleteSlideCommand(slideId));
	}

	@DocumentSerialized("moveSlide")
	public SlideStateProjection moveSlide(UUID documentId, UUID slideId, int newOrder) {
		requireSlideInDocument(documentId, slideId);
		execute(documentId, new MoveSlideCommand(slideId, newOrder));
		return currentState(slideId);
	}

	/**
	 * 撤銷文件最近一次的編輯
	 *
	 * @param documentId 文件 ID
	 * @param slideId    呼叫端關注的投影片，可為 null；不屬於此文件時不回傳其狀態
	 */
	@DocumentSerialized("undo")
	public UndoRedoResultData undo(UUID documentId, UUID slideId) {
		CommandHistory<SlideRepositoryPort> history = historyRepository.load(documentId);
		Optional<Command<SlideRepositoryPort>> undone = history.undo(slideRepository);
		if (undone.isEmpty()) {
			return result(documentId, history, false, NOTHING_TO_UNDO, slideId);
		}

		publishSnapshot(documentId, history);
		log.info(">>> [Edit] 文件 {} 已撤銷: {}", documentId, undone.get());
		return result(documentId, history, true, undone.get().describe(), slideId);
	}

	/**
	 * 重做文件最近一次被撤銷的編輯
	 *
	 * @param documentId 文件 ID
	 * @param slideId    呼叫端關注的投影片，可為 null；不屬於此文件時不回傳其狀態
	 */
	@DocumentSerialized("redo")
	public UndoRedoResultData redo(UUID documentId, UUID slideId) {
		CommandHistory<SlideRepositoryPort> history = historyRepository.load(documentId);
		Optional<Command<SlideRepositoryPort>> redone = history.redo(slideRepository);
		if (redone.isEmpty()) {
			return result(documentId, history, false, NOTHING_TO_REDO, slideId);
		}

		publishSnapshot(documentId, history);
		log.info(">>> [Edit] 文件 {} 已重做: {}", documentId, redone.get());
		return result(documentId, history, true, redone.get().describe(), slideId);
	}

	/**
	 * 連續撤銷多步。中途失敗時例外會往外拋，已完成的步驟保留，快照仍會發布。
	 */
	@DocumentSerialized("undoSteps")
	public BatchStepResultData undoSteps(UUID documentId, int steps) {
		CommandHistory<SlideRepositoryPort> history = historyRepository.load(documentId);
		try {
			List<Command<SlideRepositoryPort>> undone = history.undoMany(steps, slideRepository);
			log.info(">>> [Edit] 文件 {} 連續撤銷 {}/{} 步", documentId, undone.size(), steps);
			return batchResult(history, steps, undone);
		} finally {
			publishSnapshot(documentId, history);
		}
	}

	/**
	 * 連續重做多步。中途失敗時例外會往外拋，已完成的步驟保留，快照仍會發布。
	 */
	@DocumentSerialized("redoSteps")
	public BatchStepResultData redoSteps(UUID documentId, int steps) {
		CommandHistory<SlideRepositoryPort> history = historyRepository.load(documentId);
		try {
			List<Command<SlideRepositoryPort>> redone = history.redoMany(steps, slideRepository);
			log.info(">>> [Edit] 文件 {} 連續重做 {}/{} 步", documentId, redone.size(), steps);
			return batchResult(history, steps, redone);
		} finally {
			publishSnapshot(documentId, history);
		}
	}

	/**
	 * 清空文件歷史，投影片維持目前狀態
	 */
	@DocumentSerialized("clearHistory")
	public void clearHistory(UUID documentId) {
		CommandHistory<SlideRepositoryPort> history = historyRepository.load(documentId);
		int discarded = history.getHistorySize();
		history.clear();
		publishSnapshot(documentId, history);
		log.info(">>> [Edit] 文件 {} 歷史已清空，捨棄 {} 筆指令", documentId, discarded);
	}

	private void execute(UUID documentId, Command<SlideRepositoryPort> command) {
		CommandHistory<SlideRepositoryPort> history = historyRepository.load(documentId);
		history.execute(command, slideRepository);
		publishSnapshot(documentId, history);
		log.info(">>> [Edit] 文件 {} 已執行: {} ({})", documentId, command, command.describe());
	}

	// 快照在文件鎖內產生，持久化順序與編輯順序一致
	private void publishSnapshot(UUID documentId, CommandHistory<SlideRepositoryPort> history) {
		snapshotBus.publish(documentId, history.toSnapshot());
	}

	private void requireSlideInDocument(UUID documentId, UUID slideId) {
		Slide slide = slideRepository.getById(slideId).orElseThrow(() -> new SlideNotFoundException(slideId));
		if (!documentId.equals(slide.getDocumentId())) {
			throw new SlideNotFoundException(slideId);
		}
	}

	private SlideStateProjection currentState(UUID slideId) {
		if (slideId == null) {
			return null;
		}
		return slideRepository.getById(slideId).map(SlideStateProjection::from).orElse(null);
	}

	// 不屬於此文件的投影片不回傳狀態
	private SlideStateProjection currentState(UUID documentId, UUID slideId) {
		if (slideId == null) {
			return null;
		}
		return slideRepository.getById(slideId).filter(slide -> documentId.equals(slide.getDocumentId()))
				.map(SlideStateProjection::from).orElse(null);
	}

	private UndoRedoResultData result(UUID documentId, CommandHistory<SlideRepositoryPort> history, boolean success,
			String description, UUID slideId) {
		return new UndoRedoResultData(success, description, slideId, currentState(documentId, slideId),
				history.canUndo(), history.canRedo());
	}

	private BatchStepResultData batchResult(CommandHistory<SlideRepositoryPort> history, int requested,
			List<Command<SlideRepositoryPort>> commands) {
		return new BatchStepResultData(requested, commands.size(),
				commands.stream().map(Command::describe).toList(), history.canUndo(), history.canRedo());
	}
}

package com.example.deckhistory.infra.adapter;

import java.util.Optional;
import java.util.UUID;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.example.deckhistory.application.domain.history.command.CommandHistory;
import com.example.deckhistory.application.domain.history.command.CommandRegistry;
import com.example.deckhistory.application.domain.history.snapshot.CommandHistorySnapshot;
import com.example.deckhistory.application.port.CommandHistorySnapshotPort;
import com.example.deckhistory.application.port.DocumentHistoryRepositoryPort;
import com.example.deckhistory.application.port.SlideRepositoryPort;
import com.example.deckhistory.infra.repository.DocumentHistoryRegistry;

import lombok.extern.slf4j.Slf4j;

/**
 * 文件歷史倉儲轉接器 (Infrastructure Adapter)
 * <p>
 * 實作 Application Port，並編排 L1 Cache 與持久化快照的協作策略。
 * </p>
 */
@Slf4j
@Component
public class DocumentHistoryRepositoryAdapter implements DocumentHistoryRepositoryPort {

	private final DocumentHistoryRegistry registry;

	private final CommandHistorySnapshotPort snapshotPort;

	private final CommandRegistry<SlideRepositoryPort> commandRegistry;

	/**
	 * 新建歷史的容量
	 */
	private final int maxHistory;

	public DocumentHistoryRepositoryAdapter(DocumentHistoryRegistry registry, CommandHistorySnapshotPort snapshotPort,
			CommandRegistry<SlideRepositoryPort> commandRegistry,
			@Value("${deck.history.max-size:50}") int maxHistory) {
		this.registry = registry;
		this.snapshotPort = snapshotPort;
		this.commandRegistry = commandRegistry;
		this.maxHistory = maxHistory;
	}

	@Override
	public CommandHistory<SlideRepositoryPort> load(UUID documentId) {
		// 1. 策略 A：內存優先 (L1 Cache)
		CommandHistory<SlideRepositoryPort> cached = registry.getFromL1(documentId);
		if (cached != null) {
			return cached;
		}

		// 2. 策略 B：由持久化快照還原，沒有快照則建立空歷史
		CommandHistory<SlideRepositoryPort> history = restore(documentId)
				.orElseGet(() -> new CommandHistory<>(maxHistory));

		log.info(">>> [Recovery] 文件 {} 歷史已就緒: size={}, currentIndex={}", documentId, history.getHistorySize(),
				history.getCurrentIndex());

		// 3. 同步回內存快取
		return registry.putToL1(documentId, history);
	}

	@Override
	public void evict(UUID documentId) {
		registry.removeFromL1(documentId);
	}

	private Optional<CommandHistory<SlideRepositoryPort>> restore(UUID documentId) {
		try {
			Optional<CommandHistorySnapshot> snapshot = snapshotPort.findByDocument(documentId);
			if (snapshot.isEmpty()) {
				return Optional.empty();
			}
			log.info(">>> [Recovery] 發現文件 {} 的歷史快照，開始還原", documentId);
			return Optional.of(CommandHistory.materialize(snapshot.get(), commandRegistry));
		} catch (RuntimeException e) {
			log.warn(">>> [Recovery] 無法讀取文件 {} 的歷史快照 (原因: {})，將以空歷史開始", documentId, e.getMessage());
			return Optional.empty();
		}
	}
}

package com.example.deckhistory.infra.repository;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.stereotype.Component;

import com.example.deckhistory.application.domain.history.command.CommandHistory;
import com.example.deckhistory.application.port.SlideRepositoryPort;

import lombok.extern.slf4j.Slf4j;

/**
 * 文件歷史登錄 (Document History Registry)
 * <p>
 * 專注於 L1 Cache 管理：documentId → CommandHistory，以及每份文件專屬的公平鎖。 不處理快照讀取，快照還原由外層 Adapter 編排。
 * </p>
 * <p>
 * 目前沒有淘汰策略，曾被存取過的文件歷史會一直留在記憶體中。
 * </p>
 */
@Slf4j
@Component
public class DocumentHistoryRegistry {

	// L1 Cache: 文件歷史的唯一來源
	private final Map<UUID, CommandHistory<SlideRepositoryPort>> l1Cache = new ConcurrentHashMap<>();

	private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

	/**
	 * 從 L1 Cache 取得文件歷史
	 */
	public CommandHistory<SlideRepositoryPort> getFromL1(UUID documentId) {
		return l1Cache.get(documentId);
	}

	/**
	 * 放入 L1 Cache。若已有其他執行緒先放入，回傳既有的實例。
	 */
	public CommandHistory<SlideRepositoryPort> putToL1(UUID documentId, CommandHistory<SlideRepositoryPort> history) {
		CommandHistory<SlideRepositoryPort> existing = l1Cache.putIfAbsent(documentId, history);
		return existing != null ? existing : history;
	}

	/**
	 * 從 L1 Cache 移除文件歷史
	 * <p>
	 * 移除後，下一次載入將被迫從持久化快照還原。鎖不會一併移除，以免與正在等待的執行緒拿到不同的鎖。
	 * </p>
	 */
	public void removeFromL1(UUID documentId) {
		if (l1Cache.remove(documentId) != null) {
			log.info(">>> [L1 Cache] 已移除文件 {} 的歷史，下次載入將由快照還原", documentId);
		}
	}

	/**
	 * 取得文件專屬的鎖 (公平鎖，依取得順序執行)
	 */
	public ReentrantLock lockFor(UUID documentId) {
		return locks.computeIfAbsent(documentId, id -> new ReentrantLock(true));
	}

	public int size() {
		return l1Cache.size();
	}
}

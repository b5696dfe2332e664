package com.example.deckhistory.iface.handler;

import org.springframework.stereotype.Component;

import com.example.deckhistory.application.port.CommandHistorySnapshotPort;
import com.example.deckhistory.infra.lmax.event.HistorySnapshotEvent;
import com.lmax.disruptor.EventHandler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>歷史快照處理器 (History Snapshot Handler)</h1>
 * <p>
 * <b>職責：</b> Disruptor 唯一的消費者，把每次編輯後的文件歷史快照寫入持久層。 同一文件的快照依發布順序寫入，較新的快照會覆蓋較舊的。
 * </p>
 * <p>
 * 寫入失敗只記錄錯誤，不影響已完成的編輯，也不中斷 RingBuffer 後續處理。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HistorySnapshotHandler implements EventHandler<HistorySnapshotEvent> {

	private final CommandHistorySnapshotPort snapshotPort;

	@Override
	public void onEvent(HistorySnapshotEvent event, long sequence, boolean endOfBatch) {
		try {
			if (event.getDocumentId() == null || event.getSnapshot() == null) {
				log.warn(">>> [Snapshot] 收到不完整的快照事件 (Seq: {})，略過", sequence);
				return;
			}
			snapshotPort.save(event.getDocumentId(), event.getSnapshot());
			log.info(">>> [Snapshot] 文件 {} 歷史快照已保存 (Seq: {}, size: {}, currentIndex: {})", event.getDocumentId(),
					sequence, event.getSnapshot().getCommands().size(), event.getSnapshot().getCurrentIndex());
		} catch (Exception e) {
			log.error(">>> [Snapshot] 保存文件 {} 歷史快照失敗 (Seq: {}): {}", event.getDocumentId(), sequence,
					e.getMessage(), e);
		} finally {
			event.clear();
		}
	}
}

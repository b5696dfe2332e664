package com.example.deckhistory.config.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.deckhistory.iface.handler.HistorySnapshotHandler;
import com.example.deckhistory.infra.lmax.event.HistorySnapshotEvent;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.util.DaemonThreadFactory;

/**
 * LMAX Disruptor 設定類 (歷史快照持久化)
 *
 * <p>
 * 編輯請求只負責把快照放進 RingBuffer，實際寫入資料庫由單一消費者執行緒完成，不佔用請求路徑。
 * </p>
 *
 * <p>
 * 設計重點：
 * <ul>
 * <li>單一消費者，同一文件的快照依發布順序寫入</li>
 * <li>Disruptor 本身不包含業務邏輯，只負責事件傳遞與調度</li>
 * </ul>
 * </p>
 */
@Configuration
public class DisruptorConfiguration {

	/**
	 * 建立歷史快照專用的 Disruptor 實例
	 *
	 * @param snapshotHandler 歷史快照處理器
	 * @param bufferSize      RingBuffer 容量，需為 2 的次方
	 *
	 * @return 已啟動的 {@link Disruptor} 實例
	 */
	@Bean(destroyMethod = "shutdown")
	public Disruptor<HistorySnapshotEvent> historySnapshotDisruptor(HistorySnapshotHandler snapshotHandler,
			@Value("${deck.history.ring-buffer-size:1024}") int bufferSize) {
		if (Integer.bitCount(bufferSize) != 1) {
			throw new IllegalArgumentException("deck.history.ring-buffer-size 必須為 2 的次方: " + bufferSize);
		}

		Disruptor<HistorySnapshotEvent> disruptor = new Disruptor<>(HistorySnapshotEvent::new, bufferSize,
				DaemonThreadFactory.INSTANCE);
		disruptor.handleEventsWith(snapshotHandler);
		// 啟動 Disruptor（開始接受事件）
		disruptor.start();
		return disruptor;
	}

	/**
	 * 將 RingBuffer 暴露為 Spring Bean，作為歷史快照的唯一入口
	 */
	@Bean
	public RingBuffer<HistorySnapshotEvent> historySnapshotRingBuffer(Disruptor<HistorySnapshotEvent> disruptor) {
		return disruptor.getRingBuffer();
	}
}

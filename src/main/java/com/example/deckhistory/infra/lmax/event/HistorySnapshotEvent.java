package com.example.deckhistory.infra.lmax.event;

import java.util.UUID;

import com.example.deckhistory.application.domain.history.snapshot.CommandHistorySnapshot;

import lombok.Data;

/**
 * RingBuffer 中的歷史快照載體，處理完畢後會被清空重用
 */
@Data
public class HistorySnapshotEvent {

	private UUID documentId;

	private CommandHistorySnapshot snapshot;

	public void clear() {
		this.documentId = null;
		this.snapshot = null;
	}
}

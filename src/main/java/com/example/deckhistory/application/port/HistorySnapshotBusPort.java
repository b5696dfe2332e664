package com.example.deckhistory.application.port;

import java.util.UUID;

import com.example.deckhistory.application.domain.history.snapshot.CommandHistorySnapshot;

/**
 * 歷史快照發布 Port
 * */
public interface HistorySnapshotBusPort {

	void publish(UUID documentId, CommandHistorySnapshot snapshot);
}

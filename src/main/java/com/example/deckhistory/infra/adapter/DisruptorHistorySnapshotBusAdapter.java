package com.example.deckhistory.infra.adapter;

import java.util.UUID;

import org.springframework.stereotype.Component;

import com.example.deckhistory.application.domain.history.snapshot.CommandHistorySnapshot;
import com.example.deckhistory.application.port.HistorySnapshotBusPort;
import com.example.deckhistory.infra.lmax.event.HistorySnapshotEvent;
import com.lmax.disruptor.RingBuffer;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@AllArgsConstructor
public class DisruptorHistorySnapshotBusAdapter implements HistorySnapshotBusPort {

	private final RingBuffer<HistorySnapshotEvent> ringBuffer;

	@Override
	public void publish(UUID documentId, CommandHistorySnapshot snapshot) {
		ringBuffer.publishEvent((event, seq) -> {
			event.setDocumentId(documentId);
			event.setSnapshot(snapshot);
			log.debug(">>> [Snapshot-Bus] 快照已入隊: Seq={}, Document={}", seq, documentId);
		});
	}
}

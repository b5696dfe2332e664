package com.example.deckhistory.infra.adapter;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.deckhistory.application.domain.history.snapshot.CommandHistorySnapshot;
import com.example.deckhistory.application.port.CommandHistorySnapshotPort;
import com.example.deckhistory.infra.codec.CommandHistoryJsonCodec;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcCommandHistorySnapshotAdapter implements CommandHistorySnapshotPort {

	private final JdbcTemplate jdbcTemplate;
	private final CommandHistoryJsonCodec codec;

	@Override
	public void save(UUID documentId, CommandHistorySnapshot snapshot) {
		String json = codec.serialize(snapshot);
		LocalDateTime now = LocalDateTime.now();

		// 先嘗試更新，沒有既有資料時才新增 (MySQL 與 H2 皆適用)
		int updated = jdbcTemplate.update("""
				UPDATE document_histories
				SET max_history = ?, current_index = ?, history_json = ?, updated_at = ?
				WHERE document_id = ?
				""", snapshot.getMaxHistory(), snapshot.getCurrentIndex(), json, now, documentId.toString());

		if (updated == 0) {
			jdbcTemplate.update("""
					INSERT INTO document_histories (document_id, max_history, current_index, history_json, updated_at)
					VALUES (?, ?, ?, ?, ?)
					""", documentId.toString(), snapshot.getMaxHistory(), snapshot.getCurrentIndex(), json, now);
		}
		log.debug("[Snapshot] 歷史快照已存入資料庫: Document={}, currentIndex={}", documentId,
				snapshot.getCurrentIndex());
	}

	@Override
	public Optional<CommandHistorySnapshot> findByDocument(UUID documentId) {
		String sql = """
				SELECT history_json FROM document_histories
				WHERE document_id = ?
				""";

		try {
			CommandHistorySnapshot snapshot = jdbcTemplate.<CommandHistorySnapshot>queryForObject(sql,
					(rs, rowNum) -> {
						try {
							return codec.deserialize(rs.getString("history_json"));
						} catch (IllegalStateException e) {
							throw new SQLException("歷史快照反序列化錯誤", e);
						}
					}, documentId.toString());

			return Optional.ofNullable(snapshot);
		} catch (EmptyResultDataAccessException e) {
			// 文件從未被編輯過
			return Optional.empty();
		}
	}
}

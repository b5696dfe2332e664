package com.example.deckhistory.infra.adapter;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.deckhistory.application.domain.slide.aggregate.Slide;
import com.example.deckhistory.application.domain.slide.aggregate.SlideOrdering;
import com.example.deckhistory.application.domain.slide.aggregate.vo.SlideLayoutType;
import com.example.deckhistory.application.domain.slide.exception.SlideNotFoundException;
import com.example.deckhistory.application.port.SlideRepositoryPort;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * 投影片 JDBC 轉接器
 *
 * <p>
 * content 以 JSON 字串存放。
 * </p>
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcSlideRepositoryAdapter implements SlideRepositoryPort {

	private static final String COLUMNS = "id, document_id, title, subtitle, layout_type, content, notes, "
			+ "background_color, text_color, font_family, order_index";

	private final JdbcTemplate jdbcTemplate;
	private final ObjectMapper objectMapper;

	@Override
	public Optional<Slide> getById(UUID slideId) {
		String sql = "SELECT " + COLUMNS + " FROM slides WHERE id = ?";
		try {
			return Optional.ofNullable(jdbcTemplate.<Slide>queryForObject(sql, this::mapRow, slideId.toString()));
		} catch (EmptyResultDataAccessException e) {
			return Optional.empty();
		}
	}

	@Override
	public List<Slide> findByDocument(UUID documentId) {
		String sql = "SELECT " + COLUMNS + " FROM slides WHERE document_id = ? ORDER BY order_index, created_at, id";
		return jdbcTemplate.query(sql, this::mapRow, documentId.toString());
	}

	@Override
	public Slide create(Slide slide) {
		if (slide.getId() == null) {
			slide.setId(UUID.randomUUID());
		}
		LocalDateTime now = LocalDateTime.now();
		jdbcTemplate.update("""
				INSERT INTO slides (id, document_id, title, subtitle, layout_type, content, notes,
				    background_color, text_color, font_family, order_index, created_at, updated_at)
				VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
				""", slide.getId().toString(), slide.getDocumentId().toString(), slide.getTitle(), slide.getSubtitle(),
				slide.getLayoutType().getValue(), writeContent(slide.getContent()), slide.getNotes(),
				slide.getBackgroundColor(), slide.getTextColor(), slide.getFontFamily(), slide.getOrderIndex(), now,
				now);
		log.debug("[Slide] 新增投影片 {} (document={}, order={})", slide.getId(), slide.getDocumentId(),
				slide.getOrderIndex());
		return slide;
	}

	@Override
	public Slide update(Slide slide) {
		int updated = jdbcTemplate.update("""
				UPDATE slides
				SET title = ?, subtitle = ?, layout_type = ?, content = ?, notes = ?,
				    background_color = ?, text_color = ?, font_family = ?, order_index = ?, updated_at = ?
				WHERE id = ?
				""", slide.getTitle(), slide.getSubtitle(), slide.getLayoutType().getValue(),
				writeContent(slide.getContent()), slide.getNotes(), slide.getBackgroundColor(), slide.getTextColor(),
				slide.getFontFamily(), slide.getOrderIndex(), LocalDateTime.now(), slide.getId().toString());
		if (updated == 0) {
			throw new SlideNotFoundException(slide.getId());
		}
		return slide;
	}

	@Override
	public boolean delete(UUID slideId) {
		return jdbcTemplate.update("DELETE FROM slides WHERE id = ?", slideId.toString()) > 0;
	}

	@Override
	public void reindexSiblings(UUID documentId, UUID movedSlideId, int newOrder) {
		Map<UUID, Integer> orders = SlideOrdering.reindexSiblings(findByDocument(documentId), movedSlideId, newOrder);
		if (orders.isEmpty()) {
			return;
		}

		List<Object[]> batchArgs = new ArrayList<>(orders.size());
		orders.forEach((id, order) -> batchArgs.add(new Object[] { order, id.toString() }));
		jdbcTemplate.batchUpdate("UPDATE slides SET order_index = ? WHERE id = ?", batchArgs);
		log.debug("[Slide] 文件 {} 已重新編排 {} 張兄弟投影片", documentId, orders.size());
	}

	private Slide mapRow(ResultSet rs, int rowNum) throws SQLException {
		Map<String, Object> content;
		try {
			String json = rs.getString("content");
			content = json != null ? objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {
			}) : new LinkedHashMap<>();
		} catch (Exception e) {
			throw new SQLException("投影片內容反序列化錯誤", e);
		}

		String layout = rs.getString("layout_type");
		return Slide.builder().id(UUID.fromString(rs.getString("id")))
				.documentId(UUID.fromString(rs.getString("document_id"))).title(rs.getString("title"))
				.subtitle(rs.getString("subtitle"))
				.layoutType(layout != null ? SlideLayoutType.fromValue(layout) : SlideLayoutType.TITLE_CONTENT)
				.content(content).notes(rs.getString("notes")).backgroundColor(rs.getString("background_color"))
				.textColor(rs.getString("text_color")).fontFamily(rs.getString("font_family"))
				.orderIndex(rs.getInt("order_index")).build();
	}

	private String writeContent(Map<String, Object> content) {
		try {
			return objectMapper.writeValueAsString(content != null ? content : Map.of());
		} catch (Exception e) {
			throw new IllegalStateException("投影片內容序列化失敗", e);
		}
	}
}

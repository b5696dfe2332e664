package com.example.deckhistory.application.shared.projection;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.example.deckhistory.application.domain.slide.aggregate.Slide;

/**
 * 投影片目前狀態 (Query Model)
 */
public record SlideStateProjection(UUID id, UUID documentId, int orderIndex, String title, String subtitle,
		String layoutType, Map<String, Object> content, String notes, String backgroundColor, String textColor,
		String fontFamily) {

	public static SlideStateProjection from(Slide slide) {
		return new SlideStateProjection(slide.getId(), slide.getDocumentId(), slide.getOrderIndex(), slide.getTitle(),
				slide.getSubtitle(), slide.getLayoutType().getValue(), new LinkedHashMap<>(slide.getContent()), slide.getNotes(),
				slide.getBackgroundColor(), slide.getTextColor(), slide.getFontFamily());
	}
}

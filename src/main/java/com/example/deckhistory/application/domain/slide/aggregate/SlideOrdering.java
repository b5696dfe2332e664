package com.example.deckhistory.application.domain.slide.aggregate;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 文件內投影片的排序計算
 */
public final class SlideOrdering {

	private SlideOrdering() {
	}

	/**
	 * 計算移動後兄弟投影片的新排序。
	 *
	 * <p>
	 * 兄弟投影片維持原本的相對順序，從 0 開始連續編號並跳過 {@code newOrder} 這一格 (留給被移動的投影片)。
	 * 回傳結果不包含被移動的投影片本身。
	 * </p>
	 *
	 * @param documentSlides 文件內的全部投影片
	 * @param movedSlideId   被移動的投影片
	 * @param newOrder       被移動投影片的新位置
	 * @return 兄弟投影片 ID → 新排序
	 */
	public static Map<UUID, Integer> reindexSiblings(List<Slide> documentSlides, UUID movedSlideId, int newOrder) {
		List<Slide> siblings = documentSlides.stream().filter(slide -> !slide.getId().equals(movedSlideId))
				.sorted(Comparator.comparingInt(Slide::getOrderIndex)).toList();

		Map<UUID, Integer> orders = new LinkedHashMap<>();
		int position = 0;
		for (Slide sibling : siblings) {
			if (position == newOrder) {
				position++;
			}
			orders.put(sibling.getId(), position++);
		}
		return orders;
	}
}

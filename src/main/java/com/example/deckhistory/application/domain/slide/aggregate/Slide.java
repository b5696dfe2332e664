package com.example.deckhistory.application.domain.slide.aggregate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.example.deckhistory.application.domain.history.command.CommandPayload;
import com.example.deckhistory.application.domain.slide.aggregate.vo.SlideField;
import com.example.deckhistory.application.domain.slide.aggregate.vo.SlideLayoutType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 投影片實體
 *
 * <p>
 * 每張投影片屬於一份文件 (簡報)，以 orderIndex 決定在文件中的順序。 儲存方式由 SlideRepositoryPort 的實作決定，指令只透過該
 * Port 存取。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Slide {

	private UUID id;

	/**
	 * 所屬文件 ID
	 */
	private UUID documentId;

	private String title;

	private String subtitle;

	@Builder.Default
	private SlideLayoutType layoutType = SlideLayoutType.TITLE_CONTENT;

	/**
	 * 投影片內容 (JSON 物件)
	 */
	@Builder.Default
	private Map<String, Object> content = new LinkedHashMap<>();

	/**
	 * 演講者備註
	 */
	private String notes;

	private String backgroundColor;

	private String textColor;

	private String fontFamily;

	private int orderIndex;

	/**
	 * 移動到新的排序位置
	 */
	public void moveTo(int newOrder) {
		this.orderIndex = newOrder;
	}

	/**
	 * 產生完整狀態快照 (識別碼、所屬文件、排序與所有可編輯欄位)，值皆為可序列化形式。
	 */
	public Map<String, Object> toSnapshot() {
		Map<String, Object> snapshot = new LinkedHashMap<>();
		snapshot.put("id", id != null ? id.toString() : null);
		snapshot.put("documentId", documentId != null ? documentId.toString() : null);
		snapshot.put("orderIndex", orderIndex);
		snapshot.putAll(SlideField.readAll(this));
		return snapshot;
	}

	/**
	 * 快照工廠方法：由 {@link #toSnapshot()} 的結果重新建立一個帶有相同識別碼的實體。
	 */
	public static Slide fromSnapshot(Map<String, Object> snapshot) {
		if (snapshot == null) {
			throw new IllegalArgumentException("快照資料不可為空");
		}
		CommandPayload values = new CommandPayload(snapshot);
		Slide slide = Slide.builder().id(values.requireUuid("id")).documentId(values.requireUuid("documentId"))
				.orderIndex(values.requireInt("orderIndex")).build();
		for (SlideField field : SlideField.values()) {
			if (snapshot.containsKey(field.getKey())) {
				field.write(slide, snapshot.get(field.getKey()));
			}
		}
		return slide;
	}
}

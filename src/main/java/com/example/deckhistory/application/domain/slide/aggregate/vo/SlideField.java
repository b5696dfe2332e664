package com.example.deckhistory.application.domain.slide.aggregate.vo;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

import com.example.deckhistory.application.domain.slide.aggregate.Slide;

/**
 * 可被編輯 (也因此可被撤銷) 的投影片欄位
 *
 * <p>
 * 讀出的值一律是可直接序列化的形式 (版面類型為字串值、內容為 Map 副本)，寫入時則接受同樣的形式。 這讓 Update / Delete
 * 指令的快照可以原封不動地放進歷史快照中。
 * </p>
 */
public enum SlideField {
	TITLE("title", Slide::getTitle, (slide, value) -> slide.setTitle(asString(value))),
	SUBTITLE("subtitle", Slide::getSubtitle, (slide, value) -> slide.setSubtitle(asString(value))),
	LAYOUT_TYPE("layoutType", slide -> slide.getLayoutType().getValue(),
			(slide, value) -> slide.setLayoutType(
					value == null ? SlideLayoutType.TITLE_CONTENT : SlideLayoutType.fromValue(value.toString()))),
	CONTENT("content", slide -> copyContent(slide.getContent()), (slide, value) -> slide.setContent(copyContent(value))),
	NOTES("notes", Slide::getNotes, (slide, value) -> slide.setNotes(asString(value))),
	BACKGROUND_COLOR("backgroundColor", Slide::getBackgroundColor,
			(slide, value) -> slide.setBackgroundColor(asString(value))),
	TEXT_COLOR("textColor", Slide::getTextColor, (slide, value) -> slide.setTextColor(asString(value))),
	FONT_FAMILY("fontFamily", Slide::getFontFamily, (slide, value) -> slide.setFontFamily(asString(value)));

	private final String key;
	private final Function<Slide, Object> reader;
	private final BiConsumer<Slide, Object> writer;

	SlideField(String key, Function<Slide, Object> reader, BiConsumer<Slide, Object> writer) {
		this.key = key;
		this.reader = reader;
		this.writer = writer;
	}

	public String getKey() {
		return key;
	}

	public Object read(Slide slide) {
		return reader.apply(slide);
	}

	public void write(Slide slide, Object value) {
		writer.accept(slide, value);
	}

	/**
	 * @throws IllegalArgumentException 欄位名稱不存在
	 */
	public static SlideField fromKey(String key) {
		return Arrays.stream(values()).filter(field -> field.key.equals(key)).findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Unknown slide field: " + key));
	}

	/**
	 * 驗證欄位名稱並複製成保留順序的 Map，值同時轉成可序列化形式。
	 */
	public static Map<String, Object> normalize(Map<String, ?> fields) {
		Map<String, Object> normalized = new LinkedHashMap<>();
		if (fields == null) {
			return normalized;
		}
		fields.forEach((key, value) -> {
			SlideField field = fromKey(key);
			normalized.put(key, field == CONTENT ? copyContent(value) : normalizeScalar(field, value));
		});
		return normalized;
	}

	/**
	 * 讀出投影片的全部可編輯欄位
	 */
	public static Map<String, Object> readAll(Slide slide) {
		Map<String, Object> values = new LinkedHashMap<>();
		for (SlideField field : values()) {
			values.put(field.key, field.read(slide));
		}
		return values;
	}

	/**
	 * 依 Map 內容寫入投影片，未出現的欄位不受影響
	 */
	public static void applyAll(Slide slide, Map<String, ?> values) {
		values.forEach((key, value) -> fromKey(key).write(slide, value));
	}

	private static Object normalizeScalar(SlideField field, Object value) {
		if (value == null) {
			return null;
		}
		if (field == LAYOUT_TYPE) {
			return SlideLayoutType.fromValue(value.toString()).getValue();
		}
		return value.toString();
	}

	private static String asString(Object value) {
		return value != null ? value.toString() : null;
	}

	private static Map<String, Object> copyContent(Object value) {
		Map<String, Object> copy = new LinkedHashMap<>();
		if (value == null) {
			return copy;
		}
		if (!(value instanceof Map)) {
			throw new IllegalArgumentException("Slide content must be a JSON object");
		}
		((Map<?, ?>) value).forEach((k, v) -> copy.put(String.valueOf(k), v));
		return copy;
	}
}

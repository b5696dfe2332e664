package com.example.deckhistory.application.domain.slide.aggregate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.deckhistory.application.domain.slide.aggregate.vo.SlideField;
import com.example.deckhistory.application.domain.slide.aggregate.vo.SlideLayoutType;

class SlideTest {

	@Test
	@DisplayName("快照還原出相同的識別碼、排序與欄位值")
	void snapshotRestoresEntity() {
		Map<String, Object> content = new LinkedHashMap<>();
		content.put("body", "text");
		Slide slide = Slide.builder().id(UUID.randomUUID()).documentId(UUID.randomUUID()).title("T")
				.layoutType(SlideLayoutType.COMPARISON).content(content).fontFamily("Inter").orderIndex(4).build();

		Slide restored = Slide.fromSnapshot(slide.toSnapshot());

		assertThat(restored).isEqualTo(slide);
	}

	@Test
	@DisplayName("空快照被拒絕")
	void nullSnapshotIsRejected() {
		assertThatThrownBy(() -> Slide.fromSnapshot(null)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("版面類型接受字串值或列舉名稱")
	void layoutTypeParsing() {
		assertThat(SlideLayoutType.fromValue("image_left")).isEqualTo(SlideLayoutType.IMAGE_LEFT);
		assertThat(SlideLayoutType.fromValue("FULL_IMAGE")).isEqualTo(SlideLayoutType.FULL_IMAGE);
		assertThatThrownBy(() -> SlideLayoutType.fromValue("spiral")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("欄位正規化保留順序並把版面類型轉成字串值")
	void normalizeFields() {
		Map<String, Object> fields = new LinkedHashMap<>();
		fields.put("layoutType", "BLANK");
		fields.put("title", "x");
		fields.put("notes", null);

		Map<String, Object> normalized = SlideField.normalize(fields);

		assertThat(normalized.keySet()).containsExactly("layoutType", "title", "notes");
		assertThat(normalized).containsEntry("layoutType", "blank").containsEntry("notes", null);
	}
}

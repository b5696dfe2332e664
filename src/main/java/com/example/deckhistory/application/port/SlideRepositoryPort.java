package com.example.deckhistory.application.port;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.example.deckhistory.application.domain.slide.aggregate.Slide;

/**
 * 投影片儲存埠 (Slide Repository Port)
 *
 * <p>
 * 屬於 Application 層的 Outbound Port，是投影片指令唯一會呼叫的協作者。 指令不知道投影片實際如何被持久化。
 * </p>
 */
public interface SlideRepositoryPort {

	/**
	 * 依 ID 取得投影片
	 *
	 * @param slideId 投影片 ID
	 */
	Optional<Slide> getById(UUID slideId);

	/**
	 * 取得文件內全部投影片，依 orderIndex 排序
	 *
	 * @param documentId 文件 ID
	 */
	List<Slide> findByDocument(UUID documentId);

	/**
	 * 新增投影片。若實體尚無 ID 則由儲存層指派，若已帶 ID 則沿用。
	 *
	 * @param slide 投影片實體
	 * @return 已儲存的投影片 (帶有 ID)
	 */
	Slide create(Slide slide);

	/**
	 * 覆寫既有投影片
	 *
	 * @param slide 投影片實體
	 * @return 已儲存的投影片
	 */
	Slide update(Slide slide);

	/**
	 * 刪除投影片
	 *
	 * @param slideId 投影片 ID
	 * @return 是否確實刪除了一筆資料
	 */
	boolean delete(UUID slideId);

	/**
	 * 移動投影片後重新編排同文件內其他投影片的排序
	 *
	 * @param documentId   文件 ID
	 * @param movedSlideId 被移動的投影片
	 * @param newOrder     被移動投影片的新位置
	 */
	void reindexSiblings(UUID documentId, UUID movedSlideId, int newOrder);
}

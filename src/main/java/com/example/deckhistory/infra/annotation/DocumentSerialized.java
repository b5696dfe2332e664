package com.example.deckhistory.infra.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 標記需要依文件序列化執行的服務方法。被標註方法的第一個參數必須是文件 ID ({@link java.util.UUID})。
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DocumentSerialized {
	String value() default ""; // 操作名稱，僅用於日誌
}

package com.example.deckhistory.iface.aspect;

import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

import com.example.deckhistory.infra.annotation.DocumentSerialized;
import com.example.deckhistory.infra.repository.DocumentHistoryRegistry;

import lombok.extern.slf4j.Slf4j;

/**
 * 文件序列化攔截器 (Document Serialization Aspect)
 * <p>
 * 職責：攔截標註了 {@link DocumentSerialized} 的 Service 方法，在執行期間持有該文件專屬的鎖。
 * 同一文件的編輯依取得鎖的順序逐一執行，不同文件之間互不阻塞。
 * </p>
 */
@Slf4j
@Aspect
@Component
public class DocumentSerializationAspect {

	private final DocumentHistoryRegistry registry;

	public DocumentSerializationAspect(DocumentHistoryRegistry registry) {
		this.registry = registry;
	}

	/**
	 * 取得文件鎖後執行原方法
	 *
	 * @param pjp 切入點，預期第一個參數為文件 ID
	 * @return 原方法的回傳值
	 */
	@Around("@annotation(serialized)")
	public Object serialize(ProceedingJoinPoint pjp, DocumentSerialized serialized) throws Throwable {
		Object[] args = pjp.getArgs();
		if (args.length == 0 || !(args[0] instanceof UUID)) {
			log.error(">>> [AOP] 錯誤：@DocumentSerialized 方法必須接收文件 ID (UUID) 作為第一個參數: {}",
					pjp.getSignature().toShortString());
			return pjp.proceed(); // 若參數不符則退回原始執行
		}

		UUID documentId = (UUID) args[0];
		ReentrantLock lock = registry.lockFor(documentId);
		lock.lock();
		try {
			log.debug(">>> [AOP] 取得文件鎖: Document={}, Operation={}", documentId,
					serialized.value().isEmpty() ? pjp.getSignature().getName() : serialized.value());
			return pjp.proceed();
		} finally {
			lock.unlock();
		}
	}
}

/**
 * Runner: 적재 파이프라인의 실행 계층.
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.ingest.adapter.runner.PublishTask}: 재시도 포함 문서 발행</li>
 *   <li>{@link com.ryuqq.ingest.adapter.runner.StreamReader}: consumer를 끝없는 메시지 스트림으로 노출</li>
 *   <li>{@link com.ryuqq.ingest.adapter.runner.BulkStreamer}: bulkSize 단위 배치 제출</li>
 *   <li>{@link com.ryuqq.ingest.adapter.runner.BatchFlusher}: 연결 복구를 포함한 flush 루프</li>
 *   <li>{@link com.ryuqq.ingest.adapter.runner.WorkerPoolSupervisor}: worker 기동 및 재기동</li>
 * </ul>
 *
 * <p><strong>메시지 흐름:</strong></p>
 * <pre>
 * PublishTask → DurableChannel → StreamReader → PendingAcks
 *                                     ↓
 *                               BulkStreamer → SearchBackend
 *                                     ↓
 *                     BatchFlusher: ack (성공) / skip (실패, 재전달 대기)
 * </pre>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
package com.ryuqq.ingest.adapter.runner;

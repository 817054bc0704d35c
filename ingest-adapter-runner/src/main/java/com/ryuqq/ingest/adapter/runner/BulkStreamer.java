package com.ryuqq.ingest.adapter.runner;

import com.ryuqq.ingest.core.exception.BackendException;
import com.ryuqq.ingest.core.model.IndexingAction;
import com.ryuqq.ingest.core.spi.BackendConnection;
import com.ryuqq.ingest.core.spi.BulkItemResult;
import com.ryuqq.ingest.core.spi.ChannelMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * StreamReader의 메시지를 bulkSize 단위로 모아 백엔드에 제출합니다.
 *
 * <p><strong>배치 경계:</strong></p>
 * <ul>
 *   <li>bulkSize개가 모이면 제출</li>
 *   <li>flushOnIdle이면 버퍼가 비어 있지 않은 상태에서 pull 타임아웃 시 부분 배치 제출</li>
 *   <li>reader가 닫히면 모인 만큼 제출</li>
 * </ul>
 *
 * <p>결과는 제출 순서대로 문서당 하나입니다. 개수나 id가 맞지 않는 응답은
 * {@link BackendException}으로 배치 전체를 실패 처리합니다.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public final class BulkStreamer {

    private static final Logger log = LoggerFactory.getLogger(BulkStreamer.class);

    private final StreamReader reader;
    private final BackendConnection connection;
    private final int bulkSize;
    private final boolean flushOnIdle;

    public BulkStreamer(StreamReader reader, BackendConnection connection, int bulkSize, boolean flushOnIdle) {
        if (reader == null) {
            throw new IllegalArgumentException("reader cannot be null");
        }
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        if (bulkSize <= 0) {
            throw new IllegalArgumentException("bulkSize must be positive (current: " + bulkSize + ")");
        }
        this.reader = reader;
        this.connection = connection;
        this.bulkSize = bulkSize;
        this.flushOnIdle = flushOnIdle;
    }

    /**
     * 다음 배치를 모아 제출합니다.
     *
     * @return 문서별 결과 (제출 순서), reader가 닫혀 모인 것이 없으면 빈 리스트
     * @throws BackendException 백엔드 실패 또는 응답 불일치
     */
    public List<FlushResult> nextBatch() {
        List<ChannelMessage> buffer = fill();
        if (buffer.isEmpty()) {
            return List.of();
        }

        List<IndexingAction> actions = new ArrayList<>(buffer.size());
        for (ChannelMessage message : buffer) {
            actions.add(message.action());
        }

        List<BulkItemResult> results = connection.submit(actions);
        if (results == null || results.size() != buffer.size()) {
            throw new BackendException("Bulk response has " + (results == null ? 0 : results.size())
                + " items for " + buffer.size() + " submitted documents");
        }

        List<FlushResult> flushResults = new ArrayList<>(buffer.size());
        for (int i = 0; i < buffer.size(); i++) {
            ChannelMessage message = buffer.get(i);
            BulkItemResult result = results.get(i);
            if (!message.action().actionId().equals(result.actionId())) {
                throw new BackendException("Bulk response item " + i + " is for action "
                    + result.actionId().asString() + ", expected " + message.action().actionId().asString());
            }
            flushResults.add(new FlushResult(message, result));
        }
        log.debug("Submitted batch of {} documents", flushResults.size());
        return flushResults;
    }

    private List<ChannelMessage> fill() {
        List<ChannelMessage> buffer = new ArrayList<>(bulkSize);
        while (buffer.size() < bulkSize && reader.hasNext()) {
            if (flushOnIdle && !buffer.isEmpty()) {
                Optional<ChannelMessage> message = reader.poll();
                if (message.isEmpty()) {
                    log.debug("Channel idle, flushing partial batch of {}", buffer.size());
                    break;
                }
                buffer.add(message.get());
                continue;
            }
            try {
                buffer.add(reader.next());
            } catch (NoSuchElementException e) {
                log.debug("Reader closed with {} buffered documents", buffer.size());
                break;
            }
        }
        return buffer;
    }
}

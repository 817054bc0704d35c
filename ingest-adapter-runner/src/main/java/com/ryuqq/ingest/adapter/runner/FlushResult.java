package com.ryuqq.ingest.adapter.runner;

import com.ryuqq.ingest.core.spi.BulkItemResult;
import com.ryuqq.ingest.core.spi.ChannelMessage;

/**
 * Bulk 요청 한 건의 문서별 결과.
 *
 * @param message 제출된 문서의 메시지
 * @param result 백엔드가 보고한 결과
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public record FlushResult(ChannelMessage message, BulkItemResult result) {

    public FlushResult {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
    }

    public boolean success() {
        return result.success();
    }
}

package com.ryuqq.ingest.core.spi;

import com.ryuqq.ingest.core.model.ActionId;

/**
 * Per-document outcome of a bulk submission.
 *
 * @param actionId id of the action this result belongs to
 * @param success true if the backend indexed the document
 * @param status backend status code (e.g. 201, 400, 429)
 * @param error failure detail, null on success
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public record BulkItemResult(
    ActionId actionId,
    boolean success,
    int status,
    String error
) {

    public BulkItemResult {
        if (actionId == null) {
            throw new IllegalArgumentException("actionId cannot be null");
        }
        if (!success && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("error cannot be null or blank for a failed result");
        }
    }

    public static BulkItemResult ok(ActionId actionId, int status) {
        return new BulkItemResult(actionId, true, status, null);
    }

    public static BulkItemResult failed(ActionId actionId, int status, String error) {
        return new BulkItemResult(actionId, false, status, error);
    }
}

package com.example.viticache.source;

import com.example.viticache.domain.TableRecord;

import java.util.Objects;

/**
 * 원천 조회 결과: 성공(TableRecord) 또는 실패(FetchError)
 */
public final class FetchResult {

    private final TableRecord record;
    private final FetchError error;

    private FetchResult(TableRecord record, FetchError error) {
        this.record = record;
        this.error = error;
    }

    public static FetchResult success(TableRecord record) {
        return new FetchResult(Objects.requireNonNull(record, "record"), null);
    }

    public static FetchResult failure(FetchError error) {
        return new FetchResult(null, Objects.requireNonNull(error, "error"));
    }

    public static FetchResult failure(FetchError.Type type, String message) {
        return failure(FetchError.of(type, message));
    }

    public boolean isSuccess() {
        return record != null;
    }

    public TableRecord record() {
        if (record == null) {
            throw new IllegalStateException("fetch failed: " + error);
        }
        return record;
    }

    public FetchError error() {
        if (error == null) {
            throw new IllegalStateException("fetch succeeded");
        }
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "SUCCESS" : "FAILURE(" + error + ")";
    }
}

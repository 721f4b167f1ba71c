package com.adlanda.ethicsassistant.model;

import com.adlanda.ethicsassistant.exception.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of ingesting one document.
 *
 * @param file      Logical key of the document
 * @param status    SUCCESS or FAILED
 * @param chunks    Number of chunks indexed (null on failure)
 * @param error     Error detail (null on success)
 * @param errorKind Kind of the underlying failure (null on success)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileIngestionResult(
        String file,
        Status status,
        Integer chunks,
        String error,
        ErrorKind errorKind
) {
    public enum Status { SUCCESS, FAILED }

    public static FileIngestionResult success(String file, int chunks) {
        return new FileIngestionResult(file, Status.SUCCESS, chunks, null, null);
    }

    public static FileIngestionResult failed(String file, String error, ErrorKind errorKind) {
        return new FileIngestionResult(file, Status.FAILED, null, error, errorKind);
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }
}

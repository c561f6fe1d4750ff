package com.groceryshopper.chat.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Immutable snapshot of the local model download state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadProgress {

    private Status status;
    private int progress;
    private String message;

    public enum Status {
        IDLE, DOWNLOADING, COMPLETED, FAILED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public static DownloadProgress idle() {
        return new DownloadProgress(Status.IDLE, 0, "");
    }
}

package me.golemcore.estate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body returned by the chat and session endpoints. {@code error} is the
 * HTTP reason phrase, {@code timestamp} an ISO-8601 instant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiErrorResponse {
    private int status;
    private String error;
    private String message;
    private String timestamp;
}

package com.geomonitor.gatewayservice.dto.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    @Builder.Default
    private boolean success = false;
    private String error;
    @Builder.Default
    private Map<String, Object> details = Map.of();
    private String path;

    /**
     * Body for unexpected failures. Carries no detail about the cause.
     */
    public static ErrorResponse internalError(String supportContact, String path) {
        return ErrorResponse.builder()
                .error("Internal server error")
                .details(Map.of(
                        "message", "An unexpected error occurred",
                        "support", "Contact " + supportContact))
                .path(path)
                .build();
    }
}

package dev.pagecraft.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pagecraft.exception.ErrorKind;
import dev.pagecraft.exception.PageEngineException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result envelope of a named operation: either a payload or a structured error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationResponse {

    private String operation;
    private boolean success;
    private Object result;
    private OperationError error;

    public static OperationResponse success(String operation, Object result) {
        return OperationResponse.builder()
                .operation(operation)
                .success(true)
                .result(result)
                .build();
    }

    public static OperationResponse failure(String operation, PageEngineException ex) {
        return OperationResponse.builder()
                .operation(operation)
                .success(false)
                .error(new OperationError(ex.getKind(), ex.getMessage()))
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OperationError {
        private ErrorKind kind;
        private String message;
    }
}

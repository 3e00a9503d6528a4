package dev.pagecraft.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Acknowledgement of an operation that has no entity payload")
public class MessageResponse {

    @Schema(description = "Response message", example = "Draft published")
    private String message;

    public static MessageResponse of(String message) {
        return new MessageResponse(message);
    }
}

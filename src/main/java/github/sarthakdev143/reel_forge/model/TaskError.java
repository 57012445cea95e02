package github.sarthakdev143.reel_forge.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskError(
        GenerationStage stage,
        String message) {
}

package Codify.grading.web.dto;

import Codify.grading.model.SourceUnit;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SourceUnitDto(
        @NotBlank(message = "name must not be blank")
        String name,
        @NotNull(message = "text must not be null")
        String text
) {
    public SourceUnit toSourceUnit() {
        return new SourceUnit(name, text);
    }
}

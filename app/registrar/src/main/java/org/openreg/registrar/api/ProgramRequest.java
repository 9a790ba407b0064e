package org.openreg.registrar.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;
import org.openreg.registrar.model.ProgramType;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProgramRequest(
    @NotBlank(message = "key is required") String key,
    UUID uuid,
    @NotBlank(message = "title is required") String title,
    @NotNull(message = "program_type is required") ProgramType programType,
    @NotBlank(message = "managing_organization_key is required") String managingOrganizationKey,
    List<String> authoringOrganizationKeys) {}

package org.openreg.registrar.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;
import org.openreg.registrar.model.Program;
import org.openreg.registrar.model.ProgramType;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProgramResponse(
    long programId,
    String key,
    UUID uuid,
    String title,
    ProgramType programType,
    boolean enrollmentEnabled,
    long managingOrganizationId,
    List<Long> authoringOrganizationIds) {

  static ProgramResponse from(Program program) {
    return new ProgramResponse(
        program.id(),
        program.key(),
        program.uuid(),
        program.title(),
        program.programType(),
        program.isEnrollmentEnabled(),
        program.managingOrganizationId(),
        program.authoringOrganizationIds().stream().sorted().toList());
  }
}

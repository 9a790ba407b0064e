package org.openreg.registrar.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;
import org.openreg.registrar.model.Organization;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrganizationResponse(long organizationId, String key, UUID uuid, String name) {

  static OrganizationResponse from(Organization organization) {
    return new OrganizationResponse(
        organization.id(), organization.key(), organization.uuid(), organization.name());
  }
}

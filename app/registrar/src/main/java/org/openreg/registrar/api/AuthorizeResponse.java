package org.openreg.registrar.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import org.openreg.registrar.model.ApiPermission;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuthorizeResponse(boolean granted, List<ApiPermission> permissions) {}

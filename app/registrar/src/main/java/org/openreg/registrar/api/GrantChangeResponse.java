package org.openreg.registrar.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** changed=false は既に付与済み (または付与なし) で何もしなかったことを表す。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GrantChangeResponse(boolean changed) {}

package org.openreg.registrar.api;

import java.util.List;

public record JobsResponse(List<JobResponse> jobs) {}

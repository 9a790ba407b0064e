package org.openreg.registrar.store;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "成果物バイト列はレスポンスへそのまま渡すだけで、複製コストを避けるため")
public record StoredResult(byte[] payload, String contentType) {}

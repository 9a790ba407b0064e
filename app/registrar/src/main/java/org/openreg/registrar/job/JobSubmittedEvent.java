package org.openreg.registrar.job;

import java.util.UUID;

/** ジョブ行の登録後に発行し、コミット後にワーカーへ渡す。 */
public record JobSubmittedEvent(UUID jobId) {}

package org.openreg.registrar.job;

import java.nio.file.Path;

/** ハンドラが生成した成果物。file は実行器がアップロード後に削除する。 */
public record JobArtifact(Path file, String contentType, String summary) {}

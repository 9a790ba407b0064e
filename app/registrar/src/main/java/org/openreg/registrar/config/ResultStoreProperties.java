/*
 * どこで: Registrar 設定
 * 何を: 成果物保存先の種別と接続情報を保持する
 * なぜ: ローカル保存と S3 保存をデプロイ時に切り替えるため
 */
package org.openreg.registrar.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "registrar.result-store")
public record ResultStoreProperties(String type, Filesystem filesystem, S3 s3) {

  public ResultStoreProperties {
    type = type == null || type.isBlank() ? "filesystem" : type.trim().toLowerCase();
    if (!"filesystem".equals(type) && !"s3".equals(type)) {
      throw new IllegalArgumentException("unsupported registrar.result-store.type: " + type);
    }
    filesystem = filesystem == null ? new Filesystem(null) : filesystem;
    s3 = s3 == null ? new S3(null, null, null, null) : s3;
  }

  public record Filesystem(String root) {
    public Filesystem {
      root = root == null || root.isBlank() ? "./var/job-results" : root;
    }
  }

  public record S3(String bucket, String prefix, String region, String endpoint) {
    public S3 {
      prefix = prefix == null ? "" : prefix;
      region = region == null || region.isBlank() ? "us-east-1" : region;
    }
  }
}

/*
 * どこで: Registrar API
 * 何を: ジョブ未検出 (参照権限なしを含む) を表現する
 * なぜ: 他テナントのジョブ存在を漏らさず 404 に揃えるため
 */
package org.openreg.registrar.api;

public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String jobId) {
    super("job not found: " + jobId);
  }
}

/*
 * どこで: Registrar ジョブ実行
 * 何を: 操作種別→ハンドラの対応表を保持する
 * なぜ: 全操作にハンドラがあることを起動時に保証するため
 */
package org.openreg.registrar.job;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.openreg.registrar.model.JobOperation;
import org.springframework.stereotype.Component;

@Component
public class JobHandlers {

  private final Map<JobOperation, JobHandler> handlers = new EnumMap<>(JobOperation.class);

  public JobHandlers(List<JobHandler> handlers) {
    for (JobHandler handler : handlers) {
      if (this.handlers.putIfAbsent(handler.operation(), handler) != null) {
        throw new IllegalStateException("duplicate job handler: " + handler.operation());
      }
    }
    for (JobOperation operation : JobOperation.values()) {
      if (!this.handlers.containsKey(operation)) {
        throw new IllegalStateException("no job handler for operation " + operation);
      }
    }
  }

  public JobHandler require(JobOperation operation) {
    return handlers.get(operation);
  }
}

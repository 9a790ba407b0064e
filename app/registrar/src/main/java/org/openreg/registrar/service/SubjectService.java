/*
 * どこで: Registrar サービス層
 * 何を: 認証済み subject を初回アクセス時に記録する
 * なぜ: 認証基盤の識別子を付与やジョブ所有者として参照できるようにするため
 */
package org.openreg.registrar.service;

import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.openreg.registrar.model.Subject;
import org.openreg.registrar.repository.SubjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SubjectService {

  private static final Logger logger = LoggerFactory.getLogger(SubjectService.class);

  private final SubjectRepository subjectRepository;
  private final Clock clock;

  public Subject resolve(Subject subject) {
    final boolean created =
        subjectRepository.upsert(
            subject.subjectId(), subject.username(), subject.email(), Instant.now(clock));
    if (created) {
      logger.info("subject registered subjectId={}", subject.subjectId());
    }
    return subject;
  }
}

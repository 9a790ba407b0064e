/*
 * どこで: Registrar データアクセス
 * 何を: 組織/プログラム/著作関係の参照と管理用書き込みを抽象化する
 * なぜ: 認可解決を永続化方式から切り離してテスト可能にするため
 */
package org.openreg.registrar.repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.openreg.registrar.model.Organization;
import org.openreg.registrar.model.Program;
import org.openreg.registrar.model.ProgramType;

public interface EntityGraphRepository {

  Optional<Organization> findOrganizationById(long organizationId);

  Optional<Organization> findOrganizationByKey(String organizationKey);

  List<Organization> findOrganizationsByIds(Collection<Long> organizationIds);

  Optional<Program> findProgramById(long programId);

  Optional<Program> findProgramByKey(String programKey);

  List<Program> findProgramsByIds(Collection<Long> programIds);

  /**
   * 役割: 指定組織のいずれかが著作するプログラムを返す。
   * 動作: 著作関係テーブルを組織 ID で逆引きする。管理組織も著作組織に含まれる。
   */
  List<Program> findProgramsAuthoredBy(Collection<Long> organizationIds);

  Organization insertOrganization(String key, UUID uuid, String name, Instant createdAt);

  /** 管理組織を著作組織として同時に登録する。 */
  Program insertProgram(
      String key,
      UUID uuid,
      String title,
      ProgramType programType,
      long managingOrganizationId,
      Instant createdAt);

  /** 既に著作組織であれば false。 */
  boolean addAuthoringOrganization(long programId, long organizationId);
}

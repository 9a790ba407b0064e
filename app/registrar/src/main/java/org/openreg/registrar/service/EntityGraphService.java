/*
 * どこで: Registrar サービス層
 * 何を: 組織/プログラム/著作関係の管理用書き込みを行う
 * なぜ: 管理ツールからのグラフ更新を参照系と同じ整合性ルールで扱うため
 */
package org.openreg.registrar.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.openreg.registrar.api.ScopeNotFoundException;
import org.openreg.registrar.model.Organization;
import org.openreg.registrar.model.Program;
import org.openreg.registrar.model.ProgramType;
import org.openreg.registrar.repository.EntityGraphRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class EntityGraphService {

  private static final Logger logger = LoggerFactory.getLogger(EntityGraphService.class);

  private final EntityGraphRepository entityGraphRepository;
  private final Clock clock;

  public Organization registerOrganization(String key, UUID uuid, String name) {
    requireText(key, "key");
    requireText(name, "name");
    if (entityGraphRepository.findOrganizationByKey(key).isPresent()) {
      throw new IllegalArgumentException("organization key already exists: " + key);
    }
    final Organization organization;
    try {
      organization =
          entityGraphRepository.insertOrganization(
              key, uuid == null ? UUID.randomUUID() : uuid, name, Instant.now(clock));
    } catch (DuplicateKeyException ex) {
      // 同時登録で事前チェックをすり抜けた側
      throw new IllegalArgumentException("organization key or uuid already exists: " + key, ex);
    }
    logger.info("organization registered organizationId={} key={}", organization.id(), key);
    return organization;
  }

  @Transactional
  public Program registerProgram(
      String key,
      UUID uuid,
      String title,
      ProgramType programType,
      String managingOrganizationKey,
      Collection<String> additionalAuthorKeys) {
    requireText(key, "key");
    requireText(title, "title");
    if (programType == null) {
      throw new IllegalArgumentException("program_type is required");
    }
    if (entityGraphRepository.findProgramByKey(key).isPresent()) {
      throw new IllegalArgumentException("program key already exists: " + key);
    }
    final Organization managing = requireOrganization(managingOrganizationKey);
    final Program program;
    try {
      program =
          entityGraphRepository.insertProgram(
              key,
              uuid == null ? UUID.randomUUID() : uuid,
              title,
              programType,
              managing.id(),
              Instant.now(clock));
    } catch (DuplicateKeyException ex) {
      throw new IllegalArgumentException("program key or uuid already exists: " + key, ex);
    }
    if (additionalAuthorKeys != null) {
      for (String authorKey : additionalAuthorKeys) {
        entityGraphRepository.addAuthoringOrganization(
            program.id(), requireOrganization(authorKey).id());
      }
    }
    logger.info(
        "program registered programId={} key={} managingOrganization={}",
        program.id(),
        key,
        managing.key());
    return entityGraphRepository.findProgramById(program.id()).orElse(program);
  }

  public Program addAuthoringOrganization(String programKey, String organizationKey) {
    final Program program =
        entityGraphRepository
            .findProgramByKey(programKey)
            .orElseThrow(() -> new ScopeNotFoundException("program not found: " + programKey));
    final Organization organization = requireOrganization(organizationKey);
    final boolean added =
        entityGraphRepository.addAuthoringOrganization(program.id(), organization.id());
    logger.info(
        "authoring organization linked programKey={} organizationKey={} added={}",
        programKey,
        organizationKey,
        added);
    return entityGraphRepository.findProgramById(program.id()).orElse(program);
  }

  private Organization requireOrganization(String key) {
    requireText(key, "organization key");
    return entityGraphRepository
        .findOrganizationByKey(key)
        .orElseThrow(() -> new ScopeNotFoundException("organization not found: " + key));
  }

  private void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}

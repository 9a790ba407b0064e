/*
 * どこで: Registrar 管理 API
 * 何を: 権限付与/剥奪と組織・プログラム登録のエンドポイントを提供する
 * なぜ: 運用者だけがエンティティグラフと付与を変更できるようにするため
 */
package org.openreg.registrar.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.openreg.registrar.model.ScopeRef;
import org.openreg.registrar.model.Subject;
import org.openreg.registrar.service.AccessGrantService;
import org.openreg.registrar.service.EntityGraphService;
import org.openreg.registrar.service.SubjectService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
@Validated
public class AdminController {

  private final AccessGrantService accessGrantService;
  private final EntityGraphService entityGraphService;
  private final SubjectService subjectService;

  @PostMapping("/grants")
  public GrantChangeResponse grant(
      @RequestHeader(CallerHeaders.SUBJECT_ID)
          @NotBlank(message = "X-Subject-Id is required")
          String callerId,
      @RequestHeader(value = CallerHeaders.ADMIN, required = false) String admin,
      @Valid @RequestBody GrantRequest request) {
    requireAdministrator(callerId, admin);
    return new GrantChangeResponse(
        accessGrantService.grant(
            request.subjectId(),
            request.role(),
            new ScopeRef(request.scopeKind(), request.scopeId())));
  }

  @PostMapping("/grants/revoke")
  public GrantChangeResponse revoke(
      @RequestHeader(CallerHeaders.SUBJECT_ID)
          @NotBlank(message = "X-Subject-Id is required")
          String callerId,
      @RequestHeader(value = CallerHeaders.ADMIN, required = false) String admin,
      @Valid @RequestBody GrantRequest request) {
    requireAdministrator(callerId, admin);
    return new GrantChangeResponse(
        accessGrantService.revoke(
            request.subjectId(),
            request.role(),
            new ScopeRef(request.scopeKind(), request.scopeId())));
  }

  @GetMapping("/subjects/{subject_id}/grants")
  public GrantsResponse listGrants(
      @RequestHeader(CallerHeaders.SUBJECT_ID)
          @NotBlank(message = "X-Subject-Id is required")
          String callerId,
      @RequestHeader(value = CallerHeaders.ADMIN, required = false) String admin,
      @PathVariable("subject_id") @NotBlank(message = "subject_id is required") String subjectId) {
    requireAdministrator(callerId, admin);
    return new GrantsResponse(
        subjectId,
        accessGrantService.listBySubject(subjectId).stream().map(GrantResponse::from).toList());
  }

  @PostMapping("/organizations")
  public ResponseEntity<OrganizationResponse> registerOrganization(
      @RequestHeader(CallerHeaders.SUBJECT_ID)
          @NotBlank(message = "X-Subject-Id is required")
          String callerId,
      @RequestHeader(value = CallerHeaders.ADMIN, required = false) String admin,
      @Valid @RequestBody OrganizationRequest request) {
    requireAdministrator(callerId, admin);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            OrganizationResponse.from(
                entityGraphService.registerOrganization(
                    request.key(), request.uuid(), request.name())));
  }

  @PostMapping("/programs")
  public ResponseEntity<ProgramResponse> registerProgram(
      @RequestHeader(CallerHeaders.SUBJECT_ID)
          @NotBlank(message = "X-Subject-Id is required")
          String callerId,
      @RequestHeader(value = CallerHeaders.ADMIN, required = false) String admin,
      @Valid @RequestBody ProgramRequest request) {
    requireAdministrator(callerId, admin);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            ProgramResponse.from(
                entityGraphService.registerProgram(
                    request.key(),
                    request.uuid(),
                    request.title(),
                    request.programType(),
                    request.managingOrganizationKey(),
                    request.authoringOrganizationKeys())));
  }

  @PutMapping("/programs/{program_key}/authors/{organization_key}")
  public ProgramResponse addAuthoringOrganization(
      @RequestHeader(CallerHeaders.SUBJECT_ID)
          @NotBlank(message = "X-Subject-Id is required")
          String callerId,
      @RequestHeader(value = CallerHeaders.ADMIN, required = false) String admin,
      @PathVariable("program_key") String programKey,
      @PathVariable("organization_key") String organizationKey) {
    requireAdministrator(callerId, admin);
    return ProgramResponse.from(
        entityGraphService.addAuthoringOrganization(programKey, organizationKey));
  }

  private void requireAdministrator(String callerId, String admin) {
    final Subject caller =
        subjectService.resolve(CallerHeaders.toSubject(callerId, null, null, admin));
    if (!caller.administrator()) {
      throw new UnauthorizedActionException("administrator privileges are required");
    }
  }
}

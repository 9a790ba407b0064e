/*
 * どこで: Registrar API
 * 何を: 認可判定と認可済みスコープ一覧のエンドポイントを提供する
 * なぜ: 上流サービスがリソースごとの可否を一箇所に問い合わせられるようにするため
 */
package org.openreg.registrar.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.openreg.registrar.model.ApiPermission;
import org.openreg.registrar.model.AuthorizationDecision;
import org.openreg.registrar.model.ScopeKind;
import org.openreg.registrar.model.ScopeRef;
import org.openreg.registrar.model.Subject;
import org.openreg.registrar.service.PermissionResolver;
import org.openreg.registrar.service.SubjectService;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class AuthorizationController {

  private final PermissionResolver permissionResolver;
  private final SubjectService subjectService;

  @PostMapping("/authorize")
  public AuthorizeResponse authorize(
      @RequestHeader(CallerHeaders.SUBJECT_ID)
          @NotBlank(message = "X-Subject-Id is required")
          String subjectId,
      @RequestHeader(value = CallerHeaders.USERNAME, required = false) String username,
      @RequestHeader(value = CallerHeaders.EMAIL, required = false) String email,
      @RequestHeader(value = CallerHeaders.ADMIN, required = false) String admin,
      @Valid @RequestBody AuthorizeRequest request) {
    final Subject subject =
        subjectService.resolve(CallerHeaders.toSubject(subjectId, username, email, admin));
    final AuthorizationDecision decision =
        permissionResolver.resolve(
            subject.subjectId(),
            new ScopeRef(request.scopeKind(), request.scopeId()),
            request.action());
    final List<ApiPermission> permissions =
        decision.apiPermissions().stream().sorted(Comparator.naturalOrder()).toList();
    return new AuthorizeResponse(decision.granted(), permissions);
  }

  @GetMapping("/authorized-scopes")
  public AuthorizedScopesResponse authorizedScopes(
      @RequestHeader(CallerHeaders.SUBJECT_ID)
          @NotBlank(message = "X-Subject-Id is required")
          String subjectId,
      @RequestHeader(value = CallerHeaders.USERNAME, required = false) String username,
      @RequestHeader(value = CallerHeaders.EMAIL, required = false) String email,
      @RequestHeader(value = CallerHeaders.ADMIN, required = false) String admin,
      @RequestParam("action") String action,
      @RequestParam(value = "scope_kind", defaultValue = "program") String scopeKind) {
    final Subject subject =
        subjectService.resolve(CallerHeaders.toSubject(subjectId, username, email, admin));
    final ApiPermission permission = ApiPermission.fromValue(action);
    final ScopeKind kind = ScopeKind.fromValue(scopeKind);
    final List<Long> ids =
        permissionResolver.listAuthorizedScopes(subject.subjectId(), permission, kind).stream()
            .map(ScopeRef::id)
            .sorted()
            .toList();
    return new AuthorizedScopesResponse(permission, kind, ids);
  }
}

/*
 * どこで: AuthorizationController の Web 層テスト
 * 何を: 呼び出し元ヘッダの解釈、判定結果の応答形式、エラー変換を検証する
 */
package org.openreg.registrar.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openreg.registrar.model.ApiPermission;
import org.openreg.registrar.model.AuthorizationDecision;
import org.openreg.registrar.model.ScopeKind;
import org.openreg.registrar.model.ScopeRef;
import org.openreg.registrar.model.Subject;
import org.openreg.registrar.service.PermissionResolver;
import org.openreg.registrar.service.SubjectService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AuthorizationController.class)
@Import(ApiExceptionHandler.class)
class AuthorizationControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private PermissionResolver permissionResolver;

  @MockitoBean private SubjectService subjectService;

  @BeforeEach
  void resolveSubjectAsGiven() {
    given(subjectService.resolve(any(Subject.class))).willAnswer(inv -> inv.getArgument(0));
  }

  @Test
  void authorizeReturnsDecisionWithSortedPermissions() throws Exception {
    given(
            permissionResolver.resolve(
                "alice", ScopeRef.program(7), ApiPermission.WRITE_ENROLLMENTS))
        .willReturn(
            new AuthorizationDecision(
                true, Set.of(ApiPermission.WRITE_ENROLLMENTS, ApiPermission.READ_METADATA)));

    mockMvc
        .perform(
            post("/v1/authorize")
                .header("X-Subject-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"action":"write_enrollments","scope_kind":"program","scope_id":7}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.granted").value(true))
        .andExpect(jsonPath("$.permissions[0]").value("read_metadata"))
        .andExpect(jsonPath("$.permissions[1]").value("write_enrollments"));
  }

  @Test
  void authorizeRequiresSubjectHeader() throws Exception {
    mockMvc
        .perform(
            post("/v1/authorize")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"read_metadata\",\"scope_kind\":\"program\",\"scope_id\":7}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("X-Subject-Id is required"));

    verifyNoInteractions(permissionResolver);
  }

  @Test
  void authorizeRejectsUnknownAction() throws Exception {
    mockMvc
        .perform(
            post("/v1/authorize")
                .header("X-Subject-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"delete_everything\",\"scope_kind\":\"program\",\"scope_id\":7}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void authorizeRejectsMissingScope() throws Exception {
    mockMvc
        .perform(
            post("/v1/authorize")
                .header("X-Subject-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"read_metadata\",\"scope_kind\":\"program\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("scope_id is required"));
  }

  @Test
  void authorizeMapsUnknownScopeToNotFound() throws Exception {
    given(permissionResolver.resolve(eq("alice"), any(ScopeRef.class), any(ApiPermission.class)))
        .willThrow(new ScopeNotFoundException("program 404 not found"));

    mockMvc
        .perform(
            post("/v1/authorize")
                .header("X-Subject-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"read_metadata\",\"scope_kind\":\"program\",\"scope_id\":404}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void authorizeMapsCorruptStoredGrantToInternalError() throws Exception {
    given(permissionResolver.resolve(eq("alice"), any(ScopeRef.class), any(ApiPermission.class)))
        .willThrow(InvalidRoleException.storedGrant("ghost_role", "alice"));

    mockMvc
        .perform(
            post("/v1/authorize")
                .header("X-Subject-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"read_metadata\",\"scope_kind\":\"program\",\"scope_id\":7}"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"));
  }

  @Test
  void authorizedScopesListsSortedIds() throws Exception {
    given(
            permissionResolver.listAuthorizedScopes(
                "alice", ApiPermission.READ_ENROLLMENTS, ScopeKind.PROGRAM))
        .willReturn(Set.of(ScopeRef.program(9), ScopeRef.program(3)));

    mockMvc
        .perform(
            get("/v1/authorized-scopes")
                .header("X-Subject-Id", "alice")
                .param("action", "read_enrollments"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.action").value("read_enrollments"))
        .andExpect(jsonPath("$.scope_kind").value("program"))
        .andExpect(jsonPath("$.scope_ids[0]").value(3))
        .andExpect(jsonPath("$.scope_ids[1]").value(9));
  }

  @Test
  void authorizedScopesRequiresAction() throws Exception {
    mockMvc
        .perform(get("/v1/authorized-scopes").header("X-Subject-Id", "alice"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("action is required"));
  }
}

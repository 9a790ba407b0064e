/*
 * どこで: Registrar API
 * 何を: ジョブの投入・参照・中止・成果物取得のエンドポイントを提供する
 * なぜ: 長時間処理を要求から切り離し、クライアントにはポーリングで結果を渡すため
 */
package org.openreg.registrar.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.openreg.registrar.model.JobRecord;
import org.openreg.registrar.model.ScopeRef;
import org.openreg.registrar.model.Subject;
import org.openreg.registrar.service.JobRegistry;
import org.openreg.registrar.service.SubjectService;
import org.openreg.registrar.store.StoredResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/jobs")
@RequiredArgsConstructor
@Validated
public class JobController {

  private final JobRegistry jobRegistry;
  private final SubjectService subjectService;
  private final ObjectMapper objectMapper;

  @PostMapping
  public ResponseEntity<JobResponse> submit(
      @RequestHeader(CallerHeaders.SUBJECT_ID)
          @NotBlank(message = "X-Subject-Id is required")
          String subjectId,
      @RequestHeader(value = CallerHeaders.USERNAME, required = false) String username,
      @RequestHeader(value = CallerHeaders.EMAIL, required = false) String email,
      @RequestHeader(value = CallerHeaders.ADMIN, required = false) String admin,
      @Valid @RequestBody SubmitJobRequest request)
      throws JsonProcessingException {
    final Subject subject =
        subjectService.resolve(CallerHeaders.toSubject(subjectId, username, email, admin));
    final String inputJson =
        request.input() == null || request.input().isNull()
            ? "{}"
            : objectMapper.writeValueAsString(request.input());
    final JobRecord job =
        jobRegistry.create(
            subject,
            request.operation(),
            new ScopeRef(request.targetKind(), request.targetId()),
            inputJson);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(JobResponse.from(jobRegistry.get(subject, job.jobId())));
  }

  @GetMapping
  public JobsResponse listOwned(
      @RequestHeader(CallerHeaders.SUBJECT_ID)
          @NotBlank(message = "X-Subject-Id is required")
          String subjectId,
      @RequestHeader(value = CallerHeaders.USERNAME, required = false) String username,
      @RequestHeader(value = CallerHeaders.EMAIL, required = false) String email,
      @RequestHeader(value = CallerHeaders.ADMIN, required = false) String admin,
      @RequestParam(value = "limit", defaultValue = "20")
          @Min(value = 1, message = "limit must be between 1 and 100")
          @Max(value = 100, message = "limit must be between 1 and 100")
          int limit) {
    final Subject subject =
        subjectService.resolve(CallerHeaders.toSubject(subjectId, username, email, admin));
    return new JobsResponse(
        jobRegistry.listOwned(subject, limit).stream().map(JobResponse::from).toList());
  }

  @GetMapping("/{job_id}")
  public JobResponse get(
      @RequestHeader(CallerHeaders.SUBJECT_ID)
          @NotBlank(message = "X-Subject-Id is required")
          String subjectId,
      @RequestHeader(value = CallerHeaders.USERNAME, required = false) String username,
      @RequestHeader(value = CallerHeaders.EMAIL, required = false) String email,
      @RequestHeader(value = CallerHeaders.ADMIN, required = false) String admin,
      @PathVariable("job_id") String jobId) {
    final Subject subject =
        subjectService.resolve(CallerHeaders.toSubject(subjectId, username, email, admin));
    return JobResponse.from(jobRegistry.get(subject, parseJobId(jobId)));
  }

  @PostMapping("/{job_id}/cancel")
  public ResponseEntity<JobResponse> cancel(
      @RequestHeader(CallerHeaders.SUBJECT_ID)
          @NotBlank(message = "X-Subject-Id is required")
          String subjectId,
      @RequestHeader(value = CallerHeaders.USERNAME, required = false) String username,
      @RequestHeader(value = CallerHeaders.EMAIL, required = false) String email,
      @RequestHeader(value = CallerHeaders.ADMIN, required = false) String admin,
      @PathVariable("job_id") String jobId) {
    final Subject subject =
        subjectService.resolve(CallerHeaders.toSubject(subjectId, username, email, admin));
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(JobResponse.from(jobRegistry.cancel(subject, parseJobId(jobId))));
  }

  @GetMapping("/{job_id}/result")
  public ResponseEntity<byte[]> result(
      @RequestHeader(CallerHeaders.SUBJECT_ID)
          @NotBlank(message = "X-Subject-Id is required")
          String subjectId,
      @RequestHeader(value = CallerHeaders.USERNAME, required = false) String username,
      @RequestHeader(value = CallerHeaders.EMAIL, required = false) String email,
      @RequestHeader(value = CallerHeaders.ADMIN, required = false) String admin,
      @PathVariable("job_id") String jobId) {
    final Subject subject =
        subjectService.resolve(CallerHeaders.toSubject(subjectId, username, email, admin));
    final StoredResult result = jobRegistry.fetchResult(subject, parseJobId(jobId));
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(result.contentType()))
        .body(result.payload());
  }

  // 形式不正な ID は存在しないジョブと同じ扱いにする
  private UUID parseJobId(String jobId) {
    try {
      return UUID.fromString(jobId);
    } catch (IllegalArgumentException ex) {
      throw new JobNotFoundException(jobId);
    }
  }
}

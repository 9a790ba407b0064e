/*
 * どこで: Registrar 下流連携
 * 何を: LMS の program enrollments API を呼び出すクライアント
 * なぜ: ジョブ実行器がページ取得とバッチ書き込みを行うため
 */
package org.openreg.registrar.lms;

import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.openreg.registrar.config.LmsClientProperties;
import org.openreg.registrar.model.EnrollmentItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class LmsEnrollmentClient implements EnrollmentDataProvider {

  private static final Logger logger = LoggerFactory.getLogger(LmsEnrollmentClient.class);
  private static final Set<Integer> ITEMIZED_STATUSES = Set.of(200, 201, 207, 422);

  private final RestClient lmsRestClient;
  private final LmsClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public LmsEnrollmentClient(RestClient lmsRestClient, LmsClientProperties properties) {
    this.lmsRestClient = lmsRestClient;
    this.properties = properties;
  }

  @Override
  public EnrollmentPage fetchProgramEnrollments(UUID programUuid, String cursor) {
    try {
      final JsonNode body =
          cursor == null
              ? lmsRestClient
                  .get()
                  .uri(properties.programEnrollmentsPath(), programUuid)
                  .retrieve()
                  .body(JsonNode.class)
              : lmsRestClient.get().uri(requireSameOrigin(cursor)).retrieve().body(JsonNode.class);
      return toPage(body);
    } catch (RestClientResponseException ex) {
      throw mapResponseException("fetchProgramEnrollments", ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException("fetchProgramEnrollments", ex);
    } catch (DownstreamFailureException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("lms enrollment page parse failed programUuid={}", programUuid, ex);
      throw new DownstreamFailureException(
          DownstreamFailureException.Reason.INVALID_RESPONSE, "lms response parse failed", ex);
    }
  }

  @Override
  public EnrollmentWriteResponse writeProgramEnrollments(
      UUID programUuid, EnrollmentWriteMode mode, List<EnrollmentItem> items) {
    try {
      return lmsRestClient
          .method(mode.httpMethod())
          .uri(properties.programEnrollmentsPath(), programUuid)
          .contentType(MediaType.APPLICATION_JSON)
          .body(items)
          .exchange(
              (request, response) -> {
                final int status = response.getStatusCode().value();
                if (!ITEMIZED_STATUSES.contains(status)) {
                  throw mapStatus("writeProgramEnrollments", status, null);
                }
                final JsonNode body = response.bodyTo(JsonNode.class);
                logger.info(
                    "lms write responded method={} programUuid={} status={} items={}",
                    mode.httpMethod(),
                    programUuid,
                    status,
                    items.size());
                return new EnrollmentWriteResponse(status, toStatuses(body));
              });
    } catch (ResourceAccessException ex) {
      throw mapResourceException("writeProgramEnrollments", ex);
    } catch (DownstreamFailureException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("lms write response parse failed programUuid={}", programUuid, ex);
      throw new DownstreamFailureException(
          DownstreamFailureException.Reason.INVALID_RESPONSE, "lms response parse failed", ex);
    }
  }

  private EnrollmentPage toPage(JsonNode body) {
    if (body == null || !body.path("results").isArray()) {
      throw new DownstreamFailureException(
          DownstreamFailureException.Reason.INVALID_RESPONSE, "lms enrollment page is invalid");
    }
    final List<JsonNode> results = new ArrayList<>();
    body.path("results").forEach(results::add);
    final JsonNode next = body.path("next");
    return new EnrollmentPage(results, next.isTextual() ? next.asText() : null);
  }

  private Map<String, String> toStatuses(JsonNode body) {
    if (body == null || !body.isObject()) {
      throw new DownstreamFailureException(
          DownstreamFailureException.Reason.INVALID_RESPONSE, "lms write response is invalid");
    }
    final Map<String, String> statuses = new LinkedHashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      statuses.put(field.getKey(), field.getValue().asText());
    }
    return statuses;
  }

  private URI requireSameOrigin(String cursor) {
    // next は下流が返す絶対 URL。別ホストへは辿らない
    final URI next = URI.create(cursor);
    final URI base = URI.create(properties.baseUrl());
    if (!next.isAbsolute()) {
      return base.resolve(next);
    }
    if (!sameOrigin(next, base)) {
      throw new DownstreamFailureException(
          DownstreamFailureException.Reason.INVALID_RESPONSE,
          "lms pagination cursor points to a foreign host: " + next.getHost());
    }
    return next;
  }

  private static boolean sameOrigin(URI next, URI base) {
    return next.getHost() != null
        && next.getScheme().equalsIgnoreCase(base.getScheme())
        && next.getHost().equalsIgnoreCase(base.getHost())
        && effectivePort(next) == effectivePort(base);
  }

  // 省略されたポートはスキームの既定値とみなす
  private static int effectivePort(URI uri) {
    if (uri.getPort() != -1) {
      return uri.getPort();
    }
    return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
  }

  private DownstreamFailureException mapResponseException(
      String operation, RestClientResponseException ex) {
    return mapStatus(operation, ex.getStatusCode().value(), ex);
  }

  private DownstreamFailureException mapStatus(String operation, int status, Throwable cause) {
    logger.warn("lms {} failed with http status={}", operation, status);
    if (status == 401 || status == 403) {
      return new DownstreamFailureException(
          DownstreamFailureException.Reason.UNAUTHORIZED,
          "lms rejected credentials status=" + status,
          cause);
    }
    if (status >= 500) {
      return new DownstreamFailureException(
          DownstreamFailureException.Reason.SERVER_ERROR, "lms server error status=" + status, cause);
    }
    return new DownstreamFailureException(
        DownstreamFailureException.Reason.CLIENT_ERROR, "lms request failed status=" + status, cause);
  }

  private DownstreamFailureException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("lms {} timed out", operation);
      return new DownstreamFailureException(
          DownstreamFailureException.Reason.TIMEOUT, "lms request timeout", ex);
    }
    logger.warn("lms {} connection failed", operation, ex);
    return new DownstreamFailureException(
        DownstreamFailureException.Reason.UNAVAILABLE, "lms connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}

package io.b2mash.orgguard.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.orgguard.api.MembershipSummary;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Reads the current subject's membership summary from {@code GET /api/me/membership}. The active
 * organization is resolved server-side, so the request carries no organization id.
 *
 * <p>Authentication is the caller's concern: configure the {@link RestClient.Builder} with whatever
 * default headers or request interceptors the deployment needs before passing it in.
 */
public class MembershipClient {

  private static final Logger log = LoggerFactory.getLogger(MembershipClient.class);

  static final String MEMBERSHIP_PATH = "/api/me/membership";
  static final String DEFAULT_ERROR_MESSAGE = "Failed to fetch membership";

  private final RestClient restClient;
  private final ObjectMapper objectMapper;

  public MembershipClient(RestClient.Builder builder, MirrorSettings settings) {
    this.restClient = builder.baseUrl(settings.baseUrl()).build();
    this.objectMapper = new ObjectMapper();
  }

  /**
   * Performs one fetch. No retry and no timeout; both belong to the configured HTTP client.
   *
   * @throws MembershipFetchException on a non-2xx response, an empty body, or an I/O failure
   */
  public MembershipSummary fetchMembership() {
    MembershipSummary summary;
    try {
      summary =
          restClient
              .get()
              .uri(MEMBERSHIP_PATH)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .onStatus(
                  HttpStatusCode::isError,
                  (request, response) -> {
                    throw new MembershipFetchException(
                        response.getStatusCode().value(), readMessage(response));
                  })
              .body(MembershipSummary.class);
    } catch (MembershipFetchException e) {
      throw e;
    } catch (RestClientException e) {
      throw new MembershipFetchException(DEFAULT_ERROR_MESSAGE, e);
    }
    if (summary == null) {
      throw new MembershipFetchException(DEFAULT_ERROR_MESSAGE, null);
    }
    return summary;
  }

  private String readMessage(ClientHttpResponse response) {
    try {
      byte[] body = response.getBody().readAllBytes();
      if (body.length == 0) {
        return DEFAULT_ERROR_MESSAGE;
      }
      JsonNode message = objectMapper.readTree(body).path("message");
      return message.isTextual() && !message.asText().isBlank()
          ? message.asText()
          : DEFAULT_ERROR_MESSAGE;
    } catch (IOException e) {
      log.debug("Unreadable membership error body: {}", e.getMessage());
      return DEFAULT_ERROR_MESSAGE;
    }
  }
}

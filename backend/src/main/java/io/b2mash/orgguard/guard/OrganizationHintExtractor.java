package io.b2mash.orgguard.guard;

import io.b2mash.orgguard.config.GuardProperties;
import io.b2mash.orgguard.context.OrganizationHints;
import io.b2mash.orgguard.security.AuthenticatedSession;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerMapping;

/** Collects the three organization hints for a request. */
@Component
public class OrganizationHintExtractor {

  private final GuardProperties properties;

  public OrganizationHintExtractor(GuardProperties properties) {
    this.properties = properties;
  }

  public OrganizationHints extract(HttpServletRequest request, AuthenticatedSession session) {
    return new OrganizationHints(
        session.activeOrganizationId(),
        request.getParameter(properties.queryParameter()),
        pathVariable(request, properties.pathVariable()));
  }

  private static String pathVariable(HttpServletRequest request, String name) {
    Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    if (variables instanceof Map<?, ?> map && map.get(name) instanceof String value) {
      return value;
    }
    return null;
  }
}

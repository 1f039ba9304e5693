package aegis.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input to a single authorization check.
 *
 * <p>The subject and roles are produced by token validation; host and path have
 * already passed tenant validation.
 *
 * @param subjectId resolved subject identifier (string or integer), may be null
 * @param roles     role identifiers in any scalar form, may be null
 * @param host      request host
 * @param path      request path
 * @param method    HTTP method
 */
public record AuthorizationRequest(Object subjectId, List<?> roles, String host, String path, String method) {

    public AuthorizationRequest {
        roles = roles == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(roles));
    }
}

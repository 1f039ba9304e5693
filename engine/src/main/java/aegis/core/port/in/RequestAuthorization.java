package aegis.core.port.in;

import java.util.List;

import aegis.core.model.AuthorizationDecision;
import aegis.core.model.AuthorizationRequest;

/**
 * Use case: decide whether an authenticated caller may perform a request.
 */
public interface RequestAuthorization {

    /**
     * Authorize a request.
     *
     * <p>Never throws for cache or snapshot problems; those produce a denial or a
     * slower evaluation path instead.
     *
     * @param request the request, with identity and roles already resolved
     * @return allow or deny with a non-sensitive reason
     */
    AuthorizationDecision authorize(AuthorizationRequest request);

    /**
     * Convenience form of {@link #authorize(AuthorizationRequest)}.
     */
    default AuthorizationDecision authorize(Object subjectId, List<?> roles, String host, String path, String method) {
        return authorize(new AuthorizationRequest(subjectId, roles, host, path, method));
    }
}

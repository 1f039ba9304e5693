package aegis.config;

import java.time.Clock;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.quarkus.arc.DefaultBean;

import aegis.core.config.RbacConfig;
import aegis.core.model.common.ConfigurationException;
import aegis.core.port.out.AuthorizationMetrics;
import aegis.core.service.AuthorizationEngine;
import aegis.core.service.CacheTopology;
import aegis.core.service.PermissionMatcher;
import aegis.core.service.ResourcePathResolver;
import aegis.core.service.RoleClaimExtractor;

/**
 * Produces the authorization engine and its request-side collaborators from
 * {@link RbacConfig}.
 */
@ApplicationScoped
public class AuthorizationEngineProducer {

    private final RbacConfig config;

    @Inject
    public AuthorizationEngineProducer(RbacConfig config) {
        this.config = config;
    }

    @Produces
    @Singleton
    @DefaultBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public ResourcePathResolver resourcePathResolver() {
        try {
            return new ResourcePathResolver(Pattern.compile(config.pathnameSlugPattern()));
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid aegis.rbac.pathname-slug-pattern: " + e.getDescription(), e);
        }
    }

    @Produces
    @Singleton
    public RoleClaimExtractor roleClaimExtractor() {
        return new RoleClaimExtractor(config.roleClaim());
    }

    @Produces
    @Singleton
    public AuthorizationEngine authorizationEngine(
            CacheTopology topology, ResourcePathResolver pathResolver, Clock clock, AuthorizationMetrics metrics) {
        return AuthorizationEngine.builder(topology)
                .permissionTtl(config.permissionTtl())
                .decisionBlobExpiry(config.decisionBlobExpiry())
                .matcher(new PermissionMatcher(config.regexCacheMaxEntries()))
                .pathResolver(pathResolver)
                .clock(clock)
                .metrics(metrics)
                .build();
    }
}

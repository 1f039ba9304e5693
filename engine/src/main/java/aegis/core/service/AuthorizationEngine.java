package aegis.core.service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import org.jboss.logging.Logger;

import aegis.core.model.AuthorizationDecision;
import aegis.core.model.AuthorizationDecision.Source;
import aegis.core.model.AuthorizationRequest;
import aegis.core.model.PermissionKey;
import aegis.core.model.common.CacheException;
import aegis.core.model.common.ConfigurationException;
import aegis.core.model.snapshot.LegacyGrant;
import aegis.core.port.in.RequestAuthorization;
import aegis.core.port.out.AuthorizationMetrics;
import aegis.core.port.out.CacheStore;
import aegis.core.util.KeyFingerprint;
import aegis.core.util.RoleIdentifiers;

/**
 * Inline RBAC authorization against a shared permission snapshot.
 *
 * <p>Per request:
 * <ol>
 *   <li>Reject a missing subject or an empty role list.</li>
 *   <li>When the topology allows writes, consult the decision cache; a hit allows
 *       without reading the rules.</li>
 *   <li>Otherwise evaluate the caller's roles against the snapshot. When no valid
 *       snapshot exists, fall back to a legacy single-key entry.</li>
 *   <li>Cache the grant when writes are allowed. Denials are never cached.</li>
 * </ol>
 *
 * <p>Store failures never propagate: a failing decision cache degrades to evaluation and
 * a failing snapshot store denies.
 */
public class AuthorizationEngine implements RequestAuthorization {

    public static final Duration DEFAULT_PERMISSION_TTL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_DECISION_BLOB_EXPIRY = Duration.ofMinutes(5);

    private static final Logger LOG = Logger.getLogger(AuthorizationEngine.class);

    private final CacheTopology topology;
    private final SnapshotReader snapshotReader;
    private final Optional<DecisionCache> decisionCache;
    private final PermissionMatcher matcher;
    private final ResourcePathResolver pathResolver;
    private final AuthorizationMetrics metrics;

    private AuthorizationEngine(Builder builder) {
        this.topology = builder.topology;
        this.matcher = builder.matcher;
        this.pathResolver = builder.pathResolver;
        this.metrics = builder.metrics;
        this.snapshotReader = new SnapshotReader(topology.snapshotStore(), new SnapshotParser(matcher));
        this.decisionCache = topology.decisionStore()
                .map(store -> new DecisionCache(
                        store,
                        snapshotReader,
                        builder.permissionTtl,
                        builder.decisionBlobExpiry,
                        builder.clock,
                        metrics));
    }

    public static Builder builder(CacheTopology topology) {
        return new Builder(topology);
    }

    @Override
    public AuthorizationDecision authorize(AuthorizationRequest request) {
        final var decision = decide(request);
        metrics.recordDecision(decision);
        return decision;
    }

    /**
     * Returns the topology this engine was built with.
     */
    public CacheTopology topology() {
        return topology;
    }

    /**
     * Returns the decision cache, empty when the topology is read-only.
     */
    public Optional<DecisionCache> decisionCache() {
        return decisionCache;
    }

    private AuthorizationDecision decide(AuthorizationRequest request) {
        final var subject = request.subjectId();
        if (subject == null || String.valueOf(subject).isBlank()) {
            return AuthorizationDecision.deny(AuthorizationDecision.MISSING_SUBJECT);
        }

        final var roles = RoleIdentifiers.normalize(request.roles());
        if (roles.isEmpty()) {
            LOG.warnv("Subject {0} has no roles assigned", KeyFingerprint.of(String.valueOf(subject)));
            return AuthorizationDecision.deny(AuthorizationDecision.NO_ROLES);
        }

        final PermissionKey key;
        try {
            key = PermissionKey.of(subject, request.host(), request.path(), request.method());
        } catch (IllegalArgumentException e) {
            LOG.debugf("Rejected malformed request: %s", e.getMessage());
            return AuthorizationDecision.deny(AuthorizationDecision.INSUFFICIENT_PERMISSIONS);
        }

        if (decisionCache.isPresent() && decisionCache.get().lookup(key).isHit()) {
            return AuthorizationDecision.allow(Source.DECISION_CACHE);
        }

        final Evaluation evaluation;
        try {
            evaluation = evaluate(key, roles, request.path());
        } catch (CacheException e) {
            LOG.warnv("Permission snapshot unavailable ({0}): {1}", e.getStore(), e.getMessage());
            return AuthorizationDecision.deny(AuthorizationDecision.PERMISSIONS_UNAVAILABLE);
        } catch (RuntimeException e) {
            LOG.warnv(e, "Permission evaluation failed for {0}", KeyFingerprint.of(key.serialize()));
            return AuthorizationDecision.deny(AuthorizationDecision.INSUFFICIENT_PERMISSIONS);
        }

        if (evaluation.decision().allowed()) {
            decisionCache.ifPresent(cache -> cache.record(key, evaluation.evaluatedAgainst()));
        }
        return evaluation.decision();
    }

    private Evaluation evaluate(PermissionKey key, List<String> roles, String path) {
        final var snapshot = snapshotReader.load();
        if (snapshot.isPresent()) {
            final var resourcePath = pathResolver.resolve(path);
            final var match = matcher.findMatch(snapshot.get(), roles, resourcePath, key.method());
            if (match.isPresent()) {
                LOG.debugf(
                        "Granted %s by role %s rule '%s'",
                        KeyFingerprint.of(key.serialize()),
                        match.get().role(),
                        match.get().rule().source());
                return new Evaluation(
                        AuthorizationDecision.allow(Source.SNAPSHOT),
                        OptionalLong.of(snapshot.get().lastUpdate()));
            }
            return Evaluation.denied();
        }

        final var legacy = snapshotReader.legacyEntry(key);
        if (legacy.map(grant -> grant.grants(key.method())).orElse(false)) {
            LOG.debugf("Granted %s by legacy entry", KeyFingerprint.of(key.serialize()));
            return new Evaluation(AuthorizationDecision.allow(Source.LEGACY_ENTRY), OptionalLong.empty());
        }
        if (legacy.filter(LegacyGrant.Unrecognized.class::isInstance).isPresent()) {
            LOG.warnv("Unrecognized legacy permission value for {0}", KeyFingerprint.of(key.serialize()));
        }
        return Evaluation.denied();
    }

    private record Evaluation(AuthorizationDecision decision, OptionalLong evaluatedAgainst) {
        static Evaluation denied() {
            return new Evaluation(
                    AuthorizationDecision.deny(AuthorizationDecision.INSUFFICIENT_PERMISSIONS), OptionalLong.empty());
        }
    }

    /**
     * Builder for {@link AuthorizationEngine}.
     */
    public static final class Builder {
        private final CacheTopology topology;
        private Duration permissionTtl = DEFAULT_PERMISSION_TTL;
        private Duration decisionBlobExpiry = DEFAULT_DECISION_BLOB_EXPIRY;
        private Clock clock = Clock.systemUTC();
        private AuthorizationMetrics metrics = NoOpAuthorizationMetrics.INSTANCE;
        private PermissionMatcher matcher;
        private ResourcePathResolver pathResolver;

        private Builder(CacheTopology topology) {
            this.topology = topology;
        }

        public Builder permissionTtl(Duration permissionTtl) {
            this.permissionTtl = permissionTtl;
            return this;
        }

        public Builder decisionBlobExpiry(Duration decisionBlobExpiry) {
            this.decisionBlobExpiry = decisionBlobExpiry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(AuthorizationMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder matcher(PermissionMatcher matcher) {
            this.matcher = matcher;
            return this;
        }

        public Builder pathResolver(ResourcePathResolver pathResolver) {
            this.pathResolver = pathResolver;
            return this;
        }

        public AuthorizationEngine build() {
            if (topology == null) {
                throw new ConfigurationException("Cache topology is required");
            }
            if (permissionTtl == null || permissionTtl.isNegative() || permissionTtl.isZero()) {
                throw new ConfigurationException("Permission TTL must be positive");
            }
            if (decisionBlobExpiry == null || decisionBlobExpiry.isNegative()) {
                throw new ConfigurationException("Decision blob expiry cannot be negative");
            }
            if (clock == null) {
                clock = Clock.systemUTC();
            }
            if (metrics == null) {
                metrics = NoOpAuthorizationMetrics.INSTANCE;
            }
            if (matcher == null) {
                matcher = new PermissionMatcher();
            }
            if (pathResolver == null) {
                pathResolver = new ResourcePathResolver();
            }
            LOG.infof(
                    "Authorization engine using %s topology (snapshot store: %s, decision store: %s)",
                    topology.mode(),
                    topology.snapshotStore().name(),
                    topology.decisionStore().map(CacheStore::name).orElse("none"));
            return new AuthorizationEngine(this);
        }
    }
}

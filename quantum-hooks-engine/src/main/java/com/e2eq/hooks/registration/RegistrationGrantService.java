package com.e2eq.hooks.registration;

import com.e2eq.hooks.authz.AuthorizationModelService;
import com.e2eq.hooks.model.authz.AccessTuple;
import com.e2eq.hooks.model.authz.AuthorizationModel;
import com.e2eq.hooks.model.authz.RegistrationContext;
import com.e2eq.hooks.model.authz.RegistrationGrant;
import com.e2eq.hooks.repo.RegistrationContextRepo;
import com.e2eq.hooks.repo.TupleRepo;
import com.e2eq.hooks.util.ExceptionLoggingUtils;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.util.Optional;

/**
 * Applies the grants of a registration context to the user created through it.
 * The context is remembered at sign-up time and applied once the user id exists.
 */
@ApplicationScoped
public class RegistrationGrantService {

    static final String USER_SUBJECT = "user";

    private final RegistrationContextRepo contextRepo;
    private final PendingGrantStore pendingGrants;
    private final AuthorizationModelService modelService;
    private final TupleRepo tupleRepo;
    private final Clock clock;

    @Inject
    public RegistrationGrantService(RegistrationContextRepo contextRepo, PendingGrantStore pendingGrants,
                                    AuthorizationModelService modelService, TupleRepo tupleRepo) {
        this(contextRepo, pendingGrants, modelService, tupleRepo, Clock.systemUTC());
    }

    public RegistrationGrantService(RegistrationContextRepo contextRepo, PendingGrantStore pendingGrants,
                                    AuthorizationModelService modelService, TupleRepo tupleRepo, Clock clock) {
        this.contextRepo = contextRepo;
        this.pendingGrants = pendingGrants;
        this.modelService = modelService;
        this.tupleRepo = tupleRepo;
        this.clock = clock;
    }

    /**
     * Remember that {@code email} is signing up through {@code contextSlug}.
     *
     * @return false when the context does not exist or is disabled
     */
    public boolean queue(String email, String contextSlug, String inviteId) {
        if (email == null || email.isBlank()) {
            return false;
        }
        Optional<RegistrationContext> context = contextRepo.findBySlug(contextSlug);
        if (context.isEmpty() || !context.get().isEnabled()) {
            Log.debugf("Registration context %s is unknown or disabled; nothing queued", contextSlug);
            return false;
        }
        pendingGrants.put(email, contextSlug, inviteId);
        return true;
    }

    /**
     * Create the queued context's grants for the new user. Each grant is applied
     * independently; a failing grant is logged and skipped.
     *
     * @return number of tuples created
     */
    public int applyAfterSignup(String userId, String email) {
        Optional<PendingGrant> pending = pendingGrants.consume(email);
        if (pending.isEmpty()) {
            return 0;
        }
        Optional<RegistrationContext> context = contextRepo.findBySlug(pending.get().contextSlug());
        if (context.isEmpty() || !context.get().isEnabled()) {
            Log.warnf("Registration context %s vanished before user %s was created", pending.get().contextSlug(), userId);
            return 0;
        }
        int created = 0;
        for (RegistrationGrant grant : context.get().getGrants()) {
            try {
                if (apply(userId, grant)) {
                    created++;
                }
            } catch (RuntimeException e) {
                ExceptionLoggingUtils.logWarn(e, "Registration grant %s on %s:%s for user %s failed",
                        grant.getRelation(), grant.getEntityTypeId(), grant.getEntityId(), userId);
            }
        }
        Log.infof("Applied %d registration grants from %s to user %s", created, pending.get().contextSlug(), userId);
        return created;
    }

    private boolean apply(String userId, RegistrationGrant grant) {
        Optional<AuthorizationModel> model = modelService.findById(grant.getEntityTypeId());
        if (model.isEmpty()) {
            Log.warnf("Registration grant references missing model %s; skipped", grant.getEntityTypeId());
            return false;
        }
        AccessTuple tuple = AccessTuple.builder()
                .entityType(model.get().getEntityType())
                .entityTypeId(model.get().getId())
                .entityId(grant.getEntityId())
                .relation(grant.getRelation())
                .subjectType(USER_SUBJECT)
                .subjectId(userId)
                .build();
        tuple.ensureIdentity(clock.instant());
        return tupleRepo.createIfNotExists(tuple).created();
    }
}

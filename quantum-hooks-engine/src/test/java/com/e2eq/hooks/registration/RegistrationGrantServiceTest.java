package com.e2eq.hooks.registration;

import com.e2eq.hooks.authz.ChangeAuthor;
import com.e2eq.hooks.model.authz.AccessTuple;
import com.e2eq.hooks.model.authz.AuthorizationModel;
import com.e2eq.hooks.model.authz.PermissionDefinition;
import com.e2eq.hooks.model.authz.RegistrationContext;
import com.e2eq.hooks.model.authz.RegistrationGrant;
import com.e2eq.hooks.support.HookEngineFixture;
import com.e2eq.hooks.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RegistrationGrantServiceTest {

    HookEngineFixture engine;
    MutableClock clock;
    PendingGrantStore pending;
    RegistrationGrantService service;
    AuthorizationModel projects;

    @BeforeEach
    void init() {
        engine = new HookEngineFixture();
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        pending = new PendingGrantStore(Duration.ofMinutes(15), clock);
        service = new RegistrationGrantService(engine.registrationRepo, pending, engine.modelService,
                engine.tupleRepo, clock);
        projects = engine.modelService.upsertModel("projects",
                Map.of("owner", List.of(), "member", List.of("owner")),
                Map.of("read", PermissionDefinition.of("member")),
                ChangeAuthor.SYSTEM);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private void context(String slug, boolean enabled, List<RegistrationGrant> grants) {
        RegistrationContext context = RegistrationContext.builder()
                .slug(slug)
                .name(slug)
                .enabled(enabled)
                .grants(grants)
                .build();
        context.ensureIdentity(clock.instant());
        engine.registrationRepo.save(context);
    }

    @Test
    void queue_rejects_unknown_or_disabled_context() {
        context("closed", false, List.of());
        assertFalse(service.queue("ann@example.com", "missing", null));
        assertFalse(service.queue("ann@example.com", "closed", null));
        assertFalse(service.queue(" ", "closed", null));
        assertEquals(0, pending.size());
    }

    @Test
    void grants_are_applied_to_new_user() {
        context("beta", true, List.of(
                new RegistrationGrant(projects.getId(), "p-1", "member"),
                new RegistrationGrant(projects.getId(), "p-2", "owner")));

        assertTrue(service.queue("Ann@Example.com", "beta", "inv-9"));
        assertEquals(2, service.applyAfterSignup("user-1", "ann@example.com"));

        List<AccessTuple> tuples = engine.tupleRepo.findBySubject(RegistrationGrantService.USER_SUBJECT, "user-1");
        assertEquals(2, tuples.size());
        assertTrue(tuples.stream().allMatch(t -> "projects".equals(t.getEntityType())
                && projects.getId().equals(t.getEntityTypeId())));
        assertTrue(engine.evaluator.check("user", "user-1", "projects", "p-1", "read"));
    }

    @Test
    void pending_grant_is_applied_only_once() {
        context("beta", true, List.of(new RegistrationGrant(projects.getId(), "p-1", "member")));
        service.queue("ann@example.com", "beta", null);

        assertEquals(1, service.applyAfterSignup("user-1", "ann@example.com"));
        assertEquals(0, service.applyAfterSignup("user-1", "ann@example.com"));
        assertEquals(1, engine.tupleRepo.size());
    }

    @Test
    void existing_tuple_is_not_duplicated() {
        context("beta", true, List.of(new RegistrationGrant(projects.getId(), "p-1", "member")));
        engine.tupleService.grant("projects", "p-1", "member", "user", "user-1");

        service.queue("ann@example.com", "beta", null);
        assertEquals(0, service.applyAfterSignup("user-1", "ann@example.com"));
        assertEquals(1, engine.tupleRepo.size());
    }

    @Test
    void grant_for_missing_model_is_skipped() {
        context("beta", true, List.of(
                new RegistrationGrant("no-such-model", "x", "member"),
                new RegistrationGrant(projects.getId(), "p-1", "member")));
        service.queue("ann@example.com", "beta", null);

        assertEquals(1, service.applyAfterSignup("user-1", "ann@example.com"));
    }

    @Test
    void expired_pending_grant_creates_nothing() {
        context("beta", true, List.of(new RegistrationGrant(projects.getId(), "p-1", "member")));
        service.queue("ann@example.com", "beta", null);
        clock.advance(Duration.ofHours(1));

        assertEquals(0, service.applyAfterSignup("user-1", "ann@example.com"));
        assertEquals(0, engine.tupleRepo.size());
    }

    @Test
    void context_disabled_after_queueing_creates_nothing() {
        context("beta", true, List.of(new RegistrationGrant(projects.getId(), "p-1", "member")));
        service.queue("ann@example.com", "beta", null);
        context("beta", false, List.of(new RegistrationGrant(projects.getId(), "p-1", "member")));

        assertEquals(0, service.applyAfterSignup("user-1", "ann@example.com"));
    }
}

package com.e2eq.hooks.pipeline;

import com.e2eq.hooks.authz.ChangeAuthor;
import com.e2eq.hooks.exceptions.HookInputValidationException;
import com.e2eq.hooks.exceptions.UnknownHookException;
import com.e2eq.hooks.model.authz.AuditResult;
import com.e2eq.hooks.model.authz.PermissionDefinition;
import com.e2eq.hooks.model.pipeline.HookBinding;
import com.e2eq.hooks.model.trace.PipelineSpan;
import com.e2eq.hooks.model.trace.PipelineTrace;
import com.e2eq.hooks.model.trace.SpanStatus;
import com.e2eq.hooks.model.trace.TraceOutcome;
import com.e2eq.hooks.support.HookEngineFixture;
import com.e2eq.hooks.support.TestHookEngineConfig;
import com.e2eq.hooks.trace.TraceMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineDispatcherTest {

    static final String DOMAIN_CHECK = String.join("\n",
            "if (!context.email.endsWith('@company.com')) {",
            "  return { allowed: false, error: 'Only company emails allowed' };",
            "}",
            "return { allowed: true };");

    HookEngineFixture engine;

    @BeforeEach
    void init() {
        engine = new HookEngineFixture();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static Map<String, Object> signup(String email) {
        return Map.of("email", email, "request", Map.of("ip", "10.1.2.3"));
    }

    private static Map<String, Object> tokenBuild() {
        return Map.of("user", Map.of("id", "u1", "email", "ada@example.com"), "token", Map.of("sub", "u1"));
    }

    private PipelineTrace onlyTrace() {
        List<PipelineTrace> traces = engine.traceRepo.traces();
        assertEquals(1, traces.size());
        return traces.get(0);
    }

    @Test
    void no_bindings_is_neutral_without_trace_or_pool_use() {
        HookResult result = engine.dispatcher.dispatch("before_signup", signup("ada@example.com"));
        assertTrue(result.allowed());
        assertNull(result.error());
        assertTrue(result.data().isEmpty());
        assertTrue(engine.traceRepo.traces().isEmpty());
        assertEquals(0, engine.pool.stats().created());
    }

    @Test
    void disabled_bindings_are_ignored() {
        HookBinding binding = engine.bindScript("before_signup", "deny", "return { allowed: false };", 1);
        binding.setEnabled(false);
        assertTrue(engine.dispatcher.dispatch("before_signup", signup("ada@example.com")).allowed());
        assertTrue(engine.traceRepo.traces().isEmpty());
    }

    @Test
    void signup_domain_check_blocks_outside_emails() {
        engine.bindScript("before_signup", "domain-check", DOMAIN_CHECK, 1);

        HookResult blocked = engine.dispatcher.dispatch("before_signup", signup("eve@gmail.com"),
                new TraceMetadata("signup", null, "10.1.2.3"));
        assertFalse(blocked.allowed());
        assertEquals("Only company emails allowed", blocked.error());

        PipelineTrace trace = onlyTrace();
        assertEquals(TraceOutcome.BLOCKED, trace.getOutcome());
        assertEquals("10.1.2.3", trace.getRequestIp());
        List<PipelineSpan> spans = engine.traceRecorder.findSpans(trace.getId());
        assertEquals(1, spans.size());
        assertEquals(SpanStatus.BLOCKED, spans.get(0).getStatus());

        HookResult allowed = engine.dispatcher.dispatch("before_signup", signup("ada@company.com"));
        assertTrue(allowed.allowed());
    }

    @Test
    void blocking_short_circuits_on_first_denial() {
        engine.bindScript("before_signup", "allow", "return { allowed: true };", 1);
        engine.bindScript("before_signup", "deny", "return { allowed: false, error: 'second says no' };", 2);
        engine.bindScript("before_signup", "never", "return { allowed: true };", 3);

        HookResult result = engine.dispatcher.dispatch("before_signup", signup("ada@example.com"));
        assertFalse(result.allowed());
        assertEquals("second says no", result.error());

        List<String> executed = engine.traceRepo.spans().stream()
                .map(PipelineSpan::getScriptName)
                .collect(Collectors.toList());
        assertEquals(2, executed.size());
        assertFalse(executed.contains("never"));
    }

    @Test
    void bindings_run_in_ordinal_order() {
        engine.bindScript("token_build", "third", "return { allowed: true, data: { order: 'third' } };", 30);
        engine.bindScript("token_build", "first", "return { allowed: true, data: { order: 'first' } };", 10);
        engine.bindScript("token_build", "second", "return { allowed: true, data: { order: 'second' } };", 20);

        HookResult result = engine.dispatcher.dispatch("token_build", tokenBuild());
        assertEquals("third", result.data().get("order"));
    }

    @Test
    void enrichment_merges_with_last_write_wins() {
        engine.bindScript("token_build", "a", "return { allowed: true, data: { x: 1, y: 1 } };", 1);
        engine.bindScript("token_build", "b", "return { allowed: true, data: { y: 2 } };", 2);

        HookResult result = engine.dispatcher.dispatch("token_build", tokenBuild());
        assertTrue(result.allowed());
        assertEquals(Map.of("x", 1, "y", 2), result.data());
        assertEquals(TraceOutcome.SUCCESS, onlyTrace().getOutcome());
    }

    @Test
    void enrichment_denial_discards_accumulated_data() {
        engine.bindScript("token_build", "a", "return { allowed: true, data: { x: 1 } };", 1);
        engine.bindScript("token_build", "b", "return { allowed: false, error: 'no token for you' };", 2);

        HookResult result = engine.dispatcher.dispatch("token_build", tokenBuild());
        assertFalse(result.allowed());
        assertEquals("no token for you", result.error());
        assertTrue(result.data().isEmpty());
    }

    @Test
    void failing_script_denies_with_sandbox_message() {
        engine.bindScript("before_signup", "broken", "throw new Error('boom');", 1);

        HookResult result = engine.dispatcher.dispatch("before_signup", signup("ada@example.com"));
        assertFalse(result.allowed());
        assertTrue(result.error().contains("boom"));
        assertEquals(TraceOutcome.ERROR, onlyTrace().getOutcome());
        assertEquals(SpanStatus.ERROR, engine.traceRepo.spans().get(0).getStatus());
    }

    @Test
    void malformed_result_denies() {
        engine.bindScript("before_signup", "stringly", "return 'yes';", 1);

        HookResult result = engine.dispatcher.dispatch("before_signup", signup("ada@example.com"));
        assertFalse(result.allowed());
        assertTrue(result.error().startsWith("Malformed script result"));
    }

    @Test
    void missing_script_is_skipped_and_chain_continues() {
        engine.bindExisting("before_signup", "no-such-script", 1);
        engine.bindScript("before_signup", "deny", "return { allowed: false, error: 'denied after skip' };", 2);

        HookResult result = engine.dispatcher.dispatch("before_signup", signup("ada@example.com"));
        assertFalse(result.allowed());
        assertEquals("denied after skip", result.error());

        List<PipelineSpan> spans = engine.traceRecorder.findSpans(onlyTrace().getId());
        assertEquals(2, spans.size());
        assertTrue(spans.stream().anyMatch(s -> s.getStatus() == SpanStatus.SKIPPED
                && "no-such-script".equals(s.getScriptId())));
    }

    @Test
    void async_hook_returns_before_scripts_finish() throws Exception {
        engine.close();
        TestHookEngineConfig config = new TestHookEngineConfig();
        config.maxStatements = Long.MAX_VALUE;
        engine = new HookEngineFixture(config);
        engine.bindScript("after_signup", "slow",
                "const end = helpers.now() + 1000; while (helpers.now() < end) { } return { allowed: true };", 1);

        long start = System.currentTimeMillis();
        HookResult result = engine.dispatcher.dispatch("after_signup",
                Map.of("user", Map.of("id", "u1", "email", "ada@example.com"), "request", Map.of()));
        long elapsed = System.currentTimeMillis() - start;

        assertTrue(result.allowed());
        assertTrue(elapsed < 1000, "dispatch waited " + elapsed + "ms for an async script");

        PipelineTrace trace = awaitFinished();
        assertEquals(TraceOutcome.SUCCESS, trace.getOutcome());
        assertEquals(1, engine.traceRecorder.findSpans(trace.getId()).size());
    }

    @Test
    void async_failure_is_logged_not_raised() throws Exception {
        engine.bindScript("after_signup", "broken", "throw new Error('crm down');", 1);

        HookResult result = engine.dispatcher.dispatch("after_signup",
                Map.of("user", Map.of("id", "u1"), "request", Map.of()));
        assertTrue(result.allowed());
        assertEquals(TraceOutcome.ERROR, awaitFinished().getOutcome());
    }

    @Test
    void invalid_input_runs_no_script() {
        engine.bindScript("before_signup", "allow", "return { allowed: true };", 1);
        assertThrows(HookInputValidationException.class,
                () -> engine.dispatcher.dispatch("before_signup", Map.of("email", "bogus", "request", Map.of())));
        assertTrue(engine.traceRepo.traces().isEmpty());
        assertEquals(0, engine.pool.stats().created());
    }

    @Test
    void unknown_hook_is_rejected() {
        assertThrows(UnknownHookException.class, () -> engine.dispatcher.dispatch("before_launch", Map.of()));
    }

    @Test
    void failing_trace_store_does_not_fail_dispatch() {
        engine.traceRepo.failWrites = true;
        engine.bindScript("before_signup", "domain-check", DOMAIN_CHECK, 1);

        HookResult result = engine.dispatcher.dispatch("before_signup", signup("eve@gmail.com"));
        assertFalse(result.allowed());
        assertEquals("Only company emails allowed", result.error());
    }

    @Test
    void hook_scripts_can_check_permissions() {
        engine.tupleService.grant("groups", "g1", "admin", "user", "u1");
        engine.bindScript("before_signout",
                "admins-only",
                "return { allowed: helpers.checkPermission('user', context.user.id, 'groups', 'g1', 'delete') };", 1);

        Map<String, Object> admin = Map.of("user", Map.of("id", "u1"), "session", Map.of("id", "s1", "userId", "u1"));
        Map<String, Object> other = Map.of("user", Map.of("id", "u2"), "session", Map.of("id", "s2", "userId", "u2"));
        assertTrue(engine.dispatcher.dispatch("before_signout", admin).allowed());
        assertFalse(engine.dispatcher.dispatch("before_signout", other).allowed());
    }

    @Test
    void permission_policy_checked_from_script_reuses_the_callers_interpreter() {
        engine.close();
        TestHookEngineConfig config = new TestHookEngineConfig();
        config.poolMaxSize = 1;
        config.acquireTimeout = Duration.ofMillis(500);
        engine = new HookEngineFixture(config);
        engine.modelService.upsertModel("documents", Map.of("owner", List.of()),
                Map.of("read", PermissionDefinition.builder().relation("owner").policy("return true;").build()),
                ChangeAuthor.SYSTEM);
        engine.tupleService.grant("documents", "d1", "owner", "user", "u1");
        engine.bindScript("before_signout", "owners-only",
                "return { allowed: helpers.checkPermission('user', context.user.id, 'documents', 'd1', 'read') };", 1);

        HookResult result = engine.dispatcher.dispatch("before_signout",
                Map.of("user", Map.of("id", "u1"), "session", Map.of("id", "s1", "userId", "u1")));

        assertTrue(result.allowed(), "nested policy denied: " + result.error());
        assertEquals(AuditResult.ALLOWED, engine.auditRepo.entries().get(0).getResult());
        assertEquals(1, engine.pool.stats().created());
        assertEquals(0, engine.pool.stats().active());
    }

    @Test
    void store_failure_ends_trace_as_error_and_propagates() {
        engine.bindScript("before_signup", "domain-check", DOMAIN_CHECK, 1);
        engine.scriptRepo.failReads = true;

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> engine.dispatcher.dispatch("before_signup", signup("ada@company.com")));
        assertEquals("script store unavailable", e.getMessage());

        PipelineTrace trace = onlyTrace();
        assertEquals(TraceOutcome.ERROR, trace.getOutcome());
        assertEquals("script store unavailable", trace.getStatusMessage());
        assertEquals(1.0, engine.meterRegistry.get("quantum.hooks.dispatch")
                .tag("hook", "before_signup").tag("outcome", "error").counter().count());
    }

    @Test
    void blocking_scripts_see_earlier_outputs() {
        HookBinding scoring = engine.bindScript("before_signup", "score",
                "return { allowed: context.prev === undefined && Object.keys(context.outputs).length === 0,"
                        + " data: { score: 7 } };", 1);
        engine.bindScript("before_signup", "gate", String.join("\n",
                "const earlier = context.outputs['" + scoring.getScriptId() + "'];",
                "if (context.prev.score !== 7 || earlier.score !== 7) {",
                "  return { allowed: false, error: 'score not passed on' };",
                "}",
                "return { allowed: true };"), 2);

        HookResult result = engine.dispatcher.dispatch("before_signup", signup("ada@example.com"));
        assertTrue(result.allowed(), result.error());
        assertTrue(result.data().isEmpty());
    }

    @Test
    void enrichment_scripts_build_on_the_previous_script() {
        engine.bindScript("token_build", "base", "return { allowed: true, data: { base: 2 } };", 1);
        engine.bindScript("token_build", "double",
                "return { allowed: true, data: { doubled: context.prev.base * 2 } };", 2);

        HookResult result = engine.dispatcher.dispatch("token_build", tokenBuild());
        assertEquals(Map.of("base", 2, "doubled", 4), result.data());
    }

    @Test
    void chain_longer_than_the_limit_is_denied_without_running() {
        engine.config.maxChainDepth = 2;
        for (int i = 1; i <= 3; i++) {
            engine.bindScript("before_signup", "s" + i, "return { allowed: true };", i);
        }

        HookResult result = engine.dispatcher.dispatch("before_signup", signup("ada@example.com"));
        assertFalse(result.allowed());
        assertEquals("Pipeline exceeds max chain depth (2 allowed, got 3)", result.error());

        PipelineTrace trace = onlyTrace();
        assertEquals(TraceOutcome.ERROR, trace.getOutcome());
        assertEquals(result.error(), trace.getStatusMessage());
        assertTrue(engine.traceRepo.spans().isEmpty());
        assertEquals(0, engine.pool.stats().created());
    }

    @Test
    void async_fan_out_past_the_limit_schedules_nothing() {
        engine.config.maxParallelScripts = 1;
        engine.bindScript("after_signup", "crm", "return { allowed: true };", 1);
        engine.bindScript("after_signup", "mailer", "return { allowed: true };", 2);

        HookResult result = engine.dispatcher.dispatch("after_signup",
                Map.of("user", Map.of("id", "u1"), "request", Map.of()));
        assertTrue(result.allowed());

        PipelineTrace trace = onlyTrace();
        assertEquals(TraceOutcome.ERROR, trace.getOutcome());
        assertEquals("Pipeline exceeds max parallel scripts (1 allowed, got 2)", trace.getStatusMessage());
        assertTrue(engine.traceRepo.spans().isEmpty());
    }

    @Test
    void traced_sections_are_recorded_as_child_spans() {
        engine.bindScript("before_signup", "traced", String.join("\n",
                "const total = helpers.trace('lookup', { region: 'eu' }, () => helpers.trace('inner', () => 2) + 1);",
                "return { allowed: total === 3 };"), 1);

        HookResult result = engine.dispatcher.dispatch("before_signup", signup("ada@example.com"));
        assertTrue(result.allowed(), result.error());

        Map<String, PipelineSpan> byName = engine.traceRepo.spans().stream()
                .collect(Collectors.toMap(PipelineSpan::getScriptName, span -> span));
        assertEquals(3, byName.size());
        PipelineSpan script = byName.get("traced");
        PipelineSpan lookup = byName.get("lookup");
        PipelineSpan inner = byName.get("inner");
        assertNull(script.getParentSpanId());
        assertEquals(script.getId(), lookup.getParentSpanId());
        assertEquals(lookup.getId(), inner.getParentSpanId());
        assertEquals("{\"region\":\"eu\"}", lookup.getAttributes());
        assertNull(inner.getAttributes());
        assertEquals(SpanStatus.SUCCESS, lookup.getStatus());
        assertNull(lookup.getScriptId());
    }

    @Test
    void traced_spans_are_capped_in_depth_count_and_attribute_size() {
        engine.bindScript("before_signup", "chatty", String.join("\n",
                "helpers.trace('a', { blob: 'x'.repeat(5000) }, () => helpers.trace('b', () => helpers.trace('c', () => 1)));",
                "for (let i = 0; i < 150; i++) { helpers.trace('loop', () => i); }",
                "return { allowed: true };"), 1);

        assertTrue(engine.dispatcher.dispatch("before_signup", signup("ada@example.com")).allowed());

        List<PipelineSpan> custom = engine.traceRepo.spans().stream()
                .filter(span -> span.getParentSpanId() != null)
                .collect(Collectors.toList());
        assertEquals(100, custom.size());
        assertTrue(custom.stream().noneMatch(span -> "c".equals(span.getScriptName())));
        PipelineSpan outer = custom.stream().filter(span -> "a".equals(span.getScriptName())).findFirst().orElseThrow();
        assertEquals(1024, outer.getAttributes().length());
    }

    @Test
    void error_inside_traced_section_marks_the_span_and_fails_the_script() {
        engine.bindScript("before_signup", "risky",
                "helpers.trace('call-crm', () => { throw new Error('crm rejected'); }); return { allowed: true };", 1);

        HookResult result = engine.dispatcher.dispatch("before_signup", signup("ada@example.com"));
        assertFalse(result.allowed());
        assertTrue(result.error().contains("crm rejected"));

        PipelineSpan span = engine.traceRepo.spans().stream()
                .filter(s -> "call-crm".equals(s.getScriptName()))
                .findFirst().orElseThrow();
        assertEquals(SpanStatus.ERROR, span.getStatus());
        assertTrue(span.getError().contains("crm rejected"));
    }

    @Test
    void fetch_to_internal_address_fails_the_script() {
        engine.bindScript("before_signup", "metadata",
                "const r = helpers.fetch('https://169.254.169.254/latest/meta-data/'); return { allowed: r.ok };", 1);

        HookResult result = engine.dispatcher.dispatch("before_signup", signup("ada@example.com"));
        assertFalse(result.allowed());
        assertEquals("SafeFetch failed: blocked host 169.254.169.254", result.error());
    }

    @Test
    void dispatch_outcomes_are_counted() {
        engine.bindScript("before_signup", "domain-check", DOMAIN_CHECK, 1);
        engine.dispatcher.dispatch("before_signup", signup("eve@gmail.com"));
        engine.dispatcher.dispatch("before_signup", signup("ada@company.com"));

        assertEquals(1.0, engine.meterRegistry.get("quantum.hooks.dispatch")
                .tag("hook", "before_signup").tag("outcome", "denied").counter().count());
        assertEquals(1.0, engine.meterRegistry.get("quantum.hooks.dispatch")
                .tag("hook", "before_signup").tag("outcome", "allowed").counter().count());
    }

    private PipelineTrace awaitFinished() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            List<PipelineTrace> traces = engine.traceRepo.traces();
            if (traces.size() == 1 && traces.get(0).getOutcome() != TraceOutcome.RUNNING) {
                return traces.get(0);
            }
            Thread.sleep(20);
        }
        fail("async trace did not finish");
        return null;
    }
}

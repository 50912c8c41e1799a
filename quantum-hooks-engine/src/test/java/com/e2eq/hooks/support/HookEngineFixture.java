package com.e2eq.hooks.support;

import com.e2eq.hooks.authz.AuditLogger;
import com.e2eq.hooks.authz.AuthorizationModelService;
import com.e2eq.hooks.authz.PermissionEvaluator;
import com.e2eq.hooks.authz.PolicyScriptRunner;
import com.e2eq.hooks.authz.ScriptValidator;
import com.e2eq.hooks.authz.TupleService;
import com.e2eq.hooks.metrics.HookMetrics;
import com.e2eq.hooks.model.pipeline.HookBinding;
import com.e2eq.hooks.model.pipeline.ScriptSource;
import com.e2eq.hooks.pipeline.PipelineAdminService;
import com.e2eq.hooks.pipeline.PipelineDispatcher;
import com.e2eq.hooks.registry.HookInputValidator;
import com.e2eq.hooks.registry.HookRegistry;
import com.e2eq.hooks.script.SafeFetch;
import com.e2eq.hooks.script.SandboxBridge;
import com.e2eq.hooks.script.ScriptHelperFactory;
import com.e2eq.hooks.script.ScriptInterpreterPool;
import com.e2eq.hooks.secrets.SecretCipher;
import com.e2eq.hooks.secrets.SecretService;
import com.e2eq.hooks.trace.TraceRecorder;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;

/**
 * Hand-wired engine over in-memory stores and a real GraalJS interpreter pool.
 * Close it to release the pool and the async executor.
 */
public class HookEngineFixture implements AutoCloseable {

    public final TestHookEngineConfig config;
    public final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final HookMetrics metrics = new HookMetrics(meterRegistry);

    public final InMemoryTupleRepo tupleRepo = new InMemoryTupleRepo();
    public final InMemoryAuthorizationModelRepo modelRepo = new InMemoryAuthorizationModelRepo();
    public final InMemoryPolicyVersionRepo versionRepo = new InMemoryPolicyVersionRepo();
    public final InMemoryAuditLogRepo auditRepo = new InMemoryAuditLogRepo();
    public final InMemoryTraceRepo traceRepo = new InMemoryTraceRepo();
    public final InMemoryScriptSourceRepo scriptRepo = new InMemoryScriptSourceRepo();
    public final InMemoryHookBindingRepo bindingRepo = new InMemoryHookBindingRepo();
    public final InMemorySecretRepo secretRepo = new InMemorySecretRepo();
    public final InMemoryRegistrationContextRepo registrationRepo = new InMemoryRegistrationContextRepo();

    public final ScriptInterpreterPool pool;
    public final SandboxBridge sandbox;
    public final SecretService secrets;
    public final SafeFetch fetcher;
    public final ScriptHelperFactory helperFactory;
    public final TraceRecorder traceRecorder;
    public final AuthorizationModelService modelService;
    public final TupleService tupleService;
    public final PolicyScriptRunner policyRunner;
    public final AuditLogger auditLogger;
    public final PermissionEvaluator evaluator;
    public final ScriptValidator scriptValidator;
    public final HookRegistry registry = new HookRegistry();
    public final HookInputValidator inputValidator;
    public final PipelineDispatcher dispatcher;
    public final PipelineAdminService admin;

    public HookEngineFixture() {
        this(new TestHookEngineConfig());
    }

    public HookEngineFixture(TestHookEngineConfig config) {
        this.config = config;
        if (config.encryptionKey == null) {
            byte[] key = new byte[32];
            new SecureRandom().nextBytes(key);
            config.encryptionKey = Base64.getEncoder().encodeToString(key);
        }
        Clock clock = Clock.systemUTC();
        pool = new ScriptInterpreterPool(config, metrics);
        sandbox = new SandboxBridge(pool, objectMapper);
        secrets = new SecretService(secretRepo, new SecretCipher(config));
        fetcher = new SafeFetch(config, objectMapper);
        helperFactory = new ScriptHelperFactory(config, secrets, fetcher, clock,
                Map.of("NODE_ENV", "test", "APP_URL", "https://app.example.test", "DATABASE_URL", "mongodb://hidden")::get);
        traceRecorder = new TraceRecorder(traceRepo, objectMapper, config);
        modelService = new AuthorizationModelService(modelRepo, tupleRepo, versionRepo, registrationRepo, config);
        tupleService = new TupleService(tupleRepo, modelService, sandbox, config);
        policyRunner = new PolicyScriptRunner(sandbox, helperFactory, config);
        auditLogger = new AuditLogger(auditRepo);
        evaluator = new PermissionEvaluator(modelService, tupleRepo, policyRunner, auditLogger, metrics, objectMapper);
        scriptValidator = new ScriptValidator(sandbox, policyRunner, config);
        inputValidator = new HookInputValidator(objectMapper);
        dispatcher = new PipelineDispatcher(registry, inputValidator, bindingRepo, scriptRepo, sandbox, helperFactory,
                evaluator, traceRecorder, metrics, config);
        admin = new PipelineAdminService(scriptRepo, bindingRepo, registry, sandbox, config);
    }

    /**
     * Store a script and bind it to {@code hookName}, bypassing admin validation.
     */
    public HookBinding bindScript(String hookName, String name, String code, int ordinal) {
        ScriptSource script = ScriptSource.builder().name(name).sourceCode(code).build();
        script.ensureIdentity(Instant.now());
        scriptRepo.save(script);
        return bindExisting(hookName, script.getId(), ordinal);
    }

    public HookBinding bindExisting(String hookName, String scriptId, int ordinal) {
        HookBinding binding = HookBinding.builder()
                .hookName(hookName)
                .scriptId(scriptId)
                .ordinal(ordinal)
                .enabled(true)
                .build();
        binding.ensureIdentity(Instant.now());
        return bindingRepo.save(binding);
    }

    @Override
    public void close() {
        dispatcher.shutdown();
        sandbox.shutdown();
        pool.close();
    }
}

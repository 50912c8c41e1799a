package com.e2eq.hooks.pipeline;

import com.e2eq.hooks.config.HookEngineConfig;
import com.e2eq.hooks.model.pipeline.HookBinding;
import com.e2eq.hooks.model.pipeline.ScriptSource;
import com.e2eq.hooks.registry.HookDefinition;
import com.e2eq.hooks.registry.HookRegistry;
import com.e2eq.hooks.repo.HookBindingRepo;
import com.e2eq.hooks.repo.ScriptSourceRepo;
import com.e2eq.hooks.script.SandboxBridge;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Administration of pipeline scripts and their hook bindings. Script bodies are
 * size-checked and parsed before they are stored.
 */
@ApplicationScoped
public class PipelineAdminService {

    private final ScriptSourceRepo scriptRepo;
    private final HookBindingRepo bindingRepo;
    private final HookRegistry registry;
    private final SandboxBridge sandbox;
    private final HookEngineConfig config;
    private final Clock clock;

    @Inject
    public PipelineAdminService(ScriptSourceRepo scriptRepo, HookBindingRepo bindingRepo, HookRegistry registry,
                                SandboxBridge sandbox, HookEngineConfig config) {
        this(scriptRepo, bindingRepo, registry, sandbox, config, Clock.systemUTC());
    }

    public PipelineAdminService(ScriptSourceRepo scriptRepo, HookBindingRepo bindingRepo, HookRegistry registry,
                                SandboxBridge sandbox, HookEngineConfig config, Clock clock) {
        this.scriptRepo = scriptRepo;
        this.bindingRepo = bindingRepo;
        this.registry = registry;
        this.sandbox = sandbox;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @throws com.e2eq.hooks.exceptions.SandboxException when the body is too large or does not parse
     */
    public ScriptSource createScript(String name, String description, String sourceCode) {
        requireName(name);
        sandbox.checkSyntax(sourceCode, config.sandbox().maxHookScriptSize());
        Instant now = clock.instant();
        ScriptSource script = ScriptSource.builder()
                .name(name)
                .description(description)
                .sourceCode(sourceCode)
                .updatedAt(now)
                .build();
        script.ensureIdentity(now);
        ScriptSource saved = scriptRepo.save(script);
        Log.infof("Created pipeline script %s (%s)", name, saved.getId());
        return saved;
    }

    public ScriptSource updateScript(String scriptId, String name, String description, String sourceCode) {
        ScriptSource script = requireScript(scriptId);
        if (name != null) {
            requireName(name);
            script.setName(name);
        }
        if (description != null) {
            script.setDescription(description);
        }
        if (sourceCode != null) {
            sandbox.checkSyntax(sourceCode, config.sandbox().maxHookScriptSize());
            script.setSourceCode(sourceCode);
        }
        script.setUpdatedAt(clock.instant());
        return scriptRepo.save(script);
    }

    /**
     * Delete a script together with every binding that references it.
     */
    public boolean deleteScript(String scriptId) {
        long unbound = bindingRepo.deleteByScriptId(scriptId);
        boolean deleted = scriptRepo.delete(scriptId);
        if (deleted) {
            Log.infof("Deleted pipeline script %s and %d bindings", scriptId, unbound);
        }
        return deleted;
    }

    public Optional<ScriptSource> getScript(String scriptId) {
        return scriptRepo.findById(scriptId);
    }

    public List<ScriptSource> listScripts() {
        return scriptRepo.findAll();
    }

    /**
     * @throws com.e2eq.hooks.exceptions.UnknownHookException when the hook does not exist
     * @throws IllegalArgumentException when the hook already runs as many scripts as its mode allows
     */
    public HookBinding bind(String hookName, String scriptId, int ordinal) {
        HookDefinition definition = registry.require(hookName);
        requireScript(scriptId);
        requireRoomFor(definition);
        HookBinding binding = HookBinding.builder()
                .hookName(hookName)
                .scriptId(scriptId)
                .ordinal(ordinal)
                .enabled(true)
                .build();
        binding.ensureIdentity(clock.instant());
        HookBinding saved = bindingRepo.save(binding);
        Log.infof("Bound script %s to hook %s at ordinal %d", scriptId, hookName, ordinal);
        return saved;
    }

    public boolean unbind(String bindingId) {
        return bindingRepo.delete(bindingId);
    }

    public HookBinding setEnabled(String bindingId, boolean enabled) {
        HookBinding binding = requireBinding(bindingId);
        if (enabled && !binding.isEnabled()) {
            requireRoomFor(registry.require(binding.getHookName()));
        }
        binding.setEnabled(enabled);
        return bindingRepo.save(binding);
    }

    public HookBinding reorder(String bindingId, int ordinal) {
        HookBinding binding = requireBinding(bindingId);
        binding.setOrdinal(ordinal);
        return bindingRepo.save(binding);
    }

    /**
     * Every binding of the hook, enabled or not, in execution order.
     */
    public List<HookBinding> listBindings(String hookName) {
        registry.require(hookName);
        return bindingRepo.findByHook(hookName).stream()
                .sorted(HookBinding.EXECUTION_ORDER)
                .collect(Collectors.toList());
    }

    private void requireRoomFor(HookDefinition definition) {
        long enabled = bindingRepo.findByHook(definition.name()).stream().filter(HookBinding::isEnabled).count();
        int limit = PipelineDispatcher.scriptLimit(config, definition.executionMode());
        if (enabled >= limit) {
            throw new IllegalArgumentException(
                    PipelineDispatcher.limitError(definition.executionMode(), limit, (int) enabled + 1));
        }
    }

    private ScriptSource requireScript(String scriptId) {
        return scriptRepo.findById(scriptId)
                .orElseThrow(() -> new IllegalArgumentException("Pipeline script not found: " + scriptId));
    }

    private HookBinding requireBinding(String bindingId) {
        return bindingRepo.findById(bindingId)
                .orElseThrow(() -> new IllegalArgumentException("Hook binding not found: " + bindingId));
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Script name is required");
        }
    }
}

package com.e2eq.hooks.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Runtime settings for the hook pipeline and the authorization engine.
 */
@StaticInitSafe
@ConfigMapping(prefix = "quantum.hooks")
public interface HookEngineConfig {

    Pool pool();

    Sandbox sandbox();

    Trace trace();

    Async async();

    Pipeline pipeline();

    Fetch fetch();

    Secrets secrets();

    Registration registration();

    interface Pool {
        /** Upper bound on live interpreter contexts. */
        @WithDefault("20")
        int maxSize();

        @WithDefault("5S")
        Duration acquireTimeout();

        /** Idle contexts older than this are closed. */
        @WithDefault("5M")
        Duration idleTtl();

        /** A context is discarded after serving this many executions. */
        @WithDefault("500")
        int maxReuses();
    }

    interface Sandbox {
        @WithDefault("10S")
        Duration hookTimeout();

        @WithDefault("1S")
        Duration policyTimeout();

        @WithDefault("50000")
        long maxStatements();

        /** Bytes. */
        @WithDefault("5120")
        int maxHookScriptSize();

        /** Bytes. */
        @WithDefault("10240")
        int maxPolicyScriptSize();

        @WithDefault("NODE_ENV,APP_URL")
        List<String> allowedEnv();
    }

    interface Trace {
        @WithDefault("30D")
        Duration retention();

        @WithDefault("32768")
        int maxPayloadChars();
    }

    interface Async {
        @WithDefault("4")
        int threads();

        @WithDefault("1000")
        int queueCapacity();

        @WithDefault("2S")
        Duration shutdownGrace();
    }

    interface Pipeline {
        /** Most enabled scripts a blocking or enrichment hook may chain. */
        @WithDefault("10")
        int maxChainDepth();

        /** Most enabled scripts an async hook may fan out to. */
        @WithDefault("5")
        int maxParallelScripts();
    }

    interface Fetch {
        @WithDefault("3S")
        Duration timeout();

        /** Bytes. */
        @WithDefault("1048576")
        int maxResponseBytes();
    }

    interface Secrets {
        /** Base64 encoded 256-bit AES key. */
        Optional<String> encryptionKey();
    }

    interface Registration {
        @WithDefault("15M")
        Duration pendingGrantTtl();
    }
}

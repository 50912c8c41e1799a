package com.e2eq.hooks.repo.morphia;

import com.e2eq.hooks.model.authz.AccessTuple;
import com.e2eq.hooks.model.authz.AuditLogEntry;
import com.e2eq.hooks.model.authz.AuthorizationModel;
import com.e2eq.hooks.model.authz.PolicyVersion;
import com.e2eq.hooks.model.authz.RegistrationContext;
import com.e2eq.hooks.model.pipeline.HookBinding;
import com.e2eq.hooks.model.pipeline.PipelineSecret;
import com.e2eq.hooks.model.pipeline.ScriptSource;
import com.e2eq.hooks.model.trace.PipelineSpan;
import com.e2eq.hooks.model.trace.PipelineTrace;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import dev.morphia.Datastore;
import dev.morphia.Morphia;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Lazily created Morphia datastore for the hook engine collections.
 */
@ApplicationScoped
public class HookDatastore {

    @Inject
    MongoClient mongoClient;

    @ConfigProperty(name = "quarkus.mongodb.database", defaultValue = "quantum-hooks")
    String databaseName;

    private volatile Datastore datastore;

    public Datastore get() {
        Datastore ds = datastore;
        if (ds == null) {
            synchronized (this) {
                ds = datastore;
                if (ds == null) {
                    ds = Morphia.createDatastore(mongoClient, databaseName);
                    ds.getMapper().map(ScriptSource.class, HookBinding.class, PipelineSecret.class,
                            AccessTuple.class, AuthorizationModel.class, PolicyVersion.class,
                            AuditLogEntry.class, RegistrationContext.class,
                            PipelineTrace.class, PipelineSpan.class);
                    ds.ensureIndexes();
                    Log.infof("Hook engine datastore initialized on database %s", databaseName);
                    datastore = ds;
                }
            }
        }
        return ds;
    }

    static boolean isDuplicateKey(MongoException e) {
        return ErrorCategory.fromErrorCode(e.getCode()) == ErrorCategory.DUPLICATE_KEY;
    }
}

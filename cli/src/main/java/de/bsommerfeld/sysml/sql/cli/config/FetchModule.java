package de.bsommerfeld.sysml.sql.cli.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.sysml.sql.api.Credentials;
import de.bsommerfeld.sysml.sql.api.HttpTransport;
import de.bsommerfeld.sysml.sql.api.JdkHttpTransport;
import de.bsommerfeld.sysml.sql.core.config.FetchConfig;

/**
 * Adds the HTTP transport for the {@code fetch} command. Credentials come
 * from the environment; invalid certificates are accepted if either the
 * configuration or the command line asks for it.
 */
public class FetchModule extends AbstractModule {

    private final Credentials credentials;
    private final boolean allowInvalidCerts;

    public FetchModule(Credentials credentials, boolean allowInvalidCerts) {
        this.credentials = credentials;
        this.allowInvalidCerts = allowInvalidCerts;
    }

    @Provides
    @Singleton
    HttpTransport httpTransport(FetchConfig fetchConfig) {
        return new JdkHttpTransport(credentials, allowInvalidCerts || fetchConfig.isAllowInvalidCerts());
    }
}

package de.bsommerfeld.sysml.sql.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * {@link HttpTransport} over {@link HttpClient#sendAsync}. Redirects are
 * followed; the returned response carries the URI that finally answered.
 *
 * <p>
 * With {@code allowInvalidCerts} the client accepts any server certificate
 * and skips hostname verification. The connection is then not trustworthy,
 * which is logged once when the transport is created.
 */
public class JdkHttpTransport implements HttpTransport {

    private static final Logger LOG = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient client;
    private final Credentials credentials;

    public JdkHttpTransport(Credentials credentials, boolean allowInvalidCerts) {
        this.credentials = credentials;
        HttpClient.Builder builder = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(30));
        if (allowInvalidCerts) {
            LOG.warn("Accepting invalid certificates, the connection to the server is NOT trustworthy");
            builder.sslContext(trustAllContext());
        }
        this.client = builder.build();
    }

    @Override
    public CompletableFuture<ApiResponse> get(URI uri, Duration timeout) {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        credentials.authorizationHeader().ifPresent(value -> request.header("Authorization", value));
        LOG.trace("GET {}", uri);
        return client.sendAsync(request.build(), HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> new ApiResponse(response.statusCode(), response.headers().map(),
                        response.body(), response.uri()));
    }

    private static SSLContext trustAllContext() {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] { new TrustAllManager() }, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TLS is not available", e);
        }
    }

    /** Accepts every chain; being an extended manager it also bypasses the endpoint identity check. */
    private static final class TrustAllManager extends X509ExtendedTrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}

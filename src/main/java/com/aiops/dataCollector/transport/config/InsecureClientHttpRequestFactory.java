package com.aiops.dataCollector.transport.config;

import org.springframework.http.client.SimpleClientHttpRequestFactory;

import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.HttpsURLConnection;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;

/**
 * Request factory that accepts any server certificate and host name.
 * Only used when collector.http.ssl-verify is false (internal backends with self-signed certificates).
 */
class InsecureClientHttpRequestFactory extends SimpleClientHttpRequestFactory {

    private static final HostnameVerifier ACCEPT_ALL_HOSTS = (hostname, session) -> true;

    private final SSLSocketFactory socketFactory;

    InsecureClientHttpRequestFactory() {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[]{new AcceptAllTrustManager()}, new SecureRandom());
            this.socketFactory = context.getSocketFactory();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to initialise TLS context", e);
        }
    }

    @Override
    protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
        if (connection instanceof HttpsURLConnection https) {
            https.setSSLSocketFactory(socketFactory);
            https.setHostnameVerifier(ACCEPT_ALL_HOSTS);
        }
        super.prepareConnection(connection, httpMethod);
    }

    SSLSocketFactory getSocketFactory() {
        return socketFactory;
    }

    private static class AcceptAllTrustManager implements X509TrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
            // every client certificate is accepted
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // every server certificate is accepted
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}

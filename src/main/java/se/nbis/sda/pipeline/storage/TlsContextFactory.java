package se.nbis.sda.pipeline.storage;

import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Collection;

/**
 * Builds the TLS setup used for object storage calls: TLS 1.2 or newer, the platform trust store, and optionally
 * one extra CA certificate file from configuration.
 */
@Slf4j
public final class TlsContextFactory {

    /**
     * The only protocols offered to object storage endpoints.
     */
    public static final String[] PROTOCOLS = {"TLSv1.3", "TLSv1.2"};

    private TlsContextFactory() {
    }

    /**
     * @param caCertPath PEM file with additional CA certificates, or {@code null}/blank for the platform store only.
     * @throws StorageConfigurationException if the CA file cannot be read or holds no certificate.
     */
    public static SSLContext create(String caCertPath) {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers(caCertPath), null);
            return context;
        } catch (GeneralSecurityException e) {
            throw new StorageConfigurationException("Failed to set up TLS for object storage", e);
        }
    }

    static TrustManager[] trustManagers(String caCertPath) throws GeneralSecurityException {
        TrustManagerFactory platform = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        platform.init((KeyStore) null);
        if (caCertPath == null || caCertPath.isBlank()) {
            return platform.getTrustManagers();
        }

        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        try {
            trustStore.load(null, null);
        } catch (IOException e) {
            throw new StorageConfigurationException("Failed to create an empty trust store", e);
        }
        int index = 0;
        for (TrustManager manager : platform.getTrustManagers()) {
            if (manager instanceof X509TrustManager) {
                for (X509Certificate issuer : ((X509TrustManager) manager).getAcceptedIssuers()) {
                    trustStore.setCertificateEntry("platform-" + index++, issuer);
                }
            }
        }
        int added = 0;
        for (Certificate certificate : readCertificates(caCertPath)) {
            trustStore.setCertificateEntry("configured-" + added++, certificate);
        }
        log.info("Added {} CA certificate(s) from '{}' to the {} platform trusted issuers.", added, caCertPath, index);

        TrustManagerFactory combined = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        combined.init(trustStore);
        return combined.getTrustManagers();
    }

    private static Collection<? extends Certificate> readCertificates(String caCertPath)
            throws GeneralSecurityException {
        try (InputStream in = Files.newInputStream(Path.of(caCertPath))) {
            Collection<? extends Certificate> certificates = CertificateFactory.getInstance("X.509")
                                                                               .generateCertificates(in);
            if (certificates.isEmpty()) {
                throw new StorageConfigurationException("No certificate found in CA file '" + caCertPath + "'");
            }
            return certificates;
        } catch (IOException e) {
            throw new StorageConfigurationException("Failed to read CA certificate file '" + caCertPath + "'", e);
        }
    }
}
